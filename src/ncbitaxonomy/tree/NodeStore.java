/* 
 * Copyright (C) 2018-present BC Cancer Genome Sciences Centre
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package ncbitaxonomy.tree;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;

/**
 * Owns every taxon node, indexed by id and by name.
 *
 * @author Ka Ming Nip
 */
public class NodeStore {
    private final HashMap<Integer, TaxonNode> idToNode;
    private final HashMap<String, TaxonNode> nameToNode;
    private boolean sealed = false;

    public NodeStore() {
        idToNode = new HashMap<>();
        nameToNode = new HashMap<>();
    }

    public NodeStore(int expectedSize) {
        // HashMap default load factor is 0.75
        int capacity = (int) (expectedSize / 0.75f) + 1;
        idToNode = new HashMap<>(capacity);
        nameToNode = new HashMap<>(capacity);
    }

    /**
     * Both indices are updated only after both checks pass.
     *
     * @param id        positive taxon id
     * @param name      unique taxon name
     * @param rank      rank, may be null
     * @param parentId  id of the parent, or {@link TaxonNode#NO_PARENT} for the root
     * @return the new node
     * @throws DuplicateNameException if {@code name} is already present
     * @throws DuplicateIdException if {@code id} is already present
     * @throws IllegalStateException if the store has been indexed into a {@link Taxonomy}
     */
    public TaxonNode insert(int id, String name, String rank, int parentId) throws DuplicateNameException, DuplicateIdException {
        if (sealed) {
            throw new IllegalStateException("cannot insert taxon " + id + " into an indexed taxonomy");
        }

        if (id <= 0) {
            throw new IllegalArgumentException("taxon id must be positive: " + id);
        }

        if (name == null) {
            throw new IllegalArgumentException("taxon " + id + " has no name");
        }

        TaxonNode existing = nameToNode.get(name);
        if (existing != null) {
            throw new DuplicateNameException(name, existing.id);
        }

        if (idToNode.containsKey(id)) {
            throw new DuplicateIdException(id);
        }

        TaxonNode node = new TaxonNode(id, name, rank, parentId);
        idToNode.put(id, node);
        nameToNode.put(name, node);

        return node;
    }

    public TaxonNode lookupById(int id) throws TaxonNotFoundException {
        TaxonNode node = idToNode.get(id);
        if (node == null) {
            throw new TaxonNotFoundException(id);
        }
        return node;
    }

    public TaxonNode lookupByName(String name) throws TaxonNotFoundException {
        TaxonNode node = nameToNode.get(name);
        if (node == null) {
            throw new TaxonNotFoundException(name);
        }
        return node;
    }

    /**
     * Rejects further inserts.
     */
    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * @return the node with {@code id}, or null if absent
     */
    TaxonNode get(int id) {
        return idToNode.get(id);
    }

    /**
     * @return the node named {@code name}, or null if absent
     */
    TaxonNode get(String name) {
        return nameToNode.get(name);
    }

    public boolean containsId(int id) {
        return idToNode.containsKey(id);
    }

    public boolean containsName(String name) {
        return nameToNode.containsKey(name);
    }

    public int size() {
        return idToNode.size();
    }

    public boolean isEmpty() {
        return idToNode.isEmpty();
    }

    public Collection<TaxonNode> nodes() {
        return Collections.unmodifiableCollection(idToNode.values());
    }

    /**
     * @return all ids in ascending order
     */
    public int[] sortedIds() {
        int[] ids = new int[idToNode.size()];
        int i = 0;
        for (Integer id : idToNode.keySet()) {
            ids[i++] = id;
        }
        Arrays.sort(ids);
        return ids;
    }
}
