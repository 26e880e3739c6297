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
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Read-only, fully indexed taxonomy. Instances are only created by
 * {@link AncestryIndexer}, so every node reachable from here has its ancestry path.
 *
 * @author Ka Ming Nip
 */
public class Taxonomy {
    public static final Set<String> CANONICAL_RANKS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "superkingdom", "kingdom", "phylum", "class", "order", "family", "genus", "species")));

    private final NodeStore store;
    private final TaxonNode root;

    Taxonomy(NodeStore store, TaxonNode root) {
        this.store = store;
        this.root = root;
    }

    public TaxonNode root() {
        return root;
    }

    public int size() {
        return store.size();
    }

    public Collection<TaxonNode> nodes() {
        return store.nodes();
    }

    public boolean containsId(int id) {
        return store.containsId(id);
    }

    public boolean containsName(String name) {
        return store.containsName(name);
    }

    public TaxonNode getNode(int id) throws TaxonNotFoundException {
        return store.lookupById(id);
    }

    public TaxonNode getNode(String name) throws TaxonNotFoundException {
        return store.lookupByName(name);
    }

    /**
     * @return the node with {@code id}, or null if absent
     */
    public TaxonNode findNode(int id) {
        return store.get(id);
    }

    /**
     * @return the node named {@code name}, or null if absent
     */
    public TaxonNode findNode(String name) {
        return store.get(name);
    }

    public int getId(String name) throws TaxonNotFoundException {
        return store.lookupByName(name).id;
    }

    public String getName(int id) throws TaxonNotFoundException {
        return store.lookupById(id).name;
    }

    public int depth(TaxonNode node) {
        return node.getDepth();
    }

    /**
     * Walks the materialized path backwards, so no parent lookups are needed
     * to produce the ids.
     *
     * @param node start of the lineage
     * @return restartable sequence from {@code node} up to the root, both inclusive
     */
    public Iterable<TaxonNode> lineageOf(final TaxonNode node) {
        return () -> new Iterator<TaxonNode>() {
            private int depth = node.getDepth();

            @Override
            public boolean hasNext() {
                return depth >= 0;
            }

            @Override
            public TaxonNode next() {
                if (depth < 0) {
                    throw new NoSuchElementException();
                }
                TaxonNode n = depth == node.getDepth() ? node : store.get(node.getAncestry().get(depth));
                --depth;
                return n;
            }
        };
    }

    public Iterable<TaxonNode> lineageOf(String name) throws TaxonNotFoundException {
        return lineageOf(store.lookupByName(name));
    }

    /**
     * @return ids from {@code node} up to the root, both inclusive
     */
    public int[] lineageIds(TaxonNode node) {
        int depth = node.getDepth();
        int[] ids = new int[depth + 1];
        ids[0] = node.id;
        for (int i=1; i<=depth; ++i) {
            ids[i] = node.getAncestry().get(depth - i);
        }
        return ids;
    }

    /**
     * id at position {@code depth} of the path from the root to {@code node} inclusive
     */
    private static int idAt(TaxonNode node, int depth) {
        return depth < node.getDepth() ? node.getAncestry().get(depth) : node.id;
    }

    /**
     * Longest common prefix of the two root-to-node paths.
     *
     * @return the deepest node that is an ancestor-or-self of both {@code a} and {@code b}
     */
    public TaxonNode commonAncestor(TaxonNode a, TaxonNode b) {
        int maxLen = Math.min(a.getDepth(), b.getDepth()) + 1;
        int len = 0;
        while (len < maxLen && idAt(a, len) == idAt(b, len)) {
            ++len;
        }

        if (len == 0) {
            // only for nodes of different taxonomies
            return root;
        }

        int id = idAt(a, len-1);
        if (id == a.id) {
            return a;
        }
        else if (id == b.id) {
            return b;
        }

        return store.get(id);
    }

    public TaxonNode commonAncestor(String nameA, String nameB) throws TaxonNotFoundException {
        return commonAncestor(store.lookupByName(nameA), store.lookupByName(nameB));
    }

    /**
     * @return number of edges on the path joining {@code a} and {@code b}
     */
    public int distance(TaxonNode a, TaxonNode b) {
        TaxonNode ca = commonAncestor(a, b);
        return a.getDepth() + b.getDepth() - 2 * ca.getDepth();
    }

    public int distance(String nameA, String nameB) throws TaxonNotFoundException {
        return distance(store.lookupByName(nameA), store.lookupByName(nameB));
    }

    /**
     * Like {@link #distance(TaxonNode, TaxonNode)} but an edge is only counted
     * when its lower node has one of the {@link #CANONICAL_RANKS}.
     */
    public int canonicalDistance(TaxonNode a, TaxonNode b) {
        TaxonNode ca = commonAncestor(a, b);
        return canonicalSteps(a, ca.getDepth()) + canonicalSteps(b, ca.getDepth());
    }

    private int canonicalSteps(TaxonNode node, int ancestorDepth) {
        int steps = 0;
        for (int d=ancestorDepth+1; d<=node.getDepth(); ++d) {
            TaxonNode n = d == node.getDepth() ? node : store.get(node.getAncestry().get(d));
            if (n.rank != null && CANONICAL_RANKS.contains(n.rank)) {
                ++steps;
            }
        }
        return steps;
    }
}
