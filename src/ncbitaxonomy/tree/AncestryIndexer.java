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

import java.util.ArrayDeque;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every node of a {@link NodeStore} its ancestry path with a single
 * breadth-first traversal from the root over the child adjacency graph.
 *
 * @author Ka Ming Nip
 */
public class AncestryIndexer {
    private static final Logger LOG = LoggerFactory.getLogger(AncestryIndexer.class);

    /**
     * A store that fails to index must be discarded.
     *
     * @param store nodes to index; each node may be indexed only once and the
     *              store accepts no inserts once indexing succeeds
     * @return the fully indexed taxonomy
     * @throws MalformedTaxonomyException if there is not exactly one root, a
     *         parent id is missing, or some nodes are unreachable from the root
     */
    public static Taxonomy index(NodeStore store) throws MalformedTaxonomyException {
        if (store.isSealed()) {
            throw new IllegalStateException("node store has already been indexed");
        }

        if (store.isEmpty()) {
            throw new MalformedTaxonomyException(TaxonNode.NO_PARENT, "taxonomy has no nodes");
        }

        int[] ids = store.sortedIds();
        Graph<Integer, DefaultEdge> children = buildChildGraph(store, ids);

        TaxonNode root = null;
        for (int id : ids) {
            TaxonNode node = store.get(id);
            if (node.isRoot()) {
                if (root != null) {
                    throw new MalformedTaxonomyException(id, "taxa " + root.id + " and " + id + " both have no parent");
                }
                root = node;
            }
        }

        if (root == null) {
            throw new MalformedTaxonomyException(ids[0], "no root taxon found, first taxon is " + ids[0]);
        }

        if (root.hasAncestry()) {
            throw new IllegalStateException("node store has already been indexed");
        }

        root.setAncestry(Ancestry.ROOT);
        ArrayDeque<TaxonNode> queue = new ArrayDeque<>();
        queue.add(root);
        int numVisited = 0;
        int maxDepth = 0;

        while (!queue.isEmpty()) {
            TaxonNode parent = queue.poll();
            ++numVisited;
            maxDepth = Math.max(maxDepth, parent.getDepth());

            // siblings share one immutable path
            Ancestry childAncestry = parent.getAncestry().extend(parent.id);
            for (Integer childId : Graphs.successorListOf(children, parent.id)) {
                TaxonNode child = store.get(childId);
                child.setAncestry(childAncestry);
                queue.add(child);
            }
        }

        if (numVisited < ids.length) {
            for (int id : ids) {
                if (!store.get(id).hasAncestry()) {
                    throw new MalformedTaxonomyException(id,
                            "taxon " + id + " is not connected to root " + root.id + " (cycle in parent relation)");
                }
            }
        }

        LOG.info("Indexed {} taxa, max depth {}", numVisited, maxDepth);

        store.seal();
        return new Taxonomy(store, root);
    }

    private static Graph<Integer, DefaultEdge> buildChildGraph(NodeStore store, int[] ids) throws MalformedTaxonomyException {
        Graph<Integer, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

        for (int id : ids) {
            graph.addVertex(id);
        }

        for (int id : ids) {
            TaxonNode node = store.get(id);
            if (!node.isRoot()) {
                if (!store.containsId(node.parentId)) {
                    throw new MalformedTaxonomyException(id,
                            "taxon " + id + " refers to missing parent " + node.parentId);
                }
                graph.addEdge(node.parentId, id);
            }
        }

        return graph;
    }
}
