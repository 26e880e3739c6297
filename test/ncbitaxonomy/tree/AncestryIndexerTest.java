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

import static ncbitaxonomy.SampleTaxonomies.A;
import static ncbitaxonomy.SampleTaxonomies.B;
import static ncbitaxonomy.SampleTaxonomies.C;
import static ncbitaxonomy.SampleTaxonomies.D;
import static ncbitaxonomy.SampleTaxonomies.R;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ncbitaxonomy.SampleTaxonomies;
import org.junit.jupiter.api.Test;

class AncestryIndexerTest {

    @Test
    void assignsRootToParentPaths() throws Exception {
        Taxonomy taxonomy = SampleTaxonomies.small();

        assertThat(taxonomy.root().id).isEqualTo(R);
        assertThat(taxonomy.getNode(R).getAncestry().isEmpty()).isTrue();
        assertThat(taxonomy.getNode(A).getAncestry().toArray()).containsExactly(R);
        assertThat(taxonomy.getNode(C).getAncestry().toArray()).containsExactly(R, A, B);
        assertThat(taxonomy.getNode(D).getAncestry().toArray()).containsExactly(R);
        assertThat(taxonomy.size()).isEqualTo(5);
    }

    @Test
    void siblingsShareOnePath() throws Exception {
        NodeStore store = new NodeStore();
        store.insert(1, "root", null, TaxonNode.NO_PARENT);
        store.insert(2, "left", null, 1);
        store.insert(3, "right", null, 1);
        Taxonomy taxonomy = AncestryIndexer.index(store);

        assertThat(taxonomy.getNode(2).getAncestry()).isSameAs(taxonomy.getNode(3).getAncestry());
    }

    @Test
    void singleRootTree() throws Exception {
        NodeStore store = new NodeStore();
        store.insert(1, "root", null, TaxonNode.NO_PARENT);
        Taxonomy taxonomy = AncestryIndexer.index(store);

        assertThat(taxonomy.depth(taxonomy.root())).isZero();
        assertThat(taxonomy.lineageOf(taxonomy.root())).containsExactly(taxonomy.root());
    }

    @Test
    void danglingParentIsMalformed() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        store.insert(50, "orphan", null, 999);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(MalformedTaxonomyException.class)
                .hasMessageContaining("999")
                .satisfies(e -> {
                    MalformedTaxonomyException m = (MalformedTaxonomyException) e;
                    assertThat(m.getOffendingId()).isEqualTo(50);
                    assertThat(m.getKind()).isEqualTo("MalformedTaxonomy");
                });
    }

    @Test
    void twoRootsAreMalformed() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        store.insert(60, "second root", null, TaxonNode.NO_PARENT);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(MalformedTaxonomyException.class)
                .satisfies(e -> assertThat(((MalformedTaxonomyException) e).getOffendingId()).isEqualTo(60));
    }

    @Test
    void cycleIsMalformed() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        store.insert(70, "cycle a", null, 71);
        store.insert(71, "cycle b", null, 70);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(MalformedTaxonomyException.class)
                .satisfies(e -> assertThat(((MalformedTaxonomyException) e).getOffendingId()).isEqualTo(70));
    }

    @Test
    void missingRootIsMalformed() throws Exception {
        NodeStore store = new NodeStore();
        store.insert(5, "a", null, 6);
        store.insert(6, "b", null, 5);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(MalformedTaxonomyException.class);
    }

    @Test
    void emptyStoreIsMalformed() {
        assertThatThrownBy(() -> AncestryIndexer.index(new NodeStore()))
                .isInstanceOf(MalformedTaxonomyException.class);
    }

    @Test
    void indexedStoreRejectsInserts() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        Taxonomy taxonomy = AncestryIndexer.index(store);

        assertThat(store.isSealed()).isTrue();
        assertThatThrownBy(() -> store.insert(50, "E", "species", C))
                .isInstanceOf(IllegalStateException.class);

        assertThat(taxonomy.size()).isEqualTo(5);
        assertThat(taxonomy.containsId(50)).isFalse();
        for (TaxonNode node : taxonomy.nodes()) {
            assertThat(node.hasAncestry()).isTrue();
        }
    }

    @Test
    void failedIndexLeavesStoreOpen() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        store.insert(50, "orphan", null, 999);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(MalformedTaxonomyException.class);

        assertThat(store.isSealed()).isFalse();
    }

    @Test
    void storeCannotBeIndexedTwice() throws Exception {
        NodeStore store = SampleTaxonomies.smallStore();
        AncestryIndexer.index(store);

        assertThatThrownBy(() -> AncestryIndexer.index(store))
                .isInstanceOf(IllegalStateException.class);
    }
}
