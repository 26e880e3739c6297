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
package ncbitaxonomy.filter;

import static ncbitaxonomy.SampleTaxonomies.A;
import static ncbitaxonomy.SampleTaxonomies.B;
import static ncbitaxonomy.SampleTaxonomies.C;
import static ncbitaxonomy.SampleTaxonomies.D;
import static ncbitaxonomy.SampleTaxonomies.R;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ncbitaxonomy.SampleTaxonomies;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.TaxonNotFoundException;
import ncbitaxonomy.tree.Taxonomy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class DescendantFilterTest {

    private static Taxonomy small;

    @BeforeAll
    static void load() throws Exception {
        small = SampleTaxonomies.small();
    }

    @Test
    void targetIsItsOwnDescendant() throws Exception {
        for (TaxonNode node : small.nodes()) {
            assertThat(DescendantFilter.of(small, node).isDescendantOrSelf(node)).isTrue();
        }
    }

    @Test
    void acceptsExactlyTheSubtree() throws Exception {
        DescendantFilter filter = DescendantFilter.of(small, "A");

        assertThat(filter.getTarget().id).isEqualTo(A);
        assertThat(filter.accepts(A)).isTrue();
        assertThat(filter.accepts(B)).isTrue();
        assertThat(filter.accepts(C)).isTrue();
        assertThat(filter.accepts(D)).isFalse();
        assertThat(filter.accepts(R)).isFalse();
    }

    @Test
    void rootAcceptsEverything() throws Exception {
        DescendantFilter filter = DescendantFilter.of(small, R);

        for (TaxonNode node : small.nodes()) {
            assertThat(filter.isDescendantOrSelf(node)).isTrue();
        }
    }

    @Test
    void unknownTaxIdIsNotAMember() throws Exception {
        DescendantFilter filter = DescendantFilter.of(small, R);

        assertThat(filter.accepts(0)).isFalse();
        assertThat(filter.accepts(12345)).isFalse();
    }

    @Test
    void matchesLineageMembership() throws Exception {
        Taxonomy sample = SampleTaxonomies.sample();
        for (TaxonNode target : sample.nodes()) {
            DescendantFilter filter = DescendantFilter.of(sample, target);
            for (TaxonNode candidate : sample.nodes()) {
                boolean inLineage = false;
                for (TaxonNode n : sample.lineageOf(candidate)) {
                    inLineage |= n == target;
                }
                assertThat(filter.isDescendantOrSelf(candidate)).isEqualTo(inLineage);
            }
        }
    }

    @Test
    void unknownTargetIsNotFound() {
        assertThatThrownBy(() -> DescendantFilter.of(small, "Z"))
                .isInstanceOf(TaxonNotFoundException.class);
        assertThatThrownBy(() -> DescendantFilter.of(small, 99))
                .isInstanceOf(TaxonNotFoundException.class);
    }
}
