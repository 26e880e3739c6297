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

import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.TaxonNotFoundException;
import ncbitaxonomy.tree.Taxonomy;

/**
 * Membership test for the subtree rooted at a fixed target taxon. A candidate
 * belongs to the subtree iff its root-to-self path starts with the target's
 * root-to-self path.
 *
 * @author Ka Ming Nip
 */
public class DescendantFilter {
    private final Taxonomy taxonomy;
    private final TaxonNode target;
    private final int[] targetPath;

    private DescendantFilter(Taxonomy taxonomy, TaxonNode target) {
        this.taxonomy = taxonomy;
        this.target = target;
        this.targetPath = target.getAncestry().toLineagePrefix(target.id);
    }

    public static DescendantFilter of(Taxonomy taxonomy, TaxonNode target) {
        return new DescendantFilter(taxonomy, target);
    }

    /**
     * @throws TaxonNotFoundException if no taxon is named {@code targetName}
     */
    public static DescendantFilter of(Taxonomy taxonomy, String targetName) throws TaxonNotFoundException {
        return new DescendantFilter(taxonomy, taxonomy.getNode(targetName));
    }

    /**
     * @throws TaxonNotFoundException if there is no taxon {@code targetId}
     */
    public static DescendantFilter of(Taxonomy taxonomy, int targetId) throws TaxonNotFoundException {
        return new DescendantFilter(taxonomy, taxonomy.getNode(targetId));
    }

    public TaxonNode getTarget() {
        return target;
    }

    public boolean isDescendantOrSelf(TaxonNode candidate) {
        if (candidate.id == target.id) {
            return true;
        }
        return candidate.getAncestry().startsWith(targetPath);
    }

    /**
     * @param taxId candidate taxon id
     * @return false for ids that are not in the taxonomy
     */
    public boolean accepts(int taxId) {
        TaxonNode candidate = taxonomy.findNode(taxId);
        return candidate != null && isDescendantOrSelf(candidate);
    }
}
