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

/**
 *
 * @author Ka Ming Nip
 */
public class TaxonNode {
    public static final int NO_PARENT = 0;

    public final int id;
    public final String name;
    public final String rank;
    public final int parentId;

    private Ancestry ancestry = null;

    /**
     * @param id        positive taxon id
     * @param name      unique name
     * @param rank      rank, may be null
     * @param parentId  id of the parent, or {@link #NO_PARENT} for the root
     */
    public TaxonNode(int id, String name, String rank, int parentId) {
        this.id = id;
        this.name = name;
        this.rank = rank;
        this.parentId = parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public boolean hasAncestry() {
        return ancestry != null;
    }

    /**
     * @return the ancestry path, never null once the node belongs to a {@link Taxonomy}
     */
    public Ancestry getAncestry() {
        return ancestry;
    }

    /**
     * @return number of edges between this node and the root
     */
    public int getDepth() {
        return ancestry.length();
    }

    void setAncestry(Ancestry ancestry) {
        if (this.ancestry != null) {
            throw new IllegalStateException("ancestry of taxon " + id + " is already set");
        }
        this.ancestry = ancestry;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
