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

/**
 * Materialized ancestry path of a taxon: the ids of its ancestors ordered from
 * the root down to its immediate parent. The root has an empty path.
 *
 * @author Ka Ming Nip
 */
public final class Ancestry {
    public static final char DELIMITER = '/';
    public static final Ancestry ROOT = new Ancestry(new int[0]);

    private final int[] ids;

    private Ancestry(int[] ids) {
        this.ids = ids;
    }

    /**
     * @param parentId id of the taxon this path belongs to
     * @return path of a child of the taxon owning this path
     */
    public Ancestry extend(int parentId) {
        int[] childIds = Arrays.copyOf(ids, ids.length + 1);
        childIds[ids.length] = parentId;
        return new Ancestry(childIds);
    }

    public int length() {
        return ids.length;
    }

    public int get(int index) {
        return ids[index];
    }

    public boolean isEmpty() {
        return ids.length == 0;
    }

    /**
     * @return id of the immediate parent, or -1 for the root
     */
    public int last() {
        return ids.length == 0 ? -1 : ids[ids.length-1];
    }

    public boolean contains(int id) {
        for (int i : ids) {
            if (i == id) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param prefix sequence of ids
     * @return true if this path starts with all of {@code prefix}
     */
    public boolean startsWith(int[] prefix) {
        if (prefix.length > ids.length) {
            return false;
        }

        for (int i=0; i<prefix.length; ++i) {
            if (ids[i] != prefix[i]) {
                return false;
            }
        }

        return true;
    }

    /**
     * @param selfId id of the taxon owning this path
     * @return this path followed by {@code selfId}
     */
    public int[] toLineagePrefix(int selfId) {
        int[] prefix = Arrays.copyOf(ids, ids.length + 1);
        prefix[ids.length] = selfId;
        return prefix;
    }

    public int[] toArray() {
        return Arrays.copyOf(ids, ids.length);
    }

    /**
     * @return ids joined by {@link #DELIMITER}, root first; empty for the root
     */
    public String encode() {
        StringBuilder sb = new StringBuilder(ids.length * 8);
        for (int i=0; i<ids.length; ++i) {
            if (i > 0) {
                sb.append(DELIMITER);
            }
            sb.append(ids[i]);
        }
        return sb.toString();
    }

    /**
     * @param encoded string produced by {@link #encode()}; null or empty for the root
     * @return the decoded path
     * @throws NumberFormatException if a component is not an integer
     */
    public static Ancestry decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return ROOT;
        }

        int n = 1;
        for (int i=0; i<encoded.length(); ++i) {
            if (encoded.charAt(i) == DELIMITER) {
                ++n;
            }
        }

        int[] ids = new int[n];
        int start = 0;
        for (int i=0; i<n; ++i) {
            int end = encoded.indexOf(DELIMITER, start);
            if (end < 0) {
                end = encoded.length();
            }
            ids[i] = Integer.parseInt(encoded.substring(start, end));
            start = end + 1;
        }

        return new Ancestry(ids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ancestry)) {
            return false;
        }
        return Arrays.equals(ids, ((Ancestry) o).ids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        return encode();
    }
}
