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

import ncbitaxonomy.io.FastaRecord;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.Taxonomy;

/**
 * Resolves RefSeq style headers that carry the organism name in square
 * brackets, e.g. {@code >NP_000005.3 alpha-2-macroglobulin [Homo sapiens]}.
 *
 * @author Ka Ming Nip
 */
public class DescriptionNameResolver implements TaxonResolver {
    private final Taxonomy taxonomy;

    public DescriptionNameResolver(Taxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * @return text between the first '[' and the last ']', or null if there is none
     */
    public static String extractName(String description) {
        int start = description.indexOf('[');
        int end = description.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return null;
        }
        return description.substring(start+1, end);
    }

    @Override
    public TaxonNode resolve(FastaRecord record) {
        String name = extractName(record.comment);
        return name == null ? null : taxonomy.findNode(name);
    }
}
