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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Class of a sequence by its accession prefix, following the RefSeq scheme.
 *
 * @author Ka Ming Nip
 */
public enum AccessionClass {
    /** RefSeq records reviewed or derived from a reviewed source */
    CURATED,
    /** RefSeq model records produced by gene prediction (XM_, XR_, XP_) */
    PREDICTED,
    /** not a RefSeq accession */
    OTHER;

    private static final Set<String> CURATED_PREFIXES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "AC", "NC", "NG", "NT", "NW", "NZ", "NM", "NR", "NP", "YP", "WP")));
    private static final Set<String> PREDICTED_PREFIXES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "XM", "XR", "XP")));

    public static AccessionClass classify(String accession) {
        if (accession.length() < 4 || accession.charAt(2) != '_') {
            return OTHER;
        }

        String prefix = accession.substring(0, 2);
        if (CURATED_PREFIXES.contains(prefix)) {
            return CURATED;
        }
        else if (PREDICTED_PREFIXES.contains(prefix)) {
            return PREDICTED;
        }

        return OTHER;
    }
}
