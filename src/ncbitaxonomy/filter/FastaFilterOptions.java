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

import java.util.EnumSet;

/**
 *
 * @author Ka Ming Nip
 */
public class FastaFilterOptions {
    private final EnumSet<AccessionClass> excluded;

    public FastaFilterOptions(boolean excludeCurated, boolean excludePredicted) {
        excluded = EnumSet.noneOf(AccessionClass.class);
        if (excludeCurated) {
            excluded.add(AccessionClass.CURATED);
        }
        if (excludePredicted) {
            excluded.add(AccessionClass.PREDICTED);
        }
    }

    public static FastaFilterOptions defaults() {
        return new FastaFilterOptions(false, false);
    }

    public boolean isExcluded(AccessionClass accessionClass) {
        return excluded.contains(accessionClass);
    }
}
