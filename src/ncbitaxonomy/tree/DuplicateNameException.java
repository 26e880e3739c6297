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

import ncbitaxonomy.TaxonomyException;

/**
 *
 * @author Ka Ming Nip
 */
public class DuplicateNameException extends TaxonomyException {
    private final String name;
    
    public DuplicateNameException(String name, int existingId) {
        super("name `" + name + "` is already used by taxon " + existingId);
        this.name = name;
    }

    public String getName() {
        return name;
    }
    
    @Override
    public String getKind() {
        return "DuplicateName";
    }
}
