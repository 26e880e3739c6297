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
package ncbitaxonomy.io;

/**
 *
 * @author Ka Ming Nip
 */
public final class Constants {
    public static final int BUFFER_SIZE = 1048576; // 1 MB
    public static final String GZIP_EXT = ".gz";
    public static final String FILTERED_INFIX = "filtered";
    public static final String NODES_DMP = "nodes.dmp";
    public static final String NAMES_DMP = "names.dmp";
    public static final String DMP_FIELD_SEPARATOR = "\t|\t";
    public static final String DMP_LINE_TERMINATOR = "\t|";
    
    private Constants() {
    }
}
