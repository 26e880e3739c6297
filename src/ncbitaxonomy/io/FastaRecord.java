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

import java.util.List;

/**
 * A FASTA record as read from disk: the header line after {@code >} and the
 * sequence lines as they were wrapped in the input.
 *
 * @author Ka Ming Nip
 */
public class FastaRecord {
    public final String header;
    public final String name;
    public final String comment;
    public final List<String> seqLines;
    
    public FastaRecord(String header, String name, String comment, List<String> seqLines) {
        this.header = header;
        this.name = name;
        this.comment = comment;
        this.seqLines = seqLines;
    }
    
    public String getSeq() {
        return String.join("", seqLines);
    }
}
