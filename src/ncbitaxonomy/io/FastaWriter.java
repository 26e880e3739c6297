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

import java.io.IOException;
import java.io.Writer;
import static ncbitaxonomy.util.FileUtils.getTextFileWriter;

/**
 *
 * @author Ka Ming Nip
 */
public class FastaWriter implements AutoCloseable {
    private final Writer out;
    
    public FastaWriter(String path) throws IOException {
        this(getTextFileWriter(path));
    }
    
    public FastaWriter(Writer out) {
        this.out = out;
    }
    
    /**
     * Writes the record with its original header and line wrapping.
     */
    public void write(FastaRecord record) throws IOException {
        out.write('>');
        out.write(record.header);
        out.write('\n');
        for (String line : record.seqLines) {
            out.write(line);
            out.write('\n');
        }
    }
    
    @Override
    public void close() throws IOException {
        out.flush();
        out.close();
    }
}
