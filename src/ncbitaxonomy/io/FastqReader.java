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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import static ncbitaxonomy.io.Constants.BUFFER_SIZE;
import static ncbitaxonomy.util.FileUtils.getTextFileReader;

/**
 *
 * @author Ka Ming Nip
 */
public class FastqReader implements AutoCloseable {
    protected final static Pattern RECORD_NAME_PATTERN = Pattern.compile("([^\\s]+)/[12]");
    protected final static Pattern RECORD_NAME_COMMENT_PATTERN = Pattern.compile("^@([^\\s]+)\\s*(.*)?$");
    protected final BufferedReader br;
    protected final String source;
    protected long lineNumber = 0;

    public FastqReader(String path) throws IOException {
        this(getTextFileReader(path), path);
    }

    public FastqReader(Reader reader, String source) {
        this.br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader, BUFFER_SIZE);
        this.source = source;
    }

    /**
     * @return {@code name} without a trailing {@code /1} or {@code /2}
     */
    public static String removeMateSuffix(String name) {
        Matcher m = RECORD_NAME_PATTERN.matcher(name);
        return m.matches() ? m.group(1) : name;
    }

    private String readLine(boolean required) throws IOException {
        String line = br.readLine();
        if (line == null) {
            if (required) {
                throw new FileFormatException(source, lineNumber, "Truncated FASTQ record");
            }
            return null;
        }
        ++lineNumber;
        return line;
    }

    /**
     * @return the next record, or null at the end of input
     * @throws FileFormatException if the record is truncated or its lines are malformed
     */
    public FastqRecord next() throws IOException {
        String line1 = readLine(false);
        while (line1 != null && line1.isEmpty()) {
            line1 = readLine(false);
        }

        if (line1 == null) {
            return null;
        }

        String seq = readLine(true);
        String line3 = readLine(true);
        String qual = readLine(true);

        if (line3.isEmpty() || line3.charAt(0) != '+') {
            throw new FileFormatException(source, lineNumber - 1, "Line 3 of a FASTQ record is expected to start with '+'");
        }

        if (seq.length() != qual.length()) {
            throw new FileFormatException(source, lineNumber, "Sequence and quality lengths differ");
        }

        Matcher m = RECORD_NAME_COMMENT_PATTERN.matcher(line1);
        if (!m.matches()) {
            throw new FileFormatException(source, lineNumber - 3, "Line 1 of a FASTQ record is expected to start with '@'");
        }

        return new FastqRecord(removeMateSuffix(m.group(1)), line1.substring(1), seq, line3.substring(1), qual);
    }

    @Override
    public void close() throws IOException {
        br.close();
    }
}
