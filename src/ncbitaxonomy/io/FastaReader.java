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
import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import static ncbitaxonomy.io.Constants.BUFFER_SIZE;
import static ncbitaxonomy.util.FileUtils.getTextFileReader;

/**
 *
 * @author Ka Ming Nip
 */
public class FastaReader implements AutoCloseable {
    private final static Pattern RECORD_NAME_COMMENT_PATTERN = Pattern.compile("^>([^\\s]+)\\s*(.*)?$");
    private final BufferedReader br;
    private final String source;
    private long lineNumber = 0;
    private String header = null;
    private long headerLineNumber = 0;

    public FastaReader(String path) throws IOException {
        this(getTextFileReader(path), path);
    }

    public FastaReader(Reader reader, String source) {
        this.br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader, BUFFER_SIZE);
        this.source = source;
    }

    private String nextNonEmptyLine() throws IOException {
        for (String line; (line = br.readLine()) != null; ) {
            ++lineNumber;
            if (!line.trim().isEmpty()) {
                return line;
            }
        }
        return null;
    }

    public boolean hasNext() throws IOException {
        if (header == null) {
            header = nextNonEmptyLine();
            headerLineNumber = lineNumber;
        }
        return header != null;
    }

    /**
     * Lines are returned as read, without their line terminators. A record
     * with a malformed header is consumed before the exception is thrown, so
     * reading can continue with the next record.
     *
     * @return the next record, or null at the end of input
     * @throws FileFormatException if a record does not start with a valid '>' header line
     */
    public FastaRecord next() throws IOException {
        if (!hasNext()) {
            return null;
        }

        String headerLine = header;
        long recordLineNumber = headerLineNumber;

        ArrayList<String> seqLines = new ArrayList<>();
        header = null;
        for (String line; (line = nextNonEmptyLine()) != null; ) {
            if (line.charAt(0) == '>') {
                header = line;
                headerLineNumber = lineNumber;
                break;
            }
            seqLines.add(line);
        }

        Matcher m = RECORD_NAME_COMMENT_PATTERN.matcher(headerLine);
        if (!m.matches()) {
            throw new FileFormatException(source, recordLineNumber, "Incorrect FASTA header format");
        }

        String name = m.group(1);
        String comment = m.group(2) == null ? "" : m.group(2);

        return new FastaRecord(headerLine.substring(1), name, comment, seqLines);
    }

    @Override
    public void close() throws IOException {
        br.close();
    }
}
