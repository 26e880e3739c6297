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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.regex.Pattern;
import ncbitaxonomy.io.FileFormatException;
import static ncbitaxonomy.io.FastqReader.removeMateSuffix;
import static ncbitaxonomy.util.FileUtils.getTextFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Taxon assignments per read id, read from a Kraken2 or Centrifuge report.
 * Read ids are stored without their mate suffix.
 *
 * @author Ka Ming Nip
 */
public class ClassificationReport {
    private static final Logger LOG = LoggerFactory.getLogger(ClassificationReport.class);
    private static final Pattern FIELD_SEPARATOR_PATTERN = Pattern.compile("\t");
    private static final String CENTRIFUGE_HEADER = "readID";
    private static final String TAXID_TAG = "(taxid ";

    /** taxid of an unclassified read */
    public static final int UNCLASSIFIED = 0;

    private static class Assignment {
        long score;
        int[] taxIds;
        int size;

        Assignment(long score, int taxId) {
            this.score = score;
            this.taxIds = new int[]{taxId};
            this.size = 1;
        }

        void add(int taxId) {
            if (size == taxIds.length) {
                taxIds = Arrays.copyOf(taxIds, size * 2);
            }
            taxIds[size++] = taxId;
        }

        void reset(long score, int taxId) {
            this.score = score;
            this.size = 0;
            add(taxId);
        }
    }

    private final ReportFormat format;
    private final HashMap<String, Assignment> assignments = new HashMap<>();

    private ClassificationReport(ReportFormat format) {
        this.format = format;
    }

    public ReportFormat getFormat() {
        return format;
    }

    public int size() {
        return assignments.size();
    }

    public boolean contains(String readId) {
        return assignments.containsKey(readId);
    }

    /**
     * @return the taxa kept for {@code readId}, or null if the read is not in the report
     */
    public int[] getTaxIds(String readId) {
        Assignment a = assignments.get(readId);
        return a == null ? null : Arrays.copyOf(a.taxIds, a.size);
    }

    /**
     * @return true if the read's assignments place it inside the filter's subtree
     */
    public boolean accepts(String readId, DescendantFilter filter) {
        Assignment a = assignments.get(readId);
        if (a == null) {
            return false;
        }

        switch (format) {
            case KRAKEN2:
                for (int i=0; i<a.size; ++i) {
                    if (!filter.accepts(a.taxIds[i])) {
                        return false;
                    }
                }
                return true;
            case CENTRIFUGE:
                for (int i=0; i<a.size; ++i) {
                    if (filter.accepts(a.taxIds[i])) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("unknown report format " + format);
        }
    }

    public static ClassificationReport read(String path, ReportFormat format) throws IOException {
        ClassificationReport report = new ClassificationReport(format);

        try (BufferedReader br = getTextFileReader(path)) {
            long lineNumber = 0;
            for (String line; (line = br.readLine()) != null; ) {
                ++lineNumber;
                if (line.isEmpty()) {
                    continue;
                }

                String[] fields = FIELD_SEPARATOR_PATTERN.split(line);
                switch (format) {
                    case KRAKEN2:
                        report.addKraken2(fields, path, lineNumber);
                        break;
                    case CENTRIFUGE:
                        if (lineNumber == 1 && line.startsWith(CENTRIFUGE_HEADER)) {
                            continue;
                        }
                        report.addCentrifuge(fields, path, lineNumber);
                        break;
                }
            }
        }

        LOG.info("Read {} classifications of {} reads from {}", format, report.size(), path);

        return report;
    }

    private void addKraken2(String[] fields, String path, long lineNumber) throws FileFormatException {
        if (fields.length < 3) {
            throw new FileFormatException(path, lineNumber, "expected at least 3 tab-separated columns in Kraken2 output");
        }

        String readId = removeMateSuffix(fields[1]);
        int taxId;
        if ("U".equals(fields[0])) {
            taxId = UNCLASSIFIED;
        }
        else if ("C".equals(fields[0])) {
            taxId = parseKraken2TaxId(fields[2], path, lineNumber);
        }
        else {
            throw new FileFormatException(path, lineNumber, "classification status must be C or U, got `" + fields[0] + "`");
        }

        Assignment a = assignments.get(readId);
        if (a == null) {
            assignments.put(readId, new Assignment(0, taxId));
        }
        else {
            a.add(taxId);
        }
    }

    /**
     * Accepts both the plain taxid and the {@code --use-names} form {@code "Homo sapiens (taxid 9606)"}.
     */
    static int parseKraken2TaxId(String field, String path, long lineNumber) throws FileFormatException {
        String value = field;
        int tag = field.lastIndexOf(TAXID_TAG);
        if (tag >= 0) {
            int end = field.indexOf(')', tag);
            if (end < 0) {
                throw new FileFormatException(path, lineNumber, "unterminated taxid in `" + field + "`");
            }
            value = field.substring(tag + TAXID_TAG.length(), end);
        }

        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new FileFormatException(path, lineNumber, "invalid taxon id `" + field + "`");
        }
    }

    private void addCentrifuge(String[] fields, String path, long lineNumber) throws FileFormatException {
        if (fields.length < 4) {
            throw new FileFormatException(path, lineNumber, "expected at least 4 tab-separated columns in Centrifuge output");
        }

        String readId = removeMateSuffix(fields[0]);
        int taxId;
        long score;
        try {
            taxId = Integer.parseInt(fields[2].trim());
            score = Long.parseLong(fields[3].trim());
        }
        catch (NumberFormatException e) {
            throw new FileFormatException(path, lineNumber, "invalid taxon id or score");
        }

        Assignment a = assignments.get(readId);
        if (a == null) {
            assignments.put(readId, new Assignment(score, taxId));
        }
        else if (score > a.score) {
            a.reset(score, taxId);
        }
        else if (score == a.score) {
            a.add(taxId);
        }
    }
}
