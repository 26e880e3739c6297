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

import java.io.IOException;
import java.io.OutputStream;
import ncbitaxonomy.io.FastaReader;
import ncbitaxonomy.io.FastaRecord;
import ncbitaxonomy.io.FastaWriter;
import ncbitaxonomy.io.FileFormatException;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.TaxonNotFoundException;
import ncbitaxonomy.tree.Taxonomy;
import ncbitaxonomy.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the FASTA records whose taxon lies in the subtree of an ancestor.
 * Records that cannot be parsed, are excluded by accession class, cannot be
 * resolved or fall outside the subtree are dropped and counted; no record
 * ever fails the run.
 *
 * @author Ka Ming Nip
 */
public class FastaFilter {
    private static final Logger LOG = LoggerFactory.getLogger(FastaFilter.class);

    private final DescendantFilter descendants;
    private final TaxonResolver resolver;
    private final FastaFilterOptions options;

    public FastaFilter(DescendantFilter descendants, TaxonResolver resolver, FastaFilterOptions options) {
        this.descendants = descendants;
        this.resolver = resolver;
        this.options = options;
    }

    /**
     * @throws TaxonNotFoundException if no taxon is named {@code ancestorName}
     */
    public static FastaFilter create(Taxonomy taxonomy, String ancestorName,
            TaxonResolver resolver, FastaFilterOptions options) throws TaxonNotFoundException {
        return new FastaFilter(DescendantFilter.of(taxonomy, ancestorName), resolver, options);
    }

    public DescendantFilter getDescendantFilter() {
        return descendants;
    }

    public boolean accepts(FastaRecord record, FilterSummary summary) {
        if (options.isExcluded(AccessionClass.classify(record.name))) {
            ++summary.numExcluded;
            return false;
        }

        TaxonNode taxon = resolver.resolve(record);
        if (taxon == null) {
            ++summary.numUnresolved;
            LOG.debug("No taxon found for {}", record.name);
            return false;
        }

        return descendants.isDescendantOrSelf(taxon);
    }

    public FilterSummary filter(FastaReader reader, FastaWriter writer, String source) throws IOException {
        FilterSummary summary = new FilterSummary(source);

        for (;;) {
            FastaRecord record;
            try {
                record = reader.next();
            }
            catch (FileFormatException e) {
                ++summary.numRead;
                ++summary.numMalformed;
                LOG.warn("Skipping malformed record: {}", e.getMessage());
                continue;
            }

            if (record == null) {
                break;
            }

            ++summary.numRead;
            if (accepts(record, summary)) {
                writer.write(record);
                ++summary.numWritten;
            }
        }

        LOG.info("{}: {}", source, summary);
        return summary;
    }

    public FilterSummary filter(String inputPath, String outputPath) throws IOException {
        return filter(inputPath, outputPath, System.out);
    }

    /**
     * If the run fails, an output file it has created is deleted.
     *
     * @param inputPath   FASTA file, optionally gzipped
     * @param outputPath  output FASTA file, or null for {@code stdout}
     * @param stdout      stream used when {@code outputPath} is null; it is flushed, not closed
     */
    public FilterSummary filter(String inputPath, String outputPath, OutputStream stdout) throws IOException {
        FileUtils.checkReadable(inputPath);

        if (outputPath == null) {
            try (FastaReader reader = new FastaReader(inputPath);
                 FastaWriter writer = new FastaWriter(FileUtils.getStdoutWriter(stdout))) {
                return filter(reader, writer, inputPath);
            }
        }

        try (FastaReader reader = new FastaReader(inputPath);
             FastaWriter writer = new FastaWriter(outputPath)) {
            return filter(reader, writer, inputPath);
        }
        catch (IOException | RuntimeException e) {
            LOG.info("Removing incomplete output {}", outputPath);
            try {
                FileUtils.deleteIfExists(outputPath);
            }
            catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }
}
