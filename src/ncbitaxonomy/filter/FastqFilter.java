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

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import ncbitaxonomy.io.FastqReader;
import ncbitaxonomy.io.FastqRecord;
import ncbitaxonomy.io.FastqWriter;
import ncbitaxonomy.tree.TaxonNotFoundException;
import ncbitaxonomy.tree.Taxonomy;
import ncbitaxonomy.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the FASTQ reads that a classification report places in the subtree of
 * an ancestor. Each input file is written to its own output file, in input order.
 *
 * @author Ka Ming Nip
 */
public class FastqFilter {
    private static final Logger LOG = LoggerFactory.getLogger(FastqFilter.class);

    private final DescendantFilter descendants;
    private final ClassificationReport report;
    private final FastqFilterOptions options;

    public FastqFilter(DescendantFilter descendants, ClassificationReport report, FastqFilterOptions options) {
        this.descendants = descendants;
        this.report = report;
        this.options = options;
    }

    /**
     * Resolves the ancestor and reads the report; no output is created here.
     *
     * @throws TaxonNotFoundException if there is no taxon {@code ancestorId}
     */
    public static FastqFilter create(Taxonomy taxonomy, int ancestorId, String reportPath,
            FastqFilterOptions options) throws TaxonNotFoundException, IOException {
        DescendantFilter descendants = DescendantFilter.of(taxonomy, ancestorId);
        LOG.info("Keeping reads assigned to {} or its descendants", descendants.getTarget());
        ClassificationReport report = ClassificationReport.read(reportPath, options.getReportFormat());
        return new FastqFilter(descendants, report, options);
    }

    public FilterSummary filter(FastqReader reader, FastqWriter writer, String source) throws IOException, UnmappedReadException {
        FilterSummary summary = new FilterSummary(source);

        for (FastqRecord record; (record = reader.next()) != null; ) {
            ++summary.numRead;

            if (!report.contains(record.name)) {
                if (options.getUnmappedReadPolicy() == UnmappedReadPolicy.FAIL) {
                    throw new UnmappedReadException(record.name, source);
                }
                ++summary.numUnmapped;
                continue;
            }

            if (report.accepts(record.name, descendants)) {
                writer.write(record);
                ++summary.numWritten;
            }
        }

        if (summary.numUnmapped > 0) {
            LOG.warn("{}: skipped {} reads missing from the classification report", source, summary.numUnmapped);
        }

        LOG.info("{}: {}", source, summary);
        return summary;
    }

    /**
     * @param inputPath  FASTQ file
     * @param outputDir  output directory, or null for the directory of {@code inputPath}
     * @return path of the filtered output for {@code inputPath}
     */
    public static String getOutputPath(String inputPath, String outputDir) {
        File input = new File(inputPath);
        String dir = outputDir;
        if (dir == null) {
            dir = input.getAbsoluteFile().getParent();
        }
        return new File(dir, FileUtils.getFilteredFileName(input.getName())).getPath();
    }

    public String getOutputPath(String inputPath) {
        return getOutputPath(inputPath, options.getOutputDir());
    }

    /**
     * @return the output path of each input, in input order
     * @throws IllegalArgumentException if two inputs map to the same output or an output is one of the inputs
     */
    public static List<String> getOutputPaths(List<String> inputPaths, String outputDir) {
        HashSet<Path> inputs = new HashSet<>();
        for (String path : inputPaths) {
            if (!inputs.add(normalize(path))) {
                throw new IllegalArgumentException("input file `" + path + "` is given more than once");
            }
        }

        ArrayList<String> outputPaths = new ArrayList<>(inputPaths.size());
        HashMap<Path, String> outputToInput = new HashMap<>();
        for (String path : inputPaths) {
            String outputPath = getOutputPath(path, outputDir);
            Path output = normalize(outputPath);
            if (inputs.contains(output)) {
                throw new IllegalArgumentException("output file `" + outputPath + "` for `" + path + "` is also an input file");
            }
            String other = outputToInput.put(output, path);
            if (other != null) {
                throw new IllegalArgumentException("input files `" + other + "` and `" + path
                        + "` would both be written to `" + outputPath + "`");
            }
            outputPaths.add(outputPath);
        }

        return outputPaths;
    }

    private static Path normalize(String path) {
        return Paths.get(path).toAbsolutePath().normalize();
    }

    public List<FilterSummary> filter(List<String> inputPaths) throws IOException, UnmappedReadException {
        return filter(inputPaths, System.out);
    }

    /**
     * Filters every input into its own output. Output paths are checked before
     * any output is created. If any input fails, the output files created by
     * this call are deleted before the failure is rethrown.
     *
     * @param stdout stream used for a single input when writing to standard output; it is flushed, not closed
     * @throws IllegalArgumentException if the output paths do not correspond one to one with the inputs
     */
    public List<FilterSummary> filter(List<String> inputPaths, OutputStream stdout) throws IOException, UnmappedReadException {
        if (options.isToStdout() && inputPaths.size() != 1) {
            throw new IllegalArgumentException("standard output can only be used with a single input file");
        }

        for (String path : inputPaths) {
            FileUtils.checkReadable(path);
        }

        if (options.isToStdout()) {
            String path = inputPaths.get(0);
            try (FastqReader reader = new FastqReader(path);
                 FastqWriter writer = new FastqWriter(FileUtils.getStdoutWriter(stdout))) {
                ArrayList<FilterSummary> summaries = new ArrayList<>(1);
                summaries.add(filter(reader, writer, path));
                return summaries;
            }
        }

        List<String> outputPaths = getOutputPaths(inputPaths, options.getOutputDir());

        if (options.getOutputDir() != null) {
            FileUtils.mkdirs(options.getOutputDir());
        }

        ArrayList<FilterSummary> summaries = new ArrayList<>(inputPaths.size());
        ArrayList<String> created = new ArrayList<>(inputPaths.size());

        try {
            for (int i=0; i<inputPaths.size(); ++i) {
                String path = inputPaths.get(i);
                String outputPath = outputPaths.get(i);
                LOG.info("Filtering {} into {}", path, outputPath);
                try (FastqReader reader = new FastqReader(path);
                     FastqWriter writer = new FastqWriter(outputPath)) {
                    created.add(outputPath);
                    summaries.add(filter(reader, writer, path));
                }
            }
        }
        catch (IOException | UnmappedReadException | RuntimeException e) {
            removeOutputs(created, e);
            throw e;
        }

        return summaries;
    }

    private static void removeOutputs(List<String> paths, Exception cause) {
        for (String path : paths) {
            LOG.info("Removing incomplete output {}", path);
            try {
                FileUtils.deleteIfExists(path);
            }
            catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
    }
}
