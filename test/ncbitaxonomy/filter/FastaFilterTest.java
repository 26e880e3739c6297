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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.zip.GZIPOutputStream;
import ncbitaxonomy.SampleTaxonomies;
import ncbitaxonomy.io.FastaReader;
import ncbitaxonomy.io.FastaWriter;
import ncbitaxonomy.tree.TaxonNotFoundException;
import ncbitaxonomy.tree.Taxonomy;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FastaFilterTest {

    private static Taxonomy small;
    private static Taxonomy sample;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void load() throws Exception {
        small = SampleTaxonomies.small();
        sample = SampleTaxonomies.sample();
    }

    private static String run(FastaFilter filter, String input, FilterSummary[] summary) throws Exception {
        StringWriter out = new StringWriter();
        try (FastaReader reader = new FastaReader(new StringReader(input), "input.fa");
             FastaWriter writer = new FastaWriter(out)) {
            summary[0] = filter.filter(reader, writer, "input.fa");
        }
        return out.toString();
    }

    @Test
    void keepsSubtreeRecordsInInputOrder() throws Exception {
        String input = ">recA first [A]\nACGT\n"
                + ">recD fourth [D]\nTTTT\n"
                + ">recB second [B]\nGGGG\nCC\n"
                + ">recC third [C]\nAAAA\n";
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());
        FilterSummary[] summary = new FilterSummary[1];

        String output = run(filter, input, summary);

        assertThat(output).isEqualTo(">recA first [A]\nACGT\n"
                + ">recB second [B]\nGGGG\nCC\n"
                + ">recC third [C]\nAAAA\n");
        assertThat(summary[0].getNumRead()).isEqualTo(4);
        assertThat(summary[0].getNumWritten()).isEqualTo(3);
        assertThat(summary[0].getNumRejected()).isEqualTo(1);
        assertThat(summary[0].toString()).isEqualTo("3 records written out of 4 total records");
    }

    @Test
    void unresolvedRecordsAreDropped() throws Exception {
        String input = ">rec1 no organism here\nACGT\n"
                + ">rec2 hypothetical protein [Gorilla gorilla]\nACGT\n"
                + ">rec3 [B]\nACGT\n";
        FastaFilter filter = FastaFilter.create(small, "R", new DescriptionNameResolver(small), FastaFilterOptions.defaults());
        FilterSummary[] summary = new FilterSummary[1];

        String output = run(filter, input, summary);

        assertThat(output).isEqualTo(">rec3 [B]\nACGT\n");
        assertThat(summary[0].getNumUnresolved()).isEqualTo(2);
    }

    @Test
    void excludesRefSeqClasses() throws Exception {
        String input = ">NM_000014.6 alpha-2-macroglobulin [Homo sapiens]\nACGT\n"
                + ">XM_011520842.2 PREDICTED: alpha-2-macroglobulin [Pan troglodytes]\nACGT\n"
                + ">AB000263.1 Homo sapiens mRNA [Homo sapiens]\nACGT\n"
                + ">NM_001009.3 ribosomal protein [Mus musculus]\nACGT\n";
        DescriptionNameResolver resolver = new DescriptionNameResolver(sample);
        FilterSummary[] summary = new FilterSummary[1];

        String all = run(FastaFilter.create(sample, "Homininae", resolver, FastaFilterOptions.defaults()), input, summary);
        assertThat(all).contains(">NM_000014.6", ">XM_011520842.2", ">AB000263.1").doesNotContain("Mus musculus");

        String noPredicted = run(FastaFilter.create(sample, "Homininae", resolver, new FastaFilterOptions(false, true)), input, summary);
        assertThat(noPredicted).contains(">NM_000014.6", ">AB000263.1").doesNotContain(">XM_011520842.2");
        assertThat(summary[0].getNumExcluded()).isEqualTo(1);

        String noCurated = run(FastaFilter.create(sample, "Homininae", resolver, new FastaFilterOptions(true, false)), input, summary);
        assertThat(noCurated).contains(">XM_011520842.2", ">AB000263.1").doesNotContain(">NM_000014.6");
        assertThat(summary[0].getNumExcluded()).isEqualTo(2);

        String neither = run(FastaFilter.create(sample, "Homininae", resolver, new FastaFilterOptions(true, true)), input, summary);
        assertThat(neither).isEqualTo(">AB000263.1 Homo sapiens mRNA [Homo sapiens]\nACGT\n");
    }

    @Test
    void resolvesByAccession() throws Exception {
        HashMap<String, Integer> accessions = new HashMap<>();
        accessions.put("NC_000913", 562);
        accessions.put("NC_000001", 9606);
        AccessionTaxidResolver resolver = new AccessionTaxidResolver(sample, accessions);
        String input = ">NC_000913.3 Escherichia coli str. K-12 substr. MG1655, complete genome\nACGT\n"
                + ">NC_000001.11 Homo sapiens chromosome 1, GRCh38.p14 Primary Assembly\nACGT\n"
                + ">NC_999999.1 unknown\nACGT\n";
        FilterSummary[] summary = new FilterSummary[1];

        String output = run(FastaFilter.create(sample, "Bacteria <bacteria>", resolver, FastaFilterOptions.defaults()), input, summary);

        assertThat(output).startsWith(">NC_000913.3").doesNotContain("NC_000001").doesNotContain("NC_999999");
        assertThat(summary[0].getNumUnresolved()).isEqualTo(1);
    }

    @Test
    void filtersFilesAndGzip() throws Exception {
        Path input = tempDir.resolve("proteins.fa");
        Files.write(input, Arrays.asList(">recA [A]", "MKV", ">recD [D]", "MLL"), StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out.fa.gz");
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());

        FilterSummary summary = filter.filter(input.toString(), output.toString());

        assertThat(summary.getNumWritten()).isEqualTo(1);
        try (FastaReader reader = new FastaReader(output.toString())) {
            assertThat(reader.next().name).isEqualTo("recA");
            assertThat(reader.next()).isNull();
        }
    }

    @Test
    void malformedRecordsAreSkippedAndCounted() throws Exception {
        String input = ">rec1 x [A]\nACGT\n"
                + "> [A]\nACGT\n"
                + ">rec3 y [A]\nGG\n";
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());
        FilterSummary[] summary = new FilterSummary[1];

        String output = run(filter, input, summary);

        assertThat(output).isEqualTo(">rec1 x [A]\nACGT\n>rec3 y [A]\nGG\n");
        assertThat(summary[0].getNumRead()).isEqualTo(3);
        assertThat(summary[0].getNumWritten()).isEqualTo(2);
        assertThat(summary[0].getNumMalformed()).isEqualTo(1);
        assertThat(summary[0].getNumRejected()).isZero();
    }

    @Test
    void malformedRecordDoesNotAbortFileOutput() throws Exception {
        Path input = tempDir.resolve("in.fa");
        Files.write(input, Arrays.asList(">rec1 x [A]", "ACGT", "> [A]", "ACGT", ">rec3 y [A]", "GG"), StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out.fa");
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());

        FilterSummary summary = filter.filter(input.toString(), output.toString());

        assertThat(summary.getNumMalformed()).isEqualTo(1);
        assertThat(output).exists();
        assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8))
                .isEqualTo(">rec1 x [A]\nACGT\n>rec3 y [A]\nGG\n");
    }

    @Test
    void truncatedInputRemovesOutput() throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(compressed)) {
            for (int i = 0; i < 1000; ++i) {
                gz.write((">rec" + i + " protein " + i + " [A]\nMKVLAAGIVALLLAAGCSSSKEETPAPKPE" + i + "\n")
                        .getBytes(StandardCharsets.UTF_8));
            }
        }
        byte[] bytes = compressed.toByteArray();
        Path input = tempDir.resolve("in.fa.gz");
        Files.write(input, Arrays.copyOf(bytes, bytes.length / 2));
        Path output = tempDir.resolve("out.fa");
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());

        assertThatThrownBy(() -> filter.filter(input.toString(), output.toString()))
                .isInstanceOf(IOException.class);

        assertThat(output).doesNotExist();
    }

    @Test
    void writesToGivenStreamWithoutOutputPath() throws Exception {
        Path input = tempDir.resolve("proteins.fa");
        Files.write(input, Arrays.asList(">recA [A]", "MKV", ">recD [D]", "MLL"), StandardCharsets.UTF_8);
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        FastaFilter filter = FastaFilter.create(small, "A", new DescriptionNameResolver(small), FastaFilterOptions.defaults());

        filter.filter(input.toString(), null, stdout);

        assertThat(stdout.toString(StandardCharsets.UTF_8.name())).isEqualTo(">recA [A]\nMKV\n");
    }

    @Test
    void unknownAncestorFailsBeforeFiltering() {
        assertThatThrownBy(() -> FastaFilter.create(small, "Z", new DescriptionNameResolver(small), FastaFilterOptions.defaults()))
                .isInstanceOf(TaxonNotFoundException.class);
    }
}
