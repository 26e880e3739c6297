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
package ncbitaxonomy;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.UUID;
import ncbitaxonomy.db.TaxonomyDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NCBITaxonomyTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private String taxdir;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        taxdir = SampleTaxonomies.taxdumpDir().toString();
    }

    private int run(String... args) {
        NCBITaxonomy cli = new NCBITaxonomy(new PrintStream(out, true), new PrintStream(err, true));
        return cli.run(args);
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void getIdAndName() {
        assertThat(run("get_id", "-T", taxdir, "Homo sapiens")).isZero();
        assertThat(run("get_name", "-T", taxdir, "562")).isZero();

        assertThat(stdout()).isEqualTo("9606\nEscherichia coli\n".replace("\n", System.lineSeparator()));
    }

    @Test
    void lineageWithNames() {
        assertThat(run("get_lineage", "-T", taxdir, "-S", "-D", " > ", "Escherichia coli")).isZero();

        assertThat(stdout().trim()).isEqualTo("Escherichia coli (562) > Escherichia (561) > Enterobacteriaceae (543)"
                + " > Pseudomonadota (1224) > Bacteria <bacteria> (2) > cellular organisms (131567) > root (1)");
    }

    @Test
    void lineageIds() {
        assertThat(run("get_lineage", "-T", taxdir, "Mus musculus")).isZero();

        assertThat(stdout().trim()).isEqualTo("10090;10088;10066;9989;40674;7711;33208;2759;131567;1");
    }

    @Test
    void commonAncestorDistance() {
        assertThat(run("common_ancestor_distance", "-T", taxdir, "Homo sapiens", "Mus musculus")).isZero();
        assertThat(run("common_ancestor_distance", "-T", taxdir, "--only_canonical", "Homo sapiens", "Mus musculus")).isZero();

        assertThat(stdout().split("\\R")).containsExactly("9\tMammalia", "8\tMammalia");
    }

    @Test
    void unknownNameIsNotFound() {
        assertThat(run("get_id", "-T", taxdir, "Gorilla gorilla")).isEqualTo(1);

        assertThat(stderr()).startsWith("ERROR: NotFound: ").contains("Gorilla gorilla");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void queriesReadTheDatabase() {
        String url = "jdbc:h2:mem:cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";

        assertThat(run("to_db", "-T", taxdir, "--db", url)).isZero();
        assertThat(run("get_id", "--db", url, "Pan troglodytes")).isZero();

        assertThat(stdout().trim()).isEqualTo("9598");
    }

    @Test
    void danglingParentIsReportedAndNothingSaved() throws Exception {
        Files.write(tempDir.resolve("nodes.dmp"), Arrays.asList(
                "1\t|\t1\t|\tno rank\t|", "2\t|\t77\t|\tgenus\t|"), StandardCharsets.UTF_8);
        Files.write(tempDir.resolve("names.dmp"), Arrays.asList(
                "1\t|\troot\t|\t\t|\tscientific name\t|", "2\t|\tOrphan\t|\t\t|\tscientific name\t|"), StandardCharsets.UTF_8);
        String url = "jdbc:h2:mem:cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";

        assertThat(run("to_db", "-T", tempDir.toString(), "--db", url)).isEqualTo(1);

        assertThat(stderr()).startsWith("ERROR: MalformedTaxonomy: ");
        assertThat(new TaxonomyDatabase(url).countRows()).isZero();
    }

    @Test
    void filterFastaToFile() throws Exception {
        Path input = tempDir.resolve("proteins.fa");
        Files.write(input, Arrays.asList(
                ">NP_000005.3 alpha-2-macroglobulin [Homo sapiens]", "MGKNKLLHPS",
                ">NP_032193.2 protein [Mus musculus]", "MRLLLLLLAG",
                ">XP_001234.1 predicted protein [Pan troglodytes]", "MKKLL"), StandardCharsets.UTF_8);
        Path output = tempDir.resolve("hominids.fa");

        assertThat(run("filter_fasta", "-T", taxdir, "-A", "Hominidae", "--exclude_predicted",
                "-o", output.toString(), input.toString())).isZero();

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8))
                .containsExactly(">NP_000005.3 alpha-2-macroglobulin [Homo sapiens]", "MGKNKLLHPS");
    }

    @Test
    void filterFastaUnknownAncestorCreatesNoOutput() throws Exception {
        Path input = tempDir.resolve("proteins.fa");
        Files.write(input, Arrays.asList(">rec [Homo sapiens]", "MK"), StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out.fa");

        assertThat(run("filter_fasta", "-T", taxdir, "-A", "Hominoidea", "-o", output.toString(), input.toString())).isEqualTo(1);

        assertThat(stderr()).startsWith("ERROR: NotFound: ");
        assertThat(output).doesNotExist();
    }

    @Test
    void filterFastqWithCentrifugeReport() throws Exception {
        Path reads = tempDir.resolve("reads.fq");
        Files.write(reads, Arrays.asList("@r1", "ACGT", "+", "IIII", "@r2", "ACGT", "+", "IIII"), StandardCharsets.UTF_8);
        Path report = tempDir.resolve("centrifuge.tsv");
        Files.write(report, Arrays.asList(
                "readID\tseqID\ttaxID\tscore\t2ndBestScore\thitLength\tqueryLength\tnumMatches",
                "r1\tNC_000913.3\t562\t900\t0\t4\t4\t1",
                "r2\tNC_000001.11\t9606\t900\t0\t4\t4\t1"), StandardCharsets.UTF_8);
        Path outDir = tempDir.resolve("filtered");

        assertThat(run("filter_fastq", "-T", taxdir, "-A", "2", "-F", report.toString(), "-C",
                "-d", outDir.toString(), reads.toString())).isZero();

        assertThat(Files.readAllLines(outDir.resolve("reads.filtered.fq"), StandardCharsets.UTF_8))
                .containsExactly("@r1", "ACGT", "+", "IIII");
    }

    @Test
    void filterFastaWithoutOutputPrintsRecords() throws Exception {
        Path input = tempDir.resolve("proteins.fa");
        Files.write(input, Arrays.asList(
                ">NP_000005.3 alpha-2-macroglobulin [Homo sapiens]", "MGKNKLLHPS",
                ">NP_032193.2 protein [Mus musculus]", "MRLLLLLLAG"), StandardCharsets.UTF_8);

        assertThat(run("filter_fasta", "-T", taxdir, "-A", "Hominidae", input.toString())).isZero();

        assertThat(stdout()).isEqualTo(">NP_000005.3 alpha-2-macroglobulin [Homo sapiens]\nMGKNKLLHPS\n");
    }

    @Test
    void filterFastqToStdout() throws Exception {
        Path reads = tempDir.resolve("reads.fq");
        Files.write(reads, Arrays.asList("@r1", "ACGT", "+", "IIII", "@r2", "ACGT", "+", "IIII"), StandardCharsets.UTF_8);
        Path report = tempDir.resolve("kraken2.out");
        Files.write(report, Arrays.asList("C\tr1\t562\t4\t562:4", "C\tr2\t9606\t4\t9606:4"), StandardCharsets.UTF_8);

        assertThat(run("filter_fastq", "-T", taxdir, "-A", "2", "-F", report.toString(), "-K",
                "--stdout", reads.toString())).isZero();

        assertThat(stdout()).isEqualTo("@r1\nACGT\n+\nIIII\n");
    }

    @Test
    void filterFastqRejectsCollidingOutputs() throws Exception {
        Path a = Files.createDirectories(tempDir.resolve("a")).resolve("reads.fastq");
        Path b = Files.createDirectories(tempDir.resolve("b")).resolve("reads.fastq");
        Files.write(a, Arrays.asList("@r1", "ACGT", "+", "IIII"), StandardCharsets.UTF_8);
        Files.write(b, Arrays.asList("@r1", "ACGT", "+", "IIII"), StandardCharsets.UTF_8);
        Path outDir = tempDir.resolve("out");

        assertThat(run("filter_fastq", "-T", taxdir, "-A", "2", "-F", "report.tsv", "-K",
                "-d", outDir.toString(), a.toString(), b.toString())).isEqualTo(1);

        assertThat(stderr()).startsWith("ERROR: ").contains("would both be written to");
        assertThat(outDir).doesNotExist();
    }

    @Test
    void filterFastqNeedsReportTool() throws Exception {
        assertThat(run("filter_fastq", "-T", taxdir, "-A", "2", "-F", "report.tsv", "reads.fq")).isEqualTo(1);

        assertThat(stderr()).startsWith("ERROR: ");
    }

    @Test
    void filterFastqRejectsNonNumericAncestor() {
        assertThat(run("filter_fastq", "-T", taxdir, "-A", "Bacteria", "-F", "report.tsv", "-K", "reads.fq")).isEqualTo(1);

        assertThat(stderr()).contains("(Bacteria)");
    }

    @Test
    void stdoutOnlyWithSingleInput() {
        assertThat(run("filter_fastq", "-T", taxdir, "-A", "2", "-F", "report.tsv", "-K", "--stdout", "a.fq", "b.fq")).isEqualTo(1);

        assertThat(stderr()).contains("--stdout");
    }

    @Test
    void usageAndVersion() {
        assertThat(run()).isEqualTo(1);
        assertThat(run("-v")).isZero();
        assertThat(run("get_lineage", "-h")).isZero();
        assertThat(run("no_such_command")).isEqualTo(1);

        assertThat(stdout()).contains("NCBI-Taxonomy v" + NCBITaxonomy.VERSION).contains("--show_names");
        assertThat(stderr()).contains("no_such_command");
    }
}
