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

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import ncbitaxonomy.db.TaxonomyDatabase;
import ncbitaxonomy.filter.AccessionTaxidResolver;
import ncbitaxonomy.filter.DescendantFilter;
import ncbitaxonomy.filter.DescriptionNameResolver;
import ncbitaxonomy.filter.FastaFilter;
import ncbitaxonomy.filter.FastaFilterOptions;
import ncbitaxonomy.filter.FastqFilter;
import ncbitaxonomy.filter.FastqFilterOptions;
import ncbitaxonomy.filter.FilterSummary;
import ncbitaxonomy.filter.ReportFormat;
import ncbitaxonomy.filter.TaxonResolver;
import ncbitaxonomy.filter.UnmappedReadPolicy;
import ncbitaxonomy.io.NcbiDumpReader;
import ncbitaxonomy.tree.AncestryIndexer;
import ncbitaxonomy.tree.TaxonNode;
import ncbitaxonomy.tree.Taxonomy;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * @author Ka Ming Nip
 */
public class NCBITaxonomy {
    public final static String VERSION = "1.0.7";
    private static final Logger LOG = LoggerFactory.getLogger(NCBITaxonomy.class);

    public final static String CMD_TO_DB = "to_db";
    public final static String CMD_GET_ID = "get_id";
    public final static String CMD_GET_NAME = "get_name";
    public final static String CMD_GET_LINEAGE = "get_lineage";
    public final static String CMD_COMMON_ANCESTOR_DISTANCE = "common_ancestor_distance";
    public final static String CMD_FILTER_FASTA = "filter_fasta";
    public final static String CMD_FILTER_FASTQ = "filter_fastq";

    private final static List<String> COMMANDS = Arrays.asList(CMD_TO_DB, CMD_GET_ID, CMD_GET_NAME,
            CMD_GET_LINEAGE, CMD_COMMON_ANCESTOR_DISTANCE, CMD_FILTER_FASTA, CMD_FILTER_FASTQ);

    private final PrintStream out;
    private final PrintStream err;

    public NCBITaxonomy(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Thrown for invalid option values found after parsing.
     */
    private static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    private static Option optDatabase() {
        return Option.builder()
                    .longOpt("db")
                    .desc("JDBC URL of the taxonomy database [$" + TaxonomyDatabase.URL_ENV + " or " + TaxonomyDatabase.DEFAULT_URL + "]")
                    .hasArg(true)
                    .argName("URL")
                    .build();
    }

    private static Option optTaxDir(boolean required) {
        return Option.builder("T")
                    .longOpt("taxdir")
                    .desc("directory containing the NCBI taxonomy nodes.dmp and names.dmp files"
                            + (required ? "" : "; read instead of the database"))
                    .hasArg(true)
                    .argName("DIR")
                    .required(required)
                    .build();
    }

    private static Option optTaxPrefix() {
        return Option.builder("t")
                    .longOpt("tax_prefix")
                    .desc("string to prepend to names of nodes.dmp and names.dmp")
                    .hasArg(true)
                    .argName("STR")
                    .build();
    }

    private static Option optHelp() {
        return Option.builder("h")
                    .longOpt("help")
                    .desc("print this message and exit")
                    .hasArg(false)
                    .build();
    }

    static Options getOptions(String command) {
        Options options = new Options();
        options.addOption(optHelp());
        options.addOption(optDatabase());

        switch (command) {
            case CMD_TO_DB:
                options.addOption(optTaxDir(true));
                options.addOption(optTaxPrefix());
                break;
            case CMD_GET_ID:
            case CMD_GET_NAME:
                options.addOption(optTaxDir(false));
                options.addOption(optTaxPrefix());
                break;
            case CMD_GET_LINEAGE:
                options.addOption(optTaxDir(false));
                options.addOption(optTaxPrefix());
                options.addOption(Option.builder("S")
                                    .longOpt("show_names")
                                    .desc("show taxon names, not just IDs")
                                    .hasArg(false)
                                    .build());
                options.addOption(Option.builder("D")
                                    .longOpt("delimiter")
                                    .desc("delimiter for lineage string [;]")
                                    .hasArg(true)
                                    .argName("STR")
                                    .build());
                break;
            case CMD_COMMON_ANCESTOR_DISTANCE:
                options.addOption(optTaxDir(false));
                options.addOption(optTaxPrefix());
                options.addOption(Option.builder()
                                    .longOpt("only_canonical")
                                    .desc("only consider canonical taxonomic ranks")
                                    .hasArg(false)
                                    .build());
                break;
            case CMD_FILTER_FASTA:
                options.addOption(optTaxDir(false));
                options.addOption(optTaxPrefix());
                options.addOption(Option.builder("A")
                                    .longOpt("ancestor")
                                    .desc("name of ancestor to use as ancestor filter")
                                    .hasArg(true)
                                    .argName("NAME")
                                    .required(true)
                                    .build());
                options.addOption(Option.builder("o")
                                    .longOpt("output")
                                    .desc("output FASTA file [stdout]")
                                    .hasArg(true)
                                    .argName("FILE")
                                    .build());
                options.addOption(Option.builder()
                                    .longOpt("accession2taxid")
                                    .desc("accession to taxid table used instead of the [organism] in the description")
                                    .hasArg(true)
                                    .argName("FILE")
                                    .build());
                options.addOption(Option.builder()
                                    .longOpt("exclude_curated")
                                    .desc("drop curated RefSeq records (NM_, NR_, NP_, ...)")
                                    .hasArg(false)
                                    .build());
                options.addOption(Option.builder()
                                    .longOpt("exclude_predicted")
                                    .desc("drop predicted RefSeq records (XM_, XR_, XP_)")
                                    .hasArg(false)
                                    .build());
                break;
            case CMD_FILTER_FASTQ:
                options.addOption(optTaxDir(false));
                options.addOption(optTaxPrefix());
                options.addOption(Option.builder("A")
                                    .longOpt("ancestor_taxid")
                                    .desc("taxonomy ID of ancestor to use as ancestor filter")
                                    .hasArg(true)
                                    .argName("INT")
                                    .required(true)
                                    .build());
                options.addOption(Option.builder("F")
                                    .longOpt("tax_report_filename")
                                    .desc("read classification output from Kraken2 or Centrifuge")
                                    .hasArg(true)
                                    .argName("FILE")
                                    .required(true)
                                    .build());
                OptionGroup tools = new OptionGroup();
                tools.addOption(Option.builder("K")
                                    .longOpt("kraken2")
                                    .desc("classification report is from Kraken2")
                                    .hasArg(false)
                                    .build());
                tools.addOption(Option.builder("C")
                                    .longOpt("centrifuge")
                                    .desc("classification report is from Centrifuge")
                                    .hasArg(false)
                                    .build());
                tools.setRequired(true);
                options.addOptionGroup(tools);
                options.addOption(Option.builder("d")
                                    .longOpt("output_dir")
                                    .desc("directory to deposit filtered output files in [directory of each input]")
                                    .hasArg(true)
                                    .argName("DIR")
                                    .build());
                options.addOption(Option.builder()
                                    .longOpt("stdout")
                                    .desc("write filtered reads of a single input file to stdout")
                                    .hasArg(false)
                                    .build());
                options.addOption(Option.builder()
                                    .longOpt("skip_unmapped")
                                    .desc("skip reads missing from the classification report instead of failing")
                                    .hasArg(false)
                                    .build());
                break;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }

        return options;
    }

    private static String getArgsSyntax(String command) {
        switch (command) {
            case CMD_GET_ID:
                return " NAME";
            case CMD_GET_NAME:
                return " ID";
            case CMD_GET_LINEAGE:
                return " NAME";
            case CMD_COMMON_ANCESTOR_DISTANCE:
                return " NAME1 NAME2";
            case CMD_FILTER_FASTA:
                return " INPUT_FASTA";
            case CMD_FILTER_FASTQ:
                return " INPUT_FASTQ...";
            default:
                return "";
        }
    }

    public void printHelp(String command, Options options) {
        PrintWriter pw = new PrintWriter(out);
        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(null);
        formatter.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "java -jar ncbi-taxonomy.jar " + command + " [options]" + getArgsSyntax(command),
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, false);
        pw.flush();
    }

    public void printUsage() {
        printVersionInfo();
        out.println();
        out.println("usage: java -jar ncbi-taxonomy.jar <command> [options]");
        out.println();
        out.println("commands:");
        out.println("  " + CMD_TO_DB + "                     save taxonomy loaded from NCBI dump files to the database");
        out.println("  " + CMD_GET_ID + "                    find taxonomy ID for name");
        out.println("  " + CMD_GET_NAME + "                  find name for taxonomy ID");
        out.println("  " + CMD_GET_LINEAGE + "               get lineage for name");
        out.println("  " + CMD_COMMON_ANCESTOR_DISTANCE + "  find the tree distance to the common ancestor between two taxa");
        out.println("  " + CMD_FILTER_FASTA + "              filter FASTA files by taxonomic lineage");
        out.println("  " + CMD_FILTER_FASTQ + "              filter FASTQ files by read classification and lineage");
        out.println();
        out.println("Run `java -jar ncbi-taxonomy.jar <command> -h` for the options of a command.");
    }

    public void printVersionInfo() {
        out.println("NCBI-Taxonomy v" + VERSION);
    }

    private Taxonomy loadTaxonomy(CommandLine line) throws IOException, TaxonomyException {
        if (line.hasOption("taxdir")) {
            String dir = line.getOptionValue("taxdir");
            String prefix = line.getOptionValue("tax_prefix", "");
            LOG.info("Loading taxonomy from {}", dir);
            return AncestryIndexer.index(NcbiDumpReader.readDirectory(dir, prefix));
        }

        TaxonomyDatabase db = new TaxonomyDatabase(TaxonomyDatabase.resolveUrl(line.getOptionValue("db")));
        LOG.info("Loading taxonomy from {}", db.getUrl());
        return db.load();
    }

    private static String[] requireArgs(CommandLine line, int min, int max, String names) throws UsageException {
        String[] args = line.getArgs();
        if (args.length < min || (max >= 0 && args.length > max)) {
            throw new UsageException("expected " + names);
        }
        return args;
    }

    /**
     * @param args command followed by its options and arguments
     * @return process exit status
     */
    public int run(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        if (args[0].equals("-v") || args[0].equals("--version")) {
            printVersionInfo();
            return 0;
        }

        String command = args[0];
        if (!COMMANDS.contains(command)) {
            err.println("ERROR: Unknown command `" + command + "`");
            printUsage();
            return 1;
        }

        Options options = getOptions(command);

        if (Arrays.asList(args).contains("-h") || Arrays.asList(args).contains("--help")) {
            printHelp(command, options);
            return 0;
        }

        try {
            CommandLineParser parser = new DefaultParser();
            CommandLine line = parser.parse(options, Arrays.copyOfRange(args, 1, args.length));

            switch (command) {
                case CMD_TO_DB:
                    toDatabase(line);
                    break;
                case CMD_GET_ID:
                    getId(line);
                    break;
                case CMD_GET_NAME:
                    getName(line);
                    break;
                case CMD_GET_LINEAGE:
                    getLineage(line);
                    break;
                case CMD_COMMON_ANCESTOR_DISTANCE:
                    commonAncestorDistance(line);
                    break;
                case CMD_FILTER_FASTA:
                    filterFasta(line);
                    break;
                case CMD_FILTER_FASTQ:
                    filterFastq(line);
                    break;
            }
        }
        catch (ParseException | UsageException e) {
            err.println("ERROR: " + e.getMessage());
            printHelp(command, options);
            return 1;
        }
        catch (TaxonomyException e) {
            err.println("ERROR: " + e.getKind() + ": " + e.getMessage());
            return 1;
        }
        catch (IOException e) {
            LOG.debug("I/O failure", e);
            err.println("ERROR: IoError: " + e.getMessage());
            return 1;
        }

        return 0;
    }

    private void toDatabase(CommandLine line) throws IOException, TaxonomyException, UsageException {
        requireArgs(line, 0, 0, "no arguments");
        String dir = line.getOptionValue("taxdir");
        String prefix = line.getOptionValue("tax_prefix", "");

        LOG.info("Loading taxonomy from {}", dir);
        Taxonomy taxonomy = AncestryIndexer.index(NcbiDumpReader.readDirectory(dir, prefix));
        LOG.info("Taxonomy loaded");

        TaxonomyDatabase db = new TaxonomyDatabase(TaxonomyDatabase.resolveUrl(line.getOptionValue("db")));
        db.save(taxonomy);
    }

    private void getId(CommandLine line) throws IOException, TaxonomyException, UsageException {
        String name = requireArgs(line, 1, 1, "one taxon name")[0];
        out.println(loadTaxonomy(line).getId(name));
    }

    private void getName(CommandLine line) throws IOException, TaxonomyException, UsageException {
        String idStr = requireArgs(line, 1, 1, "one taxonomy ID")[0];
        out.println(loadTaxonomy(line).getName(parseTaxId(idStr)));
    }

    private void getLineage(CommandLine line) throws IOException, TaxonomyException, UsageException {
        String name = requireArgs(line, 1, 1, "one taxon name")[0];
        boolean showNames = line.hasOption("show_names");
        String delimiter = line.getOptionValue("delimiter", ";");

        Taxonomy taxonomy = loadTaxonomy(line);
        StringJoiner joiner = new StringJoiner(delimiter);
        for (TaxonNode node : taxonomy.lineageOf(name)) {
            joiner.add(showNames ? node.name + " (" + node.id + ")" : Integer.toString(node.id));
        }
        out.println(joiner.toString());
    }

    private void commonAncestorDistance(CommandLine line) throws IOException, TaxonomyException, UsageException {
        String[] names = requireArgs(line, 2, 2, "two taxon names");
        boolean onlyCanonical = line.hasOption("only_canonical");

        Taxonomy taxonomy = loadTaxonomy(line);
        TaxonNode a = taxonomy.getNode(names[0]);
        TaxonNode b = taxonomy.getNode(names[1]);
        int distance = onlyCanonical ? taxonomy.canonicalDistance(a, b) : taxonomy.distance(a, b);
        out.println(distance + "\t" + taxonomy.commonAncestor(a, b).name);
    }

    private void filterFasta(CommandLine line) throws IOException, TaxonomyException, UsageException {
        String input = requireArgs(line, 1, 1, "one input FASTA file")[0];
        FastaFilterOptions options = new FastaFilterOptions(
                line.hasOption("exclude_curated"), line.hasOption("exclude_predicted"));

        Taxonomy taxonomy = loadTaxonomy(line);
        DescendantFilter descendants = DescendantFilter.of(taxonomy, line.getOptionValue("ancestor"));
        TaxonResolver resolver = line.hasOption("accession2taxid") ?
                AccessionTaxidResolver.read(taxonomy, line.getOptionValue("accession2taxid")) :
                new DescriptionNameResolver(taxonomy);

        FastaFilter filter = new FastaFilter(descendants, resolver, options);
        filter.filter(input, line.getOptionValue("output"), out);
    }

    private void filterFastq(CommandLine line) throws IOException, TaxonomyException, UsageException {
        List<String> inputs = Arrays.asList(requireArgs(line, 1, -1, "at least one input FASTQ file"));
        int ancestorId = parseTaxId(line.getOptionValue("ancestor_taxid"));
        ReportFormat format = line.hasOption("centrifuge") ? ReportFormat.CENTRIFUGE : ReportFormat.KRAKEN2;
        UnmappedReadPolicy policy = line.hasOption("skip_unmapped") ? UnmappedReadPolicy.SKIP : UnmappedReadPolicy.FAIL;
        boolean toStdout = line.hasOption("stdout");

        if (toStdout && inputs.size() != 1) {
            throw new UsageException("--stdout can only be used with a single input file");
        }

        String outputDir = line.getOptionValue("output_dir");
        if (!toStdout) {
            try {
                FastqFilter.getOutputPaths(inputs, outputDir);
            }
            catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }

        FastqFilterOptions options = new FastqFilterOptions(format, policy, outputDir, toStdout);
        LOG.info("Filter tool {}", format);

        Taxonomy taxonomy = loadTaxonomy(line);
        FastqFilter filter = FastqFilter.create(taxonomy, ancestorId, line.getOptionValue("tax_report_filename"), options);

        long written = 0, total = 0;
        for (FilterSummary summary : filter.filter(inputs, out)) {
            written += summary.getNumWritten();
            total += summary.getNumRead();
        }
        LOG.info("{} records written out of {} total records in {} files", written, total, inputs.size());
    }

    private static int parseTaxId(String value) throws UsageException {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new UsageException("Failed to interpret (" + value + ") as a taxonomy ID");
        }
    }

    /**
     * @param args the command line arguments
     */
    public static void main(String[] args) {
        int status = new NCBITaxonomy(System.out, System.err).run(args);
        System.out.flush();
        System.exit(status);
    }
}
