package edu.stanford.futuredata.bitimport.executable;

import edu.stanford.futuredata.bitimport.client.ImportOptions;
import edu.stanford.futuredata.bitimport.client.ImportPipeline;
import edu.stanford.futuredata.bitimport.client.ImportSummary;
import edu.stanford.futuredata.bitimport.exceptions.BitImportException;
import edu.stanford.futuredata.bitimport.interfaces.TimeParser;
import edu.stanford.futuredata.bitimport.reader.TimeParsers;
import edu.stanford.futuredata.bitimport.schema.Field;
import edu.stanford.futuredata.bitimport.schema.FieldType;
import edu.stanford.futuredata.bitimport.schema.TimeQuantum;
import edu.stanford.futuredata.bitimport.topology.NodeResolver;
import edu.stanford.futuredata.bitimport.transport.ClientOptions;
import edu.stanford.futuredata.bitimport.transport.Cluster;
import edu.stanford.futuredata.bitimport.transport.HttpTransportClient;
import edu.stanford.futuredata.bitimport.transport.Node;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Imports a CSV file into one field:
// ImportExecutable -i index -f field [-t set] [-s host:port,...] data.csv
public class ImportExecutable {

    private static final Logger logger = LoggerFactory.getLogger(ImportExecutable.class);

    public static void main(String[] args) {
        Options options = buildOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp("ImportExecutable [options] <csv file>", options);
            System.exit(2);
            return;
        }
        if (cmd.getArgList().size() != 1) {
            new HelpFormatter().printHelp("ImportExecutable [options] <csv file>", options);
            System.exit(2);
            return;
        }
        try {
            ImportSummary summary = runImport(cmd, Path.of(cmd.getArgList().get(0)));
            logger.info("Import finished: {}", summary);
        } catch (IOException | BitImportException | IllegalArgumentException e) {
            logger.error("Import failed: {}", e.getMessage());
            System.exit(1);
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i").longOpt("index").hasArg().required().desc("Index name").build());
        options.addOption(Option.builder("f").longOpt("field").hasArg().required().desc("Field name").build());
        options.addOption("s", "servers", true, "Comma separated server addresses (default localhost:10101)");
        options.addOption("t", "type", true, "Field type: set, int, time, mutex or bool (default set)");
        options.addOption("q", "quantum", true, "Time quantum of the field, e.g. YMD");
        options.addOption("w", "shard-width", true, "Shard width of the index");
        options.addOption(null, "index-keys", false, "Columns are addressed by key");
        options.addOption(null, "field-keys", false, "Rows are addressed by key");
        options.addOption("b", "batch-size", true, "Records read per batch");
        options.addOption("n", "threads", true, "Number of import workers");
        options.addOption(null, "fast", false, "Use the roaring import format where possible");
        options.addOption(null, "clear", false, "Clear the imported bits instead of setting them");
        options.addOption(null, "header", false, "Skip the first line of the file");
        options.addOption(null, "time-format", true, "Timestamp pattern, e.g. yyyy-MM-dd'T'HH:mm:ss (default epoch seconds)");
        options.addOption(null, "manual-address", false, "Send everything to the first server only");
        options.addOption(null, "request-timeout", true, "Per-request timeout in milliseconds");
        return options;
    }

    static Field buildField(CommandLine cmd) {
        Field.Builder builder = Field.builder(cmd.getOptionValue("i"), cmd.getOptionValue("f"))
                .fieldType(FieldType.fromName(cmd.getOptionValue("t", "set")))
                .indexKeys(cmd.hasOption("index-keys"))
                .fieldKeys(cmd.hasOption("field-keys"))
                .timeQuantum(TimeQuantum.fromString(cmd.getOptionValue("q", "")));
        if (cmd.hasOption("w")) {
            builder.shardWidth(Long.parseLong(cmd.getOptionValue("w")));
        }
        return builder.build();
    }

    static ImportOptions buildImportOptions(CommandLine cmd) {
        ImportOptions.Builder builder = ImportOptions.builder()
                .fastImport(cmd.hasOption("fast"))
                .clear(cmd.hasOption("clear"));
        if (cmd.hasOption("b")) {
            builder.batchSize(Integer.parseInt(cmd.getOptionValue("b")));
        }
        if (cmd.hasOption("n")) {
            builder.threadCount(Integer.parseInt(cmd.getOptionValue("n")));
        }
        return builder.build();
    }

    private static ImportSummary runImport(CommandLine cmd, Path csvFile) throws IOException {
        List<Node> servers = new ArrayList<>();
        for (String address : cmd.getOptionValue("s", Node.defaultNode().toString()).split(",")) {
            servers.add(Node.parse(address.trim()));
        }
        ClientOptions.Builder clientOptions = ClientOptions.builder()
                .useManualAddress(cmd.hasOption("manual-address"));
        if (cmd.hasOption("request-timeout")) {
            clientOptions.requestTimeoutMillis(Integer.parseInt(cmd.getOptionValue("request-timeout")));
        }
        ClientOptions co = clientOptions.build();
        TimeParser timeParser = cmd.hasOption("time-format")
                ? TimeParsers.pattern(cmd.getOptionValue("time-format"))
                : TimeParsers.EPOCH_SECONDS;
        Field field = buildField(cmd);
        try (HttpTransportClient transport = new HttpTransportClient(new Cluster(servers), co);
             Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            NodeResolver resolver = co.useManualAddress
                    ? new NodeResolver(transport, servers.get(0))
                    : new NodeResolver(transport);
            ImportPipeline pipeline = new ImportPipeline(transport, resolver);
            Runtime.getRuntime().addShutdownHook(new Thread(pipeline::cancel));
            logger.info("Importing {} into {}", csvFile, field);
            return pipeline.importCsv(field, reader, timeParser, cmd.hasOption("header"), buildImportOptions(cmd));
        }
    }
}
