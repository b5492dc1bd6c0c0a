package com.wikisqldump;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

import lombok.extern.java.Log;
import me.tongfei.progressbar.ProgressBar;

/**
 * Command line entry point: converts one Wikipedia SQL table dump to CSV.
 */
@Log
public class WikiSqlDump2Csv {

    private static final String LOG_FILE_PREFIX = "wikisqldump";

    static {
        // Load logging configuration from classpath but don't log yet
        try (InputStream loggingConfig = WikiSqlDump2Csv.class.getResourceAsStream("/logging.properties")) {
            if (loggingConfig != null) {
                LogManager.getLogManager().readConfiguration(loggingConfig);
            } else {
                System.err.println("Warning: logging.properties not found, using default configuration");
            }
        } catch (IOException e) {
            System.err.println("Warning: Failed to load logging.properties: " + e.getMessage());
        }
    }

    private static void configureLogging(boolean debug) {
        Logger rootLogger = Logger.getLogger("");

        if (!debug) {
            // logs only go to the file, the console shows the progress bar
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    rootLogger.removeHandler(handler);
                }
            }
        } else {
            Logger.getLogger("com.wikisqldump").setLevel(Level.FINE);
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }

        log.info("Logging configuration loaded - debug mode: " + debug);
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        boolean debug = false;
        String filterFile = null;
        String summaryJson = null;
        int maxStatements = 0;
        List<String> keep = new ArrayList<>();
        List<String> drop = new ArrayList<>();
        Map<String, Set<String>> allow = new LinkedHashMap<>();
        Map<String, Set<String>> block = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--debug".equals(arg)) {
                    debug = true;
                    continue;
                }
                if (!arg.startsWith("--")) {
                    positional.add(arg);
                    continue;
                }
                String name = arg.contains("=") ? arg.substring(0, arg.indexOf('=')) : arg;
                String value;
                if (arg.contains("=")) {
                    value = arg.substring(arg.indexOf('=') + 1);
                } else if (i + 1 < args.length) {
                    value = args[++i];
                } else {
                    System.err.println("Missing value for " + name);
                    return usage();
                }
                switch (name) {
                    case "--keep" -> keep.addAll(splitList(value));
                    case "--drop" -> drop.addAll(splitList(value));
                    case "--allow" -> addValueList(allow, value);
                    case "--block" -> addValueList(block, value);
                    case "--filter" -> filterFile = value;
                    case "--summary-json" -> summaryJson = value;
                    case "--max-statements" -> maxStatements = Integer.parseInt(value);
                    default -> {
                        System.err.println("Unknown option " + name);
                        return usage();
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid argument: " + e.getMessage());
            return usage();
        }

        configureLogging(debug);

        if (positional.isEmpty() || positional.size() > 2) {
            return usage();
        }

        Instant start = Instant.now();
        try {
            WikipediaDumpFile dump = WikipediaDumpFile.of(Path.of(positional.get(0)));
            Path output = positional.size() > 1 ? Path.of(positional.get(1)) : dump.defaultOutput();
            log.info(dump.toString());
            log.log(Level.INFO, "Output file: {0}", output);

            TableSchema schema = TableSchemaRegistry.loadDefault().lookup(dump.tableName());
            FilterSpec spec = filterFile != null ? FilterSpecLoader.load(Path.of(filterFile)) : FilterSpec.none();
            spec = spec.merge(new FilterSpec(keep, drop, allow, block));

            ConversionResult result = convert(dump, schema, spec, output, maxStatements, debug);

            if (summaryJson != null) {
                Files.writeString(Path.of(summaryJson), result.toJson(), StandardCharsets.UTF_8);
            }

            Duration duration = Duration.between(start, Instant.now());
            System.err.printf("%nWrote %,d of %,d rows to %s in %d.%03ds%n", result.rowsWritten(),
                    result.rowsParsed(), output, duration.toSeconds(), duration.toMillisPart());
        } catch (DumpConversionException | IOException e) {
            log.log(Level.SEVERE, "Conversion failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            flushLogs();
            if (!debug) {
                printLogFile();
            }
        }
        return 0;
    }

    private static ConversionResult convert(WikipediaDumpFile dump, TableSchema schema, FilterSpec spec,
            Path output, int maxStatements, boolean debug) throws IOException {
        long max = dump.compressed() ? -1 : Files.size(dump.path());
        try (ProgressBar pb = new ProgressBarFactory(debug).create("Converting " + dump.basename(), max)) {
            // the filter is validated here, before the output file is created
            DumpConverter converter = new DumpConverter(schema, spec, ConverterOptions.defaults()
                    .withMaxStatements(maxStatements)
                    .withProgressListener(chars -> pb.stepTo(max > 0 ? Math.min(chars, max) : chars)));
            log.log(Level.FINE, "Output columns: {0}", converter.outputColumns());
            try (Reader in = dump.openReader()) {
                try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                    return converter.convert(in, out);
                } catch (DumpConversionException | IOException e) {
                    removeIncompleteOutput(output, e);
                    throw e;
                }
            }
        }
    }

    private static void removeIncompleteOutput(Path output, Exception cause) {
        try {
            if (Files.deleteIfExists(output)) {
                log.log(Level.INFO, "Removed incomplete output file {0}", output);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static void addValueList(Map<String, Set<String>> lists, String value) {
        int eq = value.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("expected COLUMN=VALUE[,VALUE...] but got " + value);
        }
        String column = value.substring(0, eq).trim();
        lists.computeIfAbsent(column, k -> new LinkedHashSet<>())
                .addAll(Arrays.asList(value.substring(eq + 1).split(",", -1)));
    }

    private static int usage() {
        System.err.println("Usage: wikisqldump [options] <WIKI-YYYYMMDD-TABLE.sql[.gz]> [output.csv]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --keep a,b             Only write these columns");
        System.err.println("  --drop a,b             Leave these columns out");
        System.err.println("  --allow col=v1,v2      Keep rows whose column holds one of the values (repeatable)");
        System.err.println("  --block col=v1,v2      Drop rows whose column holds one of the values (repeatable)");
        System.err.println("  --filter <file.yml>    Read keep/drop/allow/block lists from YAML");
        System.err.println("  --max-statements <n>   Stop after n INSERT statements");
        System.err.println("  --summary-json <file>  Write run counters as JSON");
        System.err.println("  --debug                Enable detailed console logging and disable the progress bar");
        System.err.println();
        System.err.println("Notes:");
        System.err.println("  If output.csv is not provided, WIKI-YYYYMMDD-TABLE.csv is written to the working directory");
        return 1;
    }

    private static void flushLogs() {
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.flush();
        }
    }

    private static void printLogFile() {
        try (Stream<Path> paths = Files.list(Paths.get(System.getProperty("java.io.tmpdir")))) {
            paths.filter(p -> p.getFileName().toString().startsWith(LOG_FILE_PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .max((a, b) -> Long.compare(a.toFile().lastModified(), b.toFile().lastModified()))
                    .ifPresent(logFile -> System.err.println("Log file: " + logFile));
        } catch (IOException e) {
            log.log(Level.FINE, "Could not list log directory", e);
        }
    }
}
