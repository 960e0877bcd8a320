package org.netpreserve.archivescope;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.netpreserve.archivescope.config.AppConfig;
import org.netpreserve.archivescope.config.ConfigException;
import org.netpreserve.archivescope.index.MatchType;
import org.netpreserve.archivescope.store.ObjectStoreException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ArchiveScope {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ArchiveScope.class);
    private static final int DEFAULT_SAMPLE_SIZE = 100;
    private static final int DEFAULT_STATS_SAMPLE_SIZE = 1000;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path configFile = null;
        String snapshot = null;
        Integer sampleSize = null;
        int limit = 100;
        MatchType matchType = MatchType.EXACT;
        int depth = 1;
        boolean caseSensitive = false;
        boolean dumpConfig = false;
        var positional = new ArrayList<String>();

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "-s", "--snapshot" -> snapshot = args[++i];
                    case "-n", "--sample-size" -> sampleSize = Integer.parseInt(args[++i]);
                    case "--limit" -> limit = Integer.parseInt(args[++i]);
                    case "--match" -> matchType = MatchType.parse(args[++i]);
                    case "--depth" -> depth = Integer.parseInt(args[++i]);
                    case "--case-sensitive" -> caseSensitive = true;
                    case "--dump-config" -> dumpConfig = true;
                    case "-v", "--verbose" -> setRootLevel(Level.DEBUG);
                    case "--log-file" -> startLogFile(args[++i]);
                    case "-h", "--help" -> {
                        usage(out);
                        return 0;
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            err.println("Unknown option: " + args[i]);
                            return 1;
                        }
                        positional.add(args[i]);
                    }
                }
            }
        } catch (ArrayIndexOutOfBoundsException e) {
            err.println("Missing value for " + args[args.length - 1]);
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Invalid option value: " + e.getMessage());
            return 1;
        }

        AppConfig config;
        try {
            config = AppConfig.load(configFile);
        } catch (ConfigException e) {
            err.println(e.getMessage());
            return 1;
        }
        if (dumpConfig) {
            try {
                out.println(AppConfig.yamlMapper().writeValueAsString(config));
            } catch (IOException e) {
                err.println("Unable to write config: " + e.getMessage());
                return 1;
            }
            return 0;
        }
        if (positional.isEmpty()) {
            usage(err);
            return 1;
        }

        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());
        try (var context = new ArchiveContext(config)) {
            Object result = switch (command) {
                case "snapshots" -> context.discovery().listSnapshots();
                case "search" -> {
                    requireOperands(command, operands, 1);
                    yield context.discovery().search(operands.get(0), snapshot, limit, matchType);
                }
                case "fetch" -> {
                    requireOperands(command, operands, 1);
                    if (operands.size() == 1) {
                        yield orNotFound(context.fetcher().fetch(operands.get(0), snapshot), operands.get(0));
                    }
                    yield context.fetcher().batchFetch(operands, snapshot, config.rateLimit().maxConcurrent());
                }
                case "record" -> {
                    requireOperands(command, operands, 1);
                    yield orNotFound(context.fetcher().fetchRecord(operands.get(0), snapshot), operands.get(0));
                }
                case "stats" -> {
                    requireOperands(command, operands, 1);
                    yield orNotFound(context.discovery().domainStats(operands.get(0), snapshot,
                            sampleSize == null ? DEFAULT_STATS_SAMPLE_SIZE : sampleSize), operands.get(0));
                }
                case "compare" -> {
                    requireOperands(command, operands, 3);
                    yield context.discovery().compareSnapshots(operands.get(0), operands.get(1), operands.get(2),
                            sampleSize == null ? DEFAULT_STATS_SAMPLE_SIZE : sampleSize);
                }
                case "tech" -> {
                    requireOperands(command, operands, 1);
                    yield context.engine().technologyReport(operands.get(0), requireSnapshot(context, snapshot),
                            sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize);
                }
                case "links" -> {
                    requireOperands(command, operands, 1);
                    yield context.engine().linkGraph(operands.get(0), requireSnapshot(context, snapshot),
                            sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize, depth);
                }
                case "keywords" -> {
                    requireOperands(command, operands, 2);
                    yield context.engine().keywordFrequency(operands.get(0), operands.subList(1, operands.size()),
                            requireSnapshot(context, snapshot), sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize,
                            caseSensitive);
                }
                case "timeline" -> {
                    requireOperands(command, operands, 2);
                    yield context.engine().evolutionTimeline(operands.get(0), operands.subList(1, operands.size()),
                            sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize);
                }
                case "headers" -> {
                    requireOperands(command, operands, 1);
                    yield context.engine().headerAnalysis(operands.get(0), requireSnapshot(context, snapshot),
                            sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize);
                }
                case "cache-stats" -> context.cache().stats();
                case "cache-clear" -> {
                    context.cache().clear();
                    yield context.cache().stats();
                }
                default -> throw new UsageException("Unknown command: " + command);
            };
            out.println(jsonMapper().writeValueAsString(result));
            return 0;
        } catch (UsageException e) {
            err.println(e.getMessage());
            return 1;
        } catch (NotFoundException e) {
            err.println(e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException | ObjectStoreException e) {
            err.println("Error: " + e.getMessage());
            log.debug("Command failed", e);
            return 1;
        }
    }

    private static ObjectMapper jsonMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static void requireOperands(String command, List<String> operands, int count) throws UsageException {
        if (operands.size() < count) {
            throw new UsageException("Command " + command + " needs " + count + " argument(s), see --help");
        }
    }

    private static String requireSnapshot(ArchiveContext context, String snapshot) throws NotFoundException {
        return context.discovery().resolveSnapshot(snapshot)
                .orElseThrow(() -> new NotFoundException("No snapshots available"));
    }

    private static <T> T orNotFound(Optional<T> value, String what) throws NotFoundException {
        return value.orElseThrow(() -> new NotFoundException("Not found: " + what));
    }

    private static void usage(PrintStream out) {
        out.println("Usage: archivescope [options] COMMAND [ARGS...]");
        out.println("Commands:");
        out.println("  snapshots                      List available snapshots");
        out.println("  search QUERY                   Query the index (see --match, --limit)");
        out.println("  fetch URL...                   Fetch archived pages");
        out.println("  record URL                     Describe the raw archive record of a URL");
        out.println("  stats DOMAIN                   Domain statistics from the index");
        out.println("  compare DOMAIN SNAP1 SNAP2     Compare a domain's page counts in two snapshots");
        out.println("  tech DOMAIN                    Technology report");
        out.println("  links DOMAIN                   Internal link graph with PageRank");
        out.println("  keywords DOMAIN KEYWORD...     Keyword frequency and TF-IDF");
        out.println("  timeline DOMAIN SNAP...        Evolution across snapshots in the given order");
        out.println("  headers DOMAIN                 Security and caching header analysis");
        out.println("  cache-stats                    Cache statistics");
        out.println("  cache-clear                    Empty the cache");
        out.println("Options:");
        out.println("  -c, --config FILE              YAML config merged over the built-in defaults");
        out.println("  -s, --snapshot ID              Snapshot to use (default: latest)");
        out.println("  -n, --sample-size N            Pages to sample");
        out.println("      --limit N                  Maximum search results (default: 100)");
        out.println("      --match TYPE               exact, prefix, domain or range (default: exact)");
        out.println("      --depth N                  Link graph depth (default: 1)");
        out.println("      --case-sensitive           Case-sensitive keyword matching");
        out.println("      --dump-config              Print the effective configuration and exit");
        out.println("  -v, --verbose                  Debug logging");
        out.println("      --log-file FILE            Also write the log to FILE");
        out.println("  -h, --help");
    }

    private static void setRootLevel(Level level) {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{36} %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static class NotFoundException extends Exception {
        NotFoundException(String message) {
            super(message);
        }
    }
}
