package io.auditchain.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.auditchain.core.api.AdminServer;
import io.auditchain.core.ledger.AuditLedger;
import io.auditchain.core.ledger.LedgerConfig;
import io.auditchain.core.ledger.MiningResult;
import io.auditchain.core.metrics.LedgerMetrics;
import io.auditchain.core.query.ExportFormat;
import io.auditchain.core.verify.VerificationResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        if (options.resetChain()) {
            resetChainState(dataPath);
        }
        Files.createDirectories(dataPath);

        LedgerConfig config = buildConfig(options);
        AuditLedger ledger = AuditLedger.rocks(config, dataPath.toString());
        AdminServer adminServer = null;
        int exitCode = 0;
        try {
            ledger.start();
            if (options.command() != Command.RUN) {
                exitCode = runCommand(ledger, options);
                return;
            }

            if (options.enableApi()) {
                adminServer = new AdminServer(ledger, options.apiBind(), options.apiPort(), options.apiToken());
                adminServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "audit-ledger-shutdown"));
                LOG.info("Ledger running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else {
                MiningResult result = ledger.forceMine();
                LOG.info("Single pass: " + result.message());
                LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
            }
        } finally {
            if (adminServer != null) {
                adminServer.stop();
            }
            ledger.close();
            if (exitCode != 0) {
                System.exit(exitCode);
            }
        }
    }

    static LedgerConfig buildConfig(CliOptions options) {
        LedgerConfig config = options.configFile() != null
                ? LedgerConfig.load(options.configFile())
                : LedgerConfig.defaultLocal();
        if (options.autoMine() != null) {
            config = config.withAutoMine(options.autoMine());
        }
        if (options.difficulty() != null) {
            config = config.withDifficulty(options.difficulty());
        }
        if (options.command() != Command.RUN) {
            // one-shot commands never start the schedule
            config = config.withAutoMine(false);
        }
        return config;
    }

    private static int runCommand(AuditLedger ledger, CliOptions options) throws IOException {
        switch (options.command()) {
            case VERIFY -> {
                VerificationResult result = ledger.verifyChain();
                System.out.println(JSON.writeValueAsString(result));
                return result.valid() ? 0 : 2;
            }
            case STATS -> System.out.println(JSON.writeValueAsString(ledger.getStats()));
            case MINE -> {
                MiningResult result = ledger.forceMine();
                System.out.println(result.status() + ": " + result.message());
                return result.status() == MiningResult.Status.MINED
                        || result.status() == MiningResult.Status.NOTHING_PENDING ? 0 : 3;
            }
            case EXPORT -> {
                if (options.outputFile() == null) {
                    ledger.export(options.exportFormat(), System.out);
                    System.out.flush();
                } else {
                    try (OutputStream out = Files.newOutputStream(options.outputFile())) {
                        ledger.export(options.exportFormat(), out);
                    }
                    LOG.info("Exported chain to " + options.outputFile());
                }
            }
            default -> throw new IllegalStateException("Unhandled command " + options.command());
        }
        return 0;
    }

    /** Use the bundled logging.properties unless the JVM was given its own. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.warning("Could not load bundled logging.properties: " + e.getMessage());
        }
    }

    private static void resetChainState(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + dataPath, e);
        }
        LOG.info("Cleared ledger data under " + dataPath);
    }

    enum Command { RUN, VERIFY, STATS, MINE, EXPORT }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configFile,
            boolean resetChain,
            boolean keepAlive,
            Boolean autoMine,
            Integer difficulty,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            Command command,
            ExportFormat exportFormat,
            Path outputFile
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("AUDIT_LEDGER_DATA_DIR", Path.of("./data/ledger"));
            Path configFile = envPath("AUDIT_LEDGER_CONFIG", null);
            boolean reset = false;
            boolean keepAlive = false;
            Boolean autoMine = null;
            Integer difficulty = null;
            boolean enableApi = "true".equalsIgnoreCase(System.getenv("AUDIT_LEDGER_ENABLE_API"));
            String apiBind = envOrDefault("AUDIT_LEDGER_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = null;
            Command command = Command.RUN;
            ExportFormat exportFormat = ExportFormat.JSON;
            Path outputFile = null;
            boolean showHelp = false;
            String error = null;

            try {
                apiPort = envPort("AUDIT_LEDGER_API_PORT", 8080);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.startsWith("--config=")) {
                            configFile = Path.of(arg.substring("--config=".length()));
                        } else if (arg.equals("--reset-chain")) {
                            reset = true;
                        } else if (arg.equals("--keep-alive")) {
                            keepAlive = true;
                        } else if (arg.equals("--no-auto-mine")) {
                            autoMine = false;
                        } else if (arg.equals("--auto-mine")) {
                            autoMine = true;
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()));
                        } else if (arg.equals("--enable-api")) {
                            enableApi = true;
                        } else if (arg.startsWith("--api-bind=")) {
                            apiBind = arg.substring("--api-bind=".length());
                        } else if (arg.startsWith("--api-port=")) {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } else if (arg.startsWith("--api-token=")) {
                            apiToken = arg.substring("--api-token=".length());
                        } else if (arg.equals("--verify")) {
                            command = Command.VERIFY;
                        } else if (arg.equals("--stats")) {
                            command = Command.STATS;
                        } else if (arg.equals("--force-mine")) {
                            command = Command.MINE;
                        } else if (arg.equals("--export")) {
                            command = Command.EXPORT;
                        } else if (arg.startsWith("--export=")) {
                            command = Command.EXPORT;
                            exportFormat = ExportFormat.parse(arg.substring("--export=".length()));
                        } else if (arg.startsWith("--output=")) {
                            outputFile = Path.of(arg.substring("--output=".length()));
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        error = ex.getMessage();
                    }
                }
            }

            if (apiToken == null || apiToken.isBlank()) {
                apiToken = System.getenv("AUDIT_LEDGER_API_TOKEN");
            }

            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("AUDIT_LEDGER_KEEP_ALIVE"));
            if (command != Command.RUN) {
                keepAlive = false;
                enableApi = false;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    configFile,
                    reset,
                    keepAlive,
                    autoMine,
                    difficulty,
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    command,
                    exportFormat,
                    outputFile
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: audit-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/ledger)
  --config=<file>            JSON config file (mining_interval, difficulty, max_block_size, ...)
  --reset-chain              Delete all ledger data, pending events included
  --keep-alive               Keep the ledger running until interrupted
  --auto-mine / --no-auto-mine  Override auto_mine from the config
  --difficulty=<0..64>       Override difficulty (leading zero hex digits)
  --enable-api               Start the admin API (default bind 127.0.0.1:8080)
  --api-bind=<host>          Bind address for the admin API
  --api-port=<port>          Port for the admin API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the admin API

One-shot commands (run, print, exit):
  --verify                   Verify the chain; exit code 2 on integrity failure
  --stats                    Print ledger statistics as JSON
  --force-mine               Mine pending events now
  --export[=json|csv]        Export the chain (to stdout unless --output is given)
  --output=<file>            Target file for --export

Environment overrides:
  AUDIT_LEDGER_DATA_DIR      Override --data-dir
  AUDIT_LEDGER_CONFIG        Override --config
  AUDIT_LEDGER_API_TOKEN     Token for admin API auth (if --api-token not supplied)
  AUDIT_LEDGER_ENABLE_API    Set to "true" to enable the admin API without CLI flag
  AUDIT_LEDGER_API_BIND      Bind address for the admin API
  AUDIT_LEDGER_API_PORT      Port for the admin API
  AUDIT_LEDGER_KEEP_ALIVE    Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parseDifficulty(String value) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0 || parsed > LedgerConfig.MAX_DIFFICULTY) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for --difficulty: " + value);
            }
        }
    }
}
