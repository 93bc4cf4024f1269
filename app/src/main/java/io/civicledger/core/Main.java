package io.civicledger.core;

import io.civicledger.core.ledger.LedgerConfig;
import io.civicledger.core.ledger.ReportLedger;
import io.civicledger.core.metrics.LedgerMetrics;
import io.civicledger.core.protocol.Location;
import io.civicledger.core.protocol.ValidationResult;
import io.civicledger.core.intake.ReportSubmission;
import io.civicledger.core.service.ChainHealth;
import io.civicledger.core.service.ReportService;
import io.civicledger.core.service.SubmissionReceipt;
import io.civicledger.core.state.InMemoryReportStore;
import io.civicledger.core.storage.InMemorySnapshotStore;
import io.civicledger.core.storage.RocksDBSnapshotStore;
import io.civicledger.core.storage.SnapshotStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

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

        SnapshotStore store;
        if ("memory".equals(options.store())) {
            store = new InMemorySnapshotStore();
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            if (options.resetChain()) {
                resetChainState(dataPath);
            }
            Files.createDirectories(dataPath);
            store = RocksDBSnapshotStore.open(dataPath.toString());
        }

        try {
            ReportLedger ledger = new ReportLedger(new LedgerConfig(options.difficulty()));
            ReportService service = new ReportService(ledger, store, new InMemoryReportStore());
            ValidationResult startup = service.start();
            if (!startup.ok) {
                LOG.severe("CRITICAL: ledger integrity check failed on startup: " + startup);
            }
            LOG.info("Ledger ready: " + ledger.length() + " blocks, difficulty " + ledger.difficulty());

            if (options.demo()) {
                runDemoFlow(service);
            }

            ChainHealth health = service.health();
            LOG.info("Chain " + health.status() + ": " + health.chainLength() + " blocks, head "
                    + health.latestBlockHash().hex());
        } finally {
            if (store instanceof AutoCloseable) {
                ((AutoCloseable) store).close();
            }
        }
    }

    private static void runDemoFlow(ReportService service) {
        SubmissionReceipt receipt = service.submit(ReportSubmission.builder()
                .category("Infrastructure")
                .urgency("Medium")
                .description("Streetlight has been broken for a week near the bus stop")
                .identity("anonymous")
                .location(new Location("Ward 12", "MG Road", "Central Police Station"))
                .evidence(List.of("photo-streetlight.jpg"))
                .authorities(List.of("Municipal Corporation"))
                .build());
        LOG.info("Report " + receipt.referenceId() + " sealed in block " + receipt.blockIndex()
                + " hash=" + receipt.blockHash().hex());

        service.verify(receipt.reportId()).ifPresent(v ->
                LOG.info("Verified report " + v.reportId() + " at block " + v.blockIndex()
                        + " (chain intact: " + v.chainIntact() + ")"));
        LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.warning("Failed to load logging.properties: " + e.getMessage());
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
            throw new IllegalStateException("Failed to reset chain data in " + dataPath, e);
        }
        LOG.info("Cleared chain data under " + dataPath);
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            String store,
            int difficulty,
            boolean resetChain,
            boolean demo
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("CIVIC_LEDGER_DATA_DIR", Path.of("./data/ledger"));
            String store = envOrDefault("CIVIC_LEDGER_STORE", "rocksdb");
            int difficulty = LedgerConfig.defaultLocal().difficulty;
            boolean reset = false;
            boolean demo = true;
            boolean showHelp = false;
            String error = null;

            String difficultyEnv = System.getenv("CIVIC_LEDGER_DIFFICULTY");
            if (difficultyEnv != null && !difficultyEnv.isBlank()) {
                try {
                    difficulty = parseDifficulty(difficultyEnv, "CIVIC_LEDGER_DIFFICULTY");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--store=")) {
                        store = arg.substring("--store=".length());
                    } else if (arg.startsWith("--difficulty=")) {
                        try {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--reset-chain")) {
                        reset = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (!"rocksdb".equals(store) && !"memory".equals(store) && error == null) {
                showHelp = true;
                error = "Invalid value for --store: " + store;
            }

            return new CliOptions(showHelp, error, dataDir, store, difficulty, reset, demo);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: civic-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger snapshots (default ./data/ledger)
  --store=<rocksdb|memory>   Snapshot store (default rocksdb)
  --difficulty=<n>           Leading hex zeros required per block hash (default 2)
  --reset-chain              Delete stored snapshots before starting
  --demo / --no-demo         Enable (default) or disable the sample report submission

Environment overrides:
  CIVIC_LEDGER_DATA_DIR      Override --data-dir
  CIVIC_LEDGER_STORE         Override --store
  CIVIC_LEDGER_DIFFICULTY    Override --difficulty
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

        private static int parseDifficulty(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < 0 || parsed > 64) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
