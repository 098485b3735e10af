package org.carball.tuner.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.alert.MailAlertDispatcher;
import org.carball.tuner.audit.JsonFileAuditStore;
import org.carball.tuner.config.ConfigurationLoader;
import org.carball.tuner.config.TunerConfig;
import org.carball.tuner.model.query.StoreKind;
import org.carball.tuner.model.recommendation.Recommendation;
import org.carball.tuner.model.run.OptimizationRun;
import org.carball.tuner.orchestrator.OptimizationOrchestrator;
import org.carball.tuner.orchestrator.OptimizationScheduler;
import org.carball.tuner.output.OptimizationReport;
import org.carball.tuner.store.DocumentStore;
import org.carball.tuner.store.MongoDocumentStore;
import org.carball.tuner.store.PostgresRelationalStore;
import org.carball.tuner.store.RelationalStore;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

@Slf4j
public class DatabaseTunerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Database Performance Analyzer & Index Tuner v%s       ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            System.exit(0);
        }

        if (hasFlag(args, "--verbose", "-v")) {
            ((Logger) LoggerFactory.getLogger("org.carball.tuner")).setLevel(Level.DEBUG);
        }

        RelationalStore relationalStore = null;
        DocumentStore documentStore = null;
        try {
            TunerConfig config = new ConfigurationLoader().loadConfiguration(args);
            LocalTime runAt = OptimizationScheduler.parseDailyTime(config.getSchedule());
            String outputFile = findArgument(args, "--output", "-o");

            if (!config.isRelationalEnabled() && !config.isDocumentEnabled()) {
                throw new IllegalArgumentException(
                        "No data store configured. Provide --postgres-url and/or --mongo-uri with --mongo-database");
            }

            System.out.println("\n🔍 Starting database analysis...");
            if (config.isRelationalEnabled()) {
                relationalStore = new PostgresRelationalStore(config.getPostgresUrl(), config.getQueryTimeoutSeconds());
                System.out.println("   Relational store: PostgreSQL");
            }
            if (config.isDocumentEnabled()) {
                documentStore = new MongoDocumentStore(config.getMongoUri(), config.getMongoDatabase(),
                        config.getQueryTimeoutSeconds());
                System.out.println("   Document store: MongoDB (" + config.getMongoDatabase() + ")");
            }
            System.out.println("   Audit directory: " + config.getAuditDirectory());
            System.out.println("   Execute recommendations: " + (config.isExecuteRecommendations() ? "yes" : "no"));
            System.out.println();

            OptimizationOrchestrator orchestrator = new OptimizationOrchestrator(
                    relationalStore,
                    documentStore,
                    new JsonFileAuditStore(Paths.get(config.getAuditDirectory()),
                            config.getThresholds().getAuditRetention()),
                    new MailAlertDispatcher(config.getMail()),
                    config);

            if (hasFlag(args, "--once")) {
                System.out.print("📊 Running optimization cycle... ");
                Optional<OptimizationRun> run = orchestrator.runOnce();
                System.out.println("✓");

                if (run.isPresent()) {
                    writeReport(run.get(), outputFile);
                    printSummary(run.get());
                }
                System.out.println("\n✅ Analysis complete!");
            } else {
                runScheduled(orchestrator, runAt, outputFile, relationalStore, documentStore);
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        } finally {
            closeQuietly(relationalStore, documentStore);
        }
    }

    private static void runScheduled(OptimizationOrchestrator orchestrator, LocalTime runAt, String outputFile,
                                     RelationalStore relationalStore, DocumentStore documentStore)
            throws InterruptedException {
        OptimizationScheduler scheduler = new OptimizationScheduler(orchestrator, runAt, Clock.systemDefaultZone());
        scheduler.onRunCompleted(run -> {
            try {
                writeReport(run, outputFile);
            } catch (IOException e) {
                log.error("Failed to write report to {}: {}", outputFile, e.getMessage());
            }
            printSummary(run);
        });

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\n🛑 Shutting down...");
            scheduler.stop();
            closeQuietly(relationalStore, documentStore);
            stopped.countDown();
        }, "db-tuner-shutdown"));

        System.out.println("⏰ Running now, then daily at " + runAt + ". Press Ctrl+C to stop.");
        scheduler.start();
        stopped.await();
    }

    private static void writeReport(OptimizationRun run, String outputFile) throws IOException {
        if (outputFile == null) {
            return;
        }
        new OptimizationReport(run).writeTo(Paths.get(outputFile));
        System.out.println("   Report file: " + outputFile);
    }

    private static void printSummary(OptimizationRun run) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 OPTIMIZATION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nSlow queries (PostgreSQL): " + run.getRelationalSlowQueries().size());
        System.out.println("Slow operations (MongoDB): " + run.getDocumentSlowQueries().size());
        System.out.println("Plans analyzed: " + run.getQueryAnalyses().stream()
                .filter(analysis -> analysis.getStoreKind() == StoreKind.RELATIONAL)
                .count());
        System.out.println("Regressions: " + run.getRegressions().size());
        System.out.println("Index suggestions: " + run.getRecommendations().size());

        List<Recommendation> recommendations = run.getRecommendations();
        if (!recommendations.isEmpty()) {
            System.out.println("\n🎯 Index Suggestions:");
            System.out.println("-".repeat(60));
            recommendations.stream()
                    .limit(5)
                    .forEach(rec -> System.out.println("  " + rec.command()));
            if (recommendations.size() > 5) {
                System.out.println("  ... and " + (recommendations.size() - 5) + " more");
            }
        }

        if (!run.getErrors().isEmpty()) {
            System.out.println("\n⚠️  " + run.getErrors().size() + " step(s) failed, see log for details");
        }
    }

    private static void closeQuietly(RelationalStore relationalStore, DocumentStore documentStore) {
        try {
            if (relationalStore != null) {
                relationalStore.close();
            }
            if (documentStore != null) {
                documentStore.close();
            }
        } catch (RuntimeException e) {
            log.warn("Error closing store connections: {}", e.getMessage());
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return hasFlag(args, "--help", "-h", "help");
    }

    private static boolean hasFlag(String[] args, String... names) {
        List<String> arguments = Arrays.asList(args);
        return Arrays.stream(names).anyMatch(arguments::contains);
    }

    private static String findArgument(String[] args, String... names) {
        List<String> candidates = Arrays.asList(names);
        for (int i = 0; i < args.length - 1; i++) {
            if (candidates.contains(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar db-tuner.jar [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --once              Run a single optimization cycle and exit");
        System.out.println("  --output, -o        Write the JSON report of each run to this file");
        System.out.println("  --verbose, -v       Enable debug logging");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  # Analyze PostgreSQL once and write a report");
        System.out.println("  java -jar db-tuner.jar --postgres-url jdbc:postgresql://localhost/app --once -o report.json");
        System.out.println();
        System.out.println("  # Monitor both stores daily at 03:30 and create suggested indexes");
        System.out.println("  java -jar db-tuner.jar --config tuner.yml --schedule 03:30 --execute");
    }
}
