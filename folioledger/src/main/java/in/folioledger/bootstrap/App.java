package in.folioledger.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.folioledger.config.LedgerConfig;
import in.folioledger.infrastructure.metrics.PrometheusLedgerMetrics;
import in.folioledger.migration.LedgerSchemaMigration;
import in.folioledger.service.audit.AuditReport;
import in.folioledger.service.audit.BalanceResult;
import in.folioledger.service.audit.Finding;
import in.folioledger.service.audit.IntegrityEngine;
import in.folioledger.service.fx.FxResolver;
import in.folioledger.service.ingest.FileImportResult;
import in.folioledger.service.ingest.ImportException;
import in.folioledger.service.ingest.ImportService;
import in.folioledger.service.ingest.ImportSummary;
import in.folioledger.service.instrument.InstrumentResolver;
import in.folioledger.service.ledger.LedgerWriter;
import in.folioledger.transport.http.LedgerApiHandlers;
import in.folioledger.transport.http.PrometheusMetricsHandler;
import in.folioledger.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 *   import &lt;paths...&gt;   import files or directories, then audit
 *   audit                run the integrity checks once
 *   serve [paths...]     optionally import, then serve /health, /metrics and /api/audit
 * </pre>
 *
 * {@code LEDGER_STORE=memory} keeps everything in process; the default is PostgreSQL.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            usage();
            System.exit(2);
            return;
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== folioledger {} ===", args[0]);
        log.info("═══════════════════════════════════════════════════════════════");

        LedgerConfig config = LedgerConfig.fromEnv();
        log.info("Base currency {}, FX window {}d, position window {}d, external FX {}",
            config.baseCurrency(), config.fxRateWindowDays(), config.fxPositionWindowDays(),
            config.fxHttpUrl() == null ? "disabled" : config.fxHttpUrl());

        // ═══════════════════════════════════════════════════════════════
        // Store
        // ═══════════════════════════════════════════════════════════════
        LedgerStore store = createStore();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusLedgerMetrics metrics = new PrometheusLedgerMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        FxResolver fxResolver = FxResolver.standard(config, store.snapshots(), store.fxRates());
        InstrumentResolver resolver = new InstrumentResolver(store.instruments(), store.aliases());
        LedgerWriter writer = new LedgerWriter(store.ledger(), store.snapshots(), store.accounts(),
            store.fxRates(), fxResolver);
        ImportService importService = new ImportService(config, resolver, writer, metrics);
        IntegrityEngine engine = IntegrityEngine.standard(config, store::view, fxResolver, metrics);

        List<Path> paths = Arrays.stream(args).skip(1).map(Path::of).toList();
        int exitCode = 0;
        try {
            switch (args[0]) {
                case "import" -> {
                    if (paths.isEmpty()) {
                        usage();
                        exitCode = 2;
                    } else {
                        exitCode = runImport(importService, paths);
                        printAudit(engine.run());
                    }
                }
                case "audit" -> printAudit(engine.run());
                case "serve" -> {
                    if (!paths.isEmpty()) {
                        runImport(importService, paths);
                    }
                    engine.run();
                    startServer(engine, metrics, store.kind());
                    return;
                }
                default -> {
                    usage();
                    exitCode = 2;
                }
            }
        } catch (ImportException e) {
            log.error("Import of {} failed: {}", e.getSourceName(), e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    private static int runImport(ImportService importService, List<Path> paths) {
        ImportSummary summary = importService.importFiles(paths);
        for (FileImportResult file : summary.files()) {
            System.out.printf("%-40s %-24s %-12s created=%d skipped=%d failed=%d%n",
                file.sourceName(), file.format(), file.status(), file.created(), file.skipped(), file.failed());
            file.errors().forEach(err -> System.out.println("    " + err));
        }
        System.out.println(summary);
        return summary.failed() > 0 ? 1 : 0;
    }

    private static void printAudit(AuditReport report) {
        System.out.printf("Audit: %d checks, %d findings%n", report.checksRun().size(), report.findings().size());
        for (Finding finding : report.findings()) {
            System.out.printf("  [%s] %-18s %s%n", finding.severity(), finding.checkId(), finding.description());
        }
        BalanceResult balance = report.balance();
        if (balance != null) {
            System.out.printf("Balance: %s derived=%s reported=%s diff=%s%%%n",
                balance.verdict(), balance.derivedValue(), balance.reportedValue(), balance.differencePercent());
        }
    }

    private static void startServer(IntegrityEngine engine, PrometheusLedgerMetrics metrics, String storeKind) {
        int port = Env.getInt("HTTP_PORT", 9090);
        LedgerApiHandlers api = new LedgerApiHandlers(engine, storeKind);

        RoutingHandler routes = Handlers.routing()
            .get("/health", api::health)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/audit", api::audit)
            .get("/api/audit/last", api::lastAudit);

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();

        server.start();
        log.info("✓ HTTP server started on port {}", port);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "http-shutdown"));
    }

    private static LedgerStore createStore() {
        String kind = Env.get("LEDGER_STORE", "postgres");
        if ("memory".equalsIgnoreCase(kind)) {
            log.info("Store: in-memory");
            return LedgerStore.memory();
        }
        DataSource dataSource = createDataSource();
        new LedgerSchemaMigration(dataSource).migrate();
        return LedgerStore.postgres(dataSource);
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/folioledger");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("folioledger-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private static void usage() {
        System.err.println("usage: folioledger import <paths...> | audit | serve [paths...]");
    }

    private App() {}
}
