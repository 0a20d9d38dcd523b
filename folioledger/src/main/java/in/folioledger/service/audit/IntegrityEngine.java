package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.infrastructure.metrics.LedgerMetrics;
import in.folioledger.service.fx.FxResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the enabled integrity checks over one consistent view of the ledger.
 *
 * Read-only; safe to run while imports are in progress. A check that throws is reported as a
 * {@code check_failed} warning and does not stop the others.
 */
public final class IntegrityEngine {
    private static final Logger log = LoggerFactory.getLogger(IntegrityEngine.class);

    public static final String CHECK_FAILED = "check_failed";

    private final LedgerConfig config;
    private final Supplier<LedgerView> ledger;
    private final List<IntegrityCheck> checks;
    private final BalanceCheck balanceCheck;
    private final LedgerMetrics metrics;
    private final AtomicReference<AuditReport> lastReport = new AtomicReference<>();

    public IntegrityEngine(LedgerConfig config, Supplier<LedgerView> ledger, List<IntegrityCheck> checks,
                           BalanceCheck balanceCheck, LedgerMetrics metrics) {
        this.config = config;
        this.ledger = ledger;
        this.checks = List.copyOf(checks);
        this.balanceCheck = balanceCheck;
        this.metrics = metrics;
    }

    /**
     * All checks in their standard order: orphans, null fields, foreign keys, duplicates,
     * alias quality, the dividend checks, unconverted FX, balance.
     */
    public static IntegrityEngine standard(LedgerConfig config, Supplier<LedgerView> ledger, FxResolver fxResolver,
                                           LedgerMetrics metrics) {
        BalanceCheck balance = new BalanceCheck(config, fxResolver);
        List<IntegrityCheck> checks = List.of(
            new OrphanCheck(),
            new NullFieldCheck(config),
            new ForeignKeyCheck(),
            new DuplicateCheck(),
            new AliasQualityCheck(),
            new DividendCurrencyCheck(),
            new CrossSourceDividendCheck(),
            new SuspiciousDividendAmountCheck(),
            new InconsistentDividendAmountCheck(),
            new MixedDividendTypeCheck(),
            new UnconvertedFxCheck(config),
            balance
        );
        return new IntegrityEngine(config, ledger, checks, balance, metrics);
    }

    public AuditReport run() {
        Instant start = Instant.now();
        LedgerView view = ledger.get();

        List<String> ran = new ArrayList<>();
        List<Finding> findings = new ArrayList<>();
        for (IntegrityCheck check : checks) {
            if (!config.isCheckEnabled(check.id())) {
                log.debug("[AUDIT] Check {} disabled", check.id());
                continue;
            }
            ran.add(check.id());
            try {
                findings.addAll(check.run(view));
            } catch (RuntimeException e) {
                log.error("[AUDIT] Check {} failed: {}", check.id(), e.getMessage(), e);
                findings.add(Finding.warning(CHECK_FAILED, "Check " + check.id() + " failed: " + e.getMessage(),
                    List.of(RecordRef.of("check", check.id()))));
            }
        }

        BalanceResult balance = null;
        if (balanceCheck != null && config.isCheckEnabled(BalanceCheck.ID) && ran.contains(BalanceCheck.ID)) {
            try {
                balance = balanceCheck.evaluate(view).orElse(null);
            } catch (RuntimeException e) {
                log.error("[AUDIT] Balance evaluation failed: {}", e.getMessage(), e);
            }
        }

        AuditReport report = new AuditReport(start, ran, findings, balance);
        publish(report);
        AuditReport previous = lastReport.getAndSet(report);
        AuditDiff diff = report.diff(previous);

        log.info("[AUDIT] {} checks, {} warnings, {} info, {} new, {} resolved{}",
            ran.size(), report.count(Severity.WARNING), report.count(Severity.INFO),
            diff.newFindings().size(), diff.resolved().size(),
            balance == null ? "" : ", balance " + balance.verdict());
        return report;
    }

    /** Result of the most recent run, null before the first. */
    public AuditReport lastReport() {
        return lastReport.get();
    }

    private void publish(AuditReport report) {
        for (Map.Entry<String, Map<Severity, Long>> entry : report.countsByCheck().entrySet()) {
            for (Severity severity : Severity.values()) {
                metrics.recordFindings(entry.getKey(), severity.name(), entry.getValue().getOrDefault(severity, 0L).intValue());
            }
        }
    }
}
