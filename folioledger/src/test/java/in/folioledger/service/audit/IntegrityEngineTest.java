package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.Instrument;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.infrastructure.metrics.LedgerMetrics;
import in.folioledger.service.fx.BaseCurrencyStrategy;
import in.folioledger.service.fx.FxResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntegrityEngine")
class IntegrityEngineTest {

    private static final FxResolver FX = new FxResolver(List.of(new BaseCurrencyStrategy("EUR")));

    @Mock
    private LedgerMetrics metrics;

    private static LedgerView withUnusedInstrument() {
        Instrument unused = Instrument.create("FI0009000202", InstrumentHints.builder().name("Kesko B").currency("EUR").build());
        return new LedgerView(List.of(unused), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of());
    }

    @Test
    void run_standardChecksInOrder() {
        IntegrityEngine engine = IntegrityEngine.standard(LedgerConfig.defaults(), LedgerView::empty, FX, metrics);

        AuditReport report = engine.run();

        assertEquals(List.of("orphans", "null_fields", "foreign_keys", "duplicates", "alias_quality",
            "dividend_currency", "cross_source_duplicates", "suspicious_amounts", "inconsistent_amounts_per_stock",
            "mixed_amount_types_per_stock", "unconverted_fx", "balance"), report.checksRun());
        assertNull(report.balance());
        assertEquals(1, report.findings().size(), "Only the skipped balance note on an empty ledger");
        assertSame(report, engine.lastReport());
        verify(metrics).recordFindings("balance", "INFO", 1);
        verify(metrics).recordFindings("orphans", "WARNING", 0);
    }

    @Test
    void run_disabledChecksAreNotRun() {
        LedgerConfig config = LedgerConfig.defaults().withDisabledChecks(Set.of("balance", "orphans"));
        IntegrityEngine engine = IntegrityEngine.standard(config, IntegrityEngineTest::withUnusedInstrument, FX, metrics);

        AuditReport report = engine.run();

        assertFalse(report.checksRun().contains("balance"));
        assertFalse(report.checksRun().contains("orphans"));
        assertTrue(report.findings().isEmpty());
        verify(metrics, never()).recordFindings(eq("orphans"), anyString(), anyInt());
    }

    @Test
    @DisplayName("a throwing check becomes a check_failed warning and the others still run")
    void run_failingCheck_isReportedNotPropagated() {
        IntegrityCheck broken = new IntegrityCheck() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public List<Finding> run(LedgerView ledger) {
                throw new IllegalStateException("boom");
            }
        };
        IntegrityEngine engine = new IntegrityEngine(LedgerConfig.defaults(), IntegrityEngineTest::withUnusedInstrument,
            List.of(broken, new OrphanCheck()), null, LedgerMetrics.NOOP);

        AuditReport report = engine.run();

        assertEquals(2, report.findings().size());
        Finding failure = report.findings(IntegrityEngine.CHECK_FAILED).get(0);
        assertEquals(Severity.WARNING, failure.severity());
        assertEquals("Check broken failed: boom", failure.description());
        assertEquals(1, report.findings(OrphanCheck.ID).size());
    }

    @Test
    void run_balanceResultAttachedWhenReportedValueExists() {
        AccountValuation valuation = new AccountValuation("v1", LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31),
            new BigDecimal("1000"), new BigDecimal("1000"), "EUR", "ibkr_activity_statement", null);
        LedgerView view = new LedgerView(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(valuation));
        IntegrityEngine engine = IntegrityEngine.standard(LedgerConfig.defaults(), () -> view, FX, LedgerMetrics.NOOP);

        AuditReport report = engine.run();

        assertNotNull(report.balance());
        assertEquals(BalanceResult.Verdict.PASS, report.balance().verdict());
    }

    @Test
    @DisplayName("diff between runs tracks new, resolved and persisting findings")
    void diff_betweenRuns() {
        AtomicReference<LedgerView> current = new AtomicReference<>(withUnusedInstrument());
        IntegrityEngine engine = new IntegrityEngine(LedgerConfig.defaults(), current::get,
            List.of(new OrphanCheck(), new NullFieldCheck(LedgerConfig.defaults())), null, LedgerMetrics.NOOP);

        AuditReport first = engine.run();
        AuditReport unchanged = engine.run();
        assertTrue(unchanged.diff(first).isUnchanged());
        assertEquals(first.findings(), unchanged.diff(first).persisting());

        Instrument nameless = Instrument.create("SE0000667925", InstrumentHints.builder().currency("SEK").build());
        List<Instrument> instruments = new ArrayList<>(current.get().instruments());
        instruments.add(nameless);
        current.set(new LedgerView(instruments, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of()));

        AuditReport third = engine.run();
        AuditDiff diff = third.diff(unchanged);

        // "1 instruments with no trades" resolved into "2 instruments ...", name finding is new
        assertEquals(2, diff.newFindings().size());
        assertEquals(1, diff.resolved().size());
        assertEquals("1 instruments with no trades or dividend payments", diff.resolved().get(0).description());
    }

    @Test
    void diff_withoutPrevious_everythingIsNew() {
        AuditReport report = new AuditReport(java.time.Instant.now(), List.of("orphans"),
            List.of(Finding.info("orphans", "x", List.of())), null);

        assertEquals(1, report.diff(null).newFindings().size());
    }

    @Test
    void fingerprint_ignoresRecordOrder() {
        Finding a = Finding.warning("duplicates", "2 dup", List.of(RecordRef.of("trade", "a"), RecordRef.of("trade", "b")));
        Finding b = Finding.warning("duplicates", "2 dup", List.of(RecordRef.of("trade", "b"), RecordRef.of("trade", "a")));

        assertEquals(a.fingerprint(), b.fingerprint());
    }
}
