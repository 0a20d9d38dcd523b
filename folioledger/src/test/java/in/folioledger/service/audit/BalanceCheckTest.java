package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.config.ToleranceBand;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.fx.BaseCurrencyStrategy;
import in.folioledger.service.fx.ExplicitRateStrategy;
import in.folioledger.service.fx.FxResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BalanceCheck")
class BalanceCheckTest {

    private static final LocalDate START = LocalDate.of(2026, 1, 1);
    private static final LocalDate END = LocalDate.of(2026, 1, 31);

    private final BalanceCheck check = new BalanceCheck(LedgerConfig.defaults(),
        new FxResolver(List.of(new ExplicitRateStrategy(), new BaseCurrencyStrategy("EUR"))));

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    private static AccountValuation valuation(String ending) {
        return new AccountValuation("v1", START, END, d("10000"), d(ending), "EUR", "ibkr_activity_statement", null);
    }

    private static LedgerView ledger(List<AccountValuation> valuations, List<CashFlow> flows, List<CashBalance> cash,
                                     List<PortfolioSnapshot> snapshots) {
        Trade buy = new Trade("t1", "i1", LocalDate.of(2026, 1, 10), null, null, d("100"), d("20"), d("-2000"),
            d("-9"), "EUR", null, "STK", null, null, null, null);
        DividendPayment dividend = new DividendPayment("d1", "i1", null, LocalDate.of(2026, 1, 28), d("220"), d("-77"),
            d("143"), "EUR", null, null, null, d("0.22"), DividendAmountType.PER_SHARE, "div", null);
        return new LedgerView(List.of(), List.of(), List.of(buy), List.of(dividend), flows, List.of(), List.of(),
            snapshots, cash, valuations);
    }

    private static List<CashFlow> deposit() {
        return List.of(new CashFlow("c1", CashFlowType.DEPOSIT, LocalDate.of(2026, 1, 5), d("500"), "EUR",
            null, null, "deposit", "ibkr_activity_statement", null));
    }

    private static List<PortfolioSnapshot> closingSnapshot(String total, String unrealized) {
        return List.of(new PortfolioSnapshot("s1", END, "ibkr_flex", d(total), unrealized == null ? null : d(unrealized),
            List.of(), null));
    }

    @Test
    @DisplayName("derived value matches reported value: every component is summed")
    void evaluate_matchingLedger_passes() {
        BalanceResult result = check.evaluate(ledger(List.of(valuation("10650")), deposit(), List.of(),
            closingSnapshot("10000", "16"))).orElseThrow();

        // 10000 opening + 500 deposit + 220 dividend - 77 withholding - 9 commission + 16 unrealized
        assertEquals(0, d("10650").compareTo(result.derivedValue()));
        assertEquals(BalanceResult.Verdict.PASS, result.verdict());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.differencePercent()));
        assertEquals(END, result.reportedDate());
        assertEquals(0, d("-77").compareTo(result.components().get("withholding")));
        assertTrue(result.callouts().stream().anyMatch(c -> c.startsWith("Opening unrealized P&L unknown")));
    }

    @Test
    void evaluate_deviationBetweenBands_warnsAndMarginBandPasses() {
        LedgerView view = ledger(List.of(valuation("10800")), deposit(), List.of(), closingSnapshot("10000", "16"));

        BalanceResult standard = check.evaluate(view).orElseThrow();
        BalanceResult margin = check.evaluate(view, ToleranceBand.margin()).orElseThrow();

        assertEquals(d("1.3889"), standard.differencePercent());
        assertEquals(BalanceResult.Verdict.WARNING, standard.verdict());
        assertEquals(BalanceResult.Verdict.PASS, margin.verdict());
    }

    @Test
    void evaluate_withoutValuation_usesSnapshotPlusBaseCash() {
        CashBalance baseCash = new CashBalance("b1", END, "EUR", d("0"), d("650"), true, "ibkr_flex", null);

        BalanceResult result = check.evaluate(ledger(List.of(), deposit(), List.of(baseCash),
            closingSnapshot("20000", null))).orElseThrow();

        assertEquals(0, d("20650").compareTo(result.reportedValue()));
        assertTrue(result.callouts().contains("No reported opening value: the ledger is reconciled from zero"));
        assertEquals(BalanceResult.Verdict.FAIL, result.verdict());
    }

    @Test
    void evaluate_foreignCashAndUnconvertedAmounts_areCalledOut() {
        CashBalance usdCash = new CashBalance("b2", END, "USD", d("0"), d("120"), false, "ibkr_flex", null);
        List<CashFlow> flows = List.of(new CashFlow("c2", CashFlowType.INTEREST, LocalDate.of(2026, 1, 20), d("3"),
            "USD", null, null, "interest", "ibkr_flex", null));

        BalanceResult result = check.evaluate(ledger(List.of(valuation("10634")), flows, List.of(usdCash),
            closingSnapshot("10000", "0"))).orElseThrow();

        assertTrue(result.callouts().stream().anyMatch(c -> c.startsWith("FX effect on USD cash balance 120")));
        assertTrue(result.callouts().stream().anyMatch(c -> c.startsWith("1 components without FX rate excluded")));
        assertFalse(result.components().containsKey("interest_received"));
    }

    @Test
    void run_withoutReportedValue_isSkippedWithInfo() {
        List<Finding> findings = check.run(LedgerView.empty());

        assertEquals(1, findings.size());
        assertEquals(Severity.INFO, findings.get(0).severity());
        assertEquals("Balance check skipped: no reported account value", findings.get(0).description());
    }

    @Test
    void run_failingBalance_isWarning() {
        List<Finding> findings = check.run(ledger(List.of(valuation("20000")), deposit(), List.of(),
            closingSnapshot("10000", "16")));

        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertTrue(findings.get(0).description().startsWith("Balance FAIL"));
    }

    @Test
    void deviationPercent_zeroReported() {
        assertEquals(0, BigDecimal.ZERO.compareTo(BalanceCheck.deviationPercent(BigDecimal.ZERO, BigDecimal.ZERO)));
        assertEquals(0, d("100").compareTo(BalanceCheck.deviationPercent(BigDecimal.ONE, BigDecimal.ZERO)));
        assertEquals(d("1.0000"), BalanceCheck.deviationPercent(d("99"), d("100")));
    }

    @Test
    void classify_boundariesAreInclusive() {
        ToleranceBand band = ToleranceBand.standard();

        assertEquals(BalanceResult.Verdict.PASS, BalanceResult.classify(d("1.0"), band));
        assertEquals(BalanceResult.Verdict.WARNING, BalanceResult.classify(d("5.0"), band));
        assertEquals(BalanceResult.Verdict.FAIL, BalanceResult.classify(d("5.0001"), band));
    }

    @Test
    @DisplayName("widening the band never worsens the verdict")
    void classify_widerBandNeverWorsens() {
        List<ToleranceBand> widening = List.of(
            ToleranceBand.of("0.5", "2.0"),
            ToleranceBand.standard(),
            ToleranceBand.of("1.0", "8.0"),
            ToleranceBand.margin(),
            ToleranceBand.of("5.0", "20.0"));

        for (int tenths = 0; tenths <= 250; tenths += 5) {
            BigDecimal deviation = BigDecimal.valueOf(tenths, 1);
            BalanceResult.Verdict previous = BalanceResult.Verdict.FAIL;
            for (ToleranceBand band : widening) {
                BalanceResult.Verdict verdict = BalanceResult.classify(deviation, band);
                assertTrue(verdict.ordinal() <= previous.ordinal(), deviation + "% under " + band);
                previous = verdict;
            }
        }
    }
}
