package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.Instrument;
import in.folioledger.domain.model.InstrumentAlias;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.domain.model.Provenance;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityChecksTest {

    private static final LocalDate DAY = LocalDate.of(2026, 1, 28);

    private static final Instrument KESKO = Instrument.create("FI0009000202",
        InstrumentHints.builder().name("Kesko B").currency("EUR").build());
    private static final Instrument TELIA = Instrument.create("SE0000667925", InstrumentHints.empty());

    private static Trade trade(String id, String instrumentId) {
        return new Trade(id, instrumentId, DAY, null, null, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE.negate(),
            BigDecimal.ZERO, "EUR", null, "STK", null, null, null, null);
    }

    private static DividendPayment dividend(String id, String instrumentId, String currency, BigDecimal fxRate, BigDecimal base) {
        return new DividendPayment(id, instrumentId, null, DAY, BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.TEN,
            currency, fxRate, base, null, null, DividendAmountType.TOTAL_NET, "div", null);
    }

    private static DividendPayment perShare(String id, String instrumentId, LocalDate payDate, String rate) {
        return perShare(id, instrumentId, payDate, rate, "EUR");
    }

    private static DividendPayment perShare(String id, String instrumentId, LocalDate payDate, String rate, String currency) {
        BigDecimal perShare = new BigDecimal(rate);
        BigDecimal total = perShare.multiply(BigDecimal.TEN);
        return new DividendPayment(id, instrumentId, null, payDate, total, BigDecimal.ZERO, total, currency, null, null,
            BigDecimal.TEN, perShare, DividendAmountType.PER_SHARE, "div", null);
    }

    private static DividendPayment sourced(DividendPayment dividend, FormatTag format) {
        return new DividendPayment(dividend.externalId(), dividend.instrumentId(), dividend.exDate(), dividend.payDate(),
            dividend.grossAmount(), dividend.withholdingTax(), dividend.netAmount(), dividend.currency(),
            dividend.fxRate(), dividend.amountBase(), dividend.quantity(), dividend.perShare(), dividend.amountType(),
            dividend.description(), Provenance.of("dividends.csv", format, null, 2, "", null));
    }

    private static LedgerView view(List<Instrument> instruments, List<InstrumentAlias> aliases, List<Trade> trades,
                                   List<DividendPayment> dividends, List<CashFlow> flows, List<SoldPosition> sold,
                                   List<PortfolioSnapshot> snapshots) {
        return new LedgerView(instruments, aliases, trades, dividends, flows, List.of(), sold, snapshots, List.of(), List.of());
    }

    private static List<String> descriptions(List<Finding> findings) {
        return findings.stream().map(Finding::description).toList();
    }

    @Test
    void orphans_unusedInstrumentsDanglingAliasesAndUnlinkedPositions() {
        InstrumentAlias dangling = InstrumentAlias.create("missing-id", "GONE", "", AliasSource.OTHER, DAY);
        Position unlinked = new Position(null, "XYZ", null, "EUR", BigDecimal.ONE, null, BigDecimal.ONE,
            null, null, null, null, "STK", null, null);
        PortfolioSnapshot snapshot = new PortfolioSnapshot("s1", DAY, "ibkr_flex", null, null, List.of(unlinked), null);

        List<Finding> findings = new OrphanCheck().run(view(List.of(KESKO, TELIA), List.of(dangling),
            List.of(trade("t1", KESKO.id())), List.of(), List.of(), List.of(), List.of(snapshot)));

        assertEquals(List.of(
            "1 instruments with no trades or dividend payments",
            "1 instrument aliases with no parent instrument",
            "1 positions with no catalog instrument"), descriptions(findings));
        assertEquals(List.of(RecordRef.of("instrument", "SE0000667925")), findings.get(0).records());
        assertEquals(Severity.INFO, findings.get(0).severity());
        assertEquals(Severity.WARNING, findings.get(1).severity());
    }

    @Test
    void nullFields_missingRatesNamesAndIsins() {
        SoldPosition sold = new SoldPosition("sp1", null, "Old Co", DAY, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.TEN,
            BigDecimal.ONE, "EUR", null);

        List<Finding> findings = new NullFieldCheck(LedgerConfig.defaults()).run(view(List.of(KESKO, TELIA), List.of(),
            List.of(), List.of(dividend("d1", KESKO.id(), "USD", null, null)), List.of(), List.of(sold), List.of()));

        assertEquals(List.of(
            "1 dividend payments missing base amount",
            "1 non-EUR dividend payments missing fx rate",
            "1 instruments missing currency",
            "1 instruments missing name",
            "1 sold positions missing ISIN"), descriptions(findings));
    }

    @Test
    void foreignKeys_referencesOutsideTheCatalog() {
        SoldPosition sold = new SoldPosition("sp1", "US0000000001", "Gone", DAY, BigDecimal.ONE, BigDecimal.ONE,
            BigDecimal.TEN, BigDecimal.ONE, "USD", null);

        List<Finding> findings = new ForeignKeyCheck().run(view(List.of(KESKO), List.of(),
            List.of(trade("t1", KESKO.id()), trade("t2", "nope")),
            List.of(dividend("d1", "nope", "EUR", null, null)), List.of(), List.of(sold), List.of()));

        assertEquals(List.of(
            "1 trades pointing to non-existent instruments",
            "1 dividend payments pointing to non-existent instruments",
            "1 sold positions whose ISIN is not in the catalog"), descriptions(findings));
        assertEquals(List.of(RecordRef.of("trade", "t2")), findings.get(0).records());
    }

    @Test
    void duplicates_externalIdsAndSnapshotDates() {
        PortfolioSnapshot a = new PortfolioSnapshot("s1", DAY, "ibkr_flex", null, null, List.of(), null);
        PortfolioSnapshot b = new PortfolioSnapshot("s2", DAY, "ibkr_flex", null, null, List.of(), null);
        PortfolioSnapshot otherSource = new PortfolioSnapshot("s3", DAY, "ibkr_activity_statement", null, null, List.of(), null);

        List<Finding> findings = new DuplicateCheck().run(view(List.of(), List.of(),
            List.of(trade("t1", "i"), trade("t1", "i"), trade("t2", "i")), List.of(), List.of(), List.of(),
            List.of(a, b, otherSource)));

        assertEquals(List.of(
            "1 duplicate external ids in trades",
            "3 snapshots share a report date with another snapshot"), descriptions(findings));
    }

    @Test
    void duplicates_snapshotsFromDifferentSourcesOnOneDate() {
        PortfolioSnapshot flex = new PortfolioSnapshot("s1", DAY, "ibkr_flex", new BigDecimal("2050"), null, List.of(), null);
        PortfolioSnapshot statement = new PortfolioSnapshot("s2", DAY, "ibkr_activity_statement", new BigDecimal("2100"),
            null, List.of(), null);
        PortfolioSnapshot nextDay = new PortfolioSnapshot("s3", DAY.plusDays(1), "ibkr_flex", null, null, List.of(), null);

        List<Finding> findings = new DuplicateCheck().run(view(List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(statement, nextDay, flex)));

        assertEquals(1, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("snapshot", "s1"), RecordRef.of("snapshot", "s2")), findings.get(0).records());
    }

    @Test
    void aliasQuality_primaryBookkeepingAndUnsplitSymbols() {
        InstrumentAlias none = InstrumentAlias.create("i1", "KESKOB", "", AliasSource.IBKR_FLEX, DAY);
        InstrumentAlias twoA = InstrumentAlias.create("i2", "TELIA", "", AliasSource.IBKR_FLEX, DAY).withPrimary(true);
        InstrumentAlias twoB = InstrumentAlias.create("i2", "TELIA1", "", AliasSource.NORDNET, DAY).withPrimary(true);
        InstrumentAlias commas = InstrumentAlias.create("i3", "BRK.B, BRKB", "", AliasSource.IBKR_FLEX, DAY).withPrimary(true);
        InstrumentAlias name = InstrumentAlias.create("i3", "Berkshire Hathaway Inc, Class B shares", "", AliasSource.OTHER, DAY);

        List<Finding> findings = new AliasQualityCheck().run(view(List.of(), List.of(none, twoA, twoB, commas, name),
            List.of(), List.of(), List.of(), List.of(), List.of()));

        assertEquals(List.of(
            "1 instruments have aliases but none marked primary",
            "1 instruments have more than one primary alias",
            "1 aliases contain commas (should be split)"), descriptions(findings));
        assertEquals(List.of(RecordRef.of("alias", commas.id())), findings.get(2).records());
    }

    @Test
    void dividendCurrency_unknownAndImplausible() {
        List<Finding> findings = new DividendCurrencyCheck().run(view(List.of(KESKO), List.of(), List.of(),
            List.of(dividend("d1", KESKO.id(), "XXX", null, null),
                dividend("d2", KESKO.id(), "SEK", null, null),
                dividend("d3", KESKO.id(), "USD", null, null),
                dividend("d4", KESKO.id(), "EUR", null, null)),
            List.of(), List.of(), List.of()));

        assertEquals(2, findings.size());
        assertEquals(List.of(RecordRef.of("dividend", "d1")), findings.get(0).records());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("dividend", "d2")), findings.get(1).records());
        assertEquals(Severity.INFO, findings.get(1).severity());
    }

    @Test
    void crossSourceDuplicates_sameInstrumentAndPayDate() {
        DividendPayment flex = sourced(dividend("ibkr:dividend:ab12", KESKO.id(), "EUR", BigDecimal.ONE, BigDecimal.TEN),
            FormatTag.DIVIDEND_REPORT);
        DividendPayment nordnet = sourced(dividend("nordnet:dividend:77", KESKO.id(), "EUR", BigDecimal.ONE, BigDecimal.TEN),
            FormatTag.TRANSACTION_EXPORT);
        DividendPayment regular = sourced(dividend("nordnet:dividend:80", TELIA.id(), "SEK", null, null), FormatTag.TRANSACTION_EXPORT);
        DividendPayment special = sourced(dividend("nordnet:dividend:81", TELIA.id(), "SEK", null, null), FormatTag.TRANSACTION_EXPORT);
        DividendPayment otherDay = perShare("d5", KESKO.id(), DAY.plusDays(1), "1.00");

        List<Finding> findings = new CrossSourceDividendCheck().run(view(List.of(KESKO, TELIA), List.of(), List.of(),
            List.of(flex, nordnet, regular, special, otherDay), List.of(), List.of(), List.of()));

        assertEquals(2, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("dividend", "ibkr:dividend:ab12"), RecordRef.of("dividend", "nordnet:dividend:77")),
            findings.get(0).records());
        assertEquals(Severity.INFO, findings.get(1).severity());
        assertEquals(2, findings.get(1).records().size());
    }

    @Test
    void suspiciousAmounts_perCurrencyThresholds() {
        List<Finding> findings = new SuspiciousDividendAmountCheck().run(view(List.of(), List.of(), List.of(),
            List.of(perShare("usd-high", "i1", DAY, "51.00", "USD"),
                perShare("usd-edge", "i1", DAY, "50.00", "USD"),
                perShare("jpy-ok", "i2", DAY, "120", "JPY"),
                perShare("gbp-pence", "i3", DAY, "4500", "GBp"),
                perShare("xyz-default", "i4", DAY, "60", "XYZ"),
                dividend("total", "i5", "USD", null, null)),
            List.of(), List.of(), List.of()));

        assertEquals(1, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("dividend", "usd-high"), RecordRef.of("dividend", "gbp-pence"),
            RecordRef.of("dividend", "xyz-default")), findings.get(0).records());
    }

    @Test
    void inconsistentAmounts_outliersAgainstRecentMedian() {
        List<Finding> findings = new InconsistentDividendAmountCheck().run(view(List.of(), List.of(), List.of(),
            List.of(perShare("q1", "i1", DAY.minusMonths(9), "0.50"),
                perShare("q2", "i1", DAY.minusMonths(6), "0.52"),
                perShare("q3", "i1", DAY.minusMonths(3), "0.55"),
                perShare("total-as-rate", "i1", DAY, "55.00"),
                perShare("supplemental", "i1", DAY, "0.03"),
                perShare("single", "i2", DAY, "99.00")),
            List.of(), List.of(), List.of()));

        assertEquals(2, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("dividend", "total-as-rate")), findings.get(0).records());
        assertEquals(Severity.INFO, findings.get(1).severity());
        assertEquals(List.of(RecordRef.of("dividend", "supplemental")), findings.get(1).records());
    }

    @Test
    void inconsistentAmounts_preSplitHistoryIgnoredForMedian() {
        List<Finding> findings = new InconsistentDividendAmountCheck().run(view(List.of(), List.of(), List.of(),
            List.of(perShare("old1", "i1", DAY.minusYears(8), "20.00"),
                perShare("old2", "i1", DAY.minusYears(7), "20.00"),
                perShare("old3", "i1", DAY.minusYears(6), "20.00"),
                perShare("new1", "i1", DAY.minusYears(1), "1.00"),
                perShare("new2", "i1", DAY, "1.00")),
            List.of(), List.of(), List.of()));

        assertEquals(1, findings.size());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(3, findings.get(0).records().size());
    }

    @Test
    void mixedAmountTypes_perInstrument() {
        List<Finding> findings = new MixedDividendTypeCheck().run(view(List.of(KESKO, TELIA), List.of(), List.of(),
            List.of(perShare("d1", KESKO.id(), DAY, "1.00"),
                dividend("d2", KESKO.id(), "EUR", BigDecimal.ONE, BigDecimal.TEN),
                perShare("d3", TELIA.id(), DAY, "2.00"),
                perShare("d4", TELIA.id(), DAY.plusDays(90), "2.00")),
            List.of(), List.of(), List.of()));

        assertEquals(1, findings.size());
        assertEquals(Severity.INFO, findings.get(0).severity());
        assertEquals(List.of(RecordRef.of("instrument", KESKO.id())), findings.get(0).records());
    }

    @Test
    void unconvertedFx_foreignAmountsWithoutBase() {
        CashFlow usdInterest = new CashFlow("c1", CashFlowType.INTEREST, DAY, BigDecimal.ONE, "USD", null, null,
            "interest", "ibkr_flex", null);
        CashFlow eurFee = new CashFlow("c2", CashFlowType.FEE, DAY, BigDecimal.ONE.negate(), "EUR", null, null,
            "fee", "ibkr_flex", null);

        List<Finding> findings = new UnconvertedFxCheck(LedgerConfig.defaults()).run(view(List.of(), List.of(), List.of(),
            List.of(dividend("d1", "i", "USD", null, null), dividend("d2", "i", "USD", new BigDecimal("0.85"), new BigDecimal("8.5"))),
            List.of(usdInterest, eurFee), List.of(), List.of()));

        assertEquals(2, findings.size());
        assertEquals(List.of(RecordRef.of("dividend", "d1")), findings.get(0).records());
        assertEquals(List.of(RecordRef.of("cash_flow", "c1")), findings.get(1).records());
    }

    @Test
    void cleanLedger_hasNoFindings() {
        Trade trade = trade("t1", KESKO.id());
        InstrumentAlias alias = InstrumentAlias.create(KESKO.id(), "KESKOB", "", AliasSource.IBKR_FLEX, DAY).withPrimary(true);
        LedgerView clean = view(List.of(KESKO), List.of(alias), List.of(trade),
            List.of(dividend("d1", KESKO.id(), "EUR", BigDecimal.ONE, BigDecimal.TEN)), List.of(), List.of(), List.of());

        assertTrue(new OrphanCheck().run(clean).isEmpty());
        assertTrue(new NullFieldCheck(LedgerConfig.defaults()).run(clean).isEmpty());
        assertTrue(new ForeignKeyCheck().run(clean).isEmpty());
        assertTrue(new DuplicateCheck().run(clean).isEmpty());
        assertTrue(new AliasQualityCheck().run(clean).isEmpty());
        assertTrue(new DividendCurrencyCheck().run(clean).isEmpty());
        assertTrue(new CrossSourceDividendCheck().run(clean).isEmpty());
        assertTrue(new SuspiciousDividendAmountCheck().run(clean).isEmpty());
        assertTrue(new InconsistentDividendAmountCheck().run(clean).isEmpty());
        assertTrue(new MixedDividendTypeCheck().run(clean).isEmpty());
        assertTrue(new UnconvertedFxCheck(LedgerConfig.defaults()).run(clean).isEmpty());
    }
}
