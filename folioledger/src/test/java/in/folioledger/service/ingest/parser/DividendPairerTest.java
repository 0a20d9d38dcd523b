package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Provenance;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DividendPairerTest {

    private static final LocalDate PAY = LocalDate.of(2026, 3, 28);
    private static final InstrumentRef KESKO = InstrumentRef.of("FI0009000202", InstrumentHints.builder().symbol("KESKOB").build());
    private static final InstrumentRef TELIA = InstrumentRef.of("FI0009007884", InstrumentHints.builder().symbol("TELIA1").build());

    private static Provenance prov(int line, String raw) {
        return Provenance.of("divs.csv", FormatTag.DIVIDEND_REPORT, null, line, raw, null);
    }

    private static DividendPairer.GrossRow gross(InstrumentRef ref, String amount, String perShare, String nativeId, int line) {
        return new DividendPairer.GrossRow(ref, PAY, null, "EUR", new BigDecimal(amount), BigDecimal.ZERO,
            null, perShare == null ? null : new BigDecimal(perShare), null, "dividend", nativeId, prov(line, "gross-" + line));
    }

    private static DividendPairer.WithholdingRow tax(InstrumentRef ref, String amount, String nativeId, int line) {
        return new DividendPairer.WithholdingRow(ref, PAY, "EUR", new BigDecimal(amount), "tax", nativeId, prov(line, "tax-" + line));
    }

    @Test
    void pair_grossAndWithholding_mergeIntoNet() {
        DividendPairer.Outcome outcome = DividendPairer.pair(
            List.of(gross(KESKO, "220", "0.22", null, 2)),
            List.of(tax(KESKO, "-77", null, 3)),
            "test");

        assertEquals(1, outcome.dividends().size());
        DividendPayment dividend = outcome.dividends().get(0).dividend();
        assertEquals(0, new BigDecimal("220").compareTo(dividend.grossAmount()));
        assertEquals(0, new BigDecimal("-77").compareTo(dividend.withholdingTax()));
        assertEquals(0, new BigDecimal("143").compareTo(dividend.netAmount()));
        assertEquals(DividendAmountType.PER_SHARE, dividend.amountType());
        assertEquals(List.of("gross-2", "tax-3"), dividend.provenance().allRows());
        assertEquals(ExternalIds.hash("dividend", "FI0009000202", PAY, new BigDecimal("220"), "EUR"), dividend.externalId());
        assertTrue(outcome.orphanedWithholdings().isEmpty());
    }

    @Test
    void pair_sameKeyGrossRows_areSummed() {
        DividendPairer.Outcome outcome = DividendPairer.pair(
            List.of(gross(KESKO, "200", null, null, 2), gross(KESKO, "20", null, null, 3)),
            List.of(),
            "test");

        DividendPayment dividend = outcome.dividends().get(0).dividend();
        assertEquals(0, new BigDecimal("220").compareTo(dividend.netAmount()));
        assertEquals(DividendAmountType.TOTAL_NET, dividend.amountType());
        assertEquals(2, dividend.provenance().allRows().size());
    }

    @Test
    void pair_unmatchedWithholding_becomesOrphanCashFlow() {
        DividendPairer.Outcome outcome = DividendPairer.pair(
            List.of(gross(KESKO, "220", null, null, 2)),
            List.of(tax(TELIA, "-10", "77", 3)),
            "nordnet");

        assertEquals(1, outcome.dividends().size());
        assertEquals(1, outcome.orphanedWithholdings().size());
        CashFlow orphan = outcome.orphanedWithholdings().get(0);
        assertEquals(CashFlowType.OTHER, orphan.flowType());
        assertEquals("nordnet:withholding:77", orphan.externalId());
        assertTrue(orphan.description().startsWith("Unmatched withholding tax"));
    }

    @Test
    void pair_nativeId_usedForDividend() {
        DividendPairer.Outcome outcome = DividendPairer.pair(
            List.of(gross(KESKO, "220", null, "55", 2)), List.of(), "nordnet");

        assertEquals("nordnet:dividend:55", outcome.dividends().get(0).dividend().externalId());
    }

    @Test
    void pair_zeroGrossAndTax_isSkipped() {
        DividendPairer.Outcome outcome = DividendPairer.pair(
            List.of(gross(KESKO, "10", null, null, 2), gross(KESKO, "-10", null, null, 3)), List.of(), "test");

        assertTrue(outcome.dividends().isEmpty());
        assertEquals(1, outcome.zeroSkipped());
    }
}
