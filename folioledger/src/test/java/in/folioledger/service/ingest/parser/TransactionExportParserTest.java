package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.format.FormatRouter;
import in.folioledger.service.ingest.format.RoutedInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransactionExportParser")
class TransactionExportParserTest {

    private static final List<String> HEADER = List.of(
        "Id", "Kirjauspäivä", "Kauppapäivä", "Maksupäivä", "Tapahtumatyyppi", "Arvopaperi", "ISIN", "Määrä",
        "Kurssi", "Kokonaiskulut", "Valuutta", "Summa", "Valuutta", "Hankinta-arvo", "Valuutta", "Tulos",
        "Valuutta", "Vaihtokurssi", "Tapahtumateksti", "Mitätöintipäivä");

    private final TransactionExportParser parser = new TransactionExportParser();

    private static String row(String... cells) {
        return String.join("\t", cells) + "\r\n";
    }

    /** UTF-16LE with BOM, the way the export is downloaded. */
    private static byte[] export(String... rows) {
        StringBuilder text = new StringBuilder(String.join("\t", HEADER)).append("\r\n");
        for (String r : rows) {
            text.append(r);
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes(new byte[] {(byte) 0xFF, (byte) 0xFE});
        bytes.writeBytes(text.toString().getBytes(StandardCharsets.UTF_16LE));
        return bytes.toByteArray();
    }

    private ParseResult parse(String... rows) {
        RoutedInput input = new FormatRouter().route(export(rows));
        assertEquals(FormatTag.TRANSACTION_EXPORT, input.format());
        return parser.parse(input, new ParseContext("transactions.csv", "EUR"));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("buy and sell become trades with native ids, sale with result becomes a sold position")
    void parse_trades() {
        ParseResult result = parse(
            row("101", "2026-01-05", "2026-01-05", "2026-01-07", "OSTO", "Kesko B", "FI0009000202", "100",
                "20,50", "9,00", "EUR", "-2 059,00", "EUR", "", "", "", "", "1", "OSTO Kesko B", ""),
            row("102", "2026-01-20", "2026-01-20", "2026-01-22", "MYYNTI", "Kesko B", "FI0009000202", "40",
                "22,00", "9,00", "EUR", "871,00", "EUR", "-820,00", "EUR", "42,00", "EUR", "1", "MYYNTI Kesko B", ""));

        assertTrue(result.errors().isEmpty(), () -> "unexpected errors " + result.errors());
        assertEquals(2, result.trades().size());

        Trade buy = result.trades().get(0).trade();
        assertEquals("nordnet:txn:101", buy.externalId());
        assertAmount("100", buy.quantity());
        assertAmount("20.5", buy.price());
        assertAmount("-2059", buy.amount());
        assertAmount("-9", buy.commission());
        assertNull(buy.fxRate(), "Base-currency rows carry no rate");
        assertEquals(LocalDate.of(2026, 1, 7), buy.settlementDate());

        Trade sell = result.trades().get(1).trade();
        assertAmount("-40", sell.quantity());
        assertAmount("42", sell.realizedPnl());

        assertEquals(1, result.soldPositions().size());
        SoldPosition sold = result.soldPositions().get(0);
        assertEquals("FI0009000202", sold.isin());
        assertAmount("40", sold.quantity());
        assertAmount("20.95", sold.purchasePrice());
        assertAmount("22", sold.salePrice());
    }

    @Test
    @DisplayName("dividend and withholding rows merge into one record")
    void parse_dividendWithWithholding() {
        ParseResult result = parse(
            row("103", "2026-03-28", "2026-03-26", "2026-03-28", "OSINKO", "Kesko B", "FI0009000202", "1000",
                "0,22", "", "", "220,00", "EUR", "", "", "", "", "1", "OSINKO KESKOB 0,22 EUR/OSAKE", ""),
            row("104", "2026-03-28", "2026-03-26", "2026-03-28", "ENNAKKOPIDÄTYS", "Kesko B", "FI0009000202", "",
                "", "", "", "-77,00", "EUR", "", "", "", "", "1", "ENNAKKOPIDÄTYS 35 %", ""));

        assertEquals(1, result.dividends().size());
        DividendPayment dividend = result.dividends().get(0).dividend();
        assertEquals("nordnet:dividend:103", dividend.externalId());
        assertAmount("220", dividend.grossAmount());
        assertAmount("-77", dividend.withholdingTax());
        assertAmount("143", dividend.netAmount());
        assertAmount("0.22", dividend.perShare());
        assertEquals(LocalDate.of(2026, 3, 28), dividend.payDate());
        assertTrue(result.orphanedWithholdings().isEmpty());
    }

    @Test
    void parse_foreignDividend_carriesExchangeRate() {
        ParseResult result = parse(
            row("108", "2026-04-01", "2026-03-13", "2026-04-01", "OSINKO", "Coca-Cola", "US1912161007", "100",
                "0,51", "", "", "51,00", "USD", "", "", "", "", "0,85", "OSINKO KO", ""));

        DividendPayment dividend = result.dividends().get(0).dividend();
        assertEquals("USD", dividend.currency());
        assertAmount("0.85", dividend.fxRate());
        assertEquals(1, result.observedRates().size());
        assertEquals("transaction", result.observedRates().get(0).source());
    }

    @Test
    void parse_cashMovementsAndIgnoredRows() {
        ParseResult result = parse(
            row("105", "2026-01-02", "2026-01-02", "2026-01-02", "TALLETUS", "", "", "",
                "", "", "", "5 000,00", "EUR", "", "", "", "", "", "TALLETUS", ""),
            row("106", "2026-01-03", "2026-01-03", "2026-01-05", "VALUUTAN OSTO", "", "", "",
                "", "", "", "1 000,00", "USD", "", "", "", "", "0,85", "VALUUTAN OSTO", ""),
            row("107", "2026-01-04", "2026-01-04", "2026-01-04", "TALLETUS", "", "", "",
                "", "", "", "100,00", "EUR", "", "", "", "", "", "TALLETUS", "2026-01-05"));

        assertEquals(1, result.cashFlows().size());
        assertEquals(CashFlowType.DEPOSIT, result.cashFlows().get(0).flowType());
        assertEquals("nordnet:txn:105", result.cashFlows().get(0).externalId());
        assertAmount("5000", result.cashFlows().get(0).amount());
        assertEquals(1, result.ignored().get("currency conversion"));
        assertEquals(1, result.ignored().get("cancelled"));
    }

    @Test
    void parse_unknownType_isKeptAsCorporateAction() {
        ParseResult result = parse(
            row("109", "2026-02-01", "2026-02-01", "2026-02-01", "VAIHTO AP-JÄTTÖ", "Kesko B", "FI0009000202", "100",
                "", "", "", "", "EUR", "", "", "", "", "", "VAIHTO", ""));

        assertEquals(1, result.corporateActions().size());
        assertEquals("VAIHTO AP-JÄTTÖ", result.corporateActions().get(0).action().actionType());
        assertEquals("nordnet:corp:109", result.corporateActions().get(0).action().externalId());
    }

    @Test
    void parse_tradeWithoutSecurity_isRowError() {
        ParseResult result = parse(
            row("110", "2026-01-05", "2026-01-05", "2026-01-07", "OSTO", "", "", "100",
                "20,50", "9,00", "EUR", "-2 059,00", "EUR", "", "", "", "", "1", "OSTO", ""));

        assertTrue(result.trades().isEmpty());
        assertEquals(1, result.errors().size());
        assertEquals(2, result.errors().get(0).lineNumber());
    }
}
