package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CashBalance;
import in.folioledger.service.ingest.format.FormatRouter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CashSummaryParserTest {

    private final CashSummaryParser parser = new CashSummaryParser();

    private ParseResult parse(String text) {
        return parser.parse(new FormatRouter().route(text.getBytes(StandardCharsets.UTF_8)),
            new ParseContext("cash.csv", "EUR"));
    }

    @Test
    void parse_baseSummaryAndCurrencyRows() {
        ParseResult result = parse("""
            ClientAccountID,CurrencyPrimary,LevelOfDetail,FromDate,ToDate,StartingCash,EndingCash
            U1234567,BASE_SUMMARY,BaseCurrency,20260101,20260131,1000.00,1250.50
            U1234567,USD,Currency,20260101,20260131,200,180
            U1234567,USD,BaseCurrency,20260101,20260131,170,153
            """);

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.cashBalances().size());
        assertEquals(1, result.ignored().get("converted summary row"));

        CashBalance base = result.cashBalances().get(0);
        assertTrue(base.baseSummary());
        assertEquals("EUR", base.currency());
        assertEquals(LocalDate.of(2026, 1, 31), base.periodEnd());
        assertEquals(0, new BigDecimal("1250.50").compareTo(base.endingCash()));

        CashBalance usd = result.cashBalances().get(1);
        assertFalse(usd.baseSummary());
        assertEquals("USD", usd.currency());
    }

    @Test
    void parse_missingToDate_isRowError() {
        ParseResult result = parse("""
            ClientAccountID,CurrencyPrimary,LevelOfDetail,FromDate,ToDate,StartingCash,EndingCash
            U1234567,EUR,Currency,20260101,,1000,1100
            """);

        assertTrue(result.cashBalances().isEmpty());
        assertEquals("Missing ToDate", result.errors().get(0).message());
    }

    @Test
    void parse_sameRowTwice_sameExternalId() {
        String text = """
            ClientAccountID,CurrencyPrimary,LevelOfDetail,FromDate,ToDate,StartingCash,EndingCash
            U1234567,EUR,Currency,20260101,20260131,1000,1100
            """;

        assertEquals(parse(text).cashBalances().get(0).externalId(), parse(text).cashBalances().get(0).externalId());
    }
}
