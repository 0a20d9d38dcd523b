package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.format.FormatRouter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class TradeReportParserTest {

    private static final String HEADER =
        "TradeID,Symbol,ISIN,AssetClass,CurrencyPrimary,FXRateToBase,DateTime,TradeDate,Quantity,TradePrice,IBCommission,Taxes,Buy/Sell,ListingExchange,FifoPnlRealized\n";

    private final TradeReportParser parser = new TradeReportParser();

    private ParseResult parse(String body) {
        return parser.parse(new FormatRouter().route((HEADER + body).getBytes(StandardCharsets.UTF_8)),
            new ParseContext("trades.csv", "EUR"));
    }

    @Test
    void parse_buyAndSell_signedQuantityAndAmount() {
        ParseResult result = parse("""
            1001,KO,US1912161007,STK,USD,0.85,"2026-01-08, 15:42:02",20260108,10,60,-1,0,BUY,NYSE,0
            1002,KO,US1912161007,STK,USD,0.86,"2026-01-20, 16:00:00",20260120,4,65,-1,0,SELL,NYSE,19.5
            """);

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.trades().size());

        Trade buy = result.trades().get(0).trade();
        assertEquals("ibkr_flex:trade:1001", buy.externalId());
        assertTrue(buy.isBuy());
        assertEquals(0, new BigDecimal("-600").compareTo(buy.amount()));
        assertEquals(0, new BigDecimal("-1").compareTo(buy.commission()));
        assertEquals(LocalDate.of(2026, 1, 8), buy.tradeDate());
        assertEquals(LocalTime.of(15, 42, 2), buy.tradeTime());

        Trade sell = result.trades().get(1).trade();
        assertEquals(0, new BigDecimal("-4").compareTo(sell.quantity()));
        assertEquals(0, new BigDecimal("260").compareTo(sell.amount()));
        assertEquals(0, new BigDecimal("19.5").compareTo(sell.realizedPnl()));
        assertEquals("US1912161007", result.trades().get(1).instrument().isin());
    }

    @Test
    void parse_currencyConversions_areIgnored() {
        ParseResult result = parse("""
            1003,EUR.USD,,CASH,USD,0.85,,20260108,1000,1.17,-2,0,BUY,IDEALFX,0
            1004,EUR.SEK,,,SEK,0.09,,20260108,1000,11.2,-2,0,SELL,IDEALFX,0
            """);

        assertTrue(result.trades().isEmpty());
        assertEquals(2, result.ignored().get("currency conversion"));
    }

    @Test
    void parse_symbolOnly_keepsReferenceWithoutIsin() {
        ParseResult result = parse("1005,NOKIA,,STK,EUR,1,,20260108,100,4,-1,0,BUY,HEX,0\n");

        assertFalse(result.trades().get(0).instrument().hasIsin());
        assertEquals("NOKIA", result.trades().get(0).instrument().hints().symbol());
        assertTrue(result.observedRates().isEmpty(), "Base-currency rows carry no rate information");
    }

    @Test
    void parse_unknownSide_isRowError() {
        ParseResult result = parse("1006,KO,US1912161007,STK,USD,0.85,,20260108,10,60,-1,0,HOLD,NYSE,0\n");

        assertTrue(result.trades().isEmpty());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).message().contains("HOLD"));
    }
}
