package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.service.ingest.format.FormatRouter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class HoldingsSnapshotParserTest {

    private final HoldingsSnapshotParser parser = new HoldingsSnapshotParser();

    private ParseResult parse(String text) {
        return parser.parse(new FormatRouter().route(text.getBytes(StandardCharsets.UTF_8)),
            new ParseContext("positions.csv", "EUR"));
    }

    @Test
    void parse_oneSnapshotPerReportDate() {
        ParseResult result = parse("""
            ReportDate,CurrencyPrimary,Symbol,Description,ISIN,Quantity,MarkPrice,PositionValue,FXRateToBase,ListingExchange,AssetClass
            20260128,EUR,KESKOB,KESKO OYJ-B SHS,FI0009000202,100,20.50,2050,1,HEX,STK
            20260128,EUR,TELIA1,TELIA CO AB,SE0000667925,500,3.10,1550,1,HEX,STK
            20260129,EUR,KESKOB,KESKO OYJ-B SHS,FI0009000202,100,20.70,2070,1,HEX,STK
            """);

        assertTrue(result.errors().isEmpty());
        assertEquals(2, result.snapshots().size());

        SnapshotDraft first = result.snapshots().get(0);
        PortfolioSnapshot snapshot = first.snapshot();
        assertEquals(LocalDate.of(2026, 1, 28), snapshot.reportDate());
        assertEquals(2, snapshot.positions().size());
        assertEquals(2, first.positionRefs().size());
        assertNull(snapshot.totalValue(), "Totals are computed when the snapshot is written");
        assertEquals(ExternalIds.hash("snapshot", "ibkr_flex", LocalDate.of(2026, 1, 28)), snapshot.externalId());

        Position kesko = snapshot.positions().get(0);
        assertEquals("FI0009000202", kesko.isin());
        assertEquals(0, new BigDecimal("2050").compareTo(kesko.positionValue()));
        assertEquals("KESKOB", first.positionRefs().get(0).hints().symbol());
        assertEquals(3, result.recordCount());
    }

    @Test
    void parse_missingPositionValue_fallsBackToQuantityTimesMark() {
        ParseResult result = parse("""
            ReportDate,CurrencyPrimary,Symbol,ISIN,Quantity,MarkPrice,PositionValue
            20260128,EUR,KESKOB,FI0009000202,100,20.50,
            """);

        Position position = result.snapshots().get(0).snapshot().positions().get(0);
        assertEquals(0, new BigDecimal("2050").compareTo(position.positionValue()));
    }

    @Test
    void parse_foreignPositionRate_isObserved() {
        ParseResult result = parse("""
            ReportDate,CurrencyPrimary,Symbol,ISIN,Quantity,MarkPrice,PositionValue,FXRateToBase
            20260128,USD,KO,US1912161007,10,60,600,0.85
            20260128,EUR,KESKOB,FI0009000202,100,20.50,2050,1
            """);

        assertEquals(1, result.observedRates().size());
        FxRate rate = result.observedRates().get(0);
        assertEquals("USD", rate.currency());
        assertEquals(0, new BigDecimal("0.85").compareTo(rate.rate()));
        assertEquals("position", rate.source());
    }

    @Test
    void parse_badRow_isReportedAndOthersContinue() {
        ParseResult result = parse("""
            ReportDate,CurrencyPrimary,Symbol,ISIN,Quantity,MarkPrice,PositionValue
            20260128,EUR,KESKOB,FI0009000202,100,20.50,2050
            20260128,EUR,,,100,1,100
            notadate,EUR,TELIA1,SE0000667925,500,3.10,1550
            """);

        assertEquals(1, result.snapshots().get(0).snapshot().positions().size());
        assertEquals(2, result.errors().size());
        assertEquals(3, result.errors().get(0).lineNumber());
        assertTrue(result.errors().get(0).rawRow().startsWith("20260128,EUR,,,"));
    }

    @Test
    void parse_accrualTable_becomesEnrichment() {
        ParseResult result = parse("""
            ReportDate,CurrencyPrimary,Symbol,ISIN,Quantity,MarkPrice,PositionValue
            20260128,EUR,KESKOB,FI0009000202,100,20.50,2050
            CurrencyPrimary,Symbol,ISIN,ExDate,PayDate,GrossRate,GrossAmount,NetAmount
            EUR,KESKOB,FI0009000202,20260320,20260401,0.22,22,15.4
            """);

        assertEquals(1, result.snapshots().size());
        assertEquals(1, result.enrichments().size());
        EnrichmentDraft draft = result.enrichments().get(0);
        assertEquals("FI0009000202", draft.instrument().isin());
        assertEquals("0.22", draft.values().get("dividend_per_payment"));
        assertEquals("2026-03-20", draft.values().get("dividend_ex_date"));
        assertEquals("accruals", draft.values().get("dividend_source"));
    }
}
