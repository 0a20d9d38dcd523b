package in.folioledger.service.ingest;

import in.folioledger.bootstrap.LedgerStore;
import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.infrastructure.metrics.LedgerMetrics;
import in.folioledger.service.fx.FxResolver;
import in.folioledger.service.instrument.InstrumentResolver;
import in.folioledger.service.ledger.LedgerWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportService")
class ImportServiceTest {

    private static final String HOLDINGS = """
        ReportDate,CurrencyPrimary,Symbol,Description,ISIN,Quantity,MarkPrice,PositionValue,FXRateToBase,ListingExchange,AssetClass
        20260128,EUR,KESKOB,KESKO OYJ-B SHS,FI0009000202,100,20.50,2050,1,HEX,STK
        20260128,EUR,TELIA1,TELIA CO AB,SE0000667925,500,3.10,1550,1,HEX,STK
        """;

    private static final String DIVIDEND_HEADER =
        "Symbol,ISIN,CurrencyPrimary,FXRateToBase,ExDate,PayDate,Quantity,GrossRate,GrossAmount,NetAmount\n";

    private LedgerStore store;
    private ImportService service;

    @BeforeEach
    void setUp() {
        store = LedgerStore.memory();
        service = newService(LedgerConfig.defaults());
    }

    private ImportService newService(LedgerConfig config) {
        FxResolver fx = FxResolver.standard(config, store.snapshots(), store.fxRates(), null);
        LedgerWriter writer = new LedgerWriter(store.ledger(), store.snapshots(), store.accounts(), store.fxRates(), fx);
        InstrumentResolver resolver = new InstrumentResolver(store.instruments(), store.aliases());
        return new ImportService(config, resolver, writer, LedgerMetrics.NOOP);
    }

    private FileImportResult importText(String name, String text) {
        return service.importBytes(name, text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("holdings: one snapshot, two linked positions, total is their sum; re-import creates nothing")
    void holdingsSnapshot_isIdempotent() {
        FileImportResult first = importText("positions.csv", HOLDINGS);

        assertEquals(FormatTag.HOLDINGS_SNAPSHOT, first.format());
        assertEquals("ok", first.status());
        assertEquals(1, first.created());

        List<PortfolioSnapshot> snapshots = store.snapshots().findAll();
        assertEquals(1, snapshots.size());
        PortfolioSnapshot snapshot = snapshots.get(0);
        assertEquals(LocalDate.of(2026, 1, 28), snapshot.reportDate());
        assertEquals(2, snapshot.positions().size());
        assertEquals(0, new BigDecimal("3600").compareTo(snapshot.totalValue()));
        for (Position position : snapshot.positions()) {
            assertNotNull(position.instrumentId(), "Positions are linked to the catalog");
        }
        assertEquals(2, store.instruments().findAll().size());

        FileImportResult again = importText("positions-copy.csv", HOLDINGS);

        assertEquals(0, again.created());
        assertEquals(1, again.skipped());
        assertEquals(1, store.snapshots().findAll().size());
        assertEquals(2, store.instruments().findAll().size());
    }

    @Test
    void dividendReport_baseCurrencyDividendStoredNet() {
        FileImportResult result = importText("dividends.csv",
            DIVIDEND_HEADER + "KESKOB,FI0009000202,EUR,1,20260320,20260401,1000,0.22,220,143\n");

        assertEquals(1, result.created());
        DividendPayment dividend = store.ledger().findAllDividends().get(0);
        assertEquals(0, new BigDecimal("143").compareTo(dividend.netAmount()));
        assertEquals(0, new BigDecimal("143").compareTo(dividend.amountBase()));
        assertEquals(store.instruments().findByIsin("FI0009000202").orElseThrow().id(), dividend.instrumentId());
    }

    @Test
    @DisplayName("foreign dividend without a rate converts at the same-currency position rate")
    void dividendReport_foreignDividendUsesPositionRate() {
        importText("positions.csv", """
            ReportDate,CurrencyPrimary,Symbol,ISIN,Quantity,MarkPrice,PositionValue,FXRateToBase
            20260331,USD,KO,US1912161007,100,60,6000,0.85
            """);

        importText("dividends.csv", DIVIDEND_HEADER + "KO,US1912161007,USD,,20260313,20260401,100,0.51,,43.35\n");

        DividendPayment dividend = store.ledger().findAllDividends().get(0);
        assertEquals(0, new BigDecimal("0.85").compareTo(dividend.fxRate()));
        assertEquals(0, new BigDecimal("36.8475").compareTo(dividend.amountBase()));
    }

    @Test
    void foreignDividendWithoutAnyRate_isStoredUnconverted() {
        importText("dividends.csv", DIVIDEND_HEADER + "KO,US1912161007,USD,,20260313,20260401,100,0.51,,43.35\n");

        DividendPayment dividend = store.ledger().findAllDividends().get(0);
        assertNull(dividend.amountBase());
        assertEquals(0, new BigDecimal("43.35").compareTo(dividend.netAmount()));
    }

    @Test
    void badRow_makesFilePartial() {
        FileImportResult result = importText("dividends.csv", DIVIDEND_HEADER
            + "KESKOB,FI0009000202,EUR,1,20260320,20260401,1000,0.22,220,143\n"
            + "KESKOB,FI0009000202,EUR,1,20260320,not-a-date,1000,0.22,220,143\n");

        assertEquals("partial", result.status());
        assertEquals(1, result.created());
        assertEquals(1, result.failed());
        assertEquals(3, result.errors().get(0).lineNumber());
    }

    @Test
    void unrecognizedFile_isReportedNotRaised() {
        FileImportResult result = importText("notes.txt", "hello,world\n1,2\n");

        assertEquals("unrecognized", result.status());
        assertEquals("no header signature matched", result.reason());
        assertTrue(store.snapshots().findAll().isEmpty());
    }

    @Test
    void importFiles_directoryOnWorkerPool(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a-positions.csv"), HOLDINGS);
        Files.writeString(dir.resolve("b-dividends.csv"),
            DIVIDEND_HEADER + "KESKOB,FI0009000202,EUR,1,20260320,20260401,1000,0.22,220,143\n");
        Files.writeString(dir.resolve("c-readme.txt"), "not a report\n");
        service = newService(LedgerConfig.defaults().withImportThreads(3));

        ImportSummary summary = service.importPath(dir);

        assertEquals(3, summary.files().size());
        assertEquals("a-positions.csv", summary.files().get(0).sourceName());
        assertEquals(2, summary.created());
        assertEquals(1, summary.unrecognized().size());
        assertTrue(store.instruments().findByIsin("FI0009000202").isPresent());
    }

    @Test
    void importFile_missingFile_throwsNamingTheFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.csv");

        ImportException e = assertThrows(ImportException.class, () -> service.importFile(missing));

        assertEquals(missing.toString(), e.getSourceName());
    }
}
