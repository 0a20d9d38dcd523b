package in.folioledger.service.ingest.format;

import in.folioledger.domain.model.FormatTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatRouter")
class FormatRouterTest {

    private FormatRouter router;

    @BeforeEach
    void setUp() {
        router = new FormatRouter();
    }

    private RoutedInput route(String text) {
        return router.route(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("holdings snapshot is recognized by MarkPrice and PositionValue")
    void route_holdingsSnapshot() {
        RoutedInput input = route("""
            ReportDate,Symbol,ISIN,Quantity,MarkPrice,PositionValue
            20260128,KESKOB,FI0009000202,100,20.5,2050
            """);

        assertEquals(FormatTag.HOLDINGS_SNAPSHOT, input.format());
        assertEquals(',', input.delimiter());
        assertEquals(2, input.lines().size());
    }

    @Test
    void route_dividendReport() {
        RoutedInput input = route("Symbol,ISIN,PayDate,GrossRate,NetAmount\nKO,US1912161007,20260401,0.51,43.35\n");
        assertEquals(FormatTag.DIVIDEND_REPORT, input.format());
    }

    @Test
    void route_tradeReport() {
        RoutedInput input = route("TradeID,Symbol,TradeDate,Quantity,TradePrice,Buy/Sell\n1,KO,20260105,10,60,BUY\n");
        assertEquals(FormatTag.TRADE_REPORT, input.format());
    }

    @Test
    void route_cashSummary() {
        RoutedInput input = route("ClientAccountID,CurrencyPrimary,ToDate,StartingCash,EndingCash\nU1,EUR,20260131,100,200\n");
        assertEquals(FormatTag.CASH_SUMMARY, input.format());
    }

    @Test
    @DisplayName("activity report is recognized by a transaction header below the summary block")
    void route_activityActions_headerAfterSummary() {
        RoutedInput input = route("""
            ClientAccountID,CurrencyPrimary,LevelOfDetail,FromDate,ToDate,StartingCash,EndingCash
            U1,BASE_SUMMARY,BaseCurrency,20260101,20260131,1000,1100
            ClientAccountID,CurrencyPrimary,Date,ActivityCode,TransactionID,Amount
            U1,EUR,20260110,DEP,555,100
            """);

        assertEquals(FormatTag.ACTIVITY_ACTIONS, input.format(),
            "Activity signature must win over the cash summary columns of the first line");
    }

    @Test
    void route_multiSectionStatement() {
        RoutedInput input = route("""
            Statement,Header,Field Name,Field Value
            Statement,Data,Period,"January 1, 2026 - January 31, 2026"
            """);
        assertEquals(FormatTag.MULTI_SECTION_STATEMENT, input.format());
    }

    @Test
    @DisplayName("UTF-16LE tab separated export with BOM")
    void route_transactionExport_utf16WithBom() {
        String text = "Id\tKirjauspäivä\tTapahtumatyyppi\tArvopaperi\tISIN\tSumma\tValuutta\r\n"
            + "1\t2026-01-28\tOSINKO\tKesko B\tFI0009000202\t143,00\tEUR\r\n";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes(new byte[] {(byte) 0xFF, (byte) 0xFE});
        bytes.writeBytes(text.getBytes(StandardCharsets.UTF_16LE));

        RoutedInput input = router.route(bytes.toByteArray());

        assertEquals(FormatTag.TRANSACTION_EXPORT, input.format());
        assertEquals('\t', input.delimiter());
        assertTrue(input.header().text().startsWith("Id\t"), "BOM must be stripped");
    }

    @Test
    void route_transactionExport_utf16WithoutBom() {
        String text = "Id\tTapahtumatyyppi\tISIN\tSumma\n1\tTALLETUS\t\t100\n";
        RoutedInput input = router.route(text.getBytes(StandardCharsets.UTF_16LE));
        assertEquals(FormatTag.TRANSACTION_EXPORT, input.format());
    }

    @Test
    void route_utf8Bom_isStripped() {
        byte[] body = "TradeID,Buy/Sell\n1,BUY\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[body.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(body, 0, content, 3, body.length);

        RoutedInput input = router.route(content);

        assertEquals(FormatTag.TRADE_REPORT, input.format());
        assertEquals("TradeID,Buy/Sell", input.header().text());
    }

    @Test
    @DisplayName("file name plays no part: unknown columns are unrecognized")
    void route_unknownHeader_unrecognized() {
        RoutedInput input = route("foo,bar,baz\n1,2,3\n");

        assertFalse(input.isRecognized());
        assertEquals("no header signature matched", input.reason());
    }

    @Test
    void route_emptyInput_unrecognized() {
        assertEquals("empty input", router.route(new byte[0]).reason());
        assertEquals("empty input", route("\n  \n").reason());
    }

    @Test
    void route_pdf_unrecognizedAsBinary() {
        RoutedInput input = route("%PDF-1.7\n%âãÏÓ\n");

        assertEquals(FormatTag.UNRECOGNIZED, input.format());
        assertTrue(input.reason().startsWith("binary"));
    }

    @Test
    @DisplayName("repeated header lines are removed, line numbers are kept")
    void route_duplicateHeaders_stripped() {
        RoutedInput input = route("""
            TradeID,Symbol,Buy/Sell
            1,KO,BUY

            TradeID,Symbol,Buy/Sell
            2,KO,SELL
            """);

        assertEquals(3, input.lines().size());
        assertEquals(2, input.body().size());
        assertEquals(5, input.body().get(1).number());
    }
}
