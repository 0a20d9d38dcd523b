package in.folioledger.service.ingest.format;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.csv.CsvLines;
import in.folioledger.service.ingest.csv.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies raw report content by its header signature.
 *
 * Signatures are tested most specific first and the first match wins. The file name is
 * never consulted. Repeated header lines, which some exporters re-insert mid-file, are
 * removed before classification and are not passed on to parsers.
 *
 * Routing never throws: empty, binary or undecodable input comes back as
 * {@link FormatTag#UNRECOGNIZED} with a reason.
 */
public final class FormatRouter {
    private static final Logger log = LoggerFactory.getLogger(FormatRouter.class);

    private static final List<FormatSignature> SIGNATURES = List.of(
        new FormatSignature(FormatTag.MULTI_SECTION_STATEMENT, "starts with Statement,",
            probe -> probe.headerLine().startsWith("Statement,") || probe.headerLine().startsWith("\"Statement\",")),
        FormatSignature.columns(FormatTag.TRANSACTION_EXPORT, "Tapahtumatyyppi", "ISIN", "Summa"),
        FormatSignature.columns(FormatTag.HOLDINGS_SNAPSHOT, "MarkPrice", "PositionValue"),
        FormatSignature.columns(FormatTag.DIVIDEND_REPORT, "GrossRate", "NetAmount"),
        // Activity files open with an account summary block, so the transaction header is searched for
        new FormatSignature(FormatTag.ACTIVITY_ACTIONS, "any header with ActivityCode+TransactionID",
            probe -> probe.anyLineHasAll("ActivityCode", "TransactionID")),
        FormatSignature.columns(FormatTag.CASH_SUMMARY, "ClientAccountID", "StartingCash", "EndingCash"),
        FormatSignature.columns(FormatTag.TRADE_REPORT, "TradeID", "Buy/Sell")
    );

    public RoutedInput route(byte[] content) {
        try {
            String text = TextDecoder.decode(content);
            if (text.isBlank()) {
                return RoutedInput.unrecognized("empty input", List.of());
            }
            if (TextDecoder.looksBinary(text)) {
                return RoutedInput.unrecognized("binary content, extract tabular text first", List.of());
            }
            return route(TextDecoder.lines(text));
        } catch (RuntimeException e) {
            log.warn("Unable to decode input: {}", e.getMessage());
            return RoutedInput.unrecognized("undecodable input: " + e.getMessage(), List.of());
        }
    }

    public RoutedInput route(List<SourceLine> lines) {
        if (lines.isEmpty()) {
            return RoutedInput.unrecognized("empty input", lines);
        }

        List<SourceLine> cleaned = stripDuplicateHeaders(lines);
        String header = cleaned.get(0).text();
        char delimiter = CsvLines.detectDelimiter(header);
        FormatSignature.Probe probe = new FormatSignature.Probe(header, delimiter, cleaned);

        for (FormatSignature signature : SIGNATURES) {
            if (signature.matches(probe)) {
                log.debug("Matched {} ({}), {} lines", signature.format(), signature.description(), cleaned.size());
                return new RoutedInput(signature.format(), delimiter, cleaned, null);
            }
        }
        return RoutedInput.unrecognized("no header signature matched", cleaned);
    }

    /**
     * Drop every later line identical (after trimming) to the first line.
     */
    public static List<SourceLine> stripDuplicateHeaders(List<SourceLine> lines) {
        if (lines.isEmpty()) return lines;
        String header = lines.get(0).text().trim();
        List<SourceLine> result = new ArrayList<>(lines.size());
        result.add(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            if (!lines.get(i).text().trim().equals(header)) {
                result.add(lines.get(i));
            }
        }
        return result;
    }

    /** Signatures in priority order. */
    public List<FormatSignature> signatures() {
        return SIGNATURES;
    }
}
