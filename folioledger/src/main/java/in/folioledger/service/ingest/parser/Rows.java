package in.folioledger.service.ingest.parser;

import in.folioledger.service.ingest.section.SectionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Per-row error capture.
 */
public final class Rows {
    private static final Logger log = LoggerFactory.getLogger(Rows.class);

    private Rows() {}

    /**
     * Apply {@code handler} to each row; a row that throws {@link IllegalArgumentException}
     * (bad date, bad amount, missing key) is reported in {@code result} and skipped.
     */
    public static void each(List<SectionRow> rows, ParseResult result, Consumer<SectionRow> handler) {
        for (SectionRow row : rows) {
            try {
                handler.accept(row);
            } catch (IllegalArgumentException | ArithmeticException e) {
                log.debug("Skipping {} line {}: {}", result.sourceName(), row.lineNumber(), e.getMessage());
                result.error(row.section(), row.lineNumber(), e.getMessage(), row.rawLine());
            }
        }
    }
}
