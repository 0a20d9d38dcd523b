package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.Provenance;
import in.folioledger.service.ingest.csv.CsvLines;
import in.folioledger.service.ingest.csv.HeaderIndex;
import in.folioledger.service.ingest.csv.SourceLine;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Shared plumbing for report parsers: header-mapped row reading, per-row error capture
 * and provenance.
 */
public abstract class AbstractReportParser implements ReportParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractReportParser.class);

    /**
     * Tokenize the body of a single-table report. The first line is the header; any later
     * line accepted by {@code isHeader} replaces it for the rows that follow.
     */
    protected List<SectionRow> readRows(RoutedInput input, ParseContext context, ParseResult result,
                                        Predicate<List<String>> isHeader) {
        List<SectionRow> rows = new ArrayList<>();
        SourceLine headerLine = input.header();
        if (headerLine == null) {
            return rows;
        }
        HeaderIndex header = new HeaderIndex(CsvLines.split(headerLine.text(), input.delimiter()));
        logUnknownColumns(header, context);

        for (SourceLine line : input.body()) {
            List<String> cells;
            try {
                cells = CsvLines.split(line.text(), input.delimiter());
            } catch (IllegalArgumentException e) {
                result.error(null, line.number(), e.getMessage(), line.text());
                continue;
            }
            if (cells.stream().allMatch(String::isEmpty)) {
                continue;
            }
            if (isHeader.test(cells)) {
                header = new HeaderIndex(cells);
                logUnknownColumns(header, context);
                continue;
            }
            rows.add(new SectionRow(null, header, cells, line.number(), line.text()));
        }
        return rows;
    }

    protected List<SectionRow> readRows(RoutedInput input, ParseContext context, ParseResult result) {
        return readRows(input, context, result, cells -> false);
    }

    protected void eachRow(List<SectionRow> rows, ParseResult result, Consumer<SectionRow> handler) {
        Rows.each(rows, result, handler);
    }

    protected Provenance provenance(SectionRow row, ParseContext context) {
        return Provenance.of(context.sourceName(), format(), row.section(), row.lineNumber(), row.rawLine(), row.fields());
    }

    /** Column names this parser maps. Others are kept in provenance only. */
    protected Set<String> knownColumns() {
        return Set.of();
    }

    protected static String require(String value, String column) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + column);
        }
        return value;
    }

    protected static InstrumentHints.Builder hints() {
        return InstrumentHints.builder();
    }

    private void logUnknownColumns(HeaderIndex header, ParseContext context) {
        Set<String> known = knownColumns();
        if (known.isEmpty() || !log.isDebugEnabled()) return;
        List<String> unknown = header.unknownColumns(known);
        if (!unknown.isEmpty()) {
            log.debug("{} {}: unmapped columns kept in provenance: {}", format(), context.sourceName(), unknown);
        }
    }
}
