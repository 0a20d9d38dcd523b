package in.folioledger.service.ingest.csv;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Line tokenizer for the supported dialects.
 *
 * Lines are tokenized one at a time so that every record keeps its verbatim source text.
 * Comma dialect honours double quotes; the tab dialect has no quoting.
 */
public final class CsvLines {

    private static final CSVFormat COMMA = CSVFormat.DEFAULT.builder()
        .setDelimiter(',')
        .setQuote('"')
        .setIgnoreEmptyLines(false)
        .build();

    private static final CSVFormat TAB = CSVFormat.DEFAULT.builder()
        .setDelimiter('\t')
        .setQuote(null)
        .setIgnoreEmptyLines(false)
        .build();

    private CsvLines() {}

    /**
     * Split one line into trimmed cells.
     *
     * @throws IllegalArgumentException when quoting is malformed
     */
    public static List<String> split(String line, char delimiter) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        CSVFormat format = delimiter == '\t' ? TAB : COMMA;
        try (CSVParser parser = CSVParser.parse(line, format)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                return List.of();
            }
            List<String> cells = new ArrayList<>();
            for (String value : records.get(0)) {
                cells.add(value == null ? "" : value.trim());
            }
            return cells;
        } catch (IOException | UncheckedIOException e) {
            throw new IllegalArgumentException("Malformed delimited line: " + e.getMessage(), e);
        }
    }

    public static List<String> split(String line) {
        return split(line, ',');
    }

    /**
     * Guess the delimiter from a header line: tab when it has more tabs than commas.
     */
    public static char detectDelimiter(String headerLine) {
        long tabs = headerLine.chars().filter(c -> c == '\t').count();
        long commas = headerLine.chars().filter(c -> c == ',').count();
        return tabs > commas ? '\t' : ',';
    }
}
