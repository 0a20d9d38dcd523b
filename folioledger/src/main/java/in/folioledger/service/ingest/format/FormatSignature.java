package in.folioledger.service.ingest.format;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.csv.CsvLines;
import in.folioledger.service.ingest.csv.SourceLine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A header predicate that identifies one report type.
 */
public record FormatSignature(FormatTag format, String description, Predicate<Probe> predicate) {

    /** Lines scanned when a signature looks past the first header. */
    static final int SCAN_LIMIT = 500;

    public boolean matches(Probe probe) {
        return predicate.test(probe);
    }

    public static FormatSignature columns(FormatTag format, String... required) {
        return new FormatSignature(format, "columns " + String.join("+", required),
            probe -> probe.headerHasAll(required));
    }

    /**
     * What the signatures look at: the first line, its columns, and the following lines
     * for formats whose distinctive header is not the first one.
     */
    public static final class Probe {
        private final String headerLine;
        private final char delimiter;
        private final Set<String> headerColumns;
        private final List<SourceLine> lines;

        public Probe(String headerLine, char delimiter, List<SourceLine> lines) {
            this.headerLine = headerLine.trim();
            this.delimiter = delimiter;
            this.headerColumns = tokenize(this.headerLine, delimiter);
            this.lines = lines;
        }

        public String headerLine() {
            return headerLine;
        }

        public char delimiter() {
            return delimiter;
        }

        public boolean headerHasAll(String... required) {
            for (String column : required) {
                if (!headerColumns.contains(column)) return false;
            }
            return true;
        }

        /** True when any of the first {@link #SCAN_LIMIT} lines has all the columns. */
        public boolean anyLineHasAll(String... required) {
            int limit = Math.min(lines.size(), SCAN_LIMIT);
            for (int i = 0; i < limit; i++) {
                String text = lines.get(i).text();
                boolean candidate = true;
                for (String column : required) {
                    if (!text.contains(column)) {
                        candidate = false;
                        break;
                    }
                }
                if (candidate && tokenize(text, delimiter).containsAll(List.of(required))) {
                    return true;
                }
            }
            return false;
        }

        private static Set<String> tokenize(String line, char delimiter) {
            try {
                return new HashSet<>(CsvLines.split(line, delimiter));
            } catch (IllegalArgumentException e) {
                // Unbalanced quotes in a header: fall back to a plain split
                Set<String> columns = new HashSet<>();
                for (String part : line.split(String.valueOf(delimiter))) {
                    columns.add(part.replace("\"", "").trim());
                }
                return columns;
            }
        }
    }
}
