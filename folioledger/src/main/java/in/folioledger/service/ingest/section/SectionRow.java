package in.folioledger.service.ingest.section;

import in.folioledger.service.ingest.csv.HeaderIndex;

import java.util.List;
import java.util.Map;

/**
 * A data row of a multi-section statement, with the header that was in force for it.
 */
public record SectionRow(
    String section,
    HeaderIndex header,
    List<String> values,    // Cells after the section and discriminator columns
    int lineNumber,
    String rawLine
) {
    public SectionRow {
        values = List.copyOf(values);
    }

    public String get(String column) {
        return header.get(values, column);
    }

    public String first(String... columns) {
        return header.first(values, columns);
    }

    public boolean has(String column) {
        return header.has(column);
    }

    public Map<String, String> fields() {
        return header.toFieldMap(values);
    }
}
