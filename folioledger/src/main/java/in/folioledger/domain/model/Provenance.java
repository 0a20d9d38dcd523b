package in.folioledger.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a ledger record came from.
 *
 * {@code rawRow} is the source line verbatim; {@code fields} maps every header of that line
 * (known or not) to its value, in column order. Records merged from several source rows
 * (dividend + withholding) keep the extra lines in {@code relatedRows}.
 */
public record Provenance(
    String sourceName,
    FormatTag format,
    String section,                 // null for single-section formats
    int lineNumber,                 // 1-based line in the decoded file
    String rawRow,
    Map<String, String> fields,
    List<String> relatedRows
) {
    public Provenance {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        relatedRows = relatedRows == null ? List.of() : List.copyOf(relatedRows);
    }

    public static Provenance of(String sourceName, FormatTag format, String section,
                                int lineNumber, String rawRow, Map<String, String> fields) {
        return new Provenance(sourceName, format, section, lineNumber, rawRow, fields, List.of());
    }

    public Provenance withRelated(String relatedRow) {
        List<String> related = new ArrayList<>(relatedRows);
        related.add(relatedRow);
        return new Provenance(sourceName, format, section, lineNumber, rawRow, fields, related);
    }

    /** All source lines that contributed to the record, primary row first. */
    public List<String> allRows() {
        List<String> rows = new ArrayList<>();
        rows.add(rawRow);
        rows.addAll(relatedRows);
        return rows;
    }
}
