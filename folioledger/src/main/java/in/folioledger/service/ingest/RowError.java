package in.folioledger.service.ingest;

/**
 * A row that could not be turned into a ledger record. The rest of the file continues.
 */
public record RowError(
    String sourceName,
    String section,         // null for single-section formats
    int lineNumber,
    String message,
    String rawRow
) {
    @Override
    public String toString() {
        String where = section == null ? sourceName : sourceName + "/" + section;
        return where + ":" + lineNumber + " " + message;
    }
}
