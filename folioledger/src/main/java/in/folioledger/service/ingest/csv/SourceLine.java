package in.folioledger.service.ingest.csv;

/**
 * One decoded line with its 1-based position in the file.
 */
public record SourceLine(int number, String text) {
}
