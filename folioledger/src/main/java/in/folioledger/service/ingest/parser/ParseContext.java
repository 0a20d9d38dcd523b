package in.folioledger.service.ingest.parser;

/**
 * Per-file parsing context.
 */
public record ParseContext(String sourceName, String baseCurrency) {
}
