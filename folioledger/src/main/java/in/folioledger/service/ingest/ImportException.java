package in.folioledger.service.ingest;

/**
 * An import could not complete because a file could not be read or the store rejected a
 * write. Row-level problems are never raised this way; they are reported in the summary.
 */
public class ImportException extends RuntimeException {

    private final String sourceName;

    public ImportException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
