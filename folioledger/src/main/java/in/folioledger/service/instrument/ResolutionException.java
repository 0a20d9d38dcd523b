package in.folioledger.service.instrument;

/**
 * A reference that cannot be tied to exactly one instrument. Fails the row, not the file.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message) {
        super(message);
    }
}
