package in.folioledger.domain.model;

/**
 * Unresolved reference from a parsed row to an instrument.
 *
 * {@code isin} is preferred; when a source omits it the resolver falls back to the
 * symbol in {@code hints}.
 */
public record InstrumentRef(String isin, InstrumentHints hints) {

    public InstrumentRef {
        isin = isin == null || isin.isBlank() ? null : isin.trim().toUpperCase();
        hints = hints == null ? InstrumentHints.empty() : hints;
    }

    public static InstrumentRef of(String isin, InstrumentHints hints) {
        return new InstrumentRef(isin, hints);
    }

    public boolean hasIsin() {
        return isin != null;
    }

    /** Stable grouping key used before resolution (pairing, hashing). */
    public String naturalKey() {
        if (isin != null) return isin;
        return hints.symbol() != null ? "SYM:" + hints.symbol().toUpperCase() : "UNKNOWN";
    }
}
