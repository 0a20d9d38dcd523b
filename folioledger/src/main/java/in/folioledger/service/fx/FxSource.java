package in.folioledger.service.fx;

/**
 * Which strategy produced a rate.
 */
public enum FxSource {
    EXPLICIT,       // Carried on the record itself
    BASE,           // Amount already in base currency
    POSITION,       // Snapshot position in the same currency
    RATE_TABLE,     // Stored daily rate
    EXTERNAL,       // Fetched on demand, then stored
    UNCONVERTED     // No rate; excluded from totals
}
