package in.folioledger.domain.model;

/**
 * How a dividend amount was derived.
 */
public enum DividendAmountType {
    PER_SHARE,      // Per-share amount known from the source
    TOTAL_NET       // Only the paid total is known (payment in lieu, reports without a rate)
}
