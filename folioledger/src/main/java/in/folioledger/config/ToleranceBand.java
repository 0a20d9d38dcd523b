package in.folioledger.config;

import java.math.BigDecimal;

/**
 * Percentage thresholds for the balance check.
 *
 * A deviation at or below {@code warnPercent} passes, at or below {@code failPercent} warns,
 * anything larger fails.
 */
public record ToleranceBand(
    BigDecimal warnPercent,   // e.g. 1.0 = 1%
    BigDecimal failPercent    // e.g. 5.0 = 5%
) {
    public ToleranceBand {
        if (warnPercent == null || failPercent == null) {
            throw new IllegalArgumentException("Tolerance percentages are required");
        }
        if (warnPercent.signum() < 0 || failPercent.compareTo(warnPercent) < 0) {
            throw new IllegalArgumentException(
                "Invalid tolerance band: warn=" + warnPercent + " fail=" + failPercent);
        }
    }

    public static ToleranceBand of(String warnPercent, String failPercent) {
        return new ToleranceBand(new BigDecimal(warnPercent), new BigDecimal(failPercent));
    }

    /** Cash accounts. */
    public static ToleranceBand standard() {
        return of("1.0", "5.0");
    }

    /** Leveraged accounts, where borrowing cost and margin interest blur the picture. */
    public static ToleranceBand margin() {
        return of("2.0", "10.0");
    }
}
