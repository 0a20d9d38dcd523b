package in.folioledger.service.fx;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * A rate to base (base amount = amount x rate) and where it came from.
 */
public record FxResolution(
    BigDecimal rate,                // null when unconverted
    FxSource source,
    LocalDate rateDate              // Date of the observation used, null for EXPLICIT/BASE
) {
    static final int SCALE = 6;

    public static FxResolution of(BigDecimal rate, FxSource source, LocalDate rateDate) {
        return new FxResolution(rate, source, rateDate);
    }

    public static FxResolution unconverted() {
        return new FxResolution(null, FxSource.UNCONVERTED, null);
    }

    public boolean isResolved() {
        return source != FxSource.UNCONVERTED;
    }

    /**
     * Base-currency amount, or null when unconverted.
     */
    public BigDecimal convert(BigDecimal amount) {
        if (amount == null || !isResolved()) {
            return null;
        }
        if (source == FxSource.BASE) {
            return amount;
        }
        return amount.multiply(rate).setScale(SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
