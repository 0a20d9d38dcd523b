package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Rate to convert one unit of {@code currency} into base currency on {@code date}.
 * Unique per (date, currency).
 */
public record FxRate(
    LocalDate date,
    String currency,
    BigDecimal rate,
    String source                   // position, trade, dividend, activity, external
) {
}
