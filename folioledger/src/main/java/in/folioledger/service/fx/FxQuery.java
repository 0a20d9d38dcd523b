package in.folioledger.service.fx;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What to convert: a currency on a date, optionally with the rate the source record carried
 * and the instrument it concerns.
 */
public record FxQuery(
    String currency,
    LocalDate date,
    BigDecimal explicitRate,        // null when the record carries none
    String instrumentId             // null when not instrument-bound
) {
    public FxQuery {
        currency = currency == null ? null : currency.trim().toUpperCase();
    }

    public static FxQuery of(String currency, LocalDate date) {
        return new FxQuery(currency, date, null, null);
    }
}
