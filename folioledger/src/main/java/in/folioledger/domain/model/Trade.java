package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * An execution. Quantity is signed: positive buys, negative sells.
 */
public record Trade(
    String externalId,
    String instrumentId,            // null until resolved
    LocalDate tradeDate,
    LocalTime tradeTime,
    LocalDate settlementDate,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal amount,              // Gross cash effect, negative for buys
    BigDecimal commission,          // Negative = cost
    String currency,
    BigDecimal fxRate,              // Rate to base, when the source carries it
    String assetCategory,
    String exchange,
    String description,
    BigDecimal realizedPnl,
    Provenance provenance
) implements LedgerRecord {

    public Trade withInstrumentId(String id) {
        return new Trade(externalId, id, tradeDate, tradeTime, settlementDate, quantity, price, amount,
            commission, currency, fxRate, assetCategory, exchange, description, realizedPnl, provenance);
    }

    public boolean isBuy() {
        return quantity != null && quantity.signum() > 0;
    }
}
