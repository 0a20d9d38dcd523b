package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Closed position from a transaction history that may predate the catalog.
 *
 * Linked to the catalog only by ISIN. A missing catalog entry is an audit finding and is
 * never repaired on import.
 */
public record SoldPosition(
    String externalId,
    String isin,
    String symbol,
    LocalDate saleDate,
    BigDecimal quantity,
    BigDecimal purchasePrice,
    BigDecimal salePrice,
    BigDecimal realizedPnl,
    String currency,
    Provenance provenance
) implements LedgerRecord {
}
