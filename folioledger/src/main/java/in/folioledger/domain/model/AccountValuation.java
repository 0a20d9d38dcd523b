package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Broker-reported account value over a period, used as the external reference for the
 * balance check.
 */
public record AccountValuation(
    String externalId,
    LocalDate periodStart,
    LocalDate periodEnd,
    BigDecimal startingValue,
    BigDecimal endingValue,
    String currency,
    String source,
    Provenance provenance
) implements LedgerRecord {
}
