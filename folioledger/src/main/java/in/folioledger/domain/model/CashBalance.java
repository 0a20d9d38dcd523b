package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cash held in one currency at the end of a reporting period.
 */
public record CashBalance(
    String externalId,
    LocalDate periodEnd,
    String currency,                // "BASE" rows are stored under the base currency with baseSummary=true
    BigDecimal startingCash,
    BigDecimal endingCash,
    boolean baseSummary,
    String source,
    Provenance provenance
) implements LedgerRecord {
}
