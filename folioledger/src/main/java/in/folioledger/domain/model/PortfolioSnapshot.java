package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Holdings as reported on one date by one source.
 */
public record PortfolioSnapshot(
    String externalId,
    LocalDate reportDate,
    String source,
    BigDecimal totalValue,          // Sum of converted position values, base currency
    BigDecimal totalUnrealizedPnl,  // Base currency, null when no position reports it
    List<Position> positions,
    Provenance provenance
) implements LedgerRecord {

    public PortfolioSnapshot {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public PortfolioSnapshot withPositions(List<Position> resolved) {
        return new PortfolioSnapshot(externalId, reportDate, source, totalValue, totalUnrealizedPnl, resolved, provenance);
    }

    public PortfolioSnapshot withTotals(BigDecimal total, BigDecimal unrealized) {
        return new PortfolioSnapshot(externalId, reportDate, source, total, unrealized, positions, provenance);
    }
}
