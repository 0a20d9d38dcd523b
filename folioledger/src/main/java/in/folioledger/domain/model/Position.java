package in.folioledger.domain.model;

import java.math.BigDecimal;

/**
 * One holding line inside a {@link PortfolioSnapshot}.
 */
public record Position(
    String instrumentId,
    String symbol,
    String isin,
    String currency,
    BigDecimal quantity,
    BigDecimal markPrice,
    BigDecimal positionValue,       // In position currency
    BigDecimal costBasisPrice,
    BigDecimal costBasisMoney,
    BigDecimal unrealizedPnl,
    BigDecimal fxRateToBase,
    String assetClass,
    String listingExchange,
    Provenance provenance
) {
    public Position withInstrumentId(String id) {
        return new Position(id, symbol, isin, currency, quantity, markPrice, positionValue, costBasisPrice,
            costBasisMoney, unrealizedPnl, fxRateToBase, assetClass, listingExchange, provenance);
    }
}
