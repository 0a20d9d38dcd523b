package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Non-trade cash movement. Amount is signed as it hits the account.
 */
public record CashFlow(
    String externalId,
    CashFlowType flowType,
    LocalDate date,
    BigDecimal amount,
    String currency,
    BigDecimal fxRate,
    BigDecimal amountBase,
    String description,
    String source,
    Provenance provenance
) implements LedgerRecord {

    public CashFlow withConversion(BigDecimal rate, BigDecimal base) {
        return new CashFlow(externalId, flowType, date, amount, currency, rate, base, description, source, provenance);
    }
}
