package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A dividend event with gross, withholding and net on one row.
 *
 * Invariant: {@code netAmount = grossAmount + withholdingTax}, withholding stored as a
 * non-positive value.
 */
public record DividendPayment(
    String externalId,
    String instrumentId,
    LocalDate exDate,
    LocalDate payDate,
    BigDecimal grossAmount,
    BigDecimal withholdingTax,      // <= 0
    BigDecimal netAmount,
    String currency,
    BigDecimal fxRate,              // Rate to base, null when unresolved
    BigDecimal amountBase,          // netAmount * fxRate, null when unconverted
    BigDecimal quantity,
    BigDecimal perShare,
    DividendAmountType amountType,
    String description,
    Provenance provenance
) implements LedgerRecord {

    public DividendPayment withInstrumentId(String id) {
        return new DividendPayment(externalId, id, exDate, payDate, grossAmount, withholdingTax, netAmount,
            currency, fxRate, amountBase, quantity, perShare, amountType, description, provenance);
    }

    public DividendPayment withConversion(BigDecimal rate, BigDecimal base) {
        return new DividendPayment(externalId, instrumentId, exDate, payDate, grossAmount, withholdingTax,
            netAmount, currency, rate, base, quantity, perShare, amountType, description, provenance);
    }

    /** Date used for FX lookups: pay date, else ex-date. */
    public LocalDate effectiveDate() {
        return payDate != null ? payDate : exDate;
    }
}
