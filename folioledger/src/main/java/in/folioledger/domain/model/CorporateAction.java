package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Split, merger, spin-off, symbol change. Instrument reference is optional.
 */
public record CorporateAction(
    String externalId,
    String instrumentId,
    String actionType,
    LocalDate date,
    String description,
    BigDecimal quantity,
    BigDecimal amount,
    BigDecimal proceeds,
    String currency,
    Provenance provenance
) implements LedgerRecord {

    public CorporateAction withInstrumentId(String id) {
        return new CorporateAction(externalId, id, actionType, date, description, quantity, amount,
            proceeds, currency, provenance);
    }
}
