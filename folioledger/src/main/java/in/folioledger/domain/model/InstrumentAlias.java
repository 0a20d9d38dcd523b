package in.folioledger.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Maps a (symbol, exchange) pair to an instrument over a validity interval.
 *
 * Unique on (instrumentId, symbol, exchange). At most one alias per instrument is primary.
 */
public record InstrumentAlias(
    String id,
    String instrumentId,
    String symbol,
    String exchange,                // "" when the source has no venue
    LocalDate validFrom,            // null = since forever
    LocalDate validTo,              // null = still valid
    AliasSource source,
    boolean primary,
    Instant createdAt
) {
    public InstrumentAlias {
        exchange = exchange == null ? "" : exchange.trim();
        source = source == null ? AliasSource.OTHER : source;
    }

    public static InstrumentAlias create(String instrumentId, String symbol, String exchange,
                                         AliasSource source, LocalDate validFrom) {
        return new InstrumentAlias(UUID.randomUUID().toString(), instrumentId, symbol.trim(), exchange,
            validFrom, null, source, false, Instant.now());
    }

    /** Key used for idempotent upsert. */
    public String key() {
        return instrumentId + "|" + symbol.toUpperCase() + "|" + exchange.toUpperCase();
    }

    public boolean isValidOn(LocalDate date) {
        if (date == null) return validTo == null;
        return (validFrom == null || !date.isBefore(validFrom))
            && (validTo == null || !date.isAfter(validTo));
    }

    /**
     * Widen the validity interval to cover another sighting. Never narrows it.
     */
    public InstrumentAlias widenedTo(LocalDate from, LocalDate to) {
        LocalDate newFrom = validFrom;
        if (validFrom != null) {
            newFrom = from == null ? null : (from.isBefore(validFrom) ? from : validFrom);
        }
        LocalDate newTo = validTo;
        if (validTo != null) {
            newTo = to == null ? null : (to.isAfter(validTo) ? to : validTo);
        }
        return new InstrumentAlias(id, instrumentId, symbol, exchange, newFrom, newTo, source, primary, createdAt);
    }

    public InstrumentAlias withPrimary(boolean isPrimary) {
        return new InstrumentAlias(id, instrumentId, symbol, exchange, validFrom, validTo, source, isPrimary, createdAt);
    }
}
