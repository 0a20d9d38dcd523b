package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical security identity.
 *
 * ISIN is the natural key and is unique across the catalog. Instruments are never deleted,
 * only enriched.
 */
public record Instrument(
    String id,                      // Internal surrogate id (UUID)
    String isin,                    // Natural key, 12 chars
    String cusip,
    String conid,                   // Broker-internal numeric id
    String figi,
    String name,
    String assetCategory,           // STK, ETF, BOND, ...
    String listingExchange,
    String currency,
    BigDecimal multiplier,          // Per-share multiplier, 1 for stocks
    String type,                    // COMMON, ADR, REIT, ...
    Map<String, String> enrichment, // sector, industry, country, dividend_rate, dividend_source ...

    Instant createdAt,
    Instant updatedAt
) {
    public Instrument {
        Objects.requireNonNull(isin, "isin");
        multiplier = multiplier == null ? BigDecimal.ONE : multiplier;
        enrichment = enrichment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(enrichment));
    }

    /**
     * New catalog entry from the hints of the first parser that saw this ISIN.
     */
    public static Instrument create(String isin, InstrumentHints hints) {
        Instant now = Instant.now();
        InstrumentHints h = hints == null ? InstrumentHints.empty() : hints;
        return new Instrument(
            UUID.randomUUID().toString(),
            isin,
            h.cusip(),
            h.conid(),
            h.figi(),
            h.name(),
            h.assetCategory(),
            h.exchange(),
            h.currency(),
            h.multiplier(),
            h.type(),
            h.enrichment(),
            now,
            now
        );
    }

    /**
     * Fill fields that are still empty from the hints. Fields already set keep their value;
     * a differing asset category or currency is reported in {@code conflicts}.
     */
    public Instrument mergeHints(InstrumentHints hints, List<String> conflicts) {
        if (hints == null) return this;

        checkConflict("asset category", assetCategory, hints.assetCategory(), conflicts);
        checkConflict("currency", currency, hints.currency(), conflicts);

        Map<String, String> mergedEnrichment = new LinkedHashMap<>(enrichment);
        hints.enrichment().forEach(mergedEnrichment::putIfAbsent);

        Instrument merged = new Instrument(
            id,
            isin,
            firstNonBlank(cusip, hints.cusip()),
            firstNonBlank(conid, hints.conid()),
            firstNonBlank(figi, hints.figi()),
            firstNonBlank(name, hints.name()),
            firstNonBlank(assetCategory, hints.assetCategory()),
            firstNonBlank(listingExchange, hints.exchange()),
            firstNonBlank(currency, hints.currency()),
            multiplier.compareTo(BigDecimal.ONE) == 0 && hints.multiplier() != null ? hints.multiplier() : multiplier,
            firstNonBlank(type, hints.type()),
            mergedEnrichment,
            createdAt,
            updatedAt
        );
        return merged.sameContent(this) ? this : merged.touched();
    }

    /**
     * Overwrite enrichment keys. Used for side lookups that are authoritative for their keys.
     */
    public Instrument withEnrichment(Map<String, String> values) {
        Map<String, String> merged = new LinkedHashMap<>(enrichment);
        merged.putAll(values);
        return new Instrument(id, isin, cusip, conid, figi, name, assetCategory, listingExchange,
            currency, multiplier, type, merged, createdAt, Instant.now());
    }

    private Instrument touched() {
        return new Instrument(id, isin, cusip, conid, figi, name, assetCategory, listingExchange,
            currency, multiplier, type, enrichment, createdAt, Instant.now());
    }

    private boolean sameContent(Instrument other) {
        return Objects.equals(cusip, other.cusip)
            && Objects.equals(conid, other.conid)
            && Objects.equals(figi, other.figi)
            && Objects.equals(name, other.name)
            && Objects.equals(assetCategory, other.assetCategory)
            && Objects.equals(listingExchange, other.listingExchange)
            && Objects.equals(currency, other.currency)
            && multiplier.compareTo(other.multiplier) == 0
            && Objects.equals(type, other.type)
            && enrichment.equals(other.enrichment);
    }

    private void checkConflict(String field, String existing, String incoming, List<String> conflicts) {
        if (conflicts == null || isBlank(existing) || isBlank(incoming)) return;
        if (!existing.equalsIgnoreCase(incoming)) {
            conflicts.add(String.format("%s %s: existing %s '%s' differs from incoming '%s'",
                isin, field, field, existing, incoming));
        }
    }

    private static String firstNonBlank(String current, String candidate) {
        return isBlank(current) ? (isBlank(candidate) ? current : candidate) : current;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
