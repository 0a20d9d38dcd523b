package in.folioledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whatever a parser learned about an instrument besides its natural key.
 *
 * Used to create the catalog entry, fill its empty fields and record the symbol alias.
 */
public record InstrumentHints(
    String symbol,
    String exchange,
    String name,
    String assetCategory,
    String currency,
    String cusip,
    String conid,
    String figi,
    BigDecimal multiplier,
    String type,
    AliasSource source,
    LocalDate seenOn,               // Date of the row that mentioned the symbol
    Map<String, String> enrichment
) {
    public InstrumentHints {
        source = source == null ? AliasSource.OTHER : source;
        enrichment = enrichment == null ? Map.of() : Map.copyOf(enrichment);
    }

    public static InstrumentHints empty() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String symbol;
        private String exchange;
        private String name;
        private String assetCategory;
        private String currency;
        private String cusip;
        private String conid;
        private String figi;
        private BigDecimal multiplier;
        private String type;
        private AliasSource source;
        private LocalDate seenOn;
        private final Map<String, String> enrichment = new LinkedHashMap<>();

        public Builder symbol(String symbol) { this.symbol = blankToNull(symbol); return this; }
        public Builder exchange(String exchange) { this.exchange = blankToNull(exchange); return this; }
        public Builder name(String name) { this.name = blankToNull(name); return this; }
        public Builder assetCategory(String assetCategory) { this.assetCategory = blankToNull(assetCategory); return this; }
        public Builder currency(String currency) { this.currency = blankToNull(currency); return this; }
        public Builder cusip(String cusip) { this.cusip = blankToNull(cusip); return this; }
        public Builder conid(String conid) { this.conid = blankToNull(conid); return this; }
        public Builder figi(String figi) { this.figi = blankToNull(figi); return this; }
        public Builder multiplier(BigDecimal multiplier) { this.multiplier = multiplier; return this; }
        public Builder type(String type) { this.type = blankToNull(type); return this; }
        public Builder source(AliasSource source) { this.source = source; return this; }
        public Builder seenOn(LocalDate seenOn) { this.seenOn = seenOn; return this; }

        public Builder enrichment(String key, String value) {
            if (value != null && !value.isBlank()) {
                enrichment.put(key, value);
            }
            return this;
        }

        public InstrumentHints build() {
            return new InstrumentHints(symbol, exchange, name, assetCategory, currency, cusip, conid,
                figi, multiplier, type, source, seenOn, enrichment);
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
