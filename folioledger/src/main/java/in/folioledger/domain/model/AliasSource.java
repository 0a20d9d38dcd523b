package in.folioledger.domain.model;

/**
 * Who told us a symbol belongs to an instrument.
 *
 * Higher priority wins primary-alias election. Enrichment lookups are more authoritative
 * than anything a broker report prints in its symbol column.
 */
public enum AliasSource {
    MANUAL("manual", 100),
    ENRICHMENT("finnhub", 90),
    SYMBOL_MAPPING("symbol_mapping", 80),
    IBKR_ACTIVITY_STATEMENT("ibkr_activity_statement", 50),
    IBKR_FLEX("ibkr_flex", 50),
    NORDNET("nordnet", 40),
    OTHER("other", 10);

    private final String code;
    private final int priority;

    AliasSource(String code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    public String code() {
        return code;
    }

    public int priority() {
        return priority;
    }

    public static AliasSource fromCode(String code) {
        if (code == null) return OTHER;
        for (AliasSource source : values()) {
            if (source.code.equalsIgnoreCase(code) || source.name().equalsIgnoreCase(code)) {
                return source;
            }
        }
        return OTHER;
    }
}
