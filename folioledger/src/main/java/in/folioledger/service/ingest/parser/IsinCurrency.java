package in.folioledger.service.ingest.parser;

import java.util.Map;
import java.util.Set;

/**
 * Country prefix of an ISIN to the currency that country's issuers usually pay in.
 * Used when a dividend row omits its currency, and by the dividend currency audit.
 */
public final class IsinCurrency {

    public static final String DEFAULT = "EUR";

    private static final Map<String, String> BY_COUNTRY = Map.ofEntries(
        Map.entry("US", "USD"),
        Map.entry("CA", "CAD"),
        Map.entry("SE", "SEK"),
        Map.entry("FI", "EUR"),
        Map.entry("DE", "EUR"),
        Map.entry("FR", "EUR"),
        Map.entry("NL", "EUR"),
        Map.entry("BE", "EUR"),
        Map.entry("IE", "EUR"),
        Map.entry("JP", "JPY"),
        Map.entry("GB", "GBP"),
        Map.entry("HK", "HKD"),
        Map.entry("IL", "ILS"),
        Map.entry("NO", "NOK"),
        Map.entry("DK", "DKK"),
        Map.entry("AU", "AUD"),
        Map.entry("CH", "CHF")
    );

    /** Currencies a dividend may legitimately be paid in. {@code GBp} is pence. */
    public static final Set<String> KNOWN_DIVIDEND_CURRENCIES = Set.of(
        "USD", "EUR", "CAD", "GBP", "GBp", "JPY", "HKD", "NOK", "SEK", "DKK", "CHF", "AUD", "NZD", "SGD", "TWD", "ILS"
    );

    private IsinCurrency() {}

    public static String forIsin(String isin) {
        if (isin == null || isin.length() < 2) return DEFAULT;
        return BY_COUNTRY.getOrDefault(isin.substring(0, 2).toUpperCase(), DEFAULT);
    }

    /**
     * Whether {@code currency} is plausible for the issuer country. Unknown countries and
     * USD (widely used by foreign issuers and ADRs) are always plausible.
     */
    public static boolean isPlausible(String isin, String currency) {
        if (isin == null || currency == null || isin.length() < 2) return true;
        String expected = BY_COUNTRY.get(isin.substring(0, 2).toUpperCase());
        if (expected == null || "USD".equals(currency)) return true;
        if ("GBP".equals(expected) && "GBp".equals(currency)) return true;
        return expected.equalsIgnoreCase(currency);
    }
}
