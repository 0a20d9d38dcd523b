package in.folioledger.service.ingest.parser;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured values from free-text descriptions such as
 * {@code KESKOB(FI0009000202) Cash Dividend EUR 0.22 per Share (Ordinary Dividend)}.
 */
public final class DescriptionParser {

    private static final Pattern ISIN_IN_PARENS = Pattern.compile("\\(([A-Z]{2}[A-Z0-9]{9}[0-9])\\)");
    private static final Pattern PER_SHARE = Pattern.compile(
        "(?:Cash Dividend|Payment in Lieu of Dividend)\\s*(?:([A-Z]{3})\\s+)?([0-9]+(?:\\.[0-9]+)?)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PAYMENT_IN_LIEU = Pattern.compile("Payment in Lieu", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISIN = Pattern.compile("^[A-Z]{2}[A-Z0-9]{9}[0-9]$");

    private DescriptionParser() {}

    /** ISIN written in parentheses after the symbol, or null. */
    public static String isin(String description) {
        if (description == null) return null;
        Matcher m = ISIN_IN_PARENS.matcher(description);
        return m.find() ? m.group(1) : null;
    }

    /** Text before the opening parenthesis, trimmed, or null when there is none. */
    public static String symbol(String description) {
        if (description == null) return null;
        int paren = description.indexOf('(');
        if (paren <= 0) return null;
        String symbol = description.substring(0, paren).trim();
        return symbol.isEmpty() ? null : symbol;
    }

    /**
     * Per-share amount following "Cash Dividend" or "Payment in Lieu of Dividend",
     * optionally preceded by an ISO currency. Null when the text carries no number.
     */
    public static BigDecimal perShare(String description) {
        if (description == null) return null;
        Matcher m = PER_SHARE.matcher(description);
        if (!m.find()) return null;
        BigDecimal amount = new BigDecimal(m.group(2));
        return amount.signum() == 0 ? null : amount;
    }

    /** ISO currency in front of the per-share amount, or null. */
    public static String perShareCurrency(String description) {
        if (description == null) return null;
        Matcher m = PER_SHARE.matcher(description);
        return m.find() ? m.group(1) : null;
    }

    public static boolean isPaymentInLieu(String description) {
        return description != null && PAYMENT_IN_LIEU.matcher(description).find();
    }

    public static boolean isValidIsin(String value) {
        return value != null && ISIN.matcher(value.trim()).matches();
    }
}
