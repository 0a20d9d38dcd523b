package in.folioledger.service.ingest.parser;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Cell value parsing shared by all parsers.
 *
 * Blank cells parse to null. Unparseable non-blank cells throw
 * {@link IllegalArgumentException} so the caller can report the row.
 */
public final class Fields {

    private static final DateTimeFormatter BASIC = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter STATEMENT_PERIOD = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final List<DateTimeFormatter> OTHER_DATES = List.of(
        DateTimeFormatter.ofPattern("dd.MM.yyyy"),
        DateTimeFormatter.ofPattern("d.M.yyyy"),
        DateTimeFormatter.ofPattern("MM/dd/yyyy"),
        STATEMENT_PERIOD
    );

    private Fields() {}

    /**
     * Decimal with optional thousands separators: {@code 1,234.50}, {@code -0.5}, {@code 12}.
     */
    public static BigDecimal decimal(String value) {
        if (isBlank(value) || "--".equals(value.trim())) return null;
        String normalized = value.trim().replace(",", "").replace(" ", "").replace("\u00A0", "");
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount '" + value + "'", e);
        }
    }

    /**
     * Decimal with a decimal comma and space grouping: {@code 1 234,50}, {@code -77,00}.
     */
    public static BigDecimal decimalComma(String value) {
        if (isBlank(value)) return null;
        String normalized = value.trim()
            .replace(" ", "")
            .replace("\u00A0", "")
            .replace("\u202F", "");
        if (normalized.indexOf(',') >= 0) {
            normalized = normalized.replace(".", "").replace(',', '.');
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount '" + value + "'", e);
        }
    }

    /**
     * Zero when blank, otherwise {@link #decimal(String)}.
     */
    public static BigDecimal decimalOrZero(String value) {
        BigDecimal parsed = decimal(value);
        return parsed == null ? BigDecimal.ZERO : parsed;
    }

    /**
     * Accepts {@code yyyyMMdd}, ISO dates, date-time forms such as {@code 2026-01-08, 07:42:02}
     * or {@code 20260108;074202}, {@code dd.MM.yyyy} and {@code January 8, 2026}.
     */
    public static LocalDate date(String value) {
        if (isBlank(value)) return null;
        String v = value.trim();
        String datePart = v;
        int cut = indexOfAny(v, ',', ';', ' ', 'T');
        if (cut > 0 && Character.isDigit(v.charAt(0))) {
            datePart = v.substring(0, cut);
        }
        try {
            if (datePart.length() == 8 && datePart.chars().allMatch(Character::isDigit)) {
                return LocalDate.parse(datePart, BASIC);
            }
            if (datePart.length() == 10 && datePart.charAt(4) == '-') {
                return LocalDate.parse(datePart);
            }
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + value + "'", e);
        }
        for (DateTimeFormatter formatter : OTHER_DATES) {
            try {
                return LocalDate.parse(formatter == STATEMENT_PERIOD ? v : datePart, formatter);
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        throw new IllegalArgumentException("Invalid date '" + value + "'");
    }

    /**
     * Time part of a combined value ({@code 2026-01-08, 07:42:02}); null when absent.
     */
    public static LocalTime time(String value) {
        if (isBlank(value)) return null;
        String v = value.trim();
        int cut = indexOfAny(v, ',', ';', ' ', 'T');
        if (cut < 0) return null;
        String timePart = v.substring(cut + 1).trim();
        if (timePart.isEmpty()) return null;
        try {
            if (timePart.length() == 6 && timePart.chars().allMatch(Character::isDigit)) {
                return LocalTime.parse(timePart, DateTimeFormatter.ofPattern("HHmmss"));
            }
            return LocalTime.parse(timePart);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Period end from a statement period such as {@code January 1, 2026 - January 31, 2026}.
     */
    public static LocalDate periodEnd(String period) {
        if (isBlank(period)) return null;
        int dash = period.lastIndexOf(" - ");
        return date(dash >= 0 ? period.substring(dash + 3) : period);
    }

    public static LocalDate periodStart(String period) {
        if (isBlank(period)) return null;
        int dash = period.indexOf(" - ");
        return date(dash >= 0 ? period.substring(0, dash) : period);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String upper(String value) {
        return isBlank(value) ? null : value.trim().toUpperCase();
    }

    private static int indexOfAny(String s, char... chars) {
        for (int i = 0; i < s.length(); i++) {
            for (char c : chars) {
                if (s.charAt(i) == c) return i;
            }
        }
        return -1;
    }
}
