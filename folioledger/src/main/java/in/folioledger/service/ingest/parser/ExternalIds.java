package in.folioledger.service.ingest.parser;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.StringJoiner;

/**
 * Deterministic deduplication keys.
 *
 * Native ids are namespaced by source; everything else hashes a stable tuple of business
 * fields. Amounts are normalized so {@code 220}, {@code 220.0} and {@code 220.00} hash
 * identically.
 */
public final class ExternalIds {

    private static final int HASH_LENGTH = 32;

    private ExternalIds() {}

    public static String nativeId(String source, String kind, String id) {
        return source + ":" + kind + ":" + id.trim();
    }

    /**
     * First 32 hex chars of SHA-256 over the colon-joined parts. Nulls hash as empty.
     */
    public static String hash(Object... parts) {
        StringJoiner joiner = new StringJoiner(":");
        for (Object part : parts) {
            joiner.add(normalize(part));
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(joiner.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalize(Object part) {
        if (part == null) return "";
        if (part instanceof BigDecimal) {
            BigDecimal d = (BigDecimal) part;
            return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
        }
        if (part instanceof LocalDate) {
            return part.toString();
        }
        return part.toString().trim();
    }
}
