package in.folioledger.service.audit;

import in.folioledger.config.ToleranceBand;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger-derived account value against the broker-reported one.
 *
 * {@code components} lists every term of the derivation in base currency, in the order
 * they are summed. {@code callouts} names the deltas the ledger cannot explain (unconverted
 * amounts, untracked FX on foreign cash, missing opening unrealized P&amp;L).
 */
public record BalanceResult(
    Verdict verdict,
    BigDecimal derivedValue,
    BigDecimal reportedValue,
    LocalDate reportedDate,
    BigDecimal differencePercent,
    ToleranceBand band,
    Map<String, BigDecimal> components,
    List<String> callouts
) {
    public enum Verdict { PASS, WARNING, FAIL }

    public BalanceResult {
        components = components == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(components));
        callouts = callouts == null ? List.of() : List.copyOf(callouts);
    }

    /**
     * Verdict for a deviation. Widening the band never makes the verdict worse.
     */
    public static Verdict classify(BigDecimal differencePercent, ToleranceBand band) {
        if (differencePercent.compareTo(band.warnPercent()) <= 0) return Verdict.PASS;
        if (differencePercent.compareTo(band.failPercent()) <= 0) return Verdict.WARNING;
        return Verdict.FAIL;
    }
}
