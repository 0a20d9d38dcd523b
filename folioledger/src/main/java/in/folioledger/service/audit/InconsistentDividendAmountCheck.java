package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-share dividends more than ten times away from the median of the same instrument, which
 * points at a total misread as a rate or at a split that was never applied.
 *
 * The median is taken over the five years before the instrument's latest payment, so that
 * pre-split history does not skew it. Outliers above the median are warnings; those below are
 * informational since they are usually supplemental dividends.
 */
public final class InconsistentDividendAmountCheck implements IntegrityCheck {

    public static final String ID = "inconsistent_amounts_per_stock";

    static final BigDecimal FACTOR = BigDecimal.TEN;
    static final int MEDIAN_WINDOW_YEARS = 5;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        Map<String, List<DividendPayment>> byInstrument = new LinkedHashMap<>();
        for (DividendPayment dividend : ledger.dividends()) {
            if (dividend.amountType() == DividendAmountType.PER_SHARE && dividend.perShare() != null
                    && dividend.instrumentId() != null && dividend.effectiveDate() != null) {
                byInstrument.computeIfAbsent(dividend.instrumentId(), k -> new ArrayList<>()).add(dividend);
            }
        }

        List<RecordRef> high = new ArrayList<>();
        List<RecordRef> low = new ArrayList<>();
        for (List<DividendPayment> group : byInstrument.values()) {
            if (group.size() < 2) {
                continue;
            }
            BigDecimal median = median(group);
            if (median.signum() <= 0) {
                continue;
            }
            for (DividendPayment dividend : group) {
                BigDecimal amount = dividend.perShare();
                if (amount.compareTo(median.multiply(FACTOR)) > 0) {
                    high.add(RecordRef.of("dividend", dividend.externalId()));
                } else if (median.compareTo(amount.multiply(FACTOR)) > 0) {
                    low.add(RecordRef.of("dividend", dividend.externalId()));
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d per-share dividends are more than 10x above their instrument's median", high);
        Checks.addIfAny(findings, ID, Severity.INFO,
            "%d per-share dividends are more than 10x below their instrument's median", low);
        return findings;
    }

    /** Upper median of the recent window, or of all payments when the window is empty. */
    static BigDecimal median(List<DividendPayment> group) {
        LocalDate latest = group.stream()
            .map(DividendPayment::effectiveDate)
            .max(Comparator.naturalOrder())
            .orElseThrow();
        LocalDate cutoff = latest.minusYears(MEDIAN_WINDOW_YEARS);
        List<DividendPayment> recent = group.stream()
            .filter(d -> !d.effectiveDate().isBefore(cutoff))
            .toList();
        List<BigDecimal> amounts = (recent.isEmpty() ? group : recent).stream()
            .map(DividendPayment::perShare)
            .sorted()
            .toList();
        return amounts.get(amounts.size() / 2);
    }
}
