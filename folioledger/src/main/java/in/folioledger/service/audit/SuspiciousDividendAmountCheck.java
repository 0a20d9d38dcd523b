package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-share dividend amounts above roughly 50 USD in the payment currency. These are usually
 * totals that were read as a rate.
 */
public final class SuspiciousDividendAmountCheck implements IntegrityCheck {

    public static final String ID = "suspicious_amounts";

    static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("50");

    static final Map<String, BigDecimal> THRESHOLDS = Map.ofEntries(
        Map.entry("USD", new BigDecimal("50")),
        Map.entry("EUR", new BigDecimal("50")),
        Map.entry("CAD", new BigDecimal("70")),
        Map.entry("GBP", new BigDecimal("40")),
        Map.entry("GBp", new BigDecimal("4000")),    // pence
        Map.entry("CHF", new BigDecimal("50")),
        Map.entry("AUD", new BigDecimal("80")),
        Map.entry("NZD", new BigDecimal("85")),
        Map.entry("SGD", new BigDecimal("70")),
        Map.entry("HKD", new BigDecimal("400")),
        Map.entry("JPY", new BigDecimal("7500")),
        Map.entry("NOK", new BigDecimal("550")),
        Map.entry("SEK", new BigDecimal("550")),
        Map.entry("DKK", new BigDecimal("350")),
        Map.entry("TWD", new BigDecimal("1600"))
    );

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<RecordRef> suspicious = new ArrayList<>();
        for (DividendPayment dividend : ledger.dividends()) {
            if (dividend.amountType() != DividendAmountType.PER_SHARE || dividend.perShare() == null) {
                continue;
            }
            if (dividend.perShare().compareTo(threshold(dividend.currency())) > 0) {
                suspicious.add(RecordRef.of("dividend", dividend.externalId()));
            }
        }
        List<Finding> findings = new ArrayList<>();
        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d per-share dividend amounts exceed the plausible maximum for their currency", suspicious);
        return findings;
    }

    static BigDecimal threshold(String currency) {
        return currency == null ? DEFAULT_THRESHOLD : THRESHOLDS.getOrDefault(currency, DEFAULT_THRESHOLD);
    }
}
