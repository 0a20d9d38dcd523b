package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Instruments whose dividends mix per-share and total-net records. Per-share yield figures for
 * such an instrument only cover part of its history.
 */
public final class MixedDividendTypeCheck implements IntegrityCheck {

    public static final String ID = "mixed_amount_types_per_stock";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        Map<String, Set<DividendAmountType>> typesByInstrument = new TreeMap<>();
        for (DividendPayment dividend : ledger.dividends()) {
            if (dividend.instrumentId() != null && dividend.amountType() != null) {
                typesByInstrument.computeIfAbsent(dividend.instrumentId(), k -> EnumSet.noneOf(DividendAmountType.class))
                    .add(dividend.amountType());
            }
        }
        List<RecordRef> mixed = typesByInstrument.entrySet().stream()
            .filter(e -> e.getValue().containsAll(EnumSet.allOf(DividendAmountType.class)))
            .map(e -> RecordRef.of("instrument", e.getKey()))
            .toList();

        List<Finding> findings = new ArrayList<>();
        Checks.addIfAny(findings, ID, Severity.INFO,
            "%d instruments have both per-share and total-net dividend records", mixed);
        return findings;
    }
}
