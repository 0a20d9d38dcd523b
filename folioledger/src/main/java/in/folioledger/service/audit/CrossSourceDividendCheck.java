package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendPayment;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Dividend payments for the same instrument on the same pay date. External ids differ between
 * brokers, so one payment imported from two sources lands twice and is counted twice.
 *
 * Groups spanning more than one source format are warnings. Groups from a single format are
 * informational: a regular and a special dividend may share a pay date.
 */
public final class CrossSourceDividendCheck implements IntegrityCheck {

    public static final String ID = "cross_source_duplicates";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        Map<String, List<DividendPayment>> byInstrumentAndDate = new LinkedHashMap<>();
        for (DividendPayment dividend : ledger.dividends()) {
            LocalDate date = dividend.effectiveDate();
            if (dividend.instrumentId() == null || date == null) {
                continue;
            }
            byInstrumentAndDate.computeIfAbsent(dividend.instrumentId() + "@" + date, k -> new ArrayList<>())
                .add(dividend);
        }

        List<RecordRef> acrossSources = new ArrayList<>();
        List<RecordRef> sameSource = new ArrayList<>();
        for (List<DividendPayment> group : byInstrumentAndDate.values()) {
            if (group.size() < 2) {
                continue;
            }
            Set<String> sources = group.stream()
                .map(CrossSourceDividendCheck::source)
                .collect(Collectors.toSet());
            List<RecordRef> refs = group.stream()
                .map(DividendPayment::externalId)
                .sorted(Comparator.nullsFirst(Comparator.naturalOrder()))
                .map(id -> RecordRef.of("dividend", id))
                .toList();
            (sources.size() > 1 ? acrossSources : sameSource).addAll(refs);
        }

        List<Finding> findings = new ArrayList<>();
        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d dividend payments share instrument and pay date with a payment from another source", acrossSources);
        Checks.addIfAny(findings, ID, Severity.INFO,
            "%d dividend payments share instrument and pay date within one source", sameSource);
        return findings;
    }

    private static String source(DividendPayment dividend) {
        return dividend.provenance() == null || dividend.provenance().format() == null
            ? "unknown"
            : dividend.provenance().format().name();
    }
}
