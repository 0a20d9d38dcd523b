package in.folioledger.service.audit;

import in.folioledger.domain.model.LedgerRecord;
import in.folioledger.domain.model.PortfolioSnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keys that should be unique but are not. With a working writer this check stays silent;
 * it guards against stores loaded by other means.
 */
public final class DuplicateCheck implements IntegrityCheck {

    public static final String ID = "duplicates";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        duplicates(findings, "trade", "trades", ledger.trades());
        duplicates(findings, "dividend", "dividend payments", ledger.dividends());
        duplicates(findings, "cash_flow", "cash flows", ledger.cashFlows());
        duplicates(findings, "corporate_action", "corporate actions", ledger.corporateActions());
        duplicates(findings, "sold_position", "sold positions", ledger.soldPositions());

        // one snapshot per report date, whichever source produced it
        Map<LocalDate, Long> perDate = ledger.snapshots().stream()
            .collect(Collectors.groupingBy(PortfolioSnapshot::reportDate, Collectors.counting()));
        Checks.addIfAny(findings, ID, Severity.WARNING, "%d snapshots share a report date with another snapshot",
            ledger.snapshots().stream()
                .filter(s -> perDate.get(s.reportDate()) > 1)
                .sorted(Comparator.comparing(PortfolioSnapshot::reportDate).thenComparing(PortfolioSnapshot::externalId))
                .map(PortfolioSnapshot::externalId)
                .map(id -> RecordRef.of("snapshot", id))
                .toList());
        return findings;
    }

    private static void duplicates(List<Finding> findings, String kind, String label, List<? extends LedgerRecord> records) {
        Map<String, Long> counts = records.stream()
            .collect(Collectors.groupingBy(LedgerRecord::externalId, Collectors.counting()));
        List<RecordRef> refs = counts.entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .map(Map.Entry::getKey)
            .sorted()
            .map(id -> RecordRef.of(kind, id))
            .toList();
        Checks.addIfAny(findings, ID, Severity.WARNING, "%d duplicate external ids in " + label, refs);
    }
}
