package in.folioledger.service.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * References into the instrument catalog that do not land.
 *
 * Sold positions only carry an ISIN; an ISIN missing from the catalog is a soft-link gap
 * rather than a broken key, but is reported the same way.
 */
public final class ForeignKeyCheck implements IntegrityCheck {

    public static final String ID = "foreign_keys";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        Set<String> known = ledger.instrumentIds();

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d trades pointing to non-existent instruments",
            ledger.trades().stream()
                .filter(t -> !known.contains(t.instrumentId()))
                .map(t -> RecordRef.of("trade", t.externalId()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d dividend payments pointing to non-existent instruments",
            ledger.dividends().stream()
                .filter(d -> !known.contains(d.instrumentId()))
                .map(d -> RecordRef.of("dividend", d.externalId()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d corporate actions pointing to non-existent instruments",
            ledger.corporateActions().stream()
                .filter(c -> c.instrumentId() != null && !known.contains(c.instrumentId()))
                .map(c -> RecordRef.of("corporate_action", c.externalId()))
                .toList());

        Map<String, ?> byIsin = ledger.instrumentsByIsin();
        Checks.addIfAny(findings, ID, Severity.WARNING, "%d sold positions whose ISIN is not in the catalog",
            ledger.soldPositions().stream()
                .filter(s -> s.isin() != null && !byIsin.containsKey(s.isin()))
                .map(s -> RecordRef.of("sold_position", s.externalId()))
                .toList());
        return findings;
    }
}
