package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.domain.model.PortfolioSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields that should have been populated by import or resolution.
 */
public final class NullFieldCheck implements IntegrityCheck {

    public static final String ID = "null_fields";

    private final LedgerConfig config;

    public NullFieldCheck(LedgerConfig config) {
        this.config = config;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();

        Checks.addIfAny(findings, ID, Severity.INFO, "%d dividend payments missing base amount",
            ledger.dividends().stream()
                .filter(d -> d.amountBase() == null)
                .map(d -> RecordRef.of("dividend", d.externalId()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d non-" + config.baseCurrency() + " dividend payments missing fx rate",
            ledger.dividends().stream()
                .filter(d -> d.fxRate() == null && !config.isBaseCurrency(d.currency()))
                .map(d -> RecordRef.of("dividend", d.externalId()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d instruments missing currency",
            ledger.instruments().stream()
                .filter(i -> i.currency() == null)
                .map(i -> RecordRef.of("instrument", i.isin()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.INFO, "%d instruments missing name",
            ledger.instruments().stream()
                .filter(i -> i.name() == null)
                .map(i -> RecordRef.of("instrument", i.isin()))
                .toList());

        List<RecordRef> positionsWithoutIsin = new ArrayList<>();
        for (PortfolioSnapshot snapshot : ledger.snapshots()) {
            snapshot.positions().stream()
                .filter(p -> p.isin() == null)
                .forEach(p -> positionsWithoutIsin.add(RecordRef.of("position", snapshot.externalId() + "/" + p.symbol())));
        }
        Checks.addIfAny(findings, ID, Severity.INFO, "%d positions missing ISIN", positionsWithoutIsin);

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d sold positions missing ISIN",
            ledger.soldPositions().stream()
                .filter(s -> s.isin() == null)
                .map(s -> RecordRef.of("sold_position", s.externalId()))
                .toList());
        return findings;
    }
}
