package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.InstrumentAlias;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.domain.model.Trade;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records nothing points to, and records pointing at nothing.
 */
public final class OrphanCheck implements IntegrityCheck {

    public static final String ID = "orphans";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        Set<String> known = ledger.instrumentIds();

        Set<String> used = new HashSet<>();
        ledger.trades().stream().map(Trade::instrumentId).forEach(used::add);
        ledger.dividends().stream().map(DividendPayment::instrumentId).forEach(used::add);
        Checks.addIfAny(findings, ID, Severity.INFO, "%d instruments with no trades or dividend payments",
            ledger.instruments().stream()
                .filter(i -> !used.contains(i.id()))
                .map(i -> RecordRef.of("instrument", i.isin()))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d instrument aliases with no parent instrument",
            ledger.aliases().stream()
                .filter(a -> !known.contains(a.instrumentId()))
                .map(InstrumentAlias::id)
                .map(id -> RecordRef.of("alias", id))
                .toList());

        List<RecordRef> unlinkedPositions = new ArrayList<>();
        for (PortfolioSnapshot snapshot : ledger.snapshots()) {
            for (Position position : snapshot.positions()) {
                if (position.instrumentId() == null || !known.contains(position.instrumentId())) {
                    unlinkedPositions.add(RecordRef.of("position", snapshot.externalId() + "/"
                        + (position.isin() != null ? position.isin() : position.symbol())));
                }
            }
        }
        Checks.addIfAny(findings, ID, Severity.WARNING, "%d positions with no catalog instrument", unlinkedPositions);
        return findings;
    }
}
