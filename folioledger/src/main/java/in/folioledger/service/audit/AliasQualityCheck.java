package in.folioledger.service.audit;

import in.folioledger.domain.model.InstrumentAlias;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Primary-alias bookkeeping and symbols that leaked through unsplit.
 */
public final class AliasQualityCheck implements IntegrityCheck {

    public static final String ID = "alias_quality";

    /** Longer values with commas are company names, not symbol lists. */
    private static final int MAX_SYMBOL_LENGTH = 30;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        Map<String, List<InstrumentAlias>> byInstrument = ledger.aliases().stream()
            .collect(Collectors.groupingBy(InstrumentAlias::instrumentId));

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d instruments have aliases but none marked primary",
            byInstrument.entrySet().stream()
                .filter(e -> e.getValue().stream().noneMatch(InstrumentAlias::primary))
                .map(Map.Entry::getKey)
                .sorted()
                .map(id -> RecordRef.of("instrument", id))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d instruments have more than one primary alias",
            byInstrument.entrySet().stream()
                .filter(e -> e.getValue().stream().filter(InstrumentAlias::primary).count() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .map(id -> RecordRef.of("instrument", id))
                .toList());

        Checks.addIfAny(findings, ID, Severity.WARNING, "%d aliases contain commas (should be split)",
            ledger.aliases().stream()
                .filter(a -> a.symbol().contains(",") && a.symbol().length() <= MAX_SYMBOL_LENGTH)
                .map(a -> RecordRef.of("alias", a.id()))
                .toList());
        return findings;
    }
}
