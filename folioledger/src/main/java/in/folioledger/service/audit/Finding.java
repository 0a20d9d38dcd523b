package in.folioledger.service.audit;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One audit observation, with the records it concerns.
 */
public record Finding(
    String checkId,
    Severity severity,
    String description,
    List<RecordRef> records
) {
    public Finding {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static Finding info(String checkId, String description, List<RecordRef> records) {
        return new Finding(checkId, Severity.INFO, description, records);
    }

    public static Finding warning(String checkId, String description, List<RecordRef> records) {
        return new Finding(checkId, Severity.WARNING, description, records);
    }

    /**
     * Identity across runs: check, severity, description and the sorted record list. Two runs
     * over an unchanged ledger produce identical fingerprints.
     */
    public String fingerprint() {
        String refs = records.stream().map(RecordRef::toString).sorted().collect(Collectors.joining(","));
        return checkId + "|" + severity + "|" + description + "|" + refs;
    }
}
