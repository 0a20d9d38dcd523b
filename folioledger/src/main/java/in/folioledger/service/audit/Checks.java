package in.folioledger.service.audit;

import java.util.List;

final class Checks {

    private Checks() {}

    /**
     * Append a finding when {@code refs} is non-empty. {@code message} is a format string
     * receiving the count.
     */
    static void addIfAny(List<Finding> findings, String checkId, Severity severity, String message, List<RecordRef> refs) {
        if (!refs.isEmpty()) {
            findings.add(new Finding(checkId, severity, String.format(message, refs.size()), refs));
        }
    }
}
