package in.folioledger.service.audit;

import java.util.List;

/**
 * Change between two audit runs, by finding fingerprint.
 */
public record AuditDiff(
    List<Finding> newFindings,
    List<Finding> resolved,
    List<Finding> persisting
) {
    public AuditDiff {
        newFindings = List.copyOf(newFindings);
        resolved = List.copyOf(resolved);
        persisting = List.copyOf(persisting);
    }

    public boolean isUnchanged() {
        return newFindings.isEmpty() && resolved.isEmpty();
    }
}
