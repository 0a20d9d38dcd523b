package in.folioledger.service.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Findings of one audit run, plus the balance reconciliation when one could be made.
 */
public record AuditReport(
    Instant runAt,
    List<String> checksRun,
    List<Finding> findings,
    BalanceResult balance           // null when nothing was reported to reconcile against
) {
    public AuditReport {
        checksRun = List.copyOf(checksRun);
        findings = List.copyOf(findings);
    }

    public List<Finding> findings(String checkId) {
        return findings.stream().filter(f -> f.checkId().equals(checkId)).toList();
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }

    /** Finding counts per (check, severity), in check order. */
    public Map<String, Map<Severity, Long>> countsByCheck() {
        Map<String, Map<Severity, Long>> counts = new LinkedHashMap<>();
        for (String check : checksRun) {
            counts.put(check, findings(check).stream()
                .collect(Collectors.groupingBy(Finding::severity, Collectors.counting())));
        }
        return counts;
    }

    /**
     * Compare with an earlier run. Findings are matched by fingerprint.
     */
    public AuditDiff diff(AuditReport previous) {
        if (previous == null) {
            return new AuditDiff(findings, List.of(), List.of());
        }
        Map<String, Finding> before = previous.findings.stream()
            .collect(Collectors.toMap(Finding::fingerprint, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        Set<String> now = findings.stream().map(Finding::fingerprint).collect(Collectors.toSet());

        List<Finding> added = findings.stream().filter(f -> !before.containsKey(f.fingerprint())).toList();
        List<Finding> persisting = findings.stream().filter(f -> before.containsKey(f.fingerprint())).toList();
        List<Finding> resolved = before.values().stream().filter(f -> !now.contains(f.fingerprint())).toList();
        return new AuditDiff(added, resolved, persisting);
    }
}
