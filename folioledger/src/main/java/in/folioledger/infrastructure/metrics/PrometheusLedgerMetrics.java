package in.folioledger.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of {@link LedgerMetrics}.
 *
 * Key Metrics:
 * - folioledger_import_records_total{format, outcome} - records created / skipped / failed
 * - folioledger_import_files_total{format, status} - files by outcome
 * - folioledger_import_duration_seconds{format} - per-file import time
 * - folioledger_audit_findings{check, severity} - findings of the latest audit
 */
public class PrometheusLedgerMetrics implements LedgerMetrics {

    private final CollectorRegistry registry;

    private final Counter recordCounter;
    private final Counter fileCounter;
    private final Histogram importDuration;
    private final Gauge auditFindings;

    public PrometheusLedgerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLedgerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.recordCounter = Counter.build()
            .name("folioledger_import_records_total")
            .help("Ledger records seen during import, by outcome")
            .labelNames("format", "outcome")
            .register(registry);

        this.fileCounter = Counter.build()
            .name("folioledger_import_files_total")
            .help("Imported files by status")
            .labelNames("format", "status")
            .register(registry);

        this.importDuration = Histogram.build()
            .name("folioledger_import_duration_seconds")
            .help("Time to import one file")
            .labelNames("format")
            .buckets(0.05, 0.1, 0.5, 1.0, 5.0, 15.0, 60.0)
            .register(registry);

        this.auditFindings = Gauge.build()
            .name("folioledger_audit_findings")
            .help("Findings reported by the latest audit run")
            .labelNames("check", "severity")
            .register(registry);
    }

    @Override
    public void recordRecords(String format, String outcome, int count) {
        if (count > 0) {
            recordCounter.labels(format, outcome).inc(count);
        }
    }

    @Override
    public void recordFile(String format, String status, Duration elapsed) {
        fileCounter.labels(format, status).inc();
        importDuration.labels(format).observe(elapsed.toMillis() / 1000.0);
    }

    @Override
    public void recordFindings(String checkId, String severity, int count) {
        auditFindings.labels(checkId, severity).set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
