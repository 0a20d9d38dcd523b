package in.folioledger.infrastructure.metrics;

import java.time.Duration;

/**
 * Import and audit counters.
 *
 * Implementations must be thread-safe: files are imported on a worker pool.
 */
public interface LedgerMetrics {

    /**
     * @param outcome created, skipped or failed
     */
    void recordRecords(String format, String outcome, int count);

    /**
     * @param status ok, partial (some rows failed), unrecognized or error
     */
    void recordFile(String format, String status, Duration elapsed);

    /**
     * Replace the finding gauge for one check with the latest audit result.
     */
    void recordFindings(String checkId, String severity, int count);

    LedgerMetrics NOOP = new LedgerMetrics() {
        @Override
        public void recordRecords(String format, String outcome, int count) {
        }

        @Override
        public void recordFile(String format, String status, Duration elapsed) {
        }

        @Override
        public void recordFindings(String checkId, String severity, int count) {
        }
    };
}
