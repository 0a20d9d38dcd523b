package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.domain.model.LedgerRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered records keyed by external id. First write wins.
 */
final class AppendOnlyTable<T extends LedgerRecord> {
    private final Map<String, T> rows = new LinkedHashMap<>();

    synchronized boolean insertIfAbsent(T record) {
        return rows.putIfAbsent(record.externalId(), record) == null;
    }

    synchronized List<T> all() {
        return new ArrayList<>(rows.values());
    }
}
