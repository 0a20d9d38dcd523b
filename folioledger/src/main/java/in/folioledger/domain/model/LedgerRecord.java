package in.folioledger.domain.model;

/**
 * A record in an append-only ledger table, deduplicated by external id.
 */
public interface LedgerRecord {

    /** Deterministic deduplication key. */
    String externalId();

    /** Source row(s) the record was built from. */
    Provenance provenance();
}
