package in.folioledger.service.audit;

/**
 * Pointer to the ledger row a finding is about.
 *
 * @param kind table-like name: instrument, alias, trade, dividend, cash_flow, ...
 * @param id   surrogate or external id
 */
public record RecordRef(String kind, String id) {

    public static RecordRef of(String kind, String id) {
        return new RecordRef(kind, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
