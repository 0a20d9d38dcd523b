package in.folioledger.service.ledger;

public enum WriteOutcome {
    CREATED,
    SKIPPED;

    static WriteOutcome of(boolean created) {
        return created ? CREATED : SKIPPED;
    }
}
