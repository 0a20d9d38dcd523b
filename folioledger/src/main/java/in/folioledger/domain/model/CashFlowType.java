package in.folioledger.domain.model;

/**
 * Non-trade cash movement kinds.
 */
public enum CashFlowType {
    DEPOSIT,
    WITHDRAWAL,
    INTEREST,
    FEE,
    OTHER;

    public String code() {
        return name().toLowerCase();
    }

    public static CashFlowType fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
