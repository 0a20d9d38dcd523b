package in.folioledger.service.audit;

public enum Severity {
    INFO,
    WARNING
}
