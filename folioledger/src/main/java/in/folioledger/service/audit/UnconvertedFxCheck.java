package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Foreign-currency amounts that never got a base amount and are therefore excluded from
 * base-currency totals.
 */
public final class UnconvertedFxCheck implements IntegrityCheck {

    public static final String ID = "unconverted_fx";

    private final LedgerConfig config;

    public UnconvertedFxCheck(LedgerConfig config) {
        this.config = config;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d foreign-currency dividend payments excluded from base totals (no FX rate)",
            ledger.dividends().stream()
                .filter(d -> d.amountBase() == null && !config.isBaseCurrency(d.currency()))
                .map(d -> RecordRef.of("dividend", d.externalId()))
                .toList());
        Checks.addIfAny(findings, ID, Severity.WARNING,
            "%d foreign-currency cash flows excluded from base totals (no FX rate)",
            ledger.cashFlows().stream()
                .filter(c -> c.amountBase() == null && !config.isBaseCurrency(c.currency()))
                .map(c -> RecordRef.of("cash_flow", c.externalId()))
                .toList());
        return findings;
    }
}
