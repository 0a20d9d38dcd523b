package in.folioledger.service.audit;

import java.util.List;

/**
 * A read-only rule over the ledger.
 */
public interface IntegrityCheck {

    /** Stable id, used in config ({@code AUDIT_DISABLED_CHECKS}) and findings. */
    String id();

    List<Finding> run(LedgerView ledger);
}
