package in.folioledger.application.port.output;

import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;

import java.util.List;

public interface AccountRepository {

    boolean insertCashBalanceIfAbsent(CashBalance balance);

    boolean insertValuationIfAbsent(AccountValuation valuation);

    List<CashBalance> findAllCashBalances();

    List<AccountValuation> findAllValuations();
}
