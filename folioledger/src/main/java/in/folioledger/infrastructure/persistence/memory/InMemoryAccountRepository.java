package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.AccountRepository;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;

import java.util.List;

public final class InMemoryAccountRepository implements AccountRepository {
    private final AppendOnlyTable<CashBalance> balances = new AppendOnlyTable<>();
    private final AppendOnlyTable<AccountValuation> valuations = new AppendOnlyTable<>();

    @Override
    public boolean insertCashBalanceIfAbsent(CashBalance balance) {
        return balances.insertIfAbsent(balance);
    }

    @Override
    public boolean insertValuationIfAbsent(AccountValuation valuation) {
        return valuations.insertIfAbsent(valuation);
    }

    @Override
    public List<CashBalance> findAllCashBalances() {
        return balances.all();
    }

    @Override
    public List<AccountValuation> findAllValuations() {
        return valuations.all();
    }
}
