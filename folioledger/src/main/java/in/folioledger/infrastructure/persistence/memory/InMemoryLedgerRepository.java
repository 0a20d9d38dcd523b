package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.LedgerRepository;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;

import java.util.List;

public final class InMemoryLedgerRepository implements LedgerRepository {
    private final AppendOnlyTable<Trade> trades = new AppendOnlyTable<>();
    private final AppendOnlyTable<DividendPayment> dividends = new AppendOnlyTable<>();
    private final AppendOnlyTable<CashFlow> cashFlows = new AppendOnlyTable<>();
    private final AppendOnlyTable<CorporateAction> corporateActions = new AppendOnlyTable<>();
    private final AppendOnlyTable<SoldPosition> soldPositions = new AppendOnlyTable<>();

    @Override
    public boolean insertTradeIfAbsent(Trade trade) {
        return trades.insertIfAbsent(trade);
    }

    @Override
    public boolean insertDividendIfAbsent(DividendPayment dividend) {
        return dividends.insertIfAbsent(dividend);
    }

    @Override
    public boolean insertCashFlowIfAbsent(CashFlow cashFlow) {
        return cashFlows.insertIfAbsent(cashFlow);
    }

    @Override
    public boolean insertCorporateActionIfAbsent(CorporateAction action) {
        return corporateActions.insertIfAbsent(action);
    }

    @Override
    public boolean insertSoldPositionIfAbsent(SoldPosition soldPosition) {
        return soldPositions.insertIfAbsent(soldPosition);
    }

    @Override
    public List<Trade> findAllTrades() {
        return trades.all();
    }

    @Override
    public List<DividendPayment> findAllDividends() {
        return dividends.all();
    }

    @Override
    public List<CashFlow> findAllCashFlows() {
        return cashFlows.all();
    }

    @Override
    public List<CorporateAction> findAllCorporateActions() {
        return corporateActions.all();
    }

    @Override
    public List<SoldPosition> findAllSoldPositions() {
        return soldPositions.all();
    }
}
