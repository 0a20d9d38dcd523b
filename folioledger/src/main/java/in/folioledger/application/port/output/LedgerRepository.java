package in.folioledger.application.port.output;

import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;

import java.util.List;

/**
 * Append-only ledger tables keyed by external id.
 *
 * Every {@code insert*IfAbsent} returns {@code true} when a row was created and
 * {@code false} when the external id was already present.
 */
public interface LedgerRepository {

    boolean insertTradeIfAbsent(Trade trade);

    boolean insertDividendIfAbsent(DividendPayment dividend);

    boolean insertCashFlowIfAbsent(CashFlow cashFlow);

    boolean insertCorporateActionIfAbsent(CorporateAction action);

    boolean insertSoldPositionIfAbsent(SoldPosition soldPosition);

    List<Trade> findAllTrades();

    List<DividendPayment> findAllDividends();

    List<CashFlow> findAllCashFlows();

    List<CorporateAction> findAllCorporateActions();

    List<SoldPosition> findAllSoldPositions();
}
