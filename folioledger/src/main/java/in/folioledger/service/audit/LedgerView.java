package in.folioledger.service.audit;

import in.folioledger.application.port.output.AccountRepository;
import in.folioledger.application.port.output.InstrumentAliasRepository;
import in.folioledger.application.port.output.InstrumentRepository;
import in.folioledger.application.port.output.LedgerRepository;
import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.Instrument;
import in.folioledger.domain.model.InstrumentAlias;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Everything an audit run reads, loaded once so that all checks see the same state.
 */
public record LedgerView(
    List<Instrument> instruments,
    List<InstrumentAlias> aliases,
    List<Trade> trades,
    List<DividendPayment> dividends,
    List<CashFlow> cashFlows,
    List<CorporateAction> corporateActions,
    List<SoldPosition> soldPositions,
    List<PortfolioSnapshot> snapshots,
    List<CashBalance> cashBalances,
    List<AccountValuation> valuations
) {
    public LedgerView {
        instruments = List.copyOf(instruments);
        aliases = List.copyOf(aliases);
        trades = List.copyOf(trades);
        dividends = List.copyOf(dividends);
        cashFlows = List.copyOf(cashFlows);
        corporateActions = List.copyOf(corporateActions);
        soldPositions = List.copyOf(soldPositions);
        snapshots = List.copyOf(snapshots);
        cashBalances = List.copyOf(cashBalances);
        valuations = List.copyOf(valuations);
    }

    public static LedgerView load(InstrumentRepository instrumentRepo, InstrumentAliasRepository aliasRepo,
                                  LedgerRepository ledgerRepo, SnapshotRepository snapshotRepo,
                                  AccountRepository accountRepo) {
        return new LedgerView(
            instrumentRepo.findAll(),
            aliasRepo.findAll(),
            ledgerRepo.findAllTrades(),
            ledgerRepo.findAllDividends(),
            ledgerRepo.findAllCashFlows(),
            ledgerRepo.findAllCorporateActions(),
            ledgerRepo.findAllSoldPositions(),
            snapshotRepo.findAll(),
            accountRepo.findAllCashBalances(),
            accountRepo.findAllValuations()
        );
    }

    public static LedgerView empty() {
        return new LedgerView(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of());
    }

    public Set<String> instrumentIds() {
        return instruments.stream().map(Instrument::id).collect(Collectors.toSet());
    }

    public Map<String, Instrument> instrumentsByIsin() {
        return instruments.stream().collect(Collectors.toMap(Instrument::isin, Function.identity(), (a, b) -> a));
    }
}
