package in.folioledger.service.ledger;

import in.folioledger.application.port.output.AccountRepository;
import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.application.port.output.LedgerRepository;
import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.fx.FxQuery;
import in.folioledger.service.fx.FxResolution;
import in.folioledger.service.fx.FxResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Idempotent ledger writes.
 *
 * Every record is inserted only if its external id is new; re-importing a file, or an
 * overlapping file, leaves the ledger unchanged. Records are never aggregated or updated.
 * Dividends and cash flows get their base amount from the FX resolver just before the
 * insert; snapshots get their base totals the same way.
 */
public final class LedgerWriter {
    private static final Logger log = LoggerFactory.getLogger(LedgerWriter.class);

    private final LedgerRepository ledgerRepo;
    private final SnapshotRepository snapshotRepo;
    private final AccountRepository accountRepo;
    private final FxRateRepository rateRepo;
    private final FxResolver fxResolver;

    public LedgerWriter(LedgerRepository ledgerRepo, SnapshotRepository snapshotRepo, AccountRepository accountRepo,
                        FxRateRepository rateRepo, FxResolver fxResolver) {
        this.ledgerRepo = ledgerRepo;
        this.snapshotRepo = snapshotRepo;
        this.accountRepo = accountRepo;
        this.rateRepo = rateRepo;
        this.fxResolver = fxResolver;
    }

    public WriteOutcome write(Trade trade) {
        requireInstrument(trade.instrumentId(), trade.externalId());
        return WriteOutcome.of(ledgerRepo.insertTradeIfAbsent(trade));
    }

    public WriteOutcome write(DividendPayment dividend) {
        requireInstrument(dividend.instrumentId(), dividend.externalId());
        FxResolution fx = fxResolver.resolve(new FxQuery(dividend.currency(), dividend.effectiveDate(),
            dividend.fxRate(), dividend.instrumentId()));
        DividendPayment converted = fx.isResolved()
            ? dividend.withConversion(fx.rate(), fx.convert(dividend.netAmount()))
            : dividend;
        if (!fx.isResolved()) {
            log.debug("[LEDGER] Dividend {} in {} on {} left unconverted", dividend.externalId(),
                dividend.currency(), dividend.effectiveDate());
        }
        return WriteOutcome.of(ledgerRepo.insertDividendIfAbsent(converted));
    }

    public WriteOutcome write(CashFlow cashFlow) {
        FxResolution fx = fxResolver.resolve(new FxQuery(cashFlow.currency(), cashFlow.date(), cashFlow.fxRate(), null));
        CashFlow converted = fx.isResolved()
            ? cashFlow.withConversion(fx.rate(), fx.convert(cashFlow.amount()))
            : cashFlow;
        return WriteOutcome.of(ledgerRepo.insertCashFlowIfAbsent(converted));
    }

    public WriteOutcome write(CorporateAction action) {
        return WriteOutcome.of(ledgerRepo.insertCorporateActionIfAbsent(action));
    }

    public WriteOutcome write(SoldPosition soldPosition) {
        return WriteOutcome.of(ledgerRepo.insertSoldPositionIfAbsent(soldPosition));
    }

    /**
     * Store a snapshot with base-currency totals. Positions without a usable rate are kept
     * but left out of the totals.
     */
    public WriteOutcome write(PortfolioSnapshot snapshot) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal unrealized = null;
        int unconverted = 0;
        for (Position position : snapshot.positions()) {
            FxResolution fx = fxResolver.resolve(new FxQuery(position.currency(), snapshot.reportDate(),
                position.fxRateToBase(), position.instrumentId()));
            if (!fx.isResolved()) {
                unconverted++;
                continue;
            }
            total = total.add(fx.convert(position.positionValue()));
            if (position.unrealizedPnl() != null) {
                BigDecimal pnl = fx.convert(position.unrealizedPnl());
                unrealized = unrealized == null ? pnl : unrealized.add(pnl);
            }
        }
        if (unconverted > 0) {
            log.warn("[LEDGER] Snapshot {} ({}): {} positions without FX rate excluded from total",
                snapshot.externalId(), snapshot.reportDate(), unconverted);
        }
        return WriteOutcome.of(snapshotRepo.insertIfAbsent(snapshot.withTotals(total, unrealized)));
    }

    public WriteOutcome write(CashBalance balance) {
        return WriteOutcome.of(accountRepo.insertCashBalanceIfAbsent(balance));
    }

    public WriteOutcome write(AccountValuation valuation) {
        return WriteOutcome.of(accountRepo.insertValuationIfAbsent(valuation));
    }

    /**
     * Store a rate observed in a source file. Later observations for the same day replace
     * earlier ones.
     */
    public void recordRate(FxRate rate) {
        if (rate.rate() == null || rate.rate().signum() <= 0) {
            return;
        }
        rateRepo.upsert(rate);
    }

    private static void requireInstrument(String instrumentId, String externalId) {
        if (instrumentId == null) {
            throw new IllegalStateException("Record " + externalId + " is not linked to an instrument");
        }
    }
}
