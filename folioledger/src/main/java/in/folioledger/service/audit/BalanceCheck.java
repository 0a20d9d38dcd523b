package in.folioledger.service.audit;

import in.folioledger.config.LedgerConfig;
import in.folioledger.config.ToleranceBand;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.fx.FxQuery;
import in.folioledger.service.fx.FxResolution;
import in.folioledger.service.fx.FxResolver;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles the ledger against the broker's own account value.
 *
 * <pre>
 * derived = opening value
 *         + deposits - withdrawals
 *         + realized P&amp;L + dividends (gross) + interest received
 *         - fees - commissions - withholding - interest paid
 *         + other cash flows
 *         + (closing unrealized P&amp;L - opening unrealized P&amp;L)
 * </pre>
 *
 * Every term is converted to base currency through the FX resolver at the record's date.
 * The reported value is the latest {@link AccountValuation} ending value, else the latest
 * snapshot total plus base-summary cash at that date. Records dated after the reported date
 * or before the opening date are left out.
 */
public final class BalanceCheck implements IntegrityCheck {

    public static final String ID = "balance";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LedgerConfig config;
    private final FxResolver fxResolver;

    public BalanceCheck(LedgerConfig config, FxResolver fxResolver) {
        this.config = config;
        this.fxResolver = fxResolver;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        Optional<BalanceResult> evaluated = evaluate(ledger);
        if (evaluated.isEmpty()) {
            return List.of(Finding.info(ID, "Balance check skipped: no reported account value", List.of()));
        }
        BalanceResult result = evaluated.get();
        String description = String.format("Balance %s: derived %s vs reported %s on %s (%s%% deviation, band %s%%/%s%%)",
            result.verdict(), result.derivedValue().toPlainString(), result.reportedValue().toPlainString(),
            result.reportedDate(), result.differencePercent().toPlainString(),
            result.band().warnPercent().toPlainString(), result.band().failPercent().toPlainString());

        List<Finding> findings = new ArrayList<>();
        findings.add(new Finding(ID, result.verdict() == BalanceResult.Verdict.PASS ? Severity.INFO : Severity.WARNING,
            description, List.of()));
        for (String callout : result.callouts()) {
            findings.add(Finding.info(ID, callout, List.of()));
        }
        return findings;
    }

    /**
     * Empty when there is nothing reported to compare against.
     */
    public Optional<BalanceResult> evaluate(LedgerView ledger) {
        return evaluate(ledger, config.activeBand());
    }

    public Optional<BalanceResult> evaluate(LedgerView ledger, ToleranceBand band) {
        Derivation d = new Derivation();

        Optional<Reported> reported = reported(ledger, d);
        if (reported.isEmpty()) {
            return Optional.empty();
        }
        LocalDate end = reported.get().date();

        Optional<AccountValuation> opening = ledger.valuations().stream()
            .filter(v -> v.startingValue() != null && v.periodStart() != null && !v.periodStart().isAfter(end))
            .min(Comparator.comparing(AccountValuation::periodStart));
        LocalDate start = opening.map(AccountValuation::periodStart).orElse(null);
        if (opening.isPresent()) {
            d.add("opening_value", d.convert(opening.get().startingValue(), opening.get().currency(), start, "opening value"));
        } else {
            d.add("opening_value", BigDecimal.ZERO);
            d.callouts.add("No reported opening value: the ledger is reconciled from zero");
        }

        for (CashFlow cf : ledger.cashFlows()) {
            if (!inWindow(cf.date(), start, end)) continue;
            BigDecimal base = d.convert(cf.amount(), cf.currency(), cf.date(), cf.fxRate(), null, "cash flow " + cf.externalId());
            if (base == null) continue;
            switch (cf.flowType()) {
                case DEPOSIT -> d.add("deposits", base.abs());
                case WITHDRAWAL -> d.add("withdrawals", base.abs().negate());
                case FEE -> d.add("fees", base);
                case INTEREST -> d.add(base.signum() >= 0 ? "interest_received" : "interest_paid", base);
                default -> d.add("other_cash_flows", base);
            }
        }

        for (Trade trade : ledger.trades()) {
            if (!inWindow(trade.tradeDate(), start, end)) continue;
            if (trade.realizedPnl() != null && trade.realizedPnl().signum() != 0) {
                d.add("realized_pnl", d.convert(trade.realizedPnl(), trade.currency(), trade.tradeDate(),
                    trade.fxRate(), trade.instrumentId(), "trade " + trade.externalId()));
            }
            if (trade.commission() != null && trade.commission().signum() != 0) {
                BigDecimal commission = d.convert(trade.commission(), trade.currency(), trade.tradeDate(),
                    trade.fxRate(), trade.instrumentId(), "trade commission " + trade.externalId());
                d.add("commissions", commission == null ? null : commission.abs().negate());
            }
        }

        for (DividendPayment dividend : ledger.dividends()) {
            if (!inWindow(dividend.effectiveDate(), start, end)) continue;
            String label = "dividend " + dividend.externalId();
            d.add("dividends", d.convert(dividend.grossAmount(), dividend.currency(), dividend.effectiveDate(),
                dividend.fxRate(), dividend.instrumentId(), label));
            if (dividend.withholdingTax() != null && dividend.withholdingTax().signum() != 0) {
                d.add("withholding", d.convert(dividend.withholdingTax(), dividend.currency(), dividend.effectiveDate(),
                    dividend.fxRate(), dividend.instrumentId(), label + " withholding"));
            }
        }

        BigDecimal closingUnrealized = reported.get().unrealized();
        Optional<PortfolioSnapshot> openingSnapshot = start == null ? Optional.empty()
            : ledger.snapshots().stream()
                .filter(s -> !s.reportDate().isAfter(start) && s.totalUnrealizedPnl() != null)
                .max(Comparator.comparing(PortfolioSnapshot::reportDate));
        if (closingUnrealized != null) {
            BigDecimal openingUnrealized = openingSnapshot.map(PortfolioSnapshot::totalUnrealizedPnl).orElse(null);
            if (openingUnrealized == null) {
                d.callouts.add("Opening unrealized P&L unknown: the full closing unrealized P&L "
                    + closingUnrealized.toPlainString() + " is counted as this period's change");
                openingUnrealized = BigDecimal.ZERO;
            }
            d.add("unrealized_pnl_change", closingUnrealized.subtract(openingUnrealized));
        } else {
            d.callouts.add("No unrealized P&L reported at the closing date: unrealized change not included");
        }

        foreignCashCallouts(ledger, end, d);
        if (!d.unconverted.isEmpty()) {
            d.callouts.add(d.unconverted.size() + " components without FX rate excluded: "
                + String.join(", ", d.unconverted.subList(0, Math.min(10, d.unconverted.size())))
                + (d.unconverted.size() > 10 ? ", ..." : ""));
        }

        BigDecimal derived = d.total();
        BigDecimal reportedValue = reported.get().value();
        BigDecimal pct = deviationPercent(derived, reportedValue);
        return Optional.of(new BalanceResult(BalanceResult.classify(pct, band), derived, reportedValue, end, pct, band,
            d.components, d.callouts));
    }

    /** |derived - reported| / |reported| in percent, 4 decimals. Zero reported value: 0 or 100. */
    static BigDecimal deviationPercent(BigDecimal derived, BigDecimal reported) {
        BigDecimal difference = derived.subtract(reported).abs();
        if (reported.signum() == 0) {
            return difference.signum() == 0 ? BigDecimal.ZERO : HUNDRED;
        }
        return difference.multiply(HUNDRED).divide(reported.abs(), 4, RoundingMode.HALF_UP);
    }

    private record Reported(LocalDate date, BigDecimal value, BigDecimal unrealized) {}

    private Optional<Reported> reported(LedgerView ledger, Derivation d) {
        Optional<PortfolioSnapshot> latestSnapshot = ledger.snapshots().stream()
            .filter(s -> s.totalValue() != null)
            .max(Comparator.comparing(PortfolioSnapshot::reportDate));

        Optional<AccountValuation> latestValuation = ledger.valuations().stream()
            .filter(v -> v.endingValue() != null && v.periodEnd() != null)
            .max(Comparator.comparing(AccountValuation::periodEnd));
        if (latestValuation.isPresent()) {
            AccountValuation v = latestValuation.get();
            BigDecimal value = d.convert(v.endingValue(), v.currency(), v.periodEnd(), "reported value");
            if (value != null) {
                BigDecimal unrealized = ledger.snapshots().stream()
                    .filter(s -> s.reportDate().equals(v.periodEnd()) && s.totalUnrealizedPnl() != null)
                    .map(PortfolioSnapshot::totalUnrealizedPnl)
                    .findFirst()
                    .orElse(null);
                return Optional.of(new Reported(v.periodEnd(), value, unrealized));
            }
        }

        if (latestSnapshot.isEmpty()) {
            return Optional.empty();
        }
        PortfolioSnapshot snapshot = latestSnapshot.get();
        BigDecimal value = snapshot.totalValue();
        Optional<CashBalance> cash = ledger.cashBalances().stream()
            .filter(CashBalance::baseSummary)
            .filter(b -> b.endingCash() != null && b.periodEnd() != null && b.periodEnd().equals(snapshot.reportDate()))
            .findFirst();
        if (cash.isPresent()) {
            value = value.add(cash.get().endingCash());
        } else {
            d.callouts.add("Reported value is the " + snapshot.reportDate()
                + " holdings total without cash: no base cash balance for that date");
        }
        return Optional.of(new Reported(snapshot.reportDate(), value, snapshot.totalUnrealizedPnl()));
    }

    private void foreignCashCallouts(LedgerView ledger, LocalDate end, Derivation d) {
        Map<String, CashBalance> latestByCurrency = new LinkedHashMap<>();
        ledger.cashBalances().stream()
            .filter(b -> !b.baseSummary() && !config.isBaseCurrency(b.currency()))
            .filter(b -> b.periodEnd() != null && !b.periodEnd().isAfter(end))
            .sorted(Comparator.comparing(CashBalance::periodEnd))
            .forEach(b -> latestByCurrency.put(b.currency(), b));
        latestByCurrency.values().stream()
            .filter(b -> b.endingCash() != null && b.endingCash().signum() != 0)
            .forEach(b -> d.callouts.add("FX effect on " + b.currency() + " cash balance "
                + b.endingCash().toPlainString() + " (" + b.periodEnd() + ") is not tracked"));
    }

    private static boolean inWindow(LocalDate date, LocalDate start, LocalDate end) {
        if (date == null || date.isAfter(end)) return false;
        return start == null || !date.isBefore(start);
    }

    /** Running sum of components, with the amounts it could not convert. */
    private final class Derivation {
        private final Map<String, BigDecimal> components = new LinkedHashMap<>();
        private final List<String> callouts = new ArrayList<>();
        private final List<String> unconverted = new ArrayList<>();

        void add(String component, BigDecimal amount) {
            if (amount == null) return;
            components.merge(component, amount, BigDecimal::add);
        }

        BigDecimal convert(BigDecimal amount, String currency, LocalDate date, String label) {
            return convert(amount, currency, date, null, null, label);
        }

        BigDecimal convert(BigDecimal amount, String currency, LocalDate date, BigDecimal explicitRate,
                           String instrumentId, String label) {
            if (amount == null) return null;
            String ccy = currency == null ? config.baseCurrency() : currency;
            FxResolution fx = fxResolver.resolve(new FxQuery(ccy, date, explicitRate, instrumentId));
            if (!fx.isResolved()) {
                unconverted.add(label + " (" + amount.toPlainString() + " " + ccy + ")");
                return null;
            }
            return fx.convert(amount);
        }

        BigDecimal total() {
            return components.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }
}
