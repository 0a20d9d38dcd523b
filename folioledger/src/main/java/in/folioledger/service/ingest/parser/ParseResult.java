package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.service.ingest.RowError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a parser produced for one file.
 *
 * Ignored rows are rows deliberately not imported (currency conversions, zero amounts,
 * adjustment codes); they are counted by reason, not reported as errors.
 */
public final class ParseResult {

    private final String sourceName;
    private final FormatTag format;

    private final List<InstrumentRef> instruments = new ArrayList<>();
    private final List<TradeDraft> trades = new ArrayList<>();
    private final List<DividendDraft> dividends = new ArrayList<>();
    private final List<CashFlow> cashFlows = new ArrayList<>();
    private final List<CashFlow> orphanedWithholdings = new ArrayList<>();
    private final List<CorporateActionDraft> corporateActions = new ArrayList<>();
    private final List<SnapshotDraft> snapshots = new ArrayList<>();
    private final List<SoldPosition> soldPositions = new ArrayList<>();
    private final List<CashBalance> cashBalances = new ArrayList<>();
    private final List<AccountValuation> valuations = new ArrayList<>();
    private final List<FxRate> observedRates = new ArrayList<>();
    private final List<EnrichmentDraft> enrichments = new ArrayList<>();
    private final List<RowError> errors = new ArrayList<>();
    private final Map<String, Integer> ignored = new LinkedHashMap<>();

    public ParseResult(String sourceName, FormatTag format) {
        this.sourceName = sourceName;
        this.format = format;
    }

    public void addInstrument(InstrumentRef ref) { instruments.add(ref); }
    public void addTrade(TradeDraft draft) { trades.add(draft); }
    public void addDividend(DividendDraft draft) { dividends.add(draft); }
    public void addCashFlow(CashFlow cashFlow) { cashFlows.add(cashFlow); }
    public void addCorporateAction(CorporateActionDraft draft) { corporateActions.add(draft); }
    public void addSnapshot(SnapshotDraft draft) { snapshots.add(draft); }
    public void addSoldPosition(SoldPosition soldPosition) { soldPositions.add(soldPosition); }
    public void addCashBalance(CashBalance balance) { cashBalances.add(balance); }
    public void addValuation(AccountValuation valuation) { valuations.add(valuation); }
    public void addObservedRate(FxRate rate) { observedRates.add(rate); }
    public void addEnrichment(EnrichmentDraft draft) { enrichments.add(draft); }

    /**
     * Withholding rows with no dividend to pair with. Kept as {@code OTHER} cash flows and
     * listed separately so they show up in the import summary.
     */
    public void addOrphanedWithholding(CashFlow cashFlow) {
        cashFlows.add(cashFlow);
        orphanedWithholdings.add(cashFlow);
    }

    public void addError(RowError error) { errors.add(error); }

    public void error(String section, int lineNumber, String message, String rawRow) {
        errors.add(new RowError(sourceName, section, lineNumber, message, rawRow));
    }

    public void ignore(String reason) {
        ignored.merge(reason, 1, Integer::sum);
    }

    public String sourceName() { return sourceName; }
    public FormatTag format() { return format; }
    public List<InstrumentRef> instruments() { return Collections.unmodifiableList(instruments); }
    public List<TradeDraft> trades() { return Collections.unmodifiableList(trades); }
    public List<DividendDraft> dividends() { return Collections.unmodifiableList(dividends); }
    public List<CashFlow> cashFlows() { return Collections.unmodifiableList(cashFlows); }
    public List<CashFlow> orphanedWithholdings() { return Collections.unmodifiableList(orphanedWithholdings); }
    public List<CorporateActionDraft> corporateActions() { return Collections.unmodifiableList(corporateActions); }
    public List<SnapshotDraft> snapshots() { return Collections.unmodifiableList(snapshots); }
    public List<SoldPosition> soldPositions() { return Collections.unmodifiableList(soldPositions); }
    public List<CashBalance> cashBalances() { return Collections.unmodifiableList(cashBalances); }
    public List<AccountValuation> valuations() { return Collections.unmodifiableList(valuations); }
    public List<FxRate> observedRates() { return Collections.unmodifiableList(observedRates); }
    public List<EnrichmentDraft> enrichments() { return Collections.unmodifiableList(enrichments); }
    public List<RowError> errors() { return Collections.unmodifiableList(errors); }
    public Map<String, Integer> ignored() { return Collections.unmodifiableMap(ignored); }

    /** Number of ledger records (snapshot positions counted individually). */
    public int recordCount() {
        int positions = snapshots.stream().mapToInt(s -> s.snapshot().positions().size()).sum();
        return trades.size() + dividends.size() + cashFlows.size() + corporateActions.size()
            + positions + soldPositions.size() + cashBalances.size() + valuations.size();
    }
}
