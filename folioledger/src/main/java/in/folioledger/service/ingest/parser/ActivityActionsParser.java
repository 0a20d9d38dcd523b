package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.csv.CsvLines;
import in.folioledger.service.ingest.csv.SourceLine;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Activity report: an account summary block followed by a transaction block keyed by
 * activity code.
 *
 * <pre>
 * DIV, PIL        dividend (paired with FRTAX / WHT withholding rows)
 * BUY, SELL       trade
 * DEP, WITH       deposit, withdrawal
 * CINT, DINT      interest
 * OFEE            fee
 * CORP            corporate action
 * ADJ             ignored
 * </pre>
 *
 * The transaction block ends at the next {@code ClientAccountID} header (open/closed lot
 * sections follow in some exports).
 */
public final class ActivityActionsParser extends AbstractReportParser {

    static final String SOURCE = "ibkr_flex";

    private static final Set<String> KNOWN = Set.of(
        "ClientAccountID", "CurrencyPrimary", "FXRateToBase", "AssetClass", "Symbol", "Description", "Conid", "CUSIP",
        "ISIN", "FIGI", "ListingExchange", "Multiplier", "Date", "SettleDate", "ActivityCode", "ActivityDescription",
        "TradeID", "TransactionID", "Buy/Sell", "TradeQuantity", "TradePrice", "TradeGross", "TradeCommission",
        "TradeTax", "Debit", "Credit", "Amount", "LevelOfDetail", "FromDate", "ToDate", "StartingCash", "EndingCash"
    );

    @Override
    public FormatTag format() {
        return FormatTag.ACTIVITY_ACTIONS;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        List<SourceLine> lines = input.lines();

        int txnHeader = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (isTransactionHeader(lines.get(i).text(), input.delimiter())) {
                txnHeader = i;
                break;
            }
        }
        if (txnHeader < 0) {
            result.error(null, 0, "No ActivityCode/TransactionID header found", null);
            return result;
        }

        if (txnHeader > 0) {
            RoutedInput summary = new RoutedInput(format(), input.delimiter(), lines.subList(0, txnHeader), null);
            eachRow(readRows(summary, context, result), result,
                row -> CashSummaryRows.parse(row, context, result, provenance(row, context), SOURCE));
        }

        List<SourceLine> txnLines = new ArrayList<>();
        String headerText = lines.get(txnHeader).text().trim();
        for (int i = txnHeader; i < lines.size(); i++) {
            String text = lines.get(i).text();
            if (i > txnHeader && startsNewBlock(text) && !text.trim().equals(headerText)) {
                break;
            }
            txnLines.add(lines.get(i));
        }
        RoutedInput transactions = new RoutedInput(format(), input.delimiter(), txnLines, null);

        List<DividendPairer.GrossRow> grossRows = new ArrayList<>();
        List<DividendPairer.WithholdingRow> withholdingRows = new ArrayList<>();
        eachRow(readRows(transactions, context, result, cells -> cells.contains("ActivityCode") && cells.contains("TransactionID")),
            result, row -> parseTransaction(row, context, result, grossRows, withholdingRows));

        DividendPairer.Outcome outcome = DividendPairer.pair(grossRows, withholdingRows, SOURCE);
        outcome.dividends().forEach(result::addDividend);
        outcome.orphanedWithholdings().forEach(result::addOrphanedWithholding);
        for (int i = 0; i < outcome.zeroSkipped(); i++) {
            result.ignore("zero dividend");
        }
        return result;
    }

    private void parseTransaction(SectionRow row, ParseContext context, ParseResult result,
                                  List<DividendPairer.GrossRow> grossRows,
                                  List<DividendPairer.WithholdingRow> withholdingRows) {
        String code = Fields.upper(row.get("ActivityCode"));
        if (code == null || "ADJ".equals(code)) {
            result.ignore(code == null ? "no activity code" : "adjustment");
            return;
        }
        LocalDate date = Fields.date(require(row.get("Date"), "Date"));
        String currency = Fields.upper(require(row.get("CurrencyPrimary"), "CurrencyPrimary"));
        String description = row.first("ActivityDescription", "Description");
        String transactionId = row.get("TransactionID");
        BigDecimal amount = amount(row);
        BigDecimal fxRate = Fields.decimal(row.get("FXRateToBase"));
        InstrumentRef ref = instrumentRef(row, currency, date);

        switch (code) {
            case "DIV", "PIL" -> {
                requireInstrument(ref, code);
                grossRows.add(new DividendPairer.GrossRow(
                    ref, date, null, currency, amount, BigDecimal.ZERO, null,
                    DescriptionParser.perShare(description), fxRate, description, null, provenance(row, context)));
            }
            case "FRTAX", "WHT" -> {
                requireInstrument(ref, code);
                withholdingRows.add(new DividendPairer.WithholdingRow(
                    ref, date, currency, amount, description, null, provenance(row, context)));
            }
            case "BUY", "SELL" -> {
                requireInstrument(ref, code);
                result.addTrade(new TradeDraft(ref, trade(row, code, date, currency, fxRate, description, transactionId, context)));
            }
            case "DEP" -> result.addCashFlow(cashFlow(CashFlowType.DEPOSIT, row, date, currency, amount, fxRate, description, transactionId, context));
            case "WITH" -> result.addCashFlow(cashFlow(CashFlowType.WITHDRAWAL, row, date, currency, amount, fxRate, description, transactionId, context));
            case "CINT", "DINT" -> result.addCashFlow(cashFlow(CashFlowType.INTEREST, row, date, currency, amount, fxRate, description, transactionId, context));
            case "OFEE" -> result.addCashFlow(cashFlow(CashFlowType.FEE, row, date, currency, amount, fxRate, description, transactionId, context));
            case "CORP" -> result.addCorporateAction(new CorporateActionDraft(ref, new CorporateAction(
                transactionId != null
                    ? ExternalIds.nativeId(SOURCE, "corp", transactionId)
                    : ExternalIds.hash("corporate_action", ref == null ? null : ref.naturalKey(), date, description),
                null,
                "CORP",
                date,
                description,
                Fields.decimal(row.get("TradeQuantity")),
                amount,
                Fields.decimal(row.get("TradeGross")),
                currency,
                provenance(row, context))));
            default -> result.ignore("activity code " + code);
        }

        if (fxRate != null && !currency.equalsIgnoreCase(context.baseCurrency())) {
            result.addObservedRate(new FxRate(date, currency, fxRate, "activity"));
        }
    }

    private Trade trade(SectionRow row, String code, LocalDate date, String currency, BigDecimal fxRate,
                        String description, String transactionId, ParseContext context) {
        BigDecimal quantity = Fields.decimal(require(row.get("TradeQuantity"), "TradeQuantity")).abs();
        if ("SELL".equals(code)) {
            quantity = quantity.negate();
        }
        BigDecimal price = Fields.decimal(require(row.get("TradePrice"), "TradePrice"));
        BigDecimal gross = Fields.decimal(row.get("TradeGross"));
        if (gross == null) {
            gross = quantity.multiply(price).negate();
        }
        BigDecimal commission = Fields.decimalOrZero(row.get("TradeCommission")).add(Fields.decimalOrZero(row.get("TradeTax")));

        String tradeId = row.get("TradeID");
        String externalId;
        if (tradeId != null) {
            externalId = ExternalIds.nativeId(SOURCE, "trade", tradeId);
        } else if (transactionId != null) {
            externalId = ExternalIds.nativeId(SOURCE, "txn", transactionId);
        } else {
            externalId = ExternalIds.hash("trade", row.first("ISIN", "Symbol"), date, quantity, price, gross);
        }
        return new Trade(externalId, null, date, null, Fields.date(row.get("SettleDate")), quantity, price, gross,
            commission, currency, fxRate, row.get("AssetClass"), row.get("ListingExchange"), description, null,
            provenance(row, context));
    }

    private CashFlow cashFlow(CashFlowType type, SectionRow row, LocalDate date, String currency, BigDecimal amount,
                              BigDecimal fxRate, String description, String transactionId, ParseContext context) {
        String externalId = transactionId != null
            ? ExternalIds.nativeId(SOURCE, "txn", transactionId)
            : ExternalIds.hash("cashflow", type.code(), date, amount, currency, description);
        return new CashFlow(externalId, type, date, amount, currency, fxRate, null, description, SOURCE,
            provenance(row, context));
    }

    private static BigDecimal amount(SectionRow row) {
        BigDecimal amount = Fields.decimal(row.get("Amount"));
        if (amount != null) return amount;
        BigDecimal credit = Fields.decimalOrZero(row.get("Credit"));
        BigDecimal debit = Fields.decimalOrZero(row.get("Debit"));
        return credit.add(debit);
    }

    private static InstrumentRef instrumentRef(SectionRow row, String currency, LocalDate date) {
        String isin = row.get("ISIN");
        String symbol = row.get("Symbol");
        if (isin == null && symbol == null) return null;
        return InstrumentRef.of(isin, hints()
            .symbol(symbol)
            .exchange(row.get("ListingExchange"))
            .name(row.get("Description"))
            .assetCategory(row.get("AssetClass"))
            .currency(currency)
            .cusip(row.get("CUSIP"))
            .conid(row.get("Conid"))
            .figi(row.get("FIGI"))
            .multiplier(Fields.decimal(row.get("Multiplier")))
            .source(AliasSource.IBKR_FLEX)
            .seenOn(date)
            .build());
    }

    private static void requireInstrument(InstrumentRef ref, String code) {
        if (ref == null) {
            throw new IllegalArgumentException(code + " row without ISIN or symbol");
        }
    }

    private static boolean isTransactionHeader(String line, char delimiter) {
        if (!line.contains("ActivityCode") || !line.contains("TransactionID")) return false;
        try {
            List<String> cells = CsvLines.split(line, delimiter);
            return cells.contains("ActivityCode") && cells.contains("TransactionID");
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean startsNewBlock(String line) {
        String stripped = line.startsWith("\"") ? line.substring(1) : line;
        return stripped.startsWith("ClientAccountID");
    }
}
