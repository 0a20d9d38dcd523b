package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * Trade report: one row per execution keyed by the broker's trade id.
 *
 * Currency conversions (symbol like {@code EUR.USD}, no ISIN, or asset class CASH) are
 * not security trades and are ignored. Quantity is signed by the Buy/Sell column; the
 * cash amount is {@code -(quantity * price)}.
 */
public final class TradeReportParser extends AbstractReportParser {

    static final String SOURCE = "ibkr_flex";

    private static final Set<String> KNOWN = Set.of(
        "ISIN", "FIGI", "CUSIP", "Conid", "Symbol", "Description", "CurrencyPrimary", "FXRateToBase", "TradeID",
        "TradeDate", "DateTime", "SettleDateTarget", "Quantity", "TradePrice", "Taxes", "IBCommission", "Buy/Sell",
        "ListingExchange", "Exchange", "AssetClass", "FifoPnlRealized", "Multiplier"
    );

    @Override
    public FormatTag format() {
        return FormatTag.TRADE_REPORT;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());

        eachRow(readRows(input, context, result), result, row -> {
            if (isCurrencyConversion(row)) {
                result.ignore("currency conversion");
                return;
            }
            LocalDate tradeDate = Fields.date(require(row.first("TradeDate", "DateTime"), "TradeDate"));
            BigDecimal quantity = Fields.decimal(require(row.get("Quantity"), "Quantity")).abs();
            BigDecimal price = Fields.decimal(require(row.get("TradePrice"), "TradePrice"));
            String side = Fields.upper(require(row.get("Buy/Sell"), "Buy/Sell"));
            if (side.startsWith("SELL")) {
                quantity = quantity.negate();
            } else if (!side.startsWith("BUY")) {
                throw new IllegalArgumentException("Unknown Buy/Sell value '" + side + "'");
            }

            String currency = Fields.upper(row.get("CurrencyPrimary"));
            BigDecimal fxRate = Fields.decimal(row.get("FXRateToBase"));
            BigDecimal commission = Fields.decimalOrZero(row.get("IBCommission")).add(Fields.decimalOrZero(row.get("Taxes")));
            String tradeId = row.get("TradeID");
            String isin = Fields.upper(row.get("ISIN"));
            String symbol = row.get("Symbol");
            BigDecimal amount = quantity.multiply(price).negate();

            String externalId = tradeId != null
                ? ExternalIds.nativeId(SOURCE, "trade", tradeId)
                : ExternalIds.hash("trade", isin != null ? isin : symbol, tradeDate, quantity, price, amount);

            Trade trade = new Trade(
                externalId,
                null,
                tradeDate,
                Fields.time(row.get("DateTime")),
                Fields.date(row.get("SettleDateTarget")),
                quantity,
                price,
                amount,
                commission,
                currency,
                fxRate,
                row.get("AssetClass"),
                row.first("Exchange", "ListingExchange"),
                row.get("Description"),
                Fields.decimal(row.get("FifoPnlRealized")),
                provenance(row, context)
            );

            InstrumentRef ref = InstrumentRef.of(isin, hints()
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
                .seenOn(tradeDate)
                .build());
            result.addTrade(new TradeDraft(ref, trade));

            if (fxRate != null && currency != null && !currency.equalsIgnoreCase(context.baseCurrency())) {
                result.addObservedRate(new FxRate(tradeDate, currency, fxRate, "trade"));
            }
        });
        return result;
    }

    static boolean isCurrencyConversion(SectionRow row) {
        if ("CASH".equalsIgnoreCase(row.get("AssetClass"))) {
            return true;
        }
        String symbol = row.get("Symbol");
        return symbol != null && symbol.contains(".") && row.get("ISIN") == null;
    }
}
