package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Dividend report: one row per paid dividend with per-share gross rate and net amount.
 *
 * Net amount is taken as an absolute value and zero rows are skipped. Gross comes from
 * {@code GrossAmount} when present, else rate times quantity; the difference to net is the
 * withholding. Missing currencies fall back to the issuer country of the ISIN.
 */
public final class DividendReportParser extends AbstractReportParser {

    static final String SOURCE = "ibkr_flex";

    private static final Set<String> KNOWN = Set.of(
        "Symbol", "ISIN", "FIGI", "AssetClass", "CurrencyPrimary", "FXRateToBase", "ExDate", "PayDate",
        "Quantity", "GrossRate", "GrossAmount", "Tax", "NetAmount", "Description", "ListingExchange", "Conid"
    );

    @Override
    public FormatTag format() {
        return FormatTag.DIVIDEND_REPORT;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        List<DividendPairer.GrossRow> grossRows = new ArrayList<>();

        eachRow(readRows(input, context, result), result, row -> {
            BigDecimal net = Fields.decimal(row.get("NetAmount"));
            if (net == null || net.signum() == 0) {
                result.ignore("zero net amount");
                return;
            }
            net = net.abs();

            String isin = Fields.upper(row.get("ISIN"));
            String symbol = row.get("Symbol");
            if (isin == null && symbol == null) {
                throw new IllegalArgumentException("Dividend has neither ISIN nor symbol");
            }
            LocalDate exDate = Fields.date(row.get("ExDate"));
            LocalDate payDate = Fields.date(row.get("PayDate"));
            if (payDate == null) payDate = exDate;
            if (payDate == null) {
                throw new IllegalArgumentException("Dividend has neither PayDate nor ExDate");
            }
            String currency = Fields.upper(row.get("CurrencyPrimary"));
            if (currency == null) {
                currency = IsinCurrency.forIsin(isin);
            }

            BigDecimal quantity = Fields.decimal(row.get("Quantity"));
            BigDecimal grossRate = Fields.decimal(row.get("GrossRate"));
            BigDecimal gross = grossAmount(row, grossRate, quantity, net);
            BigDecimal fxRate = Fields.decimal(row.get("FXRateToBase"));

            InstrumentRef ref = InstrumentRef.of(isin, hints()
                .symbol(symbol)
                .exchange(row.get("ListingExchange"))
                .name(row.get("Description"))
                .assetCategory(row.get("AssetClass"))
                .currency(currency)
                .figi(row.get("FIGI"))
                .conid(row.get("Conid"))
                .source(AliasSource.IBKR_FLEX)
                .seenOn(payDate)
                .build());

            BigDecimal withholding = net.subtract(gross);
            grossRows.add(new DividendPairer.GrossRow(
                ref, payDate, exDate, currency, gross, withholding, quantity,
                grossRate != null && grossRate.signum() > 0 ? grossRate : null,
                fxRate, row.get("Description"), null, provenance(row, context)));

            if (fxRate != null && !currency.equalsIgnoreCase(context.baseCurrency())) {
                result.addObservedRate(new FxRate(payDate, currency, fxRate, "dividend"));
            }
        });

        DividendPairer.Outcome outcome = DividendPairer.pair(grossRows, List.of(), SOURCE);
        outcome.dividends().forEach(result::addDividend);
        outcome.orphanedWithholdings().forEach(result::addOrphanedWithholding);
        for (int i = 0; i < outcome.zeroSkipped(); i++) {
            result.ignore("zero net amount");
        }
        return result;
    }

    private static BigDecimal grossAmount(SectionRow row, BigDecimal grossRate, BigDecimal quantity, BigDecimal net) {
        BigDecimal explicit = Fields.decimal(row.get("GrossAmount"));
        if (explicit != null && explicit.abs().compareTo(net) >= 0) {
            return explicit.abs();
        }
        if (grossRate != null && quantity != null) {
            BigDecimal computed = grossRate.multiply(quantity).abs();
            if (computed.compareTo(net) >= 0) {
                return computed;
            }
        }
        return net;
    }
}
