package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.SoldPosition;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Nordnet transaction export: UTF-16, tab separated, decimal commas, Finnish headers.
 *
 * The header repeats {@code Valuutta} after each amount column, so columns are addressed
 * as {@code Valuutta}, {@code Valuutta#2}, ... The {@code Id} column is a native
 * transaction id. Sales that report a result ({@code Tulos}) also yield a
 * {@link SoldPosition}, which links to the catalog by ISIN only.
 */
public final class TransactionExportParser extends AbstractReportParser {
    private static final Logger log = LoggerFactory.getLogger(TransactionExportParser.class);

    static final String SOURCE = "nordnet";

    private static final Map<String, String> TYPES = Map.ofEntries(
        Map.entry("OSTO", "buy"),
        Map.entry("MYYNTI", "sell"),
        Map.entry("OSINKO", "dividend"),
        Map.entry("ENNAKKOPIDÄTYS", "withholding"),
        Map.entry("ULKOM. KUPONKIVERO", "withholding"),
        Map.entry("TALLETUS", "deposit"),
        Map.entry("NOSTO", "withdrawal"),
        Map.entry("VALUUTAN OSTO", "fx"),
        Map.entry("VALUUTAN MYYNTI", "fx"),
        Map.entry("LAINAKORKO", "interest"),
        Map.entry("PÄÄOMIT YLIT.KORKO", "interest"),
        Map.entry("DEBET KORON KORJ.", "interest")
    );

    private static final Set<String> CORPORATE_ACTIONS = Set.of(
        "VAIHTO AP-JÄTTÖ", "VAIHTO AP-OTTO", "YHTIÖIT. IRR JÄTTÖ", "POISTO AP OTTO", "MERKINTÄ AP JÄTTÖ",
        "MERKINNÄN MAKSU", "JÄTTÖ SIIRTO", "MO OTTO EMISSION YHT", "AP OTTO"
    );

    private static final Set<String> KNOWN = Set.of(
        "Id", "Kirjauspäivä", "Kauppapäivä", "Maksupäivä", "Salkku", "Tapahtumatyyppi", "Arvopaperi", "ISIN",
        "Määrä", "Kurssi", "Korko", "Kokonaiskulut", "Valuutta", "Summa", "Hankinta-arvo", "Tulos",
        "Kokonaismäärä", "Saldo", "Vaihtokurssi", "Tapahtumateksti", "Mitätöintipäivä", "Laskelma",
        "Vahvistusnumero", "Välityspalkkio", "Viitevaluuttakurssi", "Alkuperäinen korko"
    );

    @Override
    public FormatTag format() {
        return FormatTag.TRANSACTION_EXPORT;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        List<DividendPairer.GrossRow> grossRows = new ArrayList<>();
        List<DividendPairer.WithholdingRow> withholdingRows = new ArrayList<>();

        eachRow(readRows(input, context, result), result, row -> {
            if (row.get("Mitätöintipäivä") != null) {
                result.ignore("cancelled");
                return;
            }
            String rawType = Fields.upper(require(row.get("Tapahtumatyyppi"), "Tapahtumatyyppi"));
            String type = TYPES.get(rawType);
            if (type == null) {
                if (!CORPORATE_ACTIONS.contains(rawType)) {
                    log.warn("Unknown transaction type '{}' in {} line {}, stored as corporate action",
                        rawType, context.sourceName(), row.lineNumber());
                }
                type = "corporate_action";
            }

            LocalDate entryDate = Fields.date(row.get("Kirjauspäivä"));
            LocalDate tradeDate = Fields.date(row.get("Kauppapäivä"));
            LocalDate payDate = Fields.date(row.get("Maksupäivä"));
            LocalDate date = firstDate(tradeDate, entryDate, payDate);
            if (date == null) {
                throw new IllegalArgumentException("Row has no date");
            }
            String id = row.get("Id");
            String currency = Fields.upper(row.first("Valuutta#2", "Valuutta"));
            BigDecimal amount = Fields.decimalComma(row.get("Summa"));
            BigDecimal fxRate = fxRate(row, currency, context);
            InstrumentRef ref = instrumentRef(row, currency, date);

            switch (type) {
                case "buy", "sell" -> {
                    requireInstrument(ref, rawType);
                    Trade trade = trade(row, "sell".equals(type), date, payDate, currency, amount, fxRate, id, context);
                    result.addTrade(new TradeDraft(ref, trade));
                    if ("sell".equals(type)) {
                        soldPosition(row, trade, context).ifPresent(result::addSoldPosition);
                    }
                }
                case "dividend" -> {
                    requireInstrument(ref, rawType);
                    LocalDate dividendDate = firstDate(payDate, entryDate, tradeDate);
                    grossRows.add(new DividendPairer.GrossRow(
                        ref, dividendDate, null, currency, require(amount, "Summa"), BigDecimal.ZERO,
                        Fields.decimalComma(row.get("Määrä")), Fields.decimalComma(row.get("Kurssi")), fxRate,
                        row.get("Tapahtumateksti"), id, provenance(row, context)));
                }
                case "withholding" -> {
                    requireInstrument(ref, rawType);
                    LocalDate dividendDate = firstDate(payDate, entryDate, tradeDate);
                    BigDecimal tax = require(amount, "Summa");
                    withholdingRows.add(new DividendPairer.WithholdingRow(
                        ref, dividendDate, currency, tax.signum() > 0 ? tax.negate() : tax,
                        row.get("Tapahtumateksti"), id, provenance(row, context)));
                }
                case "deposit" -> result.addCashFlow(cashFlow(CashFlowType.DEPOSIT, row, date, currency, amount, fxRate, id, context));
                case "withdrawal" -> result.addCashFlow(cashFlow(CashFlowType.WITHDRAWAL, row, date, currency, amount, fxRate, id, context));
                case "interest" -> result.addCashFlow(cashFlow(CashFlowType.INTEREST, row, date, currency, amount, fxRate, id, context));
                case "fx" -> result.ignore("currency conversion");
                default -> result.addCorporateAction(new CorporateActionDraft(ref, new CorporateAction(
                    externalId(id, "corp", rawType, ref, date, amount),
                    null,
                    rawType,
                    date,
                    row.get("Tapahtumateksti"),
                    Fields.decimalComma(row.get("Määrä")),
                    amount,
                    null,
                    currency,
                    provenance(row, context))));
            }

            if (fxRate != null) {
                result.addObservedRate(new FxRate(date, currency, fxRate, "transaction"));
            }
        });

        DividendPairer.Outcome outcome = DividendPairer.pair(grossRows, withholdingRows, SOURCE);
        outcome.dividends().forEach(result::addDividend);
        outcome.orphanedWithholdings().forEach(result::addOrphanedWithholding);
        for (int i = 0; i < outcome.zeroSkipped(); i++) {
            result.ignore("zero dividend");
        }
        return result;
    }

    private Trade trade(SectionRow row, boolean sell, LocalDate date, LocalDate settleDate, String currency,
                        BigDecimal amount, BigDecimal fxRate, String id, ParseContext context) {
        BigDecimal quantity = Fields.decimalComma(require(row.get("Määrä"), "Määrä")).abs();
        if (sell) quantity = quantity.negate();
        BigDecimal price = Fields.decimalComma(require(row.get("Kurssi"), "Kurssi"));
        BigDecimal costs = Fields.decimalComma(row.get("Kokonaiskulut"));
        BigDecimal commission = costs == null ? BigDecimal.ZERO : costs.abs().negate();
        if (amount == null) {
            amount = quantity.multiply(price).negate();
        }
        InstrumentRef ref = instrumentRef(row, currency, date);
        return new Trade(
            externalId(id, "txn", sell ? "sell" : "buy", ref, date, amount),
            null,
            date,
            null,
            settleDate,
            quantity,
            price,
            amount,
            commission,
            currency,
            fxRate,
            null,
            null,
            row.get("Tapahtumateksti"),
            Fields.decimalComma(row.get("Tulos")),
            provenance(row, context)
        );
    }

    private Optional<SoldPosition> soldPosition(SectionRow row, Trade trade, ParseContext context) {
        BigDecimal realized = trade.realizedPnl();
        if (realized == null || trade.quantity().signum() == 0) {
            return Optional.empty();
        }
        BigDecimal quantity = trade.quantity().abs();
        BigDecimal purchasePrice = trade.price().subtract(realized.divide(quantity, 6, RoundingMode.HALF_UP));
        String resultCurrency = Fields.upper(row.first("Valuutta#4", "Valuutta#2", "Valuutta"));
        return Optional.of(new SoldPosition(
            ExternalIds.nativeId(SOURCE, "sold", trade.externalId()),
            Fields.upper(row.get("ISIN")),
            row.get("Arvopaperi"),
            trade.tradeDate(),
            quantity,
            purchasePrice,
            trade.price(),
            realized,
            resultCurrency,
            provenance(row, context)
        ));
    }

    private CashFlow cashFlow(CashFlowType type, SectionRow row, LocalDate date, String currency, BigDecimal amount,
                              BigDecimal fxRate, String id, ParseContext context) {
        require(amount, "Summa");
        String externalId = id != null
            ? ExternalIds.nativeId(SOURCE, "txn", id)
            : ExternalIds.hash("cashflow", type.code(), date, amount, currency, row.get("Tapahtumateksti"));
        return new CashFlow(externalId, type, date, amount, currency, fxRate, null,
            row.first("Tapahtumateksti", "Tapahtumatyyppi"), SOURCE, provenance(row, context));
    }

    private static String externalId(String id, String kind, String type, InstrumentRef ref, LocalDate date, BigDecimal amount) {
        if (id != null) {
            return ExternalIds.nativeId(SOURCE, kind, id);
        }
        return ExternalIds.hash(kind, type, ref == null ? null : ref.naturalKey(), date, amount);
    }

    /**
     * Exchange rate to the account currency, only meaningful for foreign-currency rows.
     */
    private static BigDecimal fxRate(SectionRow row, String currency, ParseContext context) {
        if (currency == null || currency.equalsIgnoreCase(context.baseCurrency())) {
            return null;
        }
        BigDecimal rate = Fields.decimalComma(row.get("Vaihtokurssi"));
        if (rate == null || rate.signum() <= 0 || rate.compareTo(BigDecimal.ONE) == 0) {
            return null;
        }
        return rate;
    }

    private static InstrumentRef instrumentRef(SectionRow row, String currency, LocalDate date) {
        String isin = row.get("ISIN");
        String symbol = row.get("Arvopaperi");
        if (isin == null && symbol == null) return null;
        return InstrumentRef.of(isin, hints()
            .symbol(symbol)
            .currency(currency)
            .source(AliasSource.NORDNET)
            .seenOn(date)
            .build());
    }

    private static void requireInstrument(InstrumentRef ref, String type) {
        if (ref == null) {
            throw new IllegalArgumentException(type + " row without ISIN or security");
        }
    }

    private static BigDecimal require(BigDecimal value, String column) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + column);
        }
        return value;
    }

    private static LocalDate firstDate(LocalDate... dates) {
        for (LocalDate date : dates) {
            if (date != null) return date;
        }
        return null;
    }
}
