package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.FxRate;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.domain.model.Provenance;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Open positions report, one snapshot per report date.
 *
 * Some exports append a dividend accruals table under its own header
 * ({@code GrossRate}, {@code ExDate}, ...). Accrual rows do not become ledger records;
 * they enrich the catalog with the announced dividend per payment.
 */
public final class HoldingsSnapshotParser extends AbstractReportParser {

    static final String SOURCE = "ibkr_flex";

    private static final Set<String> KNOWN = Set.of(
        "ReportDate", "CurrencyPrimary", "Symbol", "Description", "SubCategory", "Quantity", "MarkPrice",
        "PositionValue", "CostBasisPrice", "CostBasisMoney", "OpenPrice", "PercentOfNAV", "FifoPnlUnrealized",
        "ListingExchange", "AssetClass", "FXRateToBase", "ISIN", "FIGI", "Conid", "HoldingPeriodDateTime",
        "ExDate", "PayDate", "GrossRate", "GrossAmount", "NetAmount"
    );

    @Override
    public FormatTag format() {
        return FormatTag.HOLDINGS_SNAPSHOT;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        List<SectionRow> rows = readRows(input, context, result,
            cells -> cells.contains("GrossRate") && cells.contains("ExDate"));

        Map<LocalDate, List<Position>> positionsByDate = new TreeMap<>();
        Map<LocalDate, List<InstrumentRef>> refsByDate = new TreeMap<>();

        eachRow(rows, result, row -> {
            if (row.has("GrossRate") && row.has("ExDate") && !row.has("MarkPrice")) {
                parseAccrual(row, result);
                return;
            }
            LocalDate reportDate = Fields.date(require(row.get("ReportDate"), "ReportDate"));
            Position position = parsePosition(row, context);
            positionsByDate.computeIfAbsent(reportDate, d -> new ArrayList<>()).add(position);
            refsByDate.computeIfAbsent(reportDate, d -> new ArrayList<>()).add(instrumentRef(row, reportDate));

            if (position.fxRateToBase() != null && position.currency() != null
                    && !position.currency().equalsIgnoreCase(context.baseCurrency())) {
                result.addObservedRate(new FxRate(reportDate, position.currency(), position.fxRateToBase(), "position"));
            }
        });

        for (Map.Entry<LocalDate, List<Position>> entry : positionsByDate.entrySet()) {
            LocalDate date = entry.getKey();
            Provenance provenance = Provenance.of(context.sourceName(), format(), null,
                input.header().number(), input.header().text(),
                Map.of("ReportDate", date.toString(), "Positions", String.valueOf(entry.getValue().size())));
            PortfolioSnapshot snapshot = new PortfolioSnapshot(
                ExternalIds.hash("snapshot", SOURCE, date),
                date,
                SOURCE,
                null,
                null,
                entry.getValue(),
                provenance
            );
            result.addSnapshot(new SnapshotDraft(snapshot, refsByDate.get(date)));
        }
        if (rows.isEmpty()) {
            result.ignore("empty report");
        }
        return result;
    }

    private Position parsePosition(SectionRow row, ParseContext context) {
        String symbol = row.get("Symbol");
        String isin = Fields.upper(row.get("ISIN"));
        if (symbol == null && isin == null) {
            throw new IllegalArgumentException("Position has neither ISIN nor symbol");
        }
        BigDecimal quantity = Fields.decimal(require(row.get("Quantity"), "Quantity"));
        BigDecimal markPrice = Fields.decimal(row.get("MarkPrice"));
        BigDecimal positionValue = Fields.decimal(row.get("PositionValue"));
        if (positionValue == null && markPrice != null) {
            positionValue = quantity.multiply(markPrice);
        }
        if (positionValue == null) {
            throw new IllegalArgumentException("Missing PositionValue");
        }
        return new Position(
            null,
            symbol,
            isin,
            Fields.upper(row.get("CurrencyPrimary")),
            quantity,
            markPrice,
            positionValue,
            Fields.decimal(row.get("CostBasisPrice")),
            Fields.decimal(row.get("CostBasisMoney")),
            Fields.decimal(row.get("FifoPnlUnrealized")),
            Fields.decimal(row.get("FXRateToBase")),
            row.get("AssetClass"),
            row.get("ListingExchange"),
            provenance(row, context)
        );
    }

    private InstrumentRef instrumentRef(SectionRow row, LocalDate seenOn) {
        return InstrumentRef.of(row.get("ISIN"), hints()
            .symbol(row.get("Symbol"))
            .exchange(row.get("ListingExchange"))
            .name(row.get("Description"))
            .assetCategory(row.get("AssetClass"))
            .currency(Fields.upper(row.get("CurrencyPrimary")))
            .figi(row.get("FIGI"))
            .conid(row.get("Conid"))
            .type(row.get("SubCategory"))
            .source(AliasSource.IBKR_FLEX)
            .seenOn(seenOn)
            .build());
    }

    private void parseAccrual(SectionRow row, ParseResult result) {
        BigDecimal grossRate = Fields.decimal(row.get("GrossRate"));
        if (grossRate == null || grossRate.signum() == 0) {
            result.ignore("accrual without rate");
            return;
        }
        String isin = row.get("ISIN");
        String symbol = row.get("Symbol");
        if (isin == null && symbol == null) {
            throw new IllegalArgumentException("Accrual has neither ISIN nor symbol");
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put("dividend_per_payment", grossRate.stripTrailingZeros().toPlainString());
        values.put("dividend_source", "accruals");
        putIfPresent(values, "dividend_ex_date", row.get("ExDate") == null ? null : Fields.date(row.get("ExDate")).toString());
        putIfPresent(values, "dividend_pay_date", row.get("PayDate") == null ? null : Fields.date(row.get("PayDate")).toString());
        putIfPresent(values, "dividend_currency", Fields.upper(row.get("CurrencyPrimary")));

        InstrumentRef ref = InstrumentRef.of(isin, hints()
            .symbol(symbol)
            .currency(Fields.upper(row.get("CurrencyPrimary")))
            .source(AliasSource.IBKR_FLEX)
            .build());
        result.addEnrichment(new EnrichmentDraft(ref, values));
    }

    private static void putIfPresent(Map<String, String> values, String key, String value) {
        if (value != null) values.put(key, value);
    }
}
