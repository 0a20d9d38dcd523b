package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Trade;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;
import in.folioledger.service.ingest.parser.TradeDraft;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * {@code Trades}. Individual fills ({@code Trade} rows) are imported; statements that only
 * carry consolidated {@code Order} rows import those instead. {@code ClosedLot} rows
 * describe the lots a sale closed and are not executions. Forex rows are currency
 * conversions.
 */
final class TradesSection implements StatementSection {

    static final String SECTION = "Trades";

    private static final Set<String> SKIPPED_CATEGORIES = Set.of("Forex", "Total");

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        List<SectionRow> rows = statement.rows(SECTION);
        boolean hasTradeRows = rows.stream().anyMatch(r -> "Trade".equals(r.get("DataDiscriminator")));
        String accepted = hasTradeRows ? "Trade" : "Order";

        Rows.each(rows, result, row -> {
            String discriminator = row.get("DataDiscriminator");
            if (discriminator != null && !accepted.equals(discriminator)) {
                result.ignore("trade " + discriminator.toLowerCase() + " row");
                return;
            }
            String category = row.get("Asset Category");
            if (category == null || SKIPPED_CATEGORIES.contains(category)) {
                result.ignore("Forex".equals(category) ? "currency conversion" : "trade total");
                return;
            }
            String currency = Fields.upper(row.get("Currency"));
            if (StatementContext.isTotalRow(currency)) {
                result.ignore("trade total");
                return;
            }

            String dateTime = row.first("Date/Time", "Date");
            LocalDate date = Fields.date(dateTime);
            if (date == null) {
                throw new IllegalArgumentException("Missing Date/Time");
            }
            BigDecimal quantity = Fields.decimal(row.get("Quantity"));
            BigDecimal price = Fields.decimal(row.get("T. Price"));
            if (quantity == null || price == null) {
                throw new IllegalArgumentException("Missing Quantity or T. Price");
            }
            BigDecimal proceeds = Fields.decimal(row.get("Proceeds"));
            if (proceeds == null) {
                proceeds = quantity.multiply(price).negate();
            }

            String symbol = row.get("Symbol");
            InstrumentRef ref = statement.reference(symbol, null, currency, category, date);
            if (ref == null) {
                throw new IllegalArgumentException("Trade row without symbol");
            }

            Trade trade = new Trade(
                ExternalIds.hash("trade", ref.naturalKey(), dateTime, quantity, price, proceeds),
                null,
                date,
                Fields.time(dateTime),
                null,
                quantity,
                price,
                proceeds,
                Fields.decimalOrZero(row.get("Comm/Fee")),
                currency,
                null,
                category,
                row.get("Exchange"),
                row.get("Code"),
                Fields.decimal(row.get("Realized P/L")),
                statement.provenance(row)
            );
            result.addTrade(new TradeDraft(ref, trade));
        });
    }
}
