package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;
import in.folioledger.service.ingest.parser.SnapshotDraft;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code Open Positions}: the {@code Summary} rows become one snapshot dated at the end
 * of the statement period. {@code Lot} rows break summaries down and are skipped.
 */
final class OpenPositionsSection implements StatementSection {

    static final String SECTION = "Open Positions";

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        List<SectionRow> rows = statement.rows(SECTION);
        if (rows.isEmpty()) {
            return;
        }
        if (statement.periodEnd() == null) {
            SectionRow row = rows.get(0);
            result.error(SECTION, row.lineNumber(), "Open Positions without statement period", row.rawLine());
            return;
        }
        List<Position> positions = new ArrayList<>();
        List<InstrumentRef> refs = new ArrayList<>();

        Rows.each(rows, result, row -> {
            String discriminator = row.get("DataDiscriminator");
            if (discriminator != null && !"Summary".equalsIgnoreCase(discriminator)) {
                result.ignore("position lot row");
                return;
            }
            String category = row.get("Asset Category");
            String currency = Fields.upper(row.get("Currency"));
            if (category == null || StatementContext.isTotalRow(category) || StatementContext.isTotalRow(currency)) {
                result.ignore("position total");
                return;
            }
            String symbol = row.get("Symbol");
            BigDecimal quantity = Fields.decimal(row.get("Quantity"));
            BigDecimal value = Fields.decimal(row.get("Value"));
            if (symbol == null || quantity == null || value == null) {
                throw new IllegalArgumentException("Position row needs Symbol, Quantity and Value");
            }
            InstrumentRef ref = statement.reference(symbol, null, currency, category, statement.periodEnd());
            BigDecimal costBasis = Fields.decimal(row.get("Cost Basis"));
            BigDecimal unrealized = Fields.decimal(row.get("Unrealized P/L"));
            positions.add(new Position(
                null,
                symbol,
                ref.isin(),
                currency,
                quantity,
                Fields.decimal(row.get("Close Price")),
                value,
                Fields.decimal(row.get("Cost Price")),
                costBasis,
                unrealized,
                null,
                category,
                null,
                statement.provenance(row)
            ));
            refs.add(ref);
        });

        if (positions.isEmpty()) {
            return;
        }
        SectionRow first = rows.get(0);
        PortfolioSnapshot snapshot = new PortfolioSnapshot(
            ExternalIds.hash("snapshot", StatementContext.SOURCE, statement.periodEnd()),
            statement.periodEnd(),
            StatementContext.SOURCE,
            null,
            null,
            positions,
            statement.provenance(first)
        );
        result.addSnapshot(new SnapshotDraft(snapshot, refs));
    }
}
