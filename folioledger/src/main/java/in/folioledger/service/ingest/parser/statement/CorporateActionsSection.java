package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.service.ingest.parser.CorporateActionDraft;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;

import java.time.LocalDate;
import java.util.Locale;

/**
 * {@code Corporate Actions}. The action type is read from the description
 * ({@code ... Split 4 for 1}, {@code ... Spinoff ...}).
 */
final class CorporateActionsSection implements StatementSection {

    static final String SECTION = "Corporate Actions";

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        Rows.each(statement.rows(SECTION), result, row -> {
            String currency = Fields.upper(row.get("Currency"));
            String category = row.get("Asset Category");
            if (category == null || StatementContext.isTotalRow(category) || StatementContext.isTotalRow(currency)) {
                result.ignore("corporate action total");
                return;
            }
            LocalDate date = Fields.date(row.first("Date/Time", "Report Date"));
            if (date == null) {
                throw new IllegalArgumentException("Missing Date/Time");
            }
            String description = row.get("Description");
            InstrumentRef ref = statement.reference(null, description, currency, category, date);
            CorporateAction action = new CorporateAction(
                ExternalIds.hash("corporate_action", StatementContext.SOURCE, date, description, row.get("Quantity")),
                null,
                actionType(description),
                date,
                description,
                Fields.decimal(row.get("Quantity")),
                Fields.decimal(row.get("Value")),
                Fields.decimal(row.get("Proceeds")),
                currency,
                statement.provenance(row)
            );
            result.addCorporateAction(new CorporateActionDraft(ref, action));
        });
    }

    static String actionType(String description) {
        String d = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (d.contains("split")) return "split";
        if (d.contains("spinoff") || d.contains("spin-off")) return "spinoff";
        if (d.contains("merged") || d.contains("merger") || d.contains("acquisition")) return "merger";
        if (d.contains("tender")) return "tender";
        if (d.contains("rights")) return "rights_issue";
        if (d.contains("change") && (d.contains("symbol") || d.contains("name") || d.contains("cusip") || d.contains("isin"))) {
            return "identifier_change";
        }
        return "other";
    }
}
