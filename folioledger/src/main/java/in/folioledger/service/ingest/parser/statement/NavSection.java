package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.AccountValuation;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;

/**
 * {@code Change in NAV}: the broker's starting and ending account value for the
 * statement period, in base currency.
 */
final class NavSection implements StatementSection {

    static final String SECTION = "Change in NAV";

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        BigDecimal starting = null;
        BigDecimal ending = null;
        SectionRow first = null;
        for (SectionRow row : statement.rows(SECTION)) {
            String field = row.get("Field Name");
            if ("Starting Value".equalsIgnoreCase(field)) {
                starting = value(row, result);
                first = first == null ? row : first;
            } else if ("Ending Value".equalsIgnoreCase(field)) {
                ending = value(row, result);
                first = first == null ? row : first;
            }
        }
        if (first == null) {
            return;
        }
        if (statement.periodEnd() == null) {
            result.error(SECTION, first.lineNumber(), "Change in NAV without statement period", first.rawLine());
            return;
        }
        if (starting == null && ending == null) {
            return;
        }
        result.addValuation(new AccountValuation(
            ExternalIds.hash("valuation", StatementContext.SOURCE, statement.periodStart(), statement.periodEnd()),
            statement.periodStart(),
            statement.periodEnd(),
            starting,
            ending,
            statement.parse().baseCurrency(),
            StatementContext.SOURCE,
            statement.provenance(first)
        ));
    }

    private static BigDecimal value(SectionRow row, ParseResult result) {
        try {
            return Fields.decimal(row.get("Field Value"));
        } catch (IllegalArgumentException e) {
            result.error(SECTION, row.lineNumber(), e.getMessage(), row.rawLine());
            return null;
        }
    }
}
