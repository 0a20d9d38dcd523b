package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deposits, withdrawals, interest and fee sections. Layouts differ per section, so the
 * date and amount are looked up by the first column name that exists.
 */
final class CashMovementsSection implements StatementSection {

    static final String DEPOSITS = "Deposits & Withdrawals";

    /** Section name to flow type; deposits are typed by sign instead. */
    private static final Map<String, CashFlowType> SECTIONS = new LinkedHashMap<>();
    static {
        SECTIONS.put(DEPOSITS, null);
        SECTIONS.put("Interest", CashFlowType.INTEREST);
        SECTIONS.put("Broker Interest Paid", CashFlowType.INTEREST);
        SECTIONS.put("Broker Interest Received", CashFlowType.INTEREST);
        SECTIONS.put("Fees", CashFlowType.FEE);
        SECTIONS.put("Other Fees", CashFlowType.FEE);
        SECTIONS.put("Transaction Fees", CashFlowType.FEE);
        SECTIONS.put("Sales Tax Details", CashFlowType.FEE);
    }

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        SECTIONS.forEach((section, type) ->
            Rows.each(statement.rows(section), result, row -> parseRow(statement, result, row, type)));
    }

    private void parseRow(StatementContext statement, ParseResult result, SectionRow row, CashFlowType fixedType) {
        String currency = Fields.upper(row.get("Currency"));
        String dateValue = row.first("Settle Date", "Date", "Date/Time");
        if (StatementContext.isTotalRow(currency) || dateValue == null) {
            result.ignore("cash movement total");
            return;
        }
        if (!Character.isDigit(dateValue.charAt(0))) {
            result.ignore("undated cash movement");
            return;
        }
        LocalDate date = Fields.date(dateValue);
        BigDecimal amount = Fields.decimal(row.first("Amount", "Sales Tax"));
        if (amount == null) {
            throw new IllegalArgumentException("Missing Amount");
        }
        CashFlowType type = fixedType != null ? fixedType
            : amount.signum() > 0 ? CashFlowType.DEPOSIT : CashFlowType.WITHDRAWAL;
        String description = row.get("Description");

        result.addCashFlow(new CashFlow(
            ExternalIds.hash("cashflow", type.code(), date, amount, currency, description),
            type,
            date,
            amount,
            currency,
            null,
            null,
            description,
            StatementContext.SOURCE,
            statement.provenance(row)
        ));
    }
}
