package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.CashBalance;
import in.folioledger.service.ingest.parser.ExternalIds;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code Cash Report}: one row per (line item, currency). Only the {@code Starting Cash}
 * and {@code Ending Cash} lines are kept; {@code Base Currency Summary} is the
 * account-wide figure in base currency.
 */
final class CashReportSection implements StatementSection {

    static final String SECTION = "Cash Report";
    static final String BASE_CURRENCY_SUMMARY = "Base Currency Summary";

    private record Amounts(SectionRow row, BigDecimal[] values) {}

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        Map<String, Amounts> byCurrency = new LinkedHashMap<>();
        for (SectionRow row : statement.rows(SECTION)) {
            String line = row.get("Currency Summary");
            boolean starting = "Starting Cash".equalsIgnoreCase(line);
            boolean ending = "Ending Cash".equalsIgnoreCase(line);
            if (!starting && !ending) {
                continue;
            }
            String currency = row.get("Currency");
            if (currency == null) {
                result.error(SECTION, row.lineNumber(), "Cash line without currency", row.rawLine());
                continue;
            }
            BigDecimal amount;
            try {
                amount = Fields.decimal(row.first("Total", "Amount"));
            } catch (IllegalArgumentException e) {
                result.error(SECTION, row.lineNumber(), e.getMessage(), row.rawLine());
                continue;
            }
            Amounts amounts = byCurrency.computeIfAbsent(currency, c -> new Amounts(row, new BigDecimal[2]));
            amounts.values()[starting ? 0 : 1] = amount;
        }
        if (byCurrency.isEmpty()) {
            return;
        }
        if (statement.periodEnd() == null) {
            SectionRow row = byCurrency.values().iterator().next().row();
            result.error(SECTION, row.lineNumber(), "Cash Report without statement period", row.rawLine());
            return;
        }

        byCurrency.forEach((label, amounts) -> {
            boolean base = BASE_CURRENCY_SUMMARY.equalsIgnoreCase(label);
            String currency = base ? statement.parse().baseCurrency() : label.toUpperCase();
            result.addCashBalance(new CashBalance(
                ExternalIds.hash("cash_balance", StatementContext.SOURCE, base ? "BASE_SUMMARY" : currency,
                    statement.periodStart(), statement.periodEnd()),
                statement.periodEnd(),
                currency,
                amounts.values()[0],
                amounts.values()[1],
                base,
                StatementContext.SOURCE,
                statement.provenance(amounts.row())
            ));
        });
    }
}
