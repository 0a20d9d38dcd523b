package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CashBalance;
import in.folioledger.domain.model.Provenance;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Account summary rows ({@code ClientAccountID, CurrencyPrimary, LevelOfDetail, FromDate,
 * ToDate, StartingCash, ..., EndingCash}) shared by the cash summary report and the
 * summary block that opens activity reports.
 *
 * {@code BASE_SUMMARY} (in either the currency or the level column) marks the
 * account-wide row in base currency. Rows already converted to base for a single
 * currency ({@code LevelOfDetail=BaseCurrency}) repeat information and are ignored.
 */
final class CashSummaryRows {

    static final String BASE_SUMMARY = "BASE_SUMMARY";

    private CashSummaryRows() {}

    static void parse(SectionRow row, ParseContext context, ParseResult result, Provenance provenance, String source) {
        String currencyColumn = row.get("CurrencyPrimary");
        String level = row.get("LevelOfDetail");
        boolean baseSummary = BASE_SUMMARY.equalsIgnoreCase(currencyColumn) || BASE_SUMMARY.equalsIgnoreCase(level);

        if (!baseSummary && level != null && !"Currency".equalsIgnoreCase(level)) {
            result.ignore("converted summary row");
            return;
        }
        String currency = baseSummary ? context.baseCurrency() : Fields.upper(currencyColumn);
        if (currency == null) {
            throw new IllegalArgumentException("Summary row without currency");
        }
        LocalDate from = Fields.date(row.get("FromDate"));
        LocalDate to = Fields.date(require(row.get("ToDate")));
        BigDecimal starting = Fields.decimal(row.get("StartingCash"));
        BigDecimal ending = Fields.decimal(row.get("EndingCash"));
        if (starting == null && ending == null) {
            result.ignore("summary row without cash");
            return;
        }

        result.addCashBalance(new CashBalance(
            ExternalIds.hash("cash_balance", row.get("ClientAccountID"), baseSummary ? BASE_SUMMARY : currency, from, to),
            to,
            currency,
            starting,
            ending,
            baseSummary,
            source,
            provenance
        ));
    }

    private static String require(String toDate) {
        if (toDate == null) {
            throw new IllegalArgumentException("Missing ToDate");
        }
        return toDate;
    }
}
