package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.format.RoutedInput;

import java.util.Set;

/**
 * Cash report: starting and ending cash per currency plus the account-wide base row.
 */
public final class CashSummaryParser extends AbstractReportParser {

    static final String SOURCE = "ibkr_flex";

    private static final Set<String> KNOWN = Set.of(
        "ClientAccountID", "AccountAlias", "Model", "CurrencyPrimary", "LevelOfDetail", "FromDate", "ToDate",
        "StartingCash", "EndingCash"
    );

    @Override
    public FormatTag format() {
        return FormatTag.CASH_SUMMARY;
    }

    @Override
    protected Set<String> knownColumns() {
        return KNOWN;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        eachRow(readRows(input, context, result), result,
            row -> CashSummaryRows.parse(row, context, result, provenance(row, context), SOURCE));
        return result;
    }
}
