package in.folioledger.domain.model;

/**
 * Closed set of report types the importer understands.
 */
public enum FormatTag {
    HOLDINGS_SNAPSHOT,          // Open positions with mark price and position value
    DIVIDEND_REPORT,            // One row per dividend with gross rate and net amount
    TRADE_REPORT,               // One row per execution keyed by broker trade id
    ACTIVITY_ACTIONS,           // Mixed cash activity keyed by activity code
    MULTI_SECTION_STATEMENT,    // Section,Header|Data,... activity statement
    CASH_SUMMARY,               // Starting/ending cash per currency
    TRANSACTION_EXPORT,         // Tab separated transaction export with decimal commas
    UNRECOGNIZED
}
