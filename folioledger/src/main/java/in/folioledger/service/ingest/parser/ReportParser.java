package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.format.RoutedInput;

/**
 * Turns one routed report into record drafts.
 *
 * Implementations map columns by header name, never by position, and report row-level
 * failures in the result instead of throwing.
 */
public interface ReportParser {

    FormatTag format();

    ParseResult parse(RoutedInput input, ParseContext context);
}
