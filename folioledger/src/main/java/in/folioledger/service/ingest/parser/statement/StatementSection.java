package in.folioledger.service.ingest.parser.statement;

import in.folioledger.service.ingest.parser.ParseResult;

/**
 * Handler for one family of statement sections.
 */
public interface StatementSection {

    void parse(StatementContext statement, ParseResult result);
}
