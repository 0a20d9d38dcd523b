package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.FormatTag;
import in.folioledger.service.ingest.RowError;
import in.folioledger.service.ingest.format.RoutedInput;
import in.folioledger.service.ingest.parser.ParseContext;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.ReportParser;
import in.folioledger.service.ingest.section.SectionRow;
import in.folioledger.service.ingest.section.SectionSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Activity statement with many sections in one file.
 *
 * The instrument section runs first so that trades and positions, which only carry
 * symbols, can be keyed by ISIN.
 */
public final class MultiSectionStatementParser implements ReportParser {
    private static final Logger log = LoggerFactory.getLogger(MultiSectionStatementParser.class);

    private final SectionSplitter splitter;
    private final List<StatementSection> sections = List.of(
        new InstrumentInfoSection(),
        new TradesSection(),
        new DividendsSection(),
        new CashMovementsSection(),
        new CorporateActionsSection(),
        new NavSection(),
        new CashReportSection(),
        new OpenPositionsSection()
    );

    public MultiSectionStatementParser() {
        this(new SectionSplitter());
    }

    public MultiSectionStatementParser(SectionSplitter splitter) {
        this.splitter = splitter;
    }

    @Override
    public FormatTag format() {
        return FormatTag.MULTI_SECTION_STATEMENT;
    }

    @Override
    public ParseResult parse(RoutedInput input, ParseContext context) {
        ParseResult result = new ParseResult(context.sourceName(), format());
        List<RowError> splitErrors = new ArrayList<>();
        Map<String, List<SectionRow>> split = splitter.split(input.lines(), context.sourceName(), splitErrors);
        splitErrors.forEach(result::addError);

        StatementContext statement = new StatementContext(split, context);
        SectionRow periodRow = statement.periodError();
        if (periodRow != null) {
            result.error(periodRow.section(), periodRow.lineNumber(), "Unreadable statement period", periodRow.rawLine());
        }
        log.debug("Statement {}: {} sections, period {} to {}", context.sourceName(), split.size(),
            statement.periodStart(), statement.periodEnd());

        for (StatementSection section : sections) {
            section.parse(statement, result);
        }
        return result;
    }
}
