package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.FormatTag;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Provenance;
import in.folioledger.service.ingest.parser.DescriptionParser;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseContext;
import in.folioledger.service.ingest.section.SectionRow;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State shared by the section handlers of one statement: the split sections, the
 * statement period and the symbol-to-ISIN table built from the instrument section.
 */
public final class StatementContext {

    static final String SOURCE = "ibkr_activity_statement";

    /** Currency cells that mark summary rows inside data sections. */
    private static final Set<String> TOTAL_MARKERS = Set.of("TOTAL", "TOTAL IN EUR", "TOTAL IN USD", "TOTAL IN BASE");

    private final Map<String, List<SectionRow>> sections;
    private final ParseContext parse;
    private final Map<String, String> isinBySymbol = new HashMap<>();
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private SectionRow periodError;

    public StatementContext(Map<String, List<SectionRow>> sections, ParseContext parse) {
        this.sections = sections;
        this.parse = parse;
        readStatementPeriod();
    }

    public List<SectionRow> rows(String section) {
        return sections.getOrDefault(section, List.of());
    }

    public ParseContext parse() {
        return parse;
    }

    public LocalDate periodStart() {
        return periodStart;
    }

    public LocalDate periodEnd() {
        return periodEnd;
    }

    /** The {@code Statement/Period} row when it could not be read, else null. */
    public SectionRow periodError() {
        return periodError;
    }

    public void registerSymbol(String symbol, String isin) {
        if (symbol != null && isin != null) {
            isinBySymbol.put(symbol.trim().toUpperCase(), isin);
        }
    }

    public String isinForSymbol(String symbol) {
        return symbol == null ? null : isinBySymbol.get(symbol.trim().toUpperCase());
    }

    /**
     * Reference from a symbol column, an optional description carrying {@code SYMBOL(ISIN)},
     * and the instrument table.
     */
    public InstrumentRef reference(String symbol, String description, String currency, String assetCategory, LocalDate seenOn) {
        String isin = DescriptionParser.isin(description);
        String effectiveSymbol = symbol != null ? symbol : DescriptionParser.symbol(description);
        if (isin == null) {
            isin = isinForSymbol(effectiveSymbol);
        }
        if (isin == null && effectiveSymbol == null) {
            return null;
        }
        InstrumentHints hints = InstrumentHints.builder()
            .symbol(effectiveSymbol)
            .currency(currency)
            .assetCategory(assetCategory)
            .source(AliasSource.IBKR_ACTIVITY_STATEMENT)
            .seenOn(seenOn)
            .build();
        return InstrumentRef.of(isin, hints);
    }

    public Provenance provenance(SectionRow row) {
        return Provenance.of(parse.sourceName(), FormatTag.MULTI_SECTION_STATEMENT, row.section(),
            row.lineNumber(), row.rawLine(), row.fields());
    }

    /** Summary rows ("Total", "Total in EUR") and blank currencies. */
    public static boolean isTotalRow(String currency) {
        return currency == null || TOTAL_MARKERS.contains(currency.trim().toUpperCase())
            || currency.trim().toUpperCase().startsWith("TOTAL");
    }

    private void readStatementPeriod() {
        for (SectionRow row : rows("Statement")) {
            if ("Period".equalsIgnoreCase(row.get("Field Name"))) {
                String period = row.get("Field Value");
                try {
                    periodStart = Fields.periodStart(period);
                    periodEnd = Fields.periodEnd(period);
                } catch (IllegalArgumentException e) {
                    periodError = row;
                }
            }
        }
    }
}
