package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.InstrumentHints;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.service.ingest.parser.DescriptionParser;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code Financial Instrument Information}: the statement's own instrument table.
 *
 * Feeds the catalog and the symbol-to-ISIN table used by the other sections. The symbol
 * cell may list several symbols separated by commas; each becomes its own alias.
 */
final class InstrumentInfoSection implements StatementSection {

    private static final Logger log = LoggerFactory.getLogger(InstrumentInfoSection.class);

    static final String SECTION = "Financial Instrument Information";

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        Rows.each(statement.rows(SECTION), result, row -> {
            String assetCategory = row.get("Asset Category");
            if (assetCategory == null || StatementContext.isTotalRow(assetCategory)) {
                result.ignore("instrument total");
                return;
            }
            String symbols = row.get("Symbol");
            if (symbols == null) {
                throw new IllegalArgumentException("Instrument row without symbol");
            }
            String securityId = Fields.upper(row.get("Security ID"));
            String isin = DescriptionParser.isValidIsin(securityId) ? securityId : null;
            String cusip = isin == null && securityId != null && securityId.length() == 9 ? securityId : null;
            if (isin == null && cusip == null) {
                log.warn("Skipping instrument without security id: {} ({})", symbols, row.get("Description"));
                result.ignore("instrument without security id");
                return;
            }
            for (String symbol : symbols.split(",")) {
                if (symbol.isBlank()) continue;
                InstrumentHints hints = InstrumentHints.builder()
                    .symbol(symbol.trim())
                    .exchange(row.get("Listing Exch"))
                    .name(row.get("Description"))
                    .assetCategory(assetCategory)
                    .cusip(cusip)
                    .conid(row.get("Conid"))
                    .multiplier(Fields.decimal(row.get("Multiplier")))
                    .type(row.get("Type"))
                    .source(AliasSource.IBKR_ACTIVITY_STATEMENT)
                    .seenOn(statement.periodEnd())
                    .build();
                statement.registerSymbol(symbol, isin);
                result.addInstrument(InstrumentRef.of(isin, hints));
            }
        });
    }
}
