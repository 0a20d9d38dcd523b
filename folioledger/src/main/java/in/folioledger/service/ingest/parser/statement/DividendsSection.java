package in.folioledger.service.ingest.parser.statement;

import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.service.ingest.parser.DescriptionParser;
import in.folioledger.service.ingest.parser.DividendPairer;
import in.folioledger.service.ingest.parser.Fields;
import in.folioledger.service.ingest.parser.ParseResult;
import in.folioledger.service.ingest.parser.Rows;
import in.folioledger.service.ingest.section.SectionRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code Dividends}, {@code Payment In Lieu Of Dividends} and {@code Withholding Tax}.
 *
 * Descriptions read {@code KESKOB(FI0009000202) Cash Dividend EUR 0.22 per Share}; the
 * ISIN and the per-share figure come from there. Withholding rows pair with the dividend
 * of the same instrument, date and currency.
 */
final class DividendsSection implements StatementSection {

    static final String DIVIDENDS = "Dividends";
    static final String PAYMENT_IN_LIEU = "Payment In Lieu Of Dividends";
    static final String WITHHOLDING = "Withholding Tax";

    @Override
    public void parse(StatementContext statement, ParseResult result) {
        List<DividendPairer.GrossRow> gross = new ArrayList<>();
        List<DividendPairer.WithholdingRow> withholding = new ArrayList<>();

        List<SectionRow> dividendRows = new ArrayList<>(statement.rows(DIVIDENDS));
        dividendRows.addAll(statement.rows(PAYMENT_IN_LIEU));

        Rows.each(dividendRows, result, row -> {
            if (isTotal(row)) {
                result.ignore("dividend total");
                return;
            }
            String currency = Fields.upper(row.get("Currency"));
            LocalDate date = requireDate(row);
            String description = row.get("Description");
            BigDecimal amount = requireAmount(row);
            InstrumentRef ref = reference(statement, description, currency, date);

            gross.add(new DividendPairer.GrossRow(
                ref, date, null, currency, amount, BigDecimal.ZERO, null,
                DescriptionParser.perShare(description), null, description, null,
                statement.provenance(row)));
        });

        Rows.each(statement.rows(WITHHOLDING), result, row -> {
            if (isTotal(row)) {
                result.ignore("withholding total");
                return;
            }
            String currency = Fields.upper(row.get("Currency"));
            LocalDate date = requireDate(row);
            String description = row.get("Description");
            InstrumentRef ref = reference(statement, description, currency, date);

            withholding.add(new DividendPairer.WithholdingRow(
                ref, date, currency, requireAmount(row), description, null, statement.provenance(row)));
        });

        DividendPairer.Outcome outcome = DividendPairer.pair(gross, withholding, StatementContext.SOURCE);
        outcome.dividends().forEach(result::addDividend);
        outcome.orphanedWithholdings().forEach(result::addOrphanedWithholding);
        for (int i = 0; i < outcome.zeroSkipped(); i++) {
            result.ignore("zero dividend");
        }
    }

    private static boolean isTotal(SectionRow row) {
        return StatementContext.isTotalRow(row.get("Currency")) || row.get("Date") == null;
    }

    private static LocalDate requireDate(SectionRow row) {
        LocalDate date = Fields.date(row.get("Date"));
        if (date == null) {
            throw new IllegalArgumentException("Missing Date");
        }
        return date;
    }

    private static BigDecimal requireAmount(SectionRow row) {
        BigDecimal amount = Fields.decimal(row.get("Amount"));
        if (amount == null) {
            throw new IllegalArgumentException("Missing Amount");
        }
        return amount;
    }

    private static InstrumentRef reference(StatementContext statement, String description, String currency, LocalDate date) {
        InstrumentRef ref = statement.reference(null, description, currency, null, date);
        if (ref == null) {
            throw new IllegalArgumentException("Cannot identify instrument from description: " + description);
        }
        return ref;
    }
}
