package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CashFlow;
import in.folioledger.domain.model.CashFlowType;
import in.folioledger.domain.model.DividendAmountType;
import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Provenance;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges gross dividend rows with their withholding rows.
 *
 * Rows pair on (instrument key, date, currency). Several gross rows under one key (a
 * reversal and its re-booking, a dividend and a payment in lieu on the same day) are
 * summed. The merged record carries {@code net = gross + sum(withholding)}, withholding
 * being non-positive as booked. Withholding rows that find no gross row become
 * {@link CashFlowType#OTHER} cash flows and are reported as orphaned.
 */
public final class DividendPairer {

    public record GrossRow(
        InstrumentRef instrument,
        LocalDate payDate,
        LocalDate exDate,
        String currency,
        BigDecimal amount,
        BigDecimal withholding,     // tax already netted on this row, zero when booked separately
        BigDecimal quantity,
        BigDecimal perShare,        // null when the source text carries no per-share figure
        BigDecimal fxRate,
        String description,
        String nativeId,            // null when the source has no transaction id
        Provenance provenance
    ) {}

    public record WithholdingRow(
        InstrumentRef instrument,
        LocalDate date,
        String currency,
        BigDecimal amount,          // as booked, normally negative
        String description,
        String nativeId,
        Provenance provenance
    ) {}

    public record Outcome(List<DividendDraft> dividends, List<CashFlow> orphanedWithholdings, int zeroSkipped) {}

    private DividendPairer() {}

    /**
     * @param idNamespace prefix for native ids, e.g. {@code nordnet}
     */
    public static Outcome pair(List<GrossRow> grossRows, List<WithholdingRow> withholdingRows, String idNamespace) {
        Map<String, List<GrossRow>> grossByKey = new LinkedHashMap<>();
        for (GrossRow row : grossRows) {
            grossByKey.computeIfAbsent(key(row.instrument(), row.payDate(), row.currency()), k -> new ArrayList<>()).add(row);
        }
        Map<String, List<WithholdingRow>> taxByKey = new LinkedHashMap<>();
        for (WithholdingRow row : withholdingRows) {
            taxByKey.computeIfAbsent(key(row.instrument(), row.date(), row.currency()), k -> new ArrayList<>()).add(row);
        }

        List<DividendDraft> dividends = new ArrayList<>();
        int zeroSkipped = 0;
        for (Map.Entry<String, List<GrossRow>> entry : grossByKey.entrySet()) {
            List<WithholdingRow> taxes = taxByKey.remove(entry.getKey());
            DividendDraft merged = merge(entry.getValue(), taxes == null ? List.of() : taxes, idNamespace);
            if (merged == null) {
                zeroSkipped++;
            } else {
                dividends.add(merged);
            }
        }

        List<CashFlow> orphans = new ArrayList<>();
        for (List<WithholdingRow> unmatched : taxByKey.values()) {
            for (WithholdingRow row : unmatched) {
                orphans.add(orphan(row, idNamespace));
            }
        }
        return new Outcome(dividends, orphans, zeroSkipped);
    }

    private static DividendDraft merge(List<GrossRow> rows, List<WithholdingRow> taxes, String idNamespace) {
        GrossRow first = rows.get(0);

        BigDecimal gross = BigDecimal.ZERO;
        BigDecimal withholding = BigDecimal.ZERO;
        BigDecimal perShare = null;
        BigDecimal quantity = null;
        BigDecimal fxRate = null;
        LocalDate exDate = null;
        Provenance provenance = first.provenance();
        for (int i = 0; i < rows.size(); i++) {
            GrossRow row = rows.get(i);
            gross = gross.add(row.amount());
            if (row.withholding() != null) withholding = withholding.add(row.withholding());
            if (perShare == null) perShare = row.perShare();
            if (quantity == null) quantity = row.quantity();
            if (fxRate == null) fxRate = row.fxRate();
            if (exDate == null) exDate = row.exDate();
            if (i > 0) provenance = provenance.withRelated(row.provenance().rawRow());
        }

        for (WithholdingRow tax : taxes) {
            withholding = withholding.add(tax.amount());
            provenance = provenance.withRelated(tax.provenance().rawRow());
        }

        if (gross.signum() == 0 && withholding.signum() == 0) {
            return null;
        }

        BigDecimal net = gross.add(withholding);
        String externalId = first.nativeId() != null
            ? ExternalIds.nativeId(idNamespace, "dividend", first.nativeId())
            : ExternalIds.hash("dividend", first.instrument().naturalKey(), first.payDate(), gross, first.currency());

        DividendPayment dividend = new DividendPayment(
            externalId,
            null,
            exDate,
            first.payDate(),
            gross,
            withholding,
            net,
            first.currency(),
            fxRate,
            null,
            quantity,
            perShare,
            perShare != null ? DividendAmountType.PER_SHARE : DividendAmountType.TOTAL_NET,
            first.description(),
            provenance
        );
        return new DividendDraft(first.instrument(), dividend);
    }

    private static CashFlow orphan(WithholdingRow row, String idNamespace) {
        String externalId = row.nativeId() != null
            ? ExternalIds.nativeId(idNamespace, "withholding", row.nativeId())
            : ExternalIds.hash("withholding", row.instrument().naturalKey(), row.date(), row.amount(), row.currency());
        return new CashFlow(
            externalId,
            CashFlowType.OTHER,
            row.date(),
            row.amount(),
            row.currency(),
            null,
            null,
            "Unmatched withholding tax: " + (row.description() == null ? row.instrument().naturalKey() : row.description()),
            idNamespace,
            row.provenance()
        );
    }

    private static String key(InstrumentRef ref, LocalDate date, String currency) {
        return ref.naturalKey() + "|" + date + "|" + (currency == null ? "" : currency.toUpperCase());
    }
}
