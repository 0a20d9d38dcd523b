package in.folioledger.service.audit;

import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.Instrument;
import in.folioledger.service.ingest.parser.IsinCurrency;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dividend currencies that are unknown, or implausible for the issuer's country.
 */
public final class DividendCurrencyCheck implements IntegrityCheck {

    public static final String ID = "dividend_currency";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Finding> run(LedgerView ledger) {
        List<Finding> findings = new ArrayList<>();
        Map<String, Instrument> byId = ledger.instruments().stream()
            .collect(Collectors.toMap(Instrument::id, i -> i, (a, b) -> a));

        List<RecordRef> unknown = new ArrayList<>();
        List<RecordRef> implausible = new ArrayList<>();
        for (DividendPayment dividend : ledger.dividends()) {
            RecordRef ref = RecordRef.of("dividend", dividend.externalId());
            if (dividend.currency() == null || !IsinCurrency.KNOWN_DIVIDEND_CURRENCIES.contains(dividend.currency())) {
                unknown.add(ref);
                continue;
            }
            Instrument instrument = byId.get(dividend.instrumentId());
            if (instrument != null && !IsinCurrency.isPlausible(instrument.isin(), dividend.currency())) {
                implausible.add(ref);
            }
        }
        Checks.addIfAny(findings, ID, Severity.WARNING, "%d dividend payments in an unknown currency", unknown);
        Checks.addIfAny(findings, ID, Severity.INFO,
            "%d dividend payments in a currency unusual for the ISIN country", implausible);
        return findings;
    }
}
