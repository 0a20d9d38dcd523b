package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.DividendPayment;
import in.folioledger.domain.model.InstrumentRef;

/** Parsed (and paired) dividend awaiting instrument resolution. */
public record DividendDraft(InstrumentRef instrument, DividendPayment dividend) {
}
