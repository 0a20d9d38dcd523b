package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.Trade;

/** Parsed trade awaiting instrument resolution. */
public record TradeDraft(InstrumentRef instrument, Trade trade) {
}
