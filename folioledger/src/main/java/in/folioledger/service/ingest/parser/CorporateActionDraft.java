package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.CorporateAction;
import in.folioledger.domain.model.InstrumentRef;

/** Parsed corporate action; {@code instrument} is null when the row names no security. */
public record CorporateActionDraft(InstrumentRef instrument, CorporateAction action) {
}
