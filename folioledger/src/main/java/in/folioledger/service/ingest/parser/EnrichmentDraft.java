package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.InstrumentRef;

import java.util.Map;

/** Catalog enrichment values learned from a report (dividend accruals). */
public record EnrichmentDraft(InstrumentRef instrument, Map<String, String> values) {

    public EnrichmentDraft {
        values = Map.copyOf(values);
    }
}
