package in.folioledger.service.ingest.parser;

import in.folioledger.domain.model.InstrumentRef;
import in.folioledger.domain.model.PortfolioSnapshot;

import java.util.List;

/**
 * Parsed snapshot. {@code positionRefs} is aligned with {@code snapshot.positions()}.
 */
public record SnapshotDraft(PortfolioSnapshot snapshot, List<InstrumentRef> positionRefs) {

    public SnapshotDraft {
        if (positionRefs.size() != snapshot.positions().size()) {
            throw new IllegalArgumentException("One instrument reference per position required");
        }
        positionRefs = List.copyOf(positionRefs);
    }
}
