package in.folioledger.service.instrument;

import in.folioledger.domain.model.Instrument;

import java.util.List;

/**
 * Outcome of resolving one reference.
 *
 * {@code warnings} holds resolution conflicts: incoming hints that disagree with what the
 * catalog already holds. The catalog value is kept.
 */
public record Resolution(
    Instrument instrument,
    boolean created,
    List<String> warnings
) {
    public Resolution {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String instrumentId() {
        return instrument.id();
    }
}
