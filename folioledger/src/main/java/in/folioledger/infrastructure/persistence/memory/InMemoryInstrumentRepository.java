package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.InstrumentRepository;
import in.folioledger.domain.model.Instrument;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog kept in memory. Used by the CLI when no database is configured and by tests.
 */
public final class InMemoryInstrumentRepository implements InstrumentRepository {
    private final Map<String, Instrument> byIsin = new ConcurrentHashMap<>();
    private final Map<String, String> isinById = new ConcurrentHashMap<>();

    @Override
    public Instrument getOrCreate(Instrument candidate) {
        return byIsin.computeIfAbsent(candidate.isin(), isin -> {
            isinById.put(candidate.id(), isin);
            return candidate;
        });
    }

    @Override
    public void update(Instrument instrument) {
        String isin = isinById.get(instrument.id());
        if (isin == null) {
            throw new IllegalArgumentException("Unknown instrument " + instrument.id());
        }
        byIsin.put(isin, instrument);
    }

    @Override
    public Optional<Instrument> findByIsin(String isin) {
        return isin == null ? Optional.empty() : Optional.ofNullable(byIsin.get(isin.toUpperCase()));
    }

    @Override
    public Optional<Instrument> findById(String id) {
        String isin = id == null ? null : isinById.get(id);
        return isin == null ? Optional.empty() : Optional.ofNullable(byIsin.get(isin));
    }

    @Override
    public List<Instrument> findAll() {
        return byIsin.values().stream()
                .sorted(Comparator.comparing(Instrument::isin))
                .toList();
    }
}
