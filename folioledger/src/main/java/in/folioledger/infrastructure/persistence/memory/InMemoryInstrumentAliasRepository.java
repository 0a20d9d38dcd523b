package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.InstrumentAliasRepository;
import in.folioledger.domain.model.InstrumentAlias;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryInstrumentAliasRepository implements InstrumentAliasRepository {
    private final Map<String, InstrumentAlias> byKey = new LinkedHashMap<>();

    @Override
    public synchronized InstrumentAlias upsert(InstrumentAlias alias) {
        InstrumentAlias existing = byKey.get(alias.key());
        InstrumentAlias stored = existing == null
                ? alias
                : new InstrumentAlias(existing.id(), existing.instrumentId(), existing.symbol(), existing.exchange(),
                        alias.validFrom(), alias.validTo(), alias.source(), existing.primary(), existing.createdAt());
        byKey.put(stored.key(), stored);
        return stored;
    }

    @Override
    public synchronized Optional<InstrumentAlias> find(String instrumentId, String symbol, String exchange) {
        String key = instrumentId + "|" + symbol.trim().toUpperCase() + "|" + (exchange == null ? "" : exchange.trim().toUpperCase());
        return Optional.ofNullable(byKey.get(key));
    }

    @Override
    public synchronized List<InstrumentAlias> findByInstrument(String instrumentId) {
        return byKey.values().stream()
                .filter(a -> a.instrumentId().equals(instrumentId))
                .toList();
    }

    @Override
    public synchronized List<InstrumentAlias> findBySymbol(String symbol) {
        String wanted = symbol.trim();
        return byKey.values().stream()
                .filter(a -> a.symbol().equalsIgnoreCase(wanted))
                .toList();
    }

    @Override
    public synchronized void setPrimary(String instrumentId, String aliasId) {
        boolean found = byKey.values().stream()
                .anyMatch(a -> a.instrumentId().equals(instrumentId) && a.id().equals(aliasId));
        if (!found) {
            throw new IllegalArgumentException("Alias " + aliasId + " does not belong to " + instrumentId);
        }
        byKey.replaceAll((key, a) -> a.instrumentId().equals(instrumentId) ? a.withPrimary(a.id().equals(aliasId)) : a);
    }

    @Override
    public synchronized List<InstrumentAlias> findAll() {
        return new ArrayList<>(byKey.values());
    }
}
