package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.domain.model.FxRate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

public final class InMemoryFxRateRepository implements FxRateRepository {
    private final Map<String, NavigableMap<LocalDate, FxRate>> byCurrency = new TreeMap<>();

    @Override
    public synchronized void upsert(FxRate rate) {
        String currency = rate.currency().toUpperCase();
        byCurrency.computeIfAbsent(currency, k -> new TreeMap<>())
                .put(rate.date(), new FxRate(rate.date(), currency, rate.rate(), rate.source()));
    }

    @Override
    public synchronized Optional<FxRate> findNearestPrior(String currency, LocalDate date, LocalDate earliest) {
        NavigableMap<LocalDate, FxRate> rates = byCurrency.get(currency.toUpperCase());
        if (rates == null) return Optional.empty();
        Map.Entry<LocalDate, FxRate> floor = rates.floorEntry(date);
        if (floor == null || (earliest != null && floor.getKey().isBefore(earliest))) {
            return Optional.empty();
        }
        return Optional.of(floor.getValue());
    }

    @Override
    public synchronized List<FxRate> findAll() {
        List<FxRate> all = new ArrayList<>();
        byCurrency.values().forEach(m -> all.addAll(m.values()));
        return all;
    }
}
