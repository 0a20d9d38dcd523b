package in.folioledger.infrastructure.persistence.memory;

import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class InMemorySnapshotRepository implements SnapshotRepository {
    private final AppendOnlyTable<PortfolioSnapshot> snapshots = new AppendOnlyTable<>();

    @Override
    public boolean insertIfAbsent(PortfolioSnapshot snapshot) {
        return snapshots.insertIfAbsent(snapshot);
    }

    @Override
    public List<PortfolioSnapshot> findAll() {
        return snapshots.all();
    }

    @Override
    public List<PositionRate> findPositionRates(String currency, LocalDate from, LocalDate to) {
        List<PositionRate> rates = new ArrayList<>();
        for (PortfolioSnapshot s : snapshots.all()) {
            if (s.reportDate() == null || s.reportDate().isBefore(from) || s.reportDate().isAfter(to)) {
                continue;
            }
            for (Position p : s.positions()) {
                if (p.fxRateToBase() != null && currency.equalsIgnoreCase(p.currency())) {
                    rates.add(new PositionRate(s.reportDate(), p));
                }
            }
        }
        return rates;
    }
}
