package in.folioledger.service.fx;

import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.application.port.output.SnapshotRepository.PositionRate;

import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rate reported on a snapshot position held in the same currency, nearest to the query date
 * within the window. A position of the same instrument is preferred when the query names one.
 * Positions in other currencies are never used.
 */
public final class PositionRateStrategy implements FxStrategy {

    private final SnapshotRepository snapshotRepo;
    private final int windowDays;

    public PositionRateStrategy(SnapshotRepository snapshotRepo, int windowDays) {
        this.snapshotRepo = snapshotRepo;
        this.windowDays = windowDays;
    }

    @Override
    public Optional<FxResolution> resolve(FxQuery query) {
        if (query.currency() == null || query.date() == null) {
            return Optional.empty();
        }
        List<PositionRate> candidates = snapshotRepo.findPositionRates(query.currency(),
                query.date().minusDays(windowDays), query.date().plusDays(windowDays))
            .stream()
            .filter(p -> p.position().fxRateToBase() != null && p.position().fxRateToBase().signum() > 0)
            .filter(p -> query.currency().equalsIgnoreCase(p.position().currency()))
            .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        Comparator<PositionRate> nearest = Comparator
            .comparingLong((PositionRate p) -> Math.abs(ChronoUnit.DAYS.between(query.date(), p.reportDate())))
            .thenComparing(PositionRate::reportDate);

        Optional<PositionRate> best = Optional.empty();
        if (query.instrumentId() != null) {
            best = candidates.stream()
                .filter(p -> Objects.equals(query.instrumentId(), p.position().instrumentId()))
                .min(nearest);
        }
        if (best.isEmpty()) {
            best = candidates.stream().min(nearest);
        }
        return best.map(p -> FxResolution.of(p.position().fxRateToBase(), FxSource.POSITION, p.reportDate()));
    }
}
