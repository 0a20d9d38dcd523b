package in.folioledger.application.port.output;

import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;

import java.time.LocalDate;
import java.util.List;

public interface SnapshotRepository {
    /**
     * Store a snapshot with its positions unless its external id exists.
     *
     * @return true when created
     */
    boolean insertIfAbsent(PortfolioSnapshot snapshot);

    List<PortfolioSnapshot> findAll();

    /**
     * Positions in {@code currency} from snapshots dated within [from, to], with a known
     * rate to base. Used as FX fallback.
     */
    List<PositionRate> findPositionRates(String currency, LocalDate from, LocalDate to);

    /**
     * A position's rate to base together with the snapshot date it was reported on.
     */
    record PositionRate(LocalDate reportDate, Position position) {}
}
