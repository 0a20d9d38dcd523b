package in.folioledger.application.port.output;

import in.folioledger.domain.model.FxRate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface FxRateRepository {
    /**
     * Insert or replace the rate for (date, currency).
     */
    void upsert(FxRate rate);

    /**
     * Latest rate for the currency dated on or before {@code date} and not before
     * {@code earliest}.
     */
    Optional<FxRate> findNearestPrior(String currency, LocalDate date, LocalDate earliest);

    List<FxRate> findAll();
}
