package in.folioledger.service.fx;

import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.domain.model.FxRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Nearest stored rate dated on or before the query date, no older than the window. On a miss
 * the external source (when configured) is asked once and its answer is stored.
 */
public final class RateTableStrategy implements FxStrategy {
    private static final Logger log = LoggerFactory.getLogger(RateTableStrategy.class);

    static final String EXTERNAL_SOURCE = "external";

    private final FxRateRepository rateRepo;
    private final int windowDays;
    private final String baseCurrency;
    private final ExternalRateSource external;

    public RateTableStrategy(FxRateRepository rateRepo, int windowDays, String baseCurrency, ExternalRateSource external) {
        this.rateRepo = rateRepo;
        this.windowDays = windowDays;
        this.baseCurrency = baseCurrency;
        this.external = external;
    }

    @Override
    public Optional<FxResolution> resolve(FxQuery query) {
        if (query.currency() == null || query.date() == null) {
            return Optional.empty();
        }
        Optional<FxRate> stored = rateRepo.findNearestPrior(query.currency(), query.date(), query.date().minusDays(windowDays));
        if (stored.isPresent()) {
            FxRate rate = stored.get();
            return Optional.of(FxResolution.of(rate.rate(), FxSource.RATE_TABLE, rate.date()));
        }
        if (external == null) {
            return Optional.empty();
        }

        Optional<BigDecimal> fetched = external.fetch(query.currency(), query.date(), baseCurrency);
        if (fetched.isEmpty()) {
            return Optional.empty();
        }
        rateRepo.upsert(new FxRate(query.date(), query.currency(), fetched.get(), EXTERNAL_SOURCE));
        log.debug("[FX] Fetched {} {} = {} {}", query.date(), query.currency(), fetched.get(), baseCurrency);
        return Optional.of(FxResolution.of(fetched.get(), FxSource.EXTERNAL, query.date()));
    }
}
