package in.folioledger.service.fx;

import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.config.LedgerConfig;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts amounts to the base currency through an ordered cascade of strategies.
 *
 * ORDER:
 * 1. rate carried on the record
 * 2. base currency (rate 1)
 * 3. snapshot position in the same currency
 * 4. rate table, with the external source on a miss
 *
 * When nothing answers the result is {@link FxSource#UNCONVERTED}: callers keep the amount
 * but exclude it from base-currency totals.
 */
public final class FxResolver {

    private final List<FxStrategy> strategies;

    public FxResolver(List<FxStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Standard cascade for the given configuration. The HTTP source is only added when
     * {@code FX_HTTP_URL} is set.
     */
    public static FxResolver standard(LedgerConfig config, SnapshotRepository snapshotRepo, FxRateRepository rateRepo) {
        ExternalRateSource external = config.fxHttpUrl() == null ? null
            : new HttpFxRateSource(config.fxHttpUrl(), Duration.ofMillis(config.fxHttpTimeoutMs()));
        return standard(config, snapshotRepo, rateRepo, external);
    }

    public static FxResolver standard(LedgerConfig config, SnapshotRepository snapshotRepo,
                                      FxRateRepository rateRepo, ExternalRateSource external) {
        List<FxStrategy> strategies = new ArrayList<>();
        strategies.add(new ExplicitRateStrategy());
        strategies.add(new BaseCurrencyStrategy(config.baseCurrency()));
        strategies.add(new PositionRateStrategy(snapshotRepo, config.fxPositionWindowDays()));
        strategies.add(new RateTableStrategy(rateRepo, config.fxRateWindowDays(), config.baseCurrency(), external));
        return new FxResolver(strategies);
    }

    public FxResolution resolve(FxQuery query) {
        for (FxStrategy strategy : strategies) {
            Optional<FxResolution> resolution = strategy.resolve(query);
            if (resolution.isPresent()) {
                return resolution.get();
            }
        }
        return FxResolution.unconverted();
    }

    public Optional<BigDecimal> rate(String currency, LocalDate date) {
        return Optional.ofNullable(resolve(FxQuery.of(currency, date)).rate());
    }

    /**
     * Base amount of {@code amount}, or null when no rate is available.
     */
    public BigDecimal toBase(BigDecimal amount, String currency, LocalDate date) {
        return resolve(FxQuery.of(currency, date)).convert(amount);
    }
}
