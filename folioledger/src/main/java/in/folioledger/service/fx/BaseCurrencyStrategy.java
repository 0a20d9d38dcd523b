package in.folioledger.service.fx;

import java.math.BigDecimal;
import java.util.Optional;

/** Amounts in the base currency convert at exactly 1. */
public final class BaseCurrencyStrategy implements FxStrategy {

    private final String baseCurrency;

    public BaseCurrencyStrategy(String baseCurrency) {
        this.baseCurrency = baseCurrency;
    }

    @Override
    public Optional<FxResolution> resolve(FxQuery query) {
        if (query.currency() != null && query.currency().equalsIgnoreCase(baseCurrency)) {
            return Optional.of(FxResolution.of(BigDecimal.ONE, FxSource.BASE, null));
        }
        return Optional.empty();
    }
}
