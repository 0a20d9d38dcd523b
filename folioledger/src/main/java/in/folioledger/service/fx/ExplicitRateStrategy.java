package in.folioledger.service.fx;

import java.util.Optional;

/** A rate present on the record always wins. */
public final class ExplicitRateStrategy implements FxStrategy {

    @Override
    public Optional<FxResolution> resolve(FxQuery query) {
        if (query.explicitRate() == null || query.explicitRate().signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(FxResolution.of(query.explicitRate(), FxSource.EXPLICIT, null));
    }
}
