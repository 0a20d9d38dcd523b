package in.folioledger.service.fx;

import java.util.Optional;

/**
 * One step of the conversion cascade. Returns empty to pass the query to the next step.
 */
public interface FxStrategy {

    Optional<FxResolution> resolve(FxQuery query);
}
