package in.folioledger.service.fx;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * On-demand daily rate lookup. Implementations must not throw: any failure is an empty result.
 */
public interface ExternalRateSource {

    /**
     * @return base-currency units per one unit of {@code currency} on {@code date}
     */
    Optional<BigDecimal> fetch(String currency, LocalDate date, String baseCurrency);
}
