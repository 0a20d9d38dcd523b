package in.folioledger.application.port.output;

import in.folioledger.domain.model.InstrumentAlias;

import java.util.List;
import java.util.Optional;

public interface InstrumentAliasRepository {
    /**
     * Insert or update an alias keyed by (instrumentId, symbol, exchange).
     * On conflict the validity interval and source are replaced by the given values.
     *
     * @return the stored alias
     */
    InstrumentAlias upsert(InstrumentAlias alias);

    Optional<InstrumentAlias> find(String instrumentId, String symbol, String exchange);

    List<InstrumentAlias> findByInstrument(String instrumentId);

    /**
     * Aliases with this symbol (case-insensitive) across all instruments.
     */
    List<InstrumentAlias> findBySymbol(String symbol);

    /**
     * Flag {@code aliasId} primary and demote every other alias of the instrument in one
     * atomic operation.
     */
    void setPrimary(String instrumentId, String aliasId);

    List<InstrumentAlias> findAll();
}
