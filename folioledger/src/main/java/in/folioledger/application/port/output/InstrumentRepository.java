package in.folioledger.application.port.output;

import in.folioledger.domain.model.Instrument;

import java.util.List;
import java.util.Optional;

public interface InstrumentRepository {
    /**
     * Insert the candidate unless an instrument with the same ISIN exists, then return
     * whichever row is stored. Must be atomic: concurrent callers with the same ISIN all
     * get the same instrument back.
     */
    Instrument getOrCreate(Instrument candidate);

    /**
     * Persist changed fields of an existing instrument (enrichment, filled hints).
     */
    void update(Instrument instrument);

    Optional<Instrument> findByIsin(String isin);

    Optional<Instrument> findById(String id);

    List<Instrument> findAll();
}
