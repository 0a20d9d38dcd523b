package in.folioledger.bootstrap;

import in.folioledger.application.port.output.AccountRepository;
import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.application.port.output.InstrumentAliasRepository;
import in.folioledger.application.port.output.InstrumentRepository;
import in.folioledger.application.port.output.LedgerRepository;
import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.infrastructure.persistence.PostgresAccountRepository;
import in.folioledger.infrastructure.persistence.PostgresFxRateRepository;
import in.folioledger.infrastructure.persistence.PostgresInstrumentAliasRepository;
import in.folioledger.infrastructure.persistence.PostgresInstrumentRepository;
import in.folioledger.infrastructure.persistence.PostgresLedgerRepository;
import in.folioledger.infrastructure.persistence.PostgresSnapshotRepository;
import in.folioledger.infrastructure.persistence.memory.InMemoryAccountRepository;
import in.folioledger.infrastructure.persistence.memory.InMemoryFxRateRepository;
import in.folioledger.infrastructure.persistence.memory.InMemoryInstrumentAliasRepository;
import in.folioledger.infrastructure.persistence.memory.InMemoryInstrumentRepository;
import in.folioledger.infrastructure.persistence.memory.InMemoryLedgerRepository;
import in.folioledger.infrastructure.persistence.memory.InMemorySnapshotRepository;
import in.folioledger.service.audit.LedgerView;

import javax.sql.DataSource;

/**
 * The six persistence ports wired to one backing store.
 */
public record LedgerStore(
    String kind,                    // memory | postgres
    InstrumentRepository instruments,
    InstrumentAliasRepository aliases,
    LedgerRepository ledger,
    SnapshotRepository snapshots,
    AccountRepository accounts,
    FxRateRepository fxRates
) {
    public static LedgerStore memory() {
        return new LedgerStore(
            "memory",
            new InMemoryInstrumentRepository(),
            new InMemoryInstrumentAliasRepository(),
            new InMemoryLedgerRepository(),
            new InMemorySnapshotRepository(),
            new InMemoryAccountRepository(),
            new InMemoryFxRateRepository()
        );
    }

    public static LedgerStore postgres(DataSource dataSource) {
        return new LedgerStore(
            "postgres",
            new PostgresInstrumentRepository(dataSource),
            new PostgresInstrumentAliasRepository(dataSource),
            new PostgresLedgerRepository(dataSource),
            new PostgresSnapshotRepository(dataSource),
            new PostgresAccountRepository(dataSource),
            new PostgresFxRateRepository(dataSource)
        );
    }

    /** Consistent read of every table, for one audit run. */
    public LedgerView view() {
        return LedgerView.load(instruments, aliases, ledger, snapshots, accounts);
    }
}
