package in.folioledger.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger Schema Migration - creates the catalog and ledger tables on startup.
 *
 * Tables, in dependency order:
 * - instruments, instrument_aliases: catalog keyed by ISIN, symbol history
 * - trades, dividends, cash_flows, corporate_actions, sold_positions: append-only ledger
 * - portfolio_snapshots, positions: holdings per report date
 * - cash_balances, account_valuations: broker-reported cash and account value
 * - fx_rates: rate to base per (date, currency)
 *
 * Every ledger table has a unique external_id. Safe to run repeatedly.
 */
public final class LedgerSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(LedgerSchemaMigration.class);

    private final DataSource dataSource;

    public LedgerSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[LEDGER MIGRATION] Starting ledger schema migration");

        try (Connection conn = dataSource.getConnection()) {
            int created = 0;
            for (Map.Entry<String, String> table : tables().entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.debug("[LEDGER MIGRATION] {} already exists", table.getKey());
                    continue;
                }
                log.info("[LEDGER MIGRATION] Creating {} table...", table.getKey());
                execute(conn, table.getValue());
                created++;
            }
            for (String index : indexes()) {
                execute(conn, index);
            }
            log.info("[LEDGER MIGRATION] Migration completed, {} tables created", created);

        } catch (Exception e) {
            log.error("[LEDGER MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Ledger migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        }
    }

    private static Map<String, String> tables() {
        Map<String, String> ddl = new LinkedHashMap<>();

        ddl.put("instruments", """
            CREATE TABLE instruments (
                id VARCHAR(64) PRIMARY KEY,
                isin VARCHAR(32) NOT NULL UNIQUE,
                cusip VARCHAR(16),
                conid VARCHAR(32),
                figi VARCHAR(16),
                name TEXT,
                asset_category VARCHAR(16),
                listing_exchange VARCHAR(32),
                currency VARCHAR(8),
                multiplier NUMERIC(20,6) NOT NULL DEFAULT 1,
                type VARCHAR(32),
                enrichment JSONB NOT NULL DEFAULT '{}'::jsonb,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("instrument_aliases", """
            CREATE TABLE instrument_aliases (
                id VARCHAR(64) PRIMARY KEY,
                instrument_id VARCHAR(64) NOT NULL REFERENCES instruments(id),
                symbol VARCHAR(64) NOT NULL,
                exchange VARCHAR(32) NOT NULL DEFAULT '',
                valid_from DATE,
                valid_to DATE,
                source VARCHAR(32) NOT NULL,
                is_primary BOOLEAN NOT NULL DEFAULT FALSE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("trades", """
            CREATE TABLE trades (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                instrument_id VARCHAR(64) REFERENCES instruments(id),
                trade_date DATE,
                trade_time TIME,
                settlement_date DATE,
                quantity NUMERIC(24,8),
                price NUMERIC(24,8),
                amount NUMERIC(24,6),
                commission NUMERIC(24,6),
                currency VARCHAR(8),
                fx_rate NUMERIC(20,10),
                asset_category VARCHAR(16),
                exchange VARCHAR(32),
                description TEXT,
                realized_pnl NUMERIC(24,6),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("dividends", """
            CREATE TABLE dividends (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                instrument_id VARCHAR(64) REFERENCES instruments(id),
                ex_date DATE,
                pay_date DATE,
                gross_amount NUMERIC(24,6),
                withholding_tax NUMERIC(24,6),
                net_amount NUMERIC(24,6),
                currency VARCHAR(8),
                fx_rate NUMERIC(20,10),
                amount_base NUMERIC(24,6),
                quantity NUMERIC(24,8),
                per_share NUMERIC(20,8),
                amount_type VARCHAR(16),
                description TEXT,
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("cash_flows", """
            CREATE TABLE cash_flows (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                flow_type VARCHAR(16) NOT NULL,
                flow_date DATE,
                amount NUMERIC(24,6),
                currency VARCHAR(8),
                fx_rate NUMERIC(20,10),
                amount_base NUMERIC(24,6),
                description TEXT,
                source VARCHAR(64),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("corporate_actions", """
            CREATE TABLE corporate_actions (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                instrument_id VARCHAR(64) REFERENCES instruments(id),
                action_type VARCHAR(32),
                action_date DATE,
                description TEXT,
                quantity NUMERIC(24,8),
                amount NUMERIC(24,6),
                proceeds NUMERIC(24,6),
                currency VARCHAR(8),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("sold_positions", """
            CREATE TABLE sold_positions (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                isin VARCHAR(32),
                symbol VARCHAR(64),
                sale_date DATE,
                quantity NUMERIC(24,8),
                purchase_price NUMERIC(24,8),
                sale_price NUMERIC(24,8),
                realized_pnl NUMERIC(24,6),
                currency VARCHAR(8),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("portfolio_snapshots", """
            CREATE TABLE portfolio_snapshots (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                report_date DATE NOT NULL,
                source VARCHAR(64),
                total_value NUMERIC(24,6),
                total_unrealized_pnl NUMERIC(24,6),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("positions", """
            CREATE TABLE positions (
                id BIGSERIAL PRIMARY KEY,
                snapshot_id BIGINT NOT NULL REFERENCES portfolio_snapshots(id),
                instrument_id VARCHAR(64) REFERENCES instruments(id),
                symbol VARCHAR(64),
                isin VARCHAR(32),
                currency VARCHAR(8),
                quantity NUMERIC(24,8),
                mark_price NUMERIC(24,8),
                position_value NUMERIC(24,6),
                cost_basis_price NUMERIC(24,8),
                cost_basis_money NUMERIC(24,6),
                unrealized_pnl NUMERIC(24,6),
                fx_rate_to_base NUMERIC(20,10),
                asset_class VARCHAR(16),
                listing_exchange VARCHAR(32),
                provenance JSONB
            )
            """);

        ddl.put("cash_balances", """
            CREATE TABLE cash_balances (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                period_end DATE,
                currency VARCHAR(8),
                starting_cash NUMERIC(24,6),
                ending_cash NUMERIC(24,6),
                base_summary BOOLEAN NOT NULL DEFAULT FALSE,
                source VARCHAR(64),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("account_valuations", """
            CREATE TABLE account_valuations (
                id BIGSERIAL PRIMARY KEY,
                external_id VARCHAR(128) NOT NULL UNIQUE,
                period_start DATE,
                period_end DATE,
                starting_value NUMERIC(24,6),
                ending_value NUMERIC(24,6),
                currency VARCHAR(8),
                source VARCHAR(64),
                provenance JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);

        ddl.put("fx_rates", """
            CREATE TABLE fx_rates (
                rate_date DATE NOT NULL,
                currency VARCHAR(8) NOT NULL,
                rate NUMERIC(20,10) NOT NULL CHECK (rate > 0),
                source VARCHAR(32),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (rate_date, currency)
            )
            """);

        return ddl;
    }

    private static String[] indexes() {
        return new String[] {
            """
            CREATE UNIQUE INDEX IF NOT EXISTS ux_instrument_aliases_key
                ON instrument_aliases (instrument_id, UPPER(symbol), UPPER(exchange))
            """,
            """
            CREATE UNIQUE INDEX IF NOT EXISTS ux_instrument_aliases_primary
                ON instrument_aliases (instrument_id) WHERE is_primary
            """,
            "CREATE INDEX IF NOT EXISTS ix_instrument_aliases_symbol ON instrument_aliases (UPPER(symbol))",
            "CREATE INDEX IF NOT EXISTS ix_positions_currency ON positions (currency)",
            "CREATE INDEX IF NOT EXISTS ix_portfolio_snapshots_date ON portfolio_snapshots (report_date)"
        };
    }
}
