package in.folioledger.infrastructure.persistence;

import in.folioledger.application.port.output.AccountRepository;
import in.folioledger.domain.model.AccountValuation;
import in.folioledger.domain.model.CashBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.List;

/**
 * PostgreSQL implementation of AccountRepository: cash balances and reported account values.
 */
public final class PostgresAccountRepository implements AccountRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAccountRepository.class);

    private final JdbcSupport jdbc;

    public PostgresAccountRepository(DataSource dataSource) {
        this.jdbc = new JdbcSupport(dataSource, log);
    }

    @Override
    public boolean insertCashBalanceIfAbsent(CashBalance b) {
        String sql = """
                INSERT INTO cash_balances (
                    external_id, period_end, currency, starting_cash, ending_cash, base_summary, source, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "cash balance", b.externalId(), ps -> {
            ps.setString(1, b.externalId());
            ps.setDate(2, JsonColumns.sqlDate(b.periodEnd()));
            ps.setString(3, b.currency());
            ps.setBigDecimal(4, b.startingCash());
            ps.setBigDecimal(5, b.endingCash());
            ps.setBoolean(6, b.baseSummary());
            ps.setString(7, b.source());
            ps.setString(8, JsonColumns.write(b.provenance()));
        });
    }

    @Override
    public boolean insertValuationIfAbsent(AccountValuation v) {
        String sql = """
                INSERT INTO account_valuations (
                    external_id, period_start, period_end, starting_value, ending_value, currency, source, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                """;

        return jdbc.insertIfAbsent(sql, "account valuation", v.externalId(), ps -> {
            ps.setString(1, v.externalId());
            ps.setDate(2, JsonColumns.sqlDate(v.periodStart()));
            ps.setDate(3, JsonColumns.sqlDate(v.periodEnd()));
            ps.setBigDecimal(4, v.startingValue());
            ps.setBigDecimal(5, v.endingValue());
            ps.setString(6, v.currency());
            ps.setString(7, v.source());
            ps.setString(8, JsonColumns.write(v.provenance()));
        });
    }

    @Override
    public List<CashBalance> findAllCashBalances() {
        String sql = """
                SELECT external_id, period_end, currency, starting_cash, ending_cash, base_summary, source, provenance
                FROM cash_balances
                ORDER BY period_end, currency
                """;

        return jdbc.queryAll(sql, "cash balances", rs -> new CashBalance(
                rs.getString("external_id"),
                JsonColumns.date(rs, "period_end"),
                rs.getString("currency"),
                rs.getBigDecimal("starting_cash"),
                rs.getBigDecimal("ending_cash"),
                rs.getBoolean("base_summary"),
                rs.getString("source"),
                JsonColumns.provenance(rs, "provenance")));
    }

    @Override
    public List<AccountValuation> findAllValuations() {
        String sql = """
                SELECT external_id, period_start, period_end, starting_value, ending_value, currency, source, provenance
                FROM account_valuations
                ORDER BY period_end, external_id
                """;

        return jdbc.queryAll(sql, "account valuations", rs -> new AccountValuation(
                rs.getString("external_id"),
                JsonColumns.date(rs, "period_start"),
                JsonColumns.date(rs, "period_end"),
                rs.getBigDecimal("starting_value"),
                rs.getBigDecimal("ending_value"),
                rs.getString("currency"),
                rs.getString("source"),
                JsonColumns.provenance(rs, "provenance")));
    }
}
