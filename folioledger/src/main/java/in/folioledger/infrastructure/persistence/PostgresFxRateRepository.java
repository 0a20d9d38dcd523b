package in.folioledger.infrastructure.persistence;

import in.folioledger.application.port.output.FxRateRepository;
import in.folioledger.domain.model.FxRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public final class PostgresFxRateRepository implements FxRateRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresFxRateRepository.class);

    private final DataSource dataSource;
    private final JdbcSupport jdbc;

    public PostgresFxRateRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbc = new JdbcSupport(dataSource, log);
    }

    @Override
    public void upsert(FxRate rate) {
        String sql = """
                INSERT INTO fx_rates (rate_date, currency, rate, source)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (rate_date, currency) DO UPDATE SET
                    rate = EXCLUDED.rate,
                    source = EXCLUDED.source,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDate(1, JsonColumns.sqlDate(rate.date()));
            ps.setString(2, rate.currency().toUpperCase());
            ps.setBigDecimal(3, rate.rate());
            ps.setString(4, rate.source());
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Error saving FX rate {} {}: {}", rate.currency(), rate.date(), e.getMessage(), e);
            throw new RuntimeException("Failed to save FX rate", e);
        }
    }

    @Override
    public Optional<FxRate> findNearestPrior(String currency, LocalDate date, LocalDate earliest) {
        String sql = """
                SELECT rate_date, currency, rate, source
                FROM fx_rates
                WHERE currency = ? AND rate_date <= ? AND rate_date >= ?
                ORDER BY rate_date DESC
                LIMIT 1
                """;

        List<FxRate> found = jdbc.query(sql, "FX rates", ps -> {
            ps.setString(1, currency.toUpperCase());
            ps.setDate(2, JsonColumns.sqlDate(date));
            ps.setDate(3, JsonColumns.sqlDate(earliest));
        }, rs -> new FxRate(
                JsonColumns.date(rs, "rate_date"),
                rs.getString("currency"),
                rs.getBigDecimal("rate"),
                rs.getString("source")));
        return found.stream().findFirst();
    }

    @Override
    public List<FxRate> findAll() {
        String sql = "SELECT rate_date, currency, rate, source FROM fx_rates ORDER BY rate_date, currency";

        return jdbc.queryAll(sql, "FX rates", rs -> new FxRate(
                JsonColumns.date(rs, "rate_date"),
                rs.getString("currency"),
                rs.getBigDecimal("rate"),
                rs.getString("source")));
    }
}
