package in.folioledger.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.folioledger.application.port.output.SnapshotRepository;
import in.folioledger.domain.model.PortfolioSnapshot;
import in.folioledger.domain.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL implementation of SnapshotRepository.
 *
 * A snapshot and its positions are written in one transaction.
 */
public final class PostgresSnapshotRepository implements SnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSnapshotRepository.class);

    private static final String POSITION_COLUMNS = """
            p.instrument_id, p.symbol, p.isin, p.currency, p.quantity, p.mark_price, p.position_value,
            p.cost_basis_price, p.cost_basis_money, p.unrealized_pnl, p.fx_rate_to_base,
            p.asset_class, p.listing_exchange, p.provenance
            """;

    private final DataSource dataSource;
    private final JdbcSupport jdbc;

    public PostgresSnapshotRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbc = new JdbcSupport(dataSource, log);
    }

    @Override
    public boolean insertIfAbsent(PortfolioSnapshot snapshot) {
        String insertSnapshot = """
                INSERT INTO portfolio_snapshots (
                    external_id, report_date, source, total_value, total_unrealized_pnl, provenance
                ) VALUES (?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (external_id) DO NOTHING
                RETURNING id
                """;
        String insertPosition = """
                INSERT INTO positions (
                    snapshot_id, instrument_id, symbol, isin, currency, quantity, mark_price,
                    position_value, cost_basis_price, cost_basis_money, unrealized_pnl,
                    fx_rate_to_base, asset_class, listing_exchange, provenance
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long snapshotId;
                try (PreparedStatement ps = conn.prepareStatement(insertSnapshot)) {
                    ps.setString(1, snapshot.externalId());
                    ps.setDate(2, JsonColumns.sqlDate(snapshot.reportDate()));
                    ps.setString(3, snapshot.source());
                    ps.setBigDecimal(4, snapshot.totalValue());
                    ps.setBigDecimal(5, snapshot.totalUnrealizedPnl());
                    ps.setString(6, JsonColumns.write(snapshot.provenance()));
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return false;
                        }
                        snapshotId = rs.getLong("id");
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(insertPosition)) {
                    for (Position p : snapshot.positions()) {
                        ps.setLong(1, snapshotId);
                        ps.setString(2, p.instrumentId());
                        ps.setString(3, p.symbol());
                        ps.setString(4, p.isin());
                        ps.setString(5, p.currency());
                        ps.setBigDecimal(6, p.quantity());
                        ps.setBigDecimal(7, p.markPrice());
                        ps.setBigDecimal(8, p.positionValue());
                        ps.setBigDecimal(9, p.costBasisPrice());
                        ps.setBigDecimal(10, p.costBasisMoney());
                        ps.setBigDecimal(11, p.unrealizedPnl());
                        ps.setBigDecimal(12, p.fxRateToBase());
                        ps.setString(13, p.assetClass());
                        ps.setString(14, p.listingExchange());
                        ps.setString(15, JsonColumns.write(p.provenance()));
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }

                conn.commit();
                log.debug("Saved snapshot {} with {} positions", snapshot.externalId(), snapshot.positions().size());
                return true;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (Exception e) {
            log.error("Error saving snapshot {}: {}", snapshot.externalId(), e.getMessage(), e);
            throw new RuntimeException("Failed to save snapshot", e);
        }
    }

    @Override
    public List<PortfolioSnapshot> findAll() {
        String snapshotsSql = """
                SELECT id, external_id, report_date, source, total_value, total_unrealized_pnl, provenance
                FROM portfolio_snapshots
                ORDER BY report_date, id
                """;
        String positionsSql = "SELECT p.snapshot_id, " + POSITION_COLUMNS + " FROM positions p ORDER BY p.snapshot_id, p.id";

        Map<Long, List<Position>> positions = new LinkedHashMap<>();
        for (Map.Entry<Long, Position> row : jdbc.queryAll(positionsSql, "positions",
                rs -> Map.entry(rs.getLong("snapshot_id"), mapPosition(rs)))) {
            positions.computeIfAbsent(row.getKey(), k -> new ArrayList<>()).add(row.getValue());
        }

        return jdbc.queryAll(snapshotsSql, "snapshots", rs -> new PortfolioSnapshot(
                rs.getString("external_id"),
                JsonColumns.date(rs, "report_date"),
                rs.getString("source"),
                rs.getBigDecimal("total_value"),
                rs.getBigDecimal("total_unrealized_pnl"),
                positions.getOrDefault(rs.getLong("id"), List.of()),
                JsonColumns.provenance(rs, "provenance")));
    }

    @Override
    public List<PositionRate> findPositionRates(String currency, LocalDate from, LocalDate to) {
        String sql = "SELECT s.report_date, " + POSITION_COLUMNS + """
                FROM positions p
                JOIN portfolio_snapshots s ON s.id = p.snapshot_id
                WHERE UPPER(p.currency) = UPPER(?)
                  AND p.fx_rate_to_base IS NOT NULL
                  AND s.report_date BETWEEN ? AND ?
                ORDER BY s.report_date
                """;

        return jdbc.query(sql, "position rates", ps -> {
            ps.setString(1, currency);
            ps.setDate(2, JsonColumns.sqlDate(from));
            ps.setDate(3, JsonColumns.sqlDate(to));
        }, rs -> new PositionRate(JsonColumns.date(rs, "report_date"), mapPosition(rs)));
    }

    private Position mapPosition(ResultSet rs) throws SQLException, JsonProcessingException {
        return new Position(
                rs.getString("instrument_id"),
                rs.getString("symbol"),
                rs.getString("isin"),
                rs.getString("currency"),
                rs.getBigDecimal("quantity"),
                rs.getBigDecimal("mark_price"),
                rs.getBigDecimal("position_value"),
                rs.getBigDecimal("cost_basis_price"),
                rs.getBigDecimal("cost_basis_money"),
                rs.getBigDecimal("unrealized_pnl"),
                rs.getBigDecimal("fx_rate_to_base"),
                rs.getString("asset_class"),
                rs.getString("listing_exchange"),
                JsonColumns.provenance(rs, "provenance"));
    }
}
