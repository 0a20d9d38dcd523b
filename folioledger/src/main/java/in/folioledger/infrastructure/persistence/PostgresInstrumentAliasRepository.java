package in.folioledger.infrastructure.persistence;

import in.folioledger.application.port.output.InstrumentAliasRepository;
import in.folioledger.domain.model.AliasSource;
import in.folioledger.domain.model.InstrumentAlias;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of InstrumentAliasRepository.
 *
 * Alias identity is (instrument_id, UPPER(symbol), UPPER(exchange)); a partial unique index
 * keeps at most one primary alias per instrument.
 */
public final class PostgresInstrumentAliasRepository implements InstrumentAliasRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInstrumentAliasRepository.class);

    private static final String COLUMNS =
            "id, instrument_id, symbol, exchange, valid_from, valid_to, source, is_primary, created_at";

    private final DataSource dataSource;

    public PostgresInstrumentAliasRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public InstrumentAlias upsert(InstrumentAlias alias) {
        String sql = """
                INSERT INTO instrument_aliases (
                    id, instrument_id, symbol, exchange, valid_from, valid_to, source, is_primary, created_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (instrument_id, UPPER(symbol), UPPER(exchange)) DO UPDATE SET
                    valid_from = EXCLUDED.valid_from,
                    valid_to = EXCLUDED.valid_to,
                    source = EXCLUDED.source
                RETURNING id, instrument_id, symbol, exchange, valid_from, valid_to, source, is_primary, created_at
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, alias.id());
            ps.setString(2, alias.instrumentId());
            ps.setString(3, alias.symbol());
            ps.setString(4, alias.exchange());
            ps.setDate(5, JsonColumns.sqlDate(alias.validFrom()));
            ps.setDate(6, JsonColumns.sqlDate(alias.validTo()));
            ps.setString(7, alias.source().code());
            ps.setBoolean(8, alias.primary());
            ps.setTimestamp(9, JsonColumns.timestamp(alias.createdAt()));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
        } catch (Exception e) {
            log.error("Error saving alias {} for {}: {}", alias.symbol(), alias.instrumentId(), e.getMessage(), e);
            throw new RuntimeException("Failed to save alias", e);
        }

        return alias;
    }

    @Override
    public Optional<InstrumentAlias> find(String instrumentId, String symbol, String exchange) {
        String sql = "SELECT " + COLUMNS + " FROM instrument_aliases"
                + " WHERE instrument_id = ? AND UPPER(symbol) = UPPER(?) AND UPPER(exchange) = UPPER(?)";
        List<InstrumentAlias> found = query(sql, instrumentId, symbol, exchange == null ? "" : exchange.trim());
        return found.stream().findFirst();
    }

    @Override
    public List<InstrumentAlias> findByInstrument(String instrumentId) {
        return query("SELECT " + COLUMNS + " FROM instrument_aliases WHERE instrument_id = ? ORDER BY created_at",
                instrumentId);
    }

    @Override
    public List<InstrumentAlias> findBySymbol(String symbol) {
        return query("SELECT " + COLUMNS + " FROM instrument_aliases WHERE UPPER(symbol) = UPPER(?) ORDER BY created_at",
                symbol.trim());
    }

    @Override
    public void setPrimary(String instrumentId, String aliasId) {
        String demote = "UPDATE instrument_aliases SET is_primary = FALSE WHERE instrument_id = ? AND is_primary";
        String promote = "UPDATE instrument_aliases SET is_primary = TRUE WHERE instrument_id = ? AND id = ?";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement d = conn.prepareStatement(demote);
                    PreparedStatement p = conn.prepareStatement(promote)) {
                d.setString(1, instrumentId);
                d.executeUpdate();

                p.setString(1, instrumentId);
                p.setString(2, aliasId);
                if (p.executeUpdate() == 0) {
                    conn.rollback();
                    throw new IllegalArgumentException("Alias " + aliasId + " does not belong to " + instrumentId);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error setting primary alias for {}: {}", instrumentId, e.getMessage(), e);
            throw new RuntimeException("Failed to set primary alias", e);
        }
    }

    @Override
    public List<InstrumentAlias> findAll() {
        return query("SELECT " + COLUMNS + " FROM instrument_aliases ORDER BY instrument_id, created_at");
    }

    private List<InstrumentAlias> query(String sql, String... params) {
        List<InstrumentAlias> results = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error querying aliases: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to query aliases", e);
        }

        return results;
    }

    private InstrumentAlias mapRow(ResultSet rs) throws SQLException {
        return new InstrumentAlias(
                rs.getString("id"),
                rs.getString("instrument_id"),
                rs.getString("symbol"),
                rs.getString("exchange"),
                JsonColumns.date(rs, "valid_from"),
                JsonColumns.date(rs, "valid_to"),
                AliasSource.fromCode(rs.getString("source")),
                rs.getBoolean("is_primary"),
                JsonColumns.instant(rs, "created_at"));
    }
}
