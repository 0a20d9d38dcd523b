package in.folioledger.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.folioledger.application.port.output.InstrumentRepository;
import in.folioledger.domain.model.Instrument;
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

public final class PostgresInstrumentRepository implements InstrumentRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInstrumentRepository.class);

    private static final String COLUMNS = """
            id, isin, cusip, conid, figi, name, asset_category, listing_exchange, currency,
            multiplier, type, enrichment, created_at, updated_at
            """;

    private final DataSource dataSource;

    public PostgresInstrumentRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Instrument getOrCreate(Instrument candidate) {
        String insert = """
                INSERT INTO instruments (
                    id, isin, cusip, conid, figi, name, asset_category, listing_exchange, currency,
                    multiplier, type, enrichment, created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
                ON CONFLICT (isin) DO NOTHING
                """;
        String select = "SELECT " + COLUMNS + " FROM instruments WHERE isin = ?";

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setString(1, candidate.id());
                ps.setString(2, candidate.isin());
                ps.setString(3, candidate.cusip());
                ps.setString(4, candidate.conid());
                ps.setString(5, candidate.figi());
                ps.setString(6, candidate.name());
                ps.setString(7, candidate.assetCategory());
                ps.setString(8, candidate.listingExchange());
                ps.setString(9, candidate.currency());
                ps.setBigDecimal(10, candidate.multiplier());
                ps.setString(11, candidate.type());
                ps.setString(12, JsonColumns.write(candidate.enrichment()));
                ps.setTimestamp(13, JsonColumns.timestamp(candidate.createdAt()));
                ps.setTimestamp(14, JsonColumns.timestamp(candidate.updatedAt()));
                if (ps.executeUpdate() > 0) {
                    log.debug("Created instrument {} ({})", candidate.isin(), candidate.id());
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(select)) {
                ps.setString(1, candidate.isin());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return mapRow(rs);
                    }
                }
            }
        } catch (Exception e) {
            log.error("Error creating instrument {}: {}", candidate.isin(), e.getMessage(), e);
            throw new RuntimeException("Failed to get or create instrument " + candidate.isin(), e);
        }

        throw new IllegalStateException("Instrument vanished after insert: " + candidate.isin());
    }

    @Override
    public void update(Instrument instrument) {
        String sql = """
                UPDATE instruments SET
                    cusip = ?, conid = ?, figi = ?, name = ?, asset_category = ?,
                    listing_exchange = ?, currency = ?, multiplier = ?, type = ?,
                    enrichment = ?::jsonb, updated_at = NOW()
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrument.cusip());
            ps.setString(2, instrument.conid());
            ps.setString(3, instrument.figi());
            ps.setString(4, instrument.name());
            ps.setString(5, instrument.assetCategory());
            ps.setString(6, instrument.listingExchange());
            ps.setString(7, instrument.currency());
            ps.setBigDecimal(8, instrument.multiplier());
            ps.setString(9, instrument.type());
            ps.setString(10, JsonColumns.write(instrument.enrichment()));
            ps.setString(11, instrument.id());

            if (ps.executeUpdate() == 0) {
                log.warn("Instrument {} not found for update", instrument.id());
            }
        } catch (Exception e) {
            log.error("Error updating instrument {}: {}", instrument.isin(), e.getMessage(), e);
            throw new RuntimeException("Failed to update instrument", e);
        }
    }

    @Override
    public Optional<Instrument> findByIsin(String isin) {
        return findOne("SELECT " + COLUMNS + " FROM instruments WHERE isin = ?", isin);
    }

    @Override
    public Optional<Instrument> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM instruments WHERE id = ?", id);
    }

    @Override
    public List<Instrument> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM instruments ORDER BY isin";
        List<Instrument> results = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        } catch (Exception e) {
            log.error("Error listing instruments: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list instruments", e);
        }

        return results;
    }

    private Optional<Instrument> findOne(String sql, String key) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error finding instrument {}: {}", key, e.getMessage(), e);
            throw new RuntimeException("Failed to find instrument", e);
        }

        return Optional.empty();
    }

    private Instrument mapRow(ResultSet rs) throws SQLException, JsonProcessingException {
        return new Instrument(
                rs.getString("id"),
                rs.getString("isin"),
                rs.getString("cusip"),
                rs.getString("conid"),
                rs.getString("figi"),
                rs.getString("name"),
                rs.getString("asset_category"),
                rs.getString("listing_exchange"),
                rs.getString("currency"),
                rs.getBigDecimal("multiplier"),
                rs.getString("type"),
                JsonColumns.stringMap(rs, "enrichment"),
                JsonColumns.instant(rs, "created_at"),
                JsonColumns.instant(rs, "updated_at"));
    }
}
