package in.folioledger.infrastructure.persistence;

import org.slf4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Insert-if-absent and list-all plumbing for the append-only ledger tables.
 */
final class JdbcSupport {

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws Exception;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws Exception;
    }

    private final DataSource dataSource;
    private final Logger log;

    JdbcSupport(DataSource dataSource, Logger log) {
        this.dataSource = dataSource;
        this.log = log;
    }

    /**
     * Run an {@code INSERT ... ON CONFLICT DO NOTHING}.
     *
     * @return true when a row was written
     */
    boolean insertIfAbsent(String sql, String what, String externalId, Binder binder) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            return ps.executeUpdate() > 0;
        } catch (Exception e) {
            log.error("Error inserting {} {}: {}", what, externalId, e.getMessage(), e);
            throw new RuntimeException("Failed to insert " + what, e);
        }
    }

    <T> List<T> queryAll(String sql, String what, RowMapper<T> mapper) {
        return query(sql, what, ps -> { }, mapper);
    }

    <T> List<T> query(String sql, String what, Binder binder, RowMapper<T> mapper) {
        List<T> results = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
        } catch (Exception e) {
            log.error("Error listing {}: {}", what, e.getMessage(), e);
            throw new RuntimeException("Failed to list " + what, e);
        }

        return results;
    }
}
