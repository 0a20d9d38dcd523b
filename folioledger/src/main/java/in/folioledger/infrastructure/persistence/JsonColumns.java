package in.folioledger.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.folioledger.domain.model.Provenance;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Column helpers shared by the Postgres repositories: jsonb payloads and nullable dates.
 */
final class JsonColumns {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonColumns() {}

    static String write(Object value) throws JsonProcessingException {
        return value == null ? null : MAPPER.writeValueAsString(value);
    }

    static Provenance provenance(ResultSet rs, String column) throws SQLException, JsonProcessingException {
        String json = rs.getString(column);
        return json == null ? null : MAPPER.readValue(json, Provenance.class);
    }

    static Map<String, String> stringMap(ResultSet rs, String column) throws SQLException, JsonProcessingException {
        String json = rs.getString(column);
        return json == null ? Map.of() : MAPPER.readValue(json, STRING_MAP);
    }

    static LocalDate date(ResultSet rs, String column) throws SQLException {
        Date d = rs.getDate(column);
        return d == null ? null : d.toLocalDate();
    }

    static Date sqlDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
