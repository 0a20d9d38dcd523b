package in.folioledger.service.ingest.csv;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column lookup by header name.
 *
 * Repeated header names get an occurrence suffix: the second {@code Valuutta} column is
 * {@code Valuutta#2}, the third {@code Valuutta#3}. The first keeps the bare name.
 */
public final class HeaderIndex {

    private final List<String> names;
    private final Map<String, Integer> positions;

    public HeaderIndex(List<String> columns) {
        List<String> unique = new ArrayList<>(columns.size());
        Map<String, Integer> occurrences = new HashMap<>();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i).trim();
            int seen = occurrences.merge(column, 1, Integer::sum);
            String name = seen == 1 ? column : column + "#" + seen;
            unique.add(name);
            index.put(name, i);
        }
        this.names = Collections.unmodifiableList(unique);
        this.positions = Collections.unmodifiableMap(index);
    }

    public List<String> names() {
        return names;
    }

    public boolean has(String name) {
        return positions.containsKey(name);
    }

    /**
     * Trimmed cell under {@code name}; null when the column is absent, the row is short or
     * the cell is blank.
     */
    public String get(List<String> values, String name) {
        Integer idx = positions.get(name);
        if (idx == null || idx >= values.size()) {
            return null;
        }
        String value = values.get(idx);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /** First non-blank value among alternative column names. */
    public String first(List<String> values, String... names) {
        for (String name : names) {
            String value = get(values, name);
            if (value != null) return value;
        }
        return null;
    }

    /**
     * Header-to-value map for provenance. Every column is kept, known or not; surplus
     * cells beyond the header become {@code _extra_N}.
     */
    public Map<String, String> toFieldMap(List<String> values) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            String key = i < names.size() ? names.get(i) : "_extra_" + (i - names.size() + 1);
            fields.put(key, values.get(i));
        }
        return fields;
    }

    /** Header names not in {@code known}, for debug logging. */
    public List<String> unknownColumns(Set<String> known) {
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            String bare = name.contains("#") ? name.substring(0, name.indexOf('#')) : name;
            if (!known.contains(bare) && !known.contains(name)) {
                unknown.add(name);
            }
        }
        return unknown;
    }
}
