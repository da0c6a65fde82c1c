package wizardrunner.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values supplied for one execution, keyed by field id. Ordinary fields map
 * to a scalar; group fields map to a list of item records.
 *
 * <p>Read-only once built: {@link #asMap()} is an unmodifiable view.
 */
public class UserData {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public UserData() {}

    public static UserData of(Map<String, ?> values) {
        UserData data = new UserData();
        if (values != null) {
            values.forEach(data::put);
        }
        return data;
    }

    @JsonAnySetter
    void put(String fieldId, Object value) {
        values.put(fieldId, value);
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean has(String fieldId) {
        return values.containsKey(fieldId) && values.get(fieldId) != null;
    }

    public Object get(String fieldId) {
        return values.get(fieldId);
    }

    public int size() {
        return values.size();
    }

    /**
     * Renders a scalar value the way it is typed into the page. Integral
     * numbers drop any trailing {@code .0}.
     */
    public static String asText(Object value) {
        if (value == null) return null;
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Interprets a group value as its list of item records.
     *
     * @throws IllegalArgumentException if the value is not a list of objects
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> asRecords(Object value) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a list of records but got: "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        List<Map<String, Object>> records = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("Group item is not a record: " + item);
            }
            records.add((Map<String, Object>) item);
        }
        return records;
    }

    @Override
    public String toString() {
        return "UserData" + values.keySet();
    }
}
