package models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import amplTransformator.AmplDataException;

/**
 * Result of reading one .dat file: named sets and named parameters.
 *
 * <p>Sets map to ordered element lists. Params map to a {@link Double} or
 * {@link String} (scalar), a {@code Map<String, Double>} (indexed by one set) or a
 * {@code Map<String, Map<String, Double>>} (row/column table). Both maps keep
 * declaration order. Sets and params are separate namespaces.
 */
public class AmplDataDocument {

    private final Map<String, List<String>> sets = new LinkedHashMap<>();
    private final Map<String, Object> params = new LinkedHashMap<>();

    public void putSet(String name, List<String> elements) {
        sets.put(name, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public void putScalar(String name, Object value) {
        if (!(value instanceof Double) && !(value instanceof String)) {
            throw new IllegalArgumentException("Scalar " + name + " must be a Double or String, got " + value);
        }
        params.put(name, value);
    }

    public void putIndexedParam(String name, Map<String, Double> values) {
        params.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public void putTable(String name, Map<String, Map<String, Double>> rows) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> row : rows.entrySet()) {
            copy.put(row.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(row.getValue())));
        }
        params.put(name, Collections.unmodifiableMap(copy));
    }

    public Map<String, List<String>> getSets() {
        return Collections.unmodifiableMap(sets);
    }

    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    public List<String> getSet(String name) {
        List<String> elements = sets.get(name);
        if (elements == null) {
            throw new AmplDataException("Unknown set " + name);
        }
        return elements;
    }

    public boolean hasParam(String name) {
        return params.containsKey(name);
    }

    /**
     * @return the scalar value, a {@link Double} or, for non-numeric literals, a {@link String}
     */
    public Object getScalar(String name) {
        Object value = requireParam(name);
        if (value instanceof Map) {
            throw new AmplDataException("Param " + name + " is indexed, not a scalar");
        }
        return value;
    }

    public double getNumericScalar(String name) {
        Object value = getScalar(name);
        if (!(value instanceof Double)) {
            throw new AmplDataException("Param " + name + " is not numeric: " + value);
        }
        return (Double) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Double> getIndexedParam(String name) {
        Object value = requireParam(name);
        if (!(value instanceof Map) || containsNestedMaps((Map<String, ?>) value)) {
            throw new AmplDataException("Param " + name + " is not indexed by a single set");
        }
        return (Map<String, Double>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Double>> getTable(String name) {
        Object value = requireParam(name);
        if (!(value instanceof Map)) {
            throw new AmplDataException("Param " + name + " is not a table");
        }
        Map<String, ?> map = (Map<String, ?>) value;
        if (!map.isEmpty() && !containsNestedMaps(map)) {
            throw new AmplDataException("Param " + name + " is not a table");
        }
        return (Map<String, Map<String, Double>>) value;
    }

    private Object requireParam(String name) {
        Object value = params.get(name);
        if (value == null) {
            throw new AmplDataException("Unknown param " + name);
        }
        return value;
    }

    private static boolean containsNestedMaps(Map<String, ?> map) {
        for (Object v : map.values()) {
            if (v instanceof Map) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AmplDataDocument)) {
            return false;
        }
        AmplDataDocument other = (AmplDataDocument) o;
        return sets.equals(other.sets) && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sets, params);
    }

    @Override
    public String toString() {
        return "AmplDataDocument{sets=" + sets + ", params=" + params + "}";
    }
}
