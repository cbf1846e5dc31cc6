package org.abmkit.runtime.model;

import com.typesafe.config.Config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Arbitrary, mutable model-level state shared by all agents (rates, thresholds, counters).
 * Keys keep their insertion order.
 */
public final class ModelProperties {

    private final Map<String, Object> values;

    private ModelProperties(Map<String, Object> values) {
        this.values = values;
    }

    public static ModelProperties empty() {
        return new ModelProperties(new LinkedHashMap<>());
    }

    /**
     * @param values initial values, copied
     * @return new properties
     */
    public static ModelProperties of(Map<String, ?> values) {
        return new ModelProperties(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }

    /**
     * Copies an object block of a configuration, e.g. {@code abmkit.model.properties}.
     * Nested objects become nested maps.
     *
     * @param config the block
     * @return new properties
     */
    public static ModelProperties fromConfig(Config config) {
        return of(config.root().unwrapped());
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * @throws IllegalArgumentException if the key is unknown
     */
    public Object get(String key) {
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("Unknown model property: " + key);
        }
        return values.get(key);
    }

    public double getDouble(String key) {
        return asNumber(key).doubleValue();
    }

    public int getInt(String key) {
        return asNumber(key).intValue();
    }

    public long getLong(String key) {
        return asNumber(key).longValue();
    }

    public boolean getBoolean(String key) {
        Object value = get(key);
        if (!(value instanceof Boolean b)) {
            throw new IllegalArgumentException("Model property '" + key + "' is not a boolean: " + value);
        }
        return b;
    }

    public String getString(String key) {
        return String.valueOf(get(key));
    }

    public ModelProperties set(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return independent properties with the same entries; nested values are shared
     */
    public ModelProperties copy() {
        return of(values);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    private Number asNumber(String key) {
        Object value = get(key);
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("Model property '" + key + "' is not numeric: " + value);
        }
        return n;
    }

    @Override
    public String toString() {
        return "ModelProperties" + values;
    }
}
