package com.example.blogsync_backend.service.options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat, immutable view of blog options keyed by option name, independent of the backend format that produced it.
 * Nested maps and collections are copied into unmodifiable structures.
 */
public final class NormalizedOptions {
    private static final Logger LOGGER = LoggerFactory.getLogger(NormalizedOptions.class);
    private static final NormalizedOptions EMPTY = new NormalizedOptions(Map.of());

    private final Map<String, Object> values;

    private NormalizedOptions(Map<String, Object> values) {
        this.values = values;
    }

    public static NormalizedOptions empty() {
        return EMPTY;
    }

    /**
     * Copies the given flat mapping, dropping {@code null} keys and values.
     * When two keys render to the same option name the first one wins.
     */
    public static NormalizedOptions of(Map<?, ?> flat) {
        if (flat == null || flat.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : flat.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String name = entry.getKey().toString();
            if (copy.containsKey(name)) {
                LOGGER.debug("NormalizedOptions ignored duplicate key={} type={}", name, entry.getKey().getClass().getSimpleName());
                continue;
            }
            copy.put(name, freeze(entry.getValue()));
        }
        return copy.isEmpty() ? EMPTY : new NormalizedOptions(Collections.unmodifiableMap(copy));
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public Optional<OptionValue> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return OptionValue.of(values.get(name));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedOptions that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizedOptions" + values;
    }
}
