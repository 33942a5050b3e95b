/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Meridian.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.meridian.common;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion ordered bag of named {@link PropertyValue}s attached to trajectory points and trajectories.
 * Every mutator returns a new map.
 *
 * @author hal.hildebrand
 */
public final class PropertyMap {
    public static final PropertyMap EMPTY = new PropertyMap(Collections.emptyMap());

    /**
     * Interpolate two property maps key by key. Keys present on only one side keep that side's value.
     */
    public static PropertyMap interpolate(PropertyMap a, PropertyMap b, double t) {
        if (a.isEmpty() && b.isEmpty()) {
            return EMPTY;
        }
        var result = new LinkedHashMap<String, PropertyValue>(a.values);
        for (var entry : b.values.entrySet()) {
            var left = a.values.get(entry.getKey());
            result.put(entry.getKey(),
                       left == null ? entry.getValue() : PropertyValue.interpolate(left, entry.getValue(), t));
        }
        return new PropertyMap(result);
    }

    private final Map<String, PropertyValue> values;

    private PropertyMap(Map<String, PropertyValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Map<String, PropertyValue> asMap() {
        return values;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PropertyMap other && values.equals(other.values);
    }

    public Optional<PropertyValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<Double> getReal(String key) {
        return get(key).filter(PropertyValue.Real.class::isInstance)
                       .map(v -> ((PropertyValue.Real) v).value());
    }

    public Optional<String> getText(String key) {
        return get(key).filter(PropertyValue.Text.class::isInstance)
                       .map(v -> ((PropertyValue.Text) v).value());
    }

    public Optional<Instant> getTime(String key) {
        return get(key).filter(PropertyValue.Time.class::isInstance)
                       .map(v -> ((PropertyValue.Time) v).value());
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public PropertyMap with(String key, PropertyValue value) {
        Objects.requireNonNull(key, "Property key cannot be null");
        Objects.requireNonNull(value, "Property value cannot be null");
        var copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new PropertyMap(copy);
    }

    public PropertyMap with(String key, double value) {
        return with(key, PropertyValue.of(value));
    }

    public PropertyMap with(String key, String value) {
        return with(key, PropertyValue.of(value));
    }

    public PropertyMap with(String key, Instant value) {
        return with(key, PropertyValue.of(value));
    }

    public PropertyMap without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        var copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return new PropertyMap(copy);
    }
}
