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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A value in a {@link PropertyMap}: a real number, a string, a timestamp or nothing at all.
 *
 * @author hal.hildebrand
 */
public sealed interface PropertyValue permits PropertyValue.Real, PropertyValue.Text, PropertyValue.Time,
                                               PropertyValue.Empty {

    Empty EMPTY = new Empty();

    static PropertyValue of(double value) {
        return new Real(value);
    }

    static PropertyValue of(String value) {
        return value == null ? EMPTY : new Text(value);
    }

    static PropertyValue of(Instant value) {
        return value == null ? EMPTY : new Time(value);
    }

    /**
     * Interpolate between two values. Reals and times of the same kind interpolate linearly, anything else takes
     * whichever endpoint is nearer to t.
     */
    static PropertyValue interpolate(PropertyValue a, PropertyValue b, double t) {
        if (a instanceof Real ra && b instanceof Real rb) {
            return new Real(ra.value() + t * (rb.value() - ra.value()));
        }
        if (a instanceof Time ta && b instanceof Time tb) {
            var span = Duration.between(ta.value(), tb.value());
            return new Time(ta.value().plusNanos(Math.round(span.toNanos() * t)));
        }
        return t < 0.5 ? a : b;
    }

    record Real(double value) implements PropertyValue {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Text(String value) implements PropertyValue {
        public Text {
            Objects.requireNonNull(value, "Text value cannot be null");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Time(Instant value) implements PropertyValue {
        public Time {
            Objects.requireNonNull(value, "Time value cannot be null");
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    final class Empty implements PropertyValue {
        private Empty() {
        }

        @Override
        public String toString() {
            return "(empty)";
        }
    }
}
