/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.ingestion.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Static helpers for inspecting loosely typed ERP field values.
 *
 * <p>Values arrive as whatever a JSON parser produced: strings, boxed numbers,
 * booleans, lists and maps. Relationship fields follow the ERP convention of
 * {@code [id, label]} for single references and {@code [id, ...]} for multi references,
 * with {@code false} standing for an unset single reference.</p>
 */
public final class ErpValues {

    private static final DateTimeFormatter ERP_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDateTime.parse(text, ERP_DATETIME).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

    private ErpValues() {
    }

    /**
     * Returns {@code true} for {@code null} and the empty string.
     */
    public static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence cs && cs.length() == 0);
    }

    /**
     * Returns {@code true} for {@code null}, blank strings and empty collections.
     */
    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence cs) {
            return cs.toString().trim().isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    /**
     * Loose truthiness: {@code null}, {@code false}, zero, NaN and the empty string are falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence cs) {
            return cs.length() > 0;
        }
        return true;
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    /**
     * Returns the numeric value as a {@code Double}, or {@code null} when the value is not a number.
     */
    public static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    /**
     * Returns {@code true} when the value is a number without a fractional part.
     * {@code 42.0} counts as integral, matching how JSON numbers are usually produced.
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d);
        }
        return false;
    }

    /**
     * Returns {@code true} when the value is absent or the ERP {@code false} sentinel.
     */
    public static boolean isUnsetRelation(Object value) {
        return value == null || Boolean.FALSE.equals(value);
    }

    /**
     * Returns {@code true} when the value is exactly {@code [integer, string]}.
     */
    public static boolean isRelationTuple(Object value) {
        return value instanceof List<?> list
                && list.size() == 2
                && isIntegral(list.get(0))
                && list.get(1) instanceof String;
    }

    /**
     * Returns the identifier of a relationship value, or {@code null} when the value is
     * not a non-empty list.
     */
    public static Object relationId(Object value) {
        return value instanceof List<?> list && !list.isEmpty() ? list.get(0) : null;
    }

    /**
     * Returns the label of a relationship tuple, or {@code null} when it has none.
     */
    public static String relationLabel(Object value) {
        if (value instanceof List<?> list && list.size() > 1 && list.get(1) instanceof String label) {
            return label;
        }
        return null;
    }

    /**
     * Converts a date-like value into an {@link Instant}.
     *
     * <p>Accepts {@code java.time} values, {@link Date}, epoch milliseconds and strings in
     * ISO-8601 date, date-time or offset date-time form, as well as the ERP
     * {@code yyyy-MM-dd HH:mm:ss} form. Values without an offset are read as UTC.</p>
     *
     * @param value the value to convert
     * @return the instant, or empty when the value cannot be read as a date
     */
    public static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Long || value instanceof Integer) {
            return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        }
        if (value instanceof String text) {
            return parseDate(text.trim());
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} when {@link #toInstant(Object)} can read the value.
     */
    public static boolean isDate(Object value) {
        return toInstant(value).isPresent();
    }

    /**
     * Returns the value as a map, or an empty map when it is not one.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Optional<Instant> parseDate(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return Optional.of(parser.apply(text));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }
}
