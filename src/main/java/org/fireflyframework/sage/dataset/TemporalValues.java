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

package org.fireflyframework.sage.dataset;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Conversions from the temporal representations found in spreadsheets and JDBC
 * result sets to {@link LocalDate} and {@link LocalDateTime}.
 *
 * <p>Strings are accepted in ISO-8601 form: {@code yyyy-MM-dd}, {@code yyyy-MM-dd'T'HH:mm[:ss]},
 * {@code yyyy-MM-dd HH:mm[:ss]} and offset or zoned date-times.</p>
 */
public final class TemporalValues {

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private TemporalValues() {}

    /**
     * Converts a value to a date-time.
     *
     * @param value the value to convert
     * @return the local date-time, at start of day for plain dates
     * @throws DateTimeException if the value is not a recognised temporal value
     */
    public static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().atStartOfDay();
        }
        if (value instanceof java.util.Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof CharSequence text) {
            return parse(text.toString().trim());
        }
        throw new DateTimeException("Value '" + value + "' of type "
                + (value == null ? "null" : value.getClass().getSimpleName()) + " is not a date");
    }

    /**
     * Converts a value to a date, dropping any time component.
     *
     * @param value the value to convert
     * @return the local date
     * @throws DateTimeException if the value is not a recognised temporal value
     */
    public static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate ld) {
            return ld;
        }
        return toLocalDateTime(value).toLocalDate();
    }

    private static LocalDateTime parse(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text, LOCAL_DATE_TIME);
        } catch (DateTimeParseException localFailure) {
            try {
                return OffsetDateTime.parse(text).toLocalDateTime();
            } catch (DateTimeParseException offsetFailure) {
                try {
                    return ZonedDateTime.parse(text).toLocalDateTime();
                } catch (DateTimeParseException zonedFailure) {
                    throw new DateTimeException("Value '" + text + "' is not an ISO-8601 date", localFailure);
                }
            }
        }
    }
}
