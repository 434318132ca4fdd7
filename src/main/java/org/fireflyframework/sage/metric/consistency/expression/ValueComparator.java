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

package org.fireflyframework.sage.metric.consistency.expression;

import org.fireflyframework.sage.dataset.NumericValues;
import org.fireflyframework.sage.dataset.TemporalValues;
import org.fireflyframework.sage.dataset.ValueKind;

import java.time.DateTimeException;
import java.util.Locale;

/**
 * Compares cell values using the native ordering of their kind.
 *
 * <ul>
 *   <li>temporal when either side is a date or date-time; the other side may be
 *       an ISO-8601 string</li>
 *   <li>numeric when both sides are numbers, by exact decimal value</li>
 *   <li>boolean when both sides are booleans</li>
 *   <li>lexical when both sides are text</li>
 * </ul>
 */
public final class ValueComparator {

    private ValueComparator() {}

    /**
     * Orders two non-missing values.
     *
     * @param left  the left value
     * @param right the right value
     * @return a negative, zero or positive integer
     * @throws ConditionEvaluationException if the kinds are incompatible or a text value
     *         is not a valid date
     */
    public static int compare(Object left, Object right) {
        ValueKind kind = commonKind(left, right);
        if (kind == null) {
            throw new ConditionEvaluationException("Cannot compare " + describe(left) + " with " + describe(right));
        }
        switch (kind) {
            case TEMPORAL:
                return toTemporal(left).compareTo(toTemporal(right));
            case NUMERIC:
                return NumericValues.compare((Number) left, (Number) right);
            case BOOLEAN:
                return Boolean.compare((Boolean) left, (Boolean) right);
            default:
                return left.toString().compareTo(right.toString());
        }
    }

    /**
     * Tests two non-missing values for equality. Values of incompatible kinds are
     * never equal.
     *
     * @param left  the left value
     * @param right the right value
     * @return whether the values are equal
     */
    public static boolean isEqual(Object left, Object right) {
        ValueKind kind = commonKind(left, right);
        if (kind == null) {
            return false;
        }
        if (kind == ValueKind.TEMPORAL && !(isDate(left) && isDate(right))) {
            return false;
        }
        return compare(left, right) == 0;
    }

    private static ValueKind commonKind(Object left, Object right) {
        ValueKind leftKind = ValueKind.of(left);
        ValueKind rightKind = ValueKind.of(right);
        if (leftKind == ValueKind.TEMPORAL || rightKind == ValueKind.TEMPORAL) {
            boolean leftOk = leftKind == ValueKind.TEMPORAL || leftKind == ValueKind.TEXT;
            boolean rightOk = rightKind == ValueKind.TEMPORAL || rightKind == ValueKind.TEXT;
            return leftOk && rightOk ? ValueKind.TEMPORAL : null;
        }
        return leftKind == rightKind ? leftKind : null;
    }

    private static boolean isDate(Object value) {
        try {
            TemporalValues.toLocalDateTime(value);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static java.time.LocalDateTime toTemporal(Object value) {
        try {
            return TemporalValues.toLocalDateTime(value);
        } catch (DateTimeException e) {
            throw new ConditionEvaluationException("Cannot compare " + describe(value) + " as a date", e);
        }
    }

    private static String describe(Object value) {
        return ValueKind.of(value).name().toLowerCase(Locale.ROOT) + " value '" + value + "'";
    }
}
