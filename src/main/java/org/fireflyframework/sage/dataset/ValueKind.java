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

import java.time.temporal.Temporal;
import java.util.Collection;

/**
 * Declared or inferred kind of the values held by a {@link Column}.
 *
 * <ul>
 *   <li>{@link #NUMERIC} - {@link Number} values</li>
 *   <li>{@link #TEXT} - character data, and the fallback for mixed columns</li>
 *   <li>{@link #BOOLEAN} - {@link Boolean} values</li>
 *   <li>{@link #TEMPORAL} - {@code java.time} values and {@link java.util.Date}</li>
 * </ul>
 */
public enum ValueKind {

    NUMERIC,
    TEXT,
    BOOLEAN,
    TEMPORAL;

    /**
     * Returns the kind of a single non-missing value.
     *
     * @param value the value, never {@code null}
     * @return the matching kind, {@link #TEXT} for anything unrecognised
     */
    public static ValueKind of(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Number) {
            return NUMERIC;
        }
        if (value instanceof Temporal || value instanceof java.util.Date) {
            return TEMPORAL;
        }
        return TEXT;
    }

    /**
     * Infers the kind shared by every non-missing value. Columns that mix kinds,
     * or hold no values at all, are treated as {@link #TEXT}.
     *
     * @param values the column values
     * @return the inferred kind
     */
    public static ValueKind infer(Collection<?> values) {
        ValueKind inferred = null;
        for (Object value : values) {
            if (Column.isMissingValue(value)) {
                continue;
            }
            ValueKind kind = of(value);
            if (inferred == null) {
                inferred = kind;
            } else if (inferred != kind) {
                return TEXT;
            }
        }
        return inferred != null ? inferred : TEXT;
    }
}
