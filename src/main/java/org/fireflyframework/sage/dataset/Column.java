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

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of a {@link TabularDataset}. Values are aligned by row
 * index; a cell is missing when it holds {@code null} or a floating point NaN.
 */
@Getter
@EqualsAndHashCode
public final class Column {

    private final String name;
    private final ValueKind kind;
    private final List<Object> values;

    public Column(String name, ValueKind kind, List<?> values) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Creates a column whose kind is inferred from its values.
     *
     * @param name   the column name
     * @param values the values
     * @return the column
     */
    public static Column of(String name, List<?> values) {
        return new Column(name, ValueKind.infer(values), values);
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    public boolean isMissing(int row) {
        return isMissingValue(values.get(row));
    }

    public int missingCount() {
        int missing = 0;
        for (Object value : values) {
            if (isMissingValue(value)) {
                missing++;
            }
        }
        return missing;
    }

    public int nonMissingCount() {
        return values.size() - missingCount();
    }

    /**
     * Returns the non-missing values in row order.
     *
     * @return the present values
     */
    public List<Object> presentValues() {
        List<Object> present = new ArrayList<>();
        for (Object value : values) {
            if (!isMissingValue(value)) {
                present.add(value);
            }
        }
        return present;
    }

    public static boolean isMissingValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    @Override
    public String toString() {
        return "Column(" + name + ", " + kind + ", " + values.size() + " rows)";
    }
}
