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

package org.fireflyframework.sage.metric.accuracy;

import lombok.Getter;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.NumericValues;
import org.fireflyframework.sage.dataset.ValueKind;
import org.fireflyframework.sage.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates that numeric values fall within an inclusive range. Either bound may be
 * omitted, but not both.
 */
@Getter
public class RangeCheck implements AccuracyCheck {

    private final String column;
    private final Number min;
    private final Number max;

    public RangeCheck(String column, Number min, Number max) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Range check requires a column name");
        }
        if (min == null && max == null) {
            throw new ConfigurationException("At least one of min or max must be specified for range check on '"
                    + column + "'");
        }
        if (min != null && max != null && NumericValues.compare(min, max) > 0) {
            throw new ConfigurationException("Range check on '" + column + "' has min " + min
                    + " greater than max " + max);
        }
        this.column = column;
        this.min = min;
        this.max = max;
    }

    @Override
    public CheckOutcome evaluate(Column data) {
        List<Object> values = data.presentValues();
        if (values.isEmpty()) {
            return CheckOutcome.skipped("No non-null values in column '" + column + "'");
        }
        if (data.getKind() != ValueKind.NUMERIC) {
            return new CheckOutcome(0, values.size(),
                    "Column '" + column + "' is not numeric (type: " + data.getKind() + ")");
        }

        int invalid = 0;
        for (Object value : values) {
            if (!(value instanceof Number number)) {
                invalid++;
                continue;
            }
            boolean belowMin = min != null && NumericValues.compare(number, min) < 0;
            boolean aboveMax = max != null && NumericValues.compare(number, max) > 0;
            if (belowMin || aboveMax) {
                invalid++;
            }
        }
        return new CheckOutcome(values.size() - invalid, invalid,
                "Range check (" + bounds() + "): " + invalid + " values outside range");
    }

    @Override
    public String getRuleName() {
        return "range:" + column;
    }

    @Override
    public String summary() {
        return "range (" + bounds() + ")";
    }

    private String bounds() {
        List<String> parts = new ArrayList<>(2);
        if (min != null) {
            parts.add("min: " + min);
        }
        if (max != null) {
            parts.add("max: " + max);
        }
        return String.join(", ", parts);
    }
}
