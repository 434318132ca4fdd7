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
import org.fireflyframework.sage.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates that every value belongs to a fixed set of allowed values. Numbers match
 * by value, so {@code 1} and {@code 1.0} are the same category.
 */
@Getter
public class CategoricalCheck implements AccuracyCheck {

    private static final int PREVIEW_SIZE = 5;

    private final String column;
    private final Set<Object> allowedValues;
    private final Set<Object> normalizedAllowed;

    public CategoricalCheck(String column, Collection<?> allowedValues) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Categorical check requires a column name");
        }
        if (allowedValues == null || allowedValues.isEmpty()) {
            throw new ConfigurationException("Allowed values for '" + column + "' cannot be empty");
        }
        if (allowedValues.stream().anyMatch(Objects::isNull)) {
            throw new ConfigurationException("Allowed values for '" + column + "' cannot contain null");
        }
        this.column = column;
        this.allowedValues = Collections.unmodifiableSet(new LinkedHashSet<>(allowedValues));
        this.normalizedAllowed = allowedValues.stream()
                .map(CategoricalCheck::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public CheckOutcome evaluate(Column data) {
        List<Object> values = data.presentValues();
        if (values.isEmpty()) {
            return CheckOutcome.skipped("No non-null values in column '" + column + "'");
        }
        int valid = 0;
        for (Object value : values) {
            if (normalizedAllowed.contains(normalize(value))) {
                valid++;
            }
        }
        int invalid = values.size() - valid;
        return new CheckOutcome(valid, invalid,
                "Categorical check: " + invalid + " values not in allowed set " + preview());
    }

    @Override
    public String getRuleName() {
        return "categorical:" + column;
    }

    @Override
    public String summary() {
        return "allowed values " + preview();
    }

    private String preview() {
        String shown = allowedValues.stream()
                .limit(PREVIEW_SIZE)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        return allowedValues.size() > PREVIEW_SIZE ? "[" + shown + ", ...]" : "[" + shown + "]";
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
            return NumericValues.normalize(number);
        }
        return value;
    }
}
