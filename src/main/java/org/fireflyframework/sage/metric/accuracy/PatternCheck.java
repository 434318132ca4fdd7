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
import org.fireflyframework.sage.exception.ConfigurationException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates that the string form of every value matches a regular expression.
 *
 * <p>The whole value must match ({@link java.util.regex.Matcher#matches()}); a valid
 * prefix followed by extra characters is invalid.</p>
 */
@Getter
public class PatternCheck implements AccuracyCheck {

    private final String column;
    private final Pattern pattern;

    public PatternCheck(String column, String regex) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Pattern check requires a column name");
        }
        if (regex == null || regex.isEmpty()) {
            throw new ConfigurationException("Pattern check on '" + column + "' requires a pattern");
        }
        try {
            this.pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regular expression pattern for '" + column + "': "
                    + e.getDescription(), e);
        }
        this.column = column;
    }

    @Override
    public CheckOutcome evaluate(Column data) {
        List<Object> values = data.presentValues();
        if (values.isEmpty()) {
            return CheckOutcome.skipped("No non-null values in column '" + column + "'");
        }
        int valid = 0;
        for (Object value : values) {
            if (pattern.matcher(String.valueOf(value)).matches()) {
                valid++;
            }
        }
        int invalid = values.size() - valid;
        return new CheckOutcome(valid, invalid,
                "Pattern check (" + pattern.pattern() + "): " + invalid + " values don't match pattern");
    }

    @Override
    public String getRuleName() {
        return "pattern:" + column;
    }

    @Override
    public String summary() {
        return "pattern (" + pattern.pattern() + ")";
    }
}
