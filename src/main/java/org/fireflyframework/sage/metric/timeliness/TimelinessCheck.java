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

package org.fireflyframework.sage.metric.timeliness;

import lombok.Getter;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TemporalValues;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.Thresholds;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Maximum-age check on one temporal column.
 */
@Getter
public class TimelinessCheck {

    private final TimelinessCheckType type;
    private final String column;
    private final int maxAgeDays;
    private final int warningAgeDays;

    /**
     * @param type           age or freshness
     * @param column         the date column
     * @param maxAgeDays     values older than this many days are untimely, must be positive
     * @param warningAgeDays values older than this are reported as aging, defaults to
     *                       half of {@code maxAgeDays}
     * @throws ConfigurationException on a blank column or invalid ages
     */
    public TimelinessCheck(TimelinessCheckType type, String column, int maxAgeDays, Integer warningAgeDays) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Timeliness check requires a column name");
        }
        if (maxAgeDays <= 0) {
            throw new ConfigurationException("maxAgeDays must be a positive integer, got " + maxAgeDays);
        }
        int warning = warningAgeDays != null ? warningAgeDays : maxAgeDays / 2;
        if (warning < 0 || warning > maxAgeDays) {
            throw new ConfigurationException("warningAgeDays must be within [0, " + maxAgeDays + "], got " + warning);
        }
        this.type = type;
        this.column = column;
        this.maxAgeDays = maxAgeDays;
        this.warningAgeDays = warning;
    }

    public String getRuleName() {
        return type.getValue() + ":" + column;
    }

    /**
     * Evaluates the check against a column.
     *
     * @param data          the column, or {@code null} when the dataset does not have it
     * @param referenceDate the date ages are measured from
     * @param thresholds    the metric thresholds used to classify the score
     * @return the column result
     */
    public ColumnTimeliness evaluate(Column data, LocalDate referenceDate, Thresholds thresholds) {
        ColumnTimeliness.ColumnTimelinessBuilder result = ColumnTimeliness.builder()
                .checkType(type)
                .maxAgeDays(maxAgeDays)
                .warningAgeDays(warningAgeDays);
        if (data == null) {
            return result.timelinessScore(0.0)
                    .status(MetricStatus.FAILED)
                    .message("Column '" + column + "' not found in data")
                    .build();
        }
        List<Object> values = data.presentValues();
        if (values.isEmpty()) {
            return result.timelinessScore(1.0)
                    .status(MetricStatus.PASSED)
                    .message("No non-null values in column '" + column + "'")
                    .build();
        }

        List<LocalDate> dates = new ArrayList<>(values.size());
        for (Object value : values) {
            try {
                dates.add(TemporalValues.toLocalDate(value));
            } catch (DateTimeException e) {
                return result.untimely(values.size())
                        .timelinessScore(0.0)
                        .status(MetricStatus.FAILED)
                        .message("Could not convert '" + column + "' to a date: " + e.getMessage())
                        .build();
            }
        }

        int timely = 0;
        int aging = 0;
        for (LocalDate date : dates) {
            long ageDays = ChronoUnit.DAYS.between(date, referenceDate);
            if (ageDays <= maxAgeDays) {
                timely++;
                if (ageDays > warningAgeDays) {
                    aging++;
                }
            }
        }
        int untimely = dates.size() - timely;
        double score = (double) timely / dates.size();
        return result.timely(timely)
                .untimely(untimely)
                .aging(aging)
                .timelinessScore(score)
                .status(thresholds.classify(score))
                .message(type.getLabel() + ": " + untimely + " of " + dates.size()
                        + " values exceed max age of " + maxAgeDays + " days")
                .build();
    }
}
