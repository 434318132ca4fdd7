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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.RuleRegistry;
import org.fireflyframework.sage.metric.Thresholds;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Measures how current the values of date columns are relative to a reference date.
 *
 * <p>When a column has both an age and a freshness check the lower-scoring result is
 * reported, the age check on ties. The score is the mean of the per-column scores.</p>
 */
@Slf4j
public class TimelinessMetric implements Metric {

    public static final String DEFAULT_NAME = "timeliness";
    public static final Thresholds DEFAULT_THRESHOLDS = Thresholds.of(0.9, 0.7);

    private final String name;
    private final Thresholds thresholds;
    private final LocalDate referenceDate;
    private final RuleRegistry<TimelinessCheck> checks;

    public TimelinessMetric() {
        this(DEFAULT_NAME, DEFAULT_THRESHOLDS, LocalDate.now());
    }

    public TimelinessMetric(LocalDate referenceDate) {
        this(DEFAULT_NAME, DEFAULT_THRESHOLDS, referenceDate);
    }

    public TimelinessMetric(double warningThreshold, double failureThreshold, LocalDate referenceDate) {
        this(DEFAULT_NAME, Thresholds.of(warningThreshold, failureThreshold), referenceDate);
    }

    public TimelinessMetric(String name, Thresholds thresholds, LocalDate referenceDate) {
        this.name = name;
        this.thresholds = thresholds;
        this.referenceDate = referenceDate != null ? referenceDate : LocalDate.now();
        this.checks = new RuleRegistry<>(name);
        log.debug("Initialized timeliness metric: {} with reference date {}", name, this.referenceDate);
    }

    public void addAgeCheck(String column, int maxAgeDays) {
        addAgeCheck(column, maxAgeDays, null);
    }

    /**
     * Adds an age check for a creation-date column.
     *
     * @param column         the date column
     * @param maxAgeDays     maximum allowed age in days
     * @param warningAgeDays age at which values are reported as aging, {@code null} for half the maximum
     * @throws org.fireflyframework.sage.exception.ConfigurationException on invalid ages or
     *         when the column already has an age check
     */
    public void addAgeCheck(String column, int maxAgeDays, Integer warningAgeDays) {
        addCheck(new TimelinessCheck(TimelinessCheckType.AGE, column, maxAgeDays, warningAgeDays));
    }

    public void addFreshnessCheck(String column, int maxAgeDays) {
        addFreshnessCheck(column, maxAgeDays, null);
    }

    /**
     * Adds a freshness check for a last-update column.
     *
     * @param column         the date column
     * @param maxAgeDays     maximum allowed age in days
     * @param warningAgeDays age at which values are reported as aging, {@code null} for half the maximum
     * @throws org.fireflyframework.sage.exception.ConfigurationException on invalid ages or
     *         when the column already has a freshness check
     */
    public void addFreshnessCheck(String column, int maxAgeDays, Integer warningAgeDays) {
        addCheck(new TimelinessCheck(TimelinessCheckType.FRESHNESS, column, maxAgeDays, warningAgeDays));
    }

    private void addCheck(TimelinessCheck check) {
        checks.register(check.getRuleName(), check);
        log.debug("Added {} check for '{}': max {} days, warning at {} days", check.getType().getValue(),
                check.getColumn(), check.getMaxAgeDays(), check.getWarningAgeDays());
    }

    public Collection<TimelinessCheck> getChecks() {
        return checks.rules();
    }

    public LocalDate getReferenceDate() {
        return referenceDate;
    }

    @Override
    public MetricResult evaluate(TabularDataset dataset) {
        checks.seal();
        if (dataset == null || dataset.isEmpty()) {
            return MetricResult.noData(MetricResult.DETAILS);
        }
        if (checks.isEmpty()) {
            return MetricResult.builder()
                    .score(1.0)
                    .status(MetricStatus.PASSED)
                    .message("No timeliness checks configured")
                    .detail(MetricResult.DETAILS, Map.of())
                    .build();
        }

        Map<String, ColumnTimeliness> details = new LinkedHashMap<>();
        for (TimelinessCheck check : checks.rules()) {
            ColumnTimeliness result = check.evaluate(
                    dataset.findColumn(check.getColumn()).orElse(null), referenceDate, thresholds);
            details.merge(check.getColumn(), result, TimelinessMetric::stricter);
        }

        double score = details.values().stream()
                .mapToDouble(ColumnTimeliness::getTimelinessScore)
                .average()
                .orElse(1.0);
        long untimely = details.values().stream().mapToLong(ColumnTimeliness::getUntimely).sum();
        long checked = details.values().stream().mapToLong(ColumnTimeliness::getEvaluated).sum();
        String message = checked > 0
                ? String.format(Locale.ROOT, "%d of %d timeliness checks failed (%.1f%% timely)",
                        untimely, checked, score * 100)
                : "No applicable data for timeliness checks";

        return MetricResult.builder()
                .score(score)
                .status(thresholds.classify(score))
                .message(message)
                .detail(MetricResult.DETAILS, Collections.unmodifiableMap(details))
                .build();
    }

    private static ColumnTimeliness stricter(ColumnTimeliness existing, ColumnTimeliness candidate) {
        if (candidate.getTimelinessScore() < existing.getTimelinessScore()) {
            return candidate;
        }
        if (candidate.getTimelinessScore() == existing.getTimelinessScore()
                && candidate.getCheckType() == TimelinessCheckType.AGE) {
            return candidate;
        }
        return existing;
    }

    @Override
    public void clear() {
        checks.clear();
        log.debug("Cleared all checks from timeliness metric: {}", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Thresholds getThresholds() {
        return thresholds;
    }
}
