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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.RuleRegistry;
import org.fireflyframework.sage.metric.Thresholds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates values against range, pattern and categorical checks.
 *
 * <p>Counts are accumulated per column across every check applied to it. The score
 * is the share of valid values over all evaluated values of all checks:</p>
 * <pre>
 *   score = sum(valid) / sum(valid + invalid)
 * </pre>
 *
 * <p>Details are reported per column under {@link MetricResult#DETAILS}.</p>
 */
@Slf4j
public class AccuracyMetric implements Metric {

    public static final String DEFAULT_NAME = "accuracy";
    public static final Thresholds DEFAULT_THRESHOLDS = Thresholds.of(0.9, 0.7);

    private final String name;
    private final Thresholds thresholds;
    private final RuleRegistry<AccuracyCheck> checks;

    public AccuracyMetric() {
        this(DEFAULT_NAME, DEFAULT_THRESHOLDS);
    }

    public AccuracyMetric(double warningThreshold, double failureThreshold) {
        this(DEFAULT_NAME, Thresholds.of(warningThreshold, failureThreshold));
    }

    public AccuracyMetric(String name, Thresholds thresholds) {
        this.name = name;
        this.thresholds = thresholds;
        this.checks = new RuleRegistry<>(name);
        log.debug("Initialized accuracy metric: {}", name);
    }

    /**
     * Adds an inclusive range check on a numeric column.
     *
     * @param column the column to validate
     * @param min    the minimum allowed value, or {@code null}
     * @param max    the maximum allowed value, or {@code null}
     * @throws org.fireflyframework.sage.exception.ConfigurationException if both bounds are
     *         missing, {@code min > max}, or the column already has a range check
     */
    public void addRangeCheck(String column, Number min, Number max) {
        addCheck(new RangeCheck(column, min, max));
    }

    /**
     * Adds a full-match regular expression check.
     *
     * @param column the column to validate
     * @param regex  the pattern values must match
     * @throws org.fireflyframework.sage.exception.ConfigurationException if the pattern does
     *         not compile or the column already has a pattern check
     */
    public void addPatternCheck(String column, String regex) {
        addCheck(new PatternCheck(column, regex));
    }

    /**
     * Adds an allowed-values check.
     *
     * @param column        the column to validate
     * @param allowedValues the allowed values, not empty
     * @throws org.fireflyframework.sage.exception.ConfigurationException if the set is empty
     *         or the column already has a categorical check
     */
    public void addCategoricalCheck(String column, Collection<?> allowedValues) {
        addCheck(new CategoricalCheck(column, allowedValues));
    }

    /**
     * Registers a custom check.
     *
     * @param check the check
     */
    public void addCheck(AccuracyCheck check) {
        checks.register(check.getRuleName(), check);
        log.debug("Added {} check for '{}': {}", check.getRuleName(), check.getColumn(), check.summary());
    }

    public Collection<AccuracyCheck> getChecks() {
        return checks.rules();
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
                    .message("No accuracy checks configured")
                    .detail(MetricResult.DETAILS, Map.of())
                    .build();
        }

        Map<String, List<AccuracyCheck>> checksByColumn = new LinkedHashMap<>();
        for (AccuracyCheck check : checks.rules()) {
            checksByColumn.computeIfAbsent(check.getColumn(), k -> new ArrayList<>()).add(check);
        }

        Map<String, ColumnAccuracy> details = new LinkedHashMap<>();
        long totalValid = 0;
        long totalInvalid = 0;
        for (Map.Entry<String, List<AccuracyCheck>> entry : checksByColumn.entrySet()) {
            ColumnAccuracy columnAccuracy = evaluateColumn(dataset, entry.getKey(), entry.getValue());
            details.put(entry.getKey(), columnAccuracy);
            totalValid += columnAccuracy.getValid();
            totalInvalid += columnAccuracy.getInvalid();
        }

        long evaluated = totalValid + totalInvalid;
        double score = evaluated > 0 ? (double) totalValid / evaluated : 1.0;
        String message = evaluated > 0
                ? String.format(Locale.ROOT, "%d of %d checks failed (%.1f%% accuracy)",
                        totalInvalid, evaluated, score * 100)
                : "No values could be evaluated by " + checks.size() + " accuracy check(s)";

        return MetricResult.builder()
                .score(score)
                .status(thresholds.classify(score))
                .message(message)
                .detail(MetricResult.DETAILS, Collections.unmodifiableMap(details))
                .build();
    }

    private ColumnAccuracy evaluateColumn(TabularDataset dataset, String columnName, List<AccuracyCheck> columnChecks) {
        List<String> summaries = columnChecks.stream().map(AccuracyCheck::summary).toList();
        Optional<Column> column = dataset.findColumn(columnName);
        if (column.isEmpty()) {
            return ColumnAccuracy.builder()
                    .status(MetricStatus.SKIPPED)
                    .message("Column '" + columnName + "' not found in data")
                    .checks(summaries)
                    .build();
        }

        int valid = 0;
        int invalid = 0;
        List<String> messages = new ArrayList<>();
        for (AccuracyCheck check : columnChecks) {
            CheckOutcome outcome = runCheck(check, column.get());
            valid += outcome.valid();
            invalid += outcome.invalid();
            messages.add(outcome.message());
        }

        int evaluated = valid + invalid;
        double accuracy = evaluated > 0 ? (double) valid / evaluated : 1.0;
        return ColumnAccuracy.builder()
                .valid(valid)
                .invalid(invalid)
                .accuracy(accuracy)
                .status(evaluated > 0 ? thresholds.classify(accuracy) : MetricStatus.SKIPPED)
                .message(String.join("; ", messages))
                .checks(summaries)
                .build();
    }

    private CheckOutcome runCheck(AccuracyCheck check, Column column) {
        try {
            return check.evaluate(column);
        } catch (RuntimeException e) {
            log.error("Error in {} check for column '{}': {}", check.getRuleName(), check.getColumn(), e.getMessage(), e);
            return new CheckOutcome(0, column.nonMissingCount(), "Error in " + check.getRuleName() + " check: " + e.getMessage());
        }
    }

    @Override
    public void clear() {
        checks.clear();
        log.debug("Cleared all checks from accuracy metric: {}", name);
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
