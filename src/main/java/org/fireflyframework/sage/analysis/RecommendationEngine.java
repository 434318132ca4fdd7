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

package org.fireflyframework.sage.analysis;

import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.accuracy.AccuracyMetric;
import org.fireflyframework.sage.metric.accuracy.ColumnAccuracy;
import org.fireflyframework.sage.metric.completeness.ColumnCompleteness;
import org.fireflyframework.sage.metric.completeness.CompletenessMetric;
import org.fireflyframework.sage.metric.consistency.ConsistencyMetric;
import org.fireflyframework.sage.metric.consistency.RuleOutcome;
import org.fireflyframework.sage.metric.timeliness.ColumnTimeliness;
import org.fireflyframework.sage.metric.timeliness.TimelinessMetric;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives ranked {@link Recommendation}s from the results of an analysis.
 *
 * <p>Results are looked up under the default metric names. Only degraded metrics
 * (warning or failed) produce metric-specific recommendations; duplicate rows are
 * checked on the dataset itself. When nothing specific applies a single generic
 * recommendation is returned, so the list is never empty.</p>
 */
public class RecommendationEngine {

    private static final int MAX_COLUMNS = 3;

    /**
     * Builds the recommendations, high priority first and stable within a priority.
     *
     * @param results the metric results keyed by metric name
     * @param dataset the analyzed dataset
     * @return the recommendations, never empty
     */
    public List<Recommendation> recommend(Map<String, MetricResult> results, TabularDataset dataset) {
        List<Recommendation> recommendations = new ArrayList<>();
        completeness(results.get(CompletenessMetric.DEFAULT_NAME), recommendations);
        consistency(results.get(ConsistencyMetric.DEFAULT_NAME), recommendations);
        accuracy(results.get(AccuracyMetric.DEFAULT_NAME), recommendations);
        timeliness(results.get(TimelinessMetric.DEFAULT_NAME), recommendations);
        duplicates(dataset, recommendations);

        if (recommendations.isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .title("Review Data Quality Issues")
                    .priority(RecommendationPriority.MEDIUM)
                    .description("Review the detailed metrics results to identify specific areas for improvement.")
                    .step("Focus on metrics with lower scores")
                    .step("Create a data quality improvement plan")
                    .step("Implement automated validation and monitoring")
                    .build());
        }
        recommendations.sort(Comparator.comparing(Recommendation::getPriority));
        return recommendations;
    }

    private void completeness(MetricResult result, List<Recommendation> out) {
        if (!isDegraded(result)) {
            return;
        }
        List<String> worst = entries(result, MetricResult.COLUMNS, ColumnCompleteness.class).entrySet().stream()
                .filter(e -> e.getValue().getStatus() != null && e.getValue().getStatus().isDegraded())
                .sorted(Comparator.comparingDouble(e -> e.getValue().getCompleteness()))
                .limit(MAX_COLUMNS)
                .map(Map.Entry::getKey)
                .toList();
        if (worst.isEmpty()) {
            return;
        }
        out.add(Recommendation.builder()
                .title("Improve Data Completeness")
                .priority(priorityFor(result))
                .description("Address missing values in columns: " + String.join(", ", worst))
                .affectedMetric(CompletenessMetric.DEFAULT_NAME)
                .affectedColumns(worst)
                .step("Identify the root cause of missing data")
                .step("Implement validation in data entry systems")
                .step("Consider backfilling missing historical data where possible")
                .build());
    }

    private void consistency(MetricResult result, List<Recommendation> out) {
        if (!isDegraded(result)) {
            return;
        }
        List<String> violated = entries(result, MetricResult.RULES, RuleOutcome.class).entrySet().stream()
                .filter(e -> e.getValue().getInconsistentRows() > 0)
                .map(Map.Entry::getKey)
                .toList();
        if (violated.isEmpty()) {
            return;
        }
        out.add(Recommendation.builder()
                .title("Enforce Data Relationships")
                .priority(priorityFor(result))
                .description("Some relationships between columns are inconsistent ("
                        + String.join(", ", violated) + "). Ensure proper constraints are enforced.")
                .affectedMetric(ConsistencyMetric.DEFAULT_NAME)
                .step("Review relationship violations")
                .step("Add validation rules to prevent inconsistencies")
                .step("Fix existing inconsistent data")
                .build());
    }

    private void accuracy(MetricResult result, List<Recommendation> out) {
        if (!isDegraded(result)) {
            return;
        }
        List<String> columns = entries(result, MetricResult.DETAILS, ColumnAccuracy.class).entrySet().stream()
                .filter(e -> e.getValue().getStatus() != null && e.getValue().getStatus().isDegraded())
                .limit(MAX_COLUMNS)
                .map(Map.Entry::getKey)
                .toList();
        if (columns.isEmpty()) {
            return;
        }
        out.add(Recommendation.builder()
                .title("Fix Data Accuracy Issues")
                .priority(priorityFor(result))
                .description("Address accuracy problems in columns: " + String.join(", ", columns))
                .affectedMetric(AccuracyMetric.DEFAULT_NAME)
                .affectedColumns(columns)
                .step("Review invalid data values")
                .step("Implement stronger validation rules")
                .step("Consider standardizing data formats")
                .build());
    }

    private void timeliness(MetricResult result, List<Recommendation> out) {
        if (!isDegraded(result)) {
            return;
        }
        List<String> columns = entries(result, MetricResult.DETAILS, ColumnTimeliness.class).entrySet().stream()
                .filter(e -> e.getValue().getStatus() != null && e.getValue().getStatus().isDegraded())
                .limit(MAX_COLUMNS)
                .map(Map.Entry::getKey)
                .toList();
        if (columns.isEmpty()) {
            return;
        }
        out.add(Recommendation.builder()
                .title("Refresh Stale Data")
                .priority(priorityFor(result))
                .description("Values older than the allowed age were found in columns: " + String.join(", ", columns))
                .affectedMetric(TimelinessMetric.DEFAULT_NAME)
                .affectedColumns(columns)
                .step("Identify sources that are no longer updated")
                .step("Schedule regular refreshes of stale records")
                .step("Monitor data age against freshness targets")
                .build());
    }

    private void duplicates(TabularDataset dataset, List<Recommendation> out) {
        if (dataset == null || dataset.isEmpty()) {
            return;
        }
        int duplicates = dataset.duplicateRowCount();
        if (duplicates == 0) {
            return;
        }
        double ratio = (double) duplicates / dataset.rowCount();
        RecommendationPriority priority = ratio > 0.05 ? RecommendationPriority.HIGH
                : ratio > 0.01 ? RecommendationPriority.MEDIUM
                : RecommendationPriority.LOW;
        out.add(Recommendation.builder()
                .title("Remove Duplicate Records")
                .priority(priority)
                .description(String.format(Locale.ROOT, "Found %d duplicate rows (%.1f%% of data)",
                        duplicates, ratio * 100))
                .affectedMetric(ConsistencyMetric.DEFAULT_NAME)
                .step("Implement unique constraints")
                .step("Review and remove duplicates")
                .step("Add validation to prevent duplicate creation")
                .build());
    }

    private static boolean isDegraded(MetricResult result) {
        return result != null && result.getStatus() != null && result.getStatus().isDegraded();
    }

    private static RecommendationPriority priorityFor(MetricResult result) {
        return result.getStatus() == MetricStatus.FAILED ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM;
    }

    // custom metrics registered under a default name may report other detail types
    private static <T> Map<String, T> entries(MetricResult result, String section, Class<T> type) {
        Map<String, T> entries = new LinkedHashMap<>();
        if (result.getDetails() != null && result.getDetails().get(section) instanceof Map<?, ?> raw) {
            raw.forEach((key, value) -> {
                if (type.isInstance(value)) {
                    entries.put(String.valueOf(key), type.cast(value));
                }
            });
        }
        return entries;
    }
}
