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
import org.fireflyframework.sage.metric.completeness.ColumnCompleteness;
import org.fireflyframework.sage.metric.consistency.RuleOutcome;
import org.fireflyframework.sage.metric.timeliness.ColumnTimeliness;
import org.fireflyframework.sage.metric.timeliness.TimelinessCheckType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RecommendationEngine}.
 */
class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    private static ColumnCompleteness column(double completeness, MetricStatus status) {
        return ColumnCompleteness.builder().completeness(completeness).status(status).build();
    }

    private static MetricResult result(MetricStatus status, String section, Map<String, ?> entries) {
        return MetricResult.builder()
                .score(status == MetricStatus.PASSED ? 1.0 : 0.5)
                .status(status)
                .detail(section, entries)
                .build();
    }

    private static TabularDataset ids(int rows, int duplicates) {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < rows - duplicates; i++) {
            values.add(i);
        }
        for (int i = 0; i < duplicates; i++) {
            values.add(i);
        }
        return TabularDataset.builder().column("id", values).build();
    }

    @Test
    void recommend_degradedMetrics_shouldRankByPriorityKeepingOrder() {
        // Given
        Map<String, ColumnCompleteness> columns = new LinkedHashMap<>();
        columns.put("a", column(0.5, MetricStatus.FAILED));
        columns.put("b", column(0.75, MetricStatus.WARNING));
        columns.put("c", column(1.0, MetricStatus.PASSED));
        columns.put("d", column(0.6, MetricStatus.FAILED));
        columns.put("e", column(0.8, MetricStatus.WARNING));

        Map<String, RuleOutcome> rules = new LinkedHashMap<>();
        rules.put("date_order", RuleOutcome.builder().inconsistentRows(2).consistentRows(3).build());
        rules.put("adult_flag", RuleOutcome.builder().inconsistentRows(0).consistentRows(5).build());

        Map<String, ColumnTimeliness> timeliness = Map.of("created_at", ColumnTimeliness.builder()
                .checkType(TimelinessCheckType.AGE).timelinessScore(0.2).status(MetricStatus.FAILED).build());

        Map<String, MetricResult> results = new LinkedHashMap<>();
        results.put("completeness", result(MetricStatus.WARNING, MetricResult.COLUMNS, columns));
        results.put("consistency", result(MetricStatus.FAILED, MetricResult.RULES, rules));
        results.put("accuracy", result(MetricStatus.PASSED, MetricResult.DETAILS, Map.of()));
        results.put("timeliness", result(MetricStatus.FAILED, MetricResult.DETAILS, timeliness));

        // When
        List<Recommendation> recommendations = engine.recommend(results, ids(4, 1));

        // Then
        assertThat(recommendations).extracting(Recommendation::getTitle).containsExactly(
                "Enforce Data Relationships",
                "Refresh Stale Data",
                "Remove Duplicate Records",
                "Improve Data Completeness");
        assertThat(recommendations.get(0).getDescription()).isEqualTo(
                "Some relationships between columns are inconsistent (date_order). Ensure proper constraints are enforced.");
        assertThat(recommendations.get(1).getAffectedColumns()).containsExactly("created_at");
        assertThat(recommendations.get(2).getDescription()).isEqualTo("Found 1 duplicate rows (25.0% of data)");
        assertThat(recommendations.get(3).getPriority()).isEqualTo(RecommendationPriority.MEDIUM);
        assertThat(recommendations.get(3).getAffectedColumns()).containsExactly("a", "d", "b");
        assertThat(recommendations.get(3).getSteps()).hasSize(3);
    }

    @Test
    void recommend_duplicateShare_shouldSetPriority() {
        assertThat(engine.recommend(Map.of(), ids(50, 1)))
                .extracting(Recommendation::getPriority).containsExactly(RecommendationPriority.MEDIUM);
        assertThat(engine.recommend(Map.of(), ids(200, 1)))
                .extracting(Recommendation::getPriority).containsExactly(RecommendationPriority.LOW);
    }

    @Test
    void recommend_nothingDegraded_shouldReturnGenericRecommendation() {
        // Given
        Map<String, MetricResult> results = Map.of(
                "completeness", result(MetricStatus.PASSED, MetricResult.COLUMNS, Map.of()));

        // When
        List<Recommendation> recommendations = engine.recommend(results, ids(3, 0));

        // Then
        assertThat(recommendations).singleElement().satisfies(recommendation -> {
            assertThat(recommendation.getTitle()).isEqualTo("Review Data Quality Issues");
            assertThat(recommendation.getPriority()).isEqualTo(RecommendationPriority.MEDIUM);
        });
    }

    @Test
    void recommend_unexpectedDetailTypes_shouldBeIgnored() {
        // Given
        Map<String, MetricResult> results = Map.of(
                "completeness", result(MetricStatus.FAILED, MetricResult.COLUMNS, Map.of("a", "not a column")),
                "accuracy", MetricResult.failure(new IllegalStateException("boom")));

        // When
        List<Recommendation> recommendations = engine.recommend(results, null);

        // Then
        assertThat(recommendations).extracting(Recommendation::getTitle)
                .containsExactly("Review Data Quality Issues");
    }
}
