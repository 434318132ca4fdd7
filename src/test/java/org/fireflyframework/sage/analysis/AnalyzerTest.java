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
import org.fireflyframework.sage.event.DataQualityAnalysisEvent;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.exception.MetricEvaluationException;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.Thresholds;
import org.fireflyframework.sage.metric.accuracy.AccuracyMetric;
import org.fireflyframework.sage.metric.completeness.CompletenessMetric;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link Analyzer}.
 */
@ExtendWith(MockitoExtension.class)
class AnalyzerTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private static TabularDataset missingData() {
        return TabularDataset.builder()
                .column("id", 1, 2, 3, 4, 5)
                .column("name", Arrays.asList("Alice", null, "Charlie", null, "Eve"))
                .column("value", Arrays.asList(10.5, 20.1, null, 40.2, null))
                .build();
    }

    @Test
    void analyze_failingMetric_shouldBeIsolatedAndExcludedFromScore() {
        // Given
        Metric broken = mock(Metric.class);
        when(broken.evaluate(any())).thenThrow(new MetricEvaluationException("boom"));
        Analyzer analyzer = new Analyzer();
        analyzer.addMetric(new CompletenessMetric());
        analyzer.addMetric("broken", broken);

        // When
        AnalysisReport report = analyzer.analyze(missingData());

        // Then
        assertThat(report.hasError()).isFalse();
        assertThat(report.getMetrics().keySet()).containsExactly("completeness", "broken");
        assertThat(report.getMetrics().get("broken").getError()).isEqualTo("boom");
        assertThat(report.getMetrics().get("broken").getStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(report.getOverallScore()).isCloseTo(11.0 / 15.0, within(1e-9));
        assertThat(report.getOverallStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(report.getAnalysisDate()).isNotNull();
        assertThat(report.getAnalysisTimeSeconds()).isGreaterThanOrEqualTo(0.0);
        assertThat(analyzer.getLastReport()).containsSame(report);
    }

    @Test
    void analyze_degradedCompleteness_shouldRecommendWorstColumns() {
        // Given
        Analyzer analyzer = new Analyzer();
        analyzer.addMetric(new CompletenessMetric());

        // When
        AnalysisReport report = analyzer.analyze(missingData());

        // Then
        assertThat(report.getRecommendations()).singleElement().satisfies(recommendation -> {
            assertThat(recommendation.getTitle()).isEqualTo("Improve Data Completeness");
            assertThat(recommendation.getPriority()).isEqualTo(RecommendationPriority.MEDIUM);
            assertThat(recommendation.getAffectedColumns()).containsExactly("name", "value");
            assertThat(recommendation.getAffectedMetrics()).containsExactly("completeness");
        });
    }

    @Test
    void analyze_healthyData_shouldPassWithOverallThresholds() {
        // Given
        Analyzer analyzer = new Analyzer(Thresholds.of(0.99, 0.9), null);
        analyzer.addMetric(new CompletenessMetric());
        TabularDataset complete = TabularDataset.builder().column("id", 1, 2, 3).build();

        // When
        AnalysisReport report = analyzer.analyze(complete);

        // Then
        assertThat(report.getOverallScore()).isEqualTo(1.0);
        assertThat(report.getOverallStatus()).isEqualTo(MetricStatus.PASSED);
        assertThat(report.getRecommendations()).extracting(Recommendation::getTitle)
                .containsExactly("Review Data Quality Issues");
    }

    @Test
    void analyze_subsetWithUnknownName_shouldSkipUnknownMetric() {
        // Given
        Analyzer analyzer = Analyzer.withDefaultMetrics();

        // When
        AnalysisReport report = analyzer.analyze(missingData(), List.of("accuracy", "nonexistent", "completeness"));

        // Then
        assertThat(report.getMetrics().keySet()).containsExactly("accuracy", "completeness");
    }

    @Test
    void analyze_noMatchingMetrics_shouldReturnErrorReport() {
        // Given
        Analyzer analyzer = new Analyzer();

        // When
        AnalysisReport report = analyzer.analyze(missingData());

        // Then
        assertThat(report.hasError()).isTrue();
        assertThat(report.getError()).isEqualTo("No metrics configured");
        assertThat(report.getOverallScore()).isZero();
        assertThat(report.getOverallStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(report.getMetrics()).isEmpty();
    }

    @Test
    void analyzeAsync_shouldMatchSynchronousResultsAndPublishEvent() {
        // Given
        Analyzer analyzer = new Analyzer(Analyzer.DEFAULT_OVERALL_THRESHOLDS, eventPublisher);
        analyzer.addMetric(new CompletenessMetric());
        AccuracyMetric accuracy = new AccuracyMetric();
        accuracy.addRangeCheck("value", 0, 30);
        analyzer.addMetric(accuracy);

        // When & Then
        StepVerifier.create(analyzer.analyzeAsync(missingData()))
                .assertNext(report -> {
                    assertThat(report.getMetrics().keySet()).containsExactly("completeness", "accuracy");
                    MetricResult accuracyResult = report.getMetrics().get("accuracy");
                    assertThat(accuracyResult.getScore()).isCloseTo(2.0 / 3.0, within(1e-9));
                    assertThat(report.getOverallScore()).isCloseTo((11.0 / 15.0 + 2.0 / 3.0) / 2, within(1e-9));
                })
                .verifyComplete();

        ArgumentCaptor<DataQualityAnalysisEvent> captor = ArgumentCaptor.forClass(DataQualityAnalysisEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        DataQualityAnalysisEvent event = captor.getValue();
        assertThat(event.getReport()).isSameAs(analyzer.getLastReport().orElseThrow());
        assertThat(event.getTimestamp()).isNotNull();
    }

    @Test
    void analyzeAsync_noMetrics_shouldEmitErrorReport() {
        // Given
        Analyzer analyzer = new Analyzer();

        // When & Then
        StepVerifier.create(analyzer.analyzeAsync(missingData(), List.of("missing")))
                .assertNext(report -> assertThat(report.getError()).isEqualTo("No metrics configured"))
                .verifyComplete();
    }

    @Test
    void addMetric_existingName_shouldReplaceMetric() {
        // Given
        Analyzer analyzer = Analyzer.withDefaultMetrics();
        CompletenessMetric strict = new CompletenessMetric(0.99, 0.95);

        // When
        analyzer.addMetric(strict);

        // Then
        assertThat(analyzer.getMetricNames())
                .containsExactly("completeness", "accuracy", "consistency", "timeliness");
        assertThat(analyzer.getMetric("completeness", CompletenessMetric.class)).containsSame(strict);
        assertThat(analyzer.getMetric("completeness", AccuracyMetric.class)).isEmpty();
    }

    @Test
    void addMetric_invalidArguments_shouldThrow() {
        // Given
        Analyzer analyzer = new Analyzer();

        // When & Then
        assertThatThrownBy(() -> analyzer.addMetric(" ", new CompletenessMetric()))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> analyzer.addMetric("completeness", null))
                .isInstanceOf(ConfigurationException.class);
    }
}
