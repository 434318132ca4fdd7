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

package org.fireflyframework.sage.metric;

import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.exception.MetricEvaluationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MetricRunner}.
 */
@ExtendWith(MockitoExtension.class)
class MetricRunnerTest {

    @Mock
    private Metric healthy;

    @Mock
    private Metric broken;

    private final TabularDataset dataset = TabularDataset.builder().column("id", 1, 2).build();

    @Test
    void runAll_metricThrows_shouldIsolateFailureAndKeepOrder() {
        // Given
        when(healthy.evaluate(any())).thenReturn(MetricResult.builder()
                .score(0.8).status(MetricStatus.WARNING).message("ok").build());
        when(broken.evaluate(any())).thenThrow(new MetricEvaluationException("boom"));
        Map<String, Metric> metrics = new LinkedHashMap<>();
        metrics.put("broken", broken);
        metrics.put("healthy", healthy);

        // When
        Map<String, MetricResult> results = MetricRunner.runAll(metrics, dataset);

        // Then
        assertThat(results).containsOnlyKeys("broken", "healthy");
        assertThat(results.keySet()).containsExactly("broken", "healthy");
        MetricResult failed = results.get("broken");
        assertThat(failed.getScore()).isZero();
        assertThat(failed.getStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("boom");
        assertThat(failed.hasValidScore()).isFalse();
        assertThat(MetricRunner.meanValidScore(results)).isEqualTo(0.8);
    }

    @Test
    void run_metricReturnsNull_shouldReportFailure() {
        // Given
        when(healthy.evaluate(any())).thenReturn(null);

        // When
        MetricResult result = MetricRunner.run("empty", healthy, dataset);

        // Then
        assertThat(result.getStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(result.getError()).contains("returned no result");
    }
}
