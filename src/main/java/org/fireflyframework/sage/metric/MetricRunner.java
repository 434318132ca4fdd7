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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.TabularDataset;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs metrics against a dataset with per-metric failure isolation.
 *
 * <p>A metric that throws is replaced in the output by {@link MetricResult#failure(Throwable)},
 * so one broken rule never aborts an analysis or a grading run. Results are keyed in
 * the iteration order of the supplied map.</p>
 */
@Slf4j
public final class MetricRunner {

    private MetricRunner() {}

    /**
     * Evaluates a single metric, converting any exception into a degraded result.
     *
     * @param name    the name the metric is registered under
     * @param metric  the metric
     * @param dataset the dataset
     * @return the metric's result, or a failed result carrying the error
     */
    public static MetricResult run(String name, Metric metric, TabularDataset dataset) {
        long start = System.nanoTime();
        try {
            log.info("Running metric: {}", name);
            MetricResult result = metric.evaluate(dataset);
            if (result == null) {
                throw new IllegalStateException("Metric '" + name + "' returned no result");
            }
            log.info("Metric '{}' completed in {} ms with score: {}",
                    name, (System.nanoTime() - start) / 1_000_000, result.getScore());
            return result;
        } catch (RuntimeException e) {
            log.error("Error running metric '{}': {}", name, e.getMessage(), e);
            return MetricResult.failure(e);
        }
    }

    /**
     * Evaluates every metric in order.
     *
     * @param metrics the metrics keyed by name
     * @param dataset the dataset
     * @return the results keyed by metric name, in the same order
     */
    public static Map<String, MetricResult> runAll(Map<String, Metric> metrics, TabularDataset dataset) {
        Map<String, MetricResult> results = new LinkedHashMap<>();
        metrics.forEach((name, metric) -> results.put(name, run(name, metric, dataset)));
        return results;
    }

    /**
     * Averages the valid scores of a result set.
     *
     * @param results the results
     * @return the mean of scores from results without an error, 0 when there are none
     */
    public static double meanValidScore(Map<String, MetricResult> results) {
        return results.values().stream()
                .filter(MetricResult::hasValidScore)
                .mapToDouble(MetricResult::getScore)
                .average()
                .orElse(0.0);
    }
}
