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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.event.DataQualityAnalysisEvent;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricRunner;
import org.fireflyframework.sage.metric.Thresholds;
import org.fireflyframework.sage.metric.accuracy.AccuracyMetric;
import org.fireflyframework.sage.metric.completeness.CompletenessMetric;
import org.fireflyframework.sage.metric.consistency.ConsistencyMetric;
import org.fireflyframework.sage.metric.timeliness.TimelinessMetric;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a set of metrics against a dataset and aggregates their results into an
 * {@link AnalysisReport}.
 *
 * <p>Each metric runs in isolation: a metric that throws is reported as a failed
 * result and excluded from the overall score. The overall status is classified
 * against its own thresholds (0.95 / 0.8 by default), which are independent of the
 * thresholds of the individual metrics.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a
 * {@link DataQualityAnalysisEvent} is published after each analysis.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Analyzer analyzer = Analyzer.withDefaultMetrics();
 * analyzer.getMetric("accuracy", AccuracyMetric.class)
 *         .ifPresent(accuracy -> accuracy.addRangeCheck("age", 0, 120));
 * AnalysisReport report = analyzer.analyze(dataset);
 * }</pre>
 */
@Slf4j
public class Analyzer {

    public static final Thresholds DEFAULT_OVERALL_THRESHOLDS = Thresholds.of(0.95, 0.8);

    private final Map<String, Metric> metrics = new LinkedHashMap<>();
    private final Thresholds overallThresholds;
    private final ApplicationEventPublisher eventPublisher;
    private final RecommendationEngine recommendationEngine = new RecommendationEngine();
    private volatile AnalysisReport lastReport;

    /**
     * Creates an analyzer with no metrics, default overall thresholds and no event publishing.
     */
    public Analyzer() {
        this(DEFAULT_OVERALL_THRESHOLDS, null);
    }

    /**
     * Creates an analyzer with no metrics.
     *
     * @param overallThresholds thresholds for the overall status
     * @param eventPublisher    the event publisher, or {@code null} to disable event publishing
     */
    public Analyzer(Thresholds overallThresholds, ApplicationEventPublisher eventPublisher) {
        this.overallThresholds = overallThresholds;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates an analyzer holding completeness, accuracy, consistency and timeliness
     * metrics with their default thresholds.
     *
     * @return the analyzer
     */
    public static Analyzer withDefaultMetrics() {
        Analyzer analyzer = new Analyzer();
        analyzer.addMetric(new CompletenessMetric());
        analyzer.addMetric(new AccuracyMetric());
        analyzer.addMetric(new ConsistencyMetric());
        analyzer.addMetric(new TimelinessMetric());
        return analyzer;
    }

    public void addMetric(Metric metric) {
        addMetric(metric.getName(), metric);
    }

    /**
     * Registers a metric, replacing any metric already registered under the name.
     *
     * @param name   the name results are reported under
     * @param metric the metric
     * @throws ConfigurationException if the name is blank or the metric is {@code null}
     */
    public synchronized void addMetric(String name, Metric metric) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Metric name must not be empty");
        }
        if (metric == null) {
            throw new ConfigurationException("Metric '" + name + "' must not be null");
        }
        if (metrics.put(name, metric) != null) {
            log.info("Replaced metric '{}' with {}", name, metric.getClass().getSimpleName());
        } else {
            log.debug("Added metric '{}': {}", name, metric.getClass().getSimpleName());
        }
    }

    /**
     * Returns a registered metric, typically to configure its rules.
     *
     * @param name the metric name
     * @param type the expected metric type
     * @param <T>  the metric type
     * @return the metric, or empty when no metric of that type is registered under the name
     */
    public synchronized <T extends Metric> Optional<T> getMetric(String name, Class<T> type) {
        Metric metric = metrics.get(name);
        return type.isInstance(metric) ? Optional.of(type.cast(metric)) : Optional.empty();
    }

    public synchronized List<String> getMetricNames() {
        return List.copyOf(metrics.keySet());
    }

    public Thresholds getOverallThresholds() {
        return overallThresholds;
    }

    public AnalysisReport analyze(TabularDataset dataset) {
        return analyze(dataset, null);
    }

    /**
     * Analyzes a dataset with all metrics or a named subset of them.
     *
     * <p>Unknown metric names are logged and skipped. If no metric remains, an
     * {@link AnalysisReport#error(String) error report} is returned.</p>
     *
     * @param dataset     the dataset to analyze
     * @param metricNames the metrics to run in order, or {@code null} for all of them
     * @return the report
     */
    public AnalysisReport analyze(TabularDataset dataset, Collection<String> metricNames) {
        Map<String, Metric> selected = resolve(metricNames);
        AnalysisReport report;
        if (selected.isEmpty()) {
            report = AnalysisReport.error("No metrics configured");
        } else {
            long start = System.nanoTime();
            log.info("Starting data quality analysis with {} metric(s) on {}", selected.size(), dataset);
            report = buildReport(dataset, MetricRunner.runAll(selected, dataset), start);
        }
        record(report);
        return report;
    }

    public Mono<AnalysisReport> analyzeAsync(TabularDataset dataset) {
        return analyzeAsync(dataset, null);
    }

    /**
     * Asynchronous variant of {@link #analyze(TabularDataset, Collection)}.
     *
     * <p>Distinct metrics are evaluated in parallel on the bounded elastic scheduler;
     * results are assembled in the requested order so the report matches the
     * synchronous one.</p>
     *
     * @param dataset     the dataset to analyze
     * @param metricNames the metrics to run in order, or {@code null} for all of them
     * @return a {@link Mono} emitting the report
     */
    public Mono<AnalysisReport> analyzeAsync(TabularDataset dataset, Collection<String> metricNames) {
        return Mono.defer(() -> {
            Map<String, Metric> selected = resolve(metricNames);
            if (selected.isEmpty()) {
                return Mono.just(AnalysisReport.error("No metrics configured"));
            }
            long start = System.nanoTime();
            return Flux.fromIterable(selected.entrySet())
                    .flatMapSequential(entry -> Mono.fromCallable(() ->
                                    Map.entry(entry.getKey(), MetricRunner.run(entry.getKey(), entry.getValue(), dataset)))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .collect(LinkedHashMap<String, MetricResult>::new, (results, entry) -> results.put(entry.getKey(), entry.getValue()))
                    .map(results -> buildReport(dataset, results, start));
        }).doOnNext(this::record);
    }

    /**
     * Returns the report of the most recent analysis.
     *
     * @return the last report, or empty before the first analysis
     */
    public Optional<AnalysisReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    private synchronized Map<String, Metric> resolve(Collection<String> metricNames) {
        if (metricNames == null) {
            return new LinkedHashMap<>(metrics);
        }
        Map<String, Metric> selected = new LinkedHashMap<>();
        for (String name : metricNames) {
            Metric metric = metrics.get(name);
            if (metric == null) {
                log.warn("Unknown metric: {}", name);
            } else {
                selected.put(name, metric);
            }
        }
        return selected;
    }

    private AnalysisReport buildReport(TabularDataset dataset, Map<String, MetricResult> results, long startNanos) {
        double overallScore = MetricRunner.meanValidScore(results);
        List<Recommendation> recommendations = recommendationEngine.recommend(results, dataset);
        double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        log.info("Analysis completed in {} s with overall score: {}", String.format("%.3f", seconds), overallScore);
        return AnalysisReport.builder()
                .overallScore(overallScore)
                .overallStatus(overallThresholds.classify(overallScore))
                .metrics(Collections.unmodifiableMap(results))
                .recommendations(List.copyOf(recommendations))
                .analysisTimeSeconds(seconds)
                .analysisDate(Instant.now())
                .build();
    }

    private void record(AnalysisReport report) {
        lastReport = report;
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new DataQualityAnalysisEvent(report));
        }
    }
}
