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

package org.fireflyframework.sage.grader;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.exception.NoActiveUnitException;
import org.fireflyframework.sage.exception.NotConnectedException;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * State shared by every grader implementation: name, configured metrics, connection
 * flag, active unit and the latest results. Graders hold one instance and delegate
 * to it.
 */
@Slf4j
public class GraderState {

    private final String name;
    private final String type;
    private final MetricRegistry metrics;
    private volatile boolean connected;
    private volatile String activeUnit;
    private volatile GradeReport lastResult;
    private volatile Instant lastRunTime;

    public GraderState(Class<?> graderType, String name) {
        this.type = graderType.getSimpleName();
        this.name = name != null && !name.isBlank() ? name : defaultName(graderType);
        this.metrics = new MetricRegistry(this.name);
        log.debug("Initialized grader: {}", this.name);
    }

    /**
     * Generates a name of the form {@code <Type>_<8 hex digits>}.
     *
     * @param graderType the grader class
     * @return the generated name
     */
    public static String defaultName(Class<?> graderType) {
        return graderType.getSimpleName() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public MetricRegistry getMetrics() {
        return metrics;
    }

    public boolean isConnected() {
        return connected;
    }

    public void markConnected() {
        connected = true;
    }

    /**
     * Drops the connection, active unit and previous results. Metrics are kept.
     */
    public void reset() {
        connected = false;
        activeUnit = null;
        lastResult = null;
        lastRunTime = null;
    }

    public void disconnect() {
        connected = false;
    }

    public void requireConnected() {
        if (!connected) {
            throw new NotConnectedException("No data source connected. Call connect() first.");
        }
    }

    public Optional<String> getActiveUnit() {
        return Optional.ofNullable(activeUnit);
    }

    public void setActiveUnit(String unit) {
        this.activeUnit = unit;
    }

    public String requireActiveUnit() {
        String unit = activeUnit;
        if (unit == null) {
            throw new NoActiveUnitException("No active unit selected. Call setActiveUnit() first.");
        }
        return unit;
    }

    /**
     * Checks the grading preconditions in order: connection, active unit, metrics.
     *
     * @param metricNames the requested metrics, or {@code null} for all of them
     * @return the metrics to run
     */
    public Map<String, Metric> prepare(Collection<String> metricNames) {
        requireConnected();
        requireActiveUnit();
        return metrics.select(metricNames);
    }

    /**
     * Runs the selected metrics over a dataset and records the report as the latest result.
     *
     * @param selected the metrics to run
     * @param dataset  the active unit's data
     * @param metadata metadata carrying the source-specific fields
     * @return the report
     */
    public GradeReport run(Map<String, Metric> selected, TabularDataset dataset,
                           GradeMetadata.GradeMetadataBuilder metadata) {
        Instant start = Instant.now();
        Map<String, MetricResult> results = MetricRunner.runAll(selected, dataset);
        Instant end = Instant.now();
        double duration = Duration.between(start, end).toNanos() / 1_000_000_000.0;

        GradeReport report = GradeReport.builder()
                .metrics(Collections.unmodifiableMap(results))
                .metadata(metadata
                        .unit(activeUnit)
                        .rowCount(dataset.rowCount())
                        .columnCount(dataset.columnCount())
                        .columns(dataset.getColumnNames())
                        .startTime(start)
                        .endTime(end)
                        .durationSeconds(duration)
                        .build())
                .build();
        lastResult = report;
        lastRunTime = end;
        log.info("Grader '{}' completed in {} ms with {} metric(s)",
                name, Duration.between(start, end).toMillis(), results.size());
        return report;
    }

    public Optional<GradeReport> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public Optional<Instant> getLastRunTime() {
        return Optional.ofNullable(lastRunTime);
    }

    public GraderSummary summary() {
        GradeReport report = lastResult;
        GraderSummary.GraderSummaryBuilder summary = GraderSummary.builder()
                .name(name)
                .type(type)
                .connected(connected)
                .metricsConfigured(metrics.size())
                .lastRun(lastRunTime)
                .hasResults(report != null && !report.getMetrics().isEmpty());
        if (report != null && !report.getMetrics().isEmpty()) {
            summary.metricsRun(report.getMetrics().size())
                    .avgScore(report.getMetrics().values().stream()
                            .mapToDouble(MetricResult::getScore)
                            .average()
                            .orElse(0.0));
        }
        return summary.build();
    }

    @Override
    public String toString() {
        return type + "('" + name + "', " + (connected ? "connected" : "disconnected") + ", "
                + metrics.size() + " metrics)";
    }
}
