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
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.exception.NoMetricsConfiguredException;
import org.fireflyframework.sage.metric.Metric;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named metrics configured on a grader, in registration order.
 */
@Slf4j
public class MetricRegistry {

    private final String owner;
    private final Map<String, Metric> metrics = new LinkedHashMap<>();

    public MetricRegistry(String owner) {
        this.owner = owner;
    }

    public synchronized void add(String name, Metric metric) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Metric name must not be empty");
        }
        if (metric == null) {
            throw new ConfigurationException("Metric '" + name + "' must not be null");
        }
        if (metrics.containsKey(name)) {
            throw new ConfigurationException("A metric named '" + name + "' already exists in grader '" + owner + "'");
        }
        metrics.put(name, metric);
        log.debug("Added metric '{}' to grader '{}'", name, owner);
    }

    public synchronized void remove(String name) {
        if (metrics.remove(name) == null) {
            throw new ConfigurationException("No metric named '" + name + "' exists in grader '" + owner + "'");
        }
        log.debug("Removed metric '{}' from grader '{}'", name, owner);
    }

    public synchronized List<String> names() {
        return List.copyOf(metrics.keySet());
    }

    public synchronized int size() {
        return metrics.size();
    }

    /**
     * Resolves the metrics to run.
     *
     * @param names the requested names in order, or {@code null} for every metric
     * @return the selected metrics keyed by name
     * @throws NoMetricsConfiguredException if the registry is empty or none of the names exist
     */
    public synchronized Map<String, Metric> select(Collection<String> names) {
        if (metrics.isEmpty()) {
            throw new NoMetricsConfiguredException("No metrics configured. Add metrics before grading.");
        }
        if (names == null) {
            return new LinkedHashMap<>(metrics);
        }
        Map<String, Metric> selected = new LinkedHashMap<>();
        for (String name : names) {
            Metric metric = metrics.get(name);
            if (metric == null) {
                log.warn("Metric '{}' not found in grader '{}'", name, owner);
            } else {
                selected.put(name, metric);
            }
        }
        if (selected.isEmpty()) {
            throw new NoMetricsConfiguredException("None of the specified metrics are configured in grader '"
                    + owner + "'");
        }
        return selected;
    }
}
