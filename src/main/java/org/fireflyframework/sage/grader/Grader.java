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

import org.fireflyframework.sage.metric.Metric;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Binds a set of metrics to an external data source.
 *
 * <p>A grader is connected to a source, one of the source's units (a sheet or a
 * table) is made active, and {@link #grade()} runs the configured metrics against
 * that unit's data. Metrics configured on the grader survive reconnection; all
 * connection state and results do not.</p>
 *
 * @param <S> the kind of source the grader connects to
 */
public interface Grader<S> extends AutoCloseable {

    String getName();

    /**
     * Connects to a source, discarding any previous connection state first.
     *
     * @param source the source
     * @return {@code true} once connected
     * @throws org.fireflyframework.sage.exception.SourceConnectionException if the source
     *         cannot be opened
     */
    boolean connect(S source);

    boolean isConnected();

    /**
     * Lists the units that can be graded.
     *
     * @return the unit names
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     */
    List<String> getAvailableUnits();

    /**
     * Selects the unit {@link #grade()} operates on.
     *
     * @param unit the unit name
     * @return {@code true} once selected
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     * @throws org.fireflyframework.sage.exception.NoActiveUnitException if the unit does not exist
     */
    boolean setActiveUnit(String unit);

    Optional<String> getActiveUnit();

    default GradeReport grade() {
        return grade(null);
    }

    /**
     * Runs the named metrics, or all of them, against the active unit.
     *
     * @param metricNames the metrics to run in order, or {@code null} for all of them
     * @return the results and run metadata
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     * @throws org.fireflyframework.sage.exception.NoActiveUnitException if no unit is active
     * @throws org.fireflyframework.sage.exception.NoMetricsConfiguredException if no metric
     *         is configured or none of the named metrics exist
     */
    GradeReport grade(Collection<String> metricNames);

    /**
     * @throws org.fireflyframework.sage.exception.ConfigurationException if the name is taken
     */
    void addMetric(String name, Metric metric);

    /**
     * @throws org.fireflyframework.sage.exception.ConfigurationException if no metric has the name
     */
    void removeMetric(String name);

    List<String> getAvailableMetrics();

    Optional<GradeReport> getLastResult();

    Optional<Instant> getLastRunTime();

    GraderSummary getSummary();

    /**
     * Releases the source. Safe to call more than once.
     */
    @Override
    void close();
}
