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

/**
 * Port for a data quality metric.
 *
 * <p>A metric owns its rule configuration and classifies its own score against its
 * own {@link Thresholds}. Rules are registered before the first evaluation; after
 * that the metric is sealed until {@link #clear()} is called.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AccuracyMetric accuracy = new AccuracyMetric();
 * accuracy.addRangeCheck("age", 0, 120);
 * MetricResult result = accuracy.evaluate(dataset);
 * }</pre>
 */
public interface Metric {

    /**
     * Returns the name this metric is registered under by default.
     *
     * @return the metric name
     */
    String getName();

    /**
     * Evaluates this metric against the dataset.
     *
     * <p>Implementations never throw for a well-formed or absent dataset: a
     * {@code null} or empty dataset yields {@link MetricResult#noData(String)} and
     * per-check problems are reported in the check's detail.</p>
     *
     * @param dataset the dataset to evaluate, possibly {@code null}
     * @return the result
     */
    MetricResult evaluate(TabularDataset dataset);

    /**
     * Removes all configured rules and reopens the metric for configuration.
     */
    void clear();

    /**
     * Returns the thresholds used to classify this metric's score.
     *
     * @return the thresholds
     */
    Thresholds getThresholds();
}
