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

package org.fireflyframework.sage.metric.completeness;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.Thresholds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Measures the share of non-missing cells, overall and per column.
 *
 * <p>The dataset score is {@code (totalCells - missingCells) / totalCells}; each column
 * is scored as {@code (rows - missing) / rows} and classified against the same
 * thresholds. The metric has no rules. Details are reported under
 * {@link MetricResult#COLUMNS}.</p>
 */
@Slf4j
public class CompletenessMetric implements Metric {

    public static final String DEFAULT_NAME = "completeness";
    public static final Thresholds DEFAULT_THRESHOLDS = Thresholds.of(0.8, 0.6);

    private final String name;
    private final Thresholds thresholds;

    public CompletenessMetric() {
        this(DEFAULT_NAME, DEFAULT_THRESHOLDS);
    }

    public CompletenessMetric(double warningThreshold, double failureThreshold) {
        this(DEFAULT_NAME, Thresholds.of(warningThreshold, failureThreshold));
    }

    public CompletenessMetric(String name, Thresholds thresholds) {
        this.name = name;
        this.thresholds = thresholds;
        log.debug("Initialized completeness metric: {}", name);
    }

    @Override
    public MetricResult evaluate(TabularDataset dataset) {
        if (dataset == null || dataset.isEmpty()) {
            return MetricResult.noData(MetricResult.COLUMNS);
        }

        long totalCells = dataset.totalCells();
        long missingCells = dataset.missingCells();
        double score = (double) (totalCells - missingCells) / totalCells;

        Map<String, ColumnCompleteness> columns = new LinkedHashMap<>();
        for (Column column : dataset.getColumns()) {
            columns.put(column.getName(), evaluateColumn(column));
        }

        String message = missingCells == 0
                ? "All values present"
                : String.format(Locale.ROOT, "Missing %d of %d values (%.1f%% complete)",
                        missingCells, totalCells, score * 100);

        return MetricResult.builder()
                .score(score)
                .status(thresholds.classify(score))
                .message(message)
                .detail(MetricResult.COLUMNS, Collections.unmodifiableMap(columns))
                .build();
    }

    private ColumnCompleteness evaluateColumn(Column column) {
        int total = column.size();
        int missing = column.missingCount();
        double completeness = total > 0 ? (double) (total - missing) / total : 0.0;
        return ColumnCompleteness.builder()
                .completeness(completeness)
                .status(thresholds.classify(completeness))
                .message(missing == 0 ? "All values present" : "Missing " + missing + " of " + total + " values")
                .missingCount(missing)
                .totalCount(total)
                .build();
    }

    @Override
    public void clear() {
        log.debug("Cleared completeness metric: {}", name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Thresholds getThresholds() {
        return thresholds;
    }
}
