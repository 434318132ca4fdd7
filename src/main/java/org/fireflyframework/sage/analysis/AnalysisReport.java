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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one {@link Analyzer} run.
 *
 * <p>{@code metrics} is keyed by metric name in the order the metrics were run.
 * {@code error} is only set when the analysis could not run at all.</p>
 */
@Data
@Builder
public class AnalysisReport {

    private final double overallScore;
    private final MetricStatus overallStatus;
    private final Map<String, MetricResult> metrics;
    private final List<Recommendation> recommendations;
    private final double analysisTimeSeconds;
    private final Instant analysisDate;
    private final String error;

    /**
     * Creates the report returned when no analysis could be performed.
     *
     * @param error the reason
     * @return a failed report with no metric results
     */
    public static AnalysisReport error(String error) {
        return AnalysisReport.builder()
                .overallScore(0.0)
                .overallStatus(MetricStatus.FAILED)
                .metrics(Map.of())
                .recommendations(List.of())
                .analysisDate(Instant.now())
                .error(error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}
