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

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

/**
 * Immutable outcome of one {@link Metric#evaluate} call.
 *
 * <p>The metric-specific breakdown is held in {@link #getDetails()} under a single
 * section key that report renderers rely on: {@link #COLUMNS} for completeness,
 * {@link #DETAILS} for accuracy and timeliness, {@link #RULES} for consistency.</p>
 */
@Data
@Builder
public class MetricResult {

    public static final String COLUMNS = "columns";
    public static final String DETAILS = "details";
    public static final String RULES = "rules";

    private final double score;
    private final MetricStatus status;
    private final String message;
    private final String error;

    @Singular("detail")
    private final Map<String, Object> details;

    /**
     * Creates the degraded result returned for an absent or empty dataset.
     *
     * @param section the section key the metric normally reports under
     * @return a failed result with score 0
     */
    public static MetricResult noData(String section) {
        return MetricResult.builder()
                .score(0.0)
                .status(MetricStatus.FAILED)
                .message("No data to evaluate")
                .detail(section, Map.of())
                .build();
    }

    /**
     * Creates the degraded result recorded when a metric raised during evaluation.
     *
     * @param error the failure
     * @return a failed result with score 0 carrying the error message
     */
    public static MetricResult failure(Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return MetricResult.builder()
                .score(0.0)
                .status(MetricStatus.FAILED)
                .message("Metric evaluation failed: " + reason)
                .error(reason)
                .build();
    }

    /**
     * Returns whether this result contributes to an aggregate score.
     *
     * @return {@code true} when no error was recorded and the score is finite
     */
    public boolean hasValidScore() {
        return error == null && Double.isFinite(score) && score >= 0.0 && score <= 1.0;
    }

    /**
     * Returns a typed view of one detail section.
     *
     * @param key  the section key
     * @param type the entry type
     * @param <T>  the entry type
     * @return the entries keyed by column or rule name, empty when absent
     * @throws IllegalStateException if the section holds entries of another type
     */
    @SuppressWarnings("unchecked")
    public <T> Map<String, T> section(String key, Class<T> type) {
        Object section = details.get(key);
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map<?, ?> entries)) {
            throw new IllegalStateException("Detail section '" + key + "' is not a map");
        }
        for (Object value : entries.values()) {
            if (!type.isInstance(value)) {
                throw new IllegalStateException("Detail section '" + key + "' holds "
                        + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
            }
        }
        return (Map<String, T>) entries;
    }
}
