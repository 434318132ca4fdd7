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

import org.fireflyframework.sage.exception.ConfigurationException;

/**
 * Warning and failure cut-offs used to classify a score.
 *
 * @param warning scores at or above this value pass
 * @param failure scores below this value fail
 */
public record Thresholds(double warning, double failure) {

    public Thresholds {
        if (Double.isNaN(warning) || warning < 0.0 || warning > 1.0) {
            throw new ConfigurationException("Warning threshold must be within [0, 1], got " + warning);
        }
        if (Double.isNaN(failure) || failure < 0.0 || failure > 1.0) {
            throw new ConfigurationException("Failure threshold must be within [0, 1], got " + failure);
        }
        if (warning <= failure) {
            throw new ConfigurationException("Warning threshold (" + warning
                    + ") must be greater than failure threshold (" + failure + ")");
        }
    }

    public static Thresholds of(double warning, double failure) {
        return new Thresholds(warning, failure);
    }

    /**
     * Classifies a score: passed at or above {@code warning}, warning at or above
     * {@code failure}, failed otherwise.
     *
     * @param score the score to classify
     * @return the status
     */
    public MetricStatus classify(double score) {
        if (score >= warning) {
            return MetricStatus.PASSED;
        }
        if (score >= failure) {
            return MetricStatus.WARNING;
        }
        return MetricStatus.FAILED;
    }
}
