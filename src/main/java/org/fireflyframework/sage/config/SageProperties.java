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

package org.fireflyframework.sage.config;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.fireflyframework.sage.metric.Thresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * Configuration properties for the data quality analyzer.
 *
 * <pre>{@code
 * firefly:
 *   sage:
 *     enabled: true
 *     completeness:
 *       warning-threshold: 0.8
 *       failure-threshold: 0.6
 *     timeliness:
 *       reference-date: 2024-01-31
 *     overall:
 *       warning-threshold: 0.95
 *       failure-threshold: 0.8
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.sage")
public class SageProperties {

    private boolean enabled = true;

    private ThresholdProperties completeness = new ThresholdProperties(0.8, 0.6);

    private ThresholdProperties accuracy = new ThresholdProperties(0.9, 0.7);

    private ThresholdProperties consistency = new ThresholdProperties(0.9, 0.7);

    private TimelinessProperties timeliness = new TimelinessProperties();

    /**
     * Cut-offs for the overall status of an analysis, independent of the metric thresholds.
     */
    private ThresholdProperties overall = new ThresholdProperties(0.95, 0.8);

    @Data
    public static class ThresholdProperties {

        private double warningThreshold;
        private double failureThreshold;

        public ThresholdProperties() {
        }

        public ThresholdProperties(double warningThreshold, double failureThreshold) {
            this.warningThreshold = warningThreshold;
            this.failureThreshold = failureThreshold;
        }

        /**
         * @throws org.fireflyframework.sage.exception.ConfigurationException if the pair is invalid
         */
        public Thresholds toThresholds() {
            return Thresholds.of(warningThreshold, failureThreshold);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class TimelinessProperties extends ThresholdProperties {

        /**
         * Date ages are measured from; today when unset.
         */
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate referenceDate;

        public TimelinessProperties() {
            super(0.9, 0.7);
        }
    }
}
