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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.analysis.Analyzer;
import org.fireflyframework.sage.metric.accuracy.AccuracyMetric;
import org.fireflyframework.sage.metric.completeness.CompletenessMetric;
import org.fireflyframework.sage.metric.consistency.ConsistencyMetric;
import org.fireflyframework.sage.metric.timeliness.TimelinessMetric;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the data quality analyzer.
 *
 * <p>This configuration automatically sets up an {@link Analyzer} holding the
 * completeness, accuracy, consistency and timeliness metrics, with thresholds taken
 * from {@link SageProperties}. Analysis events are published when an
 * {@link ApplicationEventPublisher} is available.</p>
 *
 * <p>The configuration is activated when the property {@code firefly.sage.enabled}
 * is true or not set.</p>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(SageProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.sage",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class SageAutoConfiguration {

    /**
     * Creates the analyzer bean. Rules are added to its metrics by the application,
     * e.g. through {@link Analyzer#getMetric(String, Class)}.
     *
     * @param properties     the bound properties
     * @param eventPublisher the event publisher, or {@code null} if unavailable
     * @return the configured analyzer
     */
    @Bean
    @ConditionalOnMissingBean
    public Analyzer sageAnalyzer(SageProperties properties,
                                 @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        Analyzer analyzer = new Analyzer(properties.getOverall().toThresholds(), eventPublisher);
        analyzer.addMetric(new CompletenessMetric(CompletenessMetric.DEFAULT_NAME,
                properties.getCompleteness().toThresholds()));
        analyzer.addMetric(new AccuracyMetric(AccuracyMetric.DEFAULT_NAME,
                properties.getAccuracy().toThresholds()));
        analyzer.addMetric(new ConsistencyMetric(ConsistencyMetric.DEFAULT_NAME,
                properties.getConsistency().toThresholds()));
        analyzer.addMetric(new TimelinessMetric(TimelinessMetric.DEFAULT_NAME,
                properties.getTimeliness().toThresholds(), properties.getTimeliness().getReferenceDate()));
        log.info("Configuring SAGE analyzer with metrics {}", analyzer.getMetricNames());
        return analyzer;
    }
}
