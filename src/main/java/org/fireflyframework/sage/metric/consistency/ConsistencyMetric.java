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

package org.fireflyframework.sage.metric.consistency;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.metric.Metric;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.RuleRegistry;
import org.fireflyframework.sage.metric.Thresholds;
import org.fireflyframework.sage.metric.consistency.expression.ComparisonOperator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Checks that related values follow relationship and comparison rules across columns.
 *
 * <p>The score is the unweighted mean of the rule scores. A rule that cannot be
 * evaluated scores 0 and carries the error in its {@link RuleOutcome}. Outcomes are
 * reported under {@link MetricResult#RULES}, keyed by rule name.</p>
 */
@Slf4j
public class ConsistencyMetric implements Metric {

    public static final String DEFAULT_NAME = "consistency";
    public static final Thresholds DEFAULT_THRESHOLDS = Thresholds.of(0.9, 0.7);

    private final String name;
    private final Thresholds thresholds;
    private final RuleRegistry<ConsistencyRule> rules;

    public ConsistencyMetric() {
        this(DEFAULT_NAME, DEFAULT_THRESHOLDS);
    }

    public ConsistencyMetric(double warningThreshold, double failureThreshold) {
        this(DEFAULT_NAME, Thresholds.of(warningThreshold, failureThreshold));
    }

    public ConsistencyMetric(String name, Thresholds thresholds) {
        this.name = name;
        this.thresholds = thresholds;
        this.rules = new RuleRegistry<>(name);
        log.debug("Initialized consistency metric: {}", name);
    }

    /**
     * Adds a logical implication: rows satisfying {@code condition} must satisfy
     * {@code implies}.
     *
     * @param ruleName  unique rule name
     * @param condition the antecedent, e.g. {@code age >= 18}
     * @param implies   the consequent, e.g. {@code is_adult == True}
     * @throws ConfigurationException if the name is taken or an expression is malformed
     */
    public void addRelationshipCheck(String ruleName, String condition, String implies) {
        requireName(ruleName);
        register(new RelationshipCheck(ruleName, condition, implies));
    }

    /**
     * Adds a row-wise comparison between two columns.
     *
     * @param ruleName    unique rule name
     * @param leftColumn  the left column
     * @param operator    one of {@code < <= == != >= >}
     * @param rightColumn the right column
     * @throws ConfigurationException if the name is taken, a column is blank or the
     *         operator is not supported
     */
    public void addComparisonCheck(String ruleName, String leftColumn, String operator, String rightColumn) {
        addComparisonCheck(ruleName, leftColumn, ComparisonOperator.fromSymbol(operator), rightColumn);
    }

    public void addComparisonCheck(String ruleName, String leftColumn, ComparisonOperator operator, String rightColumn) {
        requireName(ruleName);
        if (leftColumn == null || leftColumn.isBlank() || rightColumn == null || rightColumn.isBlank()) {
            throw new ConfigurationException("Comparison rule '" + ruleName + "' requires two column names");
        }
        if (operator == null) {
            throw new ConfigurationException("Comparison rule '" + ruleName + "' requires an operator");
        }
        register(new ComparisonCheck(ruleName, leftColumn, operator, rightColumn));
    }

    private void register(ConsistencyRule rule) {
        rules.register(rule.getName(), rule);
        log.debug("Added {} rule '{}': {}", rule.getType(), rule.getName(), rule.describe());
    }

    private static void requireName(String ruleName) {
        if (ruleName == null || ruleName.isBlank()) {
            throw new ConfigurationException("Consistency rules require a name");
        }
    }

    public Collection<ConsistencyRule> getRules() {
        return rules.rules();
    }

    @Override
    public MetricResult evaluate(TabularDataset dataset) {
        rules.seal();
        if (dataset == null || dataset.isEmpty()) {
            return MetricResult.noData(MetricResult.RULES);
        }
        if (rules.isEmpty()) {
            return MetricResult.builder()
                    .score(1.0)
                    .status(MetricStatus.PASSED)
                    .message("No consistency rules configured")
                    .detail(MetricResult.RULES, Map.of())
                    .build();
        }

        Map<String, RuleOutcome> outcomes = new LinkedHashMap<>();
        rules.asMap().forEach((ruleName, rule) -> outcomes.put(ruleName, evaluateRule(rule, dataset)));

        double score = outcomes.values().stream()
                .mapToDouble(RuleOutcome::getConsistencyScore)
                .average()
                .orElse(1.0);
        long failedChecks = outcomes.values().stream().mapToLong(RuleOutcome::getInconsistentRows).sum();
        long totalChecks = outcomes.values().stream().mapToLong(RuleOutcome::getEvaluatedRows).sum();
        String message = totalChecks > 0
                ? String.format(Locale.ROOT, "%d of %d consistency checks failed (%.1f%% consistency)",
                        failedChecks, totalChecks, score * 100)
                : "No applicable data for consistency rules";

        return MetricResult.builder()
                .score(score)
                .status(thresholds.classify(score))
                .message(message)
                .detail(MetricResult.RULES, Collections.unmodifiableMap(outcomes))
                .build();
    }

    private RuleOutcome evaluateRule(ConsistencyRule rule, TabularDataset dataset) {
        try {
            return rule.evaluate(dataset, thresholds);
        } catch (RuntimeException e) {
            log.error("Error evaluating {} rule '{}': {}", rule.getType(), rule.getName(), e.getMessage(), e);
            return RuleOutcome.failed(rule, e);
        }
    }

    @Override
    public void clear() {
        rules.clear();
        log.debug("Cleared all rules from consistency metric: {}", name);
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
