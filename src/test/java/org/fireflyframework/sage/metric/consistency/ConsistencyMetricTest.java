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

import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.metric.MetricResult;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.consistency.expression.ComparisonOperator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ConsistencyMetric}.
 */
class ConsistencyMetricTest {

    private static TabularDataset people() {
        return TabularDataset.builder()
                .column("age", 25, 30, 17, 45, 19, 12)
                .column("is_adult", true, true, false, true, false, false)
                .build();
    }

    private static TabularDataset contracts() {
        return TabularDataset.builder()
                .column("start_date", LocalDate.of(2023, 1, 1), LocalDate.of(2023, 2, 1), LocalDate.of(2023, 3, 1),
                        LocalDate.of(2023, 4, 1), LocalDate.of(2023, 5, 1))
                .column("end_date", "2023-01-31", "2023-02-28", "2023-02-15", "2023-03-15", "2023-04-30")
                .build();
    }

    @Test
    void evaluate_relationshipCheck_shouldOnlyCountApplicableRows() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("adult_flag", "age >= 18", "is_adult == True");

        // When
        MetricResult result = metric.evaluate(people());

        // Then
        RuleOutcome outcome = result.section(MetricResult.RULES, RuleOutcome.class).get("adult_flag");
        assertThat(outcome.getType()).isEqualTo(RelationshipCheck.TYPE);
        assertThat(outcome.getDescription()).isEqualTo("If age >= 18 then is_adult == True");
        assertThat(outcome.getConsistentRows()).isEqualTo(3);
        assertThat(outcome.getInconsistentRows()).isEqualTo(1);
        assertThat(outcome.getExamples()).singleElement()
                .satisfies(row -> assertThat(row).contains(entry("age", 19), entry("is_adult", false)));
        assertThat(result.getScore()).isCloseTo(0.75, within(1e-9));
        assertThat(result.getMessage()).isEqualTo("1 of 4 consistency checks failed (75.0% consistency)");
        assertThat(result.getStatus()).isEqualTo(MetricStatus.WARNING);
    }

    @Test
    void evaluate_relationshipWithoutApplicableRows_shouldBeConsistent() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("seniors", "age > 100", "is_adult");

        // When
        MetricResult result = metric.evaluate(people());

        // Then
        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getMessage()).isEqualTo("No applicable data for consistency rules");
    }

    @Test
    void evaluate_dateComparisonAgainstIsoText_shouldCompareAsDates() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addComparisonCheck("date_order", "start_date", "<", "end_date");

        // When
        MetricResult result = metric.evaluate(contracts());

        // Then
        RuleOutcome outcome = result.section(MetricResult.RULES, RuleOutcome.class).get("date_order");
        assertThat(outcome.getDescription()).isEqualTo("start_date < end_date");
        assertThat(outcome.getConsistentRows()).isEqualTo(2);
        assertThat(outcome.getInconsistentRows()).isEqualTo(3);
        assertThat(outcome.getExamples()).hasSize(3);
        assertThat(result.getScore()).isCloseTo(0.4, within(1e-9));
        assertThat(result.getStatus()).isEqualTo(MetricStatus.FAILED);
    }

    @Test
    void evaluate_comparisonWithMissingSide_shouldSkipRow() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addComparisonCheck("bounds", "low", ComparisonOperator.LESS_THAN_OR_EQUAL, "high");
        TabularDataset dataset = TabularDataset.builder()
                .column("low", Arrays.asList(1, null, 5))
                .column("high", Arrays.asList(2, 3, null))
                .build();

        // When
        RuleOutcome outcome = metric.evaluate(dataset).section(MetricResult.RULES, RuleOutcome.class).get("bounds");

        // Then
        assertThat(outcome.getEvaluatedRows()).isEqualTo(1);
        assertThat(outcome.getConsistencyScore()).isEqualTo(1.0);
    }

    @Test
    void evaluate_unknownColumn_shouldScoreRuleZeroAndKeepOthers() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("adult_flag", "age >= 18", "is_adult == True");
        metric.addComparisonCheck("broken", "age", ">", "salary");

        // When
        MetricResult result = metric.evaluate(people());

        // Then
        Map<String, RuleOutcome> rules = result.section(MetricResult.RULES, RuleOutcome.class);
        assertThat(rules.keySet()).containsExactly("adult_flag", "broken");
        assertThat(rules.get("broken").getConsistencyScore()).isZero();
        assertThat(rules.get("broken").getStatus()).isEqualTo(MetricStatus.FAILED);
        assertThat(rules.get("broken").getError()).isEqualTo("Column 'salary' not found in data");
        assertThat(result.getScore()).isCloseTo(0.375, within(1e-9));
    }

    @Test
    void addComparisonCheck_invalidOperator_shouldBeRejected() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();

        // When & Then
        assertThatThrownBy(() -> metric.addComparisonCheck("bad", "a", "=>", "b"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Invalid operator: =>. Must be one of [<, <=, ==, !=, >=, >]");
        assertThat(metric.getRules()).isEmpty();
    }

    @Test
    void addRelationshipCheck_duplicateName_shouldKeepExistingRule() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("adult_flag", "age >= 18", "is_adult");

        // When & Then
        assertThatThrownBy(() -> metric.addRelationshipCheck("adult_flag", "age < 18", "is_adult == False"))
                .isInstanceOf(ConfigurationException.class);
        assertThat(metric.getRules()).singleElement()
                .satisfies(rule -> assertThat(rule.describe()).isEqualTo("If age >= 18 then is_adult"));
    }

    @Test
    void addRelationshipCheck_malformedExpression_shouldBeRejected() {
        assertThatThrownBy(() -> new ConsistencyMetric().addRelationshipCheck("bad", "age >=", "is_adult"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void evaluate_noRules_shouldPass() {
        // When
        MetricResult result = new ConsistencyMetric().evaluate(people());

        // Then
        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getStatus()).isEqualTo(MetricStatus.PASSED);
        assertThat(result.getMessage()).isEqualTo("No consistency rules configured");
    }

    @Test
    void evaluate_infiniteValue_shouldCompareRowWise() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("adult_flag", "age >= 18", "is_adult == True");
        TabularDataset dataset = TabularDataset.builder()
                .column("age", 25.0, 30.0, Double.POSITIVE_INFINITY, 10.0, 40.0)
                .column("is_adult", true, true, true, false, true)
                .build();

        // When
        MetricResult result = metric.evaluate(dataset);

        // Then
        RuleOutcome outcome = result.section(MetricResult.RULES, RuleOutcome.class).get("adult_flag");
        assertThat(outcome.getError()).isNull();
        assertThat(outcome.getConsistentRows()).isEqualTo(4);
        assertThat(outcome.getInconsistentRows()).isZero();
        assertThat(result.getScore()).isEqualTo(1.0);
    }

    @Test
    void evaluate_dateNotEqualToPlaceholderText_shouldHold() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("known_start", "start_date != 'unknown'", "start_date < end_date");

        // When
        MetricResult result = metric.evaluate(contracts());

        // Then
        RuleOutcome outcome = result.section(MetricResult.RULES, RuleOutcome.class).get("known_start");
        assertThat(outcome.getError()).isNull();
        assertThat(outcome.getConsistentRows()).isEqualTo(2);
        assertThat(outcome.getInconsistentRows()).isEqualTo(3);
    }

    @Test
    void evaluate_calledTwiceWithRules_shouldReturnEqualResults() {
        // Given
        ConsistencyMetric metric = new ConsistencyMetric();
        metric.addRelationshipCheck("adult_flag", "age >= 18", "is_adult == True");
        metric.addComparisonCheck("age_order", "age", ">=", "age");
        TabularDataset dataset = people();

        // When
        MetricResult first = metric.evaluate(dataset);
        MetricResult second = metric.evaluate(dataset);

        // Then
        assertThat(second).isEqualTo(first);
    }
}
