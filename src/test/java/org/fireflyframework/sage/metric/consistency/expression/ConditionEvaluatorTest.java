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

package org.fireflyframework.sage.metric.consistency.expression;

import org.fireflyframework.sage.dataset.TabularDataset;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConditionEvaluator} and {@link ValueComparator}.
 */
class ConditionEvaluatorTest {

    private final TabularDataset dataset = TabularDataset.builder()
            .column("age", Arrays.asList(15, 25, null, 40))
            .column("is_adult", Arrays.asList(false, true, true, null))
            .column("country", "US", "DE", "US", "FR")
            .build();

    private final ConditionEvaluator evaluator = new ConditionEvaluator(dataset);

    @Test
    void evaluate_comparisonWithMissingValue_shouldBeFalse() {
        // When
        boolean[] mask = evaluator.evaluate(ConditionParser.parse("age >= 18"));

        // Then
        assertThat(mask).containsExactly(false, true, false, true);
    }

    @Test
    void evaluate_notEqualWithMissingValue_shouldBeTrue() {
        // When
        boolean[] mask = evaluator.evaluate(ConditionParser.parse("age != 25"));

        // Then
        assertThat(mask).containsExactly(true, false, true, true);
    }

    @Test
    void evaluate_compoundCondition_shouldCombineRowResults() {
        // When
        boolean[] mask = evaluator.evaluate(ConditionParser.parse("country == 'US' and not is_adult | age > 30"));

        // Then
        assertThat(mask).containsExactly(true, false, false, true);
    }

    @Test
    void evaluate_unknownColumn_shouldFailBeforeEvaluatingRows() {
        assertThatThrownBy(() -> evaluator.evaluate(ConditionParser.parse("age > 1 and salary > 100")))
                .isInstanceOf(ConditionEvaluationException.class)
                .hasMessage("Column 'salary' not found in data");
    }

    @Test
    void evaluate_orderingTextAgainstNumber_shouldFail() {
        assertThatThrownBy(() -> evaluator.evaluate(ConditionParser.parse("country > 5")))
                .isInstanceOf(ConditionEvaluationException.class)
                .hasMessageContaining("Cannot compare");
    }

    @Test
    void compare_numbersOfDifferentTypes_shouldUseExactValue() {
        assertThat(ValueComparator.compare(1, 1.0)).isZero();
        assertThat(ValueComparator.compare(2L, 1.5)).isPositive();
        assertThat(ValueComparator.isEqual(10, 10L)).isTrue();
    }

    @Test
    void compare_datesAgainstIsoText_shouldCompareAsDates() {
        assertThat(ValueComparator.compare(LocalDate.of(2024, 1, 1), "2024-02-01")).isNegative();
        assertThat(ValueComparator.compare(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDate.of(2024, 1, 1))).isZero();
        assertThatThrownBy(() -> ValueComparator.compare(LocalDate.of(2024, 1, 1), "soon"))
                .isInstanceOf(ConditionEvaluationException.class);
    }

    @Test
    void isEqual_incompatibleKinds_shouldBeFalse() {
        assertThat(ValueComparator.isEqual("1", 1)).isFalse();
        assertThat(ComparisonOperator.NOT_EQUAL.apply(true, "true")).isTrue();
    }

    @Test
    void isEqual_dateAgainstNonDateText_shouldBeFalse() {
        assertThat(ValueComparator.isEqual(LocalDate.of(2024, 1, 1), "unknown")).isFalse();
        assertThat(ComparisonOperator.NOT_EQUAL.apply(LocalDate.of(2024, 1, 1), "unknown")).isTrue();
        assertThat(ValueComparator.isEqual(LocalDate.of(2024, 1, 1), "2024-01-01")).isTrue();
    }

    @Test
    void compare_infiniteNumbers_shouldSortBeyondFiniteValues() {
        assertThat(ValueComparator.compare(Double.POSITIVE_INFINITY, 100)).isPositive();
        assertThat(ValueComparator.compare(Double.NEGATIVE_INFINITY, Long.MIN_VALUE)).isNegative();
        assertThat(ValueComparator.isEqual(Double.POSITIVE_INFINITY, Float.POSITIVE_INFINITY)).isTrue();
    }
}
