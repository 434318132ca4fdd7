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

import org.fireflyframework.sage.exception.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Binary comparison operators supported in consistency rules.
 */
public enum ComparisonOperator {

    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER_THAN_OR_EQUAL(">="),
    GREATER_THAN(">");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its symbol.
     *
     * @param symbol one of {@code < <= == != >= >}
     * @return the operator
     * @throws ConfigurationException if the symbol is not supported
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new ConfigurationException("Invalid operator: " + symbol + ". Must be one of "
                + Arrays.stream(values()).map(ComparisonOperator::getSymbol)
                        .collect(Collectors.joining(", ", "[", "]")));
    }

    /**
     * Applies the operator to two non-missing values.
     *
     * <p>Equality between values of incompatible kinds is {@code false}; ordering
     * them is an error.</p>
     *
     * @param left  the left value
     * @param right the right value
     * @return the comparison result
     * @throws ConditionEvaluationException if the values cannot be ordered
     */
    public boolean apply(Object left, Object right) {
        return switch (this) {
            case EQUAL -> ValueComparator.isEqual(left, right);
            case NOT_EQUAL -> !ValueComparator.isEqual(left, right);
            case LESS_THAN -> ValueComparator.compare(left, right) < 0;
            case LESS_THAN_OR_EQUAL -> ValueComparator.compare(left, right) <= 0;
            case GREATER_THAN_OR_EQUAL -> ValueComparator.compare(left, right) >= 0;
            case GREATER_THAN -> ValueComparator.compare(left, right) > 0;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
