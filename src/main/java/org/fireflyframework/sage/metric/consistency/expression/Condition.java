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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parsed boolean expression over the columns of a row.
 *
 * @see ConditionParser
 * @see ConditionEvaluator
 */
public sealed interface Condition {

    /**
     * Returns the names of all columns the expression reads, in order of first use.
     *
     * @return the referenced column names
     */
    default Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        collectColumns(columns);
        return columns;
    }

    void collectColumns(Set<String> columns);

    record Compare(Operand left, ComparisonOperator operator, Operand right) implements Condition {
        @Override
        public void collectColumns(Set<String> columns) {
            if (left instanceof Operand.ColumnRef ref) {
                columns.add(ref.name());
            }
            if (right instanceof Operand.ColumnRef ref) {
                columns.add(ref.name());
            }
        }

        @Override
        public String toString() {
            return left + " " + operator + " " + right;
        }
    }

    record And(Condition left, Condition right) implements Condition {
        @Override
        public void collectColumns(Set<String> columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        @Override
        public String toString() {
            return "(" + left + " and " + right + ")";
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        @Override
        public void collectColumns(Set<String> columns) {
            left.collectColumns(columns);
            right.collectColumns(columns);
        }

        @Override
        public String toString() {
            return "(" + left + " or " + right + ")";
        }
    }

    record Not(Condition operand) implements Condition {
        @Override
        public void collectColumns(Set<String> columns) {
            operand.collectColumns(columns);
        }

        @Override
        public String toString() {
            return "not " + operand;
        }
    }
}
