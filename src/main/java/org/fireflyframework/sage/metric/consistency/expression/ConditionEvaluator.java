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

import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TabularDataset;

/**
 * Evaluates {@link Condition} trees row by row against a dataset.
 *
 * <p>A comparison involving a missing value is {@code false}, except {@code !=}
 * which is {@code true}.</p>
 */
public final class ConditionEvaluator {

    private final TabularDataset dataset;

    public ConditionEvaluator(TabularDataset dataset) {
        this.dataset = dataset;
    }

    /**
     * Evaluates a condition for every row.
     *
     * @param condition the condition
     * @return one flag per row
     * @throws ConditionEvaluationException if the condition references an unknown column
     *         or compares incompatible values
     */
    public boolean[] evaluate(Condition condition) {
        requireColumns(condition);
        boolean[] mask = new boolean[dataset.rowCount()];
        for (int row = 0; row < mask.length; row++) {
            mask[row] = test(condition, row);
        }
        return mask;
    }

    /**
     * Fails fast when a condition reads a column the dataset does not have.
     *
     * @param condition the condition
     * @throws ConditionEvaluationException naming the first unknown column
     */
    public void requireColumns(Condition condition) {
        for (String name : condition.referencedColumns()) {
            if (!dataset.hasColumn(name)) {
                throw new ConditionEvaluationException("Column '" + name + "' not found in data");
            }
        }
    }

    /**
     * Evaluates a condition for a single row.
     *
     * @param condition the condition
     * @param row       the row index
     * @return the result
     */
    public boolean test(Condition condition, int row) {
        if (condition instanceof Condition.Compare compare) {
            Object left = resolve(compare.left(), row);
            Object right = resolve(compare.right(), row);
            if (Column.isMissingValue(left) || Column.isMissingValue(right)) {
                return compare.operator() == ComparisonOperator.NOT_EQUAL;
            }
            return compare.operator().apply(left, right);
        }
        if (condition instanceof Condition.And and) {
            return test(and.left(), row) && test(and.right(), row);
        }
        if (condition instanceof Condition.Or or) {
            return test(or.left(), row) || test(or.right(), row);
        }
        if (condition instanceof Condition.Not not) {
            return !test(not.operand(), row);
        }
        throw new IllegalStateException("Unsupported condition: " + condition);
    }

    private Object resolve(Operand operand, int row) {
        if (operand instanceof Operand.ColumnRef ref) {
            Column column = dataset.findColumn(ref.name())
                    .orElseThrow(() -> new ConditionEvaluationException("Column '" + ref.name() + "' not found in data"));
            return column.get(row);
        }
        return ((Operand.Literal) operand).value();
    }
}
