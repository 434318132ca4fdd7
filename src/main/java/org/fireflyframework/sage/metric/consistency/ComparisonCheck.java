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

import lombok.Getter;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.Thresholds;
import org.fireflyframework.sage.metric.consistency.expression.ComparisonOperator;
import org.fireflyframework.sage.metric.consistency.expression.ConditionEvaluationException;

/**
 * Row-wise comparison between two columns, for example {@code start_date < end_date}.
 * Rows where either side is missing are not evaluated.
 */
@Getter
public class ComparisonCheck implements ConsistencyRule {

    public static final String TYPE = "comparison";

    private final String name;
    private final String leftColumn;
    private final ComparisonOperator operator;
    private final String rightColumn;

    public ComparisonCheck(String name, String leftColumn, ComparisonOperator operator, String rightColumn) {
        this.name = name;
        this.leftColumn = leftColumn;
        this.operator = operator;
        this.rightColumn = rightColumn;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String describe() {
        return leftColumn + " " + operator.getSymbol() + " " + rightColumn;
    }

    @Override
    public RuleOutcome evaluate(TabularDataset dataset, Thresholds thresholds) {
        Column left = require(dataset, leftColumn);
        Column right = require(dataset, rightColumn);

        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder()
                .type(TYPE)
                .description(describe());
        int consistent = 0;
        int inconsistent = 0;
        for (int row = 0; row < dataset.rowCount(); row++) {
            if (left.isMissing(row) || right.isMissing(row)) {
                continue;
            }
            if (operator.apply(left.get(row), right.get(row))) {
                consistent++;
            } else {
                if (inconsistent < RuleOutcome.MAX_EXAMPLES) {
                    outcome.example(dataset.row(row));
                }
                inconsistent++;
            }
        }

        int total = consistent + inconsistent;
        double score = total > 0 ? (double) consistent / total : 1.0;
        return outcome
                .consistentRows(consistent)
                .inconsistentRows(inconsistent)
                .consistencyScore(score)
                .status(thresholds.classify(score))
                .build();
    }

    private static Column require(TabularDataset dataset, String name) {
        return dataset.findColumn(name)
                .orElseThrow(() -> new ConditionEvaluationException("Column '" + name + "' not found in data"));
    }
}
