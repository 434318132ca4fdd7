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
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.metric.Thresholds;
import org.fireflyframework.sage.metric.consistency.expression.Condition;
import org.fireflyframework.sage.metric.consistency.expression.ConditionEvaluator;
import org.fireflyframework.sage.metric.consistency.expression.ConditionParser;

/**
 * Logical implication between two row conditions: wherever {@code condition}
 * holds, {@code implies} must hold too. Rows where the condition is false are not
 * applicable; with no applicable rows the rule is vacuously consistent.
 */
@Getter
public class RelationshipCheck implements ConsistencyRule {

    public static final String TYPE = "relationship";

    private final String name;
    private final String conditionExpression;
    private final String impliesExpression;
    private final Condition condition;
    private final Condition implies;

    public RelationshipCheck(String name, String conditionExpression, String impliesExpression) {
        this.name = name;
        this.conditionExpression = conditionExpression;
        this.impliesExpression = impliesExpression;
        this.condition = ConditionParser.parse(conditionExpression);
        this.implies = ConditionParser.parse(impliesExpression);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String describe() {
        return "If " + conditionExpression + " then " + impliesExpression;
    }

    @Override
    public RuleOutcome evaluate(TabularDataset dataset, Thresholds thresholds) {
        ConditionEvaluator evaluator = new ConditionEvaluator(dataset);
        boolean[] applicable = evaluator.evaluate(condition);
        boolean[] satisfied = evaluator.evaluate(implies);

        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder()
                .type(TYPE)
                .description(describe());
        int consistent = 0;
        int inconsistent = 0;
        for (int row = 0; row < applicable.length; row++) {
            if (!applicable[row]) {
                continue;
            }
            if (satisfied[row]) {
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
}
