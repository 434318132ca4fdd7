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

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import org.fireflyframework.sage.metric.MetricStatus;

import java.util.List;
import java.util.Map;

/**
 * Result of evaluating one consistency rule.
 */
@Data
@Builder
public class RuleOutcome {

    public static final int MAX_EXAMPLES = 5;

    private final String type;
    private final String description;
    private final int consistentRows;
    private final int inconsistentRows;
    private final double consistencyScore;
    private final MetricStatus status;

    @Singular
    private final List<Map<String, Object>> examples;

    private final String error;

    /**
     * Creates the outcome recorded when a rule could not be evaluated.
     *
     * @param rule  the rule
     * @param error the failure
     * @return a failed outcome with score 0
     */
    public static RuleOutcome failed(ConsistencyRule rule, Throwable error) {
        return RuleOutcome.builder()
                .type(rule.getType())
                .description(rule.describe())
                .consistencyScore(0.0)
                .status(MetricStatus.FAILED)
                .error(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName())
                .build();
    }

    public int getEvaluatedRows() {
        return consistentRows + inconsistentRows;
    }
}
