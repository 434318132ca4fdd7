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
import org.fireflyframework.sage.metric.Thresholds;

/**
 * A named cross-column constraint evaluated row by row.
 */
public interface ConsistencyRule {

    String getName();

    /**
     * @return {@code relationship} or {@code comparison}
     */
    String getType();

    String describe();

    /**
     * Evaluates the rule over every row of the dataset.
     *
     * @param dataset    the dataset
     * @param thresholds the owning metric's thresholds, used to classify the rule score
     * @return the outcome
     * @throws org.fireflyframework.sage.exception.MetricEvaluationException if the rule
     *         cannot be evaluated against this dataset
     */
    RuleOutcome evaluate(TabularDataset dataset, Thresholds thresholds);
}
