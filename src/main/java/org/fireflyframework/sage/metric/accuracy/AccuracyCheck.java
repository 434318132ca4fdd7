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

package org.fireflyframework.sage.metric.accuracy;

import org.fireflyframework.sage.dataset.Column;

/**
 * A single validation criterion applied to the non-missing values of one column.
 *
 * <p>Checks are registered on an {@link AccuracyMetric}; a column may carry one check
 * of each kind. Missing values are never counted as valid or invalid.</p>
 */
public interface AccuracyCheck {

    /**
     * Returns the column this check validates.
     *
     * @return the column name
     */
    String getColumn();

    /**
     * Returns the unique name of this check, e.g. {@code range:age}.
     *
     * @return the rule name
     */
    String getRuleName();

    /**
     * Returns a short description of the criterion for reports.
     *
     * @return the summary
     */
    String summary();

    /**
     * Evaluates the check against the column's non-missing values.
     *
     * @param column the column to validate
     * @return the valid and invalid counts
     */
    CheckOutcome evaluate(Column column);
}
