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

package org.fireflyframework.sage.exception;

/**
 * Failure while evaluating a metric or one of its rules.
 *
 * <p>This is the only error category recovered locally: the analyzer and the
 * graders convert it into a degraded result instead of propagating it.</p>
 */
public class MetricEvaluationException extends SageException {

    public MetricEvaluationException(String message) {
        super(message);
    }

    public MetricEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
