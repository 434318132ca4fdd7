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

/**
 * Valid and invalid counts produced by one accuracy check on one column.
 *
 * @param valid   values that satisfied the check
 * @param invalid values that violated it
 * @param message human-readable summary
 */
public record CheckOutcome(int valid, int invalid, String message) {

    public static CheckOutcome skipped(String message) {
        return new CheckOutcome(0, 0, message);
    }
}
