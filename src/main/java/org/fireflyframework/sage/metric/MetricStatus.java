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

package org.fireflyframework.sage.metric;

import java.util.Locale;

/**
 * Classification of a score against a pair of thresholds.
 *
 * <ul>
 *   <li>{@link #PASSED} - score at or above the warning threshold</li>
 *   <li>{@link #WARNING} - score at or above the failure threshold</li>
 *   <li>{@link #FAILED} - score below the failure threshold, or no data</li>
 *   <li>{@link #SKIPPED} - nothing could be evaluated</li>
 * </ul>
 */
public enum MetricStatus {

    PASSED,
    WARNING,
    FAILED,
    SKIPPED;

    /**
     * Returns the lower-case name used by report renderers.
     *
     * @return the wire value, e.g. {@code "passed"}
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDegraded() {
        return this == WARNING || this == FAILED;
    }
}
