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

package org.fireflyframework.sage.metric.timeliness;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.sage.metric.MetricStatus;

/**
 * Result of a timeliness check on one column. {@code aging} counts timely values
 * that are already older than the warning age.
 */
@Data
@Builder
public class ColumnTimeliness {

    private final TimelinessCheckType checkType;
    private final int timely;
    private final int untimely;
    private final int aging;
    private final double timelinessScore;
    private final int maxAgeDays;
    private final int warningAgeDays;
    private final MetricStatus status;
    private final String message;

    public int getEvaluated() {
        return timely + untimely;
    }
}
