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

package org.fireflyframework.sage.grader;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Snapshot of a grader's state and latest results. {@code metricsRun} and
 * {@code avgScore} are {@code null} until the grader has run.
 */
@Data
@Builder
public class GraderSummary {

    private final String name;
    private final String type;
    private final boolean connected;
    private final int metricsConfigured;
    private final Instant lastRun;
    private final boolean hasResults;
    private final Integer metricsRun;
    private final Double avgScore;
}
