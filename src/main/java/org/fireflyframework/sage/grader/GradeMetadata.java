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
import java.util.List;
import java.util.Map;

/**
 * Describes what a grading run looked at and how long it took. {@code source}
 * holds the details specific to the kind of source.
 */
@Data
@Builder
public class GradeMetadata {

    private final String sourceType;
    private final String unit;
    private final int rowCount;
    private final int columnCount;
    private final List<String> columns;
    private final Map<String, Object> source;
    private final Instant startTime;
    private final Instant endTime;
    private final double durationSeconds;
}
