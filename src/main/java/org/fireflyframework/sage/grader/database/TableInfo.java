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

package org.fireflyframework.sage.grader.database;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Introspected structure of a table. {@code rowCount} is {@code null} when the
 * count query failed.
 */
@Data
@Builder
public class TableInfo {

    private final String schema;
    private final String table;
    private final Long rowCount;
    private final Map<String, ColumnInfo> columns;

    public int getColumnCount() {
        return columns.size();
    }
}
