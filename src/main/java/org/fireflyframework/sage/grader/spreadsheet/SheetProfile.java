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

package org.fireflyframework.sage.grader.spreadsheet;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Column overview of one sheet, as returned by {@link SpreadsheetGrader#getColumnInfo(String)}.
 */
@Data
@Builder
public class SheetProfile {

    private final String sheetName;
    private final int rowCount;
    private final int columnCount;
    private final Map<String, ColumnProfile> columns;
}
