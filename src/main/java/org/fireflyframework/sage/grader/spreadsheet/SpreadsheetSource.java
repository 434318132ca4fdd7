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

import org.fireflyframework.sage.dataset.TabularDataset;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a {@link SpreadsheetGrader} can connect to: a single in-memory dataset, an
 * ordered set of named in-memory sheets, or a workbook file.
 */
public final class SpreadsheetSource {

    public static final String DEFAULT_SHEET = "Sheet1";

    private final Path path;
    private final Map<String, TabularDataset> sheets;

    private SpreadsheetSource(Path path, Map<String, TabularDataset> sheets) {
        this.path = path;
        this.sheets = sheets;
    }

    /**
     * Wraps a single dataset as a workbook with one sheet named {@value #DEFAULT_SHEET}.
     *
     * @param dataset the dataset
     * @return the source
     */
    public static SpreadsheetSource of(TabularDataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        Map<String, TabularDataset> sheets = new LinkedHashMap<>();
        sheets.put(DEFAULT_SHEET, dataset);
        return new SpreadsheetSource(null, Collections.unmodifiableMap(sheets));
    }

    /**
     * Wraps named datasets; iteration order of the map is the sheet order.
     *
     * @param sheets the datasets keyed by sheet name
     * @return the source
     */
    public static SpreadsheetSource of(Map<String, TabularDataset> sheets) {
        Objects.requireNonNull(sheets, "sheets");
        return new SpreadsheetSource(null, Collections.unmodifiableMap(new LinkedHashMap<>(sheets)));
    }

    /**
     * Refers to a workbook file, read through the grader's
     * {@link org.fireflyframework.sage.dataset.DatasetLoader}.
     *
     * @param path the workbook path
     * @return the source
     */
    public static SpreadsheetSource file(Path path) {
        return new SpreadsheetSource(Objects.requireNonNull(path, "path"), null);
    }

    public boolean isFile() {
        return path != null;
    }

    public Path getPath() {
        return path;
    }

    public Map<String, TabularDataset> getSheets() {
        return sheets;
    }

    @Override
    public String toString() {
        return isFile() ? "SpreadsheetSource(" + path + ")" : "SpreadsheetSource(" + sheets.keySet() + ")";
    }
}
