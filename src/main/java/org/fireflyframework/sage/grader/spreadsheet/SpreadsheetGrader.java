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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.DatasetLoader;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.exception.NoActiveUnitException;
import org.fireflyframework.sage.exception.SourceConnectionException;
import org.fireflyframework.sage.grader.GradeMetadata;
import org.fireflyframework.sage.grader.GradeReport;
import org.fireflyframework.sage.grader.Grader;
import org.fireflyframework.sage.grader.GraderState;
import org.fireflyframework.sage.grader.GraderSummary;
import org.fireflyframework.sage.metric.Metric;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Grades the sheets of a workbook or of in-memory datasets.
 *
 * <p>All sheets are indexed when connecting and the first one becomes active.
 * Workbook files are read through the {@link DatasetLoader} supplied at
 * construction.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * try (SpreadsheetGrader grader = new SpreadsheetGrader("orders", loader)) {
 *     grader.addMetric("completeness", new CompletenessMetric());
 *     grader.connect(SpreadsheetSource.file(Path.of("orders.xlsx")));
 *     grader.setActiveUnit("2024");
 *     GradeReport report = grader.grade();
 * }
 * }</pre>
 */
@Slf4j
public class SpreadsheetGrader implements Grader<SpreadsheetSource> {

    public static final String SOURCE_TYPE = "spreadsheet";
    private static final int SAMPLE_SIZE = 5;

    private final GraderState state;
    private final DatasetLoader loader;
    private Map<String, TabularDataset> sheets = Map.of();
    private Path filePath;

    public SpreadsheetGrader() {
        this(null, null);
    }

    public SpreadsheetGrader(String name) {
        this(name, null);
    }

    /**
     * @param name   the grader name, or {@code null} for a generated one
     * @param loader reads workbook files, may be {@code null} when only in-memory
     *               sources are used
     */
    public SpreadsheetGrader(String name, DatasetLoader loader) {
        this.state = new GraderState(SpreadsheetGrader.class, name);
        this.loader = loader;
    }

    @Override
    public String getName() {
        return state.getName();
    }

    @Override
    public synchronized boolean connect(SpreadsheetSource source) {
        state.reset();
        sheets = Map.of();
        filePath = null;
        if (source == null) {
            throw new SourceConnectionException("Source must be a workbook path, a dataset or a map of datasets");
        }

        Map<String, TabularDataset> indexed = source.isFile() ? load(source.getPath()) : source.getSheets();
        sheets = indexed;
        filePath = source.getPath();
        state.setActiveUnit(indexed.isEmpty() ? null : indexed.keySet().iterator().next());
        state.markConnected();

        log.info("Connected to spreadsheet source with {} sheet(s)", indexed.size());
        indexed.forEach((sheet, data) ->
                log.debug("  Sheet '{}': {} rows, {} columns", sheet, data.rowCount(), data.columnCount()));
        return true;
    }

    private Map<String, TabularDataset> load(Path path) {
        if (loader == null) {
            throw new SourceConnectionException("No dataset loader configured to read " + path);
        }
        if (!Files.exists(path)) {
            log.error("Failed to connect to spreadsheet source: file not found: {}", path);
            throw new SourceConnectionException("Spreadsheet file not found: " + path);
        }
        log.info("Loading spreadsheet file: {}", path);
        try {
            Map<String, TabularDataset> loaded = new LinkedHashMap<>();
            for (String sheet : loader.listUnits(path)) {
                loaded.put(sheet, loader.load(path, sheet));
            }
            return loaded;
        } catch (IOException e) {
            log.error("Failed to connect to spreadsheet source {}: {}", path, e.getMessage(), e);
            throw new SourceConnectionException("Could not read spreadsheet " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return state.isConnected();
    }

    @Override
    public synchronized List<String> getAvailableUnits() {
        state.requireConnected();
        return List.copyOf(sheets.keySet());
    }

    @Override
    public synchronized boolean setActiveUnit(String sheet) {
        state.requireConnected();
        if (!sheets.containsKey(sheet)) {
            throw new NoActiveUnitException("Worksheet '" + sheet + "' does not exist");
        }
        state.setActiveUnit(sheet);
        log.debug("Set active sheet to: {}", sheet);
        return true;
    }

    @Override
    public Optional<String> getActiveUnit() {
        return state.getActiveUnit();
    }

    /**
     * Returns the data of the active sheet.
     *
     * @return the dataset, or empty when not connected or no sheet is active
     */
    public synchronized Optional<TabularDataset> getActiveData() {
        if (!state.isConnected()) {
            return Optional.empty();
        }
        return state.getActiveUnit().map(sheets::get);
    }

    /**
     * Profiles the columns of a sheet.
     *
     * @param sheet the sheet, or {@code null} for the active one
     * @return kind, null count, distinct count and up to five sample values per column
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     * @throws NoActiveUnitException if the sheet does not exist or none is active
     */
    public synchronized SheetProfile getColumnInfo(String sheet) {
        state.requireConnected();
        String target = sheet != null ? sheet : state.requireActiveUnit();
        TabularDataset data = sheets.get(target);
        if (data == null) {
            throw new NoActiveUnitException("Worksheet '" + target + "' does not exist");
        }
        Map<String, ColumnProfile> columns = new LinkedHashMap<>();
        for (Column column : data.getColumns()) {
            List<Object> present = column.presentValues();
            Set<Object> distinct = new HashSet<>(present);
            columns.put(column.getName(), ColumnProfile.builder()
                    .kind(column.getKind())
                    .nullCount(column.missingCount())
                    .distinctCount(distinct.size())
                    .sampleValues(List.copyOf(present.subList(0, Math.min(SAMPLE_SIZE, present.size()))))
                    .build());
        }
        return SheetProfile.builder()
                .sheetName(target)
                .rowCount(data.rowCount())
                .columnCount(data.columnCount())
                .columns(columns)
                .build();
    }

    @Override
    public synchronized GradeReport grade(Collection<String> metricNames) {
        Map<String, Metric> selected = state.prepare(metricNames);
        String sheet = state.requireActiveUnit();
        TabularDataset data = sheets.get(sheet);

        Map<String, Object> source = new LinkedHashMap<>();
        source.put("filePath", filePath != null ? filePath.toString() : null);
        source.put("activeSheet", sheet);
        source.put("sheetCount", sheets.size());

        log.info("Grading sheet '{}' with {} metric(s)", sheet, selected.size());
        return state.run(selected, data, GradeMetadata.builder()
                .sourceType(SOURCE_TYPE)
                .source(source));
    }

    @Override
    public void addMetric(String name, Metric metric) {
        state.getMetrics().add(name, metric);
    }

    @Override
    public void removeMetric(String name) {
        state.getMetrics().remove(name);
    }

    @Override
    public List<String> getAvailableMetrics() {
        return state.getMetrics().names();
    }

    @Override
    public Optional<GradeReport> getLastResult() {
        return state.getLastResult();
    }

    @Override
    public Optional<Instant> getLastRunTime() {
        return state.getLastRunTime();
    }

    @Override
    public GraderSummary getSummary() {
        return state.summary();
    }

    @Override
    public synchronized void close() {
        state.disconnect();
        sheets = Map.of();
        log.debug("Closed spreadsheet grader '{}'", state.getName());
    }

    @Override
    public String toString() {
        return state.toString();
    }
}
