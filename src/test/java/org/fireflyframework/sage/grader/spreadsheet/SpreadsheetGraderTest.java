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

import org.fireflyframework.sage.dataset.DatasetLoader;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.dataset.ValueKind;
import org.fireflyframework.sage.exception.ConfigurationException;
import org.fireflyframework.sage.exception.NoActiveUnitException;
import org.fireflyframework.sage.exception.NoMetricsConfiguredException;
import org.fireflyframework.sage.exception.NotConnectedException;
import org.fireflyframework.sage.exception.SourceConnectionException;
import org.fireflyframework.sage.grader.GradeReport;
import org.fireflyframework.sage.grader.GraderSummary;
import org.fireflyframework.sage.metric.MetricStatus;
import org.fireflyframework.sage.metric.accuracy.AccuracyMetric;
import org.fireflyframework.sage.metric.completeness.CompletenessMetric;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SpreadsheetGrader}.
 */
@ExtendWith(MockitoExtension.class)
class SpreadsheetGraderTest {

    @Mock
    private DatasetLoader loader;

    @TempDir
    Path tempDir;

    private static TabularDataset customers() {
        return TabularDataset.builder()
                .column("id", 1, 2, 3, 4)
                .column("email", Arrays.asList("a@x.com", null, "c@x.com", "c@x.com"))
                .build();
    }

    private static TabularDataset orders() {
        return TabularDataset.builder()
                .column("order_id", 10, 11)
                .column("amount", 5.0, -1.0)
                .build();
    }

    private static SpreadsheetSource workbook() {
        Map<String, TabularDataset> sheets = new LinkedHashMap<>();
        sheets.put("customers", customers());
        sheets.put("orders", orders());
        return SpreadsheetSource.of(sheets);
    }

    @Test
    void connect_inMemorySheets_shouldActivateFirstSheet() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");

        // When
        boolean connected = grader.connect(workbook());

        // Then
        assertThat(connected).isTrue();
        assertThat(grader.isConnected()).isTrue();
        assertThat(grader.getAvailableUnits()).containsExactly("customers", "orders");
        assertThat(grader.getActiveUnit()).contains("customers");
        assertThat(grader.getActiveData()).hasValueSatisfying(data -> assertThat(data.rowCount()).isEqualTo(4));
    }

    @Test
    void connect_singleDataset_shouldExposeDefaultSheet() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader();

        // When
        grader.connect(SpreadsheetSource.of(orders()));

        // Then
        assertThat(grader.getAvailableUnits()).containsExactly(SpreadsheetSource.DEFAULT_SHEET);
        assertThat(grader.getName()).startsWith("SpreadsheetGrader_").hasSize("SpreadsheetGrader_".length() + 8);
    }

    @Test
    void grade_activeSheet_shouldReportMetricsAndMetadata() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.addMetric("completeness", new CompletenessMetric());
        AccuracyMetric accuracy = new AccuracyMetric();
        accuracy.addRangeCheck("amount", 0, null);
        grader.addMetric("accuracy", accuracy);
        grader.connect(workbook());
        grader.setActiveUnit("orders");

        // When
        GradeReport report = grader.grade();

        // Then
        assertThat(report.getMetrics().keySet()).containsExactly("completeness", "accuracy");
        assertThat(report.getMetrics().get("completeness").getScore()).isEqualTo(1.0);
        assertThat(report.getMetrics().get("accuracy").getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(report.getMetadata().getSourceType()).isEqualTo(SpreadsheetGrader.SOURCE_TYPE);
        assertThat(report.getMetadata().getUnit()).isEqualTo("orders");
        assertThat(report.getMetadata().getRowCount()).isEqualTo(2);
        assertThat(report.getMetadata().getColumns()).containsExactly("order_id", "amount");
        assertThat(report.getMetadata().getSource())
                .contains(entry("activeSheet", "orders"), entry("sheetCount", 2), entry("filePath", null));
        assertThat(report.getMetadata().getEndTime()).isAfterOrEqualTo(report.getMetadata().getStartTime());
        assertThat(grader.getLastResult()).containsSame(report);
        assertThat(grader.getLastRunTime()).isPresent();
    }

    @Test
    void grade_namedSubset_shouldRunOnlyKnownMetrics() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.addMetric("completeness", new CompletenessMetric());
        grader.addMetric("accuracy", new AccuracyMetric());
        grader.connect(workbook());

        // When
        GradeReport report = grader.grade(List.of("accuracy", "unknown"));

        // Then
        assertThat(report.getMetrics().keySet()).containsExactly("accuracy");
        assertThatThrownBy(() -> grader.grade(List.of("unknown")))
                .isInstanceOf(NoMetricsConfiguredException.class)
                .hasMessage("None of the specified metrics are configured in grader 'crm'");
    }

    @Test
    void grade_preconditions_shouldBeCheckedInOrder() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");

        // When & Then
        assertThatThrownBy(grader::grade)
                .isInstanceOf(NotConnectedException.class)
                .hasMessage("No data source connected. Call connect() first.");

        grader.connect(SpreadsheetSource.of(Map.of()));
        assertThatThrownBy(grader::grade)
                .isInstanceOf(NoActiveUnitException.class)
                .hasMessage("No active unit selected. Call setActiveUnit() first.");

        grader.connect(workbook());
        assertThatThrownBy(grader::grade)
                .isInstanceOf(NoMetricsConfiguredException.class)
                .hasMessage("No metrics configured. Add metrics before grading.");
    }

    @Test
    void setActiveUnit_unknownSheet_shouldKeepCurrentSheet() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.connect(workbook());

        // When & Then
        assertThatThrownBy(() -> grader.setActiveUnit("invoices"))
                .isInstanceOf(NoActiveUnitException.class)
                .hasMessage("Worksheet 'invoices' does not exist");
        assertThat(grader.getActiveUnit()).contains("customers");
    }

    @Test
    void getColumnInfo_shouldProfileColumns() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.connect(workbook());

        // When
        SheetProfile profile = grader.getColumnInfo(null);

        // Then
        assertThat(profile.getSheetName()).isEqualTo("customers");
        assertThat(profile.getRowCount()).isEqualTo(4);
        ColumnProfile email = profile.getColumns().get("email");
        assertThat(email.getKind()).isEqualTo(ValueKind.TEXT);
        assertThat(email.getNullCount()).isEqualTo(1);
        assertThat(email.getDistinctCount()).isEqualTo(2);
        assertThat(email.getSampleValues()).containsExactly("a@x.com", "c@x.com", "c@x.com");
        assertThat(grader.getColumnInfo("orders").getColumns()).containsOnlyKeys("order_id", "amount");
    }

    @Test
    void connect_workbookFile_shouldLoadEverySheet() throws IOException {
        // Given
        Path file = Files.createFile(tempDir.resolve("crm.xlsx"));
        when(loader.listUnits(file)).thenReturn(List.of("customers", "orders"));
        when(loader.load(file, "customers")).thenReturn(customers());
        when(loader.load(file, "orders")).thenReturn(orders());
        SpreadsheetGrader grader = new SpreadsheetGrader("crm", loader);
        grader.addMetric("completeness", new CompletenessMetric());

        // When
        grader.connect(SpreadsheetSource.file(file));
        GradeReport report = grader.grade();

        // Then
        assertThat(grader.getAvailableUnits()).containsExactly("customers", "orders");
        assertThat(report.getMetadata().getSource()).containsEntry("filePath", file.toString());
        assertThat(report.getMetrics().get("completeness").getScore()).isCloseTo(0.875, within(1e-9));
        assertThat(report.getMetrics().get("completeness").getStatus()).isEqualTo(MetricStatus.PASSED);
    }

    @Test
    void connect_unreadableOrMissingFile_shouldThrowSourceConnectionException() throws IOException {
        // Given
        Path file = Files.createFile(tempDir.resolve("broken.xlsx"));
        when(loader.listUnits(any())).thenThrow(new IOException("unsupported format"));
        SpreadsheetGrader grader = new SpreadsheetGrader("crm", loader);

        // When & Then
        assertThatThrownBy(() -> grader.connect(SpreadsheetSource.file(file)))
                .isInstanceOf(SourceConnectionException.class)
                .hasMessageContaining("unsupported format");
        assertThatThrownBy(() -> grader.connect(SpreadsheetSource.file(tempDir.resolve("missing.xlsx"))))
                .isInstanceOf(SourceConnectionException.class)
                .hasMessageStartingWith("Spreadsheet file not found");
        assertThatThrownBy(() -> new SpreadsheetGrader().connect(SpreadsheetSource.file(file)))
                .isInstanceOf(SourceConnectionException.class);
        assertThat(grader.isConnected()).isFalse();
    }

    @Test
    void addMetric_duplicateName_shouldBeRejected() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.addMetric("completeness", new CompletenessMetric());

        // When & Then
        assertThatThrownBy(() -> grader.addMetric("completeness", new CompletenessMetric()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("A metric named 'completeness' already exists in grader 'crm'");
        grader.removeMetric("completeness");
        assertThat(grader.getAvailableMetrics()).isEmpty();
        assertThatThrownBy(() -> grader.removeMetric("completeness"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void getSummary_afterGrading_shouldReportAverageScore() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.addMetric("completeness", new CompletenessMetric());
        GraderSummary before = grader.getSummary();
        grader.connect(workbook());

        // When
        grader.grade();
        GraderSummary after = grader.getSummary();

        // Then
        assertThat(before.isConnected()).isFalse();
        assertThat(before.isHasResults()).isFalse();
        assertThat(before.getAvgScore()).isNull();
        assertThat(after.getType()).isEqualTo("SpreadsheetGrader");
        assertThat(after.getMetricsConfigured()).isEqualTo(1);
        assertThat(after.getMetricsRun()).isEqualTo(1);
        assertThat(after.getAvgScore()).isCloseTo(7.0 / 8.0, within(1e-9));
        assertThat(after.getLastRun()).isNotNull();
    }

    @Test
    void close_shouldDisconnect() {
        // Given
        SpreadsheetGrader grader = new SpreadsheetGrader("crm");
        grader.connect(workbook());

        // When
        grader.close();

        // Then
        assertThat(grader.isConnected()).isFalse();
        assertThat(grader.getActiveData()).isEmpty();
        assertThatThrownBy(grader::getAvailableUnits).isInstanceOf(NotConnectedException.class);
    }
}
