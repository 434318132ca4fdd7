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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.sage.dataset.Column;
import org.fireflyframework.sage.dataset.TabularDataset;
import org.fireflyframework.sage.dataset.ValueKind;
import org.fireflyframework.sage.exception.NoActiveUnitException;
import org.fireflyframework.sage.exception.SageException;
import org.fireflyframework.sage.exception.SourceConnectionException;
import org.fireflyframework.sage.grader.GradeMetadata;
import org.fireflyframework.sage.grader.GradeReport;
import org.fireflyframework.sage.grader.Grader;
import org.fireflyframework.sage.grader.GraderState;
import org.fireflyframework.sage.grader.GraderSummary;
import org.fireflyframework.sage.metric.Metric;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Grades tables of a relational database over JDBC.
 *
 * <p>{@link #connect(DatabaseSource)} opens a single connection, wrapped in a
 * {@link SingleConnectionDataSource} and used through a {@link JdbcTemplate}, and
 * selects the default schema: {@code public} for PostgreSQL, the database name for
 * MySQL, the connection's current schema otherwise. The connection is released by
 * {@link #close()} and on every failed connection attempt. Units are the tables of
 * the active schema.</p>
 *
 * <p>Connection URLs are only ever logged with credentials masked.</p>
 */
@Slf4j
public class DatabaseGrader implements Grader<DatabaseSource> {

    public static final String SOURCE_TYPE = "database";

    private final GraderState state;
    private SingleConnectionDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private String dbType;
    private String activeSchema;
    private String quoteString;

    public DatabaseGrader() {
        this(null);
    }

    public DatabaseGrader(String name) {
        this.state = new GraderState(DatabaseGrader.class, name);
    }

    @Override
    public String getName() {
        return state.getName();
    }

    @Override
    public synchronized boolean connect(DatabaseSource source) {
        state.reset();
        release();
        dbType = null;
        activeSchema = null;
        if (source == null) {
            throw new SourceConnectionException("Source must be a JDBC URL or a DataSource");
        }

        log.info("Connecting to database: {}", source.describe());
        Connection connection = null;
        try {
            connection = open(source);
            dataSource = new SingleConnectionDataSource(connection, true);
            jdbcTemplate = new JdbcTemplate(dataSource);
            DatabaseMetaData metaData = connection.getMetaData();
            dbType = metaData.getDatabaseProductName().toLowerCase(Locale.ROOT);
            quoteString = metaData.getIdentifierQuoteString();
            activeSchema = defaultSchema(connection);
        } catch (SQLException | DataAccessException e) {
            // driver messages may echo the raw URL
            String reason = ConnectionStrings.mask(e.getMessage());
            log.error("Failed to connect to database {}: {}", source.describe(), reason);
            if (dataSource == null) {
                closeQuietly(connection);
            }
            release();
            throw new SourceConnectionException("Could not connect to database " + source.describe()
                    + ": " + reason, e);
        }
        state.markConnected();
        log.info("Connected to {} database, active schema: {}", dbType, activeSchema);
        return true;
    }

    private static Connection open(DatabaseSource source) throws SQLException {
        if (source.hasDataSource()) {
            return source.getDataSource().getConnection();
        }
        if (source.getUsername() != null) {
            return DriverManager.getConnection(source.getUrl(), source.getUsername(), source.getPassword());
        }
        return DriverManager.getConnection(source.getUrl());
    }

    private String defaultSchema(Connection connection) throws SQLException {
        if (dbType.contains("postgres")) {
            return "public";
        }
        if (isMySql()) {
            return connection.getCatalog();
        }
        return connection.getSchema();
    }

    private boolean isMySql() {
        return dbType != null && (dbType.contains("mysql") || dbType.contains("mariadb"));
    }

    @Override
    public boolean isConnected() {
        return state.isConnected();
    }

    public Optional<String> getDbType() {
        return Optional.ofNullable(dbType);
    }

    public Optional<String> getActiveSchema() {
        return Optional.ofNullable(activeSchema);
    }

    /**
     * Lists the schemas of the database, or its catalogs on MySQL.
     *
     * @return the schema names
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     */
    public synchronized List<String> getAvailableSchemas() {
        state.requireConnected();
        return jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            List<String> schemas = new ArrayList<>();
            try (ResultSet rs = isMySql() ? metaData.getCatalogs() : metaData.getSchemas()) {
                while (rs.next()) {
                    schemas.add(rs.getString(1));
                }
            }
            return schemas;
        });
    }

    /**
     * Switches the active schema and clears the active table.
     *
     * @param schema the schema name
     * @return {@code true} once selected
     * @throws NoActiveUnitException if the schema does not exist
     */
    public synchronized boolean setActiveSchema(String schema) {
        if (!getAvailableSchemas().contains(schema)) {
            throw new NoActiveUnitException("Schema '" + schema + "' does not exist");
        }
        activeSchema = schema;
        state.setActiveUnit(null);
        log.debug("Set active schema to: {}", schema);
        return true;
    }

    /**
     * Lists the tables of the active schema.
     */
    @Override
    public synchronized List<String> getAvailableUnits() {
        state.requireConnected();
        return tables(activeSchema);
    }

    private List<String> tables(String schema) {
        return jdbcTemplate.execute((ConnectionCallback<List<String>>) connection -> {
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = connection.getMetaData().getTables(catalog(schema), schemaPattern(schema), "%", null)) {
                while (rs.next()) {
                    String type = rs.getString("TABLE_TYPE");
                    if (type != null && type.toUpperCase(Locale.ROOT).contains("TABLE")
                            && !type.toUpperCase(Locale.ROOT).contains("SYSTEM")) {
                        tables.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            return tables;
        });
    }

    @Override
    public synchronized boolean setActiveUnit(String table) {
        state.requireConnected();
        if (!tables(activeSchema).contains(table)) {
            throw new NoActiveUnitException("Table '" + table + "' does not exist in schema '" + activeSchema + "'");
        }
        state.setActiveUnit(table);
        log.debug("Set active table to: {}.{}", activeSchema, table);
        return true;
    }

    @Override
    public Optional<String> getActiveUnit() {
        return state.getActiveUnit();
    }

    /**
     * Describes a table: column types, nullability, defaults, primary key membership
     * and row count. Failures of the primary key lookup or of the count query are
     * logged and leave those fields unset.
     *
     * @param table the table, or {@code null} for the active one
     * @return the table structure
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     * @throws NoActiveUnitException if no table is given and none is active
     */
    public synchronized TableInfo getTableInfo(String table) {
        state.requireConnected();
        String target = table != null ? table : state.requireActiveUnit();

        Map<String, ColumnInfo> columns = jdbcTemplate.execute((ConnectionCallback<Map<String, ColumnInfo>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            Set<String> primaryKeys = primaryKeys(metaData, target);
            Map<String, ColumnInfo> result = new LinkedHashMap<>();
            try (ResultSet rs = metaData.getColumns(catalog(activeSchema), schemaPattern(activeSchema), target, "%")) {
                while (rs.next()) {
                    String column = rs.getString("COLUMN_NAME");
                    result.put(column, ColumnInfo.builder()
                            .type(rs.getString("TYPE_NAME"))
                            .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                            .defaultValue(rs.getString("COLUMN_DEF"))
                            .primaryKey(primaryKeys.contains(column))
                            .build());
                }
            }
            return result;
        });

        return TableInfo.builder()
                .schema(activeSchema)
                .table(target)
                .rowCount(countRows(target))
                .columns(columns)
                .build();
    }

    private Set<String> primaryKeys(DatabaseMetaData metaData, String table) {
        Set<String> keys = new LinkedHashSet<>();
        try (ResultSet rs = metaData.getPrimaryKeys(catalog(activeSchema), schemaPattern(activeSchema), table)) {
            while (rs.next()) {
                keys.add(rs.getString("COLUMN_NAME"));
            }
        } catch (SQLException e) {
            log.warn("Could not get primary key information for table '{}': {}", table, e.getMessage());
        }
        return keys;
    }

    private Long countRows(String table) {
        try {
            return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + qualify(table), Long.class);
        } catch (DataAccessException e) {
            log.warn("Could not get row count for table '{}': {}", table, e.getMessage());
            return null;
        }
    }

    /**
     * Runs a query and materializes its result.
     *
     * @param sql the query
     * @return the rows as a dataset, columns in select-list order
     * @throws org.fireflyframework.sage.exception.NotConnectedException if not connected
     * @throws DataAccessException if the query fails
     */
    public synchronized TabularDataset executeQuery(String sql) {
        state.requireConnected();
        try {
            return jdbcTemplate.query(sql, (ResultSetExtractor<TabularDataset>) DatabaseGrader::toDataset);
        } catch (DataAccessException e) {
            log.error("Error executing query: {}", e.getMessage());
            throw e;
        }
    }

    private static TabularDataset toDataset(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int count = metaData.getColumnCount();
        List<String> names = new ArrayList<>(count);
        List<ValueKind> kinds = new ArrayList<>(count);
        List<List<Object>> values = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add(metaData.getColumnLabel(i));
            kinds.add(kindOf(metaData.getColumnType(i)));
            values.add(new ArrayList<>());
        }
        while (rs.next()) {
            for (int i = 1; i <= count; i++) {
                values.get(i - 1).add(readValue(rs, i, kinds.get(i - 1)));
            }
        }
        TabularDataset.Builder builder = TabularDataset.builder();
        for (int i = 0; i < count; i++) {
            builder.column(new Column(names.get(i), kinds.get(i), values.get(i)));
        }
        return builder.build();
    }

    static ValueKind kindOf(int sqlType) {
        switch (sqlType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return ValueKind.BOOLEAN;
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
            case Types.NUMERIC:
            case Types.DECIMAL:
                return ValueKind.NUMERIC;
            case Types.DATE:
            case Types.TIME:
            case Types.TIMESTAMP:
            case Types.TIME_WITH_TIMEZONE:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return ValueKind.TEMPORAL;
            default:
                return ValueKind.TEXT;
        }
    }

    private static Object readValue(ResultSet rs, int index, ValueKind kind) throws SQLException {
        Object value = rs.getObject(index);
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime();
        }
        if (kind == ValueKind.TEXT && value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (kind == ValueKind.TEXT && !(value instanceof CharSequence)) {
            return String.valueOf(value);
        }
        return value;
    }

    @Override
    public synchronized GradeReport grade(Collection<String> metricNames) {
        Map<String, Metric> selected = state.prepare(metricNames);
        String table = state.requireActiveUnit();

        log.info("Loading data from table {}", activeSchema != null ? activeSchema + "." + table : table);
        TabularDataset data;
        try {
            data = executeQuery("SELECT * FROM " + qualify(table));
        } catch (DataAccessException e) {
            throw new SageException("Could not load data from table '" + table + "': " + e.getMessage(), e);
        }
        log.debug("Loaded {} rows from table {}", data.rowCount(), table);

        Set<String> primaryKeys = jdbcTemplate.execute(
                (ConnectionCallback<Set<String>>) connection -> primaryKeys(connection.getMetaData(), table));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("dbType", dbType);
        source.put("schema", activeSchema);
        source.put("table", table);
        source.put("primaryKeys", List.copyOf(primaryKeys));

        return state.run(selected, data, GradeMetadata.builder()
                .sourceType(SOURCE_TYPE)
                .source(source));
    }

    private String catalog(String schema) {
        return isMySql() ? schema : null;
    }

    private String schemaPattern(String schema) {
        return isMySql() ? null : schema;
    }

    private String qualify(String table) {
        return activeSchema != null ? quote(activeSchema) + "." + quote(table) : quote(table);
    }

    private String quote(String identifier) {
        if (quoteString == null || quoteString.isBlank()) {
            return identifier;
        }
        return quoteString + identifier.replace(quoteString, quoteString + quoteString) + quoteString;
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
        release();
        state.disconnect();
    }

    private void release() {
        if (dataSource != null) {
            dataSource.destroy();
            log.debug("Closed database connection of grader '{}'", state.getName());
        }
        dataSource = null;
        jdbcTemplate = null;
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Could not close connection after failed connect: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return state.toString();
    }
}
