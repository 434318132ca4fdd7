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

import javax.sql.DataSource;
import java.util.Objects;

/**
 * What a {@link DatabaseGrader} can connect to: a JDBC URL with optional
 * credentials, or an existing {@link DataSource}.
 */
public final class DatabaseSource {

    private final String url;
    private final String username;
    private final String password;
    private final DataSource dataSource;

    private DatabaseSource(String url, String username, String password, DataSource dataSource) {
        this.url = url;
        this.username = username;
        this.password = password;
        this.dataSource = dataSource;
    }

    public static DatabaseSource url(String url) {
        return url(url, null, null);
    }

    public static DatabaseSource url(String url, String username, String password) {
        return new DatabaseSource(Objects.requireNonNull(url, "url"), username, password, null);
    }

    public static DatabaseSource of(DataSource dataSource) {
        return new DatabaseSource(null, null, null, Objects.requireNonNull(dataSource, "dataSource"));
    }

    public boolean hasDataSource() {
        return dataSource != null;
    }

    public String getUrl() {
        return url;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * @return the URL with credentials masked, or a description of the data source
     */
    public String describe() {
        return hasDataSource() ? "provided DataSource" : ConnectionStrings.mask(url);
    }

    @Override
    public String toString() {
        return "DatabaseSource(" + describe() + ")";
    }
}
