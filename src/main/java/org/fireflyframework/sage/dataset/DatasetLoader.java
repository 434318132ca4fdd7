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

package org.fireflyframework.sage.dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for the collaborators that physically read spreadsheet workbooks or other
 * files into {@link TabularDataset}s.
 *
 * <p>Implementations live outside the core; the spreadsheet grader only needs to
 * enumerate the units of a file and load each of them.</p>
 */
public interface DatasetLoader {

    /**
     * Lists the addressable units (sheets) of the given file, in file order.
     *
     * @param path the file to inspect
     * @return the unit names
     * @throws IOException if the file is missing or its format is unsupported
     */
    List<String> listUnits(Path path) throws IOException;

    /**
     * Loads one unit of the given file.
     *
     * @param path the file to read
     * @param unit the sheet to load
     * @return the dataset
     * @throws IOException if the file is missing or its format is unsupported
     */
    TabularDataset load(Path path, String unit) throws IOException;
}
