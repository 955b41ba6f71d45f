/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.olapcubes.core;

import java.util.List;
import java.util.Map;

/**
 * External supplier of raw tabular rows, the only boundary {@link QueryExecutor} crosses. Treated as opaque, 
 * read-only and potentially slow.
 * 
 * @author mengran
 *
 */
public interface RowSource {
    
    /**
     * @param cubeName cube to fetch
     * @param dimensionColumns dimension source columns (include level columns)
     * @param measureColumns measure source columns
     * @return rows, each maps every requested column name to a scalar value
     * @throws DataAccessException when fetching failed
     */
    List<Map<String, Object>> fetchRows(String cubeName, List<String> dimensionColumns, List<String> measureColumns);
}
