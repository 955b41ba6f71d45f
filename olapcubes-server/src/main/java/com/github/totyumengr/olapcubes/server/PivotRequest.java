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
package com.github.totyumengr.olapcubes.server;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.totyumengr.olapcubes.core.AggregationKind;

/**
 * Body of <code>/pivot</code>.
 * @author mengran
 *
 */
public class PivotRequest {
    
    private final List<Map<String, Object>> rows;
    private final List<String> rowKeys;
    private final List<String> columnKeys;
    private final String valueColumn;
    private final AggregationKind aggregation;
    
    @JsonCreator
    public PivotRequest(@JsonProperty("rows") List<Map<String, Object>> rows, 
            @JsonProperty("row_keys") List<String> rowKeys, @JsonProperty("column_keys") List<String> columnKeys, 
            @JsonProperty("value_column") String valueColumn, @JsonProperty("aggregation") AggregationKind aggregation) {
        this.rows = rows;
        this.rowKeys = rowKeys;
        this.columnKeys = columnKeys;
        this.valueColumn = valueColumn;
        this.aggregation = aggregation == null ? AggregationKind.SUM : aggregation;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public List<String> getRowKeys() {
        return rowKeys;
    }

    public List<String> getColumnKeys() {
        return columnKeys;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public AggregationKind getAggregation() {
        return aggregation;
    }
}
