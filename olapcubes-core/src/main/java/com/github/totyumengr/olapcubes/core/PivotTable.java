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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@link PivotTables#pivot(List, List, List, String, AggregationKind)}. Row tuple to column tuple to 
 * aggregated value, both levels in discovery order. A combination without rows has no cell.
 * 
 * @author mengran
 *
 */
public final class PivotTable {
    
    static final String LABEL_DELIMITER = "|";
    
    private final List<String> rowKeys;
    private final List<String> columnKeys;
    private final String valueColumn;
    private final AggregationKind aggregation;
    private final Map<List<Object>, Map<List<Object>, BigDecimal>> cells;
    
    PivotTable(List<String> rowKeys, List<String> columnKeys, String valueColumn, AggregationKind aggregation, 
            Map<List<Object>, Map<List<Object>, BigDecimal>> cells) {
        this.rowKeys = Collections.unmodifiableList(rowKeys);
        this.columnKeys = Collections.unmodifiableList(columnKeys);
        this.valueColumn = valueColumn;
        this.aggregation = aggregation;
        Map<List<Object>, Map<List<Object>, BigDecimal>> copy = new LinkedHashMap<List<Object>, Map<List<Object>, BigDecimal>>();
        for (Entry<List<Object>, Map<List<Object>, BigDecimal>> e : cells.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        this.cells = Collections.unmodifiableMap(copy);
    }
    
    /**
     * @param row row tuple
     * @param column column tuple
     * @return aggregated value, <code>null</code> when no row falls in the cell
     */
    public BigDecimal cell(List<Object> row, List<Object> column) {
        
        Map<List<Object>, BigDecimal> r = cells.get(row);
        return r == null ? null : r.get(column);
    }
    
    /**
     * @return cells with tuples rendered as labels, members joined by <code>|</code>
     */
    @JsonProperty("cells")
    public Map<String, Map<String, BigDecimal>> toLabelledMap() {
        
        Map<String, Map<String, BigDecimal>> labelled = new LinkedHashMap<String, Map<String, BigDecimal>>();
        for (Entry<List<Object>, Map<List<Object>, BigDecimal>> r : cells.entrySet()) {
            Map<String, BigDecimal> columns = new LinkedHashMap<String, BigDecimal>();
            for (Entry<List<Object>, BigDecimal> c : r.getValue().entrySet()) {
                columns.put(label(c.getKey()), c.getValue());
            }
            labelled.put(label(r.getKey()), columns);
        }
        return labelled;
    }
    
    private static String label(List<Object> tuple) {
        return StringUtils.collectionToDelimitedString(tuple, LABEL_DELIMITER);
    }
    
    @JsonIgnore
    public Map<List<Object>, Map<List<Object>, BigDecimal>> getCells() {
        return cells;
    }
    
    @JsonProperty("row_keys")
    public List<String> getRowKeys() {
        return rowKeys;
    }

    @JsonProperty("column_keys")
    public List<String> getColumnKeys() {
        return columnKeys;
    }

    @JsonProperty("value_column")
    public String getValueColumn() {
        return valueColumn;
    }

    public AggregationKind getAggregation() {
        return aggregation;
    }

    @Override
    public String toString() {
        return "PivotTable [rowKeys=" + rowKeys + ", columnKeys=" + columnKeys + ", valueColumn=" + valueColumn 
                + ", aggregation=" + aggregation + ", rows=" + cells.size() + "]";
    }
}
