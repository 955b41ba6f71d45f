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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Cross tabulation and group-by over arbitrary rows, independent of any {@link Cube}. Numbers that are 
 * numerically equal fall into the same tuple.
 * 
 * @author mengran
 *
 */
public class PivotTables {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(PivotTables.class);
    
    /**
     * @param rows input rows
     * @param rowKeys columns forming row tuples, not empty
     * @param columnKeys columns forming column tuples, not empty
     * @param valueColumn column to aggregate
     * @param kind built-in aggregation kind
     * @return pivot table
     * @throws AggregationException when values can not be aggregated with kind
     */
    public PivotTable pivot(List<Map<String, Object>> rows, List<String> rowKeys, List<String> columnKeys, 
            String valueColumn, AggregationKind kind) {
        
        Assert.notNull(rows, "Rows can not null.");
        Assert.notEmpty(rowKeys, "Row keys can not empty.");
        Assert.notEmpty(columnKeys, "Column keys can not empty.");
        Assert.hasText(valueColumn, "Value column can not empty.");
        Assert.notNull(kind, "Aggregation kind can not null.");
        Aggregator aggregator = Aggregators.of(kind);
        
        Tuples rowTuples = new Tuples();
        Tuples columnTuples = new Tuples();
        Map<List<Object>, Map<List<Object>, List<Object>>> values = new LinkedHashMap<List<Object>, Map<List<Object>, List<Object>>>();
        for (Map<String, Object> row : rows) {
            List<Object> r = rowTuples.of(row, rowKeys);
            List<Object> c = columnTuples.of(row, columnKeys);
            values.computeIfAbsent(r, k -> new LinkedHashMap<List<Object>, List<Object>>())
                .computeIfAbsent(c, k -> new ArrayList<Object>()).add(row.get(valueColumn));
        }
        
        Map<List<Object>, Map<List<Object>, BigDecimal>> cells = new LinkedHashMap<List<Object>, Map<List<Object>, BigDecimal>>();
        for (Entry<List<Object>, Map<List<Object>, List<Object>>> r : values.entrySet()) {
            Map<List<Object>, BigDecimal> columns = new LinkedHashMap<List<Object>, BigDecimal>();
            for (Entry<List<Object>, List<Object>> c : r.getValue().entrySet()) {
                columns.put(c.getKey(), aggregator.aggregate(c.getValue()));
            }
            cells.put(r.getKey(), columns);
        }
        LOGGER.info("Pivot {} rows into {} x {} tuples, {} of {} by {}", rows.size(), cells.size(), 
            columnTuples.size(), kind.getCode(), valueColumn, rowKeys);
        return new PivotTable(new ArrayList<String>(rowKeys), new ArrayList<String>(columnKeys), valueColumn, kind, 
                cells);
    }
    
    /**
     * @param rows input rows
     * @param groupBy group by columns, empty gives exactly one group over all rows
     * @param measures column to built-in aggregation kind
     * @return groups in discovery order
     * @throws AggregationException when values can not be aggregated with kind
     */
    public DynamicAggregation dynamicAggregate(List<Map<String, Object>> rows, List<String> groupBy, 
            Map<String, AggregationKind> measures) {
        
        Assert.notNull(rows, "Rows can not null.");
        Assert.notNull(groupBy, "Group by columns can not null.");
        Assert.notEmpty(measures, "Measures can not empty.");
        Map<String, Aggregator> aggregators = new LinkedHashMap<String, Aggregator>();
        for (Entry<String, AggregationKind> m : measures.entrySet()) {
            aggregators.put(m.getKey(), Aggregators.of(m.getValue()));
        }
        
        Tuples tuples = new Tuples();
        Map<List<Object>, List<Map<String, Object>>> members = new LinkedHashMap<List<Object>, List<Map<String, Object>>>();
        if (groupBy.isEmpty()) {
            members.put(new ArrayList<Object>(), rows);
        } else {
            for (Map<String, Object> row : rows) {
                members.computeIfAbsent(tuples.of(row, groupBy), k -> new ArrayList<Map<String, Object>>()).add(row);
            }
        }
        
        List<DynamicAggregation.Group> groups = new ArrayList<DynamicAggregation.Group>(members.size());
        for (Entry<List<Object>, List<Map<String, Object>>> e : members.entrySet()) {
            Map<String, Object> key = new LinkedHashMap<String, Object>();
            for (int i = 0; i < groupBy.size(); i++) {
                key.put(groupBy.get(i), e.getKey().get(i));
            }
            Map<String, BigDecimal> aggregated = new LinkedHashMap<String, BigDecimal>();
            for (Entry<String, Aggregator> a : aggregators.entrySet()) {
                List<Object> values = new ArrayList<Object>(e.getValue().size());
                for (Map<String, Object> row : e.getValue()) {
                    values.add(row.get(a.getKey()));
                }
                aggregated.put(a.getKey(), a.getValue().aggregate(values));
            }
            groups.add(new DynamicAggregation.Group(key, aggregated));
        }
        LOGGER.info("Aggregate {} rows by {} into {} groups.", rows.size(), groupBy, groups.size());
        return new DynamicAggregation(new ArrayList<String>(groupBy), measures, groups);
    }
    
    /**
     * Canonical tuples, the first seen raw values represent numerically equal ones.
     */
    private static final class Tuples {
        
        private final Map<List<Object>, List<Object>> canonical = new LinkedHashMap<List<Object>, List<Object>>();
        
        private List<Object> of(Map<String, Object> row, List<String> columns) {
            
            List<Object> raw = new ArrayList<Object>(columns.size());
            List<Object> identity = new ArrayList<Object>(columns.size());
            for (String c : columns) {
                Object v = row.get(c);
                raw.add(v);
                identity.add(FilterValue.normalize(v));
            }
            return canonical.computeIfAbsent(identity, k -> raw);
        }
        
        private int size() {
            return canonical.size();
        }
    }
}
