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
 * Define supported calculation operations.
 * @author mengran
 *
 */
public interface Aggregations {

    /**
     * Calculation scale
     */
    int IND_SCALE = 8;
    
    /**
     * Aggregate measures of a cube grouped by selected dimensions. It equal to "SELECT {dims}, AGG({measures}) FROM 
     * {data source of cube} WHERE {dimension1 IN (a, b, c)} AND {dimension2 = d} GROUP BY {dims} ORDER BY 
     * {sort_by} DESC LIMIT {limit}", with drill path reshaping grouping levels.
     * @param query query to execute
     * @return result, never <code>null</code>, failures give a degraded result
     */
    AggregationResult execute(Query query);
    
    /**
     * Drill dimension down to a finer level and execute.
     * @param query current query
     * @param dimension dimension name
     * @param level target level
     * @return result of drilled query
     */
    AggregationResult drillDown(Query query, String dimension, String level);
    
    /**
     * Drill dimension up to a coarser level and execute.
     * @param query current query
     * @param dimension dimension name
     * @param level target level
     * @return result of drilled query
     */
    AggregationResult drillUp(Query query, String dimension, String level);
    
    /**
     * Cross tabulation of arbitrary rows, no cube needed.
     * @param rows input rows
     * @param rowKeys columns forming row tuples
     * @param columnKeys columns forming column tuples
     * @param valueColumn column to aggregate
     * @param kind aggregation kind
     * @return pivot table
     */
    PivotTable pivot(List<Map<String, Object>> rows, List<String> rowKeys, List<String> columnKeys, 
            String valueColumn, AggregationKind kind);
    
    /**
     * Group arbitrary rows by columns and aggregate, no cube needed. It equal to "SELECT {groupBy}, AGG({measures}) 
     * FROM {rows} GROUP BY {groupBy}".
     * @param rows input rows
     * @param groupBy group by columns, empty means one group of all rows
     * @param measures column to aggregation kind
     * @return grouped aggregation
     */
    DynamicAggregation dynamicAggregate(List<Map<String, Object>> rows, List<String> groupBy, 
            Map<String, AggregationKind> measures);
    
    /**
     * Whole multi-dimensional view of a cube, undrilled, unsorted and unlimited.
     * @param cubeName cube name
     * @param dimensions selected dimensions
     * @param measures selected measures
     * @return view
     */
    MultiDimensionalView view(String cubeName, List<String> dimensions, List<String> measures);
    
}
