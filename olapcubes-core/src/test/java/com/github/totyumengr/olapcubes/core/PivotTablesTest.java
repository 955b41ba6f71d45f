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

import static com.github.totyumengr.olapcubes.core.ShiftFixtures.assertDecimal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * @author mengran
 *
 */
public class PivotTablesTest {
    
    private final PivotTables pivotTables = new PivotTables();
    
    private static Map<String, Object> row(String dept, String month, Object hours) {
        
        Map<String, Object> row = new HashMap<String, Object>();
        row.put("dept", dept);
        row.put("month", month);
        row.put("hours", hours);
        return row;
    }
    
    private static List<Map<String, Object>> rows() {
        return Arrays.asList(row("A", "Jan", 10), row("A", "Feb", 20), row("B", "Jan", 5), row("B", "Feb", 15));
    }
    
    @Test
    public void test_Pivot() {
        
        PivotTable pivot = pivotTables.pivot(rows(), Arrays.asList("dept"), Arrays.asList("month"), "hours", 
                AggregationKind.SUM);
        
        Map<String, Map<String, BigDecimal>> labelled = pivot.toLabelledMap();
        Assert.assertEquals(Arrays.asList("A", "B"), new ArrayList<String>(labelled.keySet()));
        Assert.assertEquals(Arrays.asList("Jan", "Feb"), new ArrayList<String>(labelled.get("A").keySet()));
        assertDecimal("10", labelled.get("A").get("Jan"));
        assertDecimal("20", labelled.get("A").get("Feb"));
        assertDecimal("5", labelled.get("B").get("Jan"));
        assertDecimal("15", labelled.get("B").get("Feb"));
        assertDecimal("15", pivot.cell(Arrays.<Object>asList("B"), Arrays.<Object>asList("Feb")));
    }
    
    @Test
    public void test_Pivot_EmptyCellsAbsent() {
        
        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>(rows());
        rows.add(row("C", "Mar", 7));
        rows.add(row("C", "Mar", 3));
        PivotTable pivot = pivotTables.pivot(rows, Arrays.asList("dept"), Arrays.asList("month"), "hours", 
                AggregationKind.MEAN);
        
        Assert.assertNull(pivot.cell(Arrays.<Object>asList("A"), Arrays.<Object>asList("Mar")));
        Assert.assertFalse(pivot.toLabelledMap().get("C").containsKey("Jan"));
        assertDecimal("5", pivot.cell(Arrays.<Object>asList("C"), Arrays.<Object>asList("Mar")));
    }
    
    @Test
    public void test_Pivot_TupleKeys() throws Exception {
        
        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        for (Map<String, Object> r : rows()) {
            Map<String, Object> copy = new HashMap<String, Object>(r);
            copy.put("year", 2025);
            rows.add(copy);
        }
        rows.get(0).put("year", 2025L);
        PivotTable pivot = pivotTables.pivot(rows, Arrays.asList("dept"), Arrays.asList("year", "month"), "hours", 
                AggregationKind.COUNT);
        
        Assert.assertEquals(2, pivot.toLabelledMap().get("A").size());
        assertDecimal("1", pivot.toLabelledMap().get("A").get("2025|Jan"));
        
        String json = new ObjectMapper().writeValueAsString(pivot);
        Assert.assertTrue(json, json.contains("\"2025|Feb\""));
        Assert.assertTrue(json, json.contains("\"row_keys\":[\"dept\"]"));
    }
    
    @Test
    public void test_DynamicAggregate() {
        
        Map<String, AggregationKind> measures = new LinkedHashMap<String, AggregationKind>();
        measures.put("hours", AggregationKind.SUM);
        DynamicAggregation aggregation = pivotTables.dynamicAggregate(rows(), Arrays.asList("dept"), measures);
        
        Assert.assertEquals(2, aggregation.getTotalGroups());
        DynamicAggregation.Group a = aggregation.getGroups().get(0);
        Assert.assertEquals("A", a.getKey().get("dept"));
        assertDecimal("30", a.getValues().get("hours"));
        assertDecimal("20", aggregation.getGroups().get(1).getValues().get("hours"));
    }
    
    @Test
    public void test_DynamicAggregate_NoGroupBy() {
        
        Map<String, AggregationKind> measures = new LinkedHashMap<String, AggregationKind>();
        measures.put("hours", AggregationKind.MAX);
        DynamicAggregation aggregation = pivotTables.dynamicAggregate(rows(), Collections.<String>emptyList(), measures);
        
        Assert.assertEquals(1, aggregation.getTotalGroups());
        Assert.assertTrue(aggregation.getGroups().get(0).getKey().isEmpty());
        assertDecimal("20", aggregation.getGroups().get(0).getValues().get("hours"));
    }
    
    @Test(expected = AggregationException.class)
    public void test_Pivot_NonNumeric() {
        pivotTables.pivot(rows(), Arrays.asList("dept"), Arrays.asList("hours"), "month", AggregationKind.SUM);
    }
}
