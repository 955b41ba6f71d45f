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

import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * @author mengran
 *
 */
public class MeasureTest {
    
    @Test
    public void test_SourceColumn() {
        
        Map<String, Object> row = new HashMap<String, Object>();
        row.put("work_hours", 8);
        row.put("total_hours", 9);
        
        Assert.assertEquals(9, Measure.builder("total_hours", AggregationKind.SUM).build().valueOf(row));
        Assert.assertEquals(8, Measure.builder("total_hours", AggregationKind.SUM).sourceColumn("work_hours").build()
                .valueOf(row));
    }
    
    @Test
    public void test_Formula() {
        
        Map<String, Object> row = new HashMap<String, Object>();
        row.put("work_hours", 8);
        row.put("overtime_hours", 2);
        Measure paid = Measure.builder("paid_hours", AggregationKind.SUM).formula("work_hours + overtime_hours * 1.5").build();
        
        Assert.assertNull(paid.getSourceColumn());
        Assert.assertEquals(11.0d, ((Number) paid.valueOf(row)).doubleValue(), 0d);
    }
    
    @Test(expected = AggregationException.class)
    public void test_Formula_MissingColumn() {
        
        Measure paid = Measure.builder("paid_hours", AggregationKind.SUM).formula("work_hours * rate").build();
        paid.valueOf(new HashMap<String, Object>());
    }
    
    @Test
    public void test_Formula_TypeReference_Rejected() {
        
        Measure m = Measure.builder("m", AggregationKind.SUM)
                .formula("T(java.lang.System).setProperty('olapcubes.formula.escape', 'yes')").build();
        try {
            m.valueOf(new HashMap<String, Object>());
            Assert.fail();
        } catch (AggregationException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("Can not evaluate formula"));
        }
        Assert.assertNull(System.getProperty("olapcubes.formula.escape"));
    }
    
    @Test(expected = AggregationException.class)
    public void test_Formula_MethodCall_Rejected() {
        
        Map<String, Object> row = new HashMap<String, Object>();
        row.put("work_hours", "8");
        Measure.builder("m", AggregationKind.SUM).formula("work_hours.concat('0')").build().valueOf(row);
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void test_Custom_NeedsFunction() {
        Measure.builder("m", AggregationKind.CUSTOM).build();
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void test_Percentile_Range() {
        Measure.builder("m", AggregationKind.PERCENTILE).percentile(101).build();
    }
    
    @Test
    public void test_Json() throws Exception {
        
        ObjectMapper objectMapper = new ObjectMapper();
        Measure m = objectMapper.readValue("{\"name\":\"avg_hours\",\"aggregation\":\"avg\","
                + "\"source_column\":\"work_hours\",\"unit\":\"hours\"}", Measure.class);
        
        Assert.assertEquals(AggregationKind.MEAN, m.getAggregation());
        Assert.assertEquals(Aggregators.DEFAULT_PERCENTILE, m.getPercentileRank(), 0d);
        String json = objectMapper.writeValueAsString(m);
        Assert.assertTrue(json, json.contains("\"aggregation\":\"mean\""));
        Assert.assertTrue(json, json.contains("\"source_column\":\"work_hours\""));
    }
}
