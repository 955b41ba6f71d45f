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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StopWatch;

/**
 * @author mengran
 *
 */
public class FactTableTest {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(FactTableTest.class);
    
    private static FactTable factTable;
    
    @BeforeClass
    public static void prepare() {
        
        factTable = FactTable.builder("FactTableTest").addDimColumns(Arrays.asList("region", "department"))
                .addRecords(ShiftFixtures.shiftRows()).done();
        LOGGER.info("Prepared {}", factTable);
    }
    
    private static Map<String, FilterValue> filter(String column, FilterValue value) {
        return Collections.singletonMap(column, value);
    }
    
    @Test
    public void test_Filter_Or() {
        
        RoaringBitmap ids = factTable.filter(filter("region", FilterValue.set("East", "West", "Nowhere")));
        Assert.assertEquals(RoaringBitmap.bitmapOf(0, 1, 2, 3, 6), ids);
        
        List<Map<String, Object>> selected = factTable.select(ids);
        Assert.assertEquals(5, selected.size());
        Assert.assertEquals("2025-04-01", selected.get(4).get("date"));
    }
    
    @Test
    public void test_Filter_And() {
        
        Map<String, FilterValue> filters = new HashMap<String, FilterValue>();
        filters.put("region", FilterValue.set("East", "North"));
        filters.put("department", FilterValue.scalar("ER"));
        
        Assert.assertEquals(RoaringBitmap.bitmapOf(0, 1, 4), factTable.filter(filters));
        Assert.assertTrue(factTable.filter(filter("department", FilterValue.scalar("LAB"))).isEmpty());
    }
    
    @Test
    public void test_Filter_None() {
        
        Assert.assertEquals(factTable.size(), factTable.filter(null).getCardinality());
        Assert.assertEquals(8, factTable.filter(Collections.<String, FilterValue>emptyMap()).getCardinality());
    }
    
    @Test
    public void test_Filter_NumericValues() {
        
        FactTable numbers = FactTable.builder("numbers").addDimColumns(Arrays.asList("level"))
                .addRecord(Collections.<String, Object>singletonMap("level", 3))
                .addRecord(Collections.<String, Object>singletonMap("level", 3L))
                .addRecord(Collections.<String, Object>singletonMap("level", "3")).done();
        
        Assert.assertEquals(RoaringBitmap.bitmapOf(0, 1), numbers.filter(filter("level", FilterValue.scalar(3.0d))));
    }
    
    @Test
    public void test_Filter_TemporalValues() {
        
        FactTable shifts = FactTable.builder("shifts").addDimColumns(Arrays.asList("shift_start"))
                .addRecord(Collections.<String, Object>singletonMap("shift_start", 
                    java.sql.Timestamp.valueOf("2025-01-06 08:00:00")))
                .addRecord(Collections.<String, Object>singletonMap("shift_start", 
                    LocalDateTime.of(2025, 1, 6, 8, 0)))
                .addRecord(Collections.<String, Object>singletonMap("shift_start", "2025-01-06T08:00"))
                .addRecord(Collections.<String, Object>singletonMap("shift_start", 
                    java.sql.Timestamp.valueOf("2025-01-06 16:00:00")))
                .addRecord(Collections.<String, Object>singletonMap("shift_start", java.sql.Date.valueOf("2025-01-06")))
                .done();
        
        Assert.assertEquals(RoaringBitmap.bitmapOf(0, 1, 2), 
            shifts.filter(filter("shift_start", FilterValue.scalar("2025-01-06 08:00:00"))));
        Assert.assertEquals(RoaringBitmap.bitmapOf(4), 
            shifts.filter(filter("shift_start", FilterValue.scalar(LocalDate.of(2025, 1, 6)))));
        Assert.assertEquals(RoaringBitmap.bitmapOf(0, 1, 2, 3), 
            shifts.filter(filter("shift_start", FilterValue.set("2025-01-06 08:00:00", "2025-01-06T16:00:00"))));
        Assert.assertTrue(shifts.filter(filter("shift_start", FilterValue.scalar("2025-13-45"))).isEmpty());
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void test_Filter_NotIndexed() {
        factTable.filter(filter("staff", FilterValue.scalar("s1")));
    }
    
    @Test(expected = IllegalStateException.class)
    public void test_Builder_DimColumnsAfterRecords() {
        FactTable.builder("late").addRecord(new HashMap<String, Object>()).addDimColumns(Arrays.asList("region"));
    }
    
    @Test
    public void test_Filter_Large() {
        
        FactTable.FactTableBuilder builder = FactTable.builder("large").addDimColumns(Arrays.asList("bucket"));
        for (int i = 0; i < 100000; i++) {
            builder.addRecord(Collections.<String, Object>singletonMap("bucket", i % 100));
        }
        FactTable large = builder.done();
        
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        RoaringBitmap ids = large.filter(filter("bucket", FilterValue.set(1, 2, 3)));
        stopWatch.stop();
        LOGGER.info("Filter {} records using {} ms", large.size(), stopWatch.getTotalTimeMillis());
        
        Assert.assertEquals(3000, ids.getCardinality());
    }
}
