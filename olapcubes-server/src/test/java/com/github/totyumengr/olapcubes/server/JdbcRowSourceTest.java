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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.AggregationKind;
import com.github.totyumengr.olapcubes.core.AggregationResult;
import com.github.totyumengr.olapcubes.core.Cube;
import com.github.totyumengr.olapcubes.core.CubeRegistry;
import com.github.totyumengr.olapcubes.core.DataAccessException;
import com.github.totyumengr.olapcubes.core.Dimension;
import com.github.totyumengr.olapcubes.core.Measure;
import com.github.totyumengr.olapcubes.core.OlapEngine;
import com.github.totyumengr.olapcubes.core.Query;

/**
 * @author mengran
 *
 */
public class JdbcRowSourceTest {
    
    private static EmbeddedDatabase database;
    private static CubeRegistry registry;
    private static JdbcRowSource rowSource;
    
    @BeforeClass
    public static void prepare() {
        
        database = new EmbeddedDatabaseBuilder().setType(EmbeddedDatabaseType.H2).generateUniqueName(true)
                .addScript("schema.sql").addScript("data.sql").build();
        registry = new CubeDefinitions(new ObjectMapper()).register(new ClassPathResource("cubes.json"), 
                new CubeRegistry());
        rowSource = new JdbcRowSource(database, registry);
    }
    
    @AfterClass
    public static void shutdown() {
        database.shutdown();
    }
    
    private static Map<Object, BigDecimal> index(AggregationResult result, String dim, String measure) {
        
        Map<Object, BigDecimal> indexed = new LinkedHashMap<Object, BigDecimal>();
        for (Map<String, Object> r : result.getRecords()) {
            indexed.put(r.get(dim), (BigDecimal) r.get(measure));
        }
        return indexed;
    }
    
    @Test
    public void test_FetchRows() {
        
        Cube cube = registry.get("shift_analysis_cube");
        List<Map<String, Object>> rows = rowSource.fetchRows(cube.getName(), cube.getDimensionColumns(), 
                cube.getMeasureColumns());
        
        Assert.assertEquals(8, rows.size());
        Map<String, Object> first = rows.get(0);
        Assert.assertEquals("N001", first.get("staff_id"));
        Assert.assertEquals("Ward A", first.get("staff_team"));
        Assert.assertEquals(0, new BigDecimal("8").compareTo((BigDecimal) first.get("work_hours")));
        Assert.assertTrue(first.containsKey("shift_start"));
        Assert.assertFalse(first.containsKey("STAFF_ID"));
    }
    
    @Test
    public void test_Execute_OverJdbc() {
        
        OlapEngine engine = new OlapEngine(registry, rowSource);
        try {
            AggregationResult departments = engine.execute(Query.builder("shift_analysis_cube").dimensions("staff")
                    .measures("total_hours", "staff_count").drill("staff", "department").build());
            Map<Object, BigDecimal> hours = index(departments, "staff", "total_hours");
            Assert.assertEquals(3, hours.size());
            Assert.assertEquals(0, new BigDecimal("34").compareTo(hours.get("Nursing")));
            Assert.assertEquals(0, new BigDecimal("21.5").compareTo(hours.get("Care")));
            Assert.assertEquals(0, new BigDecimal("4").compareTo(index(departments, "staff", "staff_count").get("Nursing")));
            
            AggregationResult months = engine.execute(Query.builder("shift_analysis_cube").dimensions("time")
                    .measures("total_hours").filter("facility", "Central Hospital").drill("time", "month").build());
            Assert.assertFalse(months.getInterpretation(), months.isFailed());
            Map<Object, BigDecimal> byMonth = index(months, "time", "total_hours");
            Assert.assertEquals(0, new BigDecimal("26").compareTo(byMonth.get("2025-01")));
            Assert.assertEquals(0, new BigDecimal("8").compareTo(byMonth.get("2025-02")));
            
            AggregationResult performance = engine.execute(Query.builder("performance_analysis_cube")
                    .dimensions("facility").measures("quality_score").drill("facility", "region").build());
            Assert.assertEquals(3, performance.getTotalRecords());
        } finally {
            engine.shutdown();
        }
    }
    
    @Test
    public void test_TimeFilter_OverJdbc() {
        
        OlapEngine engine = new OlapEngine(registry, rowSource);
        try {
            Cube cube = registry.get("shift_analysis_cube");
            Object raw = rowSource.fetchRows(cube.getName(), cube.getDimensionColumns(), cube.getMeasureColumns())
                    .get(0).get("shift_start");
            Assert.assertTrue(raw instanceof java.sql.Timestamp);
            
            AggregationResult single = engine.execute(Query.builder("shift_analysis_cube").dimensions("staff")
                    .measures("total_hours").filter("time", "2025-01-06 08:00:00").build());
            Assert.assertFalse(single.getInterpretation(), single.isFailed());
            Assert.assertEquals(1, single.getTotalRecords());
            Assert.assertEquals("N001", single.getRecords().get(0).get("staff"));
            Assert.assertEquals(0, new BigDecimal("8").compareTo((BigDecimal) single.getRecords().get(0).get("total_hours")));
            
            AggregationResult pair = engine.execute(Query.builder("shift_analysis_cube").dimensions("staff")
                    .measures("total_hours").filterIn("time", "2025-01-06T16:00", "2025-02-03 16:00:00").build());
            Assert.assertEquals(0, new BigDecimal("16").compareTo(pair.getSummary().get("total_hours").getSum()));
        } finally {
            engine.shutdown();
        }
    }
    
    @Test
    public void test_MissingTable() {
        
        registry.replace(new Cube("ghost_cube", Arrays.asList(Dimension.builder("d").levels("d").build()), 
                Arrays.asList(Measure.builder("m", AggregationKind.SUM).build()), "ghost_table"));
        try {
            rowSource.fetchRows("ghost_cube", Arrays.asList("d"), Arrays.asList("m"));
            Assert.fail();
        } catch (DataAccessException e) {
            Assert.assertTrue(e.getMessage().contains("ghost_cube"));
            Assert.assertTrue(e.getCause() instanceof org.springframework.dao.DataAccessException);
        }
    }
    
    @Test(expected = DataAccessException.class)
    public void test_IllegalIdentifier() {
        rowSource.fetchRows("shift_analysis_cube", Arrays.asList("staff_id; DROP TABLE shift_analysis_data"), 
                Arrays.asList("work_hours"));
    }
}
