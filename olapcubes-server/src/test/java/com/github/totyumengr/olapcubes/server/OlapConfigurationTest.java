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
import java.time.Duration;
import java.util.Map;

import javax.sql.DataSource;

import org.junit.Assert;
import org.junit.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.mock.env.MockEnvironment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.AggregationResult;
import com.github.totyumengr.olapcubes.core.EngineSettings;
import com.github.totyumengr.olapcubes.core.InMemoryRowSource;
import com.github.totyumengr.olapcubes.core.OlapEngine;
import com.github.totyumengr.olapcubes.core.Query;
import com.github.totyumengr.olapcubes.core.RowSource;

/**
 * @author mengran
 *
 */
public class OlapConfigurationTest {
    
    private static AnnotationConfigApplicationContext context(MockEnvironment env) {
        
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.setEnvironment(env);
        context.registerBean(ObjectMapper.class, () -> new ObjectMapper());
        context.registerBean(DataSource.class, () -> new EmbeddedDatabaseBuilder().setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true).addScript("schema.sql").addScript("data.sql").build());
        context.register(OlapConfiguration.class);
        context.refresh();
        return context;
    }
    
    @Test
    public void test_MemorySource() {
        
        MockEnvironment env = new MockEnvironment()
                .withProperty("olapcubes.source.type", "memory")
                .withProperty("olapcubes.source.rows.location", "classpath:rows.json")
                .withProperty("olapcubes.cache.max-entries", "7")
                .withProperty("olapcubes.cache.ttl-minutes", "5")
                .withProperty("olapcubes.quality.threshold", "0.9");
        AnnotationConfigApplicationContext context = context(env);
        try {
            EngineSettings settings = context.getBean(EngineSettings.class);
            Assert.assertEquals(7, settings.getMaxCacheEntries());
            Assert.assertEquals(Duration.ofMinutes(5), settings.getCacheTtl());
            Assert.assertEquals(0.9d, settings.getQualityThreshold(), 0.0001d);
            Assert.assertTrue(settings.isCacheEnabled());
            
            Assert.assertTrue(context.getBean(RowSource.class) instanceof InMemoryRowSource);
            OlapEngine engine = context.getBean(OlapEngine.class);
            Assert.assertEquals(7, engine.getCache().stats().getMaxSize());
            Assert.assertEquals(2, engine.getRegistry().list().size());
            
            AggregationResult result = engine.execute(Query.builder("shift_analysis_cube").dimensions("staff")
                    .measures("total_hours").drill("staff", "department").build());
            Assert.assertFalse(result.getInterpretation(), result.isFailed());
            Assert.assertEquals(2, result.getTotalRecords());
            for (Map<String, Object> r : result.getRecords()) {
                BigDecimal expected = "Nursing".equals(r.get("staff")) ? new BigDecimal("16") : new BigDecimal("13.5");
                Assert.assertEquals(0, expected.compareTo((BigDecimal) r.get("total_hours")));
            }
        } finally {
            context.close();
        }
    }
    
    @Test
    public void test_JdbcSource() {
        
        AnnotationConfigApplicationContext context = context(new MockEnvironment());
        try {
            Assert.assertTrue(context.getBean(RowSource.class) instanceof JdbcRowSource);
            AggregationResult result = context.getBean(OlapEngine.class).execute(
                Query.builder("shift_analysis_cube").measures("total_hours").build());
            Assert.assertEquals(1, result.getTotalRecords());
            Assert.assertEquals(0, new BigDecimal("60.5").compareTo(
                (BigDecimal) result.getRecords().get(0).get("total_hours")));
        } finally {
            context.close();
        }
    }
    
    @Test(expected = BeanCreationException.class)
    public void test_UnsupportedSource() {
        context(new MockEnvironment().withProperty("olapcubes.source.type", "csv")).close();
    }
}
