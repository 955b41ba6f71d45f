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

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.Aggregators;
import com.github.totyumengr.olapcubes.core.CubeRegistry;
import com.github.totyumengr.olapcubes.core.EngineSettings;
import com.github.totyumengr.olapcubes.core.InMemoryRowSource;
import com.github.totyumengr.olapcubes.core.OlapEngine;
import com.github.totyumengr.olapcubes.core.ResultCache;
import com.github.totyumengr.olapcubes.core.RowSource;

/**
 * Wire aggregation engine from <code>olapcubes.*</code> properties.
 * 
 * @author mengran
 *
 */
@Configuration
@EnableScheduling
public class OlapConfiguration {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(OlapConfiguration.class);
    
    static final String SOURCE_MEMORY = "memory";
    static final String SOURCE_JDBC = "jdbc";
    
    @Autowired
    private Environment env;
    
    @Value("${olapcubes.cubes.location:classpath:cubes.json}")
    private String cubesLocation;
    
    @Value("${olapcubes.source.type:jdbc}")
    private String sourceType;
    
    @Value("${olapcubes.source.rows.location:}")
    private String rowsLocation;
    
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();
    
    @Bean
    public EngineSettings engineSettings() {
        
        EngineSettings settings = new EngineSettings()
            .setCacheEnabled(env.getProperty("olapcubes.cache.enabled", Boolean.class, Boolean.TRUE))
            .setCacheTtl(Duration.ofMinutes(env.getProperty("olapcubes.cache.ttl-minutes", Long.class, 30L)))
            .setMaxCacheEntries(env.getProperty("olapcubes.cache.max-entries", Integer.class, 1000))
            .setQualityThreshold(env.getProperty("olapcubes.quality.threshold", Double.class, 0.85d))
            .setLatencyThresholdMs(env.getProperty("olapcubes.quality.latency-threshold-ms", Long.class, 1000L))
            .setLargeResultThreshold(env.getProperty("olapcubes.quality.large-result-threshold", Integer.class, 1000))
            .setDimensionComplexityThreshold(
                env.getProperty("olapcubes.quality.dimension-complexity-threshold", Integer.class, 5))
            .setComplexityCeiling(env.getProperty("olapcubes.quality.complexity-ceiling", Integer.class, 10))
            .setPerformanceLogging(env.getProperty("olapcubes.performance-logging", Boolean.class, Boolean.TRUE));
        LOGGER.info("Bind {}", settings);
        return settings;
    }
    
    @Bean
    public CubeDefinitions cubeDefinitions(ObjectMapper objectMapper) {
        return new CubeDefinitions(objectMapper);
    }
    
    @Bean
    public CubeRegistry cubeRegistry(CubeDefinitions cubeDefinitions) {
        return cubeDefinitions.register(resourceLoader.getResource(cubesLocation), new CubeRegistry());
    }
    
    @Bean
    public RowSource rowSource(CubeRegistry cubeRegistry, CubeDefinitions cubeDefinitions, DataSource dataSource) {
        
        if (SOURCE_MEMORY.equalsIgnoreCase(sourceType)) {
            InMemoryRowSource memory = new InMemoryRowSource();
            Map<String, List<Map<String, Object>>> rows = cubeDefinitions.loadRows(
                    rowsLocation.isEmpty() ? null : resourceLoader.getResource(rowsLocation));
            for (Entry<String, List<Map<String, Object>>> e : rows.entrySet()) {
                memory.put(e.getKey(), e.getValue());
            }
            LOGGER.info("Use in-memory row source.");
            return memory;
        }
        if (SOURCE_JDBC.equalsIgnoreCase(sourceType)) {
            LOGGER.info("Use JDBC row source on {}", dataSource);
            return new JdbcRowSource(dataSource, cubeRegistry);
        }
        throw new IllegalArgumentException("Unsupported olapcubes.source.type " + sourceType 
            + ", only " + SOURCE_MEMORY + " or " + SOURCE_JDBC);
    }
    
    @Bean
    public ResultCache resultCache(EngineSettings engineSettings) {
        return new ResultCache(engineSettings.getCacheTtl(), engineSettings.getMaxCacheEntries());
    }
    
    @Bean(destroyMethod = "shutdown")
    public OlapEngine olapEngine(CubeRegistry cubeRegistry, RowSource rowSource, EngineSettings engineSettings, 
            ResultCache resultCache) {
        return new OlapEngine(cubeRegistry, rowSource, engineSettings, new Aggregators(), resultCache, 
                Clock.systemUTC());
    }
}
