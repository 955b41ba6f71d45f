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

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Entry point of aggregation engine, wires {@link CubeRegistry}, {@link ResultCache}, {@link QueryExecutor}, 
 * {@link DrillEngine}, {@link PivotTables} together. Cube queries never throw, a failure is reported through a 
 * degraded {@link AggregationResult}.
 * 
 * <p>Owns the {@link ResultCache}, call {@link #shutdown()} to release it.
 * 
 * @author mengran
 *
 */
public class OlapEngine implements Aggregations {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(OlapEngine.class);
    
    private final CubeRegistry registry;
    private final ResultCache cache;
    private final QueryExecutor executor;
    private final DrillEngine drillEngine;
    private final PivotTables pivotTables = new PivotTables();
    private final Aggregators aggregators;
    private final Clock clock;
    
    public OlapEngine(CubeRegistry registry, RowSource rowSource) {
        this(registry, rowSource, new EngineSettings(), new Aggregators());
    }
    
    public OlapEngine(CubeRegistry registry, RowSource rowSource, EngineSettings settings, Aggregators aggregators) {
        this(registry, rowSource, settings, aggregators, 
                new ResultCache(settings.getCacheTtl(), settings.getMaxCacheEntries()), Clock.systemUTC());
    }
    
    public OlapEngine(CubeRegistry registry, RowSource rowSource, EngineSettings settings, Aggregators aggregators, 
            ResultCache cache, Clock clock) {
        
        Assert.notNull(settings, "Engine settings can not null.");
        Assert.notNull(aggregators, "Aggregators can not null.");
        this.registry = registry;
        this.cache = cache;
        this.aggregators = aggregators;
        this.clock = clock;
        this.executor = new QueryExecutor(registry, rowSource, cache, aggregators, settings);
        this.drillEngine = new DrillEngine(registry);
        LOGGER.info("Started aggregation engine with {}", settings);
    }
    
    @Override
    public AggregationResult execute(Query query) {
        return executor.execute(query);
    }
    
    @Override
    public AggregationResult drillDown(Query query, String dimension, String level) {
        
        Query drilled;
        try {
            drilled = drillEngine.drillDown(query, dimension, level);
        } catch (CubeException e) {
            LOGGER.warn("Can not drill down {} to {}: {}", dimension, level, e.getMessage());
            return AggregationResult.failure(query, "Invalid query: " + e.getMessage(), e.getMessage());
        }
        return executor.execute(drilled);
    }
    
    @Override
    public AggregationResult drillUp(Query query, String dimension, String level) {
        
        Query drilled;
        try {
            drilled = drillEngine.drillUp(query, dimension, level);
        } catch (CubeException e) {
            LOGGER.warn("Can not drill up {} to {}: {}", dimension, level, e.getMessage());
            return AggregationResult.failure(query, "Invalid query: " + e.getMessage(), e.getMessage());
        }
        return executor.execute(drilled);
    }
    
    @Override
    public PivotTable pivot(List<Map<String, Object>> rows, List<String> rowKeys, List<String> columnKeys, 
            String valueColumn, AggregationKind kind) {
        return pivotTables.pivot(rows, rowKeys, columnKeys, valueColumn, kind);
    }
    
    @Override
    public DynamicAggregation dynamicAggregate(List<Map<String, Object>> rows, List<String> groupBy, 
            Map<String, AggregationKind> measures) {
        return pivotTables.dynamicAggregate(rows, groupBy, measures);
    }
    
    @Override
    public MultiDimensionalView view(String cubeName, List<String> dimensions, List<String> measures) {
        
        Query query = Query.builder(cubeName).dimensions(dimensions.toArray(new String[0]))
                .measures(measures.toArray(new String[0])).build();
        AggregationResult result = executor.execute(query);
        if (result.isFailed()) {
            LOGGER.warn("View of {} is degraded: {}", cubeName, result.getError());
        }
        return new MultiDimensionalView(cubeName, result, clock.millis());
    }
    
    /**
     * Replace a cube definition and drop the results computed on the previous one.
     * @param cube new definition
     * @return previous definition, <code>null</code> if absent
     */
    public Cube replaceCube(Cube cube) {
        
        Cube previous = registry.replace(cube);
        cache.evictCube(cube.getName());
        return previous;
    }
    
    /**
     * Release cached results, later executions run without cache hits.
     */
    public void shutdown() {
        
        cache.shutdown();
        LOGGER.info("Aggregation engine shutdown, cache {}", cache.stats());
    }
    
    public CubeRegistry getRegistry() {
        return registry;
    }
    
    public ResultCache getCache() {
        return cache;
    }
    
    public Aggregators getAggregators() {
        return aggregators;
    }
    
    public DrillEngine getDrillEngine() {
        return drillEngine;
    }
}
