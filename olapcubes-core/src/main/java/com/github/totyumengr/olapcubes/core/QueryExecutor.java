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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

/**
 * Run a {@link Query} through validate, cache lookup, fetch, filter, aggregate, drill, sort, limit, score and 
 * cache store.
 * 
 * <p>{@link #execute(Query)} never throws: an invalid query or a failure in any step gives a degraded 
 * {@link AggregationResult} with quality score 0 and an interpretation naming the failure. It is called 
 * synchronously by interactive dashboard code.
 * 
 * <p>Thread-safe, the only shared mutable state is the {@link ResultCache}. Two concurrent executions of the same 
 * query may both run the whole pipeline.
 * 
 * @author mengran
 *
 */
public class QueryExecutor {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);
    
    private final CubeRegistry registry;
    private final RowSource rowSource;
    private final ResultCache cache;
    private final Aggregators aggregators;
    private final QualityScorer scorer;
    private final EngineSettings settings;
    
    public QueryExecutor(CubeRegistry registry, RowSource rowSource, ResultCache cache, Aggregators aggregators, 
            EngineSettings settings) {
        
        Assert.notNull(registry, "Cube registry can not null.");
        Assert.notNull(rowSource, "Row source can not null.");
        Assert.notNull(cache, "Result cache can not null.");
        this.registry = registry;
        this.rowSource = rowSource;
        this.cache = cache;
        this.aggregators = aggregators == null ? new Aggregators() : aggregators;
        this.settings = settings == null ? new EngineSettings() : settings;
        this.scorer = new QualityScorer(this.settings);
    }
    
    /**
     * Group of filtered rows sharing one combination of dimension values.
     */
    private static final class Group {
        
        private final Map<String, Object> key;
        private final List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        
        private Group(Map<String, Object> key) {
            this.key = key;
        }
    }
    
    public AggregationResult execute(Query query) {
        
        if (query == null) {
            return AggregationResult.failure(null, "Invalid query: query can not null.", "query can not null");
        }
        
        // Read before validation, a replacement in between only makes this result unreachable
        long version = registry.version(query.getCubeName());
        
        // 1. Validation
        Cube cube;
        try {
            cube = validate(query);
        } catch (CubeException e) {
            LOGGER.warn("Reject invalid {}: {}", query, e.getMessage());
            return AggregationResult.failure(query, "Invalid query: " + e.getMessage(), e.getMessage());
        }
        
        // 2. Cache lookup, keyed by fingerprint and definition version
        String key = cacheKey(query, version);
        if (settings.isCacheEnabled()) {
            AggregationResult cached = cache.get(key);
            if (cached != null) {
                LOGGER.info("Cache hit {} for {}", key, query);
                return cached.copyAsCacheHit(query);
            }
        }
        
        AggregationResult result;
        try {
            result = run(query, cube);
        } catch (DataAccessException e) {
            LOGGER.error("Can not fetch rows for " + query, e);
            return AggregationResult.failure(query, "Aggregation failed: data access error, " + e.getMessage(), 
                    e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Error occurred when try to execute " + query, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return AggregationResult.failure(query, "Aggregation failed: " + message, message);
        }
        
        // 10. Cache store
        if (settings.isCacheEnabled()) {
            cache.put(key, result);
        }
        return result;
    }
    
    static String cacheKey(Query query, long version) {
        return query.getFingerprint() + "@" + version;
    }
    
    /**
     * @return cube of query
     * @throws CubeException naming the first invalid reference
     */
    Cube validate(Query query) {
        
        Cube cube = registry.get(query.getCubeName());
        for (String d : query.getDimensions()) {
            cube.getDimension(d);
        }
        for (String m : query.getMeasures()) {
            cube.getMeasure(m);
        }
        for (String f : query.getFilters().keySet()) {
            if (cube.findDimension(f) == null) {
                throw new InvalidDimensionException("Filter dimension " + f + " is not defined on cube " + cube.getName());
            }
        }
        if (query.getSortBy() != null && !query.getMeasures().contains(query.getSortBy())) {
            throw new InvalidMeasureException("Sort measure " + query.getSortBy() + " is not a selected measure " 
                + query.getMeasures());
        }
        for (DrillStep step : query.getDrillPath()) {
            Dimension d = cube.findDimension(step.getDimension());
            if (d == null) {
                throw new InvalidDimensionException("Drill dimension " + step.getDimension() 
                    + " is not defined on cube " + cube.getName());
            }
            if (!d.hasLevel(step.getLevel())) {
                throw new InvalidLevelException("Level " + step.getLevel() + " is not in hierarchy " + d.getLevels() 
                    + " of dimension " + d.getName());
            }
        }
        return cube;
    }
    
    private AggregationResult run(Query query, Cube cube) {
        
        StopWatch stopWatch = new StopWatch(query.getFingerprint());
        
        // 3. Row retrieval
        stopWatch.start("fetch");
        List<Map<String, Object>> rows = rowSource.fetchRows(cube.getName(), cube.getDimensionColumns(), 
                cube.getMeasureColumns());
        if (rows == null) {
            throw new DataAccessException("Row source returned nothing for cube " + cube.getName());
        }
        stopWatch.stop();
        
        // 4. Filtering
        stopWatch.start("filter");
        List<Map<String, Object>> filtered = filter(cube, rows, query.getFilters());
        stopWatch.stop();
        
        // 5. Aggregation
        stopWatch.start("aggregate");
        List<Dimension> dims = new ArrayList<Dimension>(query.getDimensions().size());
        for (String d : query.getDimensions()) {
            dims.add(cube.getDimension(d));
        }
        Map<String, Measure> measures = new LinkedHashMap<String, Measure>();
        Map<String, Aggregator> reducers = new LinkedHashMap<String, Aggregator>();
        for (String m : query.getMeasures()) {
            Measure measure = cube.getMeasure(m);
            measures.put(m, measure);
            reducers.put(m, aggregators.resolve(measure));
        }
        List<Group> groups = group(filtered, dims, Collections.<String, String>emptyMap());
        List<Map<String, Object>> records = reduce(groups, measures, reducers);
        Map<String, MeasureSummary> summary = summarize(filtered, measures);
        stopWatch.stop();
        
        // 6. Drill application
        if (!query.getDrillPath().isEmpty()) {
            stopWatch.start("drill");
            Map<String, String> levels = effectiveLevels(query);
            if (!levels.isEmpty()) {
                groups = merge(groups, dims, levels);
                records = reduce(groups, measures, reducers);
            }
            stopWatch.stop();
        }
        
        // 7. Sort, stable so ties keep group discovery order
        stopWatch.start("sort");
        if (query.getSortBy() != null) {
            final String sortBy = query.getSortBy();
            Comparator<BigDecimal> desc = Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder());
            records.sort((x, y) -> desc.compare((BigDecimal) x.get(sortBy), (BigDecimal) y.get(sortBy)));
        }
        
        // 8. Limit
        if (query.getLimit() != null && records.size() > query.getLimit()) {
            records = new ArrayList<Map<String, Object>>(records.subList(0, query.getLimit()));
        }
        stopWatch.stop();
        
        // 9. Scoring & interpretation
        long latency = stopWatch.getTotalTimeMillis();
        QualityScorer.Assessment assessment = scorer.score(query, records, summary, latency);
        
        if (settings.isPerformanceLogging()) {
            LOGGER.info("Execute {} fetch {} rows, filter to {}, result {} records using {} ms, quality {}.", query, 
                rows.size(), filtered.size(), records.size(), latency, assessment.getScore());
            LOGGER.debug(stopWatch.prettyPrint());
        }
        return new AggregationResult(query, records, summary, query.getDimensions(), query.getMeasures(), 
                records.size(), latency, false, assessment.getScore(), assessment.getInterpretation(), 
                assessment.getRecommendations(), null);
    }
    
    private List<Map<String, Object>> filter(Cube cube, List<Map<String, Object>> rows, 
            Map<String, FilterValue> filters) {
        
        if (filters.isEmpty()) {
            return rows;
        }
        List<String> columns = new ArrayList<String>(filters.size());
        for (String f : filters.keySet()) {
            columns.add(cube.getDimension(f).getSourceColumn());
        }
        FactTable factTable = FactTable.builder(cube.getName()).addDimColumns(distinct(columns)).addRecords(rows).done();
        RoaringBitmap ids = factTable.filter(null);
        for (Entry<String, FilterValue> f : filters.entrySet()) {
            ids.and(factTable.filter(Collections.singletonMap(cube.getDimension(f.getKey()).getSourceColumn(), 
                    f.getValue())));
        }
        return factTable.select(ids);
    }
    
    private static List<String> distinct(List<String> columns) {
        
        List<String> distinct = new ArrayList<String>(columns.size());
        for (String c : columns) {
            if (!distinct.contains(c)) {
                distinct.add(c);
            }
        }
        return distinct;
    }
    
    /**
     * @param rows rows in discovery order
     * @param dims selected dimensions
     * @param levels dimension name to drill level, dimensions absent keep their raw value
     * @return groups in discovery order
     */
    private static List<Group> group(List<Map<String, Object>> rows, List<Dimension> dims, Map<String, String> levels) {
        
        Map<List<Object>, Group> groups = new LinkedHashMap<List<Object>, Group>();
        for (Map<String, Object> row : rows) {
            List<Object> identity = new ArrayList<Object>(dims.size());
            Map<String, Object> key = new LinkedHashMap<String, Object>();
            for (Dimension d : dims) {
                String level = levels.get(d.getName());
                Object value = level == null ? d.valueOf(row) : d.resolve(row, level);
                identity.add(FilterValue.normalize(value));
                key.put(d.getName(), value);
            }
            Group g = groups.get(identity);
            if (g == null) {
                g = new Group(key);
                groups.put(identity, g);
            }
            g.rows.add(row);
        }
        return new ArrayList<Group>(groups.values());
    }
    
    /**
     * Drill steps apply in order, a later step of the same dimension overrides an earlier one. Steps on 
     * dimensions that are not selected do not change grouping.
     */
    private static Map<String, String> effectiveLevels(Query query) {
        
        Map<String, String> levels = new LinkedHashMap<String, String>();
        for (DrillStep step : query.getDrillPath()) {
            if (query.getDimensions().contains(step.getDimension())) {
                levels.put(step.getDimension(), step.getLevel());
            } else {
                LOGGER.debug("Drill {} ignored, dimension is not selected in {}", step, query.getDimensions());
            }
        }
        return levels;
    }
    
    /**
     * Reshape groups to drill levels, groups collapsing onto the same key merge their rows.
     */
    private static List<Group> merge(List<Group> groups, List<Dimension> dims, Map<String, String> levels) {
        
        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
        for (Group g : groups) {
            rows.addAll(g.rows);
        }
        List<Group> merged = group(rows, dims, levels);
        LOGGER.debug("Drill to {} merged {} groups into {}", levels, groups.size(), merged.size());
        return merged;
    }
    
    private static List<Map<String, Object>> reduce(List<Group> groups, Map<String, Measure> measures, 
            Map<String, Aggregator> reducers) {
        
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(groups.size());
        for (Group g : groups) {
            Map<String, Object> record = new LinkedHashMap<String, Object>(g.key);
            for (Entry<String, Measure> m : measures.entrySet()) {
                record.put(m.getKey(), reducers.get(m.getKey()).aggregate(values(g.rows, m.getValue())));
            }
            records.add(record);
        }
        return records;
    }
    
    private static Map<String, MeasureSummary> summarize(List<Map<String, Object>> rows, Map<String, Measure> measures) {
        
        Map<String, MeasureSummary> summary = new LinkedHashMap<String, MeasureSummary>();
        for (Entry<String, Measure> m : measures.entrySet()) {
            summary.put(m.getKey(), MeasureSummary.of(values(rows, m.getValue())));
        }
        return summary;
    }
    
    private static List<Object> values(List<Map<String, Object>> rows, Measure measure) {
        
        List<Object> values = new ArrayList<Object>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(measure.valueOf(row));
        }
        return values;
    }
    
    public ResultCache getCache() {
        return cache;
    }
    
    public CubeRegistry getRegistry() {
        return registry;
    }
}
