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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Output of {@link QueryExecutor#execute(Query)}. Created fresh per execution and immutable. Records map selected 
 * dimension and measure names to values.
 * 
 * <p>A failed execution is still a result: no records, {@link #getQualityScore() quality score} 0, and 
 * {@link #getError()} naming the failure.
 * 
 * @author mengran
 *
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AggregationResult {
    
    static final String CHECK_RECOMMENDATION = "Check the query and the underlying data.";
    
    private final Query query;
    private final List<Map<String, Object>> records;
    private final Map<String, MeasureSummary> summary;
    private final List<String> dimensionsUsed;
    private final List<String> measuresCalculated;
    private final int totalRecords;
    private final long executionTimeMs;
    private final boolean cacheHit;
    private final double qualityScore;
    private final String interpretation;
    private final List<String> recommendations;
    private final String error;
    
    @JsonCreator
    public AggregationResult(@JsonProperty("query") Query query, 
            @JsonProperty("records") List<Map<String, Object>> records, 
            @JsonProperty("summary") Map<String, MeasureSummary> summary, 
            @JsonProperty("dimensions_used") List<String> dimensionsUsed, 
            @JsonProperty("measures_calculated") List<String> measuresCalculated, 
            @JsonProperty("total_records") int totalRecords, 
            @JsonProperty("execution_time_ms") long executionTimeMs, 
            @JsonProperty("cache_hit") boolean cacheHit, 
            @JsonProperty("quality_score") double qualityScore, 
            @JsonProperty("interpretation") String interpretation, 
            @JsonProperty("recommendations") List<String> recommendations, 
            @JsonProperty("error") String error) {
        this.query = query;
        this.records = copyRecords(records);
        this.summary = summary == null ? Collections.<String, MeasureSummary>emptyMap() 
                : Collections.unmodifiableMap(new LinkedHashMap<String, MeasureSummary>(summary));
        this.dimensionsUsed = unmodifiable(dimensionsUsed);
        this.measuresCalculated = unmodifiable(measuresCalculated);
        this.totalRecords = totalRecords;
        this.executionTimeMs = executionTimeMs;
        this.cacheHit = cacheHit;
        this.qualityScore = qualityScore;
        this.interpretation = interpretation;
        this.recommendations = unmodifiable(recommendations);
        this.error = error;
    }
    
    private static List<String> unmodifiable(List<String> list) {
        return list == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<String>(list));
    }
    
    private static List<Map<String, Object>> copyRecords(List<Map<String, Object>> records) {
        
        if (records == null) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> copy = new ArrayList<Map<String, Object>>(records.size());
        for (Map<String, Object> r : records) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(r)));
        }
        return Collections.unmodifiableList(copy);
    }
    
    /**
     * @param query failed query
     * @param interpretation message naming the failure
     * @param error raw error message
     * @return degraded result
     */
    static AggregationResult failure(Query query, String interpretation, String error) {
        return new AggregationResult(query, null, null, null, null, 0, 0L, false, 0d, interpretation, 
                Collections.singletonList(CHECK_RECOMMENDATION), error);
    }
    
    /**
     * @param requested query that hit the cache, may differ from the cached one in selection order only
     * @return structural copy flagged as cache hit with zero execution time
     */
    public AggregationResult copyAsCacheHit(Query requested) {
        return new AggregationResult(requested == null ? query : requested, records, summary, 
                requested == null ? dimensionsUsed : requested.getDimensions(), 
                requested == null ? measuresCalculated : requested.getMeasures(), 
                totalRecords, 0L, true, qualityScore, interpretation, recommendations, error);
    }
    
    /**
     * @return <code>true</code> if execution failed
     */
    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    @JsonProperty("query")
    public Query getQuery() {
        return query;
    }

    @JsonProperty("records")
    public List<Map<String, Object>> getRecords() {
        return records;
    }

    @JsonProperty("summary")
    public Map<String, MeasureSummary> getSummary() {
        return summary;
    }

    @JsonProperty("dimensions_used")
    public List<String> getDimensionsUsed() {
        return dimensionsUsed;
    }

    @JsonProperty("measures_calculated")
    public List<String> getMeasuresCalculated() {
        return measuresCalculated;
    }

    @JsonProperty("total_records")
    public int getTotalRecords() {
        return totalRecords;
    }

    @JsonProperty("execution_time_ms")
    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @JsonProperty("cache_hit")
    public boolean isCacheHit() {
        return cacheHit;
    }

    @JsonProperty("quality_score")
    public double getQualityScore() {
        return qualityScore;
    }

    @JsonProperty("interpretation")
    public String getInterpretation() {
        return interpretation;
    }

    @JsonProperty("recommendations")
    public List<String> getRecommendations() {
        return recommendations;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "AggregationResult [cube=" + (query == null ? null : query.getCubeName()) + ", totalRecords=" 
                + totalRecords + ", executionTimeMs=" + executionTimeMs + ", cacheHit=" + cacheHit 
                + ", qualityScore=" + qualityScore + (error == null ? "" : ", error=" + error) + "]";
    }
}
