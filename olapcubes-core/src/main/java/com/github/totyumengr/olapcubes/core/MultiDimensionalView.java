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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whole aggregated view of a cube over some dimensions and measures, see 
 * {@link Aggregations#view(String, List, List)}.
 * 
 * @author mengran
 *
 */
public final class MultiDimensionalView {
    
    public static final String VIEW_TYPE = "multi_dimensional";
    
    private final String cubeName;
    private final List<String> dimensions;
    private final List<String> measures;
    private final List<Map<String, Object>> data;
    private final int totalRecords;
    private final double qualityScore;
    private final long createdAt;
    
    MultiDimensionalView(String cubeName, AggregationResult result, long createdAt) {
        this.cubeName = cubeName;
        this.dimensions = result.getDimensionsUsed();
        this.measures = result.getMeasuresCalculated();
        this.data = result.getRecords();
        this.totalRecords = result.getTotalRecords();
        this.qualityScore = result.getQualityScore();
        this.createdAt = createdAt;
    }

    @JsonProperty("cube_name")
    public String getCubeName() {
        return cubeName;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<String> getMeasures() {
        return measures;
    }

    public List<Map<String, Object>> getData() {
        return data;
    }

    @JsonProperty("total_records")
    public int getTotalRecords() {
        return totalRecords;
    }

    @JsonProperty("quality_score")
    public double getQualityScore() {
        return qualityScore;
    }
    
    @JsonProperty("view_type")
    public String getViewType() {
        return VIEW_TYPE;
    }

    /**
     * @return epoch millis of creation
     */
    @JsonProperty("created_at")
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "MultiDimensionalView [cubeName=" + cubeName + ", dimensions=" + dimensions + ", measures=" + measures 
                + ", totalRecords=" + totalRecords + ", qualityScore=" + qualityScore + "]";
    }
}
