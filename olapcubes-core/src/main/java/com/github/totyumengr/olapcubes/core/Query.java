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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.springframework.util.Assert;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable OLAP query against one {@link Cube}. Equal to "SELECT {dimensions}, AGG({measures}) FROM {cube} WHERE 
 * {filters} GROUP BY {dimensions at drill levels} ORDER BY {sortBy} DESC LIMIT {limit}".
 * 
 * <p>Use {@link #builder(String)} or {@link #toBuilder()} to create a changed copy, a query is never mutated.
 * 
 * @author mengran
 *
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Query {
    
    private final String cubeName;
    private final List<String> dimensions;
    private final List<String> measures;
    private final Map<String, FilterValue> filters;
    private final List<DrillStep> drillPath;
    private final String sortBy;
    private final Integer limit;
    
    private final String fingerprint;
    
    @JsonCreator
    public Query(@JsonProperty("cube_name") String cubeName, @JsonProperty("dimensions") List<String> dimensions, 
            @JsonProperty("measures") List<String> measures, @JsonProperty("filters") Map<String, FilterValue> filters, 
            @JsonProperty("drill_path") List<DrillStep> drillPath, @JsonProperty("sort_by") String sortBy, 
            @JsonProperty("limit") Integer limit) {
        
        Assert.hasText(cubeName, "Query cube name can not empty.");
        if (limit != null) {
            Assert.isTrue(limit > 0, "Query limit must be positive but " + limit);
        }
        this.cubeName = cubeName;
        this.dimensions = distinct(dimensions);
        this.measures = distinct(measures);
        Map<String, FilterValue> f = new LinkedHashMap<String, FilterValue>();
        if (filters != null) {
            for (Entry<String, FilterValue> e : filters.entrySet()) {
                Assert.notNull(e.getValue(), "Filter of " + e.getKey() + " can not null.");
                f.put(e.getKey(), e.getValue());
            }
        }
        this.filters = Collections.unmodifiableMap(f);
        this.drillPath = drillPath == null ? Collections.<DrillStep>emptyList() 
                : Collections.unmodifiableList(new ArrayList<DrillStep>(drillPath));
        this.sortBy = StringUtils.hasText(sortBy) ? sortBy : null;
        this.limit = limit;
        this.fingerprint = DigestUtils.md5DigestAsHex(canonical().getBytes(StandardCharsets.UTF_8));
    }
    
    private static List<String> distinct(Collection<String> names) {
        
        if (names == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<String>(new LinkedHashSet<String>(names)));
    }
    
    public static Builder builder(String cubeName) {
        return new Builder(cubeName);
    }
    
    public Builder toBuilder() {
        
        Builder b = new Builder(cubeName);
        b.dimensions.addAll(dimensions);
        b.measures.addAll(measures);
        b.filters.putAll(filters);
        b.drillPath.addAll(drillPath);
        b.sortBy = sortBy;
        b.limit = limit;
        return b;
    }
    
    /**
     * Selection order, filter order and set member order do not matter, drill path order does.
     */
    private String canonical() {
        
        List<String> dims = new ArrayList<String>(dimensions);
        Collections.sort(dims);
        List<String> meas = new ArrayList<String>(measures);
        Collections.sort(meas);
        Map<String, String> sortedFilters = new TreeMap<String, String>();
        for (Entry<String, FilterValue> e : filters.entrySet()) {
            sortedFilters.put(e.getKey(), e.getValue().canonical());
        }
        return "cube=" + cubeName + "|dims=" + dims + "|measures=" + meas + "|filters=" + sortedFilters 
                + "|drill=" + drillPath + "|sort=" + sortBy + "|limit=" + limit;
    }
    
    /**
     * @return stable structural hash, the cache key of this query
     */
    @JsonIgnore
    public String getFingerprint() {
        return fingerprint;
    }

    @JsonProperty("cube_name")
    public String getCubeName() {
        return cubeName;
    }

    @JsonProperty("dimensions")
    public List<String> getDimensions() {
        return dimensions;
    }

    @JsonProperty("measures")
    public List<String> getMeasures() {
        return measures;
    }

    @JsonProperty("filters")
    public Map<String, FilterValue> getFilters() {
        return filters;
    }

    @JsonProperty("drill_path")
    public List<DrillStep> getDrillPath() {
        return drillPath;
    }

    @JsonProperty("sort_by")
    public String getSortBy() {
        return sortBy;
    }

    @JsonProperty("limit")
    public Integer getLimit() {
        return limit;
    }

    @Override
    public int hashCode() {
        return fingerprint.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Query)) {
            return false;
        }
        Query other = (Query) obj;
        return cubeName.equals(other.cubeName) && dimensions.equals(other.dimensions) && measures.equals(other.measures)
                && filters.equals(other.filters) && drillPath.equals(other.drillPath) 
                && (sortBy == null ? other.sortBy == null : sortBy.equals(other.sortBy)) 
                && (limit == null ? other.limit == null : limit.equals(other.limit));
    }

    @Override
    public String toString() {
        return "Query [cube=" + cubeName + ", dimensions=" + dimensions + ", measures=" + measures + ", filters=" 
                + filters + ", drillPath=" + drillPath + ", sortBy=" + sortBy + ", limit=" + limit + "]";
    }
    
    /**
     * Builder of {@link Query}, chain model begin with {@link Query#builder(String)} and end with {@link #build()}.
     * @author mengran
     *
     */
    public static class Builder {
        
        private final String cubeName;
        private final List<String> dimensions = new ArrayList<String>();
        private final List<String> measures = new ArrayList<String>();
        private final Map<String, FilterValue> filters = new LinkedHashMap<String, FilterValue>();
        private final List<DrillStep> drillPath = new ArrayList<DrillStep>();
        private String sortBy;
        private Integer limit;
        
        private Builder(String cubeName) {
            this.cubeName = cubeName;
        }
        
        public Builder dimensions(String... dimNames) {
            Collections.addAll(dimensions, dimNames);
            return this;
        }
        
        public Builder measures(String... measureNames) {
            Collections.addAll(measures, measureNames);
            return this;
        }
        
        public Builder filter(String dimName, Object value) {
            filters.put(dimName, FilterValue.of(value));
            return this;
        }
        
        public Builder filterIn(String dimName, Object... values) {
            filters.put(dimName, FilterValue.set(values));
            return this;
        }
        
        public Builder drill(String dimName, String level) {
            drillPath.add(new DrillStep(dimName, level));
            return this;
        }
        
        public Builder drillPath(List<DrillStep> path) {
            drillPath.clear();
            drillPath.addAll(path);
            return this;
        }
        
        public Builder sortBy(String measureName) {
            this.sortBy = measureName;
            return this;
        }
        
        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }
        
        public Query build() {
            return new Query(cubeName, dimensions, measures, filters, drillPath, sortBy, limit);
        }
    }
}
