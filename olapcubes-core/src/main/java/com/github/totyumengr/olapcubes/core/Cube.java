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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.util.Assert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named bundle of {@link Dimension dimensions} and {@link Measure measures} over one data source. Immutable, 
 * reconfiguration replaces the whole definition through {@link CubeRegistry#replace(Cube)}.
 * 
 * @author mengran
 *
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Cube {
    
    private final String name;
    private final Map<String, Dimension> dimensions;
    private final Map<String, Measure> measures;
    private final String dataSource;
    private final String refreshFrequency;
    private final String description;
    
    @JsonCreator
    public Cube(@JsonProperty("name") String name, @JsonProperty("dimensions") List<Dimension> dimensions, 
            @JsonProperty("measures") List<Measure> measures, @JsonProperty("data_source") String dataSource, 
            @JsonProperty("refresh_frequency") String refreshFrequency, 
            @JsonProperty("description") String description) {
        
        Assert.hasText(name, "Cube name can not empty.");
        Assert.notEmpty(dimensions, "Cube " + name + " must have a dimension at least.");
        Assert.notEmpty(measures, "Cube " + name + " must have a measure at least.");
        
        Map<String, Dimension> dims = new LinkedHashMap<String, Dimension>();
        for (Dimension d : dimensions) {
            if (dims.put(d.getName(), d) != null) {
                throw new IllegalArgumentException("Dimension " + d.getName() + " has exists in cube " + name);
            }
        }
        Map<String, Measure> meas = new LinkedHashMap<String, Measure>();
        for (Measure m : measures) {
            if (meas.put(m.getName(), m) != null) {
                throw new IllegalArgumentException("Measure " + m.getName() + " has exists in cube " + name);
            }
            if (dims.containsKey(m.getName())) {
                throw new IllegalArgumentException("Measure " + m.getName() + " has the name of a dimension in cube " 
                    + name);
            }
        }
        
        this.name = name;
        this.dimensions = Collections.unmodifiableMap(dims);
        this.measures = Collections.unmodifiableMap(meas);
        this.dataSource = dataSource == null ? name : dataSource;
        this.refreshFrequency = refreshFrequency;
        this.description = description;
    }
    
    public Cube(String name, List<Dimension> dimensions, List<Measure> measures, String dataSource) {
        this(name, dimensions, measures, dataSource, null, null);
    }
    
    /**
     * @param dimName dimension name
     * @return definition, <code>null</code> if not exists
     */
    public Dimension findDimension(String dimName) {
        return dimensions.get(dimName);
    }
    
    /**
     * @param dimName dimension name
     * @return definition
     * @throws InvalidDimensionException if not exists
     */
    public Dimension getDimension(String dimName) {
        
        Dimension d = dimensions.get(dimName);
        if (d == null) {
            throw new InvalidDimensionException("Dimension " + dimName + " is not defined on cube " + name);
        }
        return d;
    }
    
    /**
     * @param measureName measure name
     * @return definition, <code>null</code> if not exists
     */
    public Measure findMeasure(String measureName) {
        return measures.get(measureName);
    }
    
    /**
     * @param measureName measure name
     * @return definition
     * @throws InvalidMeasureException if not exists
     */
    public Measure getMeasure(String measureName) {
        
        Measure m = measures.get(measureName);
        if (m == null) {
            throw new InvalidMeasureException("Measure " + measureName + " is not defined on cube " + name);
        }
        return m;
    }
    
    /**
     * @return all dimension columns (include level columns) in definition order
     */
    @JsonIgnore
    public List<String> getDimensionColumns() {
        
        Set<String> columns = new LinkedHashSet<String>();
        for (Dimension d : dimensions.values()) {
            columns.addAll(d.getColumns());
        }
        return new ArrayList<String>(columns);
    }
    
    /**
     * @return all measure source columns in definition order
     */
    @JsonIgnore
    public List<String> getMeasureColumns() {
        
        Set<String> columns = new LinkedHashSet<String>();
        for (Measure m : measures.values()) {
            if (m.getSourceColumn() != null) {
                columns.add(m.getSourceColumn());
            }
        }
        return new ArrayList<String>(columns);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("dimensions")
    public List<Dimension> getDimensions() {
        return Collections.unmodifiableList(new ArrayList<Dimension>(dimensions.values()));
    }

    @JsonProperty("measures")
    public List<Measure> getMeasures() {
        return Collections.unmodifiableList(new ArrayList<Measure>(measures.values()));
    }

    @JsonProperty("data_source")
    public String getDataSource() {
        return dataSource;
    }

    @JsonProperty("refresh_frequency")
    public String getRefreshFrequency() {
        return refreshFrequency;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Cube [name=" + name + ", dimensions=" + dimensions.keySet() + ", measures=" + measures.keySet() 
                + ", dataSource=" + dataSource + "]";
    }
}
