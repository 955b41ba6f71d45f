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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named axis of analysis. Hierarchy levels are ordered from coarsest to finest, e.g. 
 * <code>year, quarter, month, week, day, hour</code>.
 * 
 * <p>Raw values come from {@link #getSourceColumn()}. A drill to a level reads the column mapped for that level 
 * by {@link #getLevelColumns()} when there is one. Otherwise a {@link DimensionType#TEMPORAL temporal} dimension derives 
 * the level from its raw date value, and any other dimension keeps the raw value.
 * 
 * @author mengran
 *
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Dimension {
    
    private final String name;
    private final DimensionType type;
    private final List<String> levels;
    private final String defaultLevel;
    private final String sourceColumn;
    private final Map<String, String> levelColumns;
    private final String description;
    
    @JsonCreator
    public Dimension(@JsonProperty("name") String name, @JsonProperty("type") DimensionType type, 
            @JsonProperty("hierarchy_levels") List<String> levels, @JsonProperty("default_level") String defaultLevel, 
            @JsonProperty("source_column") String sourceColumn, 
            @JsonProperty("level_columns") Map<String, String> levelColumns, 
            @JsonProperty("description") String description) {
        
        Assert.hasText(name, "Dimension name can not empty.");
        Assert.notEmpty(levels, "Dimension " + name + " must have a hierarchy level at least.");
        Set<String> unique = new HashSet<String>(levels);
        Assert.isTrue(unique.size() == levels.size(), "Dimension " + name + " has duplicated levels " + levels);
        String level = StringUtils.hasText(defaultLevel) ? defaultLevel : levels.get(levels.size() - 1);
        Assert.isTrue(unique.contains(level), "Default level " + level + " is not a level of dimension " + name);
        
        this.name = name;
        this.type = type == null ? DimensionType.CATEGORICAL : type;
        this.levels = Collections.unmodifiableList(new ArrayList<String>(levels));
        this.defaultLevel = level;
        this.sourceColumn = StringUtils.hasText(sourceColumn) ? sourceColumn : name;
        Map<String, String> columns = new LinkedHashMap<String, String>();
        if (levelColumns != null) {
            for (Entry<String, String> e : levelColumns.entrySet()) {
                Assert.isTrue(unique.contains(e.getKey()), "Level column mapped for unknown level " + e.getKey() 
                    + " of dimension " + name);
                columns.put(e.getKey(), e.getValue());
            }
        }
        this.levelColumns = Collections.unmodifiableMap(columns);
        this.description = description;
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    /**
     * @param level level name
     * @return <code>true</code> when level is in hierarchy
     */
    public boolean hasLevel(String level) {
        return levels.contains(level);
    }
    
    /**
     * @param row raw row of {@link RowSource}
     * @return raw dimension value of row
     */
    public Object valueOf(Map<String, Object> row) {
        return row.get(sourceColumn);
    }
    
    /**
     * Reshape the dimension value of a row to the granularity of a level.
     * @param row raw row
     * @param level target level, must be in hierarchy
     * @return value at level
     * @throws InvalidLevelException if level is not in hierarchy
     * @throws AggregationException if a temporal raw value can not be parsed
     */
    public Object resolve(Map<String, Object> row, String level) {
        
        if (!hasLevel(level)) {
            throw new InvalidLevelException("Level " + level + " is not in hierarchy " + levels + " of dimension " + name);
        }
        String column = levelColumns.get(level);
        if (column != null) {
            return row.get(column);
        }
        Object raw = valueOf(row);
        if (type == DimensionType.TEMPORAL) {
            return TemporalLevels.truncate(raw, level);
        }
        return raw;
    }
    
    /**
     * @return columns need to fetch from {@link RowSource}: source column and mapped level columns
     */
    @JsonIgnore
    public List<String> getColumns() {
        
        Set<String> columns = new LinkedHashSet<String>();
        columns.add(sourceColumn);
        columns.addAll(levelColumns.values());
        return new ArrayList<String>(columns);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public DimensionType getType() {
        return type;
    }

    @JsonProperty("hierarchy_levels")
    public List<String> getLevels() {
        return levels;
    }

    @JsonProperty("default_level")
    public String getDefaultLevel() {
        return defaultLevel;
    }

    @JsonProperty("source_column")
    public String getSourceColumn() {
        return sourceColumn;
    }

    @JsonProperty("level_columns")
    public Map<String, String> getLevelColumns() {
        return levelColumns;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "Dimension [name=" + name + ", type=" + type.getCode() + ", levels=" + levels + ", defaultLevel=" 
                + defaultLevel + ", sourceColumn=" + sourceColumn + "]";
    }
    
    /**
     * @author mengran
     *
     */
    public static class Builder {
        
        private final String name;
        private DimensionType type = DimensionType.CATEGORICAL;
        private List<String> levels = new ArrayList<String>();
        private String defaultLevel;
        private String sourceColumn;
        private Map<String, String> levelColumns = new LinkedHashMap<String, String>();
        private String description;
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder type(DimensionType type) {
            this.type = type;
            return this;
        }
        
        public Builder levels(String... levels) {
            this.levels = new ArrayList<String>();
            Collections.addAll(this.levels, levels);
            return this;
        }
        
        public Builder defaultLevel(String defaultLevel) {
            this.defaultLevel = defaultLevel;
            return this;
        }
        
        public Builder sourceColumn(String sourceColumn) {
            this.sourceColumn = sourceColumn;
            return this;
        }
        
        public Builder levelColumn(String level, String column) {
            this.levelColumns.put(level, column);
            return this;
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Dimension build() {
            return new Dimension(name, type, levels, defaultLevel, sourceColumn, levelColumns, description);
        }
    }
}
