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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@link PivotTables#dynamicAggregate(List, List, Map)}.
 * 
 * @author mengran
 *
 */
public final class DynamicAggregation {
    
    private final List<String> groupBy;
    private final Map<String, AggregationKind> measures;
    private final List<Group> groups;
    
    DynamicAggregation(List<String> groupBy, Map<String, AggregationKind> measures, List<Group> groups) {
        this.groupBy = Collections.unmodifiableList(groupBy);
        this.measures = Collections.unmodifiableMap(new LinkedHashMap<String, AggregationKind>(measures));
        this.groups = Collections.unmodifiableList(groups);
    }
    
    @JsonProperty("group_by")
    public List<String> getGroupBy() {
        return groupBy;
    }
    
    public Map<String, AggregationKind> getMeasures() {
        return measures;
    }
    
    public List<Group> getGroups() {
        return groups;
    }
    
    @JsonProperty("total_groups")
    public int getTotalGroups() {
        return groups.size();
    }
    
    @Override
    public String toString() {
        return "DynamicAggregation [groupBy=" + groupBy + ", measures=" + measures + ", groups=" + groups.size() + "]";
    }

    /**
     * One group: values of group by columns and aggregated measures.
     */
    public static final class Group {
        
        private final Map<String, Object> key;
        private final Map<String, BigDecimal> values;
        
        Group(Map<String, Object> key, Map<String, BigDecimal> values) {
            this.key = Collections.unmodifiableMap(key);
            this.values = Collections.unmodifiableMap(values);
        }
        
        public Map<String, Object> getKey() {
            return key;
        }
        
        public Map<String, BigDecimal> getValues() {
            return values;
        }
        
        @Override
        public String toString() {
            return "Group [key=" + key + ", values=" + values + "]";
        }
    }
}
