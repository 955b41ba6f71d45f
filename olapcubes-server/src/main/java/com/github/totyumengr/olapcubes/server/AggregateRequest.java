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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.totyumengr.olapcubes.core.AggregationKind;

/**
 * Body of <code>/aggregate</code>.
 * @author mengran
 *
 */
public class AggregateRequest {
    
    private final List<Map<String, Object>> rows;
    private final List<String> groupBy;
    private final Map<String, AggregationKind> measures;
    
    @JsonCreator
    public AggregateRequest(@JsonProperty("rows") List<Map<String, Object>> rows, 
            @JsonProperty("group_by") List<String> groupBy, 
            @JsonProperty("measures") Map<String, AggregationKind> measures) {
        this.rows = rows;
        this.groupBy = groupBy == null ? Collections.<String>emptyList() : groupBy;
        this.measures = measures;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public Map<String, AggregationKind> getMeasures() {
        return measures;
    }
}
