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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.totyumengr.olapcubes.core.Query;

/**
 * Body of <code>/drill/down</code> and <code>/drill/up</code>.
 * @author mengran
 *
 */
public class DrillRequest {
    
    private final Query query;
    private final String dimension;
    private final String level;
    
    @JsonCreator
    public DrillRequest(@JsonProperty("query") Query query, @JsonProperty("dimension") String dimension, 
            @JsonProperty("level") String level) {
        this.query = query;
        this.dimension = dimension;
        this.level = level;
    }

    public Query getQuery() {
        return query;
    }

    public String getDimension() {
        return dimension;
    }

    public String getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return "DrillRequest [query=" + query + ", dimension=" + dimension + ", level=" + level + "]";
    }
}
