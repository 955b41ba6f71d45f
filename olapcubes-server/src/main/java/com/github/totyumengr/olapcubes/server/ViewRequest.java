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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of <code>/view</code>.
 * @author mengran
 *
 */
public class ViewRequest {
    
    private final String cubeName;
    private final List<String> dimensions;
    private final List<String> measures;
    
    @JsonCreator
    public ViewRequest(@JsonProperty("cube_name") String cubeName, @JsonProperty("dimensions") List<String> dimensions, 
            @JsonProperty("measures") List<String> measures) {
        this.cubeName = cubeName;
        this.dimensions = dimensions == null ? Collections.<String>emptyList() : dimensions;
        this.measures = measures == null ? Collections.<String>emptyList() : measures;
    }

    public String getCubeName() {
        return cubeName;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<String> getMeasures() {
        return measures;
    }
}
