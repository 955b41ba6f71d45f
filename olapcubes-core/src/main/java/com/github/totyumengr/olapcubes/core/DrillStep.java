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

import org.springframework.util.Assert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a drill path: show <code>dimension</code> at granularity <code>level</code>.
 * @author mengran
 *
 */
public final class DrillStep {
    
    private final String dimension;
    private final String level;
    
    @JsonCreator
    public DrillStep(@JsonProperty("dimension") String dimension, @JsonProperty("level") String level) {
        
        Assert.hasText(dimension, "Drill dimension can not empty.");
        Assert.hasText(level, "Drill level can not empty.");
        this.dimension = dimension;
        this.level = level;
    }

    @JsonProperty("dimension")
    public String getDimension() {
        return dimension;
    }

    @JsonProperty("level")
    public String getLevel() {
        return level;
    }

    @Override
    public int hashCode() {
        return dimension.hashCode() * 31 + level.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DrillStep)) {
            return false;
        }
        DrillStep other = (DrillStep) obj;
        return dimension.equals(other.dimension) && level.equals(other.level);
    }

    @Override
    public String toString() {
        return dimension + ":" + level;
    }
}
