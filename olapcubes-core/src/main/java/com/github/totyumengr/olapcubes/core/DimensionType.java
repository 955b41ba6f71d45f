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

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of analysis axis. Only {@link #TEMPORAL} changes engine behavior: its levels can be derived from a raw
 * date value, see {@link Dimension#resolve(java.util.Map, String)}.
 * @author mengran
 *
 */
public enum DimensionType {

    TEMPORAL, CATEGORICAL, HIERARCHICAL, NUMERIC, GEOGRAPHIC, CUSTOM;
    
    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Accepts the codes of {@link #getCode()} and the short aliases <code>time</code>, <code>category</code> and 
     * <code>hierarchy</code>.
     * @param code case insensitive type code
     * @return matched type
     * @throws IllegalArgumentException on unknown code
     */
    @JsonCreator
    public static DimensionType of(String code) {
        
        if (code == null) {
            throw new IllegalArgumentException("Dimension type can not be null.");
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        switch (c) {
            case "time":
                return TEMPORAL;
            case "category":
                return CATEGORICAL;
            case "hierarchy":
                return HIERARCHICAL;
            default:
                for (DimensionType t : values()) {
                    if (t.getCode().equals(c)) {
                        return t;
                    }
                }
                throw new IllegalArgumentException("Unknown dimension type " + code);
        }
    }
}
