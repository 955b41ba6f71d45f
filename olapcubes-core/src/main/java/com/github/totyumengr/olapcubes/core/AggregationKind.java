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
 * Reduction applied to the values of a measure within one group. {@link #CUSTOM} resolves by function name 
 * through {@link Aggregators}.
 * @author mengran
 *
 */
public enum AggregationKind {

    SUM, MEAN, MEDIAN, COUNT, MIN, MAX, STD, VAR, PERCENTILE, CUSTOM;
    
    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @JsonCreator
    public static AggregationKind of(String code) {
        
        if (code == null) {
            throw new IllegalArgumentException("Aggregation kind can not be null.");
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        if ("avg".equals(c)) {
            return MEAN;
        }
        for (AggregationKind k : values()) {
            if (k.getCode().equals(c)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation kind " + code);
    }
}
