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
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whole-result statistics of one measure, independent of grouping.
 * @author mengran
 *
 */
public final class MeasureSummary {
    
    private final BigDecimal sum;
    private final BigDecimal mean;
    private final long count;
    private final BigDecimal min;
    private final BigDecimal max;
    
    @JsonCreator
    public MeasureSummary(@JsonProperty("sum") BigDecimal sum, @JsonProperty("mean") BigDecimal mean, 
            @JsonProperty("count") long count, @JsonProperty("min") BigDecimal min, @JsonProperty("max") BigDecimal max) {
        this.sum = sum;
        this.mean = mean;
        this.count = count;
        this.min = min;
        this.max = max;
    }
    
    /**
     * @param values measure values of filtered rows
     * @return summary, numeric statistics are <code>null</code> when values are not numeric
     */
    static MeasureSummary of(List<?> values) {
        
        long count = Aggregators.count(values).longValue();
        try {
            return new MeasureSummary(Aggregators.sum(values), Aggregators.mean(values), count, 
                    Aggregators.of(AggregationKind.MIN).aggregate(values), 
                    Aggregators.of(AggregationKind.MAX).aggregate(values));
        } catch (AggregationException e) {
            // Not numeric
            return new MeasureSummary(null, null, count, null, null);
        }
    }

    @JsonProperty("sum")
    public BigDecimal getSum() {
        return sum;
    }

    @JsonProperty("mean")
    public BigDecimal getMean() {
        return mean;
    }

    @JsonProperty("count")
    public long getCount() {
        return count;
    }

    @JsonProperty("min")
    public BigDecimal getMin() {
        return min;
    }

    @JsonProperty("max")
    public BigDecimal getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "MeasureSummary [sum=" + sum + ", mean=" + mean + ", count=" + count + ", min=" + min + ", max=" + max + "]";
    }
}
