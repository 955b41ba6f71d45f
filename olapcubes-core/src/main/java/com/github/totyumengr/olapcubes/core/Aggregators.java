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
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Built-in reduction functions plus a registry of named custom ones. Results use scale 
 * {@value Aggregations#IND_SCALE}, except {@link AggregationKind#COUNT} which is an integral value.
 * 
 * <p>Statistics follow population semantics: {@link AggregationKind#VAR} divides by <code>n</code>. 
 * {@link AggregationKind#MEDIAN} and {@link AggregationKind#PERCENTILE} interpolate linearly between closest ranks.
 * 
 * @author mengran
 *
 */
public class Aggregators {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregators.class);
    
    public static final double DEFAULT_PERCENTILE = 50d;
    
    private final Map<String, Aggregator> customs = new ConcurrentHashMap<String, Aggregator>();
    
    /**
     * Register a custom reduction, later registration of the same name wins.
     * @param name function name referenced by {@link Measure#getFunction()}
     * @param aggregator reduction
     * @return this for chaining
     */
    public Aggregators register(String name, Aggregator aggregator) {
        
        Assert.hasText(name, "Custom aggregation name can not empty.");
        Assert.notNull(aggregator, "Custom aggregation can not null.");
        if (customs.put(name, aggregator) != null) {
            LOGGER.warn("Custom aggregation {} has been replaced.", name);
        }
        return this;
    }
    
    /**
     * @param measure measure definition
     * @return concrete reduction of the measure
     * @throws AggregationException when a custom function is not registered
     */
    public Aggregator resolve(Measure measure) {
        
        if (measure.getAggregation() == AggregationKind.CUSTOM) {
            Aggregator custom = customs.get(measure.getFunction());
            if (custom == null) {
                throw new AggregationException("Can not resolve custom aggregation " + measure.getFunction() 
                    + " of measure " + measure.getName());
            }
            return custom;
        }
        if (measure.getAggregation() == AggregationKind.PERCENTILE) {
            return percentile(measure.getPercentileRank());
        }
        return of(measure.getAggregation());
    }
    
    /**
     * @param kind built-in kind
     * @return reduction function
     * @throws AggregationException for {@link AggregationKind#CUSTOM}, it needs a name
     */
    public static Aggregator of(AggregationKind kind) {
        
        switch (kind) {
            case SUM:
                return Aggregators::sum;
            case MEAN:
                return Aggregators::mean;
            case MEDIAN:
                return percentile(DEFAULT_PERCENTILE);
            case COUNT:
                return Aggregators::count;
            case MIN:
                return values -> {
                    List<BigDecimal> numbers = numbers(values);
                    return numbers.isEmpty() ? null : scale(Collections.min(numbers));
                };
            case MAX:
                return values -> {
                    List<BigDecimal> numbers = numbers(values);
                    return numbers.isEmpty() ? null : scale(Collections.max(numbers));
                };
            case STD:
                return values -> {
                    BigDecimal var = variance(numbers(values));
                    return var == null ? null : scale(sqrt(var));
                };
            case VAR:
                return values -> {
                    BigDecimal var = variance(numbers(values));
                    return var == null ? null : scale(var);
                };
            case PERCENTILE:
                return percentile(DEFAULT_PERCENTILE);
            default:
                throw new AggregationException("Aggregation " + kind.getCode() + " need a registered function.");
        }
    }
    
    public static Aggregator percentile(double rank) {
        
        Assert.isTrue(rank >= 0 && rank <= 100, "Percentile rank must between 0 and 100.");
        return values -> {
            List<BigDecimal> sorted = numbers(values);
            if (sorted.isEmpty()) {
                return null;
            }
            Collections.sort(sorted);
            double position = rank / 100d * (sorted.size() - 1);
            int lower = (int) Math.floor(position);
            int upper = (int) Math.ceil(position);
            BigDecimal low = sorted.get(lower);
            if (lower == upper) {
                return scale(low);
            }
            BigDecimal fraction = BigDecimal.valueOf(position - lower);
            return scale(low.add(sorted.get(upper).subtract(low).multiply(fraction)));
        };
    }
    
    static BigDecimal sum(List<?> values) {
        
        List<BigDecimal> numbers = numbers(values);
        if (numbers.isEmpty()) {
            return null;
        }
        return scale(numbers.stream().reduce(BigDecimal.ZERO, (x, y) -> x.add(y)));
    }
    
    static BigDecimal mean(List<?> values) {
        
        List<BigDecimal> numbers = numbers(values);
        if (numbers.isEmpty()) {
            return null;
        }
        BigDecimal sum = numbers.stream().reduce(BigDecimal.ZERO, (x, y) -> x.add(y));
        return sum.divide(BigDecimal.valueOf(numbers.size()), Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }
    
    static BigDecimal count(List<?> values) {
        
        long count = values.stream().filter(v -> v != null).count();
        return BigDecimal.valueOf(count);
    }
    
    private static BigDecimal variance(List<BigDecimal> numbers) {
        
        if (numbers.isEmpty()) {
            return null;
        }
        BigDecimal n = BigDecimal.valueOf(numbers.size());
        BigDecimal mean = numbers.stream().reduce(BigDecimal.ZERO, (x, y) -> x.add(y)).divide(n, MathContext.DECIMAL128);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal v : numbers) {
            BigDecimal d = v.subtract(mean);
            squares = squares.add(d.multiply(d));
        }
        return squares.divide(n, MathContext.DECIMAL128);
    }
    
    /**
     * Newton iteration on {@link MathContext#DECIMAL128}, seeded from the double root.
     */
    static BigDecimal sqrt(BigDecimal value) {
        
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        Assert.isTrue(value.signum() > 0, "Can not take square root of negative " + value);
        BigDecimal two = BigDecimal.valueOf(2);
        double seed = Math.sqrt(value.doubleValue());
        BigDecimal x = seed > 0 && !Double.isInfinite(seed) ? new BigDecimal(seed, MathContext.DECIMAL128) : value;
        for (int i = 0; i < 100; i++) {
            BigDecimal next = x.add(value.divide(x, MathContext.DECIMAL128)).divide(two, MathContext.DECIMAL128);
            if (next.compareTo(x) == 0) {
                break;
            }
            x = next;
        }
        return x;
    }
    
    static BigDecimal scale(BigDecimal value) {
        return value == null ? null : value.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }
    
    /**
     * @param values raw values
     * @return numeric values with <code>null</code>s dropped, modifiable
     * @throws AggregationException when a value is not numeric
     */
    static List<BigDecimal> numbers(List<?> values) {
        
        List<BigDecimal> numbers = new ArrayList<BigDecimal>(values.size());
        for (Object v : values) {
            BigDecimal d = toDecimal(v);
            if (d != null) {
                numbers.add(d);
            }
        }
        return numbers;
    }
    
    /**
     * @param value raw value
     * @return decimal form, <code>null</code> for <code>null</code>
     * @throws AggregationException when value is not numeric
     */
    public static BigDecimal toDecimal(Object value) {
        
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new AggregationException("Can not aggregate non-finite value " + value);
            }
            return BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new AggregationException("Can not aggregate non-numeric value '" + value + "'", e);
        }
    }
}
