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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.springframework.util.Assert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Allowed value(s) of one dimension in a {@link Query} filter: either a {@link Scalar} (equality) or a {@link Set} 
 * (membership). JSON form is the bare scalar or an array.
 * 
 * <p>Numbers match numerically, so <code>8</code>, <code>8L</code> and <code>8.0</code> are the same member. Dates 
 * and date-times match by value whatever their type, so a JDBC timestamp matches the string 
 * <code>2025-01-06 08:00:00</code>.
 * 
 * @author mengran
 *
 */
public abstract class FilterValue {
    
    FilterValue() {
    }
    
    public static Scalar scalar(Object value) {
        return new Scalar(value);
    }
    
    public static Set set(Object... values) {
        
        List<Object> members = new ArrayList<Object>(values.length);
        Collections.addAll(members, values);
        return new Set(members);
    }
    
    public static Set set(Collection<?> values) {
        return new Set(values);
    }
    
    /**
     * @param value a collection for {@link Set}, otherwise {@link Scalar}
     * @return filter value
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FilterValue of(Object value) {
        
        if (value instanceof FilterValue) {
            return (FilterValue) value;
        }
        if (value instanceof Collection) {
            return new Set((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return set((Object[]) value);
        }
        return new Scalar(value);
    }
    
    /**
     * @param value raw column value
     * @return <code>true</code> if the value passes this filter
     */
    public boolean matches(Object value) {
        return normalizedMembers().contains(normalize(value));
    }
    
    /**
     * @return allowed values as given
     */
    public abstract List<Object> getValues();
    
    @JsonValue
    abstract Object toJson();
    
    abstract java.util.Set<Object> normalizedMembers();
    
    /**
     * @return order independent, type tagged rendering used by {@link Query#getFingerprint()}
     */
    abstract String canonical();
    
    /**
     * @param value raw value
     * @return comparable form of value, numbers become stripped {@link BigDecimal}, dates and date-times become 
     *      canonical text
     */
    static Object normalize(Object value) {
        
        if (value instanceof Number) {
            try {
                return Aggregators.toDecimal(value).stripTrailingZeros();
            } catch (AggregationException e) {
                return value;
            }
        }
        String temporal = TemporalLevels.canonical(value);
        return temporal == null ? value : temporal;
    }
    
    static String tag(Object value) {
        
        Object n = normalize(value);
        if (n instanceof BigDecimal) {
            return "n:" + ((BigDecimal) n).toPlainString();
        }
        if (n instanceof String) {
            return "s:" + n;
        }
        return (n == null ? "null" : n.getClass().getSimpleName() + ":" + n);
    }
    
    @Override
    public boolean equals(Object obj) {
        
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return normalizedMembers().equals(((FilterValue) obj).normalizedMembers());
    }
    
    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + normalizedMembers().hashCode();
    }
    
    /**
     * Equality with one value.
     */
    public static final class Scalar extends FilterValue {
        
        private final Object value;
        private final java.util.Set<Object> members;
        
        Scalar(Object value) {
            
            Assert.notNull(value, "Filter value can not null.");
            Assert.isTrue(!(value instanceof Collection), "Scalar filter can not hold a collection.");
            this.value = value;
            this.members = Collections.singleton(normalize(value));
        }
        
        public Object getValue() {
            return value;
        }

        @Override
        public List<Object> getValues() {
            return Collections.singletonList(value);
        }

        @Override
        Object toJson() {
            return value;
        }

        @Override
        java.util.Set<Object> normalizedMembers() {
            return members;
        }

        @Override
        String canonical() {
            return "=" + tag(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
    
    /**
     * Membership in a set of values.
     */
    public static final class Set extends FilterValue {
        
        private final List<Object> values;
        private final java.util.Set<Object> members;
        
        Set(Collection<?> values) {
            
            Assert.notNull(values, "Filter values can not null.");
            List<Object> copy = new ArrayList<Object>(values.size());
            java.util.Set<Object> normalized = new HashSet<Object>();
            for (Object v : values) {
                if (normalized.add(normalize(v))) {
                    copy.add(v);
                }
            }
            this.values = Collections.unmodifiableList(copy);
            this.members = Collections.unmodifiableSet(normalized);
        }

        @Override
        public List<Object> getValues() {
            return values;
        }

        @Override
        Object toJson() {
            return values;
        }

        @Override
        java.util.Set<Object> normalizedMembers() {
            return members;
        }

        @Override
        String canonical() {
            
            List<String> tags = new ArrayList<String>(values.size());
            for (Object v : values) {
                tags.add(tag(v));
            }
            Collections.sort(tags);
            return "in" + tags;
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }
}
