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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Fact table object of <a href="http://en.wikipedia.org/wiki/Star_schema">Star Schema</a>, a read-only view over 
 * the rows fetched for one query execution. Record id is the row position.
 * 
 * <p>Dimension columns are indexed with <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>: 
 * a filter entry ORs the bitmaps of its allowed values, entries are ANDed together.
 * 
 * @author mengran
 *
 */
public class FactTable {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(FactTable.class);
    
    private final String name;
    private final List<Map<String, Object>> records;
    private final Set<String> dimColumnNames;
    
    /**
     * Bitmap index for speed up filtering. Key is columnName + ":" + tagged value.
     */
    private final Map<String, RoaringBitmap> bitmapIndex;
    
    private FactTable(String name, List<Map<String, Object>> records, Set<String> dimColumnNames, 
            Map<String, RoaringBitmap> bitmapIndex) {
        this.name = name;
        this.records = records;
        this.dimColumnNames = dimColumnNames;
        this.bitmapIndex = bitmapIndex;
    }
    
    public static FactTableBuilder builder(String name) {
        return new FactTableBuilder(name);
    }
    
    private static String indexKey(String column, Object value) {
        return column + ":" + FilterValue.tag(value);
    }
    
    /**
     * @param filterColumns column name to allowed values, AND-combined
     * @return ids of passing records in ascending order
     * @throws IllegalArgumentException when filtering a column that is not indexed
     */
    public RoaringBitmap filter(Map<String, FilterValue> filterColumns) {
        
        RoaringBitmap ands = RoaringBitmap.bitmapOf();
        ands.add(0L, (long) records.size());
        if (filterColumns == null) {
            return ands;
        }
        for (Entry<String, FilterValue> entry : filterColumns.entrySet()) {
            if (!dimColumnNames.contains(entry.getKey())) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " of " + name + " is not indexed.");
            }
            RoaringBitmap ors = new RoaringBitmap();
            for (Object v : entry.getValue().getValues()) {
                RoaringBitmap o = bitmapIndex.get(indexKey(entry.getKey(), v));
                if (o != null) {
                    ors.or(o);
                }
            }
            ands.and(ors);
        }
        LOGGER.debug("Filter {} of {} by {} pass {} records", records.size(), name, filterColumns, ands.getCardinality());
        return ands;
    }
    
    /**
     * @param ids record ids, e.g. result of {@link #filter(Map)}
     * @return records in fetch order
     */
    public List<Map<String, Object>> select(RoaringBitmap ids) {
        
        List<Map<String, Object>> selected = new ArrayList<Map<String, Object>>(ids.getCardinality());
        ids.forEach((int id) -> selected.add(records.get(id)));
        return selected;
    }
    
    public Map<String, Object> getRecord(int id) {
        return records.get(id);
    }
    
    public int size() {
        return records.size();
    }
    
    public String getName() {
        return name;
    }
    
    @Override
    public String toString() {
        return "FactTable [name=" + name + ", dimension columns=" + dimColumnNames + ", records=" + records.size() 
                + ", indexes=" + bitmapIndex.size() + "]";
    }
    
    /**
     * Builder pattern class for {@link FactTable}, chain model begin with {@link FactTable#builder(String)} 
     * and end with {@link #done()}.
     * 
     * @author mengran
     *
     */
    public static class FactTableBuilder {
        
        private final String name;
        private final Set<String> dimColumnNames = new LinkedHashSet<String>();
        private final List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
        private final Map<String, RoaringBitmap> bitmapIndex = new HashMap<String, RoaringBitmap>();
        private boolean done = false;
        
        private FactTableBuilder(String name) {
            
            Assert.hasText(name, "Fact-table name can not empty.");
            this.name = name;
        }
        
        public FactTableBuilder addDimColumns(List<String> columns) {
            
            Assert.state(records.isEmpty(), "Dimension columns must be added before records.");
            for (String c : columns) {
                if (!dimColumnNames.add(c)) {
                    throw new IllegalStateException("Dimension " + c + " has exists.");
                }
            }
            return this;
        }
        
        public FactTableBuilder addRecord(Map<String, Object> record) {
            
            Assert.state(!done, "Fact-table " + name + " has been built.");
            Assert.notNull(record, "Record can not null.");
            int id = records.size();
            records.add(record);
            // Index dimension value
            for (String column : dimColumnNames) {
                String key = indexKey(column, record.get(column));
                RoaringBitmap bitmap = bitmapIndex.get(key);
                if (bitmap == null) {
                    bitmap = new RoaringBitmap();
                    bitmapIndex.put(key, bitmap);
                }
                bitmap.add(id);
            }
            return this;
        }
        
        public FactTableBuilder addRecords(List<Map<String, Object>> rows) {
            
            for (Map<String, Object> row : rows) {
                addRecord(row);
            }
            return this;
        }
        
        public FactTable done() {
            
            Assert.state(!done, "Fact-table " + name + " has been built.");
            done = true;
            long usedBytes = 0;
            for (RoaringBitmap b : bitmapIndex.values()) {
                b.runOptimize();
                usedBytes += b.getSizeInBytes();
            }
            LOGGER.debug("Build completed: name {} with {} dimension columns and {} records, {} indexes used {} kb.", 
                name, dimColumnNames.size(), records.size(), bitmapIndex.size(), usedBytes / 1024);
            return new FactTable(name, Collections.unmodifiableList(records), 
                    Collections.unmodifiableSet(dimColumnNames), bitmapIndex);
        }
    }
}
