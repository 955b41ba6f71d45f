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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * {@link RowSource} over rows held in memory per cube, for tests and demos.
 * 
 * @author mengran
 *
 */
public class InMemoryRowSource implements RowSource {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRowSource.class);
    
    private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<String, List<Map<String, Object>>>();
    
    /**
     * @param cubeName cube name
     * @param rows rows of cube, replace previous ones
     * @return this for chaining
     */
    public InMemoryRowSource put(String cubeName, List<Map<String, Object>> rows) {
        
        Assert.hasText(cubeName, "Cube name can not empty.");
        Assert.notNull(rows, "Rows can not null.");
        List<Map<String, Object>> copy = new ArrayList<Map<String, Object>>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(row)));
        }
        tables.put(cubeName, Collections.unmodifiableList(copy));
        LOGGER.info("Put {} rows of cube {}", copy.size(), cubeName);
        return this;
    }

    @Override
    public List<Map<String, Object>> fetchRows(String cubeName, List<String> dimensionColumns, 
            List<String> measureColumns) {
        
        List<Map<String, Object>> rows = tables.get(cubeName);
        if (rows == null) {
            throw new DataAccessException("No rows of cube " + cubeName + " in memory.");
        }
        LOGGER.debug("Fetch {} rows of cube {} with dimensions {} and measures {}", rows.size(), cubeName, 
            dimensionColumns, measureColumns);
        return rows;
    }
}
