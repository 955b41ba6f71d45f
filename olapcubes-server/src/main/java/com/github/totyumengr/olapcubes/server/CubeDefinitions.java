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

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.util.Assert;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.Cube;
import com.github.totyumengr.olapcubes.core.CubeRegistry;

/**
 * Load cube definitions and in-memory rows from JSON resources.
 * 
 * <p>Cube definitions are a JSON array of cubes, using the same property names as the <code>/cubes</code> 
 * endpoint. Rows are a JSON object of cube name to array of rows.
 * 
 * @author mengran
 *
 */
public class CubeDefinitions {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CubeDefinitions.class);
    
    private final ObjectMapper objectMapper;
    
    public CubeDefinitions(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    /**
     * @param resource JSON array of cubes
     * @return cubes in file order
     * @throws IllegalStateException if resource can not be read or a definition is invalid
     */
    public List<Cube> load(Resource resource) {
        
        Assert.notNull(resource, "Cube definitions resource can not null.");
        try (InputStream in = resource.getInputStream()) {
            List<Cube> cubes = objectMapper.readValue(in, new TypeReference<List<Cube>>() { });
            LOGGER.info("Loaded {} cube definitions from {}", cubes.size(), resource.getDescription());
            return cubes;
        } catch (IOException e) {
            throw new IllegalStateException("Can not load cube definitions from " + resource.getDescription(), e);
        }
    }
    
    /**
     * @param resource JSON array of cubes
     * @param registry registry to fill, a cube of same name is a duplicate
     * @return registry
     */
    public CubeRegistry register(Resource resource, CubeRegistry registry) {
        
        for (Cube cube : load(resource)) {
            registry.register(cube);
        }
        return registry;
    }
    
    /**
     * @param resource JSON object of cube name to rows, absent resource means no rows
     * @return rows per cube
     */
    public Map<String, List<Map<String, Object>>> loadRows(Resource resource) {
        
        if (resource == null || !resource.exists()) {
            LOGGER.info("No in-memory rows resource, start with empty tables.");
            return Collections.emptyMap();
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, List<Map<String, Object>>> rows = objectMapper.readValue(in, 
                    new TypeReference<Map<String, List<Map<String, Object>>>>() { });
            LOGGER.info("Loaded rows of cubes {} from {}", rows.keySet(), resource.getDescription());
            return rows;
        } catch (IOException e) {
            throw new IllegalStateException("Can not load rows from " + resource.getDescription(), e);
        }
    }
}
