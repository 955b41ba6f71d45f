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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.github.totyumengr.olapcubes.core.AggregationException;
import com.github.totyumengr.olapcubes.core.AggregationResult;
import com.github.totyumengr.olapcubes.core.Cube;
import com.github.totyumengr.olapcubes.core.CubeNotFoundException;
import com.github.totyumengr.olapcubes.core.DuplicateCubeException;
import com.github.totyumengr.olapcubes.core.DynamicAggregation;
import com.github.totyumengr.olapcubes.core.MultiDimensionalView;
import com.github.totyumengr.olapcubes.core.OlapEngine;
import com.github.totyumengr.olapcubes.core.PivotTable;
import com.github.totyumengr.olapcubes.core.Query;
import com.github.totyumengr.olapcubes.core.ResultCache.CacheStats;

/**
 * HTTP/JSON surface of {@link OlapEngine}. Query endpoints always answer 200 with a result, possibly degraded; 
 * registry errors map to 404 and 409.
 * 
 * @author mengran
 *
 */
@Controller
public class BootOlapController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootOlapController.class);
    
    @Autowired
    private OlapEngine engine;
    
    public BootOlapController() {
    }
    
    BootOlapController(OlapEngine engine) {
        this.engine = engine;
    }
    
    @RequestMapping(value="/cubes", method=RequestMethod.GET)
    public @ResponseBody List<Cube> cubes() {
        
        List<Cube> cubes = new ArrayList<Cube>();
        for (String name : engine.getRegistry().list()) {
            cubes.add(engine.getRegistry().get(name));
        }
        LOGGER.info("List {} cubes.", cubes.size());
        return cubes;
    }
    
    @RequestMapping(value="/cubes/{name}", method=RequestMethod.GET)
    public @ResponseBody Cube cube(@PathVariable String name) {
        return engine.getRegistry().get(name);
    }
    
    @RequestMapping(value="/cubes", method=RequestMethod.POST)
    @ResponseStatus(HttpStatus.CREATED)
    public @ResponseBody Cube register(@RequestBody Cube cube) {
        
        engine.getRegistry().register(cube);
        LOGGER.info("Success to register {}", cube);
        return cube;
    }
    
    @RequestMapping(value="/cubes", method=RequestMethod.PUT)
    public @ResponseBody Cube replace(@RequestBody Cube cube) {
        
        Cube previous = engine.replaceCube(cube);
        LOGGER.info("Success to replace {} by {}", previous, cube);
        return cube;
    }
    
    @RequestMapping(value="/query", method=RequestMethod.POST)
    public @ResponseBody AggregationResult query(@RequestBody Query query) {
        
        LOGGER.info("Try to execute {}", query);
        AggregationResult result = engine.execute(query);
        LOGGER.info("Execute {} result {} records, cache hit {}, quality {}.", query.getFingerprint(), 
            result.getTotalRecords(), result.isCacheHit(), result.getQualityScore());
        return result;
    }
    
    @RequestMapping(value="/drill/down", method=RequestMethod.POST)
    public @ResponseBody AggregationResult drillDown(@RequestBody DrillRequest request) {
        
        LOGGER.info("Try to {}", request);
        return engine.drillDown(request.getQuery(), request.getDimension(), request.getLevel());
    }
    
    @RequestMapping(value="/drill/up", method=RequestMethod.POST)
    public @ResponseBody AggregationResult drillUp(@RequestBody DrillRequest request) {
        
        LOGGER.info("Try to {}", request);
        return engine.drillUp(request.getQuery(), request.getDimension(), request.getLevel());
    }
    
    @RequestMapping(value="/pivot", method=RequestMethod.POST)
    public @ResponseBody PivotTable pivot(@RequestBody PivotRequest request) {
        return engine.pivot(request.getRows(), request.getRowKeys(), request.getColumnKeys(), request.getValueColumn(), 
                request.getAggregation());
    }
    
    @RequestMapping(value="/aggregate", method=RequestMethod.POST)
    public @ResponseBody DynamicAggregation aggregate(@RequestBody AggregateRequest request) {
        return engine.dynamicAggregate(request.getRows(), request.getGroupBy(), request.getMeasures());
    }
    
    @RequestMapping(value="/view", method=RequestMethod.POST)
    public @ResponseBody MultiDimensionalView view(@RequestBody ViewRequest request) {
        return engine.view(request.getCubeName(), request.getDimensions(), request.getMeasures());
    }
    
    @RequestMapping(value="/cache", method=RequestMethod.GET)
    public @ResponseBody CacheStats cache() {
        return engine.getCache().stats();
    }
    
    @RequestMapping(value="/cache", method=RequestMethod.DELETE)
    public @ResponseBody CacheStats clearCache() {
        
        engine.getCache().clear();
        LOGGER.info("Cache cleared.");
        return engine.getCache().stats();
    }
    
    private static Map<String, Object> error(HttpStatus status, Exception e) {
        
        Map<String, Object> error = new LinkedHashMap<String, Object>();
        error.put("status", status.value());
        error.put("error", e.getMessage());
        return error;
    }
    
    @ExceptionHandler(CubeNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public @ResponseBody Map<String, Object> notFound(CubeNotFoundException e) {
        
        LOGGER.warn("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, e);
    }
    
    @ExceptionHandler(DuplicateCubeException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public @ResponseBody Map<String, Object> duplicate(DuplicateCubeException e) {
        
        LOGGER.warn("Conflict: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e);
    }
    
    @ExceptionHandler({IllegalArgumentException.class, AggregationException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public @ResponseBody Map<String, Object> badRequest(RuntimeException e) {
        
        LOGGER.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }
}
