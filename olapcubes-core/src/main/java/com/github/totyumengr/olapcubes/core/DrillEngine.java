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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hierarchy level transitions on a {@link Query}. Both operations return a new query with an adjusted drill path, 
 * the given query is never touched.
 * 
 * @author mengran
 *
 */
public class DrillEngine {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(DrillEngine.class);
    
    private final CubeRegistry registry;
    
    public DrillEngine(CubeRegistry registry) {
        this.registry = registry;
    }
    
    /**
     * Append <code>(dimension, level)</code> to the drill path.
     * @param query current query
     * @param dimension dimension name
     * @param level target finer level
     * @return new query
     * @throws CubeNotFoundException if cube of query is not registered
     * @throws InvalidDimensionException if dimension is not defined on cube
     * @throws InvalidLevelException if level is not in hierarchy
     */
    public Query drillDown(Query query, String dimension, String level) {
        
        checkLevel(query, dimension, level);
        Query drilled = query.toBuilder().drill(dimension, level).build();
        LOGGER.info("Drill down {} to {}, path now {}", dimension, level, drilled.getDrillPath());
        return drilled;
    }
    
    /**
     * Remove every drill step of the dimension at another level, then append <code>(dimension, level)</code>.
     * @param query current query
     * @param dimension dimension name
     * @param level target coarser level
     * @return new query
     * @throws CubeNotFoundException if cube of query is not registered
     * @throws InvalidDimensionException if dimension is not defined on cube
     * @throws InvalidLevelException if level is not in hierarchy
     */
    public Query drillUp(Query query, String dimension, String level) {
        
        checkLevel(query, dimension, level);
        List<DrillStep> path = new ArrayList<DrillStep>(query.getDrillPath().size() + 1);
        for (DrillStep step : query.getDrillPath()) {
            if (!(step.getDimension().equals(dimension) && !step.getLevel().equals(level))) {
                path.add(step);
            }
        }
        path.add(new DrillStep(dimension, level));
        Query drilled = query.toBuilder().drillPath(path).build();
        LOGGER.info("Drill up {} to {}, path now {}", dimension, level, drilled.getDrillPath());
        return drilled;
    }
    
    private void checkLevel(Query query, String dimension, String level) {
        
        Dimension dim = registry.get(query.getCubeName()).getDimension(dimension);
        if (!dim.hasLevel(level)) {
            throw new InvalidLevelException("Level " + level + " is not in hierarchy " + dim.getLevels() 
                + " of dimension " + dimension);
        }
    }
}
