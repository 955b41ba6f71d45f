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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Sole owner of {@link Cube} definitions. Read-mostly: lookups share a read lock, registration and replacement 
 * are serialized by the write lock.
 * 
 * @author mengran
 *
 */
public class CubeRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CubeRegistry.class);
    
    private final Map<String, Cube> cubes = new LinkedHashMap<String, Cube>();
    
    /**
     * Definition version per cube, bumped by {@link #replace(Cube)}.
     */
    private final Map<String, Long> versions = new HashMap<String, Long>();
    
    /**
     * Protect cube definitions.
     */
    private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    
    /**
     * @param cube definition
     * @throws DuplicateCubeException when a cube of same name has been registered
     */
    public void register(Cube cube) {
        
        Assert.notNull(cube, "Cube can not null.");
        readWriteLock.writeLock().lock();
        try {
            if (cubes.containsKey(cube.getName())) {
                throw new DuplicateCubeException("Cube " + cube.getName() + " has been registered.");
            }
            cubes.put(cube.getName(), cube);
            versions.put(cube.getName(), 1L);
        } finally {
            readWriteLock.writeLock().unlock();
        }
        LOGGER.info("Registered {}", cube);
    }
    
    /**
     * Replace a definition as a whole. This is a breaking change for queries built against the previous one.
     * @param cube new definition
     * @return previous definition, <code>null</code> if absent
     */
    public Cube replace(Cube cube) {
        
        Assert.notNull(cube, "Cube can not null.");
        Cube previous;
        readWriteLock.writeLock().lock();
        try {
            previous = cubes.put(cube.getName(), cube);
            Long version = versions.get(cube.getName());
            versions.put(cube.getName(), version == null ? 1L : version + 1);
        } finally {
            readWriteLock.writeLock().unlock();
        }
        if (previous != null) {
            LOGGER.warn("Breaking change: cube {} replaced, previous {}, now {}", cube.getName(), previous, cube);
        } else {
            LOGGER.info("Registered {} by replacement", cube);
        }
        return previous;
    }
    
    /**
     * @param name cube name
     * @return definition
     * @throws CubeNotFoundException if not registered
     */
    public Cube get(String name) {
        
        readWriteLock.readLock().lock();
        try {
            Cube cube = cubes.get(name);
            if (cube == null) {
                throw new CubeNotFoundException("Cube " + name + " is not registered.");
            }
            return cube;
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
    
    /**
     * @param name cube name
     * @return definition version, starts at 1 and grows with each {@link #replace(Cube)}, 0 if not registered
     */
    public long version(String name) {
        
        readWriteLock.readLock().lock();
        try {
            Long version = versions.get(name);
            return version == null ? 0L : version;
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
    
    /**
     * @param name cube name
     * @return <code>true</code> if registered
     */
    public boolean contains(String name) {
        
        readWriteLock.readLock().lock();
        try {
            return cubes.containsKey(name);
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
    
    /**
     * @return cube names in registration order
     */
    public List<String> list() {
        
        readWriteLock.readLock().lock();
        try {
            return new ArrayList<String>(cubes.keySet());
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
}
