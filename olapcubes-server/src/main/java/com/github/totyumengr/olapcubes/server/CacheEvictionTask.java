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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.github.totyumengr.olapcubes.core.ResultCache;

/**
 * Periodically drop expired results of {@link ResultCache}.
 * @author mengran
 *
 */
@Component
public class CacheEvictionTask {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CacheEvictionTask.class);
    
    @Autowired
    private ResultCache resultCache;
    
    @Scheduled(fixedDelayString = "${olapcubes.cache.evict-interval-ms:60000}")
    public void evictExpired() {
        
        int evicted = resultCache.evictExpired();
        LOGGER.debug("Scheduled eviction removed {} expired results, {}", evicted, resultCache.stats());
    }
}
