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

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map.Entry;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Query fingerprint to {@link AggregationResult} cache with time based expiry and a maximum entry count.
 * 
 * <p>Entries are kept in insertion order. When a {@link #put(String, AggregationResult)} grows the cache over its 
 * maximum size, expired entries are evicted first and then the oldest insertions. {@link #get(String)} does not 
 * tell "never cached" from "expired", both return <code>null</code>.
 * 
 * @author mengran
 *
 */
public class ResultCache {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultCache.class);
    
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
    
    public static final int DEFAULT_MAX_SIZE = 1000;
    
    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<String, CacheEntry>();
    
    /**
     * Protect {@link #entries}, readers never see a partially written entry.
     */
    private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    
    private volatile boolean shutdown = false;
    
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    
    private static final class CacheEntry {
        
        private final AggregationResult result;
        private final long createdAt;
        
        private CacheEntry(AggregationResult result, long createdAt) {
            this.result = result;
            this.createdAt = createdAt;
        }
    }
    
    public ResultCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }
    
    public ResultCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, Clock.systemUTC());
    }
    
    public ResultCache(Duration ttl, int maxSize, Clock clock) {
        
        Assert.notNull(ttl, "Cache TTL can not null.");
        Assert.isTrue(!ttl.isNegative() && !ttl.isZero(), "Cache TTL must be positive.");
        Assert.isTrue(maxSize > 0, "Cache max size must be positive.");
        Assert.notNull(clock, "Clock can not null.");
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
        LOGGER.info("Create result cache with ttl {} and max size {}", ttl, maxSize);
    }
    
    private boolean expired(CacheEntry entry, long now) {
        return now - entry.createdAt > ttl.toMillis();
    }
    
    /**
     * @param fingerprint query fingerprint
     * @return cached result, <code>null</code> if never cached or expired
     */
    public AggregationResult get(String fingerprint) {
        
        CacheEntry entry;
        readWriteLock.readLock().lock();
        try {
            entry = entries.get(fingerprint);
        } finally {
            readWriteLock.readLock().unlock();
        }
        if (entry == null || expired(entry, clock.millis())) {
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        return entry.result;
    }
    
    /**
     * Store a result, last writer wins for the same fingerprint.
     * @param fingerprint query fingerprint
     * @param result result to cache
     */
    public void put(String fingerprint, AggregationResult result) {
        
        Assert.hasText(fingerprint, "Fingerprint can not empty.");
        Assert.notNull(result, "Result can not null.");
        if (shutdown) {
            LOGGER.debug("Cache has been shutdown, ignore {}", fingerprint);
            return;
        }
        readWriteLock.writeLock().lock();
        try {
            // Re-insert so that a refreshed entry becomes the newest
            entries.remove(fingerprint);
            entries.put(fingerprint, new CacheEntry(result, clock.millis()));
            if (entries.size() > maxSize) {
                int expired = removeExpired(clock.millis());
                int oldest = 0;
                Iterator<String> it = entries.keySet().iterator();
                while (entries.size() > maxSize && it.hasNext()) {
                    it.next();
                    it.remove();
                    oldest++;
                }
                evictions.addAndGet(oldest);
                LOGGER.debug("Cache over {} entries, evicted {} expired and {} oldest", maxSize, expired, oldest);
            }
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }
    
    /**
     * @return count of evicted entries
     */
    public int evictExpired() {
        
        readWriteLock.writeLock().lock();
        try {
            int count = removeExpired(clock.millis());
            if (count > 0) {
                LOGGER.info("Evicted {} expired cache entries", count);
            }
            return count;
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }
    
    /**
     * Drop every result computed on a cube.
     * @param cubeName cube name
     * @return count of evicted entries
     */
    public int evictCube(String cubeName) {
        
        int count = 0;
        readWriteLock.writeLock().lock();
        try {
            for (Iterator<Entry<String, CacheEntry>> it = entries.entrySet().iterator(); it.hasNext();) {
                Query query = it.next().getValue().result.getQuery();
                if (query != null && query.getCubeName().equals(cubeName)) {
                    it.remove();
                    count++;
                }
            }
            evictions.addAndGet(count);
        } finally {
            readWriteLock.writeLock().unlock();
        }
        LOGGER.info("Evicted {} cache entries of cube {}", count, cubeName);
        return count;
    }
    
    // Caller must hold the write lock
    private int removeExpired(long now) {
        
        int count = 0;
        for (Iterator<Entry<String, CacheEntry>> it = entries.entrySet().iterator(); it.hasNext();) {
            if (expired(it.next().getValue(), now)) {
                it.remove();
                count++;
            }
        }
        evictions.addAndGet(count);
        return count;
    }
    
    /**
     * @return entry count, expired entries not evicted yet are counted
     */
    public int size() {
        
        readWriteLock.readLock().lock();
        try {
            return entries.size();
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
    
    public void clear() {
        
        readWriteLock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }
    
    /**
     * Drop all entries, later {@link #put(String, AggregationResult)} calls are ignored.
     */
    public void shutdown() {
        
        shutdown = true;
        clear();
        LOGGER.info("Result cache shutdown, {}", stats());
    }
    
    public boolean isShutdown() {
        return shutdown;
    }
    
    public CacheStats stats() {
        return new CacheStats(size(), maxSize, ttl.toMillis(), hits.get(), misses.get(), evictions.get());
    }
    
    /**
     * Snapshot of cache counters.
     * @author mengran
     *
     */
    public static final class CacheStats {
        
        private final int size;
        private final int maxSize;
        private final long ttlMs;
        private final long hits;
        private final long misses;
        private final long evictions;
        
        CacheStats(int size, int maxSize, long ttlMs, long hits, long misses, long evictions) {
            this.size = size;
            this.maxSize = maxSize;
            this.ttlMs = ttlMs;
            this.hits = hits;
            this.misses = misses;
            this.evictions = evictions;
        }

        public int getSize() {
            return size;
        }

        @JsonProperty("max_size")
        public int getMaxSize() {
            return maxSize;
        }

        @JsonProperty("ttl_ms")
        public long getTtlMs() {
            return ttlMs;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }

        public long getEvictions() {
            return evictions;
        }

        @Override
        public String toString() {
            return "CacheStats [size=" + size + ", maxSize=" + maxSize + ", hits=" + hits + ", misses=" + misses 
                    + ", evictions=" + evictions + "]";
        }
    }
}
