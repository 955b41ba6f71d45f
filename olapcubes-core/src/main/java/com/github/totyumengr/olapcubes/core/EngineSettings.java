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

import java.time.Duration;

import org.springframework.util.Assert;

/**
 * Tunables of {@link OlapEngine}. Defaults match a dashboard workload: 30 minutes cache TTL, 1000 cached results.
 * @author mengran
 *
 */
public class EngineSettings {
    
    private boolean cacheEnabled = true;
    private Duration cacheTtl = ResultCache.DEFAULT_TTL;
    private int maxCacheEntries = ResultCache.DEFAULT_MAX_SIZE;
    private double qualityThreshold = 0.85d;
    private long latencyThresholdMs = 1000L;
    private int largeResultThreshold = 1000;
    private int dimensionComplexityThreshold = 5;
    private int complexityCeiling = 10;
    private boolean performanceLogging = true;

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public EngineSettings setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
        return this;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public EngineSettings setCacheTtl(Duration cacheTtl) {
        Assert.notNull(cacheTtl, "Cache TTL can not null.");
        this.cacheTtl = cacheTtl;
        return this;
    }

    public int getMaxCacheEntries() {
        return maxCacheEntries;
    }

    public EngineSettings setMaxCacheEntries(int maxCacheEntries) {
        this.maxCacheEntries = maxCacheEntries;
        return this;
    }

    /**
     * @return score under which a result is logged as low quality
     */
    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public EngineSettings setQualityThreshold(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
        return this;
    }

    /**
     * @return latency up to which execution efficiency scores 1.0
     */
    public long getLatencyThresholdMs() {
        return latencyThresholdMs;
    }

    public EngineSettings setLatencyThresholdMs(long latencyThresholdMs) {
        Assert.isTrue(latencyThresholdMs > 0, "Latency threshold must be positive.");
        this.latencyThresholdMs = latencyThresholdMs;
        return this;
    }

    /**
     * @return record count over which adding filters is recommended
     */
    public int getLargeResultThreshold() {
        return largeResultThreshold;
    }

    public EngineSettings setLargeResultThreshold(int largeResultThreshold) {
        this.largeResultThreshold = largeResultThreshold;
        return this;
    }

    /**
     * @return dimension count over which narrowing the selection is recommended
     */
    public int getDimensionComplexityThreshold() {
        return dimensionComplexityThreshold;
    }

    public EngineSettings setDimensionComplexityThreshold(int dimensionComplexityThreshold) {
        this.dimensionComplexityThreshold = dimensionComplexityThreshold;
        return this;
    }

    /**
     * @return selected dimensions plus measures giving full complexity score
     */
    public int getComplexityCeiling() {
        return complexityCeiling;
    }

    public EngineSettings setComplexityCeiling(int complexityCeiling) {
        Assert.isTrue(complexityCeiling > 0, "Complexity ceiling must be positive.");
        this.complexityCeiling = complexityCeiling;
        return this;
    }

    public boolean isPerformanceLogging() {
        return performanceLogging;
    }

    public EngineSettings setPerformanceLogging(boolean performanceLogging) {
        this.performanceLogging = performanceLogging;
        return this;
    }

    @Override
    public String toString() {
        return "EngineSettings [cacheEnabled=" + cacheEnabled + ", cacheTtl=" + cacheTtl + ", maxCacheEntries=" 
                + maxCacheEntries + ", qualityThreshold=" + qualityThreshold + ", latencyThresholdMs=" 
                + latencyThresholdMs + ", largeResultThreshold=" + largeResultThreshold 
                + ", dimensionComplexityThreshold=" + dimensionComplexityThreshold + ", complexityCeiling=" 
                + complexityCeiling + ", performanceLogging=" + performanceLogging + "]";
    }
}
