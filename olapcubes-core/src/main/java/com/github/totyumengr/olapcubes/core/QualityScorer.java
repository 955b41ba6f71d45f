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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quality score, interpretation and recommendations of a query result.
 * 
 * <p>Score = 0.4 * completeness + 0.3 * complexity + 0.3 * efficiency, each in [0, 1]:
 * <ul>
 *   <li>completeness: 1.0 with records, {@value #EMPTY_COMPLETENESS} without
 *   <li>complexity: selected dimensions plus measures against {@link EngineSettings#getComplexityCeiling()}, capped
 *   <li>efficiency: 1.0 if latency is unknown or within {@link EngineSettings#getLatencyThresholdMs()}, 
 *   otherwise threshold / latency
 * </ul>
 * 
 * @author mengran
 *
 */
public class QualityScorer {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(QualityScorer.class);
    
    static final double COMPLETENESS_WEIGHT = 0.4d;
    static final double COMPLEXITY_WEIGHT = 0.3d;
    static final double EFFICIENCY_WEIGHT = 0.3d;
    
    static final double EMPTY_COMPLETENESS = 0.5d;
    
    private final EngineSettings settings;
    
    public QualityScorer(EngineSettings settings) {
        this.settings = settings;
    }
    
    /**
     * @param query executed query
     * @param records final records
     * @param summary summary per measure
     * @param latencyMs measured latency, negative if unknown
     * @return assessment
     */
    public Assessment score(Query query, List<Map<String, Object>> records, Map<String, MeasureSummary> summary, 
            long latencyMs) {
        
        double completeness = records.isEmpty() ? EMPTY_COMPLETENESS : 1.0d;
        double complexity = Math.min(1.0d, 
                (query.getDimensions().size() + query.getMeasures().size()) / (double) settings.getComplexityCeiling());
        double efficiency = efficiency(latencyMs);
        double score = completeness * COMPLETENESS_WEIGHT + complexity * COMPLEXITY_WEIGHT 
                + efficiency * EFFICIENCY_WEIGHT;
        
        if (score < settings.getQualityThreshold()) {
            LOGGER.warn("Quality {} of {} under threshold {}: completeness {}, complexity {}, efficiency {}", 
                String.format(Locale.ROOT, "%.2f", score), query, settings.getQualityThreshold(), completeness, 
                complexity, efficiency);
        }
        return new Assessment(score, interpret(records, summary), recommend(query, records));
    }
    
    double efficiency(long latencyMs) {
        
        if (latencyMs < 0 || latencyMs <= settings.getLatencyThresholdMs()) {
            return 1.0d;
        }
        return settings.getLatencyThresholdMs() / (double) latencyMs;
    }
    
    String interpret(List<Map<String, Object>> records, Map<String, MeasureSummary> summary) {
        
        StringBuilder sb = new StringBuilder();
        sb.append(records.size()).append(" records aggregated.");
        for (Entry<String, MeasureSummary> e : summary.entrySet()) {
            BigDecimal mean = e.getValue().getMean();
            if (mean != null) {
                sb.append(String.format(Locale.ROOT, " Mean of %s is %.2f.", e.getKey(), mean));
            }
        }
        return sb.toString();
    }
    
    List<String> recommend(Query query, List<Map<String, Object>> records) {
        
        List<String> recommendations = new ArrayList<String>(3);
        if (records.size() > settings.getLargeResultThreshold()) {
            recommendations.add("Large result of " + records.size() + " records, consider adding filters.");
        }
        if (query.getDimensions().size() > settings.getDimensionComplexityThreshold()) {
            recommendations.add("Many dimensions selected, consider narrowing to the key ones.");
        }
        if (query.getDrillPath().isEmpty()) {
            recommendations.add("Drill down for a more detailed analysis.");
        }
        return recommendations;
    }
    
    /**
     * Score with its human readable explanation.
     * @author mengran
     *
     */
    public static final class Assessment {
        
        private final double score;
        private final String interpretation;
        private final List<String> recommendations;
        
        Assessment(double score, String interpretation, List<String> recommendations) {
            this.score = score;
            this.interpretation = interpretation;
            this.recommendations = Collections.unmodifiableList(recommendations);
        }

        public double getScore() {
            return score;
        }

        public String getInterpretation() {
            return interpretation;
        }

        public List<String> getRecommendations() {
            return recommendations;
        }
    }
}
