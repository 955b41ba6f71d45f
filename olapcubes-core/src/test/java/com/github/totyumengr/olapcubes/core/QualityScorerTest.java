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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class QualityScorerTest {
    
    private final QualityScorer scorer = new QualityScorer(new EngineSettings());
    
    private static List<Map<String, Object>> records(int count) {
        
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(count);
        for (int i = 0; i < count; i++) {
            records.add(Collections.<String, Object>singletonMap("id", i));
        }
        return records;
    }
    
    @Test
    public void test_Score_Weights() {
        
        Query query = Query.builder("c").dimensions("d1", "d2").measures("m1", "m2", "m3").build();
        Map<String, MeasureSummary> summary = Collections.emptyMap();
        
        // 1.0 * 0.4 + 0.5 * 0.3 + 1.0 * 0.3
        Assert.assertEquals(0.85d, scorer.score(query, records(3), summary, 10L).getScore(), 0.0001d);
        // 0.5 * 0.4 + 0.5 * 0.3 + 1.0 * 0.3
        Assert.assertEquals(0.65d, scorer.score(query, records(0), summary, -1L).getScore(), 0.0001d);
        // 1.0 * 0.4 + 0.5 * 0.3 + 0.5 * 0.3
        Assert.assertEquals(0.70d, scorer.score(query, records(3), summary, 2000L).getScore(), 0.0001d);
    }
    
    @Test
    public void test_Complexity_Capped() {
        
        Query query = Query.builder("c").dimensions("d1", "d2", "d3", "d4", "d5", "d6")
                .measures("m1", "m2", "m3", "m4", "m5", "m6").build();
        QualityScorer.Assessment assessment = scorer.score(query, records(1), Collections.<String, MeasureSummary>emptyMap(), 0L);
        
        Assert.assertEquals(1.0d, assessment.getScore(), 0.0001d);
        Assert.assertTrue(assessment.getRecommendations().contains(
                "Many dimensions selected, consider narrowing to the key ones."));
    }
    
    @Test
    public void test_Efficiency() {
        
        Assert.assertEquals(1.0d, scorer.efficiency(-1L), 0d);
        Assert.assertEquals(1.0d, scorer.efficiency(1000L), 0d);
        Assert.assertEquals(0.25d, scorer.efficiency(4000L), 0.0001d);
    }
    
    @Test
    public void test_Interpretation() {
        
        Map<String, MeasureSummary> summary = new LinkedHashMap<String, MeasureSummary>();
        summary.put("total_hours", new MeasureSummary(new BigDecimal("30"), new BigDecimal("7.5"), 4, null, null));
        summary.put("staff_ids", new MeasureSummary(null, null, 4, null, null));
        
        Assert.assertEquals("2 records aggregated. Mean of total_hours is 7.50.", scorer.interpret(records(2), summary));
    }
    
    @Test
    public void test_Recommendations() {
        
        Query drilled = Query.builder("c").dimensions("d").measures("m").drill("d", "l").build();
        Assert.assertTrue(scorer.recommend(drilled, records(10)).isEmpty());
        
        List<String> recommendations = scorer.recommend(drilled.toBuilder().drillPath(Collections.<DrillStep>emptyList())
                .build(), records(1001));
        Assert.assertEquals(2, recommendations.size());
        Assert.assertEquals("Large result of 1001 records, consider adding filters.", recommendations.get(0));
        Assert.assertEquals("Drill down for a more detailed analysis.", recommendations.get(1));
    }
}
