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

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.olapcubes.core.CubeRegistry;
import com.github.totyumengr.olapcubes.core.InMemoryRowSource;
import com.github.totyumengr.olapcubes.core.OlapEngine;

/**
 * @author mengran
 *
 */
public class BootOlapControllerTest {
    
    private static final String DEPARTMENT_QUERY = "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"staff\"],"
            + "\"measures\":[\"total_hours\"],\"drill_path\":[{\"dimension\":\"staff\",\"level\":\"department\"}]}";
    
    private static final String TIME_QUERY = "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"time\"],"
            + "\"measures\":[\"total_hours\"]}";
    
    private OlapEngine engine;
    private MockMvc mockMvc;
    
    @Before
    public void prepare() {
        
        CubeDefinitions cubeDefinitions = new CubeDefinitions(new ObjectMapper());
        CubeRegistry registry = cubeDefinitions.register(new ClassPathResource("cubes.json"), new CubeRegistry());
        InMemoryRowSource rowSource = new InMemoryRowSource();
        for (Entry<String, List<Map<String, Object>>> e : cubeDefinitions.loadRows(
                new ClassPathResource("rows.json")).entrySet()) {
            rowSource.put(e.getKey(), e.getValue());
        }
        engine = new OlapEngine(registry, rowSource);
        mockMvc = MockMvcBuilders.standaloneSetup(new BootOlapController(engine)).build();
    }
    
    @After
    public void shutdown() {
        engine.shutdown();
    }
    
    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }
    
    @Test
    public void test_Cubes() throws Exception {
        
        mockMvc.perform(get("/cubes")).andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].name").value("shift_analysis_cube"))
            .andExpect(jsonPath("$[0].dimensions[1].hierarchy_levels[0]").value("department"));
        mockMvc.perform(get("/cubes/performance_analysis_cube")).andExpect(status().isOk())
            .andExpect(jsonPath("$.data_source").value("performance_data"));
        mockMvc.perform(get("/cubes/unknown_cube")).andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404));
    }
    
    @Test
    public void test_RegisterCube() throws Exception {
        
        String cube = "{\"name\":\"visit_cube\",\"data_source\":\"visit_data\","
                + "\"dimensions\":[{\"name\":\"ward\",\"type\":\"categorical\",\"hierarchy_levels\":[\"ward\"]}],"
                + "\"measures\":[{\"name\":\"visits\",\"aggregation\":\"count\",\"source_column\":\"visit_id\"}]}";
        postJson("/cubes", cube).andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("visit_cube"));
        postJson("/cubes", cube).andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value(409));
        mockMvc.perform(get("/cubes")).andExpect(jsonPath("$.length()").value(3));
    }
    
    @Test
    public void test_ReplaceCube_FormulaCanNotReachJvm() throws Exception {
        
        postJson("/query", DEPARTMENT_QUERY).andExpect(jsonPath("$.total_records").value(2));
        mockMvc.perform(get("/cache")).andExpect(jsonPath("$.size").value(1));
        
        String cube = "{\"name\":\"shift_analysis_cube\",\"data_source\":\"shift_analysis_data\","
                + "\"dimensions\":[{\"name\":\"staff\",\"type\":\"hierarchical\","
                + "\"hierarchy_levels\":[\"department\"],\"source_column\":\"department\"}],"
                + "\"measures\":[{\"name\":\"total_hours\",\"aggregation\":\"sum\","
                + "\"formula\":\"T(java.lang.System).setProperty('olapcubes.http.escape', 'yes')\"}]}";
        mockMvc.perform(put("/cubes").contentType(MediaType.APPLICATION_JSON).content(cube))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.measures[0].formula").exists());
        mockMvc.perform(get("/cache")).andExpect(jsonPath("$.size").value(0));
        
        postJson("/query", DEPARTMENT_QUERY).andExpect(status().isOk())
            .andExpect(jsonPath("$.cache_hit").value(false))
            .andExpect(jsonPath("$.quality_score").value(0.0d))
            .andExpect(jsonPath("$.error").exists());
        Assert.assertNull(System.getProperty("olapcubes.http.escape"));
    }
    
    @Test
    public void test_Query() throws Exception {
        
        postJson("/query", DEPARTMENT_QUERY).andExpect(status().isOk())
            .andExpect(jsonPath("$.total_records").value(2))
            .andExpect(jsonPath("$.cache_hit").value(false))
            .andExpect(jsonPath("$.records[0].staff").value("Nursing"))
            .andExpect(jsonPath("$.records[0].total_hours").value(16.0d))
            .andExpect(jsonPath("$.summary.total_hours.count").value(4));
        postJson("/query", DEPARTMENT_QUERY).andExpect(status().isOk())
            .andExpect(jsonPath("$.cache_hit").value(true))
            .andExpect(jsonPath("$.execution_time_ms").value(0));
        
        mockMvc.perform(get("/cache")).andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(1))
            .andExpect(jsonPath("$.max_size").value(1000))
            .andExpect(jsonPath("$.hits").value(1));
        mockMvc.perform(delete("/cache")).andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(0));
    }
    
    @Test
    public void test_Query_Filter() throws Exception {
        
        postJson("/query", "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"staff\"],"
                + "\"measures\":[\"total_hours\"],\"filters\":{\"staff\":[\"N001\",\"C001\"]}}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_records").value(2))
            .andExpect(jsonPath("$.summary.total_hours.sum").value(15.5d));
    }
    
    @Test
    public void test_Query_Degraded() throws Exception {
        
        postJson("/query", "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"staff\"],"
                + "\"measures\":[\"overtime_hours\"]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_records").value(0))
            .andExpect(jsonPath("$.quality_score").value(0.0d))
            .andExpect(jsonPath("$.error").exists());
        postJson("/query", "{\"cube_name\":\"missing_cube\",\"measures\":[\"total_hours\"]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").exists());
    }
    
    @Test
    public void test_Drill() throws Exception {
        
        postJson("/drill/down", "{\"query\":" + TIME_QUERY + ",\"dimension\":\"time\",\"level\":\"month\"}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_records").value(2))
            .andExpect(jsonPath("$.query.drill_path[0].level").value("month"))
            .andExpect(jsonPath("$.records[0].time").value("2025-01"))
            .andExpect(jsonPath("$.records[0].total_hours").value(23.5d))
            .andExpect(jsonPath("$.records[1].total_hours").value(6.0d));
        
        String dayQuery = "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"time\"],"
                + "\"measures\":[\"total_hours\"],\"drill_path\":[{\"dimension\":\"time\",\"level\":\"day\"}]}";
        postJson("/drill/up", "{\"query\":" + dayQuery + ",\"dimension\":\"time\",\"level\":\"year\"}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query.drill_path.length()").value(1))
            .andExpect(jsonPath("$.records[0].time").value("2025"))
            .andExpect(jsonPath("$.records[0].total_hours").value(29.5d));
        
        postJson("/drill/down", "{\"query\":" + TIME_QUERY + ",\"dimension\":\"time\",\"level\":\"decade\"}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").exists());
    }
    
    @Test
    public void test_Pivot() throws Exception {
        
        String rows = "[{\"dept\":\"ER\",\"month\":\"Jan\",\"hours\":8},{\"dept\":\"ER\",\"month\":\"Jan\",\"hours\":4},"
                + "{\"dept\":\"ER\",\"month\":\"Feb\",\"hours\":6},{\"dept\":\"ICU\",\"month\":\"Jan\",\"hours\":12}]";
        postJson("/pivot", "{\"rows\":" + rows + ",\"row_keys\":[\"dept\"],\"column_keys\":[\"month\"],"
                + "\"value_column\":\"hours\",\"aggregation\":\"sum\"}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cells.ER.Jan").value(12.0d))
            .andExpect(jsonPath("$.cells.ER.Feb").value(6.0d))
            .andExpect(jsonPath("$.cells.ICU.Jan").value(12.0d));
        
        postJson("/pivot", "{\"rows\":" + rows + ",\"row_keys\":[],\"column_keys\":[\"month\"],"
                + "\"value_column\":\"hours\"}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400));
    }
    
    @Test
    public void test_Aggregate() throws Exception {
        
        String rows = "[{\"dept\":\"ER\",\"hours\":8},{\"dept\":\"ER\",\"hours\":4},{\"dept\":\"ICU\",\"hours\":12}]";
        postJson("/aggregate", "{\"rows\":" + rows + ",\"group_by\":[\"dept\"],"
                + "\"measures\":{\"hours\":\"mean\"}}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_groups").value(2))
            .andExpect(jsonPath("$.groups[0].key.dept").value("ER"))
            .andExpect(jsonPath("$.groups[0].values.hours").value(6.0d));
    }
    
    @Test
    public void test_View() throws Exception {
        
        postJson("/view", "{\"cube_name\":\"shift_analysis_cube\",\"dimensions\":[\"facility\"],"
                + "\"measures\":[\"total_hours\",\"staff_count\"]}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.view_type").value("multi_dimensional"))
            .andExpect(jsonPath("$.cube_name").value("shift_analysis_cube"))
            .andExpect(jsonPath("$.total_records").value(2))
            .andExpect(jsonPath("$.data[1].facility").value("Hill Care Home"));
    }
}
