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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.olapcubes.core.Cube;
import com.github.totyumengr.olapcubes.core.CubeRegistry;
import com.github.totyumengr.olapcubes.core.DataAccessException;
import com.github.totyumengr.olapcubes.core.RowSource;

/**
 * {@link RowSource} reading the data source table of a cube through {@link JdbcTemplate}. Row keys are the 
 * requested column names whatever case the database reports.
 * 
 * @author mengran
 *
 */
public class JdbcRowSource implements RowSource {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcRowSource.class);
    
    /**
     * Plain or schema qualified identifier, never quoted.
     */
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    
    private final JdbcTemplate jdbcTemplate;
    private final CubeRegistry registry;
    
    public JdbcRowSource(DataSource dataSource, CubeRegistry registry) {
        
        Assert.notNull(dataSource, "Data source can not null.");
        Assert.notNull(registry, "Cube registry can not null.");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.registry = registry;
    }
    
    private static String identifier(String name) {
        
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new DataAccessException("Illegal SQL identifier '" + name + "'");
        }
        return name;
    }
    
    @Override
    public List<Map<String, Object>> fetchRows(String cubeName, List<String> dimensionColumns, 
            List<String> measureColumns) {
        
        Cube cube = registry.get(cubeName);
        Set<String> distinct = new LinkedHashSet<String>(dimensionColumns);
        distinct.addAll(measureColumns);
        final List<String> columns = new ArrayList<String>(distinct.size());
        for (String c : distinct) {
            columns.add(identifier(c));
        }
        String sql = "SELECT " + String.join(", ", columns) + " FROM " + identifier(cube.getDataSource());
        
        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        List<Map<String, Object>> rows;
        try {
            rows = jdbcTemplate.query(sql, new RowMapper<Map<String, Object>>() {
                
                @Override
                public Map<String, Object> mapRow(ResultSet rs, int rowNum) throws SQLException {
                    
                    Map<String, Object> row = new LinkedHashMap<String, Object>();
                    for (int i = 0; i < columns.size(); i++) {
                        row.put(columns.get(i), rs.getObject(i + 1));
                    }
                    return row;
                }
            });
        } catch (org.springframework.dao.DataAccessException e) {
            throw new DataAccessException("Can not fetch rows of cube " + cubeName + ": " + e.getMessage(), e);
        }
        stopWatch.stop();
        LOGGER.info("Fetch {} rows of cube {} by [{}] using {} ms.", rows.size(), cubeName, sql, 
            stopWatch.getTotalTimeMillis());
        return rows;
    }
}
