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
package com.github.totyumengr.salescubes.boot;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.util.Assert;

import com.github.totyumengr.salescubes.core.CubeException;
import com.github.totyumengr.salescubes.core.FactSource;
import com.github.totyumengr.salescubes.core.FactTable;
import com.github.totyumengr.salescubes.core.FactTable.FactTableBuilder;
import com.github.totyumengr.salescubes.core.IngestionException;

/**
 * Load facts by running a SQL query, column labels of result set are the fact-table columns, an empty result
 * gives an empty fact-table. Integral values are 
 * widened to {@link Long}, other values are kept as the driver gives them.
 * 
 * @author mengran
 *
 */
public class JdbcFactSource implements FactSource {
    
    private final JdbcTemplate jdbcTemplate;
    
    private final String sql;
    
    private final String name;
    
    private final String idColumn;
    
    private final Logger logger;
    
    public JdbcFactSource(JdbcTemplate jdbcTemplate, String sql, String name, String idColumn) {
        this(jdbcTemplate, sql, name, idColumn, LoggerFactory.getLogger(JdbcFactSource.class));
    }
    
    public JdbcFactSource(JdbcTemplate jdbcTemplate, String sql, String name, String idColumn, Logger logger) {
        super();
        Assert.notNull(jdbcTemplate, "JdbcTemplate can not be null.");
        Assert.hasText(sql, "Fact source SQL can not empty.");
        Assert.hasText(name, "Fact-table name can not empty.");
        Assert.hasText(idColumn, "Identifier column can not empty.");
        Assert.notNull(logger, "Logger can not be null.");
        this.jdbcTemplate = jdbcTemplate;
        this.sql = sql;
        this.name = name;
        this.idColumn = idColumn;
        this.logger = logger;
    }

    @Override
    public FactTable load() throws IngestionException {
        
        logger.info("Start fetching facts {} by {}", name, sql);
        long startTime = System.currentTimeMillis();
        FactTableBuilder builder = new FactTableBuilder(logger).build(name);
        boolean builded = false;
        AtomicInteger rowCount = new AtomicInteger();
        try {
            jdbcTemplate.query(sql, new ResultSetExtractor<Void>() {
                
                @Override
                public Void extractData(ResultSet rs) throws SQLException {
                    // Columns come from meta so an empty result still has them
                    ResultSetMetaData meta = rs.getMetaData();
                    List<String> columns = new ArrayList<String>(meta.getColumnCount());
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        columns.add(meta.getColumnLabel(i));
                    }
                    logger.debug("Add columns {} of {}", columns, name);
                    builder.addColumns(columns).identifiedBy(idColumn);
                    
                    while (rs.next()) {
                        List<Object> datas = new ArrayList<Object>(columns.size());
                        for (int i = 1; i <= columns.size(); i++) {
                            datas.add(widen(rs.getObject(i)));
                        }
                        builder.addDatas(datas);
                        
                        if (rowCount.incrementAndGet() % 1000000 == 0) {
                            logger.info("Loaded {} records into fact-table {}.", rowCount.get(), name);
                        }
                    }
                    return null;
                }
            });
            
            FactTable factTable = builder.done();
            builded = true;
            logger.info("Success to fetch {} facts of {} using {} ms.", factTable.size(), name, 
                    System.currentTimeMillis() - startTime);
            return factTable;
        } catch (DataAccessException e) {
            logger.error("Error fetching facts {} by {} after {} records", name, sql, rowCount.get(), e);
            throw new IngestionException("Can not fetch facts of " + name + " by " + sql, e);
        } catch (CubeException e) {
            logger.error("Error fetching facts {} at record {}: {}", name, rowCount.get() + 1, e.getMessage());
            throw e;
        } finally {
            if (!builded) {
                builder.discard();
            }
        }
    }
    
    static Object widen(Object value) {
        
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Long.valueOf(((Number) value).longValue());
        }
        return value;
    }

    @Override
    public String toString() {
        return "JdbcFactSource [name=" + name + ", sql=" + sql + "]";
    }
    
}
