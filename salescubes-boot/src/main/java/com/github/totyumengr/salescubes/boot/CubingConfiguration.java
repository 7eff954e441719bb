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

import java.nio.file.Paths;
import java.util.List;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

import com.github.totyumengr.salescubes.core.Aggregations;
import com.github.totyumengr.salescubes.core.CalendarDimensionDeriver;
import com.github.totyumengr.salescubes.core.ConfigurationException;
import com.github.totyumengr.salescubes.core.CubeBuilder;
import com.github.totyumengr.salescubes.core.CubeSink;
import com.github.totyumengr.salescubes.core.DelimitedFileCubeSink;
import com.github.totyumengr.salescubes.core.DerivedDimensionProvider;
import com.github.totyumengr.salescubes.core.DimensionSpec;
import com.github.totyumengr.salescubes.core.FactSource;
import com.github.totyumengr.salescubes.core.MetricSpec;
import com.github.totyumengr.salescubes.core.OlapCubingJob;

/**
 * Wire cubing job from <code>salescubes.*</code> properties.
 * @author mengran
 *
 */
@Configuration
public class CubingConfiguration {
    
    @Bean
    public FactSource factSource(DataSource dataSource, 
            @Value("${salescubes.source.sql}") String sql, 
            @Value("${salescubes.cube.name}") String name, 
            @Value("${salescubes.source.id-column}") String idColumn) {
        return new JdbcFactSource(new JdbcTemplate(dataSource), sql, name, idColumn);
    }
    
    @Bean
    public CalendarDimensionDeriver calendarDimensionDeriver(@Value("${salescubes.source.date-column}") String dateColumn) {
        return new CalendarDimensionDeriver(dateColumn);
    }
    
    @Bean
    public Aggregations cubeBuilder() {
        return new CubeBuilder();
    }
    
    @Bean
    public CubeSink cubeSink(@Value("${salescubes.sink.path}") String path, 
            @Value("${salescubes.sink.delimiter}") String delimiter) {
        return new DelimitedFileCubeSink(Paths.get(path), delimiterOf(delimiter));
    }
    
    @Bean
    public DimensionSpec dimensionSpec(@Value("${salescubes.cube.dimensions}") String dimensions) {
        return DimensionSpec.of(StringUtils.trimArrayElements(StringUtils.commaDelimitedListToStringArray(dimensions)));
    }
    
    @Bean
    public MetricSpec metricSpec(@Value("${salescubes.cube.metrics}") String metrics) {
        return new MetricSpecParser().parse(metrics);
    }
    
    @Bean
    public OlapCubingJob olapCubingJob(FactSource factSource, List<DerivedDimensionProvider> providers, 
            Aggregations aggregations, CubeSink cubeSink, DimensionSpec dimensionSpec, MetricSpec metricSpec) {
        return new OlapCubingJob(factSource, providers, aggregations, cubeSink, dimensionSpec, metricSpec);
    }
    
    static char delimiterOf(String delimiter) {
        if (delimiter == null || delimiter.length() != 1) {
            throw new ConfigurationException("Sink delimiter must be one character, but is '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }
    
}
