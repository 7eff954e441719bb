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
package com.github.totyumengr.salescubes.core;

/**
 * Define supported cube calculation. It equal to "SELECT {dimensions}, {function(metric)}... FROM {fact table} 
 * GROUP BY {dimensions}" plus identifiers of grouped facts.
 * 
 * @author mengran
 *
 */
public interface Aggregations {

    /**
     * Calculation scale of divisions.
     */
    int IND_SCALE = 8;
    
    /**
     * Single level aggregation of fact-table, one row per distinct tuple of dimension values.
     * @param factTable detail data, derived dimensions already appended
     * @param dimensions group by columns
     * @param metrics aggregation functions of metric columns
     * @return aggregated cube
     * @throws ConfigurationException when specs are invalid, before any grouping
     * @throws AggregationException when a value can not be grouped or aggregated
     */
    Cube build(FactTable factTable, DimensionSpec dimensions, MetricSpec metrics);
    
}
