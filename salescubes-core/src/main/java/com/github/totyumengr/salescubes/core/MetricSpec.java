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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping of metric column to one or more aggregation function names, for example 
 * <code>{sale_amount_usd: [sum, mean], transaction_id: [count]}</code>. Every (metric, function) pair produces 
 * one cube column.
 * 
 * <p>Function names are kept as configured, they are checked against {@link AggregateFunction} when a cube is 
 * built.
 * 
 * @author mengran
 *
 */
public final class MetricSpec {
    
    private final LinkedHashMap<String, List<String>> functions;
    
    private MetricSpec(LinkedHashMap<String, List<String>> functions) {
        this.functions = functions;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        
        private final LinkedHashMap<String, List<String>> functions = new LinkedHashMap<String, List<String>>();
        
        private Builder() {
            super();
        }
        
        public Builder metric(String column, String... functionNames) {
            return metric(column, Arrays.asList(functionNames));
        }
        
        public Builder metric(String column, List<String> functionNames) {
            
            if (column == null || column.trim().isEmpty()) {
                throw new ConfigurationException("Blank metric column.");
            }
            if (functions.containsKey(column)) {
                throw new ConfigurationException("Metric " + column + " has exists.");
            }
            if (functionNames == null || functionNames.isEmpty()) {
                throw new ConfigurationException("Metric " + column + " must have an aggregation function at least.");
            }
            if (functionNames.contains(null)) {
                throw new ConfigurationException("Null aggregation function of metric " + column);
            }
            functions.put(column, Collections.unmodifiableList(new ArrayList<String>(functionNames)));
            return this;
        }
        
        public MetricSpec build() {
            if (functions.isEmpty()) {
                throw new ConfigurationException("Metric spec must have a metric at least.");
            }
            return new MetricSpec(new LinkedHashMap<String, List<String>>(functions));
        }
    }
    
    /**
     * @return metric columns in configured order
     */
    public Set<String> getColumns() {
        return Collections.unmodifiableSet(functions.keySet());
    }
    
    /**
     * @param column metric column
     * @return function names of column in configured order, empty if column is not a metric
     */
    public List<String> getFunctions(String column) {
        List<String> names = functions.get(column);
        return names == null ? Collections.<String>emptyList() : names;
    }
    
    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(functions);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof MetricSpec && functions.equals(((MetricSpec) obj).functions);
    }

    @Override
    public int hashCode() {
        return functions.hashCode();
    }

    @Override
    public String toString() {
        return "MetricSpec " + functions;
    }
    
}
