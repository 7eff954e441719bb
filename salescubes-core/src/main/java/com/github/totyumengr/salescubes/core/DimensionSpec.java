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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered column names (native or derived) that define the grouping key of a cube. Order decides output column 
 * order only, grouping itself is set based.
 * 
 * @author mengran
 *
 */
public final class DimensionSpec {
    
    private final List<String> columns;
    
    private DimensionSpec(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("Dimension spec must have a column at least.");
        }
        Set<String> seen = new HashSet<String>();
        for (String column : columns) {
            if (column == null || column.trim().isEmpty()) {
                throw new ConfigurationException("Blank dimension column in " + columns);
            }
            if (!seen.add(column)) {
                throw new ConfigurationException("Dimension " + column + " has exists in " + columns);
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    }
    
    public static DimensionSpec of(String... columns) {
        return new DimensionSpec(Arrays.asList(columns));
    }
    
    public static DimensionSpec of(List<String> columns) {
        return new DimensionSpec(columns);
    }

    public List<String> getColumns() {
        return columns;
    }
    
    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DimensionSpec && columns.equals(((DimensionSpec) obj).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "DimensionSpec " + columns;
    }
    
}
