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
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link Aggregations#build(FactTable, DimensionSpec, MetricSpec)}: column names and one {@link Row} per 
 * distinct tuple of dimension values, in the order the first fact of every tuple was loaded.
 * 
 * <p>Rows partition facts of source table exactly, see {@link Row#getRecordIds()}.
 * 
 * @author mengran
 *
 */
public class Cube {
    
    private final String name;
    
    private final DimensionSpec dimensions;
    
    private final MetricSpec metrics;
    
    private final List<String> columns;
    
    private final List<Row> rows = new ArrayList<Row>();
    
    /**
     * One aggregated row.
     * @author mengran
     *
     */
    public class Row {
        
        private final List<Object> dimValues;
        
        private final List<Object> measures;
        
        private final List<Object> recordIds;
        
        private Row(List<Object> dimValues, List<Object> measures, List<Object> recordIds) {
            super();
            this.dimValues = Collections.unmodifiableList(dimValues);
            this.measures = Collections.unmodifiableList(measures);
            this.recordIds = Collections.unmodifiableList(recordIds);
        }
        
        /**
         * @return one value per dimension, nulls included
         */
        public List<Object> getDimValues() {
            return dimValues;
        }
        
        /**
         * @return one value per (metric, function) pair in column order
         */
        public List<Object> getMeasures() {
            return measures;
        }
        
        /**
         * @return identifiers of grouped facts in load order
         */
        public List<Object> getRecordIds() {
            return recordIds;
        }
        
        /**
         * @return values of every column, traceability list as last one
         */
        public List<Object> getValues() {
            List<Object> values = new ArrayList<Object>(columns.size());
            values.addAll(dimValues);
            values.addAll(measures);
            values.add(recordIds);
            return values;
        }
        
        /**
         * @param column cube column name
         * @return value of column
         * @throws IllegalArgumentException if column is not a cube column
         */
        public Object get(String column) {
            int index = columns.indexOf(column);
            if (index < 0) {
                throw new IllegalArgumentException("Column " + column + " is not a column of cube " + name);
            }
            return getValues().get(index);
        }

        @Override
        public String toString() {
            return "Row " + getValues();
        }
        
    }
    
    Cube(String name, DimensionSpec dimensions, MetricSpec metrics, List<String> columns) {
        super();
        this.name = name;
        this.dimensions = dimensions;
        this.metrics = metrics;
        this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    }
    
    Row addRow(List<Object> dimValues, List<Object> measures, List<Object> recordIds) {
        Row row = new Row(dimValues, measures, recordIds);
        rows.add(row);
        return row;
    }

    public String getName() {
        return name;
    }

    public DimensionSpec getDimensions() {
        return dimensions;
    }

    public MetricSpec getMetrics() {
        return metrics;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }
    
    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "Cube [name=" + name + ", columns=" + columns + ", rows=" + rows.size() + "]";
    }
    
}
