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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Fact table object of <a href="http://en.wikipedia.org/wiki/Star_schema">Star Schema</a>. It hold detail data 
 * of one run in memory, every {@link Record} is identified by the value of {@link #getIdColumn() id column}.
 * 
 * <p>Instances are immutable after {@link FactTableBuilder#done()}. Derived dimensions are added by
 * {@link #derive(Collection)} which returns a new table.
 * 
 * @author mengran
 *
 */
public class FactTable {
    
    static class Meta {
        
        String name;
        String idColumn;
        int idIndex = -1;
        private LinkedHashMap<String, Integer> columnNames = new LinkedHashMap<String, Integer>();

        @Override
        public String toString() {
            return "Meta [name=" + name + ", idColumn=" + idColumn + ", columnNames=" + columnNames.keySet() + "]";
        }
    }
    
    /**
     * Holding detail data of one fact.
     * @author mengran
     *
     */
    public class Record {
        
        private final int ordinal;     // Load position, 0 based. Can hold 2^31 records.
        
        private final Object[] values;
        
        private Record(int ordinal, Object[] values) {
            super();
            this.ordinal = ordinal;
            this.values = values;
        }
        
        public int getOrdinal() {
            return ordinal;
        }
        
        public Object getId() {
            return values[meta.idIndex];
        }

        public Object get(String column) {
            return values[FactTable.this.getColumnIndex(column)];
        }
        
        public Object get(int index) {
            return values[index];
        }

        @Override
        public String toString() {
            return "Record [ordinal=" + ordinal + ", id=" + getId() + "]";
        }
        
    }
    
    Meta meta;
    
    private final List<Record> records = new ArrayList<Record>();
    
    private final Logger logger;
    
    private FactTable(String name, Logger logger) {
        Assert.hasText(name, "Fact-table name can not empty.");
        Meta meta = new Meta();
        meta.name = name;
        
        this.meta = meta;
        this.logger = logger;
    }
    
    /**
     * Builder pattern class for {@link FactTable}, chain model begin with {@link #build(String)} 
     * and end with {@link #done()}.
     * 
     * @author mengran
     *
     */
    public static class FactTableBuilder {
        
        private final Logger logger;
        
        private FactTable current;
        
        private Set<Object> seenIds;
        
        public FactTableBuilder() {
            this(LoggerFactory.getLogger(FactTable.class));
        }
        
        public FactTableBuilder(Logger logger) {
            super();
            Assert.notNull(logger, "Logger can not be null.");
            this.logger = logger;
        }

        public FactTableBuilder build(String name) {
            
            if (current != null) {
                throw new IllegalStateException("Previous building " + current + " is doing call #done to finish it.");
            }
            current = new FactTable(name, logger);
            seenIds = new HashSet<Object>();
            return this;
        }
        
        private FactTable current() {
            if (current == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
            return current;
        }
        
        public FactTableBuilder addColumns(List<String> columnNames) {
            
            FactTable current = current();
            if (!current.records.isEmpty()) {
                throw new IllegalStateException("Columns must be added before any data of " + current.meta.name);
            }
            for (String column : columnNames) {
                if (column == null || column.isEmpty()) {
                    throw new IngestionException("Blank column name in fact-table " + current.meta.name);
                }
                if (current.meta.columnNames.containsKey(column)) {
                    throw new IngestionException("Column " + column + " has exists in fact-table " + current.meta.name);
                }
                current.meta.columnNames.put(column, current.meta.columnNames.size());
            }
            return this;
        }
        
        public FactTableBuilder identifiedBy(String idColumn) {
            
            FactTable current = current();
            Integer index = current.meta.columnNames.get(idColumn);
            if (index == null) {
                throw new ConfigurationException("Identifier column " + idColumn + " is not a column of fact-table "
                        + current.meta.name + " " + current.meta.columnNames.keySet());
            }
            current.meta.idColumn = idColumn;
            current.meta.idIndex = index;
            return this;
        }
        
        public FactTableBuilder addDatas(List<?> datas) {
            
            FactTable current = current();
            Assert.isTrue(current.meta.columnNames.size() > 0, "Fact-table must have a column at least.");
            if (current.meta.idIndex < 0) {
                throw new IllegalStateException("Identifier column is not specified, call #identifiedBy first.");
            }
            if (datas.size() != current.meta.columnNames.size()) {
                throw new IngestionException("Record #" + current.records.size() + " of " + current.meta.name + " has "
                        + datas.size() + " values but " + current.meta.columnNames.size() + " columns declared.");
            }
            
            Object id = datas.get(current.meta.idIndex);
            if (id == null) {
                throw new IngestionException("Record #" + current.records.size() + " of " + current.meta.name 
                        + " has no identifier in column " + current.meta.idColumn);
            }
            if (!seenIds.add(id)) {
                throw new IngestionException("Duplicate identifier " + id + " in column " + current.meta.idColumn 
                        + " of " + current.meta.name);
            }
            
            current.records.add(current.new Record(current.records.size(), datas.toArray()));
            return this;
        }
        
        /**
         * Drop current building without result, nothing happens if none is started.
         */
        public void discard() {
            if (current != null) {
                logger.debug("Discard unfinished building {}", current);
            }
            this.current = null;
            this.seenIds = null;
        }
        
        public FactTable done() {
            
            FactTable current = current();
            this.current = null;
            this.seenIds = null;
            
            if (current.meta.idIndex < 0) {
                throw new IllegalStateException("Identifier column is not specified for " + current.meta.name);
            }
            logger.info("Build completed: name {} with {} columns and {} records.", 
                    current.meta.name, current.meta.columnNames.size(), current.records.size());
            return current;
        }
    }
    
    /**
     * Append derived dimension columns computed by given providers, in {@link DerivedDimensionProvider#getOrder() order}.
     * @param providers derived dimension providers
     * @return a new fact-table holding all columns of this one followed by derived columns
     * @throws ConfigurationException when a required column is missing or a derived column has exists
     */
    public FactTable derive(Collection<? extends DerivedDimensionProvider> providers) {
        
        List<DerivedDimensionProvider> sorted = new ArrayList<DerivedDimensionProvider>(providers);
        Collections.sort(sorted, Comparator.comparingInt(DerivedDimensionProvider::getOrder));
        
        List<String> columns = new ArrayList<String>(getColumns());
        for (DerivedDimensionProvider p : sorted) {
            for (String required : p.getRequiredColumns()) {
                if (!hasColumn(required)) {
                    throw new ConfigurationException("Column " + required + " required by " + p 
                            + " is not a column of fact-table " + meta.name);
                }
            }
            for (String derived : p.getDerivedDimNames()) {
                if (columns.contains(derived)) {
                    throw new ConfigurationException("Derived dimension " + derived + " of " + p 
                            + " has exists in fact-table " + meta.name);
                }
                columns.add(derived);
            }
        }
        logger.info("Derive dimensions of {} by providers {}", meta.name, sorted);
        
        FactTableBuilder builder = new FactTableBuilder(logger).build(meta.name)
                .addColumns(columns)
                .identifiedBy(meta.idColumn);
        for (Record record : records) {
            List<Object> datas = new ArrayList<Object>(columns.size());
            datas.addAll(Arrays.asList(record.values));
            for (DerivedDimensionProvider p : sorted) {
                List<Object> derived = p.derive(record);
                if (derived.size() != p.getDerivedDimNames().size()) {
                    throw new IllegalStateException(p + " derived " + derived.size() + " values for " 
                            + p.getDerivedDimNames().size() + " columns.");
                }
                datas.addAll(derived);
            }
            builder.addDatas(datas);
        }
        return builder.done();
    }

    /**
     * Column index by search {@link #meta}.
     * @param column column name
     * @return column index in fact-table
     * @throws IllegalArgumentException if column name is empty or invalid.
     */
    public int getColumnIndex(String column) throws IllegalArgumentException {
        
        Integer index = column == null ? null : meta.columnNames.get(column);
        if (index == null) {
            throw new IllegalArgumentException("Column " + column + " is not a column of fact-table " + meta.name);
        }
        return index;
    }
    
    public boolean hasColumn(String column) {
        return meta.columnNames.containsKey(column);
    }
    
    public List<String> getColumns() {
        return Collections.unmodifiableList(new ArrayList<String>(meta.columnNames.keySet()));
    }
    
    public String getName() {
        return meta.name;
    }
    
    public String getIdColumn() {
        return meta.idColumn;
    }
    
    public List<Record> getRecords() {
        return Collections.unmodifiableList(records);
    }
    
    public int size() {
        return records.size();
    }
    
    @Override
    public String toString() {
        return "FactTable [meta=" + meta + ", records=" + records.size() + "]";
    }
    
}
