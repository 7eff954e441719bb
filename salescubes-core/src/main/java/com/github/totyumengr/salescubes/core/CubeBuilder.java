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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.salescubes.core.FactTable.Record;

/**
 * In-memory, single pass implementation of {@link Aggregations}. Facts are grouped by exact tuple of dimension 
 * values, <code>null</code> is a group key like any other value. Members of a group are kept as 
 * <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a> of {@link Record#getOrdinal() ordinals}, so 
 * iterating it gives identifiers in load order and the partition of facts can be verified cheaply.
 * 
 * <p>Numeric dimension values are compared by value, scale is ignored. Floating point dimension values are not 
 * supported, exact equality on them is meaningless.
 * 
 * @author mengran
 *
 */
public class CubeBuilder implements Aggregations {
    
    private final Logger logger;
    
    /**
     * Resolved (metric, function) pair.
     */
    private static class Measure {
        
        final String metric;
        final int index;
        final AggregateFunction function;
        
        Measure(String metric, int index, AggregateFunction function) {
            this.metric = metric;
            this.index = index;
            this.function = function;
        }
    }
    
    public CubeBuilder() {
        this(LoggerFactory.getLogger(CubeBuilder.class));
    }
    
    public CubeBuilder(Logger logger) {
        super();
        Assert.notNull(logger, "Logger can not be null.");
        this.logger = logger;
    }

    @Override
    public Cube build(FactTable factTable, DimensionSpec dimensions, MetricSpec metrics) {
        
        Assert.notNull(factTable, "Fact-table can not be null.");
        Assert.notNull(dimensions, "Dimension spec can not be null.");
        Assert.notNull(metrics, "Metric spec can not be null.");
        
        StopWatch stopWatch = new StopWatch(factTable.getName());
        
        // All configuration errors before grouping
        stopWatch.start("validate");
        List<String> columns;
        int[] dimIndexes = new int[dimensions.size()];
        List<Measure> measures = new ArrayList<Measure>();
        try {
            columns = ColumnNamer.nameColumns(dimensions, metrics);
            for (int i = 0; i < dimensions.size(); i++) {
                dimIndexes[i] = indexOf(factTable, dimensions.getColumns().get(i), "Dimension");
            }
            for (String metric : metrics.getColumns()) {
                int index = indexOf(factTable, metric, "Metric");
                for (String function : metrics.getFunctions(metric)) {
                    measures.add(new Measure(metric, index, AggregateFunction.of(function)));
                }
            }
        } catch (ConfigurationException e) {
            logger.error("Invalid cube configuration {} {} for {}: {}", dimensions, metrics, factTable, e.getMessage());
            throw e;
        }
        stopWatch.stop();
        
        stopWatch.start("group");
        Map<List<Object>, List<Object>> dimValues = new HashMap<List<Object>, List<Object>>();
        Map<List<Object>, RoaringBitmap> groups = group(factTable, dimensions, dimIndexes, dimValues);
        checkPartition(groups.values(), factTable.size());
        stopWatch.stop();
        
        stopWatch.start("aggregate");
        Cube cube = new Cube(factTable.getName(), dimensions, metrics, columns);
        List<Record> records = factTable.getRecords();
        for (Entry<List<Object>, RoaringBitmap> group : groups.entrySet()) {
            List<Record> members = new ArrayList<Record>(group.getValue().getCardinality());
            List<Object> recordIds = new ArrayList<Object>(group.getValue().getCardinality());
            for (int ordinal : group.getValue()) {
                Record record = records.get(ordinal);
                members.add(record);
                recordIds.add(record.getId());
            }
            
            Map<String, List<Object>> valuesCache = new LinkedHashMap<String, List<Object>>();
            Map<String, List<BigDecimal>> numbersCache = new LinkedHashMap<String, List<BigDecimal>>();
            List<Object> aggregated = new ArrayList<Object>(measures.size());
            for (Measure m : measures) {
                List<Object> values = valuesCache.computeIfAbsent(m.metric, k -> valuesOf(members, m.index));
                List<BigDecimal> numbers = m.function.isNumeric() 
                        ? numbersCache.computeIfAbsent(m.metric, k -> numbersOf(members, values, m.metric)) 
                        : new ArrayList<BigDecimal>(0);
                aggregated.add(m.function.aggregate(values, numbers));
            }
            
            Cube.Row row = cube.addRow(dimValues.get(group.getKey()), aggregated, recordIds);
            logger.debug("Aggregated {}", row);
        }
        stopWatch.stop();
        
        logger.info("Build cube {} by {} with {} rows from {} facts using {} ms.", cube.getName(), 
                dimensions.getColumns(), cube.size(), factTable.size(), stopWatch.getTotalTimeMillis());
        logger.debug(stopWatch.prettyPrint());
        return cube;
    }
    
    private int indexOf(FactTable factTable, String column, String role) {
        
        if (!factTable.hasColumn(column)) {
            throw new ConfigurationException(role + " column " + column + " is not a column of fact-table " 
                    + factTable.getName() + " " + factTable.getColumns());
        }
        return factTable.getColumnIndex(column);
    }
    
    private Map<List<Object>, RoaringBitmap> group(FactTable factTable, DimensionSpec dimensions, int[] dimIndexes, 
            Map<List<Object>, List<Object>> dimValues) {
        
        Map<List<Object>, RoaringBitmap> groups = new LinkedHashMap<List<Object>, RoaringBitmap>();
        for (Record record : factTable.getRecords()) {
            List<Object> key = new ArrayList<Object>(dimIndexes.length);
            List<Object> values = new ArrayList<Object>(dimIndexes.length);
            for (int i = 0; i < dimIndexes.length; i++) {
                Object value = record.get(dimIndexes[i]);
                if (value instanceof Double || value instanceof Float) {
                    logger.error("Floating value {} of dimension {} in {}", value, dimensions.getColumns().get(i), record);
                    throw new AggregationException("Floating point value " + value + " of dimension " 
                            + dimensions.getColumns().get(i) + " in record " + record.getId() + " is not supported.");
                }
                key.add(normalize(value));
                values.add(value);
            }
            // First seen values stand for the group
            dimValues.putIfAbsent(key, values);
            groups.computeIfAbsent(key, k -> new RoaringBitmap()).add(record.getOrdinal());
        }
        logger.info("Grouped {} facts of {} into {} groups by {}", factTable.size(), factTable.getName(), 
                groups.size(), dimensions.getColumns());
        return groups;
    }
    
    /**
     * Every fact must be in exactly one group.
     */
    private void checkPartition(Collection<RoaringBitmap> groups, int factCount) {
        
        RoaringBitmap all = new RoaringBitmap();
        long members = 0;
        for (RoaringBitmap group : groups) {
            members += group.getLongCardinality();
            all.or(group);
        }
        boolean covered = factCount == 0 ? all.isEmpty() 
                : all.getLongCardinality() == factCount && all.first() == 0 && all.last() == factCount - 1;
        if (members != factCount || !covered) {
            throw new AggregationException("Groups hold " + members + " members (" + all.getLongCardinality() 
                    + " distinct) but fact-table has " + factCount + " facts.");
        }
    }
    
    private static List<Object> valuesOf(List<Record> members, int index) {
        
        List<Object> values = new ArrayList<Object>(members.size());
        for (Record record : members) {
            values.add(record.get(index));
        }
        return values;
    }
    
    private List<BigDecimal> numbersOf(List<Record> members, List<Object> values, String metric) {
        
        List<BigDecimal> numbers = new ArrayList<BigDecimal>(values.size());
        for (int i = 0; i < values.size(); i++) {
            BigDecimal number;
            try {
                number = toNumber(values.get(i));
            } catch (NumberFormatException e) {
                logger.error("Non-numeric value '{}' of metric {} in {}", values.get(i), metric, members.get(i));
                throw new AggregationException("Non-numeric value '" + values.get(i) + "' of metric " + metric 
                        + " in record " + members.get(i).getId(), e);
            }
            if (number != null) {
                numbers.add(number);
            }
        }
        return numbers;
    }
    
    /**
     * Numbers equal in value become the same object key, so <code>10</code>, <code>10.0</code> and 
     * <code>10.00</code> are one value. NaN becomes <code>null</code>, other values are kept.
     */
    static Object normalize(Object value) {
        
        if (value instanceof Double || value instanceof Float) {
            if (Double.isInfinite(((Number) value).doubleValue())) {
                return value;
            }
        } else if (!(value instanceof BigDecimal || value instanceof BigInteger || value instanceof Long 
                || value instanceof Integer || value instanceof Short || value instanceof Byte)) {
            return value;
        }
        BigDecimal number = toNumber(value);
        return number == null ? null : number.stripTrailingZeros();
    }
    
    /**
     * @return number of value, <code>null</code> for null and NaN
     * @throws NumberFormatException when value is not a number
     */
    static BigDecimal toNumber(Object value) throws NumberFormatException {
        
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            // Infinite is rejected by BigDecimal
            return new BigDecimal(value.toString());
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            return text.isEmpty() ? null : new BigDecimal(text);
        }
        throw new NumberFormatException(value.getClass().getName() + " is not a number type.");
    }
    
}
