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
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Aggregation functions vocabulary. Numeric functions work on non-null values of a group only, 
 * {@link #COUNT} counts grouped facts regardless of nulls.
 * 
 * @author mengran
 *
 */
public enum AggregateFunction {
    
    SUM(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            return numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    },
    /** Null when a group has no value. */
    MEAN(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            if (numbers.isEmpty()) {
                return null;
            }
            return divide(SUM.aggregate(values, numbers), numbers.size());
        }
    },
    COUNT(false) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            return Long.valueOf(values.size());
        }
    },
    MIN(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            return numbers.stream().min(BigDecimal::compareTo).orElse(null);
        }
    },
    MAX(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            return numbers.stream().max(BigDecimal::compareTo).orElse(null);
        }
    },
    MEDIAN(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            if (numbers.isEmpty()) {
                return null;
            }
            List<BigDecimal> sorted = new ArrayList<BigDecimal>(numbers);
            Collections.sort(sorted);
            int middle = sorted.size() / 2;
            if (sorted.size() % 2 == 1) {
                return sorted.get(middle);
            }
            return divide(sorted.get(middle - 1).add(sorted.get(middle)), 2);
        }
    },
    /** Sample variance, null when a group has less than two values. */
    VAR(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            BigDecimal variance = variance(numbers);
            return variance == null ? null : variance.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP);
        }
    },
    /** Sample standard deviation, null when a group has less than two values. */
    STD(true) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            BigDecimal variance = variance(numbers);
            return variance == null ? null 
                    : variance.sqrt(MathContext.DECIMAL128).setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP);
        }
    },
    NUNIQUE(false) {
        @Override
        public Object aggregate(List<Object> values, List<BigDecimal> numbers) {
            Set<Object> distinct = new HashSet<Object>();
            for (Object value : values) {
                distinct.add(CubeBuilder.normalize(value));
            }
            distinct.remove(null);
            return Long.valueOf(distinct.size());
        }
    };
    
    private final boolean numeric;
    
    private AggregateFunction(boolean numeric) {
        this.numeric = numeric;
    }
    
    /**
     * @return <code>true</code> if this function need numeric values of metric
     */
    public boolean isNumeric() {
        return numeric;
    }
    
    /**
     * @return lower case name used in configuration and column names
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * @param values metric values of every grouped fact, in group order, nulls included
     * @param numbers non-null values converted to numbers, empty for non-numeric functions
     * @return aggregated value, may be null
     */
    public abstract Object aggregate(List<Object> values, List<BigDecimal> numbers);
    
    /**
     * @param name function name, case insensitive
     * @return function of name
     * @throws ConfigurationException when name is not supported
     */
    public static AggregateFunction of(String name) throws ConfigurationException {
        
        if (name != null) {
            for (AggregateFunction f : values()) {
                if (f.getName().equalsIgnoreCase(name.trim())) {
                    return f;
                }
            }
        }
        throw new ConfigurationException("Unsupported aggregation function '" + name + "', supported are " 
                + supportedNames());
    }
    
    public static List<String> supportedNames() {
        List<String> names = new ArrayList<String>();
        for (AggregateFunction f : values()) {
            names.add(f.getName());
        }
        return names;
    }
    
    private static BigDecimal divide(Object dividend, int divisor) {
        return ((BigDecimal) dividend).divide(BigDecimal.valueOf(divisor), Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }
    
    private static BigDecimal variance(List<BigDecimal> numbers) {
        
        if (numbers.size() < 2) {
            return null;
        }
        BigDecimal count = BigDecimal.valueOf(numbers.size());
        BigDecimal mean = numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add).divide(count, MathContext.DECIMAL128);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal n : numbers) {
            BigDecimal deviation = n.subtract(mean);
            squares = squares.add(deviation.multiply(deviation));
        }
        return squares.divide(count.subtract(BigDecimal.ONE), MathContext.DECIMAL128);
    }
    
}
