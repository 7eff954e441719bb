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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class AggregateFunctionTest {
    
    private static List<BigDecimal> numbers(String... values) {
        List<BigDecimal> numbers = new ArrayList<BigDecimal>();
        for (String v : values) {
            numbers.add(new BigDecimal(v));
        }
        return numbers;
    }
    
    private static void assertNumber(String expected, Object actual) {
        Assert.assertNotNull(actual);
        Assert.assertEquals(expected + " <> " + actual, 0, new BigDecimal(expected).compareTo((BigDecimal) actual));
    }
    
    @Test
    public void test_1_1_Of() {
        
        Assert.assertEquals(AggregateFunction.SUM, AggregateFunction.of("sum"));
        Assert.assertEquals(AggregateFunction.MEAN, AggregateFunction.of("MEAN"));
        Assert.assertEquals(AggregateFunction.NUNIQUE, AggregateFunction.of(" nunique "));
        Assert.assertEquals("count", AggregateFunction.COUNT.getName());
        Assert.assertTrue(AggregateFunction.supportedNames().contains("median"));
    }
    
    @Test
    public void test_1_2_Of_unknown() {
        
        for (String name : Arrays.asList("avg", "", null)) {
            try {
                AggregateFunction.of(name);
                Assert.fail(name);
            } catch (ConfigurationException e) {
                Assert.assertTrue(e.getMessage().contains("sum"));
            }
        }
    }
    
    @Test
    public void test_2_1_Basic() {
        
        List<Object> values = Arrays.<Object>asList(new BigDecimal("10"), null, new BigDecimal("20"));
        List<BigDecimal> numbers = numbers("10", "20");
        
        assertNumber("30", AggregateFunction.SUM.aggregate(values, numbers));
        assertNumber("15", AggregateFunction.MEAN.aggregate(values, numbers));
        Assert.assertEquals(3L, AggregateFunction.COUNT.aggregate(values, numbers));
        assertNumber("10", AggregateFunction.MIN.aggregate(values, numbers));
        assertNumber("20", AggregateFunction.MAX.aggregate(values, numbers));
        assertNumber("15", AggregateFunction.MEDIAN.aggregate(values, numbers));
        Assert.assertEquals(2L, AggregateFunction.NUNIQUE.aggregate(values, numbers));
    }
    
    @Test
    public void test_2_2_Empty_group_values() {
        
        List<Object> values = Collections.singletonList(null);
        List<BigDecimal> numbers = Collections.emptyList();
        
        assertNumber("0", AggregateFunction.SUM.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.MEAN.aggregate(values, numbers));
        Assert.assertEquals(1L, AggregateFunction.COUNT.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.MIN.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.MAX.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.MEDIAN.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.VAR.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.STD.aggregate(values, numbers));
        Assert.assertEquals(0L, AggregateFunction.NUNIQUE.aggregate(values, numbers));
    }
    
    @Test
    public void test_2_3_Sample_statistics() {
        
        List<BigDecimal> numbers = numbers("2", "4", "4", "4", "5", "5", "7", "9");
        List<Object> values = new ArrayList<Object>(numbers);
        
        // Population variance is 4, sample variance is 32 / 7
        assertNumber("4.57142857", AggregateFunction.VAR.aggregate(values, numbers));
        assertNumber("2.13808994", AggregateFunction.STD.aggregate(values, numbers));
        assertNumber("4.5", AggregateFunction.MEDIAN.aggregate(values, numbers));
        assertNumber("5", AggregateFunction.MEAN.aggregate(values, numbers));
        Assert.assertNull(AggregateFunction.VAR.aggregate(values.subList(0, 1), numbers.subList(0, 1)));
    }
    
    @Test
    public void test_2_4_Mean_scale() {
        
        List<BigDecimal> numbers = numbers("1", "1", "2");
        assertNumber("1.33333333", AggregateFunction.MEAN.aggregate(new ArrayList<Object>(numbers), numbers));
        Assert.assertEquals(Aggregations.IND_SCALE, 
                ((BigDecimal) AggregateFunction.MEAN.aggregate(new ArrayList<Object>(numbers), numbers)).scale());
    }
    
    @Test
    public void test_2_5_Nunique_by_value() {
        
        List<Object> values = Arrays.<Object>asList(new BigDecimal("10.0"), new BigDecimal("10.00"), 10L, 10, 
                null, Double.NaN, new BigDecimal("10.5"), "10");
        Assert.assertEquals(3L, AggregateFunction.NUNIQUE.aggregate(values, new ArrayList<BigDecimal>()));
    }
    
}
