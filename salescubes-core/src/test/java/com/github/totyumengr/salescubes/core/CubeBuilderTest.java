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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import ch.qos.logback.classic.Level;

import com.github.totyumengr.salescubes.core.FactTable.FactTableBuilder;

/**
 * @author mengran
 *
 */
public class CubeBuilderTest {
    
    private final CubeBuilder cubeBuilder = new CubeBuilder();
    
    private static FactTable withCalendar(FactTable factTable) {
        return factTable.derive(Collections.singletonList(new CalendarDimensionDeriver("sale_date")));
    }
    
    private static Cube.Row rowOf(Cube cube, Object... dimValues) {
        for (Cube.Row row : cube.getRows()) {
            if (row.getDimValues().equals(Arrays.asList(dimValues))) {
                return row;
            }
        }
        Assert.fail("No row of " + Arrays.toString(dimValues) + " in " + cube.getRows());
        return null;
    }
    
    private static void assertNumber(String expected, Object actual) {
        Assert.assertEquals(expected + " <> " + actual, 0, new BigDecimal(expected).compareTo((BigDecimal) actual));
    }
    
    @Test
    public void test_1_1_Documented_example() {
        
        Cube cube = cubeBuilder.build(withCalendar(Facts.example()), 
                DimensionSpec.of("DayOfWeek", "product_id", "customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
        
        Assert.assertEquals(Arrays.asList("DayOfWeek", "product_id", "customer_id", "sale_amount_usd_sum", "sale_ids"), 
                cube.getColumns());
        Assert.assertEquals(2, cube.size());
        
        Cube.Row row = rowOf(cube, "Saturday", 101L, 1001L);
        assertNumber("6344.96", row.get("sale_amount_usd_sum"));
        Assert.assertEquals(Arrays.<Object>asList(550L), row.getRecordIds());
        
        Cube.Row other = rowOf(cube, "Saturday", 102L, 1002L);
        assertNumber("312.80", other.getMeasures().get(0));
        Assert.assertEquals(Arrays.<Object>asList(551L), other.get(ColumnNamer.TRACEABILITY_COLUMN));
    }
    
    @Test
    public void test_1_2_Aggregation_correctness() {
        
        FactTableBuilder builder = Facts.sales();
        Facts.sale(builder, 1L, "2024-01-06", 1001L, 101L, "10");
        Facts.sale(builder, 2L, "2024-01-07", 1001L, 101L, "20");
        Facts.sale(builder, 3L, "2024-01-08", 1002L, 101L, "5");
        
        Cube cube = cubeBuilder.build(builder.done(), DimensionSpec.of("customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum", "mean", "count", "min", "max").build());
        
        Cube.Row row = rowOf(cube, 1001L);
        assertNumber("30", row.get("sale_amount_usd_sum"));
        assertNumber("15", row.get("sale_amount_usd_mean"));
        Assert.assertEquals(2L, row.get("sale_amount_usd_count"));
        assertNumber("10", row.get("sale_amount_usd_min"));
        assertNumber("20", row.get("sale_amount_usd_max"));
        Assert.assertEquals(Arrays.<Object>asList(1L, 2L), row.getRecordIds());
        
        Cube.Row single = rowOf(cube, 1002L);
        assertNumber("5", single.get("sale_amount_usd_mean"));
        Assert.assertEquals(1L, single.get("sale_amount_usd_count"));
    }
    
    @Test
    public void test_1_3_Null_metric_values() {
        
        FactTableBuilder builder = Facts.sales();
        Facts.sale(builder, 1L, "2024-01-06", 1001L, 101L, null);
        Facts.sale(builder, 2L, "2024-01-06", 1001L, 101L, null);
        Facts.sale(builder, 3L, "2024-01-06", 1002L, 101L, "7");
        Facts.sale(builder, 4L, "2024-01-06", 1002L, 101L, null);
        
        Cube cube = cubeBuilder.build(builder.done(), DimensionSpec.of("customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum", "mean").metric("transaction_id", "count").build());
        
        Cube.Row allNull = rowOf(cube, 1001L);
        assertNumber("0", allNull.get("sale_amount_usd_sum"));
        Assert.assertNull(allNull.get("sale_amount_usd_mean"));
        Assert.assertEquals(2L, allNull.get("transaction_id_count"));
        
        Cube.Row someNull = rowOf(cube, 1002L);
        assertNumber("7", someNull.get("sale_amount_usd_mean"));
        Assert.assertEquals(2L, someNull.get("transaction_id_count"));
    }
    
    @Test
    public void test_1_4_Null_dimension_is_a_group() {
        
        FactTableBuilder builder = Facts.sales();
        Facts.sale(builder, 1L, "2024-01-06", null, 101L, "1");
        Facts.sale(builder, 2L, "2024-01-06", 1001L, 101L, "2");
        Facts.sale(builder, 3L, "2024-01-06", null, 101L, "3");
        Facts.sale(builder, 4L, "2024-01-06", null, null, "4");
        
        Cube cube = cubeBuilder.build(builder.done(), DimensionSpec.of("customer_id", "product_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
        
        Assert.assertEquals(3, cube.size());
        Cube.Row nullCustomer = rowOf(cube, null, 101L);
        Assert.assertEquals(Arrays.<Object>asList(1L, 3L), nullCustomer.getRecordIds());
        assertNumber("4", nullCustomer.get("sale_amount_usd_sum"));
        Assert.assertEquals(Arrays.<Object>asList(4L), rowOf(cube, null, null).getRecordIds());
    }
    
    @Test
    public void test_1_5_Rows_in_first_seen_order() {
        
        FactTableBuilder builder = Facts.sales();
        Facts.sale(builder, 9L, "2024-01-06", 3L, 101L, "1");
        Facts.sale(builder, 7L, "2024-01-06", 1L, 101L, "1");
        Facts.sale(builder, 8L, "2024-01-06", 3L, 101L, "1");
        Facts.sale(builder, 5L, "2024-01-06", 2L, 101L, "1");
        Facts.sale(builder, 6L, "2024-01-06", 1L, 101L, "1");
        
        Cube cube = cubeBuilder.build(builder.done(), DimensionSpec.of("customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
        
        Assert.assertEquals(Arrays.<Object>asList(3L), cube.getRows().get(0).getDimValues());
        Assert.assertEquals(Arrays.<Object>asList(9L, 8L), cube.getRows().get(0).getRecordIds());
        Assert.assertEquals(Arrays.<Object>asList(7L, 6L), cube.getRows().get(1).getRecordIds());
        Assert.assertEquals(Arrays.<Object>asList(5L), cube.getRows().get(2).getRecordIds());
    }
    
    @Test
    public void test_1_6_Numeric_dimension_by_value() {
        
        FactTableBuilder builder = new FactTableBuilder().build("sale")
                .addColumns(Arrays.asList("id", "price", "amount")).identifiedBy("id");
        builder.addDatas(Arrays.<Object>asList(1L, new BigDecimal("312.8"), BigDecimal.ONE));
        builder.addDatas(Arrays.<Object>asList(2L, new BigDecimal("312.80"), BigDecimal.ONE));
        builder.addDatas(Arrays.<Object>asList(3L, 100L, BigDecimal.ONE));
        builder.addDatas(Arrays.<Object>asList(4L, new BigDecimal("100.0"), BigDecimal.ONE));
        builder.addDatas(Arrays.<Object>asList(5L, new BigDecimal("312.81"), BigDecimal.ONE));
        
        Cube cube = cubeBuilder.build(builder.done(), DimensionSpec.of("price"), 
                MetricSpec.builder().metric("amount", "count").build());
        
        Assert.assertEquals(3, cube.size());
        Assert.assertEquals(Arrays.<Object>asList(new BigDecimal("312.8")), cube.getRows().get(0).getDimValues());
        Assert.assertEquals(Arrays.<Object>asList(1L, 2L), cube.getRows().get(0).getRecordIds());
        Assert.assertEquals(Arrays.<Object>asList(100L), cube.getRows().get(1).getDimValues());
        Assert.assertEquals(Arrays.<Object>asList(3L, 4L), cube.getRows().get(1).getRecordIds());
        Assert.assertEquals(Arrays.<Object>asList(5L), cube.getRows().get(2).getRecordIds());
    }
    
    @Test
    public void test_2_1_Partition_completeness() {
        
        Random random = new Random(20240106L);
        FactTableBuilder builder = Facts.sales();
        for (long id = 1; id <= 5000; id++) {
            Long customer = random.nextInt(10) == 0 ? null : Long.valueOf(random.nextInt(40));
            String date = "2024-" + String.format(Locale.ROOT, "%02d", 1 + random.nextInt(12)) + "-" 
                    + String.format(Locale.ROOT, "%02d", 1 + random.nextInt(28));
            Facts.sale(builder, id, date, customer, Long.valueOf(random.nextInt(15)), 
                    String.valueOf(random.nextInt(100000)) + ".25");
        }
        FactTable factTable = withCalendar(builder.done());
        
        Cube cube = cubeBuilder.build(factTable, DimensionSpec.of("Quarter", "product_id", "customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum", "mean").metric("transaction_id", "count").build());
        
        Set<Object> seen = new HashSet<Object>();
        Set<List<Object>> keys = new HashSet<List<Object>>();
        long counted = 0;
        for (Cube.Row row : cube.getRows()) {
            Assert.assertTrue("Duplicate group " + row.getDimValues(), keys.add(row.getDimValues()));
            Assert.assertFalse(row.getRecordIds().isEmpty());
            for (Object id : row.getRecordIds()) {
                Assert.assertTrue("Duplicate id " + id, seen.add(id));
            }
            counted += (Long) row.get("transaction_id_count");
        }
        Assert.assertEquals(factTable.size(), seen.size());
        Assert.assertEquals(factTable.size(), counted);
        
        List<Object> ids = new ArrayList<Object>();
        for (FactTable.Record record : factTable.getRecords()) {
            ids.add(record.getId());
        }
        Assert.assertTrue(seen.containsAll(ids));
    }
    
    @Test
    public void test_2_2_Deterministic() {
        
        FactTable factTable = withCalendar(Facts.example());
        DimensionSpec dimensions = DimensionSpec.of("Year", "customer_id");
        MetricSpec metrics = MetricSpec.builder().metric("sale_amount_usd", "sum", "median").build();
        
        List<List<Object>> first = new ArrayList<List<Object>>();
        for (Cube.Row row : cubeBuilder.build(factTable, dimensions, metrics).getRows()) {
            first.add(row.getValues());
        }
        for (int i = 0; i < 3; i++) {
            List<List<Object>> again = new ArrayList<List<Object>>();
            for (Cube.Row row : cubeBuilder.build(factTable, dimensions, metrics).getRows()) {
                again.add(row.getValues());
            }
            Assert.assertEquals(first, again);
        }
    }
    
    @Test
    public void test_2_3_Empty_fact_table() {
        
        Cube cube = cubeBuilder.build(Facts.sales().done(), DimensionSpec.of("customer_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
        Assert.assertEquals(0, cube.size());
        Assert.assertEquals(3, cube.getColumns().size());
    }
    
    @Test
    public void test_3_1_Unknown_metric_column_before_grouping() {
        
        LogCapture capture = new LogCapture("builder");
        FactTableBuilder builder = Facts.sales();
        // Floating dimension would fail grouping, configuration must fail first
        builder.addDatas(Arrays.<Object>asList(1L, "2024-01-06", 1001L, 1.5d, BigDecimal.ONE));
        
        try {
            new CubeBuilder(capture.logger()).build(builder.done(), DimensionSpec.of("product_id"), 
                    MetricSpec.builder().metric("discount", "sum").build());
            Assert.fail();
        } catch (ConfigurationException e) {
            Assert.assertTrue(e.getMessage().contains("discount"));
        }
        Assert.assertTrue(capture.contains(Level.ERROR, "Invalid cube configuration"));
        Assert.assertFalse(capture.contains(Level.INFO, "Grouped"));
    }
    
    @Test
    public void test_3_2_Unknown_function() {
        
        try {
            cubeBuilder.build(Facts.example(), DimensionSpec.of("product_id"), 
                    MetricSpec.builder().metric("sale_amount_usd", "sum", "avg").build());
            Assert.fail();
        } catch (ConfigurationException e) {
            Assert.assertEquals(CubeException.ErrorKind.CONFIGURATION, e.getKind());
            Assert.assertTrue(e.getMessage().contains("avg"));
        }
    }
    
    @Test(expected = ConfigurationException.class)
    public void test_3_3_Unknown_dimension_column() {
        
        cubeBuilder.build(Facts.example(), DimensionSpec.of("DayOfWeek"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
    }
    
    @Test(expected = ConfigurationException.class)
    public void test_3_4_Empty_function_is_not_supported() {
        
        cubeBuilder.build(Facts.example(), DimensionSpec.of("product_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "").build());
    }
    
    @Test
    public void test_3_5_Non_numeric_metric() {
        
        try {
            cubeBuilder.build(Facts.example(), DimensionSpec.of("product_id"), 
                    MetricSpec.builder().metric("sale_date", "sum").build());
            Assert.fail();
        } catch (AggregationException e) {
            Assert.assertTrue(e.getMessage().contains("2024-01-06"));
        }
    }
    
    @Test
    public void test_3_6_Count_and_nunique_accept_text() {
        
        Cube cube = cubeBuilder.build(Facts.example(), DimensionSpec.of("sale_date"), 
                MetricSpec.builder().metric("sale_date", "count", "nunique").build());
        Cube.Row row = rowOf(cube, "2024-01-06");
        Assert.assertEquals(2L, row.get("sale_date_count"));
        Assert.assertEquals(1L, row.get("sale_date_nunique"));
    }
    
    @Test(expected = AggregationException.class)
    public void test_3_7_Floating_dimension() {
        
        FactTableBuilder builder = Facts.sales();
        builder.addDatas(Arrays.<Object>asList(1L, "2024-01-06", 1001L, 1.5d, BigDecimal.ONE));
        cubeBuilder.build(builder.done(), DimensionSpec.of("product_id"), 
                MetricSpec.builder().metric("sale_amount_usd", "sum").build());
    }
    
    @Test
    public void test_4_2_Normalize() {
        
        Assert.assertEquals(CubeBuilder.normalize(10L), CubeBuilder.normalize(new BigDecimal("10.00")));
        Assert.assertEquals(CubeBuilder.normalize(100), CubeBuilder.normalize(new BigDecimal("1E+2")));
        Assert.assertNull(CubeBuilder.normalize(Double.NaN));
        Assert.assertNull(CubeBuilder.normalize(null));
        Assert.assertEquals("10.0", CubeBuilder.normalize("10.0"));
        Assert.assertEquals(Double.POSITIVE_INFINITY, CubeBuilder.normalize(Double.POSITIVE_INFINITY));
    }
    
    @Test
    public void test_4_1_To_number() {
        
        Assert.assertNull(CubeBuilder.toNumber(null));
        Assert.assertNull(CubeBuilder.toNumber(Double.NaN));
        Assert.assertNull(CubeBuilder.toNumber(" "));
        assertNumber("312.8", CubeBuilder.toNumber(312.8d));
        assertNumber("42", CubeBuilder.toNumber(42));
        assertNumber("12.50", CubeBuilder.toNumber("12.50"));
        try {
            CubeBuilder.toNumber(Double.POSITIVE_INFINITY);
            Assert.fail();
        } catch (NumberFormatException e) {
            // Expected
        }
        try {
            CubeBuilder.toNumber(Boolean.TRUE);
            Assert.fail();
        } catch (NumberFormatException e) {
            // Expected
        }
    }
    
}
