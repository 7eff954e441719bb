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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Derive calendar dimensions {@value #DAY_OF_WEEK}, {@value #MONTH}, {@value #QUARTER} and {@value #YEAR} 
 * from a date column, using ISO/Gregorian calendar. Day names are English and do not depend on default locale.
 * 
 * <p>Supported date values: {@link LocalDate}, {@link LocalDateTime}, {@link java.sql.Date}, 
 * {@link java.sql.Timestamp}, {@link java.util.Date} (read as UTC) and text like <code>2024-01-06</code>, 
 * <code>2024-01-06 13:45:00</code> or <code>2024-01-06T13:45:00Z</code>.
 * 
 * @author mengran
 *
 */
public class CalendarDimensionDeriver implements DerivedDimensionProvider {
    
    public static final String DAY_OF_WEEK = "DayOfWeek";
    public static final String MONTH = "Month";
    public static final String QUARTER = "Quarter";
    public static final String YEAR = "Year";
    
    private static final List<String> DERIVED_DIMS = Collections.unmodifiableList(
            Arrays.asList(DAY_OF_WEEK, MONTH, QUARTER, YEAR));
    
    private final String dateColumn;
    
    private final Logger logger;
    
    public CalendarDimensionDeriver(String dateColumn) {
        this(dateColumn, LoggerFactory.getLogger(CalendarDimensionDeriver.class));
    }
    
    public CalendarDimensionDeriver(String dateColumn, Logger logger) {
        super();
        Assert.hasText(dateColumn, "Date column can not empty.");
        Assert.notNull(logger, "Logger can not be null.");
        this.dateColumn = dateColumn;
        this.logger = logger;
    }
    
    @Override
    public int getOrder() {
        return 0;
    }

    @Override
    public List<String> getRequiredColumns() {
        return Collections.singletonList(dateColumn);
    }

    @Override
    public List<String> getDerivedDimNames() {
        return DERIVED_DIMS;
    }

    @Override
    public List<Object> derive(FactTable.Record record) {
        
        Object value = record.get(dateColumn);
        LocalDate date;
        try {
            date = toLocalDate(value);
        } catch (IllegalArgumentException e) {
            logger.error("Can not derive calendar dimensions of {} from {}={}", record, dateColumn, value);
            throw new IngestionException("Unparseable " + dateColumn + " '" + value + "' of record " 
                    + record.getId(), e);
        }
        return derive(date);
    }
    
    /**
     * @param date calendar date
     * @return day-of-week name, month (1-12), quarter (1-4) and year
     */
    public List<Object> derive(LocalDate date) {
        
        Assert.notNull(date, "Date can not be null.");
        String dayOfWeek = StringUtils.capitalize(date.getDayOfWeek().name().toLowerCase(Locale.ROOT));
        return Arrays.<Object>asList(dayOfWeek, date.getMonthValue(), date.get(IsoFields.QUARTER_OF_YEAR), 
                date.getYear());
    }
    
    /**
     * @param value date value of a fact
     * @return calendar date of value
     * @throws IllegalArgumentException when value is null or not a date
     */
    static LocalDate toLocalDate(Object value) throws IllegalArgumentException {
        
        if (value == null) {
            throw new IllegalArgumentException("Date value is null.");
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().atOffset(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            try {
                if (text.length() == 10) {
                    return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
                }
                // 'yyyy-MM-dd HH:mm:ss' is SQL style of ISO date time
                return LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(text.replaceFirst(" ", "T")));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not a date: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unsupported date type " + value.getClass().getName());
    }

    @Override
    public String toString() {
        return "CalendarDimensionDeriver [dateColumn=" + dateColumn + "]";
    }
    
}
