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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.util.StringUtils;

/**
 * Names cube columns from specs only: dimensions as-is, then <code>{metric}_{function}</code> for every 
 * (metric, function) pair, then {@value #TRACEABILITY_COLUMN}. Single function metrics keep the suffix.
 * 
 * @author mengran
 *
 */
public final class ColumnNamer {
    
    /**
     * Reserved name of the column listing identifiers of grouped facts.
     */
    public static final String TRACEABILITY_COLUMN = "sale_ids";
    
    public static final char SEPARATOR = '_';
    
    private ColumnNamer() {
        super();
    }
    
    /**
     * @param dimensions group by columns
     * @param metrics aggregation functions of metric columns
     * @return cube column names in output order
     * @throws ConfigurationException when two columns get the same name
     */
    public static List<String> nameColumns(DimensionSpec dimensions, MetricSpec metrics) throws ConfigurationException {
        
        List<String> names = new ArrayList<String>(dimensions.getColumns());
        for (String metric : metrics.getColumns()) {
            for (String function : metrics.getFunctions(metric)) {
                names.add(nameMetric(metric, function));
            }
        }
        names.add(TRACEABILITY_COLUMN);
        
        Set<String> seen = new HashSet<String>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new ConfigurationException("Column name " + name + " is produced more than once by " 
                        + dimensions + " and " + metrics);
            }
        }
        return names;
    }
    
    /**
     * @param metric metric column
     * @param function function name as configured, case insensitive
     * @return <code>{metric}_{function}</code> with function in lower case, without trailing separators
     */
    public static String nameMetric(String metric, String function) {
        return StringUtils.trimTrailingCharacter(metric + SEPARATOR + function.trim().toLowerCase(Locale.ROOT), 
                SEPARATOR);
    }
    
}
