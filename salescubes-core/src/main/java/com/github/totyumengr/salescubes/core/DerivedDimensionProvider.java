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

import java.util.List;

import org.springframework.core.Ordered;

/**
 * Computes dimension columns which are not stored in source, e.g. calendar attributes of a sale date. 
 * Values are recomputed on every run and never become source of truth.
 * 
 * @author mengran
 * @see FactTable#derive(java.util.Collection)
 */
public interface DerivedDimensionProvider extends Ordered {
    
    /**
     * @return columns which must exist in fact-table before deriving. MUST NOT NULL.
     */
    List<String> getRequiredColumns();
    
    /**
     * @return names of derived columns, in value order. MUST NOT NULL.
     */
    List<String> getDerivedDimNames();
    
    /**
     * @param record source fact
     * @return one value per {@link #getDerivedDimNames() derived column}
     * @throws IngestionException when record can not be derived, whole batch fails
     */
    List<Object> derive(FactTable.Record record);
    
}
