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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.util.Assert;

import com.github.totyumengr.salescubes.core.FactTable.FactTableBuilder;

/**
 * Load facts from a delimited text resource, first line is header. Empty cell is <code>null</code>, integer cell 
 * is {@link Long}, decimal cell is {@link BigDecimal} and anything else is kept as trimmed text. Content must be valid UTF-8.
 * 
 * @author mengran
 *
 */
public class DelimitedFileFactSource implements FactSource {
    
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+|-?\\d+\\.\\d*|-?\\d{19,}");
    
    private final Resource resource;
    
    private final String name;
    
    private final String idColumn;
    
    private final char delimiter;
    
    private final Logger logger;
    
    public DelimitedFileFactSource(Resource resource, String name, String idColumn, char delimiter) {
        this(resource, name, idColumn, delimiter, LoggerFactory.getLogger(DelimitedFileFactSource.class));
    }
    
    public DelimitedFileFactSource(Resource resource, String name, String idColumn, char delimiter, Logger logger) {
        super();
        Assert.notNull(resource, "Resource can not be null.");
        Assert.hasText(name, "Fact-table name can not empty.");
        Assert.hasText(idColumn, "Identifier column can not empty.");
        Assert.notNull(logger, "Logger can not be null.");
        this.resource = resource;
        this.name = name;
        this.idColumn = idColumn;
        this.delimiter = delimiter;
        this.logger = logger;
    }

    @Override
    public FactTable load() throws IngestionException {
        
        long startTime = System.currentTimeMillis();
        logger.info("Load facts {} from {}", name, resource);
        FactTableBuilder builder = new FactTableBuilder(logger).build(name);
        boolean built = false;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), 
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)))) {
            String line = reader.readLine();
            if (line == null) {
                throw new IngestionException("No header line in " + resource);
            }
            builder.addColumns(DelimitedText.split(stripBom(line), delimiter)).identifiedBy(idColumn);
            
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                List<Object> datas = new ArrayList<Object>();
                for (String cell : DelimitedText.split(line, delimiter)) {
                    datas.add(typed(cell));
                }
                try {
                    builder.addDatas(datas);
                } catch (IngestionException e) {
                    throw new IngestionException("Line " + lineNumber + " of " + resource + ": " + e.getMessage(), e);
                }
            }
            FactTable factTable = builder.done();
            built = true;
            logger.info("Loaded {} facts from {} using {} ms.", factTable.size(), resource, 
                    System.currentTimeMillis() - startTime);
            return factTable;
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Error loading facts {} from {}", name, resource, e);
            throw new IngestionException("Can not read facts from " + resource, e);
        } catch (CubeException e) {
            logger.error("Error loading facts {} from {}: {}", name, resource, e.getMessage());
            throw e;
        } finally {
            if (!built) {
                builder.discard();
            }
        }
    }
    
    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
    
    static Object typed(String cell) {
        
        String text = cell.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(text).matches()) {
            return Long.valueOf(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            return new BigDecimal(text);
        }
        return text;
    }

    @Override
    public String toString() {
        return "DelimitedFileFactSource [resource=" + resource + ", name=" + name + "]";
    }
    
}
