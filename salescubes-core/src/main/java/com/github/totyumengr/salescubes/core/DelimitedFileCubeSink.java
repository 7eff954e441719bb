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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Write cube as delimited text with a header row. Traceability values are written as a literal list like 
 * <code>[550, 551]</code>, nulls as empty cells and decimals in plain notation without trailing zeros. Lines end with 
 * <code>\n</code> so the same cube always gives the same bytes.
 * 
 * <p>Content goes to a sibling temporary file first and replaces target when complete.
 * 
 * @author mengran
 *
 */
public class DelimitedFileCubeSink implements CubeSink {
    
    private static final String LINE_SEPARATOR = "\n";
    
    private final Path target;
    
    private final char delimiter;
    
    private final Logger logger;
    
    public DelimitedFileCubeSink(Path target, char delimiter) {
        this(target, delimiter, LoggerFactory.getLogger(DelimitedFileCubeSink.class));
    }
    
    public DelimitedFileCubeSink(Path target, char delimiter, Logger logger) {
        super();
        Assert.notNull(target, "Target path can not be null.");
        Assert.notNull(logger, "Logger can not be null.");
        this.target = target.toAbsolutePath();
        this.delimiter = delimiter;
        this.logger = logger;
    }

    @Override
    public void write(Cube cube) throws PersistenceException {
        
        Assert.notNull(cube, "Cube can not be null.");
        long startTime = System.currentTimeMillis();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            FileSystemResource resource = new FileSystemResource(temp);
            try (Writer writer = new BufferedWriter(new OutputStreamWriter(resource.getOutputStream(), 
                    StandardCharsets.UTF_8))) {
                writeLine(writer, cube.getColumns());
                for (Cube.Row row : cube.getRows()) {
                    writeLine(writer, row.getValues());
                }
            }
            move(temp, target);
        } catch (IOException e) {
            logger.error("Error saving cube {} to {}", cube.getName(), target, e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new PersistenceException("Can not write cube " + cube.getName() + " to " + target, e);
        }
        logger.info("Cube {} with {} rows saved to {} using {} ms.", cube.getName(), cube.size(), target, 
                System.currentTimeMillis() - startTime);
    }
    
    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
    
    private void writeLine(Writer writer, List<?> values) throws IOException {
        
        List<String> cells = new ArrayList<String>(values.size());
        for (Object value : values) {
            cells.add(DelimitedText.escape(format(value), delimiter));
        }
        writer.write(StringUtils.collectionToDelimitedString(cells, String.valueOf(delimiter)));
        writer.write(LINE_SEPARATOR);
    }
    
    static String format(Object value) {
        
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Collection) {
            List<String> items = new ArrayList<String>();
            for (Object item : (Collection<?>) value) {
                items.add(format(item));
            }
            return "[" + StringUtils.collectionToDelimitedString(items, ", ") + "]";
        }
        return value.toString();
    }
    
    public Path getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "DelimitedFileCubeSink [target=" + target + "]";
    }
    
}
