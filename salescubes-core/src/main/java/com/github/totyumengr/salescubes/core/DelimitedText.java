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
import java.util.List;

/**
 * Cell level helpers of delimited text, quoting follows RFC 4180: a cell holding delimiter, quote or line break is 
 * quoted and inner quotes are doubled. Quoted line breaks are not supported when reading.
 * 
 * @author mengran
 *
 */
final class DelimitedText {
    
    private static final char QUOTE = '"';
    
    private DelimitedText() {
        super();
    }
    
    static List<String> split(String line, char delimiter) {
        
        List<String> cells = new ArrayList<String>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    cell.append(QUOTE);
                    i++;
                } else if (c == QUOTE) {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == QUOTE) {
                quoted = true;
            } else if (c == delimiter) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quote in line: " + line);
        }
        cells.add(cell.toString());
        return cells;
    }
    
    static String escape(String cell, char delimiter) {
        
        if (cell.indexOf(delimiter) < 0 && cell.indexOf(QUOTE) < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return QUOTE + cell.replace("\"", "\"\"") + QUOTE;
    }
    
}
