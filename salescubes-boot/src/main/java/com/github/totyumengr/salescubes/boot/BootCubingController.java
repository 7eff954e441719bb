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
package com.github.totyumengr.salescubes.boot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.server.ResponseStatusException;

import com.github.totyumengr.salescubes.core.ColumnNamer;
import com.github.totyumengr.salescubes.core.CubingOutcome;

/**
 * Trigger cubing over HTTP. Results are written by the configured sink, responses only summarize the outcome.
 * @author mengran
 *
 */
@Controller
public class BootCubingController {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootCubingController.class);
    
    private final CubingRunner runner;
    
    @Autowired
    public BootCubingController(CubingRunner runner) {
        super();
        this.runner = runner;
    }
    
    @RequestMapping(value="/cubing", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> cubing() {
        
        LOGGER.info("Try to run cubing by request.");
        long timing = System.currentTimeMillis();
        CubingOutcome outcome = runner.runJob();
        LOGGER.info("Finish cubing by request with {} using {}ms.", outcome.isSuccess() ? "success" 
                : outcome.getErrorKind(), System.currentTimeMillis() - timing);
        
        return summary(outcome);
    }
    
    @RequestMapping(value="/cubing/persist", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> persist() {
        
        LOGGER.info("Try to persist last built cube by request.");
        CubingOutcome outcome = runner.persistLastCube();
        if (outcome == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "No cube has been built yet.");
        }
        
        return summary(outcome);
    }
    
    @RequestMapping(value="/cubing/columns", method=RequestMethod.GET)
    public @ResponseBody List<String> columns() {
        
        return ColumnNamer.nameColumns(runner.getJob().getDimensions(), runner.getJob().getMetrics());
    }
    
    static Map<String, Object> summary(CubingOutcome outcome) {
        
        Map<String, Object> summary = new LinkedHashMap<String, Object>();
        summary.put("success", outcome.isSuccess());
        if (outcome.getCube() != null) {
            summary.put("cube", outcome.getCube().getName());
            summary.put("rows", outcome.getCube().size());
            summary.put("columns", outcome.getCube().getColumns());
        }
        if (!outcome.isSuccess()) {
            summary.put("errorKind", outcome.getErrorKind());
            summary.put("error", outcome.getError().getMessage());
        }
        return summary;
    }
}
