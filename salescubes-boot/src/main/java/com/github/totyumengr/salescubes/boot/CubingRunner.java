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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import com.github.totyumengr.salescubes.core.Cube;
import com.github.totyumengr.salescubes.core.CubingOutcome;
import com.github.totyumengr.salescubes.core.OlapCubingJob;

/**
 * Run cubing job once on startup when <code>salescubes.run-on-startup</code> is true, and serialize later runs. 
 * Last built cube is kept so a failed write can be retried without building again.
 * 
 * @author mengran
 *
 */
@Component
public class CubingRunner implements CommandLineRunner {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(CubingRunner.class);
    
    private final Object lock = new Object();
    
    private final OlapCubingJob job;
    
    private final boolean runOnStartup;
    
    private Cube lastCube;
    
    @Autowired
    public CubingRunner(OlapCubingJob job, @Value("${salescubes.run-on-startup}") boolean runOnStartup) {
        super();
        Assert.notNull(job, "Cubing job can not be null.");
        this.job = job;
        this.runOnStartup = runOnStartup;
    }

    @Override
    public void run(String... args) {
        
        if (!runOnStartup) {
            LOGGER.info("Skip cubing on startup, trigger it by POST /cubing.");
            return;
        }
        CubingOutcome outcome = runJob();
        if (!outcome.isSuccess()) {
            LOGGER.warn("Cubing on startup failed with {} error, application keeps running for retries.", 
                    outcome.getErrorKind());
        }
    }
    
    public CubingOutcome runJob() {
        
        synchronized (lock) {
            CubingOutcome outcome = job.run();
            if (outcome.getCube() != null) {
                lastCube = outcome.getCube();
            }
            return outcome;
        }
    }
    
    /**
     * @return <code>null</code> if no cube is built yet
     */
    public CubingOutcome persistLastCube() {
        
        synchronized (lock) {
            if (lastCube == null) {
                LOGGER.warn("No cube has been built yet, nothing to persist.");
                return null;
            }
            return job.persist(lastCube);
        }
    }
    
    public OlapCubingJob getJob() {
        return job;
    }
    
}
