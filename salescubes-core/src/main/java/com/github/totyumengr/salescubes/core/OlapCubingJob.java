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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

/**
 * One batch cubing run: load facts from {@link FactSource}, append derived dimensions, aggregate by 
 * {@link Aggregations} and write to {@link CubeSink}. Every run recomputes the whole cube, nothing is kept 
 * between runs.
 * 
 * <p>Failures are logged and returned as {@link CubingOutcome}, a run never returns a partial cube.
 * 
 * @author mengran
 *
 */
public class OlapCubingJob {
    
    private final FactSource factSource;
    
    private final List<DerivedDimensionProvider> providers;
    
    private final Aggregations aggregations;
    
    private final CubeSink cubeSink;
    
    private final DimensionSpec dimensions;
    
    private final MetricSpec metrics;
    
    private final Logger logger;
    
    public OlapCubingJob(FactSource factSource, List<? extends DerivedDimensionProvider> providers, 
            Aggregations aggregations, CubeSink cubeSink, DimensionSpec dimensions, MetricSpec metrics) {
        this(factSource, providers, aggregations, cubeSink, dimensions, metrics, 
                LoggerFactory.getLogger(OlapCubingJob.class));
    }
    
    public OlapCubingJob(FactSource factSource, List<? extends DerivedDimensionProvider> providers, 
            Aggregations aggregations, CubeSink cubeSink, DimensionSpec dimensions, MetricSpec metrics, 
            Logger logger) {
        super();
        Assert.notNull(factSource, "Fact source can not be null.");
        Assert.notNull(providers, "Derived dimension providers can not be null.");
        Assert.notNull(aggregations, "Aggregations can not be null.");
        Assert.notNull(cubeSink, "Cube sink can not be null.");
        Assert.notNull(dimensions, "Dimension spec can not be null.");
        Assert.notNull(metrics, "Metric spec can not be null.");
        Assert.notNull(logger, "Logger can not be null.");
        this.factSource = factSource;
        this.providers = Collections.unmodifiableList(new ArrayList<DerivedDimensionProvider>(providers));
        this.aggregations = aggregations;
        this.cubeSink = cubeSink;
        this.dimensions = dimensions;
        this.metrics = metrics;
        this.logger = logger;
    }
    
    public CubingOutcome run() {
        
        logger.info("Starting OLAP cubing by {} with {}", dimensions.getColumns(), metrics.asMap());
        StopWatch stopWatch = new StopWatch("olap-cubing");
        Cube cube;
        try {
            stopWatch.start("ingest");
            FactTable factTable = factSource.load();
            stopWatch.stop();
            
            stopWatch.start("derive");
            FactTable derived = providers.isEmpty() ? factTable : factTable.derive(providers);
            stopWatch.stop();
            
            stopWatch.start("build");
            cube = aggregations.build(derived, dimensions, metrics);
            stopWatch.stop();
        } catch (CubeException e) {
            logger.error("OLAP cubing failed with {} error: {}", e.getKind(), e.getMessage(), e);
            return CubingOutcome.failure(e);
        } catch (RuntimeException e) {
            CubeException error = wrap(stopWatch.currentTaskName(), e);
            logger.error("OLAP cubing failed at {} with unexpected error, reported as {}", 
                    stopWatch.currentTaskName(), error.getKind(), e);
            return CubingOutcome.failure(error);
        }
        
        CubingOutcome outcome = persist(cube);
        logger.info("OLAP cubing completed {} in {} ms: {}", outcome.isSuccess() ? "successfully" : "with errors", 
                stopWatch.getTotalTimeMillis(), outcome);
        return outcome;
    }
    
    /**
     * Write a built cube, used by {@link #run()} and by callers retrying a failed write.
     * @param cube complete cube
     * @return success, or {@link CubeException.ErrorKind#PERSISTENCE} failure still holding the cube
     */
    public CubingOutcome persist(Cube cube) {
        
        Assert.notNull(cube, "Cube can not be null.");
        try {
            cubeSink.write(cube);
        } catch (PersistenceException e) {
            logger.error("Cube {} is built but could not be saved by {}: {}", cube.getName(), cubeSink, 
                    e.getMessage(), e);
            return CubingOutcome.failure(e, cube);
        } catch (RuntimeException e) {
            logger.error("Cube {} is built but {} failed unexpectedly", cube.getName(), cubeSink, e);
            return CubingOutcome.failure(new PersistenceException("Unexpected failure writing cube " + cube.getName() 
                    + ": " + e, e), cube);
        }
        return CubingOutcome.success(cube);
    }

    /**
     * Unexpected failures of collaborators are typed by the step they broke.
     */
    private static CubeException wrap(String step, RuntimeException e) {
        String message = "Unexpected failure at " + step + ": " + e;
        if ("build".equals(step)) {
            return new AggregationException(message, e);
        }
        return new IngestionException(message, e);
    }

    public DimensionSpec getDimensions() {
        return dimensions;
    }

    public MetricSpec getMetrics() {
        return metrics;
    }
    
}
