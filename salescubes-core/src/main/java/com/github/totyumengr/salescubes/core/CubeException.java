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

/**
 * Base of all failures raised while building a cube. Every failure is fatal for the run, callers branch on
 * {@link #getKind()} to decide whether to retry, abort or alert.
 * 
 * @author mengran
 *
 */
public abstract class CubeException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;

    /**
     * Failure categories of a cubing run.
     */
    public static enum ErrorKind {
        /** Source unreadable or unparseable. */
        INGESTION,
        /** Unknown column or function, naming collision. Raised before grouping. */
        CONFIGURATION,
        /** Unexpected numeric failure while grouping or aggregating. */
        AGGREGATION,
        /** Sink write failure, the built cube is still usable. */
        PERSISTENCE
    }
    
    private final ErrorKind kind;
    
    protected CubeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    protected CubeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
    
}
