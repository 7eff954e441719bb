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
 * Fact records could not be read or parsed.
 * @author mengran
 *
 */
public class IngestionException extends CubeException {

    private static final long serialVersionUID = 1L;

    public IngestionException(String message) {
        super(ErrorKind.INGESTION, message);
    }
    
    public IngestionException(String message, Throwable cause) {
        super(ErrorKind.INGESTION, message, cause);
    }
    
}
