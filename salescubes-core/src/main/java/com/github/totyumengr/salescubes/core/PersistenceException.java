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
 * The cube could not be written. The cube itself is complete and may be written again.
 * @author mengran
 *
 */
public class PersistenceException extends CubeException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(ErrorKind.PERSISTENCE, message);
    }
    
    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
    
}
