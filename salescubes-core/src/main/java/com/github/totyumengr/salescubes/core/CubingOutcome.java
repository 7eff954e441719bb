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

import com.github.totyumengr.salescubes.core.CubeException.ErrorKind;

/**
 * Result of a cubing run: a complete cube, or a typed error. A {@link ErrorKind#PERSISTENCE persistence} failure 
 * still carries the built cube so caller can write it again.
 * 
 * @author mengran
 *
 */
public final class CubingOutcome {
    
    private final Cube cube;
    
    private final CubeException error;
    
    private CubingOutcome(Cube cube, CubeException error) {
        this.cube = cube;
        this.error = error;
    }
    
    public static CubingOutcome success(Cube cube) {
        if (cube == null) {
            throw new IllegalArgumentException("Successful outcome must hold a cube.");
        }
        return new CubingOutcome(cube, null);
    }
    
    public static CubingOutcome failure(CubeException error) {
        return failure(error, null);
    }
    
    public static CubingOutcome failure(CubeException error, Cube builtCube) {
        if (error == null) {
            throw new IllegalArgumentException("Failed outcome must hold an error.");
        }
        if (builtCube != null && error.getKind() != ErrorKind.PERSISTENCE) {
            throw new IllegalArgumentException("Only persistence failure keeps a built cube, not " + error.getKind());
        }
        return new CubingOutcome(builtCube, error);
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    /**
     * @return built cube, <code>null</code> when run failed before the cube was complete
     */
    public Cube getCube() {
        return cube;
    }
    
    public CubeException getError() {
        return error;
    }
    
    /**
     * @return kind of error, <code>null</code> on success
     */
    public ErrorKind getErrorKind() {
        return error == null ? null : error.getKind();
    }

    @Override
    public String toString() {
        return isSuccess() ? "CubingOutcome [success, cube=" + cube + "]" 
                : "CubingOutcome [" + error.getKind() + ", error=" + error.getMessage() + "]";
    }
    
}
