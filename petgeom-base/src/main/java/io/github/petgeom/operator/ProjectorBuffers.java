/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.petgeom.operator;

import io.github.petgeom.engine.ProjectionData;
import io.github.petgeom.engine.ProjectionEngine;
import io.github.petgeom.engine.SystemMatrix;
import io.github.petgeom.engine.Verbosity;
import io.github.petgeom.engine.Volume;
import io.github.petgeom.util.ExceptionUtils;

/**
 * The engine state a forward and a back projector share: the engine, its system matrix and
 * the two buffers every call goes through.
 */
final class ProjectorBuffers {
    final ProjectionEngine engine;
    final SystemMatrix matrix;
    final Volume volume;
    final ProjectionData projectionData;
    final int verbosity;

    ProjectorBuffers(ProjectionEngine engine, SystemMatrix matrix, Volume volume, ProjectionData projectionData, int verbosity) {
        this.engine = engine;
        this.matrix = matrix;
        this.volume = volume;
        this.projectionData = projectionData;
        this.verbosity = verbosity;
    }

    /**
     * Runs one engine call at this pair's verbosity.
     */
    void call(String action, Runnable work) {
        try {
            Verbosity.withLevel(verbosity, work);
        } catch (RuntimeException e) {
            throw ExceptionUtils.asEngineCallException(action + " with engine " + engine.name(), e);
        }
    }

    static void copy(float[] from, float[] to) {
        System.arraycopy(from, 0, to, 0, to.length);
    }
}
