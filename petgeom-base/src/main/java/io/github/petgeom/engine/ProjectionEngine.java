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

package io.github.petgeom.engine;

import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;

import java.nio.file.Path;
import java.util.Set;

/**
 * The projection engine: everything that turns geometry into numbers. It owns the
 * projection-data description, the volume and sinogram buffers, the system matrix and the
 * forward/back projection kernels.
 * <p>
 * All calls are blocking. Implementations report failures as {@link EngineCallException} and
 * consult {@link Verbosity#get()} to decide how much to log. Implementations are discovered
 * with {@link ProjectionEngines}.
 */
public interface ProjectionEngine {
    /**
     * @return the name this engine is registered under
     */
    String name();

    /**
     * Describes axially compressed projection data for a scanner.
     */
    ProjectionDataInfo makeProjectionDataInfo(ScannerGeometry scanner, int span, int maxRingDiff,
                                              int numViews, int numTangentialBins, boolean arcCorrected);

    /**
     * Creates a zero-filled volume suited to the projection data. Size components equal to
     * {@link IntCoordinate3D#AUTO} are derived from the projection data.
     */
    Volume makeVolume(ProjectionDataInfo info, float zoom, Coordinate3D offset, IntCoordinate3D sizes);

    /**
     * Creates an in-memory projection-data buffer.
     *
     * @param zeroInit whether the bins must start at zero; when false their content is unspecified
     */
    ProjectionData makeProjectionData(ExamInfo examInfo, ProjectionDataInfo info, boolean zeroInit);

    /**
     * Builds the system matrix between a volume and projection data. The result may be shared by
     * any number of forward and back projections over the same volume and projection data.
     *
     * @param symmetries the symmetry reductions the matrix may use
     * @param numTangentialLORs number of lines of response traced per tangential bin
     */
    SystemMatrix buildSystemMatrix(ProjectionDataInfo info, Volume volume, Set<Symmetry> symmetries, int numTangentialLORs);

    /**
     * Forward projects {@code in} into {@code out}, overwriting it.
     */
    void forwardProject(SystemMatrix matrix, ProjectionData out, Volume in);

    /**
     * Back projects {@code in} and adds the result to {@code out}.
     */
    void backProject(SystemMatrix matrix, Volume out, ProjectionData in);

    /**
     * Reads a volume (geometry and content) from an engine-specific file.
     */
    Volume readVolume(Path path);

    /**
     * Reads projection data from an engine-specific file, returning an in-memory copy.
     */
    ProjectionData readProjectionData(Path path);

    /**
     * @return the logging level the engine currently runs at, shared by all engines
     */
    default int getVerbosity() {
        return Verbosity.get();
    }

    /**
     * Sets the shared logging level. Prefer {@link Verbosity#withLevel(int, Runnable)} around a
     * unit of work.
     *
     * @return the previous level
     */
    default int setVerbosity(int level) {
        return Verbosity.set(level);
    }
}
