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

import io.github.petgeom.compression.ProjectionDataGeometry;
import io.github.petgeom.scanner.ScannerGeometry;

/**
 * Engine-side description of projection data.
 */
public interface ProjectionDataInfo {
    ScannerGeometry getScanner();

    int getMinSegment();

    int getMaxSegment();

    int getMinAxialPos(int segment);

    int getMaxAxialPos(int segment);

    int getNumSinograms();

    int getNumViews();

    int getNumTangentialBins();

    /**
     * @return the geometry as seen by the core, for building operator spaces
     */
    ProjectionDataGeometry getGeometry();

    /**
     * @return {@code (numSinograms, numViews, numTangentialBins)}
     */
    default int[] shape() {
        return new int[] {getNumSinograms(), getNumViews(), getNumTangentialBins()};
    }
}
