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

import java.util.Set;

/**
 * Opaque handle on the geometric weighting between volume voxels and projection bins. One
 * matrix serves both projection directions.
 */
public interface SystemMatrix {
    ProjectionDataInfo getProjectionDataInfo();

    /**
     * @return the shape of the volumes this matrix was set up for
     */
    int[] getVolumeShape();

    /**
     * @return the symmetries that were requested when the matrix was built
     */
    Set<Symmetry> getSymmetries();

    int getNumTangentialLORs();
}
