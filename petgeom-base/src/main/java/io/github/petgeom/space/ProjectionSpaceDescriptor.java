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

package io.github.petgeom.space;

import io.github.petgeom.compression.ProjectionDataGeometry;
import io.github.petgeom.engine.ProjectionData;

import java.util.List;

/**
 * Builds the continuous space that projection data are sampled from: flat sinogram index,
 * view angle in {@code [0, pi)} and tangential position in {@code [-radius, radius]}.
 */
public final class ProjectionSpaceDescriptor {
    public static final List<String> AXIS_LABELS = List.of("(dz,z)", "phi", "s");

    private ProjectionSpaceDescriptor() {
    }

    public static UniformSpace fromProjectionDataGeometry(ProjectionDataGeometry geometry) {
        return fromProjectionDataGeometry(geometry, 1.0);
    }

    /**
     * @param radius half the extent of the tangential axis
     * @throws IllegalArgumentException if {@code radius} is not positive
     */
    public static UniformSpace fromProjectionDataGeometry(ProjectionDataGeometry geometry, double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("radius " + radius + " must be positive");
        }
        int[] shape = geometry.shape();
        return new UniformSpace(shape,
                                new double[] {0, 0, -radius},
                                new double[] {shape[0], Math.PI, radius},
                                AXIS_LABELS);
    }

    public static UniformSpace fromProjectionData(ProjectionData projectionData) {
        return fromProjectionData(projectionData, 1.0);
    }

    public static UniformSpace fromProjectionData(ProjectionData projectionData, double radius) {
        return fromProjectionDataGeometry(projectionData.getInfo().getGeometry(), radius);
    }
}
