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

import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.engine.Volume;

import java.util.List;

/**
 * Builds the space of a voxel grid, in mm, with axes in (z, y, x) order.
 */
public final class VolumeSpaces {
    public static final List<String> AXIS_LABELS = List.of("z", "y", "x");

    private VolumeSpaces() {
    }

    /**
     * The space covers every voxel completely: each axis runs from the outer edge of its first
     * voxel to the outer edge of its last one.
     */
    public static UniformSpace fromVolume(VolumeDescriptor volume) {
        var size = volume.getVoxelSize();
        var offset = volume.getOffset();
        double[] min = {
                edge(volume.getMinIndexZ(), -0.5, size.z, offset.z),
                edge(volume.getMinIndexY(), -0.5, size.y, offset.y),
                edge(volume.getMinIndexX(), -0.5, size.x, offset.x)
        };
        double[] max = {
                edge(volume.getMaxIndexZ(), 0.5, size.z, offset.z),
                edge(volume.getMaxIndexY(), 0.5, size.y, offset.y),
                edge(volume.getMaxIndexX(), 0.5, size.x, offset.x)
        };
        return new UniformSpace(volume.shape(), min, max, AXIS_LABELS);
    }

    public static UniformSpace fromVolume(Volume volume) {
        return fromVolume(volume.getDescriptor());
    }

    private static double edge(int index, double halfStep, float voxelSize, float offset) {
        return (index + halfStep) * voxelSize + offset;
    }
}
