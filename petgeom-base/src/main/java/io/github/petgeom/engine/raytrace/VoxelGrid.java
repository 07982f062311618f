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

package io.github.petgeom.engine.raytrace;

import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.engine.Volume;

import java.util.Arrays;

/**
 * A float volume on a Cartesian grid, stored as one flat array in (z, y, x) order.
 */
public final class VoxelGrid implements Volume {
    private final VolumeDescriptor descriptor;
    private final float[] data;

    public VoxelGrid(VolumeDescriptor descriptor) {
        this.descriptor = descriptor;
        this.data = new float[descriptor.size()];
    }

    @Override
    public int[] shape() {
        return descriptor.shape();
    }

    @Override
    public VolumeDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public void fill(float[] values) {
        if (values.length != data.length) {
            throw new IllegalArgumentException(String.format("expected %d voxel values for shape %s, got %d",
                                                             data.length, Arrays.toString(shape()), values.length));
        }
        System.arraycopy(values, 0, data, 0, data.length);
    }

    @Override
    public void fill(float value) {
        Arrays.fill(data, value);
    }

    @Override
    public float[] toFlatArray() {
        return data.clone();
    }

    /**
     * Flat index of a voxel, or -1 if the indices fall outside the grid. x and y indices are
     * centred, z starts at 0, see {@link VolumeDescriptor}.
     */
    int flatIndex(int z, int y, int x) {
        var d = descriptor;
        if (z < d.getMinIndexZ() || z > d.getMaxIndexZ()
            || y < d.getMinIndexY() || y > d.getMaxIndexY()
            || x < d.getMinIndexX() || x > d.getMaxIndexX()) {
            return -1;
        }
        var sizes = d.getSizes();
        return ((z - d.getMinIndexZ()) * sizes.y + (y - d.getMinIndexY())) * sizes.x + (x - d.getMinIndexX());
    }

    // direct access for the projection kernels in this package
    float[] data() {
        return data;
    }
}
