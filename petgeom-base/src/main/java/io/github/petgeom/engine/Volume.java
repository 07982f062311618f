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

import io.github.petgeom.compression.VolumeDescriptor;

/**
 * Engine-side image volume buffer. Flat arrays are in (z, y, x) order, x varying fastest.
 */
public interface Volume {
    /**
     * @return the shape in (z, y, x) order
     */
    int[] shape();

    VolumeDescriptor getDescriptor();

    /**
     * Overwrites every voxel from a flat array of {@code product(shape())} values.
     */
    void fill(float[] values);

    /**
     * Sets every voxel to the same value.
     */
    void fill(float value);

    /**
     * @return a copy of the voxel values as a flat array
     */
    float[] toFlatArray();
}
