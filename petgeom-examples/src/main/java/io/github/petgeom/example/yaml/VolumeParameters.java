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

package io.github.petgeom.example.yaml;

import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;

import java.util.List;

/**
 * The image grid. Sizes and offset are given as [z, y, x]; a size of -1 is derived from the
 * projection data.
 */
public class VolumeParameters {
    public float zoom = 1.0f;
    public List<Integer> sizes = List.of(IntCoordinate3D.AUTO, IntCoordinate3D.AUTO, IntCoordinate3D.AUTO);
    public List<Float> offset = List.of(0.0f, 0.0f, 0.0f);

    public VolumeParameters() {
    }

    public VolumeDescriptor toDescriptor(CompressionModel model) {
        if (sizes.size() != 3 || offset.size() != 3) {
            throw new IllegalArgumentException("volume sizes and offset need three values [z, y, x], got " + sizes + " and " + offset);
        }
        var s = new IntCoordinate3D(sizes.get(0), sizes.get(1), sizes.get(2));
        var o = new Coordinate3D(offset.get(0), offset.get(1), offset.get(2));
        return model.buildVolumeDescriptor(zoom, s, o);
    }
}
