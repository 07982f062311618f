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

import io.github.petgeom.compression.CompressionConfig;
import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.exceptions.ShapeMismatchException;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestSpaces {
    private static final ScannerGeometry MCT = ScannerGeometry.fromName(ScannerRegistry.MCT);

    @Test
    public void testProjectionSpace() {
        var geometry = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT)).buildProjectionDataGeometry();
        var space = ProjectionSpaceDescriptor.fromProjectionDataGeometry(geometry);
        assertArrayEquals(new int[] {64, 56, 56}, space.shape());
        assertArrayEquals(new double[] {0, 0, -1}, space.getMinPt(), 0.0);
        assertArrayEquals(new double[] {64, Math.PI, 1}, space.getMaxPt(), 0.0);
        assertEquals(List.of("(dz,z)", "phi", "s"), space.getAxisLabels());
        assertEquals(64 * 56 * 56, space.size());
        assertArrayEquals(new double[] {1, Math.PI / 56, 2.0 / 56}, space.cellSides(), 1e-12);

        var wide = ProjectionSpaceDescriptor.fromProjectionDataGeometry(geometry, 50.0);
        assertEquals(-50.0, wide.getMinPt()[2], 0.0);
        assertEquals(50.0, wide.getMaxPt()[2], 0.0);
    }

    @Test
    public void testRadiusMustBePositive() {
        var geometry = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT)).buildProjectionDataGeometry();
        try {
            ProjectionSpaceDescriptor.fromProjectionDataGeometry(geometry, 0.0);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testVolumeSpace() {
        var volume = new VolumeDescriptor(new IntCoordinate3D(3, 4, 5), new Coordinate3D(2, 1, 1), new Coordinate3D(10, 0, 0.5f),
                                          1.0f, false);
        var space = VolumeSpaces.fromVolume(volume);
        assertArrayEquals(new int[] {3, 4, 5}, space.shape());
        // z runs over planes 0..2, y over -2..1, x over -2..2
        assertArrayEquals(new double[] {9, -2.5, -2.0}, space.getMinPt(), 1e-9);
        assertArrayEquals(new double[] {15, 1.5, 3.0}, space.getMaxPt(), 1e-9);
        assertArrayEquals(new double[] {2, 1, 1}, space.cellSides(), 1e-9);
        assertEquals(List.of("z", "y", "x"), space.getAxisLabels());
    }

    @Test
    public void testElements() {
        var space = new UniformSpace(new int[] {2, 3}, new double[] {0, 0}, new double[] {1, 1}, List.of("a", "b"));
        assertEquals(6, space.zero().length);
        var values = new float[] {1, 2, 3, 4, 5, 6};
        var element = space.element(values);
        assertArrayEquals(values, element, 0.0f);
        try {
            space.element(new float[5]);
            fail();
        } catch (ShapeMismatchException e) {
            assertArrayEquals(new int[] {6}, e.getExpected());
            assertArrayEquals(new int[] {5}, e.getActual());
        }
    }

    @Test
    public void testInvalidBox() {
        try {
            new UniformSpace(new int[] {2}, new double[] {1}, new double[] {1}, List.of("a"));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
