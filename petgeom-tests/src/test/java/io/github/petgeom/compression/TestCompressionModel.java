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

package io.github.petgeom.compression;

import io.github.petgeom.engine.ProjectionEngines;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestCompressionModel {
    private static final ScannerGeometry MCT = ScannerGeometry.fromName(ScannerRegistry.MCT);

    @Test
    public void testSessionDefaults() {
        var config = CompressionConfig.defaultsFor(MCT);
        assertEquals(1, config.getSpanNum());
        assertNull(config.getMaxNumSegments());
        assertEquals(Integer.valueOf(56), config.getNumOfViews());
        assertEquals(Integer.valueOf(56), config.getNumNonArcCorBins());
        assertFalse(config.isDataArcCorrected());

        var model = new CompressionModel(MCT, config);
        assertEquals(7, model.effectiveMaxRingDiff());
        assertEquals(56, model.effectiveNumViews());
        assertEquals(56, model.effectiveNumTangentialBins());
    }

    @Test
    public void testUnsetFieldsResolveAgainstScanner() {
        var model = new CompressionModel(MCT, CompressionConfig.builder().build());
        assertEquals(56, model.effectiveNumViews());
        assertEquals(MCT.getMaxNumNonArcCorrectedBins(), model.effectiveNumTangentialBins());

        var arcCorrected = new CompressionModel(MCT, CompressionConfig.builder().withDataArcCorrected(true).build());
        assertEquals(MCT.getDefaultNumArcCorrectedBins(), arcCorrected.effectiveNumTangentialBins());
    }

    @Test
    public void testSpanOneCoversEveryRingDifference() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT));
        var geometry = model.buildProjectionDataGeometry();
        assertEquals(7, geometry.getMaxRingDiff());
        assertEquals(-7, geometry.getMinSegment());
        assertEquals(7, geometry.getMaxSegment());
        List<SegmentInfo> info = model.sinogramInfo();
        assertEquals(15, info.size());
        assertEquals(-7, info.get(0).getSegment());
        assertEquals(1, info.get(0).getNumAxialPositions());
    }

    @Test
    public void testBuildIsIdempotent() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT).toBuilder().withSpanNum(3).build());
        assertEquals(model.buildProjectionDataGeometry(), model.buildProjectionDataGeometry());
        assertEquals(model.buildProjectionDataGeometry().hashCode(), model.buildProjectionDataGeometry().hashCode());
        assertEquals(model.buildVolumeDescriptor(), model.buildVolumeDescriptor());
    }

    @Test
    public void testOffsets() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT));
        assertEquals(0, model.getOffset(-7, 0));
        assertEquals(1, model.getOffset(-6, 0));
        assertEquals(3, model.getOffset(-5, 0));
        assertEquals(63, model.getOffset(7, 0));
        try {
            model.getOffset(7, 1);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("segment 7"));
        }
    }

    @Test
    public void testEvenSpanIsRejected() {
        try {
            CompressionConfig.builder().withSpanNum(4).build();
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testAutomaticVolume() {
        for (int span : new int[] {1, 3}) {
            var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT).toBuilder().withSpanNum(span).build());
            var volume = model.buildVolumeDescriptor();
            assertEquals("span " + span, 15, volume.getSizes().z);
            assertEquals(MCT.getRingSpacing() / 2, volume.getVoxelSize().z, 0.0f);
            assertEquals(1.65f, volume.getVoxelSize().x, 1e-6f);
            assertEquals(volume.getSizes().x, volume.getSizes().y);
            assertEquals(1, volume.getSizes().x % 2);
            assertTrue(volume.isInPlaneSizeAutoDerived());
        }
    }

    @Test
    public void testExplicitVolume() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT));
        var volume = model.buildVolumeDescriptor(2.0f, new IntCoordinate3D(IntCoordinate3D.AUTO, 40, 41), new Coordinate3D(0, 1, 2));
        assertArrayEquals(new int[] {15, 40, 41}, volume.shape());
        assertEquals(0.825f, volume.getVoxelSize().y, 1e-6f);
        assertFalse(volume.isInPlaneSizeAutoDerived());
        assertEquals(-20, volume.getMinIndexY());
        assertEquals(19, volume.getMaxIndexY());
        assertEquals(-20, volume.getMinIndexX());
        assertEquals(20, volume.getMaxIndexX());
        assertEquals(15 * 40 * 41, volume.size());
    }

    @Test
    public void testZoomMustBePositive() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT));
        try {
            model.buildVolumeDescriptor(0.0f, IntCoordinate3D.ALL_AUTO, Coordinate3D.ZERO);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("zoom"));
        }
    }

    @Test
    public void testOversizedVolumeIsRejected() {
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT));
        try {
            model.buildVolumeDescriptor(1.0f, new IntCoordinate3D(2000, 2000, 2000), Coordinate3D.ZERO);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("more voxels"));
        }
        var largest = model.buildVolumeDescriptor(1.0f, new IntCoordinate3D(1000, 1000, 1000), Coordinate3D.ZERO);
        assertEquals(1_000_000_000, largest.size());
    }

    @Test
    public void testBinSizeFallsBackToTangentialSampling() {
        var noBinSize = MCT.toBuilder().withDefaultBinSize(0.0f).build();
        var model = new CompressionModel(noBinSize, CompressionConfig.defaultsFor(noBinSize));
        var geometry = model.buildProjectionDataGeometry();
        var volume = model.buildVolumeDescriptor();
        assertEquals(geometry.getTangentialSamplingAtCentre(), volume.getVoxelSize().x, 1e-5);
    }

    @Test
    public void testEngineAgreesOnLayout() {
        var engine = ProjectionEngines.getDefault();
        var model = new CompressionModel(MCT, CompressionConfig.defaultsFor(MCT).toBuilder().withSpanNum(3).build());
        var info = model.buildEngineProjectionDataInfo(engine);
        assertArrayEquals(new int[] {47, 56, 56}, info.shape());
        assertEquals(model.buildProjectionDataGeometry(), info.getGeometry());
        var data = model.buildProjectionData(engine, true);
        assertArrayEquals(info.shape(), data.shape());
        assertEquals(0.0f, data.toFlatArray()[0], 0.0f);
    }
}
