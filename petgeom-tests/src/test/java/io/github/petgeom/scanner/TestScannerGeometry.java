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

package io.github.petgeom.scanner;

import io.github.petgeom.exceptions.GeometryConsistencyException;
import io.github.petgeom.exceptions.UnknownScannerException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestScannerGeometry {
    private static ScannerGeometry.Builder minimal() {
        return ScannerGeometry.builder()
                .withNumRings(4)
                .withNumDetectorsPerRing(64)
                .withInnerRingRadius(100.0f)
                .withRingSpacing(4.0f)
                .withAverageDepthOfInteraction(5.0f)
                .withDefaultBinSize(2.0f);
    }

    @Test
    public void testPresetsAreConsistent() {
        for (var name : ScannerRegistry.names()) {
            var scanner = ScannerGeometry.fromName(name);
            assertTrue(name + ": " + scanner.checkConsistency(), scanner.isConsistent());
            assertEquals(name, scanner.getName());
        }
    }

    @Test
    public void testBuilderDefaults() {
        var scanner = minimal().build();
        assertEquals("Userdefined", scanner.getName());
        assertEquals(32, scanner.getMaxNumNonArcCorrectedBins());
        assertEquals(32, scanner.getDefaultNumArcCorrectedBins());
        assertEquals(1, scanner.getNumDetectorLayers());
        assertEquals(1, scanner.getNumAxialCrystalsPerBlock());
        assertEquals(0.0f, scanner.getIntrinsicTilt(), 0.0f);
        assertEquals(105.0f, scanner.getEffectiveRingRadius(), 1e-6f);
        assertTrue(scanner.isConsistent());
    }

    @Test
    public void testArcCorrectedBinsFollowNonArcCorrectedBins() {
        var scanner = minimal().withMaxNumNonArcCorrectedBins(20).build();
        assertEquals(20, scanner.getDefaultNumArcCorrectedBins());
    }

    @Test
    public void testIndivisibleDetectorsAreRejected() {
        try {
            minimal().withTransaxialCrystalsPerBlock(5).withTransaxialBlocksPerBucket(3).build();
            fail("64 detectors cannot be split into buckets of 15 crystals");
        } catch (GeometryConsistencyException e) {
            assertEquals(e.getViolations().toString(), 1, e.getViolations().size());
            assertTrue(e.getViolations().get(0).contains("num_detectors_per_ring"));
        }
    }

    @Test
    public void testEveryViolationIsReported() {
        try {
            minimal().withRingSpacing(Float.NaN).withAverageDepthOfInteraction(-1).withIntrinsicTilt(4.0f).build();
            fail();
        } catch (GeometryConsistencyException e) {
            assertEquals(e.getViolations().toString(), 3, e.getViolations().size());
        }
    }

    @Test
    public void testSinglesUnitOfZeroDisablesTheCheck() {
        assertTrue(minimal().withTransaxialCrystalsPerSinglesUnit(0).build().isConsistent());
        try {
            minimal().withTransaxialCrystalsPerSinglesUnit(7).build();
            fail();
        } catch (GeometryConsistencyException e) {
            assertTrue(e.getViolations().get(0).contains("singles unit"));
        }
    }

    @Test
    public void testUnknownNameListsSupportedNames() {
        try {
            ScannerGeometry.fromName("Unknown scanner");
            fail();
        } catch (UnknownScannerException e) {
            assertEquals("Unknown scanner", e.getRequestedName());
            for (var name : ScannerRegistry.names()) {
                assertTrue(e.getMessage(), e.getMessage().contains(name));
            }
        }
    }

    @Test
    public void testLookupIgnoresCase() {
        assertTrue(ScannerRegistry.contains("mct"));
        assertFalse(ScannerRegistry.contains("mct2"));
        assertSame(ScannerRegistry.get(ScannerRegistry.MCT), ScannerRegistry.get(" MCT "));
    }

    @Test
    public void testToBuilderRoundTrip() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.ECAT_962);
        assertEquals(scanner, scanner.toBuilder().build());
        var tilted = scanner.toBuilder().withIntrinsicTilt(0.1f).build();
        assertFalse(scanner.equals(tilted));
        assertEquals(0.1f, tilted.getIntrinsicTilt(), 0.0f);
    }

    @Test
    public void testBuckets() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        assertEquals(1, scanner.getNumTransaxialBuckets());
        assertEquals(1, scanner.getNumAxialBuckets());
    }
}
