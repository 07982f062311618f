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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestProjectionDataGeometry extends RandomizedTest {
    private static ScannerGeometry scannerWithRings(int numRings) {
        return ScannerGeometry.builder()
                .withNumRings(numRings)
                .withNumDetectorsPerRing(64)
                .withInnerRingRadius(100.0f)
                .withRingSpacing(4.0f)
                .withDefaultBinSize(2.0f)
                .build();
    }

    @Test
    public void testSpanThreeSegmentSizes() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        var geometry = ProjectionDataGeometry.compute(scanner, 3, 7, 8, 16, false);
        assertEquals(-2, geometry.getMinSegment());
        assertEquals(2, geometry.getMaxSegment());
        int[] sizes = geometry.getSegments().stream().mapToInt(SegmentInfo::getNumAxialPositions).toArray();
        assertArrayEquals(new int[] {5, 11, 15, 11, 5}, sizes);
        assertEquals(47, geometry.getNumSinograms());
        assertTrue(geometry.isSegmentZeroAxiallyCompressed());

        var one = geometry.getSegment(1);
        assertEquals(2, one.getMinRingDiff());
        assertEquals(4, one.getMaxRingDiff());
        assertEquals(3.0f, one.getAverageRingDiff(), 0.0f);
        var minusTwo = geometry.getSegment(-2);
        assertEquals(-7, minusTwo.getMinRingDiff());
        assertEquals(-5, minusTwo.getMaxRingDiff());
    }

    @Test
    public void testSpanOneSegmentSizes() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        var geometry = ProjectionDataGeometry.compute(scanner, 1, 7, 56, 56, false);
        assertEquals(-7, geometry.getMinSegment());
        assertEquals(7, geometry.getMaxSegment());
        assertFalse(geometry.isSegmentZeroAxiallyCompressed());
        for (var segment : geometry.getSegments()) {
            assertEquals(8 - Math.abs(segment.getSegment()), segment.getNumAxialPositions());
        }
        assertEquals(64, geometry.getNumSinograms());
        assertArrayEquals(new int[] {64, 56, 56}, geometry.shape());
    }

    @Test
    public void testIncompleteLastSegmentIsDropped() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        var geometry = ProjectionDataGeometry.compute(scanner, 3, 6, 8, 16, false);
        assertEquals(1, geometry.getMaxSegment());
        assertEquals(4, geometry.getSegment(1).getMaxRingDiff());
    }

    @Test
    public void testInvalidArguments() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, 2, 7, 8, 16, false));
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, -1, 7, 8, 16, false));
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, 1, 8, 8, 16, false));
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, 5, 1, 8, 16, false));
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, 1, 7, 0, 16, false));
        assertRejected(() -> ProjectionDataGeometry.compute(scanner, 1, 7, 8, 113, false));
    }

    private static void assertRejected(Runnable r) {
        try {
            r.run();
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testRandomGeometriesAreSymmetricAndComplete() {
        for (int trial = 0; trial < 200; trial++) {
            int numRings = randomIntBetween(1, 40);
            int span = 2 * randomIntBetween(0, (numRings - 1) / 2) + 1;
            int maxRingDiff = randomIntBetween((span - 1) / 2, numRings - 1);
            var geometry = ProjectionDataGeometry.compute(scannerWithRings(numRings), span, maxRingDiff, 4, 8, false);
            var context = String.format("rings=%d span=%d maxRingDiff=%d", numRings, span, maxRingDiff);

            assertEquals(context, -geometry.getMinSegment(), geometry.getMaxSegment());
            assertEquals(context, geometry.getNumSegments(), geometry.getSegments().size());
            int total = 0;
            for (var segment : geometry.getSegments()) {
                int k = segment.getSegment();
                total += segment.getNumAxialPositions();
                assertTrue(context, segment.getNumAxialPositions() > 0);
                assertEquals(context, segment.getNumAxialPositions(), geometry.getNumAxialPositions(-k));
                assertEquals(context, segment.getMinRingDiff(), -geometry.getSegment(-k).getMaxRingDiff());
                if (k > 0) {
                    assertTrue(context, segment.getNumAxialPositions() <= geometry.getNumAxialPositions(k - 1));
                    assertTrue(context, segment.getMaxRingDiff() <= maxRingDiff);
                }
            }
            assertEquals(context, geometry.getNumSinograms(), total);
            assertEquals(context, geometry.size(), total * 4 * 8);
        }
    }

    @Test
    public void testOffsetsAreABijection() {
        for (int trial = 0; trial < 50; trial++) {
            int numRings = randomIntBetween(1, 24);
            int span = 2 * randomIntBetween(0, (numRings - 1) / 2) + 1;
            int maxRingDiff = randomIntBetween((span - 1) / 2, numRings - 1);
            var geometry = ProjectionDataGeometry.compute(scannerWithRings(numRings), span, maxRingDiff, 4, 8, true);

            var seen = new boolean[geometry.getNumSinograms()];
            int expected = 0;
            for (var segment : geometry.getSegments()) {
                for (int a = geometry.getMinAxialPos(segment.getSegment()); a <= geometry.getMaxAxialPos(segment.getSegment()); a++) {
                    int offset = geometry.getSinogramOffset(segment.getSegment(), a);
                    assertEquals(expected++, offset);
                    assertFalse(seen[offset]);
                    seen[offset] = true;
                }
            }
            for (boolean b : seen) {
                assertTrue(Arrays.toString(seen), b);
            }
            int maxSegment = geometry.getMaxSegment();
            assertRejected(() -> geometry.getSinogramOffset(maxSegment + 1, 0));
            assertRejected(() -> geometry.getSinogramOffset(0, geometry.getNumAxialPositions(0)));
            assertRejected(() -> geometry.getSinogramOffset(0, -1));
        }
    }

    @Test
    public void testTangentialCoordinates() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        var arc = ProjectionDataGeometry.compute(scanner, 1, 7, 56, 56, true);
        assertEquals(-28, arc.getMinTangentialPos());
        assertEquals(27, arc.getMaxTangentialPos());
        assertEquals(3 * 1.65, arc.getTangentialCoordinate(3), 1e-5);

        var nonArc = ProjectionDataGeometry.compute(scanner, 1, 7, 56, 56, false);
        double radius = scanner.getEffectiveRingRadius();
        assertEquals(radius * Math.sin(Math.PI / 4), nonArc.getTangentialCoordinate(28), 1e-5);
        assertEquals(-nonArc.getTangentialCoordinate(5), nonArc.getTangentialCoordinate(-5), 1e-9);
        assertEquals(0.0, nonArc.getViewAngle(0), 0.0);
        assertEquals(Math.PI / 2, nonArc.getViewAngle(28), 1e-12);
    }

    @Test
    public void testAxialCentrePlanes() {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT);
        var spanOne = ProjectionDataGeometry.compute(scanner, 1, 7, 8, 16, false);
        // ring pair (a, a + d) is centred on plane 2a + d
        assertEquals(0, spanOne.getAxialCentrePlane(0, 0));
        assertEquals(14, spanOne.getAxialCentrePlane(0, 7));
        assertEquals(7, spanOne.getAxialCentrePlane(7, 0));
        assertEquals(7, spanOne.getAxialCentrePlane(-7, 0));

        var spanThree = ProjectionDataGeometry.compute(scanner, 3, 7, 8, 16, false);
        assertEquals(0, spanThree.getAxialCentrePlane(0, 0));
        assertEquals(2, spanThree.getAxialCentrePlane(1, 0));
        assertEquals(12, spanThree.getAxialCentrePlane(-1, 10));
    }
}
