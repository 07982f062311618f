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

package io.github.petgeom.operator;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.petgeom.compression.CompressionConfig;
import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.engine.ProjectionEngines;
import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.engine.Verbosity;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.exceptions.ShapeMismatchException;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import io.github.petgeom.space.UniformSpace;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.junit.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestProjectorPair extends RandomizedTest {
    private static final ScannerGeometry MCT = ScannerGeometry.fromName(ScannerRegistry.MCT);

    /**
     * A small span-3 geometry: 47 sinograms, 8 views, 16 tangential bins.
     */
    static CompressionModel smallModel() {
        var config = CompressionConfig.builder()
                .withSpanNum(3)
                .withNumOfViews(8)
                .withNumNonArcCorBins(16)
                .build();
        return new CompressionModel(MCT, config);
    }

    private static ProjectorPair.Builder smallBuilder() {
        var model = smallModel();
        var volume = model.buildVolumeDescriptor(1.0f, new IntCoordinate3D(IntCoordinate3D.AUTO, 17, 17), Coordinate3D.ZERO);
        return model.projectorBuilder(ProjectionEngines.getDefault(), volume);
    }

    private float[] randomElement(int size) {
        var values = new float[size];
        for (int i = 0; i < size; i++) {
            values[i] = randomFloat();
        }
        return values;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    private void assertAdjoint(ProjectorPair pair) {
        var forward = pair.forward();
        var x = randomElement(forward.domain().size());
        var y = randomElement(forward.range().size());
        double lhs = dot(forward.apply(x), y);
        double rhs = dot(x, forward.adjoint().apply(y));
        assertTrue("<Ax, y> = " + lhs, lhs > 0);
        assertEquals(lhs, rhs, 1e-4 * Math.abs(lhs));
    }

    @Test
    public void testAdjointIdentity() {
        assertAdjoint(smallBuilder().build());
    }

    @Test
    public void testAdjointIdentityWithoutSymmetries() {
        assertAdjoint(smallBuilder().withSymmetries(EnumSet.noneOf(Symmetry.class)).build());
    }

    @Test
    public void testAdjointIdentityWithSeveralLORs() {
        assertAdjoint(smallBuilder().withNumTangentialLORs(3).withVerbosity(2).build());
    }

    @Test
    public void testAdjointIdentityOffCentre() {
        var model = smallModel();
        var volume = model.buildVolumeDescriptor(1.5f, new IntCoordinate3D(9, 12, 13), new Coordinate3D(3.0f, 2.0f, -1.0f));
        assertAdjoint(model.buildProjector(ProjectionEngines.getDefault(), volume));
    }

    @Test
    public void testAdjointLinks() {
        var pair = smallBuilder().build();
        assertSame(pair.back(), pair.forward().adjoint());
        assertSame(pair.forward(), pair.forward().adjoint().adjoint());
        assertSame(pair.forward().domain(), pair.back().range());
        assertSame(pair.forward().range(), pair.back().domain());
    }

    @Test
    public void testSymmetriesDoNotChangeTheProjection() {
        var withSymmetries = smallBuilder().build();
        var without = smallBuilder().withSymmetries(EnumSet.noneOf(Symmetry.class)).build();
        var x = randomElement(withSymmetries.forward().domain().size());
        var a = withSymmetries.forward().apply(x);
        var b = without.forward().apply(x);
        double difference = 0;
        for (int i = 0; i < a.length; i++) {
            difference += (a[i] - b[i]) * (double) (a[i] - b[i]);
        }
        // rows of symmetric bins only differ where a sample falls exactly between two voxels
        assertTrue(Math.sqrt(difference / dot(b, b)) < 0.05);
    }

    @Test
    public void testPairIsReusable() {
        var pair = smallBuilder().build();
        var ones = new float[pair.forward().domain().size()];
        Arrays.fill(ones, 1.0f);
        var first = pair.forward().apply(ones);
        pair.forward().apply(randomElement(ones.length));
        var again = pair.forward().apply(ones);
        assertEquals(0.0, dot(first, first) - dot(first, again), 1e-6 * dot(first, first));

        var backFirst = pair.back().apply(first);
        var backAgain = pair.back().apply(first);
        assertEquals(dot(backFirst, backFirst), dot(backFirst, backAgain), 1e-6 * dot(backFirst, backFirst));
    }

    @Test
    public void testVerbosityIsRestored() {
        Verbosity.set(0);
        var pair = smallBuilder().withVerbosity(1).build();
        pair.forward().apply(pair.forward().domain().zero());
        assertEquals(0, Verbosity.get());
    }

    @Test
    public void testShapeMismatchBeforeAnyEngineCall() {
        var engine = new CountingEngine();
        var domain = new UniformSpace(new int[] {4, 4, 4}, new double[] {0, 0, 0}, new double[] {1, 1, 1},
                                     List.of("z", "y", "x"));
        var range = new UniformSpace(new int[] {2, 2, 2}, new double[] {0, 0, 0}, new double[] {1, 1, 1},
                                    List.of("a", "b", "c"));
        try {
            ProjectorPair.builder(engine, domain, range, engine.volume(5, 4, 4), engine.projectionData(2, 2, 2)).build();
            fail();
        } catch (ShapeMismatchException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("[4, 4, 4] does not equal [5, 4, 4]"));
        }
        try {
            ProjectorPair.builder(engine, domain, range, engine.volume(4, 4, 4), engine.projectionData(3, 2, 2)).build();
            fail();
        } catch (ShapeMismatchException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("range"));
        }
        assertEquals(0, engine.calls);
    }

    @Test
    public void testApplyChecksLengths() {
        var pair = smallBuilder().build();
        try {
            pair.forward().apply(new float[3]);
            fail();
        } catch (ShapeMismatchException e) {
            // expected
        }
        try {
            pair.back().apply(new float[pair.back().domain().size()], new float[1]);
            fail();
        } catch (ShapeMismatchException e) {
            // expected
        }
    }

    @Test
    public void testSharedSystemMatrix() {
        var first = smallBuilder().build();
        var second = smallBuilder().withSystemMatrix(first.getSystemMatrix()).build();
        assertSame(first.getSystemMatrix(), second.getSystemMatrix());
        assertAdjoint(second);
    }

    private static CompressionModel fewerViewsModel() {
        var config = CompressionConfig.builder()
                .withSpanNum(3)
                .withNumOfViews(4)
                .withNumNonArcCorBins(16)
                .build();
        return new CompressionModel(MCT, config);
    }

    @Test
    public void testSystemMatrixForOtherProjectionDataRejected() {
        var first = smallBuilder().build();
        var model = fewerViewsModel();
        var volume = model.buildVolumeDescriptor(1.0f, new IntCoordinate3D(IntCoordinate3D.AUTO, 17, 17), Coordinate3D.ZERO);
        var builder = model.projectorBuilder(ProjectionEngines.getDefault(), volume).withSystemMatrix(first.getSystemMatrix());
        try {
            builder.build();
            fail("expected EngineCallException");
        } catch (EngineCallException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("System matrix was built for"));
        }
    }

    @Test
    public void testProjectionDataInfoForOtherDataRejected() {
        var otherInfo = fewerViewsModel().buildEngineProjectionDataInfo(ProjectionEngines.getDefault());
        try {
            smallBuilder().withProjectionDataInfo(otherInfo).build();
            fail("expected EngineCallException");
        } catch (EngineCallException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("does not match the projection data"));
        }
    }
}
