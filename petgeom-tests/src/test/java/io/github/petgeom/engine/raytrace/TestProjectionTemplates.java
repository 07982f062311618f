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

import io.github.petgeom.compression.CompressionConfig;
import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.operator.ProjectorPair;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestProjectionTemplates {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static CompressionModel model(ScannerGeometry scanner) {
        var config = CompressionConfig.builder()
                .withSpanNum(3)
                .withNumOfViews(8)
                .withNumNonArcCorBins(16)
                .build();
        return new CompressionModel(scanner, config);
    }

    @Test
    public void testPresetGeometryRoundTrip() throws IOException {
        var geometry = model(ScannerGeometry.fromName(ScannerRegistry.MCT)).buildProjectionDataGeometry();
        var path = folder.getRoot().toPath().resolve("data.yml");
        ProjectionTemplates.writeProjectionTemplate(path, geometry);
        assertTrue(Files.readString(path, StandardCharsets.UTF_8).contains(ScannerRegistry.MCT));
        assertEquals(geometry, ProjectionTemplates.readProjectionGeometry(path));
    }

    @Test
    public void testCustomScannerIsSpelledOut() throws IOException {
        var scanner = ScannerGeometry.fromName(ScannerRegistry.MCT).toBuilder()
                .withName("Bench")
                .withInnerRingRadius(300.0f)
                .build();
        var geometry = model(scanner).buildProjectionDataGeometry();
        var path = folder.getRoot().toPath().resolve("bench.yml");
        ProjectionTemplates.writeProjectionTemplate(path, geometry);
        var read = ProjectionTemplates.readProjectionGeometry(path);
        assertEquals(geometry, read);
        assertEquals(300.0f, read.getScanner().getInnerRingRadius(), 0f);
    }

    @Test
    public void testVolumeTemplateRoundTrip() throws IOException {
        var model = model(ScannerGeometry.fromName(ScannerRegistry.MCT));
        var geometry = model.buildProjectionDataGeometry();
        var volume = model.buildVolumeDescriptor(1.5f, new IntCoordinate3D(9, 12, 13), new Coordinate3D(3, 2, -1));
        var sub = folder.newFolder("templates").toPath();
        var projection = sub.resolve("data.yml");
        var image = folder.getRoot().toPath().resolve("image.yml");
        ProjectionTemplates.writeProjectionTemplate(projection, geometry);
        ProjectionTemplates.writeVolumeTemplate(image, projection, volume);

        var template = ProjectionTemplates.readVolumeTemplate(image);
        assertEquals(geometry, template.getProjectionGeometry());
        assertEquals(volume, template.getVolume());
        assertArrayEquals(new int[] {9, 12, 13}, template.getVolume().shape());
    }

    @Test
    public void testPairFromFiles() throws IOException {
        var model = model(ScannerGeometry.fromName(ScannerRegistry.MCT));
        var geometry = model.buildProjectionDataGeometry();
        var volume = model.buildVolumeDescriptor(1.0f, new IntCoordinate3D(IntCoordinate3D.AUTO, 17, 17), Coordinate3D.ZERO);
        var projection = folder.getRoot().toPath().resolve("data.yml");
        var image = folder.getRoot().toPath().resolve("image.yml");
        ProjectionTemplates.writeProjectionTemplate(projection, geometry);
        ProjectionTemplates.writeVolumeTemplate(image, projection, volume);

        var pair = ProjectorPair.fromFiles(new RayTracingProjectionEngine(), image, projection);
        assertArrayEquals(volume.shape(), pair.forward().domain().shape());
        assertArrayEquals(geometry.shape(), pair.forward().range().shape());
        assertEquals(Symmetry.all(), pair.getSystemMatrix().getSymmetries());

        var ones = new float[volume.size()];
        Arrays.fill(ones, 1.0f);
        var projected = pair.forward().apply(ones);
        double total = 0;
        for (float value : projected) {
            total += value;
        }
        assertTrue(total > 0);
    }

    @Test
    public void testMissingProjectionReference() throws IOException {
        var image = folder.getRoot().toPath().resolve("image.yml");
        Files.writeString(image, "zoom: 1.0\n", StandardCharsets.UTF_8);
        try {
            ProjectionTemplates.readVolumeTemplate(image);
            fail("expected EngineCallException");
        } catch (EngineCallException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(ProjectionTemplates.PROJECTION_TEMPLATE));
        }
    }

    @Test
    public void testUnknownScanner() throws IOException {
        var path = folder.getRoot().toPath().resolve("data.yml");
        Files.writeString(path, "scanner: Nonexistent\nspan: 1\n", StandardCharsets.UTF_8);
        try {
            ProjectionTemplates.readProjectionGeometry(path);
            fail("expected EngineCallException");
        } catch (EngineCallException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Nonexistent"));
        }
    }
}
