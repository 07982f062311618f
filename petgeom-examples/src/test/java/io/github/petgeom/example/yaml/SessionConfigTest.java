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

import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.exceptions.UnknownScannerException;
import io.github.petgeom.scanner.ScannerRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionConfigTest {
    private static SessionConfig parse(String yaml) {
        return SessionConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void defaultConfigLoads() {
        var config = SessionConfig.getDefaultConfig();
        assertEquals(ScannerRegistry.MCT, config.scanner);
        assertEquals(3, config.compression.span);
        assertEquals(Symmetry.all(), config.projector.getSymmetries());

        var model = config.toCompressionModel();
        assertEquals(7, model.effectiveMaxRingDiff());
        var volume = config.volume.toDescriptor(model);
        assertEquals(41, volume.shape()[1]);
        assertEquals(41, volume.shape()[2]);
    }

    @Test
    void customScannerBuildsWorkingPair() {
        var config = parse(readResource("/custom-scanner.yml"));
        var scanner = config.toScannerGeometry();
        assertEquals("Bench", scanner.getName());
        assertEquals(4, scanner.getNumRings());
        assertEquals(EnumSet.of(Symmetry.SWAP_SEGMENT), config.projector.getSymmetries());

        var pair = config.toProjectorPair();
        assertNotNull(pair.getSystemMatrix());
        assertEquals(2, pair.getSystemMatrix().getNumTangentialLORs());
        assertArrayEquals(new int[] {config.toCompressionModel().buildProjectionDataGeometry().getNumSinograms(), 16, 16},
                          pair.forward().range().shape());
    }

    @Test
    void missingSectionsTakeDefaults() {
        var config = parse("scanner: ECAT 931\n");
        assertEquals(1, config.compression.span);
        assertEquals(1.0f, config.volume.zoom);
        assertEquals(1, config.projector.numTangentialLORs);
        assertEquals(config.toScannerGeometry().getNumDetectorsPerRing() / 2,
                     config.toCompressionModel().effectiveNumViews());
    }

    @Test
    void unknownPresetIsReported() {
        var config = parse("scanner: Nonexistent\n");
        var e = assertThrows(UnknownScannerException.class, config::toScannerGeometry);
        assertEquals("Nonexistent", e.getRequestedName());
    }

    @Test
    void unknownSymmetryIsReported() {
        var config = parse("scanner: mCT\nprojector:\n  symmetries: [MIRROR]\n");
        var e = assertThrows(IllegalArgumentException.class, () -> config.projector.getSymmetries());
        assertTrue(e.getMessage().contains("MIRROR"));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(FileNotFoundException.class, () -> SessionConfig.getConfig(new File("no/such/session.yml")));
    }

    private static String readResource(String name) {
        try (var in = SessionConfigTest.class.getResourceAsStream(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
