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

import io.github.petgeom.exceptions.UnknownScannerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed registry of named scanner presets. The set of names is closed; callers that need another
 * scanner build it with {@link ScannerGeometry#builder()}.
 */
public final class ScannerRegistry {
    /** Small 8-ring scanner used throughout the tests and examples. */
    public static final String MCT = "mCT";
    public static final String ECAT_931 = "ECAT 931";
    public static final String ECAT_962 = "ECAT 962";

    private static final Map<String, ScannerGeometry> PRESETS;

    static {
        var presets = new LinkedHashMap<String, ScannerGeometry>();
        register(presets, ScannerGeometry.builder()
                .withName(MCT)
                .withNumRings(8)
                .withNumDetectorsPerRing(112)
                .withInnerRingRadius(57.5f)
                .withRingSpacing(6.25f)
                .withAverageDepthOfInteraction(7.0f)
                .withDefaultBinSize(1.65f)
                .withAxialCrystalsPerBlock(8)
                .withTransaxialCrystalsPerBlock(7)
                .withAxialBlocksPerBucket(1)
                .withTransaxialBlocksPerBucket(16)
                .withAxialCrystalsPerSinglesUnit(8)
                .withTransaxialCrystalsPerSinglesUnit(0)
                .build());
        register(presets, ScannerGeometry.builder()
                .withName(ECAT_931)
                .withNumRings(8)
                .withNumDetectorsPerRing(512)
                .withInnerRingRadius(510.0f)
                .withRingSpacing(13.5f)
                .withAverageDepthOfInteraction(7.0f)
                .withDefaultBinSize(3.129f)
                .withMaxNumNonArcCorrectedBins(192)
                .withDefaultNumArcCorrectedBins(192)
                .withAxialCrystalsPerBlock(4)
                .withTransaxialCrystalsPerBlock(8)
                .withAxialBlocksPerBucket(2)
                .withTransaxialBlocksPerBucket(4)
                .withAxialCrystalsPerSinglesUnit(8)
                .withTransaxialCrystalsPerSinglesUnit(32)
                .build());
        register(presets, ScannerGeometry.builder()
                .withName(ECAT_962)
                .withNumRings(32)
                .withNumDetectorsPerRing(576)
                .withInnerRingRadius(412.0f)
                .withRingSpacing(4.85f)
                .withAverageDepthOfInteraction(7.0f)
                .withDefaultBinSize(2.25f)
                .withMaxNumNonArcCorrectedBins(288)
                .withDefaultNumArcCorrectedBins(288)
                .withAxialCrystalsPerBlock(8)
                .withTransaxialCrystalsPerBlock(8)
                .withAxialBlocksPerBucket(4)
                .withTransaxialBlocksPerBucket(3)
                .withAxialCrystalsPerSinglesUnit(8)
                .withTransaxialCrystalsPerSinglesUnit(24)
                .build());
        PRESETS = Collections.unmodifiableMap(presets);
    }

    private ScannerRegistry() {
    }

    private static void register(Map<String, ScannerGeometry> presets, ScannerGeometry scanner) {
        presets.put(scanner.getName(), scanner);
    }

    /**
     * @return the supported preset names, in registration order
     */
    public static List<String> names() {
        return new ArrayList<>(PRESETS.keySet());
    }

    /**
     * @param name a preset name
     * @return true if {@link #get(String)} would succeed for this name
     */
    public static boolean contains(String name) {
        return resolve(name) != null;
    }

    /**
     * Looks up a preset. Exact names win; otherwise the lookup ignores case.
     *
     * @param name the preset name
     * @return the registered geometry
     * @throws UnknownScannerException if the name is not registered
     */
    public static ScannerGeometry get(String name) {
        var scanner = resolve(name);
        if (scanner == null) {
            throw new UnknownScannerException(name, names());
        }
        return scanner;
    }

    private static ScannerGeometry resolve(String name) {
        if (name == null) {
            return null;
        }
        var exact = PRESETS.get(name);
        if (exact != null) {
            return exact;
        }
        for (var e : PRESETS.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name.trim())) {
                return e.getValue();
            }
        }
        return null;
    }
}
