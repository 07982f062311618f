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

import io.github.petgeom.scanner.ScannerGeometry;

/**
 * Explicit scanner parameters, for scanners that are not registered presets.
 * Lengths are in mm, the tilt in radians.
 */
public class ScannerParameters {
    public String name;
    public int numRings;
    public int numDetectorsPerRing;
    public float innerRingRadius;
    public float ringSpacing;
    public float averageDepthOfInteraction;
    public float defaultBinSize;
    public Integer maxNumNonArcCorrectedBins;
    public Integer defaultNumArcCorrectedBins;
    public float intrinsicTilt;
    public int numAxialCrystalsPerBlock = 1;
    public int numTransaxialCrystalsPerBlock = 1;
    public int numAxialBlocksPerBucket = 1;
    public int numTransaxialBlocksPerBucket = 1;
    public int numAxialCrystalsPerSinglesUnit = 1;
    public int numTransaxialCrystalsPerSinglesUnit = 1;
    public int numDetectorLayers = 1;

    public ScannerParameters() {
    }

    /**
     * @throws io.github.petgeom.exceptions.GeometryConsistencyException if the parameters are inconsistent
     */
    public ScannerGeometry toScannerGeometry() {
        var builder = ScannerGeometry.builder()
                .withNumRings(numRings)
                .withNumDetectorsPerRing(numDetectorsPerRing)
                .withInnerRingRadius(innerRingRadius)
                .withRingSpacing(ringSpacing)
                .withAverageDepthOfInteraction(averageDepthOfInteraction)
                .withDefaultBinSize(defaultBinSize)
                .withMaxNumNonArcCorrectedBins(maxNumNonArcCorrectedBins)
                .withDefaultNumArcCorrectedBins(defaultNumArcCorrectedBins)
                .withIntrinsicTilt(intrinsicTilt)
                .withAxialCrystalsPerBlock(numAxialCrystalsPerBlock)
                .withTransaxialCrystalsPerBlock(numTransaxialCrystalsPerBlock)
                .withAxialBlocksPerBucket(numAxialBlocksPerBucket)
                .withTransaxialBlocksPerBucket(numTransaxialBlocksPerBucket)
                .withAxialCrystalsPerSinglesUnit(numAxialCrystalsPerSinglesUnit)
                .withTransaxialCrystalsPerSinglesUnit(numTransaxialCrystalsPerSinglesUnit)
                .withNumDetectorLayers(numDetectorLayers);
        if (name != null) {
            builder.withName(name);
        }
        return builder.build();
    }
}
