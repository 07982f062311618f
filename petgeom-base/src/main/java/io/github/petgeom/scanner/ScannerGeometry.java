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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Physical description of a ring-detector PET scanner: ring layout, radii, default sampling
 * and the block/bucket/singles-unit structure of its crystals.
 * <p>
 * Instances are immutable and always consistent: the only ways to obtain one are
 * {@link #fromName(String)} and {@link Builder#build()}, and both run {@link #checkConsistency()}
 * before anything is returned. Lengths are in mm, angles in radians.
 */
public final class ScannerGeometry {
    private final String name;
    private final int numRings;
    private final int numDetectorsPerRing;
    private final float innerRingRadius;
    private final float ringSpacing;
    private final float averageDepthOfInteraction;
    private final float defaultBinSize;
    private final int defaultNumArcCorrectedBins;
    private final int maxNumNonArcCorrectedBins;
    private final float intrinsicTilt;
    private final int numAxialCrystalsPerBlock;
    private final int numTransaxialCrystalsPerBlock;
    private final int numAxialBlocksPerBucket;
    private final int numTransaxialBlocksPerBucket;
    private final int numAxialCrystalsPerSinglesUnit;
    private final int numTransaxialCrystalsPerSinglesUnit;
    private final int numDetectorLayers;

    private ScannerGeometry(Builder b, int maxNumNonArcCorrectedBins, int defaultNumArcCorrectedBins) {
        this.name = b.name;
        this.numRings = b.numRings;
        this.numDetectorsPerRing = b.numDetectorsPerRing;
        this.innerRingRadius = b.innerRingRadius;
        this.ringSpacing = b.ringSpacing;
        this.averageDepthOfInteraction = b.averageDepthOfInteraction;
        this.defaultBinSize = b.defaultBinSize;
        this.maxNumNonArcCorrectedBins = maxNumNonArcCorrectedBins;
        this.defaultNumArcCorrectedBins = defaultNumArcCorrectedBins;
        this.intrinsicTilt = b.intrinsicTilt;
        this.numAxialCrystalsPerBlock = b.numAxialCrystalsPerBlock;
        this.numTransaxialCrystalsPerBlock = b.numTransaxialCrystalsPerBlock;
        this.numAxialBlocksPerBucket = b.numAxialBlocksPerBucket;
        this.numTransaxialBlocksPerBucket = b.numTransaxialBlocksPerBucket;
        this.numAxialCrystalsPerSinglesUnit = b.numAxialCrystalsPerSinglesUnit;
        this.numTransaxialCrystalsPerSinglesUnit = b.numTransaxialCrystalsPerSinglesUnit;
        this.numDetectorLayers = b.numDetectorLayers;
    }

    /**
     * Returns the preset registered under the given name.
     *
     * @param name the preset name, see {@link ScannerRegistry#names()}
     * @return the preset geometry
     * @throws UnknownScannerException if no preset has that name
     */
    public static ScannerGeometry fromName(String name) {
        return ScannerRegistry.get(name);
    }

    /**
     * @return a builder with every optional field at its default
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with this geometry's values, for deriving variants
     */
    public Builder toBuilder() {
        return new Builder()
                .withName(name)
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
    }

    /**
     * Evaluates the consistency predicate over all fields.
     *
     * @return one message per violated relation; empty if the geometry is consistent
     */
    public List<String> checkConsistency() {
        return checkConsistency(numRings, numDetectorsPerRing, innerRingRadius, ringSpacing, averageDepthOfInteraction,
                                defaultBinSize, maxNumNonArcCorrectedBins, defaultNumArcCorrectedBins, intrinsicTilt,
                                numAxialCrystalsPerBlock, numTransaxialCrystalsPerBlock,
                                numAxialBlocksPerBucket, numTransaxialBlocksPerBucket,
                                numAxialCrystalsPerSinglesUnit, numTransaxialCrystalsPerSinglesUnit,
                                numDetectorLayers);
    }

    /**
     * @return true if {@link #checkConsistency()} reports no violation
     */
    public boolean isConsistent() {
        return checkConsistency().isEmpty();
    }

    private static List<String> checkConsistency(int numRings, int numDetectorsPerRing,
                                                 float innerRingRadius, float ringSpacing,
                                                 float averageDepthOfInteraction, float defaultBinSize,
                                                 int maxNumNonArcCorrectedBins, int defaultNumArcCorrectedBins,
                                                 float intrinsicTilt,
                                                 int axialCrystalsPerBlock, int transaxialCrystalsPerBlock,
                                                 int axialBlocksPerBucket, int transaxialBlocksPerBucket,
                                                 int axialCrystalsPerSinglesUnit, int transaxialCrystalsPerSinglesUnit,
                                                 int numDetectorLayers) {
        var violations = new ArrayList<String>();
        if (numRings <= 0) {
            violations.add("num_rings " + numRings + " must be positive");
        }
        if (numDetectorsPerRing <= 0) {
            violations.add("num_detectors_per_ring " + numDetectorsPerRing + " must be positive");
        }
        if (numDetectorLayers <= 0) {
            violations.add("num_detector_layers " + numDetectorLayers + " must be positive");
        }
        // negated comparisons so that NaN is rejected as well
        if (!(innerRingRadius > 0)) {
            violations.add("inner_ring_radius " + innerRingRadius + " must be positive");
        }
        if (!(ringSpacing > 0)) {
            violations.add("ring_spacing " + ringSpacing + " must be positive");
        }
        if (!(averageDepthOfInteraction >= 0)) {
            violations.add("average_depth_of_interaction " + averageDepthOfInteraction + " must not be negative");
        }
        if (!(defaultBinSize >= 0)) {
            violations.add("default_bin_size " + defaultBinSize + " must not be negative");
        }
        if (maxNumNonArcCorrectedBins <= 0) {
            violations.add("max_num_non_arc_corrected_bins " + maxNumNonArcCorrectedBins + " must be positive");
        }
        if (defaultNumArcCorrectedBins <= 0) {
            violations.add("default_num_arc_corrected_bins " + defaultNumArcCorrectedBins + " must be positive");
        }
        if (!(intrinsicTilt >= -Math.PI && intrinsicTilt <= Math.PI)) {
            violations.add("intrinsic_tilt " + intrinsicTilt + " must be in [-pi, pi]");
        }

        if (axialCrystalsPerBlock <= 0 || transaxialCrystalsPerBlock <= 0
            || axialBlocksPerBucket <= 0 || transaxialBlocksPerBucket <= 0) {
            violations.add(String.format("crystals per block (%d axial, %d transaxial) and blocks per bucket (%d axial, %d transaxial) must be positive",
                                         axialCrystalsPerBlock, transaxialCrystalsPerBlock, axialBlocksPerBucket, transaxialBlocksPerBucket));
        } else {
            int transaxialCrystalsPerBucket = transaxialCrystalsPerBlock * transaxialBlocksPerBucket;
            if (numDetectorsPerRing > 0 && numDetectorsPerRing % transaxialCrystalsPerBucket != 0) {
                violations.add(String.format("num_detectors_per_ring %d is not divisible by transaxial crystals per block %d times transaxial blocks per bucket %d",
                                             numDetectorsPerRing, transaxialCrystalsPerBlock, transaxialBlocksPerBucket));
            }
            int axialCrystalsPerBucket = axialCrystalsPerBlock * axialBlocksPerBucket;
            if (numRings > 0 && numRings % axialCrystalsPerBucket != 0) {
                violations.add(String.format("num_rings %d is not divisible by axial crystals per block %d times axial blocks per bucket %d",
                                             numRings, axialCrystalsPerBlock, axialBlocksPerBucket));
            }
        }

        // a singles unit of 0 means the scanner does not report singles along that direction
        if (transaxialCrystalsPerSinglesUnit < 0 || axialCrystalsPerSinglesUnit < 0) {
            violations.add("crystals per singles unit must not be negative");
        }
        if (transaxialCrystalsPerSinglesUnit > 0 && numDetectorsPerRing > 0
            && numDetectorsPerRing % transaxialCrystalsPerSinglesUnit != 0) {
            violations.add(String.format("num_detectors_per_ring %d is not divisible by transaxial crystals per singles unit %d",
                                         numDetectorsPerRing, transaxialCrystalsPerSinglesUnit));
        }
        if (axialCrystalsPerSinglesUnit > 0 && numRings > 0 && numRings % axialCrystalsPerSinglesUnit != 0) {
            violations.add(String.format("num_rings %d is not divisible by axial crystals per singles unit %d",
                                         numRings, axialCrystalsPerSinglesUnit));
        }
        return violations;
    }

    public String getName() {
        return name;
    }

    public int getNumRings() {
        return numRings;
    }

    public int getNumDetectorsPerRing() {
        return numDetectorsPerRing;
    }

    /**
     * @return radius of the crystal front surface
     */
    public float getInnerRingRadius() {
        return innerRingRadius;
    }

    /**
     * @return axial distance between the centres of two neighbouring rings
     */
    public float getRingSpacing() {
        return ringSpacing;
    }

    public float getAverageDepthOfInteraction() {
        return averageDepthOfInteraction;
    }

    /**
     * @return the radius at which lines of response are assumed to start, i.e. the inner radius
     * plus the average depth of interaction
     */
    public float getEffectiveRingRadius() {
        return innerRingRadius + averageDepthOfInteraction;
    }

    /**
     * @return tangential bin size of arc-corrected data; 0 when the scanner does not define one
     */
    public float getDefaultBinSize() {
        return defaultBinSize;
    }

    public int getDefaultNumArcCorrectedBins() {
        return defaultNumArcCorrectedBins;
    }

    public int getMaxNumNonArcCorrectedBins() {
        return maxNumNonArcCorrectedBins;
    }

    public float getIntrinsicTilt() {
        return intrinsicTilt;
    }

    public int getNumAxialCrystalsPerBlock() {
        return numAxialCrystalsPerBlock;
    }

    public int getNumTransaxialCrystalsPerBlock() {
        return numTransaxialCrystalsPerBlock;
    }

    public int getNumAxialBlocksPerBucket() {
        return numAxialBlocksPerBucket;
    }

    public int getNumTransaxialBlocksPerBucket() {
        return numTransaxialBlocksPerBucket;
    }

    public int getNumAxialCrystalsPerSinglesUnit() {
        return numAxialCrystalsPerSinglesUnit;
    }

    public int getNumTransaxialCrystalsPerSinglesUnit() {
        return numTransaxialCrystalsPerSinglesUnit;
    }

    public int getNumDetectorLayers() {
        return numDetectorLayers;
    }

    /**
     * @return number of buckets around a ring
     */
    public int getNumTransaxialBuckets() {
        return numDetectorsPerRing / (numTransaxialCrystalsPerBlock * numTransaxialBlocksPerBucket);
    }

    /**
     * @return number of buckets along the axis
     */
    public int getNumAxialBuckets() {
        return numRings / (numAxialCrystalsPerBlock * numAxialBlocksPerBucket);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScannerGeometry that = (ScannerGeometry) o;
        return numRings == that.numRings
               && numDetectorsPerRing == that.numDetectorsPerRing
               && Float.compare(innerRingRadius, that.innerRingRadius) == 0
               && Float.compare(ringSpacing, that.ringSpacing) == 0
               && Float.compare(averageDepthOfInteraction, that.averageDepthOfInteraction) == 0
               && Float.compare(defaultBinSize, that.defaultBinSize) == 0
               && defaultNumArcCorrectedBins == that.defaultNumArcCorrectedBins
               && maxNumNonArcCorrectedBins == that.maxNumNonArcCorrectedBins
               && Float.compare(intrinsicTilt, that.intrinsicTilt) == 0
               && numAxialCrystalsPerBlock == that.numAxialCrystalsPerBlock
               && numTransaxialCrystalsPerBlock == that.numTransaxialCrystalsPerBlock
               && numAxialBlocksPerBucket == that.numAxialBlocksPerBucket
               && numTransaxialBlocksPerBucket == that.numTransaxialBlocksPerBucket
               && numAxialCrystalsPerSinglesUnit == that.numAxialCrystalsPerSinglesUnit
               && numTransaxialCrystalsPerSinglesUnit == that.numTransaxialCrystalsPerSinglesUnit
               && numDetectorLayers == that.numDetectorLayers
               && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, numRings, numDetectorsPerRing, innerRingRadius, ringSpacing, averageDepthOfInteraction,
                            defaultBinSize, defaultNumArcCorrectedBins, maxNumNonArcCorrectedBins, intrinsicTilt,
                            numAxialCrystalsPerBlock, numTransaxialCrystalsPerBlock, numAxialBlocksPerBucket,
                            numTransaxialBlocksPerBucket, numAxialCrystalsPerSinglesUnit,
                            numTransaxialCrystalsPerSinglesUnit, numDetectorLayers);
    }

    @Override
    public String toString() {
        return String.format("ScannerGeometry(%s, rings=%d, detectorsPerRing=%d, innerRadius=%.2f, ringSpacing=%.3f, DOI=%.2f, binSize=%.4f, " +
                             "arcCorrectedBins=%d, nonArcCorrectedBins=%d, tilt=%.4f, layers=%d)",
                             name, numRings, numDetectorsPerRing, innerRingRadius, ringSpacing, averageDepthOfInteraction, defaultBinSize,
                             defaultNumArcCorrectedBins, maxNumNonArcCorrectedBins, intrinsicTilt, numDetectorLayers);
    }

    /**
     * Collects explicit scanner parameters. Block, bucket and singles-unit counts and the number
     * of detector layers default to 1, the intrinsic tilt to 0. When not given,
     * {@code maxNumNonArcCorrectedBins} is half the number of detectors per ring (roughly the
     * number of detectors on a diameter) and {@code defaultNumArcCorrectedBins} follows it.
     */
    public static final class Builder {
        private String name = "Userdefined";
        private int numRings;
        private int numDetectorsPerRing;
        private float innerRingRadius;
        private float ringSpacing;
        private float averageDepthOfInteraction;
        private float defaultBinSize;
        private Integer maxNumNonArcCorrectedBins;
        private Integer defaultNumArcCorrectedBins;
        private float intrinsicTilt = 0;
        private int numAxialCrystalsPerBlock = 1;
        private int numTransaxialCrystalsPerBlock = 1;
        private int numAxialBlocksPerBucket = 1;
        private int numTransaxialBlocksPerBucket = 1;
        private int numAxialCrystalsPerSinglesUnit = 1;
        private int numTransaxialCrystalsPerSinglesUnit = 1;
        private int numDetectorLayers = 1;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder withNumRings(int numRings) {
            this.numRings = numRings;
            return this;
        }

        public Builder withNumDetectorsPerRing(int numDetectorsPerRing) {
            this.numDetectorsPerRing = numDetectorsPerRing;
            return this;
        }

        public Builder withInnerRingRadius(float innerRingRadius) {
            this.innerRingRadius = innerRingRadius;
            return this;
        }

        public Builder withRingSpacing(float ringSpacing) {
            this.ringSpacing = ringSpacing;
            return this;
        }

        public Builder withAverageDepthOfInteraction(float averageDepthOfInteraction) {
            this.averageDepthOfInteraction = averageDepthOfInteraction;
            return this;
        }

        public Builder withDefaultBinSize(float defaultBinSize) {
            this.defaultBinSize = defaultBinSize;
            return this;
        }

        /**
         * @param bins the maximum number of non-arc-corrected tangential bins, or null for the default
         */
        public Builder withMaxNumNonArcCorrectedBins(Integer bins) {
            this.maxNumNonArcCorrectedBins = bins;
            return this;
        }

        /**
         * @param bins the default number of arc-corrected tangential bins, or null for the default
         */
        public Builder withDefaultNumArcCorrectedBins(Integer bins) {
            this.defaultNumArcCorrectedBins = bins;
            return this;
        }

        public Builder withIntrinsicTilt(float intrinsicTilt) {
            this.intrinsicTilt = intrinsicTilt;
            return this;
        }

        public Builder withAxialCrystalsPerBlock(int n) {
            this.numAxialCrystalsPerBlock = n;
            return this;
        }

        public Builder withTransaxialCrystalsPerBlock(int n) {
            this.numTransaxialCrystalsPerBlock = n;
            return this;
        }

        public Builder withAxialBlocksPerBucket(int n) {
            this.numAxialBlocksPerBucket = n;
            return this;
        }

        public Builder withTransaxialBlocksPerBucket(int n) {
            this.numTransaxialBlocksPerBucket = n;
            return this;
        }

        public Builder withAxialCrystalsPerSinglesUnit(int n) {
            this.numAxialCrystalsPerSinglesUnit = n;
            return this;
        }

        public Builder withTransaxialCrystalsPerSinglesUnit(int n) {
            this.numTransaxialCrystalsPerSinglesUnit = n;
            return this;
        }

        public Builder withNumDetectorLayers(int numDetectorLayers) {
            this.numDetectorLayers = numDetectorLayers;
            return this;
        }

        /**
         * Resolves the defaults, runs the consistency predicate and creates the geometry.
         *
         * @return a consistent scanner geometry
         * @throws GeometryConsistencyException if any relation does not hold
         */
        public ScannerGeometry build() {
            int maxNonArc = maxNumNonArcCorrectedBins != null ? maxNumNonArcCorrectedBins : numDetectorsPerRing / 2;
            int defaultArc = defaultNumArcCorrectedBins != null ? defaultNumArcCorrectedBins : maxNonArc;
            var violations = checkConsistency(numRings, numDetectorsPerRing, innerRingRadius, ringSpacing,
                                              averageDepthOfInteraction, defaultBinSize, maxNonArc, defaultArc, intrinsicTilt,
                                              numAxialCrystalsPerBlock, numTransaxialCrystalsPerBlock,
                                              numAxialBlocksPerBucket, numTransaxialBlocksPerBucket,
                                              numAxialCrystalsPerSinglesUnit, numTransaxialCrystalsPerSinglesUnit,
                                              numDetectorLayers);
            if (!violations.isEmpty()) {
                throw new GeometryConsistencyException(name, violations);
            }
            return new ScannerGeometry(this, maxNonArc, defaultArc);
        }
    }
}
