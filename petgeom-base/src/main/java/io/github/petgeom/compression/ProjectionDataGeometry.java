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

import io.github.petgeom.scanner.ScannerGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Geometry of axially compressed 3D projection data, following the CTI segment convention.
 * <p>
 * Segment 0 merges the ring differences {@code [-(span-1)/2, (span-1)/2]}; every further
 * segment merges the next {@code span} ring differences, and segment {@code -k} mirrors
 * segment {@code k}. With span 1 each segment holds a single ring difference {@code d} and
 * {@code numRings - |d|} sinograms, one per ring pair. With a larger span the axial positions
 * are sampled at half the ring spacing, so segment 0 holds {@code 2*numRings - 1} sinograms and
 * segment {@code k} holds {@code 2*numRings - 1 - 2*m}, where {@code m} is the smallest
 * |ring difference| it merges.
 * <p>
 * Sinograms are laid out segment by segment in increasing segment index, so the flat sinogram
 * offset of {@code (segment, axial)} is the total size of all preceding segments plus
 * {@code axial}. Instances are immutable and are produced by the pure function
 * {@link #compute(ScannerGeometry, int, int, int, int, boolean)}.
 */
public final class ProjectionDataGeometry {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionDataGeometry.class);

    private final ScannerGeometry scanner;
    private final int span;
    private final int maxRingDiff;
    private final int numViews;
    private final int numTangentialBins;
    private final boolean arcCorrected;
    private final List<SegmentInfo> segments;
    // segmentOffsets[i] is the flat sinogram index of axial position 0 of segments.get(i)
    private final int[] segmentOffsets;
    private final int numSinograms;

    private ProjectionDataGeometry(ScannerGeometry scanner, int span, int maxRingDiff, int numViews,
                                   int numTangentialBins, boolean arcCorrected, List<SegmentInfo> segments) {
        this.scanner = scanner;
        this.span = span;
        this.maxRingDiff = maxRingDiff;
        this.numViews = numViews;
        this.numTangentialBins = numTangentialBins;
        this.arcCorrected = arcCorrected;
        this.segments = Collections.unmodifiableList(segments);
        this.segmentOffsets = new int[segments.size()];
        int offset = 0;
        for (int i = 0; i < segments.size(); i++) {
            segmentOffsets[i] = offset;
            offset += segments.get(i).getNumAxialPositions();
        }
        this.numSinograms = offset;
    }

    /**
     * Derives the projection-data geometry for a scanner and a set of compression choices.
     *
     * @param scanner the scanner
     * @param span axial compression, a positive odd number
     * @param maxRingDiff the largest ring difference to keep
     * @param numViews number of azimuthal views covering [0, pi)
     * @param numTangentialBins number of tangential positions per view
     * @param arcCorrected whether the tangential positions are uniformly spaced
     * @return the derived geometry
     * @throws IllegalArgumentException if the choices are incompatible with each other or the scanner
     */
    public static ProjectionDataGeometry compute(ScannerGeometry scanner, int span, int maxRingDiff,
                                                 int numViews, int numTangentialBins, boolean arcCorrected) {
        Objects.requireNonNull(scanner, "scanner");
        int numRings = scanner.getNumRings();
        if (span < 1 || span % 2 == 0) {
            throw new IllegalArgumentException("span " + span + " has to be a positive odd number");
        }
        if (maxRingDiff > numRings - 1) {
            throw new IllegalArgumentException(String.format("max ring difference %d exceeds the %d rings of scanner %s",
                                                             maxRingDiff, numRings, scanner.getName()));
        }
        int halfSpan = (span - 1) / 2;
        if (maxRingDiff < halfSpan) {
            throw new IllegalArgumentException(String.format("max ring difference %d has to be at least (span-1)/2, span is %d",
                                                             maxRingDiff, span));
        }
        if (numViews <= 0) {
            throw new IllegalArgumentException("number of views " + numViews + " must be positive");
        }
        if (numTangentialBins <= 0) {
            throw new IllegalArgumentException("number of tangential bins " + numTangentialBins + " must be positive");
        }
        if (!arcCorrected && numTangentialBins > scanner.getNumDetectorsPerRing()) {
            throw new IllegalArgumentException(String.format("%d non-arc-corrected tangential bins exceed the %d detectors per ring",
                                                             numTangentialBins, scanner.getNumDetectorsPerRing()));
        }

        int numPositiveSegments = (maxRingDiff - halfSpan) / span;
        int uncovered = (maxRingDiff - halfSpan) % span;
        if (uncovered != 0) {
            logger.warn("Max ring difference {} is not compatible with span {}: ring differences above {} do not fill a segment and are dropped",
                        maxRingDiff, span, halfSpan + numPositiveSegments * span);
        }

        var positive = new ArrayList<SegmentInfo>(numPositiveSegments + 1);
        positive.add(new SegmentInfo(0, -halfSpan, halfSpan, span == 1 ? numRings : 2 * numRings - 1));
        for (int k = 1; k <= numPositiveSegments; k++) {
            int minDiff = halfSpan + 1 + (k - 1) * span;
            int maxDiff = minDiff + span - 1;
            int numAxial = span == 1 ? numRings - minDiff : 2 * numRings - 1 - 2 * minDiff;
            positive.add(new SegmentInfo(k, minDiff, maxDiff, numAxial));
        }

        var segments = new ArrayList<SegmentInfo>(2 * numPositiveSegments + 1);
        for (int k = numPositiveSegments; k >= 1; k--) {
            var p = positive.get(k);
            segments.add(new SegmentInfo(-k, -p.getMaxRingDiff(), -p.getMinRingDiff(), p.getNumAxialPositions()));
        }
        segments.addAll(positive);
        return new ProjectionDataGeometry(scanner, span, maxRingDiff, numViews, numTangentialBins, arcCorrected, segments);
    }

    public ScannerGeometry getScanner() {
        return scanner;
    }

    public int getSpan() {
        return span;
    }

    public int getMaxRingDiff() {
        return maxRingDiff;
    }

    public boolean isArcCorrected() {
        return arcCorrected;
    }

    public int getMinSegment() {
        return segments.get(0).getSegment();
    }

    public int getMaxSegment() {
        return segments.get(segments.size() - 1).getSegment();
    }

    public int getNumSegments() {
        return segments.size();
    }

    /**
     * @return all segments, ordered from {@link #getMinSegment()} to {@link #getMaxSegment()}
     */
    public List<SegmentInfo> getSegments() {
        return segments;
    }

    public SegmentInfo getSegment(int segment) {
        return segments.get(segmentIndex(segment));
    }

    public int getMinAxialPos(int segment) {
        segmentIndex(segment);
        return 0;
    }

    public int getMaxAxialPos(int segment) {
        return getSegment(segment).getNumAxialPositions() - 1;
    }

    public int getNumAxialPositions(int segment) {
        return getSegment(segment).getNumAxialPositions();
    }

    public int getNumSinograms() {
        return numSinograms;
    }

    public int getNumViews() {
        return numViews;
    }

    public int getNumTangentialBins() {
        return numTangentialBins;
    }

    public int getMinTangentialPos() {
        return -(numTangentialBins / 2);
    }

    public int getMaxTangentialPos() {
        return getMinTangentialPos() + numTangentialBins - 1;
    }

    /**
     * @return true if segment 0 merges more than one ring difference
     */
    public boolean isSegmentZeroAxiallyCompressed() {
        var zero = getSegment(0);
        return zero.getMaxRingDiff() > zero.getMinRingDiff();
    }

    /**
     * @return {@code (numSinograms, numViews, numTangentialBins)}
     */
    public int[] shape() {
        return new int[] {numSinograms, numViews, numTangentialBins};
    }

    /**
     * @return total number of bins, the product of {@link #shape()}
     */
    public int size() {
        return numSinograms * numViews * numTangentialBins;
    }

    /**
     * Flat sinogram index of an axial position within a segment.
     *
     * @throws IllegalArgumentException if the pair is outside the geometry
     */
    public int getSinogramOffset(int segment, int axial) {
        int i = segmentIndex(segment);
        int numAxial = segments.get(i).getNumAxialPositions();
        if (axial < 0 || axial >= numAxial) {
            throw new IllegalArgumentException(String.format("axial position %d outside [0, %d) of segment %d", axial, numAxial, segment));
        }
        return segmentOffsets[i] + axial;
    }

    /**
     * Index of a volume plane (spaced at half the ring spacing, plane 0 on ring 0) that the
     * centre of the lines of response at this axial position falls on.
     */
    public int getAxialCentrePlane(int segment, int axial) {
        var info = getSegment(segment);
        if (span == 1) {
            return 2 * axial + Math.abs(info.getMinRingDiff());
        }
        return info.getMinAbsRingDiff() + axial;
    }

    /**
     * Azimuthal angle of a view, including the scanner's intrinsic tilt.
     */
    public double getViewAngle(int view) {
        return view * Math.PI / numViews + scanner.getIntrinsicTilt();
    }

    /**
     * Signed distance from the scanner axis of the lines of response in a tangential bin.
     * Arc-corrected bins are spaced uniformly; non-arc-corrected bins follow the detector arc.
     */
    public double getTangentialCoordinate(int tangentialPos) {
        return getTangentialCoordinate((double) tangentialPos);
    }

    /**
     * Same as {@link #getTangentialCoordinate(int)} for a fractional position, e.g. a bin edge.
     */
    public double getTangentialCoordinate(double tangentialPos) {
        if (arcCorrected) {
            return tangentialPos * arcCorrectedBinSize();
        }
        return scanner.getEffectiveRingRadius() * Math.sin(tangentialPos * Math.PI / scanner.getNumDetectorsPerRing());
    }

    /**
     * @return the distance between the central tangential bin and its neighbour
     */
    public double getTangentialSamplingAtCentre() {
        if (arcCorrected) {
            return arcCorrectedBinSize();
        }
        return getTangentialCoordinate(1) - getTangentialCoordinate(0);
    }

    /**
     * @return radius of the transaxial field of view spanned by the outermost tangential bins
     */
    public double getTangentialFieldOfViewRadius() {
        return Math.max(Math.abs(getTangentialCoordinate(getMinTangentialPos())),
                        Math.abs(getTangentialCoordinate(getMaxTangentialPos())));
    }

    private double arcCorrectedBinSize() {
        if (scanner.getDefaultBinSize() > 0) {
            return scanner.getDefaultBinSize();
        }
        return scanner.getEffectiveRingRadius() * Math.PI / scanner.getNumDetectorsPerRing();
    }

    private int segmentIndex(int segment) {
        int i = segment - getMinSegment();
        if (i < 0 || i >= segments.size()) {
            throw new IllegalArgumentException(String.format("segment %d outside [%d, %d]", segment, getMinSegment(), getMaxSegment()));
        }
        return i;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectionDataGeometry that = (ProjectionDataGeometry) o;
        return span == that.span
               && maxRingDiff == that.maxRingDiff
               && numViews == that.numViews
               && numTangentialBins == that.numTangentialBins
               && arcCorrected == that.arcCorrected
               && scanner.equals(that.scanner)
               && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scanner, span, maxRingDiff, numViews, numTangentialBins, arcCorrected, segments);
    }

    @Override
    public String toString() {
        return String.format("ProjectionDataGeometry(%s, span=%d, maxRingDiff=%d, segments=[%d, %d], sinograms=%d, views=%d, tangential=%d, arcCorrected=%s)",
                             scanner.getName(), span, maxRingDiff, getMinSegment(), getMaxSegment(), numSinograms, numViews,
                             numTangentialBins, arcCorrected);
    }
}
