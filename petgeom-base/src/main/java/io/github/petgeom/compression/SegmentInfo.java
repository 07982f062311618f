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

/**
 * One segment of axially compressed projection data: the group of ring differences it merges
 * and the number of axial positions (sinograms) it holds.
 */
public final class SegmentInfo {
    private final int segment;
    private final int minRingDiff;
    private final int maxRingDiff;
    private final int numAxialPositions;

    public SegmentInfo(int segment, int minRingDiff, int maxRingDiff, int numAxialPositions) {
        if (minRingDiff > maxRingDiff) {
            throw new IllegalArgumentException("min ring difference " + minRingDiff + " exceeds max " + maxRingDiff);
        }
        this.segment = segment;
        this.minRingDiff = minRingDiff;
        this.maxRingDiff = maxRingDiff;
        this.numAxialPositions = numAxialPositions;
    }

    public int getSegment() {
        return segment;
    }

    public int getMinRingDiff() {
        return minRingDiff;
    }

    public int getMaxRingDiff() {
        return maxRingDiff;
    }

    /**
     * @return the smallest |ring difference| merged into this segment
     */
    public int getMinAbsRingDiff() {
        if (minRingDiff <= 0 && maxRingDiff >= 0) {
            return 0;
        }
        return Math.min(Math.abs(minRingDiff), Math.abs(maxRingDiff));
    }

    /**
     * @return the ring difference at the centre of the merged range
     */
    public float getAverageRingDiff() {
        return (minRingDiff + maxRingDiff) / 2.0f;
    }

    public int getNumAxialPositions() {
        return numAxialPositions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegmentInfo that = (SegmentInfo) o;
        return segment == that.segment
               && minRingDiff == that.minRingDiff
               && maxRingDiff == that.maxRingDiff
               && numAxialPositions == that.numAxialPositions;
    }

    @Override
    public int hashCode() {
        int result = segment;
        result = 31 * result + minRingDiff;
        result = 31 * result + maxRingDiff;
        return 31 * result + numAxialPositions;
    }

    @Override
    public String toString() {
        return String.format("Segment(%d, ringDiff=[%d, %d], axial=%d)", segment, minRingDiff, maxRingDiff, numAxialPositions);
    }
}
