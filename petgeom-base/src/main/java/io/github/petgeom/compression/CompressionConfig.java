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

import java.util.Objects;

/**
 * Acquisition and compression choices for one compression session.
 * <p>
 * Optional fields are {@code null} when unset; {@link CompressionModel} resolves them against
 * its scanner:
 * <ul>
 *   <li>{@code maxNumSegments}: the maximum ring difference, defaults to {@code numRings - 1}</li>
 *   <li>{@code numOfViews}: defaults to half the detectors per ring. Fewer views subsample the
 *       scanner's angular positions, more leave empty cells in the sinogram.</li>
 *   <li>{@code numNonArcCorBins}: number of tangential positions, defaults to the scanner's
 *       arc-corrected bin count for arc-corrected data and to its maximum non-arc-corrected bin
 *       count otherwise</li>
 * </ul>
 * Instances are immutable; use {@link #toBuilder()} to derive a modified configuration.
 */
public final class CompressionConfig {
    private final int spanNum;
    private final Integer maxNumSegments;
    private final Integer numOfViews;
    private final Integer numNonArcCorBins;
    private final boolean dataArcCorrected;

    private CompressionConfig(Builder b) {
        this.spanNum = b.spanNum;
        this.maxNumSegments = b.maxNumSegments;
        this.numOfViews = b.numOfViews;
        this.numNonArcCorBins = b.numNonArcCorBins;
        this.dataArcCorrected = b.dataArcCorrected;
    }

    /**
     * @return a builder with span 1, no arc correction and every optional field unset
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The defaults a new session starts with: no axial compression, the maximum ring
     * difference, and half the detectors per ring for both views and tangential positions.
     */
    public static CompressionConfig defaultsFor(ScannerGeometry scanner) {
        return builder()
                .withNumOfViews(scanner.getNumDetectorsPerRing() / 2)
                .withNumNonArcCorBins(scanner.getNumDetectorsPerRing() / 2)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .withSpanNum(spanNum)
                .withMaxNumSegments(maxNumSegments)
                .withNumOfViews(numOfViews)
                .withNumNonArcCorBins(numNonArcCorBins)
                .withDataArcCorrected(dataArcCorrected);
    }

    /**
     * @return the axial compression factor; odd, 1 meaning no compression
     */
    public int getSpanNum() {
        return spanNum;
    }

    /**
     * @return the configured maximum ring difference, or null to use the scanner's
     */
    public Integer getMaxNumSegments() {
        return maxNumSegments;
    }

    public Integer getNumOfViews() {
        return numOfViews;
    }

    public Integer getNumNonArcCorBins() {
        return numNonArcCorBins;
    }

    /**
     * @return whether the data were arc corrected during acquisition or preprocessing
     */
    public boolean isDataArcCorrected() {
        return dataArcCorrected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompressionConfig that = (CompressionConfig) o;
        return spanNum == that.spanNum
               && dataArcCorrected == that.dataArcCorrected
               && Objects.equals(maxNumSegments, that.maxNumSegments)
               && Objects.equals(numOfViews, that.numOfViews)
               && Objects.equals(numNonArcCorBins, that.numNonArcCorBins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanNum, maxNumSegments, numOfViews, numNonArcCorBins, dataArcCorrected);
    }

    @Override
    public String toString() {
        return String.format("CompressionConfig(span=%d, maxRingDiff=%s, views=%s, tangentialBins=%s, arcCorrected=%s)",
                             spanNum, maxNumSegments, numOfViews, numNonArcCorBins, dataArcCorrected);
    }

    public static final class Builder {
        private int spanNum = 1;
        private Integer maxNumSegments;
        private Integer numOfViews;
        private Integer numNonArcCorBins;
        private boolean dataArcCorrected;

        private Builder() {
        }

        public Builder withSpanNum(int spanNum) {
            this.spanNum = spanNum;
            return this;
        }

        /**
         * @param maxNumSegments maximum ring difference, or null for {@code numRings - 1}
         */
        public Builder withMaxNumSegments(Integer maxNumSegments) {
            this.maxNumSegments = maxNumSegments;
            return this;
        }

        public Builder withNumOfViews(Integer numOfViews) {
            this.numOfViews = numOfViews;
            return this;
        }

        public Builder withNumNonArcCorBins(Integer numNonArcCorBins) {
            this.numNonArcCorBins = numNonArcCorBins;
            return this;
        }

        public Builder withDataArcCorrected(boolean dataArcCorrected) {
            this.dataArcCorrected = dataArcCorrected;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the span is not a positive odd number or an
         * explicitly set count is not valid
         */
        public CompressionConfig build() {
            if (spanNum < 1 || spanNum % 2 == 0) {
                throw new IllegalArgumentException("span " + spanNum + " has to be a positive odd number");
            }
            if (maxNumSegments != null && maxNumSegments < 0) {
                throw new IllegalArgumentException("max ring difference " + maxNumSegments + " must not be negative");
            }
            if (numOfViews != null && numOfViews <= 0) {
                throw new IllegalArgumentException("number of views " + numOfViews + " must be positive");
            }
            if (numNonArcCorBins != null && numNonArcCorBins <= 0) {
                throw new IllegalArgumentException("number of tangential bins " + numNonArcCorBins + " must be positive");
            }
            return new CompressionConfig(this);
        }
    }
}
