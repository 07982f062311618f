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

import io.github.petgeom.compression.ProjectionDataGeometry;
import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.engine.ProjectionDataInfo;
import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.engine.SystemMatrix;
import io.github.petgeom.engine.Verbosity;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.LongArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * System matrix that samples every line of response at regular steps and assigns each sample
 * to its nearest voxel.
 * <p>
 * A bin is traced as {@code numTangentialLORs} parallel rays spread evenly across its
 * tangential width. Each ray runs between its two intersections with the detector cylinder
 * (radius = inner radius + average depth of interaction) and rises linearly in z by the
 * segment's average ring difference times the ring spacing, centred on the bin's axial centre
 * plane. It is sampled at no more than half the smallest voxel size, and every sample adds its
 * share of the ray's length to the voxel it falls in, so a row holds intersection lengths in mm
 * divided by the number of rays.
 * <p>
 * Rows are computed lazily, one per orbit of the enabled symmetries, and cached for the life of
 * the matrix. Forward and back projection read the same rows, which makes them exact adjoints
 * of each other.
 * <p>
 * The cache is not bounded. After one full projection it holds one row per orbit: every bin of
 * the projection data when no symmetry is enabled, several times fewer with all four. A row
 * costs 16 bytes per voxel it crosses, so a full-size geometry (an ECAT 962 at span 1 has over
 * 80 million bins) needs the symmetries and a coarse grid to fit in memory. The orbit of a bin
 * is recomputed on every visit, which costs time but no memory.
 */
public final class RayTracingSystemMatrix implements SystemMatrix {
    private static final Logger logger = LoggerFactory.getLogger(RayTracingSystemMatrix.class);

    private final ProjectionDataInfo info;
    private final ProjectionDataGeometry geometry;
    private final VolumeDescriptor volume;
    private final Set<Symmetry> requestedSymmetries;
    private final BinSymmetries symmetries;
    private final int numTangentialLORs;
    private final Int2ObjectHashMap<SparseRow> rows = new Int2ObjectHashMap<>();

    RayTracingSystemMatrix(ProjectionDataInfo info, VolumeDescriptor volume, Set<Symmetry> requestedSymmetries,
                           int numTangentialLORs) {
        if (numTangentialLORs < 1) {
            throw new IllegalArgumentException("numTangentialLORs " + numTangentialLORs + " must be at least 1");
        }
        this.info = info;
        this.geometry = info.getGeometry();
        this.volume = volume;
        var requested = EnumSet.noneOf(Symmetry.class);
        requested.addAll(requestedSymmetries);
        this.requestedSymmetries = Collections.unmodifiableSet(requested);
        this.symmetries = new BinSymmetries(geometry, volume, requested);
        this.numTangentialLORs = numTangentialLORs;

        if (Verbosity.get() >= 1) {
            logger.info("Ray tracing system matrix for {} over {}, {} LOR(s) per bin, symmetries {}",
                        geometry, volume, numTangentialLORs, symmetries.enabled());
        }
        if (Verbosity.get() >= 2 && !symmetries.enabled().equals(this.requestedSymmetries)) {
            var unsupported = EnumSet.copyOf(requested);
            unsupported.removeAll(symmetries.enabled());
            logger.debug("Symmetries {} do not hold for this grid and are not used", unsupported);
        }
    }

    @Override
    public ProjectionDataInfo getProjectionDataInfo() {
        return info;
    }

    @Override
    public int[] getVolumeShape() {
        return volume.shape();
    }

    @Override
    public Set<Symmetry> getSymmetries() {
        return requestedSymmetries;
    }

    /**
     * @return the subset of {@link #getSymmetries()} that this grid supports
     */
    public Set<Symmetry> getEnabledSymmetries() {
        return symmetries.enabled();
    }

    @Override
    public int getNumTangentialLORs() {
        return numTangentialLORs;
    }

    VolumeDescriptor getVolumeDescriptor() {
        return volume;
    }

    /**
     * @return how many distinct rows have been computed so far
     */
    synchronized int getNumCachedRows() {
        return rows.size();
    }

    /**
     * Overwrites {@code out} with the projection of {@code in}.
     */
    void forward(VoxelGrid in, InMemoryProjectionData out) {
        float[] image = in.data();
        float[] bins = out.data();
        int[] zyx = new int[3];
        int minTangential = geometry.getMinTangentialPos();
        for (var segment : geometry.getSegments()) {
            int k = segment.getSegment();
            for (int a = 0; a < segment.getNumAxialPositions(); a++) {
                for (int v = 0; v < geometry.getNumViews(); v++) {
                    int start = out.rowStart(k, a, v);
                    for (int b = minTangential; b <= geometry.getMaxTangentialPos(); b++) {
                        var resolution = symmetries.resolve(new Bin(k, a, v, b));
                        var row = row(resolution);
                        double sum = 0;
                        for (int i = 0; i < row.size(); i++) {
                            resolution.mapVoxel(row.z[i], row.y[i], row.x[i], zyx);
                            int index = in.flatIndex(zyx[0], zyx[1], zyx[2]);
                            if (index >= 0) {
                                sum += (double) row.weights[i] * image[index];
                            }
                        }
                        bins[start + b - minTangential] = (float) sum;
                    }
                }
            }
        }
        if (Verbosity.get() >= 2) {
            logger.debug("Forward projected {} bins using {} distinct rows", geometry.size(), getNumCachedRows());
        }
    }

    /**
     * Adds the back projection of {@code in} to {@code out}.
     */
    void back(InMemoryProjectionData in, VoxelGrid out) {
        float[] bins = in.data();
        float[] image = out.data();
        int[] zyx = new int[3];
        int minTangential = geometry.getMinTangentialPos();
        for (var segment : geometry.getSegments()) {
            int k = segment.getSegment();
            for (int a = 0; a < segment.getNumAxialPositions(); a++) {
                for (int v = 0; v < geometry.getNumViews(); v++) {
                    int start = in.rowStart(k, a, v);
                    for (int b = minTangential; b <= geometry.getMaxTangentialPos(); b++) {
                        float value = bins[start + b - minTangential];
                        if (value == 0) {
                            continue;
                        }
                        var resolution = symmetries.resolve(new Bin(k, a, v, b));
                        var row = row(resolution);
                        for (int i = 0; i < row.size(); i++) {
                            resolution.mapVoxel(row.z[i], row.y[i], row.x[i], zyx);
                            int index = out.flatIndex(zyx[0], zyx[1], zyx[2]);
                            if (index >= 0) {
                                image[index] += row.weights[i] * value;
                            }
                        }
                    }
                }
            }
        }
        if (Verbosity.get() >= 2) {
            logger.debug("Back projected {} bins using {} distinct rows", geometry.size(), getNumCachedRows());
        }
    }

    private synchronized SparseRow row(BinSymmetries.Resolution resolution) {
        var row = rows.get(resolution.canonicalIndex);
        if (row == null) {
            row = trace(resolution.canonical);
            rows.put(resolution.canonicalIndex, row);
        }
        return row;
    }

    /**
     * Traces the unclipped row of one bin.
     */
    SparseRow trace(Bin bin) {
        var scanner = geometry.getScanner();
        var segment = geometry.getSegment(bin.segment);
        double radius = scanner.getEffectiveRingRadius();
        double phi = geometry.getViewAngle(bin.view);
        double cos = Math.cos(phi);
        double sin = Math.sin(phi);
        double deltaZ = segment.getAverageRingDiff() * scanner.getRingSpacing();
        double centreZ = geometry.getAxialCentrePlane(bin.segment, bin.axial) * scanner.getRingSpacing() / 2.0;

        var voxelSize = volume.getVoxelSize();
        var offset = volume.getOffset();
        double step = 0.5 * Math.min(voxelSize.z, Math.min(voxelSize.y, voxelSize.x));

        var row = SparseRow.empty();
        var samples = new LongArrayList();
        for (int m = 0; m < numTangentialLORs; m++) {
            double position = bin.tangential - 0.5 + (m + 0.5) / numTangentialLORs;
            double s = geometry.getTangentialCoordinate(position);
            if (Math.abs(s) >= radius) {
                continue;
            }
            double halfLength = Math.sqrt(radius * radius - s * s);
            double length = Math.sqrt(4 * halfLength * halfLength + deltaZ * deltaZ);
            int numSamples = Math.max(1, (int) Math.ceil(length / step));
            samples.clear();
            for (int j = 0; j < numSamples; j++) {
                double t = -halfLength + (j + 0.5) * 2 * halfLength / numSamples;
                double x = s * cos - t * sin;
                double y = s * sin + t * cos;
                double z = centreZ + t / halfLength * deltaZ / 2;
                samples.addLong(SparseRow.pack(nearest(z, offset.z, voxelSize.z),
                                               nearest(y, offset.y, voxelSize.y),
                                               nearest(x, offset.x, voxelSize.x)));
            }
            row = row.plus(SparseRow.fromSamples(samples, (float) (length / numSamples / numTangentialLORs)));
        }
        return row;
    }

    private static int nearest(double coordinate, float offset, float voxelSize) {
        return (int) Math.floor((coordinate - offset) / voxelSize + 0.5);
    }

    @Override
    public String toString() {
        return String.format("RayTracingSystemMatrix(%s, volume=%s, LORs=%d, symmetries=%s)",
                             geometry, volume, numTangentialLORs, symmetries.enabled());
    }
}
