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
import io.github.petgeom.engine.Symmetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The symmetry group a system matrix can use for one volume and projection-data geometry.
 * <p>
 * Each symmetry is an involution on bins paired with an involution on voxel indices, such that
 * the row of the mapped bin is the mapped row of the original bin:
 * <ul>
 *   <li>{@link Symmetry#SWAP_TANGENTIAL}: {@code (k, a, v, s) -> (-k, a, v, -s)}, voxels {@code (z, y, x) -> (z, -y, -x)}</li>
 *   <li>{@link Symmetry#SWAP_SEGMENT}: {@code (k, a, v, s) -> (-k, a, v, s)}, voxels {@code z -> 2c - z} around the centre plane {@code c}</li>
 *   <li>{@link Symmetry#ROTATION_180_MIN_PHI}: {@code (k, a, v, s) -> (-k, a, V - v, s)} for {@code v > 0}, voxels {@code x -> -x}</li>
 *   <li>{@link Symmetry#ROTATION_90_MIN_PHI}: {@code (k, a, v, s) -> (-k, a, V/2 - v, s)} for {@code v <= V/2}, voxels {@code x <-> y}</li>
 * </ul>
 * The segment sign flips wherever the line of response is traversed in the opposite direction.
 * A requested symmetry is only enabled when the grid supports it: in-plane mirrors need a zero
 * x/y offset, the 90 degree rotation square voxels, the view rotations no intrinsic tilt, and
 * the segment swap planes spaced at half the ring spacing starting on ring 0.
 */
final class BinSymmetries {
    private static final float RELATIVE_TOLERANCE = 1e-5f;

    private final ProjectionDataGeometry geometry;
    private final Set<Symmetry> enabled;

    BinSymmetries(ProjectionDataGeometry geometry, VolumeDescriptor volume, Set<Symmetry> requested) {
        this.geometry = geometry;
        var enabled = EnumSet.noneOf(Symmetry.class);
        var offset = volume.getOffset();
        var voxelSize = volume.getVoxelSize();
        boolean centredInPlane = offset.x == 0 && offset.y == 0;
        boolean untilted = geometry.getScanner().getIntrinsicTilt() == 0;
        float halfRingSpacing = geometry.getScanner().getRingSpacing() / 2;

        if (requested.contains(Symmetry.SWAP_TANGENTIAL) && centredInPlane) {
            enabled.add(Symmetry.SWAP_TANGENTIAL);
        }
        if (requested.contains(Symmetry.SWAP_SEGMENT) && offset.z == 0 && close(voxelSize.z, halfRingSpacing)) {
            enabled.add(Symmetry.SWAP_SEGMENT);
        }
        if (requested.contains(Symmetry.ROTATION_180_MIN_PHI) && centredInPlane && untilted) {
            enabled.add(Symmetry.ROTATION_180_MIN_PHI);
        }
        if (requested.contains(Symmetry.ROTATION_90_MIN_PHI) && centredInPlane && untilted
            && close(voxelSize.x, voxelSize.y) && geometry.getNumViews() % 2 == 0) {
            enabled.add(Symmetry.ROTATION_90_MIN_PHI);
        }
        this.enabled = Collections.unmodifiableSet(enabled);
    }

    private static boolean close(float a, float b) {
        return Math.abs(a - b) <= RELATIVE_TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
    }

    Set<Symmetry> enabled() {
        return enabled;
    }

    /**
     * Finds the canonical bin of the orbit of {@code bin} (the one with the smallest flat index)
     * and the chain of symmetries that carries the canonical row onto the row of {@code bin}.
     */
    Resolution resolve(Bin bin) {
        var orbit = new ArrayList<Bin>();
        var paths = new ArrayList<List<Symmetry>>();
        orbit.add(bin);
        paths.add(List.of());
        for (int i = 0; i < orbit.size(); i++) {
            var current = orbit.get(i);
            for (var symmetry : enabled) {
                var next = apply(symmetry, current);
                if (next == null || orbit.contains(next)) {
                    continue;
                }
                var path = new ArrayList<>(paths.get(i));
                path.add(symmetry);
                orbit.add(next);
                paths.add(path);
            }
        }

        int best = 0;
        for (int i = 1; i < orbit.size(); i++) {
            if (flatIndex(orbit.get(i)) < flatIndex(orbit.get(best))) {
                best = i;
            }
        }
        var canonical = orbit.get(best);
        int centrePlane = geometry.getAxialCentrePlane(canonical.segment, canonical.axial);
        // row(bin) = m1(m2(...mn(row(canonical)))) for the path s1..sn from bin to canonical
        var toApply = new ArrayList<>(paths.get(best));
        Collections.reverse(toApply);
        return new Resolution(canonical, flatIndex(canonical), toApply.toArray(new Symmetry[0]), centrePlane);
    }

    /**
     * @return the image of {@code bin}, or null if the symmetry does not apply to it
     */
    Bin apply(Symmetry symmetry, Bin bin) {
        int numViews = geometry.getNumViews();
        switch (symmetry) {
            case SWAP_TANGENTIAL:
                if (-bin.tangential < geometry.getMinTangentialPos() || -bin.tangential > geometry.getMaxTangentialPos()) {
                    return null;
                }
                return new Bin(-bin.segment, bin.axial, bin.view, -bin.tangential);
            case SWAP_SEGMENT:
                if (bin.segment == 0) {
                    return null;
                }
                return new Bin(-bin.segment, bin.axial, bin.view, bin.tangential);
            case ROTATION_180_MIN_PHI:
                if (bin.view == 0) {
                    return null;
                }
                return new Bin(-bin.segment, bin.axial, numViews - bin.view, bin.tangential);
            case ROTATION_90_MIN_PHI:
                if (bin.view > numViews / 2) {
                    return null;
                }
                return new Bin(-bin.segment, bin.axial, numViews / 2 - bin.view, bin.tangential);
            default:
                throw new IllegalArgumentException("Unknown symmetry " + symmetry);
        }
    }

    int flatIndex(Bin bin) {
        int sinogram = geometry.getSinogramOffset(bin.segment, bin.axial);
        return (sinogram * geometry.getNumViews() + bin.view) * geometry.getNumTangentialBins()
               + (bin.tangential - geometry.getMinTangentialPos());
    }

    /**
     * Where to find the row of a bin: the canonical bin whose row is computed, and the voxel
     * maps to apply to it, in order.
     */
    static final class Resolution {
        final Bin canonical;
        final int canonicalIndex;
        final Symmetry[] voxelMaps;
        final int centrePlane;

        Resolution(Bin canonical, int canonicalIndex, Symmetry[] voxelMaps, int centrePlane) {
            this.canonical = canonical;
            this.canonicalIndex = canonicalIndex;
            this.voxelMaps = voxelMaps;
            this.centrePlane = centrePlane;
        }

        /**
         * Maps one voxel of the canonical row; the result is written to {@code zyx}.
         */
        void mapVoxel(int z, int y, int x, int[] zyx) {
            for (var symmetry : voxelMaps) {
                switch (symmetry) {
                    case SWAP_TANGENTIAL:
                        y = -y;
                        x = -x;
                        break;
                    case SWAP_SEGMENT:
                        z = 2 * centrePlane - z;
                        break;
                    case ROTATION_180_MIN_PHI:
                        x = -x;
                        break;
                    case ROTATION_90_MIN_PHI:
                        int swap = x;
                        x = y;
                        y = swap;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown symmetry " + symmetry);
                }
            }
            zyx[0] = z;
            zyx[1] = y;
            zyx[2] = x;
        }
    }
}
