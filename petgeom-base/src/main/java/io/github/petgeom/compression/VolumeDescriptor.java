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

import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Voxel grid of a reconstruction volume.
 * <p>
 * z indices run from 0; x and y indices run from {@code -(size/2)}, so that with a zero
 * offset the voxel with index 0 sits on the scanner axis. The centre of voxel
 * {@code (z, y, x)} is {@code index * voxelSize + offset} along each axis.
 */
public final class VolumeDescriptor {
    private static final Logger logger = LoggerFactory.getLogger(VolumeDescriptor.class);

    private final IntCoordinate3D sizes;
    private final Coordinate3D voxelSize;
    private final Coordinate3D offset;
    private final float zoom;
    private final boolean inPlaneSizeAutoDerived;

    public VolumeDescriptor(IntCoordinate3D sizes, Coordinate3D voxelSize, Coordinate3D offset, float zoom,
                            boolean inPlaneSizeAutoDerived) {
        if (sizes.z <= 0 || sizes.y <= 0 || sizes.x <= 0) {
            throw new IllegalArgumentException("volume sizes must be positive, got " + sizes);
        }
        if (!(voxelSize.z > 0 && voxelSize.y > 0 && voxelSize.x > 0)) {
            throw new IllegalArgumentException("voxel sizes must be positive, got " + voxelSize);
        }
        try {
            Math.multiplyExact(Math.multiplyExact(sizes.z, sizes.y), sizes.x);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("volume of " + sizes + " has more voxels than an array can hold", e);
        }
        this.sizes = sizes;
        this.voxelSize = voxelSize;
        this.offset = Objects.requireNonNull(offset, "offset");
        this.zoom = zoom;
        this.inPlaneSizeAutoDerived = inPlaneSizeAutoDerived;
    }

    /**
     * Derives a grid suited to the given projection data.
     * <p>
     * The in-plane voxel size is the scanner's default bin size divided by {@code zoom} (the
     * tangential sampling at the central bin when the scanner has no default bin size), the
     * axial one half the ring spacing. A size component equal to {@link IntCoordinate3D#AUTO}
     * is derived: z covers every axial position of segment 0, x and y cover the tangential field
     * of view.
     *
     * @throws IllegalArgumentException if {@code zoom} is not positive or a size is neither
     *         positive nor {@link IntCoordinate3D#AUTO}
     */
    public static VolumeDescriptor forProjectionData(ProjectionDataGeometry geometry, float zoom, Coordinate3D offset,
                                                     IntCoordinate3D sizes) {
        if (!(zoom > 0)) {
            throw new IllegalArgumentException("zoom " + zoom + " must be positive");
        }
        var scanner = geometry.getScanner();
        double binSize = scanner.getDefaultBinSize() > 0 ? scanner.getDefaultBinSize() : geometry.getTangentialSamplingAtCentre();
        float voxelXY = (float) (binSize / zoom);
        float voxelZ = scanner.getRingSpacing() / 2;

        int segmentZeroPlanes = geometry.getNumAxialPositions(0);
        int z = resolve("z", sizes.z, geometry.isSegmentZeroAxiallyCompressed() ? segmentZeroPlanes : 2 * segmentZeroPlanes - 1);
        int inPlane = 2 * (int) Math.floor(geometry.getTangentialFieldOfViewRadius() / voxelXY) + 1;
        int y = resolve("y", sizes.y, inPlane);
        int x = resolve("x", sizes.x, inPlane);
        boolean inPlaneAuto = sizes.x == IntCoordinate3D.AUTO || sizes.y == IntCoordinate3D.AUTO;
        if (inPlaneAuto) {
            logger.warn("Deriving in-plane volume size {} from the tangential field of view; this default is not validated, "
                        + "pass explicit x/y sizes when the grid has to match another one", inPlane);
        }
        return new VolumeDescriptor(new IntCoordinate3D(z, y, x), new Coordinate3D(voxelZ, voxelXY, voxelXY),
                                    offset, zoom, inPlaneAuto);
    }

    private static int resolve(String axis, int requested, int derived) {
        if (requested == IntCoordinate3D.AUTO) {
            return derived;
        }
        if (requested <= 0) {
            throw new IllegalArgumentException(String.format("volume size %d along %s must be positive or %d for automatic",
                                                             requested, axis, IntCoordinate3D.AUTO));
        }
        return requested;
    }

    /**
     * @return the grid shape in (z, y, x) order
     */
    public int[] shape() {
        return sizes.toArray();
    }

    public int size() {
        return Math.multiplyExact(Math.multiplyExact(sizes.z, sizes.y), sizes.x);
    }

    public IntCoordinate3D getSizes() {
        return sizes;
    }

    public Coordinate3D getVoxelSize() {
        return voxelSize;
    }

    public Coordinate3D getOffset() {
        return offset;
    }

    public float getZoom() {
        return zoom;
    }

    /**
     * The x/y sizes were derived from the tangential field of view rather than given by the
     * caller. That derivation has not been validated against other engines' defaults; give
     * explicit sizes when the grid has to match an external one.
     */
    public boolean isInPlaneSizeAutoDerived() {
        return inPlaneSizeAutoDerived;
    }

    public int getMinIndexZ() {
        return 0;
    }

    public int getMaxIndexZ() {
        return sizes.z - 1;
    }

    public int getMinIndexY() {
        return -(sizes.y / 2);
    }

    public int getMaxIndexY() {
        return getMinIndexY() + sizes.y - 1;
    }

    public int getMinIndexX() {
        return -(sizes.x / 2);
    }

    public int getMaxIndexX() {
        return getMinIndexX() + sizes.x - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VolumeDescriptor that = (VolumeDescriptor) o;
        return Float.compare(zoom, that.zoom) == 0
               && inPlaneSizeAutoDerived == that.inPlaneSizeAutoDerived
               && sizes.equals(that.sizes)
               && voxelSize.equals(that.voxelSize)
               && offset.equals(that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sizes, voxelSize, offset, zoom, inPlaneSizeAutoDerived);
    }

    @Override
    public String toString() {
        return String.format("VolumeDescriptor(sizes=%s, voxelSize=%s, offset=%s, zoom=%s)", sizes, voxelSize, offset, zoom);
    }
}
