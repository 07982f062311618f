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
import io.github.petgeom.engine.ProjectionDataInfo;
import io.github.petgeom.scanner.ScannerGeometry;

/**
 * Projection-data description of a cylindrical scanner, backed by a {@link ProjectionDataGeometry}.
 */
public final class CylindricalProjectionDataInfo implements ProjectionDataInfo {
    private final ProjectionDataGeometry geometry;

    public CylindricalProjectionDataInfo(ProjectionDataGeometry geometry) {
        this.geometry = geometry;
    }

    @Override
    public ScannerGeometry getScanner() {
        return geometry.getScanner();
    }

    @Override
    public int getMinSegment() {
        return geometry.getMinSegment();
    }

    @Override
    public int getMaxSegment() {
        return geometry.getMaxSegment();
    }

    @Override
    public int getMinAxialPos(int segment) {
        return geometry.getMinAxialPos(segment);
    }

    @Override
    public int getMaxAxialPos(int segment) {
        return geometry.getMaxAxialPos(segment);
    }

    @Override
    public int getNumSinograms() {
        return geometry.getNumSinograms();
    }

    @Override
    public int getNumViews() {
        return geometry.getNumViews();
    }

    @Override
    public int getNumTangentialBins() {
        return geometry.getNumTangentialBins();
    }

    @Override
    public ProjectionDataGeometry getGeometry() {
        return geometry;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return geometry.equals(((CylindricalProjectionDataInfo) o).geometry);
    }

    @Override
    public int hashCode() {
        return geometry.hashCode();
    }

    @Override
    public String toString() {
        return "CylindricalProjectionDataInfo(" + geometry + ")";
    }
}
