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

import io.github.petgeom.engine.ExamInfo;
import io.github.petgeom.engine.ProjectionData;
import io.github.petgeom.engine.ProjectionDataInfo;
import io.github.petgeom.engine.ProjectionEngine;
import io.github.petgeom.engine.Volume;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.operator.ProjectorPair;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.space.ProjectionSpaceDescriptor;
import io.github.petgeom.space.VolumeSpaces;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.ExceptionUtils;
import io.github.petgeom.util.IntCoordinate3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A scanner together with the compression choices made for it. Resolves the optional parts of
 * a {@link CompressionConfig}, derives the {@link ProjectionDataGeometry} and hands it to a
 * {@link ProjectionEngine}.
 * <p>
 * The model is immutable; every derivation is a pure function of the scanner and the config.
 */
public final class CompressionModel {
    private static final Logger logger = LoggerFactory.getLogger(CompressionModel.class);

    private final ScannerGeometry scanner;
    private final CompressionConfig config;

    public CompressionModel(ScannerGeometry scanner, CompressionConfig config) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.config = Objects.requireNonNull(config, "config");
    }

    public ScannerGeometry getScanner() {
        return scanner;
    }

    public CompressionConfig getConfig() {
        return config;
    }

    public int effectiveMaxRingDiff() {
        var configured = config.getMaxNumSegments();
        return configured != null ? configured : scanner.getNumRings() - 1;
    }

    public int effectiveNumViews() {
        var configured = config.getNumOfViews();
        return configured != null ? configured : scanner.getNumDetectorsPerRing() / 2;
    }

    public int effectiveNumTangentialBins() {
        var configured = config.getNumNonArcCorBins();
        if (configured != null) {
            return configured;
        }
        return config.isDataArcCorrected() ? scanner.getDefaultNumArcCorrectedBins() : scanner.getMaxNumNonArcCorrectedBins();
    }

    /**
     * @throws IllegalArgumentException if the resolved choices are inconsistent, see
     *         {@link ProjectionDataGeometry#compute}
     */
    public ProjectionDataGeometry buildProjectionDataGeometry() {
        return ProjectionDataGeometry.compute(scanner, config.getSpanNum(), effectiveMaxRingDiff(),
                                              effectiveNumViews(), effectiveNumTangentialBins(),
                                              config.isDataArcCorrected());
    }

    /**
     * @return the segments and their axial sizes, most negative segment first
     */
    public List<SegmentInfo> sinogramInfo() {
        return buildProjectionDataGeometry().getSegments();
    }

    /**
     * @return the flat sinogram index of an axial position within a segment
     * @throws IllegalArgumentException if the pair is outside the geometry
     */
    public int getOffset(int segment, int axial) {
        return buildProjectionDataGeometry().getSinogramOffset(segment, axial);
    }

    /**
     * Describes a volume matched to the projection data.
     *
     * @param sizes (z, y, x) sizes, any of them {@link IntCoordinate3D#AUTO}
     * @see VolumeDescriptor#forProjectionData
     */
    public VolumeDescriptor buildVolumeDescriptor(float zoom, IntCoordinate3D sizes, Coordinate3D offset) {
        return VolumeDescriptor.forProjectionData(buildProjectionDataGeometry(), zoom, offset, sizes);
    }

    public VolumeDescriptor buildVolumeDescriptor() {
        return buildVolumeDescriptor(1.0f, IntCoordinate3D.ALL_AUTO, Coordinate3D.ZERO);
    }

    /**
     * Asks the engine to describe the projection data, and checks that it agrees on the segment
     * layout.
     *
     * @throws EngineCallException if the engine fails or disagrees
     */
    public ProjectionDataInfo buildEngineProjectionDataInfo(ProjectionEngine engine) {
        var geometry = buildProjectionDataGeometry();
        ProjectionDataInfo info;
        try {
            info = engine.makeProjectionDataInfo(scanner, geometry.getSpan(), geometry.getMaxRingDiff(),
                                                 geometry.getNumViews(), geometry.getNumTangentialBins(),
                                                 geometry.isArcCorrected());
        } catch (RuntimeException e) {
            throw ExceptionUtils.asEngineCallException("Describing " + geometry + " with engine " + engine.name(), e);
        }

        var mismatches = new ArrayList<String>();
        if (info.getMinSegment() != geometry.getMinSegment() || info.getMaxSegment() != geometry.getMaxSegment()) {
            mismatches.add(String.format("segments [%d, %d] instead of [%d, %d]", info.getMinSegment(), info.getMaxSegment(),
                                         geometry.getMinSegment(), geometry.getMaxSegment()));
        } else {
            for (var segment : geometry.getSegments()) {
                int k = segment.getSegment();
                int engineSize = info.getMaxAxialPos(k) - info.getMinAxialPos(k) + 1;
                if (engineSize != segment.getNumAxialPositions()) {
                    mismatches.add(String.format("segment %d has %d axial positions instead of %d", k, engineSize,
                                                 segment.getNumAxialPositions()));
                }
            }
        }
        if (!Arrays.equals(info.shape(), geometry.shape())) {
            mismatches.add(String.format("shape %s instead of %s", Arrays.toString(info.shape()), Arrays.toString(geometry.shape())));
        }
        if (!mismatches.isEmpty()) {
            throw new EngineCallException("Engine " + engine.name() + " disagrees on the projection data: " + mismatches);
        }
        logger.debug("Engine {} describes {}", engine.name(), geometry);
        return info;
    }

    /**
     * Creates a zero-filled engine volume on the given grid.
     */
    public Volume buildVolume(ProjectionEngine engine, ProjectionDataInfo info, VolumeDescriptor descriptor) {
        var volume = engine.makeVolume(info, descriptor.getZoom(), descriptor.getOffset(), descriptor.getSizes());
        if (!Arrays.equals(volume.shape(), descriptor.shape())) {
            throw new EngineCallException(String.format("Engine %s made a volume of shape %s instead of %s", engine.name(),
                                                        Arrays.toString(volume.shape()), Arrays.toString(descriptor.shape())));
        }
        return volume;
    }

    public ProjectionData buildProjectionData(ProjectionEngine engine, ProjectionDataInfo info, boolean zeroInit) {
        return engine.makeProjectionData(ExamInfo.defaultInfo(), info, zeroInit);
    }

    public ProjectionData buildProjectionData(ProjectionEngine engine, boolean zeroInit) {
        return buildProjectionData(engine, buildEngineProjectionDataInfo(engine), zeroInit);
    }

    /**
     * Wires a projector pair between a volume on {@code descriptor} and this model's projection
     * data, with the default projector options.
     */
    public ProjectorPair buildProjector(ProjectionEngine engine, VolumeDescriptor descriptor) {
        return projectorBuilder(engine, descriptor).build();
    }

    /**
     * @return a projector builder over freshly made engine buffers, for callers that want to
     *         change the projector options
     */
    public ProjectorPair.Builder projectorBuilder(ProjectionEngine engine, VolumeDescriptor descriptor) {
        var info = buildEngineProjectionDataInfo(engine);
        var volume = buildVolume(engine, info, descriptor);
        var projectionData = buildProjectionData(engine, info, true);
        return ProjectorPair.builder(engine,
                                     VolumeSpaces.fromVolume(descriptor),
                                     ProjectionSpaceDescriptor.fromProjectionDataGeometry(info.getGeometry()),
                                     volume,
                                     projectionData)
                            .withProjectionDataInfo(info);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompressionModel that = (CompressionModel) o;
        return scanner.equals(that.scanner) && config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scanner, config);
    }

    @Override
    public String toString() {
        return "CompressionModel(" + scanner.getName() + ", " + config + ")";
    }
}
