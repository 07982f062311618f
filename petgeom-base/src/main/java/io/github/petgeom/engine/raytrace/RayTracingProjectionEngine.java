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
import io.github.petgeom.engine.ExamInfo;
import io.github.petgeom.engine.ProjectionData;
import io.github.petgeom.engine.ProjectionDataInfo;
import io.github.petgeom.engine.ProjectionEngine;
import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.engine.SystemMatrix;
import io.github.petgeom.engine.Verbosity;
import io.github.petgeom.engine.Volume;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.IntCoordinate3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;

/**
 * The built-in engine: projection data of a cylindrical scanner held in memory, volumes on a
 * Cartesian grid and a {@link RayTracingSystemMatrix}. Templates are the YAML files described in
 * {@link ProjectionTemplates}.
 * <p>
 * Every call is blocking and single-threaded. Buffers and matrices from other engines are
 * rejected with {@link EngineCallException}.
 */
public class RayTracingProjectionEngine implements ProjectionEngine {
    private static final Logger logger = LoggerFactory.getLogger(RayTracingProjectionEngine.class);

    public static final String NAME = "raytrace";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProjectionDataInfo makeProjectionDataInfo(ScannerGeometry scanner, int span, int maxRingDiff,
                                                     int numViews, int numTangentialBins, boolean arcCorrected) {
        try {
            var geometry = ProjectionDataGeometry.compute(scanner, span, maxRingDiff, numViews, numTangentialBins, arcCorrected);
            if (Verbosity.get() >= 1) {
                logger.info("Projection data {}", geometry);
            }
            return new CylindricalProjectionDataInfo(geometry);
        } catch (IllegalArgumentException e) {
            throw new EngineCallException("Cannot describe projection data for " + scanner.getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Volume makeVolume(ProjectionDataInfo info, float zoom, Coordinate3D offset, IntCoordinate3D sizes) {
        try {
            var descriptor = VolumeDescriptor.forProjectionData(info.getGeometry(), zoom, offset, sizes);
            if (Verbosity.get() >= 1) {
                logger.info("Volume {}", descriptor);
            }
            return new VoxelGrid(descriptor);
        } catch (IllegalArgumentException e) {
            throw new EngineCallException("Cannot make a volume for " + info.getGeometry() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ProjectionData makeProjectionData(ExamInfo examInfo, ProjectionDataInfo info, boolean zeroInit) {
        return new InMemoryProjectionData(examInfo, info);
    }

    @Override
    public SystemMatrix buildSystemMatrix(ProjectionDataInfo info, Volume volume, Set<Symmetry> symmetries, int numTangentialLORs) {
        var grid = voxelGrid(volume);
        try {
            var matrix = new RayTracingSystemMatrix(info, grid.getDescriptor(), symmetries, numTangentialLORs);
            logger.debug("Built {}", matrix);
            return matrix;
        } catch (IllegalArgumentException e) {
            throw new EngineCallException("Cannot set up the system matrix: " + e.getMessage(), e);
        }
    }

    @Override
    public void forwardProject(SystemMatrix matrix, ProjectionData out, Volume in) {
        var m = checked(matrix, in, out);
        long start = System.nanoTime();
        m.forward(voxelGrid(in), inMemory(out));
        if (Verbosity.get() >= 1) {
            logger.info("Forward projection took {} ms", (System.nanoTime() - start) / 1_000_000);
        }
    }

    @Override
    public void backProject(SystemMatrix matrix, Volume out, ProjectionData in) {
        var m = checked(matrix, out, in);
        long start = System.nanoTime();
        m.back(inMemory(in), voxelGrid(out));
        if (Verbosity.get() >= 1) {
            logger.info("Back projection took {} ms", (System.nanoTime() - start) / 1_000_000);
        }
    }

    @Override
    public Volume readVolume(Path path) {
        var template = ProjectionTemplates.readVolumeTemplate(path);
        logger.debug("Read volume template {}: {}", path, template.getVolume());
        return new VoxelGrid(template.getVolume());
    }

    @Override
    public ProjectionData readProjectionData(Path path) {
        var geometry = ProjectionTemplates.readProjectionGeometry(path);
        logger.debug("Read projection data template {}: {}", path, geometry);
        return new InMemoryProjectionData(ExamInfo.defaultInfo(), new CylindricalProjectionDataInfo(geometry));
    }

    private static RayTracingSystemMatrix checked(SystemMatrix matrix, Volume volume, ProjectionData projectionData) {
        if (!(matrix instanceof RayTracingSystemMatrix)) {
            throw new EngineCallException("System matrix " + matrix + " was not built by the " + NAME + " engine");
        }
        var m = (RayTracingSystemMatrix) matrix;
        if (!Arrays.equals(m.getVolumeShape(), volume.shape())) {
            throw new EngineCallException(String.format("System matrix expects a volume of shape %s, got %s",
                                                        Arrays.toString(m.getVolumeShape()), Arrays.toString(volume.shape())));
        }
        if (!m.getVolumeDescriptor().equals(volume.getDescriptor())) {
            throw new EngineCallException("System matrix was built for " + m.getVolumeDescriptor() + ", not " + volume.getDescriptor());
        }
        if (!m.getProjectionDataInfo().getGeometry().equals(projectionData.getInfo().getGeometry())) {
            throw new EngineCallException("System matrix was built for " + m.getProjectionDataInfo().getGeometry()
                                          + ", not " + projectionData.getInfo().getGeometry());
        }
        return m;
    }

    private static VoxelGrid voxelGrid(Volume volume) {
        if (!(volume instanceof VoxelGrid)) {
            throw new EngineCallException("Volume " + volume.getClass().getName() + " was not made by the " + NAME + " engine");
        }
        return (VoxelGrid) volume;
    }

    private static InMemoryProjectionData inMemory(ProjectionData data) {
        if (!(data instanceof InMemoryProjectionData)) {
            throw new EngineCallException("Projection data " + data.getClass().getName() + " were not made by the " + NAME + " engine");
        }
        return (InMemoryProjectionData) data;
    }
}
