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

package io.github.petgeom.operator;

import io.github.petgeom.engine.ProjectionData;
import io.github.petgeom.engine.ProjectionDataInfo;
import io.github.petgeom.engine.ProjectionEngine;
import io.github.petgeom.engine.Symmetry;
import io.github.petgeom.engine.SystemMatrix;
import io.github.petgeom.engine.Volume;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.exceptions.ShapeMismatchException;
import io.github.petgeom.space.ProjectionSpaceDescriptor;
import io.github.petgeom.space.UniformSpace;
import io.github.petgeom.space.VolumeSpaces;
import io.github.petgeom.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A forward projector and its adjoint back projector, built over one system matrix and one
 * pair of engine buffers.
 * <p>
 * Both operators fill the shared buffers on every call, so a pair must not be used from more
 * than one thread at a time. Once built, a pair can be applied any number of times.
 * <pre>{@code
 * var pair = ProjectorPair.builder(engine, domain, range, volume, projectionData)
 *                         .withNumTangentialLORs(2)
 *                         .build();
 * float[] sinogram = pair.forward().apply(image);
 * float[] backProjected = pair.forward().adjoint().apply(sinogram);
 * }</pre>
 */
public final class ProjectorPair {
    private static final Logger logger = LoggerFactory.getLogger(ProjectorPair.class);

    private final ForwardProjector forward;
    private final BackProjector back;
    private final SystemMatrix systemMatrix;

    private ProjectorPair(ForwardProjector forward, BackProjector back, SystemMatrix systemMatrix) {
        this.forward = forward;
        this.back = back;
        this.systemMatrix = systemMatrix;
    }

    /**
     * @param domain the volume space; its shape must equal {@code volume.shape()}
     * @param range the projection space; its shape must equal {@code projectionData.shape()}
     */
    public static Builder builder(ProjectionEngine engine, UniformSpace domain, UniformSpace range,
                                  Volume volume, ProjectionData projectionData) {
        return new Builder(engine, domain, range, volume, projectionData);
    }

    /**
     * Builds a pair from an engine's volume and projection-data template files. The projection
     * data are copied into memory; the spaces are derived from the two buffers.
     *
     * @throws EngineCallException if the engine cannot read either file
     */
    public static ProjectorPair fromFiles(ProjectionEngine engine, Path volumeFile, Path projectionFile) {
        Volume volume;
        ProjectionData projectionData;
        try {
            volume = engine.readVolume(volumeFile);
            projectionData = engine.readProjectionData(projectionFile);
        } catch (RuntimeException e) {
            throw ExceptionUtils.asEngineCallException("Reading templates " + volumeFile + " and " + projectionFile, e);
        }
        return builder(engine, VolumeSpaces.fromVolume(volume), ProjectionSpaceDescriptor.fromProjectionData(projectionData),
                       volume, projectionData).build();
    }

    public ForwardProjector forward() {
        return forward;
    }

    public BackProjector back() {
        return back;
    }

    public SystemMatrix getSystemMatrix() {
        return systemMatrix;
    }

    /**
     * Collects the projector options. {@link #build()} validates the shapes before anything is
     * asked of the engine.
     */
    public static final class Builder {
        private final ProjectionEngine engine;
        private final UniformSpace domain;
        private final UniformSpace range;
        private final Volume volume;
        private final ProjectionData projectionData;
        private int numTangentialLORs = 1;
        private int verbosity = 0;
        private Set<Symmetry> symmetries = Symmetry.all();
        private SystemMatrix systemMatrix;
        private ProjectionDataInfo projectionDataInfo;

        private Builder(ProjectionEngine engine, UniformSpace domain, UniformSpace range,
                        Volume volume, ProjectionData projectionData) {
            this.engine = Objects.requireNonNull(engine, "engine");
            this.domain = Objects.requireNonNull(domain, "domain");
            this.range = Objects.requireNonNull(range, "range");
            this.volume = Objects.requireNonNull(volume, "volume");
            this.projectionData = Objects.requireNonNull(projectionData, "projectionData");
        }

        /**
         * @param numTangentialLORs lines of response traced per tangential bin, at least 1
         */
        public Builder withNumTangentialLORs(int numTangentialLORs) {
            if (numTangentialLORs < 1) {
                throw new IllegalArgumentException("numTangentialLORs " + numTangentialLORs + " must be at least 1");
            }
            this.numTangentialLORs = numTangentialLORs;
            return this;
        }

        /**
         * @param verbosity engine verbosity for every projection made by the pair
         */
        public Builder withVerbosity(int verbosity) {
            if (verbosity < 0) {
                throw new IllegalArgumentException("verbosity " + verbosity + " must not be negative");
            }
            this.verbosity = verbosity;
            return this;
        }

        public Builder withSymmetries(Set<Symmetry> symmetries) {
            var copy = EnumSet.noneOf(Symmetry.class);
            copy.addAll(symmetries);
            this.symmetries = copy;
            return this;
        }

        /**
         * Reuses a system matrix built earlier for the same volume and projection data, instead
         * of building a new one.
         */
        public Builder withSystemMatrix(SystemMatrix systemMatrix) {
            this.systemMatrix = systemMatrix;
            return this;
        }

        /**
         * Builds the system matrix for this description instead of the projection data's own.
         */
        public Builder withProjectionDataInfo(ProjectionDataInfo projectionDataInfo) {
            this.projectionDataInfo = projectionDataInfo;
            return this;
        }

        /**
         * @throws ShapeMismatchException if a space does not have the shape of its buffer; the
         *         engine has not been called at that point
         * @throws EngineCallException if the engine cannot set up the system matrix, or a
         *         reused system matrix or projection data description belongs to other
         *         projection data
         */
        public ProjectorPair build() {
            if (!domain.hasShape(volume.shape())) {
                throw new ShapeMismatchException("domain.shape vs volume shape", domain.shape(), volume.shape());
            }
            if (!range.hasShape(projectionData.shape())) {
                throw new ShapeMismatchException("range.shape vs projection data shape", range.shape(), projectionData.shape());
            }

            var dataGeometry = projectionData.getInfo().getGeometry();
            var info = projectionDataInfo != null ? projectionDataInfo : projectionData.getInfo();
            if (!info.getGeometry().equals(dataGeometry)) {
                throw new EngineCallException("Projection data description " + info.getGeometry()
                                              + " does not match the projection data " + dataGeometry);
            }
            var matrix = systemMatrix;
            if (matrix == null) {
                try {
                    matrix = engine.buildSystemMatrix(info, volume, symmetries, numTangentialLORs);
                } catch (RuntimeException e) {
                    throw ExceptionUtils.asEngineCallException("Setting up the system matrix", e);
                }
            } else if (!Arrays.equals(matrix.getVolumeShape(), volume.shape())) {
                throw new ShapeMismatchException("system matrix volume shape vs volume shape", matrix.getVolumeShape(), volume.shape());
            } else if (!matrix.getProjectionDataInfo().getGeometry().equals(dataGeometry)) {
                throw new EngineCallException("System matrix was built for " + matrix.getProjectionDataInfo().getGeometry()
                                              + ", not " + dataGeometry);
            }

            var buffers = new ProjectorBuffers(engine, matrix, volume, projectionData, verbosity);
            var forward = new ForwardProjector(domain, range, buffers);
            var back = new BackProjector(range, domain, buffers);
            forward.linkAdjoint(back);
            back.linkAdjoint(forward);
            logger.debug("Projector pair ready: {} with {}", forward, matrix);
            return new ProjectorPair(forward, back, matrix);
        }
    }
}
