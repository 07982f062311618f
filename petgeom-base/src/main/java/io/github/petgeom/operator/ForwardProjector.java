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

import io.github.petgeom.space.UniformSpace;

/**
 * Maps a volume to projection data.
 */
public final class ForwardProjector implements LinearOperator {
    private final UniformSpace domain;
    private final UniformSpace range;
    private final ProjectorBuffers buffers;
    private BackProjector adjoint;

    ForwardProjector(UniformSpace domain, UniformSpace range, ProjectorBuffers buffers) {
        this.domain = domain;
        this.range = range;
        this.buffers = buffers;
    }

    void linkAdjoint(BackProjector adjoint) {
        this.adjoint = adjoint;
    }

    @Override
    public UniformSpace domain() {
        return domain;
    }

    @Override
    public UniformSpace range() {
        return range;
    }

    /**
     * Loads {@code in} into the shared volume, projects it and copies the sinogram to {@code out}.
     */
    @Override
    public void apply(float[] in, float[] out) {
        domain.checkElement(in, "forward projection input");
        range.checkElement(out, "forward projection output");
        buffers.volume.fill(in);
        buffers.call("forward projection", () -> buffers.engine.forwardProject(buffers.matrix, buffers.projectionData, buffers.volume));
        ProjectorBuffers.copy(buffers.projectionData.toFlatArray(), out);
    }

    @Override
    public BackProjector adjoint() {
        return adjoint;
    }

    @Override
    public String toString() {
        return "ForwardProjector(" + domain + " -> " + range + ")";
    }
}
