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
 * Maps projection data to a volume; the adjoint of {@link ForwardProjector}.
 */
public final class BackProjector implements LinearOperator {
    private final UniformSpace domain;
    private final UniformSpace range;
    private final ProjectorBuffers buffers;
    private ForwardProjector adjoint;

    BackProjector(UniformSpace domain, UniformSpace range, ProjectorBuffers buffers) {
        this.domain = domain;
        this.range = range;
        this.buffers = buffers;
    }

    void linkAdjoint(ForwardProjector adjoint) {
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
     * Loads {@code in} into the shared projection data, clears the shared volume, back projects
     * into it and copies the result to {@code out}.
     */
    @Override
    public void apply(float[] in, float[] out) {
        domain.checkElement(in, "back projection input");
        range.checkElement(out, "back projection output");
        buffers.projectionData.fill(in);
        // the engine accumulates into the volume
        buffers.volume.fill(0f);
        buffers.call("back projection", () -> buffers.engine.backProject(buffers.matrix, buffers.volume, buffers.projectionData));
        ProjectorBuffers.copy(buffers.volume.toFlatArray(), out);
    }

    @Override
    public ForwardProjector adjoint() {
        return adjoint;
    }

    @Override
    public String toString() {
        return "BackProjector(" + domain + " -> " + range + ")";
    }
}
