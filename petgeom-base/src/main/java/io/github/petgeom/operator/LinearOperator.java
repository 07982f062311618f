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
 * A linear map between two discretized spaces, with elements passed as flat float arrays.
 */
public interface LinearOperator {
    UniformSpace domain();

    UniformSpace range();

    /**
     * @return a new element of {@link #range()}
     */
    default float[] apply(float[] in) {
        var out = range().zero();
        apply(in, out);
        return out;
    }

    /**
     * Evaluates the operator on {@code in}, overwriting {@code out}.
     *
     * @throws io.github.petgeom.exceptions.ShapeMismatchException if either array does not
     *         match its space
     */
    void apply(float[] in, float[] out);

    /**
     * @return the operator A* with {@code <A x, y> = <x, A* y>}
     */
    LinearOperator adjoint();
}
