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

package io.github.petgeom.exceptions;

import java.util.Arrays;

/**
 * Thrown when an operator space and the engine buffer it is bound to disagree on shape,
 * or when an array handed to an operator does not have the size of its space.
 */
public class ShapeMismatchException extends RuntimeException {
    private final int[] expected;
    private final int[] actual;

    /**
     * @param what short description of the two shapes being compared, e.g. "domain.shape vs volume shape"
     * @param expected the shape declared by the operator space
     * @param actual the shape of the buffer or array
     */
    public ShapeMismatchException(String what, int[] expected, int[] actual) {
        super(String.format("%s: %s does not equal %s", what, Arrays.toString(expected), Arrays.toString(actual)));
        this.expected = expected.clone();
        this.actual = actual.clone();
    }

    public int[] getExpected() {
        return expected.clone();
    }

    public int[] getActual() {
        return actual.clone();
    }
}
