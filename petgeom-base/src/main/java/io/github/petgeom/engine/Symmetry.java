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

package io.github.petgeom.engine;

import java.util.EnumSet;

/**
 * Geometric symmetries a system matrix may exploit to compute fewer distinct rows.
 */
public enum Symmetry {
    /** Views at phi and 90 degrees - phi are related by swapping x and y. */
    ROTATION_90_MIN_PHI,
    /** Views at phi and 180 degrees - phi are related by mirroring x. */
    ROTATION_180_MIN_PHI,
    /** Tangential positions s and -s are related by a point reflection through the axis. */
    SWAP_TANGENTIAL,
    /** Segments k and -k are related by mirroring z around the line-of-response centre. */
    SWAP_SEGMENT;

    /**
     * @return a new set holding all four symmetries
     */
    public static EnumSet<Symmetry> all() {
        return EnumSet.allOf(Symmetry.class);
    }
}
