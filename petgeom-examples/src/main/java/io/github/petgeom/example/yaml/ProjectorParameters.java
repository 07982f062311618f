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

package io.github.petgeom.example.yaml;

import io.github.petgeom.engine.Symmetry;

import java.util.EnumSet;
import java.util.List;

/**
 * Projector options: the engine by name, lines of response per bin, verbosity and the
 * symmetries the system matrix may use.
 */
public class ProjectorParameters {
    /** Engine name; the first discovered engine when unset. */
    public String engine;
    public int numTangentialLORs = 1;
    public int verbosity;
    /** Symmetry names; all of them when unset. */
    public List<String> symmetries;

    public ProjectorParameters() {
    }

    public EnumSet<Symmetry> getSymmetries() {
        if (symmetries == null) {
            return Symmetry.all();
        }
        var result = EnumSet.noneOf(Symmetry.class);
        for (var name : symmetries) {
            try {
                result.add(Symmetry.valueOf(name));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown symmetry '" + name + "'; supported are " + Symmetry.all(), e);
            }
        }
        return result;
    }
}
