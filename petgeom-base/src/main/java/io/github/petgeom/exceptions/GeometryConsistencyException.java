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

import java.util.List;

/**
 * Thrown when scanner parameters fail the consistency predicate. No scanner object is created
 * in that case.
 */
public class GeometryConsistencyException extends RuntimeException {
    private final List<String> violations;

    /**
     * @param scannerName name of the scanner being built
     * @param violations the relations that do not hold, one message each
     */
    public GeometryConsistencyException(String scannerName, List<String> violations) {
        super(String.format("Something is wrong in the geometry of scanner '%s': %s", scannerName, String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return the violated relations, in the order they were checked
     */
    public List<String> getViolations() {
        return violations;
    }
}
