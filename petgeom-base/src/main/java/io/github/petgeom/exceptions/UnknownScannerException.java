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
 * Thrown when a scanner preset is requested by a name that the registry does not know.
 */
public class UnknownScannerException extends RuntimeException {
    private final String requestedName;

    /**
     * Creates a new exception for the given name.
     * @param requestedName the name that was looked up
     * @param supportedNames the names the registry does support, listed in the message
     */
    public UnknownScannerException(String requestedName, List<String> supportedNames) {
        super(String.format("No default scanner of name '%s'; supported names are %s", requestedName, supportedNames));
        this.requestedName = requestedName;
    }

    /**
     * @return the name that was looked up
     */
    public String getRequestedName() {
        return requestedName;
    }
}
