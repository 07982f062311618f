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

package io.github.petgeom.util;

import io.github.petgeom.exceptions.EngineCallException;

/**
 * Utility methods for exception handling around engine calls.
 */
public class ExceptionUtils {
    private ExceptionUtils() {
    }

    /**
     * Converts a failure raised inside a projection engine into an {@link EngineCallException}.
     * An EngineCallException is returned unchanged and Errors are rethrown; anything else is
     * wrapped, keeping it as the cause.
     *
     * @param action what the engine was asked to do, e.g. "forward projection"
     * @param t the failure
     * @return the exception to throw
     */
    public static EngineCallException asEngineCallException(String action, Throwable t) {
        if (t instanceof EngineCallException) {
            return (EngineCallException) t;
        } else if (t instanceof Error) {
            throw (Error) t;
        } else {
            return new EngineCallException(action + " failed: " + t.getMessage(), t);
        }
    }
}
