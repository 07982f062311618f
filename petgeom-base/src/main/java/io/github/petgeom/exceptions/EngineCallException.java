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

/**
 * Unchecked exception raised when a call into the projection engine fails. The original
 * failure, if any, is preserved as the cause.
 */
public class EngineCallException extends RuntimeException {
    public EngineCallException(String message) {
        super(message);
    }

    public EngineCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
