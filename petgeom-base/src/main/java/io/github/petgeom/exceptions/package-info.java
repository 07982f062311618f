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

/**
 * Exception types raised while setting up scanner geometry and projectors.
 * <p>
 * All of them are unchecked. They signal caller errors (an unknown preset name, inconsistent
 * scanner parameters, a space bound to a buffer of another shape) or a failing engine call,
 * and are never retried by the library.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.petgeom.exceptions.UnknownScannerException} - a preset name that is not
 *       in {@link io.github.petgeom.scanner.ScannerRegistry}.</li>
 *   <li>{@link io.github.petgeom.exceptions.GeometryConsistencyException} - scanner parameters
 *       that fail the consistency predicate; carries every violated relation.</li>
 *   <li>{@link io.github.petgeom.exceptions.ShapeMismatchException} - operator space and buffer
 *       shapes differ; raised before any engine setup happens.</li>
 *   <li>{@link io.github.petgeom.exceptions.EngineCallException} - the projection engine failed;
 *       the underlying failure is kept as the cause.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     var scanner = ScannerGeometry.fromName(name);
 * } catch (UnknownScannerException e) {
 *     logger.error("Cannot set up reconstruction for {}", e.getRequestedName(), e);
 * }
 * }</pre>
 */
package io.github.petgeom.exceptions;
