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
 * Physical scanner description.
 * <p>
 * {@link io.github.petgeom.scanner.ScannerGeometry} is built either from a preset in
 * {@link io.github.petgeom.scanner.ScannerRegistry} or from explicit parameters through its
 * builder. Construction is all-or-nothing: a geometry that fails the consistency predicate is
 * reported with {@link io.github.petgeom.exceptions.GeometryConsistencyException} and never
 * handed out.
 */
package io.github.petgeom.scanner;
