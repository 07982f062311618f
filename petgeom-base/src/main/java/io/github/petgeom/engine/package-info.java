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
 * The projection engine interface.
 * <p>
 * An engine owns the numeric side of projection: buffers, the system matrix and the forward
 * and back projection kernels. Implementations register themselves as a
 * {@link java.util.ServiceLoader} service of {@link io.github.petgeom.engine.ProjectionEngine}
 * and are looked up by name with {@link io.github.petgeom.engine.ProjectionEngines}. How much
 * they log is controlled by the process-wide {@link io.github.petgeom.engine.Verbosity}.
 */
package io.github.petgeom.engine;
