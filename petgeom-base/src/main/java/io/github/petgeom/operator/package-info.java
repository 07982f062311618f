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
 * Linear operators between volume and projection spaces.
 * <p>
 * {@link io.github.petgeom.operator.ProjectorPair} wires a
 * {@link io.github.petgeom.operator.ForwardProjector} and a
 * {@link io.github.petgeom.operator.BackProjector} around one engine system matrix; each is the
 * other's {@code adjoint()}.
 */
package io.github.petgeom.operator;
