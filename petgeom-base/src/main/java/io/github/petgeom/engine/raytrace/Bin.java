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

package io.github.petgeom.engine.raytrace;

/**
 * Address of one projection bin.
 */
final class Bin {
    final int segment;
    final int axial;
    final int view;
    final int tangential;

    Bin(int segment, int axial, int view, int tangential) {
        this.segment = segment;
        this.axial = axial;
        this.view = view;
        this.tangential = tangential;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Bin bin = (Bin) o;
        return segment == bin.segment && axial == bin.axial && view == bin.view && tangential == bin.tangential;
    }

    @Override
    public int hashCode() {
        int result = segment;
        result = 31 * result + axial;
        result = 31 * result + view;
        return 31 * result + tangential;
    }

    @Override
    public String toString() {
        return String.format("Bin(segment=%d, axial=%d, view=%d, tangential=%d)", segment, axial, view, tangential);
    }
}
