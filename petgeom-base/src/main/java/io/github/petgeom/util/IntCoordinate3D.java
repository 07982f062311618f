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

/**
 * An int triple in (z, y, x) order. Used for grid sizes, where {@link #AUTO} marks a component
 * that should be derived from the projection data.
 */
public final class IntCoordinate3D {
    /** Size component to be derived automatically. */
    public static final int AUTO = -1;
    /** All three sizes derived automatically. */
    public static final IntCoordinate3D ALL_AUTO = new IntCoordinate3D(AUTO, AUTO, AUTO);

    public final int z;
    public final int y;
    public final int x;

    public IntCoordinate3D(int z, int y, int x) {
        this.z = z;
        this.y = y;
        this.x = x;
    }

    /**
     * @param zyx three values in (z, y, x) order
     */
    public static IntCoordinate3D of(int[] zyx) {
        if (zyx.length != 3) {
            throw new IllegalArgumentException("expected 3 coordinates, got " + zyx.length);
        }
        return new IntCoordinate3D(zyx[0], zyx[1], zyx[2]);
    }

    public int[] toArray() {
        return new int[] {z, y, x};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntCoordinate3D that = (IntCoordinate3D) o;
        return z == that.z && y == that.y && x == that.x;
    }

    @Override
    public int hashCode() {
        return (31 * z + y) * 31 + x;
    }

    @Override
    public String toString() {
        return String.format("(z=%d, y=%d, x=%d)", z, y, x);
    }
}
