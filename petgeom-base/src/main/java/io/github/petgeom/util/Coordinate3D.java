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
 * A float triple in (z, y, x) order, the order volume shapes are reported in.
 */
public final class Coordinate3D {
    public static final Coordinate3D ZERO = new Coordinate3D(0, 0, 0);

    public final float z;
    public final float y;
    public final float x;

    public Coordinate3D(float z, float y, float x) {
        this.z = z;
        this.y = y;
        this.x = x;
    }

    /**
     * @param zyx three values in (z, y, x) order
     */
    public static Coordinate3D of(float[] zyx) {
        if (zyx.length != 3) {
            throw new IllegalArgumentException("expected 3 coordinates, got " + zyx.length);
        }
        return new Coordinate3D(zyx[0], zyx[1], zyx[2]);
    }

    public float[] toArray() {
        return new float[] {z, y, x};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Coordinate3D that = (Coordinate3D) o;
        return Float.compare(z, that.z) == 0 && Float.compare(y, that.y) == 0 && Float.compare(x, that.x) == 0;
    }

    @Override
    public int hashCode() {
        int result = Float.hashCode(z);
        result = 31 * result + Float.hashCode(y);
        return 31 * result + Float.hashCode(x);
    }

    @Override
    public String toString() {
        return String.format("(z=%s, y=%s, x=%s)", z, y, x);
    }
}
