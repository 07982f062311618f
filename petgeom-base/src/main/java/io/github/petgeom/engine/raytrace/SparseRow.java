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

import org.agrona.collections.LongArrayList;

import java.util.Arrays;

/**
 * One row of the system matrix: the voxels a line of response crosses and the length of
 * the crossing in each, in mm.
 * <p>
 * Voxel indices are kept unclipped so that rows can be mapped onto symmetric bins before
 * they are restricted to the grid.
 */
final class SparseRow {
    // each index field gets 21 bits, offset so that negative indices pack as well
    private static final int FIELD_BITS = 21;
    private static final int FIELD_OFFSET = 1 << (FIELD_BITS - 1);
    private static final long FIELD_MASK = (1L << FIELD_BITS) - 1;

    final int[] z;
    final int[] y;
    final int[] x;
    final float[] weights;

    private SparseRow(int[] z, int[] y, int[] x, float[] weights) {
        this.z = z;
        this.y = y;
        this.x = x;
        this.weights = weights;
    }

    int size() {
        return weights.length;
    }

    static long pack(int z, int y, int x) {
        return ((long) (z + FIELD_OFFSET) << (2 * FIELD_BITS))
               | ((long) (y + FIELD_OFFSET) << FIELD_BITS)
               | (x + FIELD_OFFSET);
    }

    /**
     * Accumulates equally weighted samples into a row.
     *
     * @param samples packed voxel indices, one per sample, in any order
     * @param sampleWeight the weight every sample contributes
     */
    static SparseRow fromSamples(LongArrayList samples, float sampleWeight) {
        long[] keys = samples.toLongArray();
        Arrays.sort(keys);
        int distinct = 0;
        for (int i = 0; i < keys.length; i++) {
            if (i == 0 || keys[i] != keys[i - 1]) {
                distinct++;
            }
        }

        var z = new int[distinct];
        var y = new int[distinct];
        var x = new int[distinct];
        var weights = new float[distinct];
        int n = -1;
        for (int i = 0; i < keys.length; i++) {
            if (i == 0 || keys[i] != keys[i - 1]) {
                n++;
                long key = keys[i];
                z[n] = (int) ((key >>> (2 * FIELD_BITS)) & FIELD_MASK) - FIELD_OFFSET;
                y[n] = (int) ((key >>> FIELD_BITS) & FIELD_MASK) - FIELD_OFFSET;
                x[n] = (int) (key & FIELD_MASK) - FIELD_OFFSET;
            }
            weights[n] += sampleWeight;
        }
        return new SparseRow(z, y, x, weights);
    }

    static SparseRow empty() {
        return new SparseRow(new int[0], new int[0], new int[0], new float[0]);
    }

    /**
     * @return the element-wise sum of this row and {@code other}
     */
    SparseRow plus(SparseRow other) {
        int capacity = size() + other.size();
        var z = new int[capacity];
        var y = new int[capacity];
        var x = new int[capacity];
        var weights = new float[capacity];
        int i = 0;
        int j = 0;
        int n = 0;
        // both rows are sorted by packed index
        while (i < size() || j < other.size()) {
            long a = i < size() ? key(i) : Long.MAX_VALUE;
            long b = j < other.size() ? other.key(j) : Long.MAX_VALUE;
            if (a <= b) {
                z[n] = this.z[i];
                y[n] = this.y[i];
                x[n] = this.x[i];
                weights[n] = this.weights[i];
                i++;
                if (a == b) {
                    weights[n] += other.weights[j];
                    j++;
                }
            } else {
                z[n] = other.z[j];
                y[n] = other.y[j];
                x[n] = other.x[j];
                weights[n] = other.weights[j];
                j++;
            }
            n++;
        }
        return new SparseRow(Arrays.copyOf(z, n), Arrays.copyOf(y, n), Arrays.copyOf(x, n), Arrays.copyOf(weights, n));
    }

    private long key(int i) {
        return pack(z[i], y[i], x[i]);
    }
}
