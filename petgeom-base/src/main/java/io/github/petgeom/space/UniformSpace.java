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

package io.github.petgeom.space;

import io.github.petgeom.exceptions.ShapeMismatchException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A box {@code [minPt, maxPt]} split into equally sized cells, with one float value per cell.
 * Elements are flat float arrays in row-major order, last axis fastest.
 */
public final class UniformSpace {
    private final int[] shape;
    private final double[] minPt;
    private final double[] maxPt;
    private final List<String> axisLabels;

    /**
     * @throws IllegalArgumentException if the arguments disagree on the number of axes, a
     *         count is not positive or a max point is not above its min point
     */
    public UniformSpace(int[] shape, double[] minPt, double[] maxPt, List<String> axisLabels) {
        if (minPt.length != shape.length || maxPt.length != shape.length || axisLabels.size() != shape.length) {
            throw new IllegalArgumentException(String.format("shape %s, min point %s, max point %s and labels %s must have the same length",
                                                             Arrays.toString(shape), Arrays.toString(minPt),
                                                             Arrays.toString(maxPt), axisLabels));
        }
        for (int i = 0; i < shape.length; i++) {
            if (shape[i] <= 0) {
                throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " must be positive");
            }
            if (!(maxPt[i] > minPt[i])) {
                throw new IllegalArgumentException(String.format("max point %s must exceed min point %s along %s",
                                                                 Arrays.toString(maxPt), Arrays.toString(minPt), axisLabels.get(i)));
            }
        }
        this.shape = shape.clone();
        this.minPt = minPt.clone();
        this.maxPt = maxPt.clone();
        this.axisLabels = List.copyOf(axisLabels);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return shape.length;
    }

    public double[] getMinPt() {
        return minPt.clone();
    }

    public double[] getMaxPt() {
        return maxPt.clone();
    }

    public List<String> getAxisLabels() {
        return axisLabels;
    }

    /**
     * @return the extent of one cell along each axis
     */
    public double[] cellSides() {
        var sides = new double[shape.length];
        for (int i = 0; i < shape.length; i++) {
            sides[i] = (maxPt[i] - minPt[i]) / shape[i];
        }
        return sides;
    }

    /**
     * @return the volume of one cell
     */
    public double cellVolume() {
        double volume = 1;
        for (double side : cellSides()) {
            volume *= side;
        }
        return volume;
    }

    /**
     * @return the number of cells
     */
    public int size() {
        int size = 1;
        for (int n : shape) {
            size = Math.multiplyExact(size, n);
        }
        return size;
    }

    /**
     * @return a new all-zero element
     */
    public float[] zero() {
        return new float[size()];
    }

    /**
     * @return a copy of {@code values} as an element of this space
     * @throws ShapeMismatchException if {@code values} does not hold one value per cell
     */
    public float[] element(float[] values) {
        checkElement(values, "element");
        return values.clone();
    }

    /**
     * @param what how the array is used, for the error message
     * @throws ShapeMismatchException if {@code values} does not hold one value per cell
     */
    public void checkElement(float[] values, String what) {
        if (values.length != size()) {
            throw new ShapeMismatchException(what + " size vs space size", new int[] {size()}, new int[] {values.length});
        }
    }

    /**
     * @return true if the two spaces have the same shape
     */
    public boolean hasShape(int[] other) {
        return Arrays.equals(shape, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UniformSpace that = (UniformSpace) o;
        return Arrays.equals(shape, that.shape)
               && Arrays.equals(minPt, that.minPt)
               && Arrays.equals(maxPt, that.maxPt)
               && axisLabels.equals(that.axisLabels);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(axisLabels);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(minPt);
        return 31 * result + Arrays.hashCode(maxPt);
    }

    @Override
    public String toString() {
        return String.format("UniformSpace(shape=%s, min=%s, max=%s, labels=%s)", Arrays.toString(shape),
                             Arrays.toString(minPt), Arrays.toString(maxPt), axisLabels);
    }
}
