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

import io.github.petgeom.engine.ExamInfo;
import io.github.petgeom.engine.ProjectionData;
import io.github.petgeom.engine.ProjectionDataInfo;

import java.util.Arrays;

/**
 * Projection data held in one flat float array in (sinogram, view, tangential) order, with
 * sinograms ordered by segment and then by axial position.
 */
public final class InMemoryProjectionData implements ProjectionData {
    private final ExamInfo examInfo;
    private final ProjectionDataInfo info;
    private final float[] data;

    /**
     * Creates zero-filled projection data. Java arrays always start zeroed, so the engine's
     * {@code zeroInit} flag needs no special handling here.
     */
    public InMemoryProjectionData(ExamInfo examInfo, ProjectionDataInfo info) {
        this.examInfo = examInfo;
        this.info = info;
        this.data = new float[info.getNumSinograms() * info.getNumViews() * info.getNumTangentialBins()];
    }

    @Override
    public ProjectionDataInfo getInfo() {
        return info;
    }

    @Override
    public ExamInfo getExamInfo() {
        return examInfo;
    }

    @Override
    public void fill(float[] values) {
        if (values.length != data.length) {
            throw new IllegalArgumentException(String.format("expected %d bin values for shape %s, got %d",
                                                             data.length, Arrays.toString(shape()), values.length));
        }
        System.arraycopy(values, 0, data, 0, data.length);
    }

    @Override
    public void fill(float value) {
        Arrays.fill(data, value);
    }

    @Override
    public float[] toFlatArray() {
        return data.clone();
    }

    /**
     * Flat index of the first tangential bin of a (segment, axial, view) triple.
     */
    int rowStart(int segment, int axial, int view) {
        int sinogram = info.getGeometry().getSinogramOffset(segment, axial);
        return (sinogram * info.getNumViews() + view) * info.getNumTangentialBins();
    }

    float[] data() {
        return data;
    }
}
