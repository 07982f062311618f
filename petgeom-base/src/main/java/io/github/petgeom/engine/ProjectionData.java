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

package io.github.petgeom.engine;

/**
 * Engine-side projection-data (sinogram) buffer. Flat arrays are in
 * (sinogram, view, tangential) order, tangential varying fastest.
 */
public interface ProjectionData {
    ProjectionDataInfo getInfo();

    ExamInfo getExamInfo();

    /**
     * @return {@code (numSinograms, numViews, numTangentialBins)}
     */
    default int[] shape() {
        return getInfo().shape();
    }

    void fill(float[] values);

    void fill(float value);

    float[] toFlatArray();
}
