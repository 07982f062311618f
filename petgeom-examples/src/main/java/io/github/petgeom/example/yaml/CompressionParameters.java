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

package io.github.petgeom.example.yaml;

import io.github.petgeom.compression.CompressionConfig;
import io.github.petgeom.scanner.ScannerGeometry;

/**
 * Axial and angular compression of the projection data. Unset values take the scanner's
 * defaults.
 */
public class CompressionParameters {
    public int span = 1;
    public Integer maxRingDiff;
    public Integer views;
    public Integer tangentialBins;
    public boolean arcCorrected;

    public CompressionParameters() {
    }

    public CompressionConfig toConfig(ScannerGeometry scanner) {
        var defaults = CompressionConfig.defaultsFor(scanner);
        return defaults.toBuilder()
                .withSpanNum(span)
                .withMaxNumSegments(maxRingDiff)
                .withNumOfViews(views != null ? views : defaults.getNumOfViews())
                .withNumNonArcCorBins(tangentialBins != null ? tangentialBins : defaults.getNumNonArcCorBins())
                .withDataArcCorrected(arcCorrected)
                .build();
    }
}
