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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Examination metadata attached to projection data. Only the time-frame definitions are kept.
 * Without list-mode or motion correction a single frame {@code [0, 1]} stands for one bed
 * position, and engines ignore it.
 */
public final class ExamInfo {
    private final List<double[]> timeFrames;

    private ExamInfo(List<double[]> timeFrames) {
        this.timeFrames = timeFrames;
    }

    /**
     * @return exam info with the single time frame {@code [0, 1]}
     */
    public static ExamInfo defaultInfo() {
        return withTimeFrames(new double[] {0.0}, new double[] {1.0});
    }

    /**
     * @param starts frame start times in seconds
     * @param ends frame end times in seconds, one per start
     */
    public static ExamInfo withTimeFrames(double[] starts, double[] ends) {
        if (starts.length != ends.length) {
            throw new IllegalArgumentException(String.format("%d frame starts but %d frame ends", starts.length, ends.length));
        }
        var frames = new ArrayList<double[]>(starts.length);
        for (int i = 0; i < starts.length; i++) {
            if (ends[i] < starts[i]) {
                throw new IllegalArgumentException(String.format("frame %d ends at %s before it starts at %s", i, ends[i], starts[i]));
            }
            frames.add(new double[] {starts[i], ends[i]});
        }
        return new ExamInfo(Collections.unmodifiableList(frames));
    }

    public int getNumTimeFrames() {
        return timeFrames.size();
    }

    /**
     * @param frame 0-based frame index
     */
    public double getStartTime(int frame) {
        return timeFrames.get(frame)[0];
    }

    public double getEndTime(int frame) {
        return timeFrames.get(frame)[1];
    }
}
