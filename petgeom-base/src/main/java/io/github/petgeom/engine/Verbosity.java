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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Process-wide engine verbosity. 0 keeps engines quiet, 1 reports progress, 2 and above add
 * per-call detail.
 * <p>
 * The level is global mutable state. Code that needs a particular level for one engine call
 * should use {@link #withLevel(int, Supplier)} or {@link #withLevel(int, Runnable)}, which set
 * the level for the duration of the call and restore the previous one afterwards, also when the
 * call throws.
 */
public final class Verbosity {
    private static final AtomicInteger level = new AtomicInteger(0);

    private Verbosity() {
    }

    public static int get() {
        return level.get();
    }

    /**
     * @return the previous level
     */
    public static int set(int newLevel) {
        if (newLevel < 0) {
            throw new IllegalArgumentException("verbosity " + newLevel + " must not be negative");
        }
        return level.getAndSet(newLevel);
    }

    /**
     * Runs {@code work} with the verbosity set to {@code requested}.
     *
     * @return what {@code work} returned
     */
    public static <T> T withLevel(int requested, Supplier<T> work) {
        int previous = set(requested);
        try {
            return work.get();
        } finally {
            level.set(previous);
        }
    }

    public static void withLevel(int requested, Runnable work) {
        withLevel(requested, () -> {
            work.run();
            return null;
        });
    }
}
