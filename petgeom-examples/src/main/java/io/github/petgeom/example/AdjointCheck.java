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

package io.github.petgeom.example;

import io.github.petgeom.example.yaml.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Builds the projector pair of a session and checks {@code <Ax, y> == <x, A*y>} on random
 * elements.
 */
@Command(
    name = "adjoint-check",
    mixinStandardHelpOptions = true,
    version = "petgeom adjoint check 1.0.0",
    description = "Checks that the forward and back projectors of a session are adjoint"
)
public class AdjointCheck implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(AdjointCheck.class);

    @Option(
        names = {"-c", "--config"},
        description = "Session YAML file; the bundled default.yml when absent"
    )
    private File config;

    @Option(
        names = {"-s", "--seed"},
        description = "Seed for the random volume and sinogram",
        defaultValue = "42"
    )
    private long seed = 42;

    @Option(
        names = {"-t", "--tolerance"},
        description = "Largest accepted relative difference of the two inner products",
        defaultValue = "1e-4"
    )
    private double tolerance = 1e-4;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AdjointCheck()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var session = config != null ? SessionConfig.getConfig(config) : SessionConfig.getDefaultConfig();
        long start = System.nanoTime();
        var pair = session.toProjectorPair();
        logger.info("Built {} in {} ms", pair.getSystemMatrix(), (System.nanoTime() - start) / 1_000_000);

        var random = new Random(seed);
        var forward = pair.forward();
        float[] x = random(forward.domain().size(), random);
        float[] y = random(forward.range().size(), random);

        start = System.nanoTime();
        double lhs = dot(forward.apply(x), y);
        logger.info("Forward projection took {} ms", (System.nanoTime() - start) / 1_000_000);
        start = System.nanoTime();
        double rhs = dot(x, forward.adjoint().apply(y));
        logger.info("Back projection took {} ms", (System.nanoTime() - start) / 1_000_000);

        double relative = Math.abs(lhs - rhs) / Math.max(Math.abs(lhs), Math.abs(rhs));
        logger.info("<Ax, y> = {}, <x, A*y> = {}, relative difference {}", lhs, rhs, relative);
        if (relative > tolerance) {
            logger.error("Forward and back projection are not adjoint: {} > {}", relative, tolerance);
            return 1;
        }
        return 0;
    }

    private static float[] random(int size, Random random) {
        var values = new float[size];
        for (int i = 0; i < size; i++) {
            values[i] = random.nextFloat();
        }
        return values;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }
}
