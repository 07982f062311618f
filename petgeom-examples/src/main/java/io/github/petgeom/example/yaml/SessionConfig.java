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

import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.engine.ProjectionEngine;
import io.github.petgeom.engine.ProjectionEngines;
import io.github.petgeom.operator.ProjectorPair;
import io.github.petgeom.scanner.ScannerGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * A projector session loaded from YAML: the scanner, either a preset name or explicit
 * parameters, and the compression, volume and projector settings.
 * <pre>
 * scanner: mCT
 * compression:
 *   span: 3
 * volume:
 *   sizes: [-1, 64, 64]
 * projector:
 *   numTangentialLORs: 1
 * </pre>
 */
public class SessionConfig {
    private static final Logger logger = LoggerFactory.getLogger(SessionConfig.class);

    /** Classpath resource loaded by {@link #getDefaultConfig()}. */
    static final String DEFAULT_RESOURCE = "/default.yml";

    /** Preset name; ignored when {@link #customScanner} is set. */
    public String scanner;
    public ScannerParameters customScanner;
    public CompressionParameters compression = new CompressionParameters();
    public VolumeParameters volume = new VolumeParameters();
    public ProjectorParameters projector = new ProjectorParameters();

    public SessionConfig() {
    }

    public static SessionConfig getDefaultConfig() {
        try (InputStream in = SessionConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SessionConfig getConfig(String configName) throws FileNotFoundException {
        return getConfig(new File(configName));
    }

    /**
     * @throws FileNotFoundException if the configuration file is not found
     */
    public static SessionConfig getConfig(File configFile) throws FileNotFoundException {
        if (!configFile.exists()) {
            throw new FileNotFoundException(configFile.getAbsolutePath());
        }
        try (InputStream in = new FileInputStream(configFile)) {
            logger.info("Loading session from {}", configFile.getAbsolutePath());
            return load(in);
        } catch (FileNotFoundException e) {
            throw e;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static SessionConfig load(InputStream in) {
        Yaml yaml = new Yaml();
        var config = yaml.loadAs(in, SessionConfig.class);
        if (config.compression == null) {
            config.compression = new CompressionParameters();
        }
        if (config.volume == null) {
            config.volume = new VolumeParameters();
        }
        if (config.projector == null) {
            config.projector = new ProjectorParameters();
        }
        return config;
    }

    public ScannerGeometry toScannerGeometry() {
        if (customScanner != null) {
            return customScanner.toScannerGeometry();
        }
        if (scanner == null) {
            throw new IllegalArgumentException("The session names neither a scanner preset nor custom scanner parameters");
        }
        return ScannerGeometry.fromName(scanner);
    }

    public CompressionModel toCompressionModel() {
        var geometry = toScannerGeometry();
        return new CompressionModel(geometry, compression.toConfig(geometry));
    }

    public ProjectionEngine toEngine() {
        return projector.engine == null ? ProjectionEngines.getDefault() : ProjectionEngines.get(projector.engine);
    }

    /**
     * Builds the projector pair the session describes.
     */
    public ProjectorPair toProjectorPair() {
        var model = toCompressionModel();
        var descriptor = volume.toDescriptor(model);
        logger.info("Session {} with volume {}", model, descriptor);
        return model.projectorBuilder(toEngine(), descriptor)
                .withNumTangentialLORs(projector.numTangentialLORs)
                .withVerbosity(projector.verbosity)
                .withSymmetries(projector.getSymmetries())
                .build();
    }
}
