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

import io.github.petgeom.compression.CompressionConfig;
import io.github.petgeom.compression.CompressionModel;
import io.github.petgeom.compression.ProjectionDataGeometry;
import io.github.petgeom.compression.VolumeDescriptor;
import io.github.petgeom.exceptions.EngineCallException;
import io.github.petgeom.scanner.ScannerGeometry;
import io.github.petgeom.scanner.ScannerRegistry;
import io.github.petgeom.util.Coordinate3D;
import io.github.petgeom.util.ExceptionUtils;
import io.github.petgeom.util.IntCoordinate3D;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML template files for the ray-tracing engine. A template describes the geometry of a
 * buffer; buffers read from one start out zero-filled.
 * <p>
 * A projection-data template names a scanner, either a preset or explicit parameters, and the
 * compression settings. Unset optional settings take their usual defaults:
 * <pre>
 * scanner: mCT
 * span: 3
 * maxRingDiff: 7
 * views: 56
 * tangentialBins: 56
 * arcCorrected: false
 * </pre>
 * A volume template refers to a projection-data template, resolved relative to its own
 * directory, and gives the grid; {@code -1} sizes are derived:
 * <pre>
 * projectionTemplate: mct-span3.yml
 * zoom: 1.0
 * sizes: [-1, 64, 64]
 * offset: [0.0, 0.0, 0.0]
 * </pre>
 */
public final class ProjectionTemplates {
    static final String SCANNER = "scanner";
    static final String SPAN = "span";
    static final String MAX_RING_DIFF = "maxRingDiff";
    static final String VIEWS = "views";
    static final String TANGENTIAL_BINS = "tangentialBins";
    static final String ARC_CORRECTED = "arcCorrected";
    static final String PROJECTION_TEMPLATE = "projectionTemplate";
    static final String ZOOM = "zoom";
    static final String SIZES = "sizes";
    static final String OFFSET = "offset";

    private ProjectionTemplates() {
    }

    /**
     * @throws EngineCallException if the file cannot be read or does not describe valid projection data
     */
    public static ProjectionDataGeometry readProjectionGeometry(Path path) {
        var template = load(path);
        try {
            var scanner = scanner(template.get(SCANNER), path);
            var config = CompressionConfig.builder()
                    .withSpanNum(intValue(template, SPAN, 1))
                    .withMaxNumSegments(optionalInt(template, MAX_RING_DIFF))
                    .withNumOfViews(optionalInt(template, VIEWS))
                    .withNumNonArcCorBins(optionalInt(template, TANGENTIAL_BINS))
                    .withDataArcCorrected(Boolean.TRUE.equals(template.get(ARC_CORRECTED)))
                    .build();
            return new CompressionModel(scanner, config).buildProjectionDataGeometry();
        } catch (RuntimeException e) {
            throw ExceptionUtils.asEngineCallException("Reading projection data template " + path, e);
        }
    }

    /**
     * @throws EngineCallException if the file or the projection template it names cannot be
     *         read, or they do not describe a valid grid
     */
    public static VolumeTemplate readVolumeTemplate(Path path) {
        var template = load(path);
        var reference = template.get(PROJECTION_TEMPLATE);
        if (!(reference instanceof String)) {
            throw new EngineCallException("Volume template " + path + " does not name a " + PROJECTION_TEMPLATE);
        }
        var parent = path.toAbsolutePath().getParent();
        var geometry = readProjectionGeometry(parent.resolve((String) reference));
        try {
            float zoom = ((Number) template.getOrDefault(ZOOM, 1.0)).floatValue();
            var sizes = template.containsKey(SIZES) ? IntCoordinate3D.of(intTriple(template.get(SIZES))) : IntCoordinate3D.ALL_AUTO;
            var offset = template.containsKey(OFFSET) ? Coordinate3D.of(floatTriple(template.get(OFFSET))) : Coordinate3D.ZERO;
            return new VolumeTemplate(geometry, VolumeDescriptor.forProjectionData(geometry, zoom, offset, sizes));
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new EngineCallException("Invalid volume template " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a projection-data template for a geometry whose scanner is a registered preset, or
     * with the scanner's parameters spelled out otherwise.
     */
    public static void writeProjectionTemplate(Path path, ProjectionDataGeometry geometry) throws IOException {
        var template = new LinkedHashMap<String, Object>();
        template.put(SCANNER, scannerEntry(geometry.getScanner()));
        template.put(SPAN, geometry.getSpan());
        template.put(MAX_RING_DIFF, geometry.getMaxRingDiff());
        template.put(VIEWS, geometry.getNumViews());
        template.put(TANGENTIAL_BINS, geometry.getNumTangentialBins());
        template.put(ARC_CORRECTED, geometry.isArcCorrected());
        dump(path, template);
    }

    /**
     * Writes a volume template that refers to {@code projectionTemplate}.
     */
    public static void writeVolumeTemplate(Path path, Path projectionTemplate, VolumeDescriptor volume) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        var template = new LinkedHashMap<String, Object>();
        template.put(PROJECTION_TEMPLATE, parent.relativize(projectionTemplate.toAbsolutePath()).toString());
        template.put(ZOOM, (double) volume.getZoom());
        var sizes = volume.getSizes();
        template.put(SIZES, List.of(sizes.z, sizes.y, sizes.x));
        var offset = volume.getOffset();
        template.put(OFFSET, List.of((double) offset.z, (double) offset.y, (double) offset.x));
        dump(path, template);
    }

    private static Map<String, Object> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            Yaml yaml = new Yaml();
            Object document = yaml.load(in);
            if (!(document instanceof Map)) {
                throw new EngineCallException("Template " + path + " is not a YAML mapping");
            }
            @SuppressWarnings("unchecked")
            var template = (Map<String, Object>) document;
            return template;
        } catch (IOException e) {
            throw new EngineCallException("Cannot read template " + path, e);
        }
    }

    private static void dump(Path path, Map<String, Object> template) throws IOException {
        var options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(template, out);
        }
    }

    private static Object scannerEntry(ScannerGeometry scanner) {
        if (ScannerRegistry.contains(scanner.getName())
            && ScannerRegistry.get(scanner.getName()).equals(scanner)) {
            return scanner.getName();
        }
        var parameters = new LinkedHashMap<String, Object>();
        parameters.put("name", scanner.getName());
        parameters.put("numRings", scanner.getNumRings());
        parameters.put("numDetectorsPerRing", scanner.getNumDetectorsPerRing());
        parameters.put("innerRingRadius", (double) scanner.getInnerRingRadius());
        parameters.put("ringSpacing", (double) scanner.getRingSpacing());
        parameters.put("averageDepthOfInteraction", (double) scanner.getAverageDepthOfInteraction());
        parameters.put("defaultBinSize", (double) scanner.getDefaultBinSize());
        parameters.put("maxNumNonArcCorrectedBins", scanner.getMaxNumNonArcCorrectedBins());
        parameters.put("defaultNumArcCorrectedBins", scanner.getDefaultNumArcCorrectedBins());
        parameters.put("intrinsicTilt", (double) scanner.getIntrinsicTilt());
        parameters.put("numAxialCrystalsPerBlock", scanner.getNumAxialCrystalsPerBlock());
        parameters.put("numTransaxialCrystalsPerBlock", scanner.getNumTransaxialCrystalsPerBlock());
        parameters.put("numAxialBlocksPerBucket", scanner.getNumAxialBlocksPerBucket());
        parameters.put("numTransaxialBlocksPerBucket", scanner.getNumTransaxialBlocksPerBucket());
        parameters.put("numAxialCrystalsPerSinglesUnit", scanner.getNumAxialCrystalsPerSinglesUnit());
        parameters.put("numTransaxialCrystalsPerSinglesUnit", scanner.getNumTransaxialCrystalsPerSinglesUnit());
        parameters.put("numDetectorLayers", scanner.getNumDetectorLayers());
        return parameters;
    }

    private static ScannerGeometry scanner(Object entry, Path path) {
        if (entry instanceof String) {
            return ScannerGeometry.fromName((String) entry);
        }
        if (!(entry instanceof Map)) {
            throw new EngineCallException("Template " + path + " names no scanner");
        }
        @SuppressWarnings("unchecked")
        var p = (Map<String, Object>) entry;
        var builder = ScannerGeometry.builder()
                .withNumRings(intValue(p, "numRings", 0))
                .withNumDetectorsPerRing(intValue(p, "numDetectorsPerRing", 0))
                .withInnerRingRadius(floatValue(p, "innerRingRadius", 0))
                .withRingSpacing(floatValue(p, "ringSpacing", 0))
                .withAverageDepthOfInteraction(floatValue(p, "averageDepthOfInteraction", 0))
                .withDefaultBinSize(floatValue(p, "defaultBinSize", 0))
                .withMaxNumNonArcCorrectedBins(optionalInt(p, "maxNumNonArcCorrectedBins"))
                .withDefaultNumArcCorrectedBins(optionalInt(p, "defaultNumArcCorrectedBins"))
                .withIntrinsicTilt(floatValue(p, "intrinsicTilt", 0))
                .withAxialCrystalsPerBlock(intValue(p, "numAxialCrystalsPerBlock", 1))
                .withTransaxialCrystalsPerBlock(intValue(p, "numTransaxialCrystalsPerBlock", 1))
                .withAxialBlocksPerBucket(intValue(p, "numAxialBlocksPerBucket", 1))
                .withTransaxialBlocksPerBucket(intValue(p, "numTransaxialBlocksPerBucket", 1))
                .withAxialCrystalsPerSinglesUnit(intValue(p, "numAxialCrystalsPerSinglesUnit", 1))
                .withTransaxialCrystalsPerSinglesUnit(intValue(p, "numTransaxialCrystalsPerSinglesUnit", 1))
                .withNumDetectorLayers(intValue(p, "numDetectorLayers", 1));
        if (p.get("name") instanceof String) {
            builder.withName((String) p.get("name"));
        }
        return builder.build();
    }

    private static int intValue(Map<String, Object> map, String key, int defaultValue) {
        var value = map.get(key);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private static Integer optionalInt(Map<String, Object> map, String key) {
        var value = map.get(key);
        return value == null ? null : ((Number) value).intValue();
    }

    private static float floatValue(Map<String, Object> map, String key, float defaultValue) {
        var value = map.get(key);
        return value == null ? defaultValue : ((Number) value).floatValue();
    }

    private static int[] intTriple(Object value) {
        var list = (List<?>) value;
        if (list.size() != 3) {
            throw new IllegalArgumentException("expected [z, y, x], got " + list);
        }
        return new int[] {((Number) list.get(0)).intValue(), ((Number) list.get(1)).intValue(), ((Number) list.get(2)).intValue()};
    }

    private static float[] floatTriple(Object value) {
        var list = (List<?>) value;
        if (list.size() != 3) {
            throw new IllegalArgumentException("expected [z, y, x], got " + list);
        }
        return new float[] {((Number) list.get(0)).floatValue(), ((Number) list.get(1)).floatValue(), ((Number) list.get(2)).floatValue()};
    }

    /**
     * A volume grid together with the projection data it was derived from.
     */
    public static final class VolumeTemplate {
        private final ProjectionDataGeometry projectionGeometry;
        private final VolumeDescriptor volume;

        VolumeTemplate(ProjectionDataGeometry projectionGeometry, VolumeDescriptor volume) {
            this.projectionGeometry = projectionGeometry;
            this.volume = volume;
        }

        public ProjectionDataGeometry getProjectionGeometry() {
            return projectionGeometry;
        }

        public VolumeDescriptor getVolume() {
            return volume;
        }
    }
}
