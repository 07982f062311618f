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

import io.github.petgeom.exceptions.EngineCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Discovers {@link ProjectionEngine} implementations registered under
 * {@code META-INF/services/io.github.petgeom.engine.ProjectionEngine}.
 */
public final class ProjectionEngines {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionEngines.class);

    /** Name of the engine selected when none is asked for. */
    public static final String DEFAULT_ENGINE = "raytrace";

    private ProjectionEngines() {
    }

    /**
     * @return every engine on the class path, in service-loader order
     */
    public static List<ProjectionEngine> load() {
        var engines = new ArrayList<ProjectionEngine>();
        for (ProjectionEngine engine : ServiceLoader.load(ProjectionEngine.class)) {
            engines.add(engine);
        }
        return engines;
    }

    /**
     * @param name the engine name, see {@link ProjectionEngine#name()}
     * @throws EngineCallException if no engine of that name is registered
     */
    public static ProjectionEngine get(String name) {
        var engines = load();
        for (var engine : engines) {
            if (engine.name().equalsIgnoreCase(name)) {
                logger.debug("Using projection engine {} ({})", engine.name(), engine.getClass().getName());
                return engine;
            }
        }
        var names = engines.stream().map(ProjectionEngine::name).collect(Collectors.toList());
        throw new EngineCallException("No projection engine named '" + name + "'; available engines are " + names);
    }

    /**
     * @return the {@link #DEFAULT_ENGINE}
     */
    public static ProjectionEngine getDefault() {
        return get(DEFAULT_ENGINE);
    }
}
