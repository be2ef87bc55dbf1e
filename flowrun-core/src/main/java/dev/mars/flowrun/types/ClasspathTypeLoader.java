/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowrun.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads node and credential types from every type catalogue resource on the classpath.
 *
 * <p>A catalogue is a JSON document {@code { "nodeTypes": [...], "credentialTypes": [...] }}.
 * Catalogues are read in classpath order; a later definition of a type name replaces an earlier one,
 * so packages can override the built-in catalogue shipped with this module.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class ClasspathTypeLoader implements TypeLoader {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathTypeLoader.class);

    private final String resourceName;
    private final ClassLoader classLoader;
    private final ObjectMapper objectMapper;

    public ClasspathTypeLoader(String resourceName) {
        this(resourceName, Thread.currentThread().getContextClassLoader());
    }

    public ClasspathTypeLoader(String resourceName, ClassLoader classLoader) {
        this.resourceName = Objects.requireNonNull(resourceName, "Resource name cannot be null");
        this.classLoader = classLoader != null ? classLoader : ClasspathTypeLoader.class.getClassLoader();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public LoadedTypes load() throws IOException {
        Map<String, NodeType> nodeTypes = new LinkedHashMap<>();
        Map<String, CredentialType> credentialTypes = new LinkedHashMap<>();

        Enumeration<URL> resources = classLoader.getResources(resourceName);
        int catalogues = 0;
        while (resources.hasMoreElements()) {
            URL url = resources.nextElement();
            TypeCatalogue catalogue;
            try (InputStream input = url.openStream()) {
                catalogue = objectMapper.readValue(input, TypeCatalogue.class);
            } catch (IOException e) {
                throw new IOException("Failed to read type catalogue " + url + ": " + e.getMessage(), e);
            }
            catalogue.nodeTypes.forEach(type -> nodeTypes.put(type.getName(), type));
            catalogue.credentialTypes.forEach(type -> credentialTypes.put(type.getName(), type));
            catalogues++;
            logger.debug("Read type catalogue {}", url);
        }

        if (catalogues == 0) {
            logger.warn("No type catalogue named {} found on the classpath", resourceName);
        }
        logger.info("Loaded {} node types and {} credential types from {} catalogue(s)",
                nodeTypes.size(), credentialTypes.size(), catalogues);
        return new LoadedTypes(nodeTypes, credentialTypes);
    }

    static final class TypeCatalogue {
        final List<NodeType> nodeTypes;
        final List<CredentialType> credentialTypes;

        @JsonCreator
        TypeCatalogue(@JsonProperty("nodeTypes") List<NodeType> nodeTypes,
                      @JsonProperty("credentialTypes") List<CredentialType> credentialTypes) {
            this.nodeTypes = nodeTypes != null ? nodeTypes : List.of();
            this.credentialTypes = credentialTypes != null ? credentialTypes : List.of();
        }
    }
}
