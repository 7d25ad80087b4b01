package com.bizflow.process.core.engine.definition;

import com.bizflow.process.core.engine.definition.storage.ProcessDefinitionSerializer;
import com.bizflow.process.core.engine.definition.storage.ProcessDefinitionSerializer.Format;
import com.bizflow.process.core.engine.registry.ProcessDefinitionRegistry;
import com.bizflow.process.core.engine.registry.ProcessDefinitionRegistryHolder;
import com.bizflow.process.core.exception.definition.ProcessDefinitionDocumentException;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a persisted definition document and publishes it through the registry holder.
 *
 * <p>Locations prefixed with {@code classpath:} are resolved against the loader's class loader,
 * anything else is a file system path. Files ending in {@code .json} are read as JSON, all
 * others as YAML.</p>
 */
@Slf4j
public class ProcessDefinitionLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final ProcessDefinitionRegistryHolder registryHolder;
    private final ClassLoader classLoader;

    public ProcessDefinitionLoader(ProcessDefinitionRegistryHolder registryHolder) {
        this(registryHolder, ProcessDefinitionLoader.class.getClassLoader());
    }

    public ProcessDefinitionLoader(ProcessDefinitionRegistryHolder registryHolder, ClassLoader classLoader) {
        this.registryHolder = registryHolder;
        this.classLoader = classLoader;
    }

    /**
     * Reads, validates and activates the document at {@code location}.
     */
    public ProcessDefinitionRegistry load(String location) {
        ProcessDocumentSource document = read(location);
        log.info("Loading process definitions from {}", location);
        return registryHolder.reload(document);
    }

    public ProcessDocumentSource read(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Definition location cannot be empty");
        }
        Format format = Format.fromLocation(location);
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return readClasspath(location.substring(CLASSPATH_PREFIX.length()), format);
        }
        return readFile(Path.of(location), format);
    }

    private ProcessDocumentSource readClasspath(String resource, Format format) {
        String normalized = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream input = classLoader.getResourceAsStream(normalized)) {
            if (input == null) {
                throw new ProcessDefinitionDocumentException("Definition resource not found on classpath: " + resource, null);
            }
            return ProcessDefinitionSerializer.read(input, format);
        } catch (IOException e) {
            log.error("Failed to close definition resource {}", resource, e);
            throw new ProcessDefinitionDocumentException("Failed to read definition resource: " + resource, e);
        }
    }

    private ProcessDocumentSource readFile(Path path, Format format) {
        try (InputStream input = Files.newInputStream(path)) {
            return ProcessDefinitionSerializer.read(input, format);
        } catch (IOException e) {
            log.error("Failed to read definition file {}", path, e);
            throw new ProcessDefinitionDocumentException("Failed to read definition file: " + path, e);
        }
    }
}
