package com.bizflow.process.core.engine.definition.storage;

import com.bizflow.process.core.exception.definition.ProcessDefinitionDocumentException;
import com.bizflow.process.integration.models.definition.EntityDefinition;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.RoleDefinition;
import com.bizflow.process.integration.models.definition.StepBranchDefinition;
import com.bizflow.process.integration.models.definition.StepDefinition;
import com.bizflow.process.integration.models.definition.TransitionDefinition;
import com.bizflow.process.integration.models.source.BranchSource;
import com.bizflow.process.integration.models.source.EntityFieldSource;
import com.bizflow.process.integration.models.source.EntitySource;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import com.bizflow.process.integration.models.source.ProcessSource;
import com.bizflow.process.integration.models.source.ProjectInfoSource;
import com.bizflow.process.integration.models.source.RoleSource;
import com.bizflow.process.integration.models.source.StateSource;
import com.bizflow.process.integration.models.source.StepSource;
import com.bizflow.process.integration.models.source.TransitionSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads and writes process definition documents as YAML or JSON.
 *
 * <p>Supports:</p>
 * <ul>
 *   <li>Parsing a document into its source model</li>
 *   <li>Rendering validated definitions back to the document form</li>
 *   <li>Human-readable YAML output and indented JSON output</li>
 * </ul>
 */
@Slf4j
public final class ProcessDefinitionSerializer {

    public enum Format {
        YAML,
        JSON;

        public static Format fromLocation(String location) {
            return location != null && location.toLowerCase().endsWith(".json") ? JSON : YAML;
        }
    }

    private static final ObjectMapper JSON_MAPPER;
    private static final ObjectMapper YAML_MAPPER;

    static {
        JSON_MAPPER = new ObjectMapper();
        configureMapper(JSON_MAPPER);

        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        YAML_MAPPER = new ObjectMapper(yamlFactory);
        configureMapper(YAML_MAPPER);
    }

    private static void configureMapper(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_EMPTY);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private ProcessDefinitionSerializer() {
        // Utility class
    }

    // ========================================================================
    // READING
    // ========================================================================

    public static ProcessDocumentSource fromYaml(String yaml) {
        return read(yaml, Format.YAML);
    }

    public static ProcessDocumentSource fromJson(String json) {
        return read(json, Format.JSON);
    }

    public static ProcessDocumentSource read(String content, Format format) {
        try {
            return mapper(format).readValue(content, ProcessDocumentSource.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse definition document as {}: {}", format, e.getOriginalMessage(), e);
            throw new ProcessDefinitionDocumentException("Failed to parse definition document as " + format, e);
        }
    }

    public static ProcessDocumentSource read(InputStream input, Format format) {
        try {
            return mapper(format).readValue(input, ProcessDocumentSource.class);
        } catch (IOException e) {
            log.error("Failed to read definition document as {}: {}", format, e.getMessage(), e);
            throw new ProcessDefinitionDocumentException("Failed to read definition document as " + format, e);
        }
    }

    // ========================================================================
    // WRITING
    // ========================================================================

    public static String toYaml(ProcessDocumentSource document) {
        return write(document, Format.YAML);
    }

    public static String toJson(ProcessDocumentSource document) {
        return write(document, Format.JSON);
    }

    public static String write(ProcessDocumentSource document, Format format) {
        try {
            return mapper(format).writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize definition document to {}: {}", format, e.getMessage(), e);
            throw new ProcessDefinitionDocumentException("Failed to serialize definition document to " + format, e);
        }
    }

    /**
     * Document form of validated definitions. Project information is taken from the first definition.
     * Validating the result yields definitions equal to the input.
     */
    public static ProcessDocumentSource toDocument(Collection<ProcessDefinition> definitions) {
        ProjectInfoSource project = definitions.stream().findFirst()
                .map(first -> ProjectInfoSource.builder()
                        .name(first.getProjectName())
                        .description(first.getDescription())
                        .version(first.getVersion())
                        .author(first.getAuthor())
                        .build())
                .orElseGet(ProjectInfoSource::new);
        return ProcessDocumentSource.builder()
                .project(project)
                .processes(definitions.stream()
                        .map(ProcessDefinitionSerializer::toSource)
                        .collect(Collectors.toList()))
                .build();
    }

    public static ProcessSource toSource(ProcessDefinition definition) {
        return ProcessSource.builder()
                .name(definition.getName())
                .initialState(definition.getInitialState().getName())
                .entities(definition.getEntities().stream()
                        .map(ProcessDefinitionSerializer::toSource)
                        .collect(Collectors.toList()))
                .roles(definition.getRoles().stream()
                        .map(role -> toSource(definition, role))
                        .collect(Collectors.toList()))
                .states(definition.getStates().stream()
                        .map(state -> new StateSource(state.getName()))
                        .collect(Collectors.toList()))
                .steps(definition.getSteps().stream()
                        .map(step -> toSource(definition, step))
                        .collect(Collectors.toList()))
                .transitions(definition.getTransitions().stream()
                        .map(transition -> toSource(definition, transition))
                        .collect(Collectors.toList()))
                .flow(definition.flowSteps().stream()
                        .map(StepDefinition::getName)
                        .collect(Collectors.toList()))
                .build();
    }

    private static EntitySource toSource(EntityDefinition entity) {
        return EntitySource.builder()
                .name(entity.getName())
                .fields(entity.getFields().stream()
                        .map(field -> EntityFieldSource.builder()
                                .name(field.getName())
                                .type(field.getType().getKeyword())
                                .variants(new ArrayList<>(field.getVariants()))
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private static RoleSource toSource(ProcessDefinition definition, RoleDefinition role) {
        List<String> supervises = definition.getRoles().stream()
                .filter(other -> other.getSupervisorIndex() == role.getIndex())
                .map(RoleDefinition::getName)
                .collect(Collectors.toList());
        return RoleSource.builder()
                .name(role.getName())
                .supervises(supervises)
                .build();
    }

    private static StepSource toSource(ProcessDefinition definition, StepDefinition step) {
        return StepSource.builder()
                .name(step.getName())
                .role(definition.roleName(step.getRoleIndex()))
                .entity(step.hasEntity() ? definition.getEntities().get(step.getEntityIndex()).getName() : null)
                .dependsOn(step.getDependsOn().stream()
                        .map(index -> definition.getStep(index).getName())
                        .collect(Collectors.toList()))
                .auto(step.isAuto())
                .onComplete(step.getBranches().stream()
                        .map(branch -> toSource(definition, branch))
                        .collect(Collectors.toList()))
                .build();
    }

    private static BranchSource toSource(ProcessDefinition definition, StepBranchDefinition branch) {
        BranchSource source = new BranchSource();
        source.setCondition(branch.getCondition());
        if (branch.getTargetKind() == StepBranchDefinition.TargetKind.TRANSITION) {
            source.setTransition(definition.getTransition(branch.getTargetIndex()).getName());
        } else {
            source.setStep(definition.getStep(branch.getTargetIndex()).getName());
        }
        return source;
    }

    private static TransitionSource toSource(ProcessDefinition definition, TransitionDefinition transition) {
        return TransitionSource.builder()
                .name(transition.getName())
                .from(definition.getState(transition.getFromStateIndex()).getName())
                .to(definition.getState(transition.getToStateIndex()).getName())
                .by(definition.roleName(transition.getRoleIndex()))
                .build();
    }

    private static ObjectMapper mapper(Format format) {
        return format == Format.JSON ? JSON_MAPPER : YAML_MAPPER;
    }
}
