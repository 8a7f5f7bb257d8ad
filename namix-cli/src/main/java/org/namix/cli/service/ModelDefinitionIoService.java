package org.namix.cli.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.namix.cli.definition.ModelDefinition;
import org.namix.cli.report.NamingReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads model definitions and renders naming reports.
 */
public class ModelDefinitionIoService {

    /**
     * Supported report formats.
     */
    public enum Format {
        JSON, YAML;

        public static Format fromString(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported format: " + value + " (expected json or yaml)", e);
            }
        }
    }

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public ModelDefinitionIoService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads a YAML model definition.
     *
     * @throws IOException if the file is missing or cannot be parsed
     */
    public ModelDefinition loadDefinition(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Model definition not found: " + file);
        }
        ModelDefinition definition = yamlMapper.readValue(file.toFile(), ModelDefinition.class);
        if (definition == null) {
            throw new IOException("Model definition is empty: " + file);
        }
        return definition;
    }

    public String render(NamingReport report, Format format) throws IOException {
        ObjectMapper mapper = format == Format.YAML ? yamlMapper : jsonMapper;
        return mapper.writeValueAsString(report);
    }

    /**
     * Writes the rendered report, creating parent directories as needed.
     */
    public void write(String rendered, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(out, rendered);
    }
}
