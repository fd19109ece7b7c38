package org.bpmntocacao.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.cacao.CacaoSpecVersion;
import org.bpmntocacao.config.models.ConverterConfig;
import org.bpmntocacao.config.models.PlaybookMetadata;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class ConverterConfigHelper {
    private static final String DEFAULT_CONFIG_RESOURCE_PATH = "config/default_config.json";
    private static final String SCHEMA_RESOURCE_PATH = "config/config_validation_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the built-in defaults bundled with the converter.
     */
    public static ConverterConfig loadDefaultConfig() {
        try (InputStream in = ConverterConfigHelper.class.getClassLoader()
                .getResourceAsStream(DEFAULT_CONFIG_RESOURCE_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Default config resource not found: " + DEFAULT_CONFIG_RESOURCE_PATH);
            }
            return mapper.readValue(in, ConverterConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read default config", e);
        }
    }

    public static ConverterConfig loadConfigFile(String configFilePath) throws IOException {
        return mapper.readValue(new File(configFilePath), ConverterConfig.class);
    }

    /**
     * Validates a user config file against the bundled schema.
     *
     * @param configFilePath path of the config file
     * @throws IllegalArgumentException if the file is missing, not JSON, or violates the schema
     */
    public static void validateConfigFile(String configFilePath) {
        File configFile = new File(configFilePath);
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Config file not found: " + configFilePath);
        }

        try (InputStream schemaStream = ConverterConfigHelper.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            JsonNode configNode = mapper.readTree(configFile);

            Set<ValidationMessage> result = schema.validate(configNode);
            if (!result.isEmpty()) {
                result.forEach(e -> log.error("Config {}: {}", configFilePath, e.getMessage()));
                throw new IllegalArgumentException("Config file " + configFilePath + " is invalid: "
                        + result.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Config file " + configFilePath + " could not be read", e);
        }
    }

    /**
     * Overlays the fields set in {@code override} onto {@code base}. Metadata is replaced as a whole.
     *
     * @return a new config, neither argument is modified
     */
    public static ConverterConfig merge(ConverterConfig base, ConverterConfig override) {
        ConverterConfig merged = new ConverterConfig();
        merged.cacaoSpecVersion = pick(override.cacaoSpecVersion, base.cacaoSpecVersion);
        merged.outputDir = pick(override.outputDir, base.outputDir);
        merged.outputSuffix = pick(override.outputSuffix, base.outputSuffix);
        merged.validateInput = pick(override.validateInput, base.validateInput);
        merged.validateOutput = pick(override.validateOutput, base.validateOutput);
        merged.metadata = pick(override.metadata, base.metadata);
        return merged;
    }

    public static CacaoSpecVersion resolveSpecVersion(ConverterConfig config) {
        return CacaoSpecVersion.fromValue(config.cacaoSpecVersion);
    }

    public static PlaybookMetadata metadataOrEmpty(ConverterConfig config) {
        return config.metadata != null ? config.metadata : new PlaybookMetadata();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
