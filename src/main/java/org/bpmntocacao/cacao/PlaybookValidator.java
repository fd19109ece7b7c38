package org.bpmntocacao.cacao;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks rendered playbooks against the bundled CACAO JSON schema
 * (envelope fields, step types, command shape).
 */
public class PlaybookValidator {
    private static final String SCHEMA_RESOURCE_PATH = "schemas/cacao_playbook_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static JsonSchema schema;

    public static Set<ValidationMessage> validate(String playbookJson) {
        try {
            JsonNode playbookNode = mapper.readTree(playbookJson);
            return getSchema().validate(playbookNode);
        } catch (IOException e) {
            throw new IllegalArgumentException("Playbook is not valid JSON", e);
        }
    }

    public static void validateOrThrow(String playbookJson) {
        Set<ValidationMessage> result = validate(playbookJson);
        if (!result.isEmpty()) {
            throw new IllegalStateException("Playbook does not match the CACAO schema: "
                    + result.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
        }
    }

    private static synchronized JsonSchema getSchema() {
        if (schema == null) {
            try (InputStream schemaStream = PlaybookValidator.class.getClassLoader()
                    .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
                if (schemaStream == null) {
                    throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
                }
                schema = factory.getSchema(mapper.readTree(schemaStream));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load schema " + SCHEMA_RESOURCE_PATH, e);
            }
        }
        return schema;
    }
}
