package org.bpmntocacao.config;

import org.bpmntocacao.cacao.CacaoSpecVersion;
import org.bpmntocacao.config.models.ConverterConfig;
import org.bpmntocacao.config.models.PlaybookMetadata;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigHelperTest {
    private static final String VALID_CONFIG = "src/test/resources/config/config_valid.json";
    private static final String INVALID_CONFIG = "src/test/resources/config/config_invalid.json";

    @Test
    void shouldLoadDefaultConfig() {
        ConverterConfig config = ConverterConfigHelper.loadDefaultConfig();

        assertEquals("1.1", config.cacaoSpecVersion);
        assertEquals(".", config.outputDir);
        assertEquals(".cacao.json", config.outputSuffix);
        assertFalse(config.validateInput);
        assertTrue(config.validateOutput);
        assertEquals(CacaoSpecVersion.V1_1, ConverterConfigHelper.resolveSpecVersion(config));
    }

    @Test
    void shouldLoadConfigFile() throws IOException {
        ConverterConfig config = ConverterConfigHelper.loadConfigFile(VALID_CONFIG);

        assertEquals("2.0", config.cacaoSpecVersion);
        assertEquals(".playbook.json", config.outputSuffix);
        assertNull(config.outputDir);
        assertNotNull(config.metadata);
        assertEquals(List.of("investigation"), config.metadata.playbookTypes);
        assertEquals("Source diagram", config.metadata.externalReferences.get(0).name());
        assertEquals("https://example.org/diagrams/phishing", config.metadata.externalReferences.get(0).url());
    }

    @Test
    void shouldValidateConfigFile() {
        assertDoesNotThrow(() -> ConverterConfigHelper.validateConfigFile(VALID_CONFIG));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConverterConfigHelper.validateConfigFile(INVALID_CONFIG));
        assertTrue(e.getMessage().contains("is invalid"));

        assertThrows(IllegalArgumentException.class,
                () -> ConverterConfigHelper.validateConfigFile("src/test/resources/config/missing.json"));
    }

    @Test
    void shouldOverlaySetFieldsOnly() throws IOException {
        ConverterConfig merged = ConverterConfigHelper.merge(
                ConverterConfigHelper.loadDefaultConfig(), ConverterConfigHelper.loadConfigFile(VALID_CONFIG));

        assertEquals("2.0", merged.cacaoSpecVersion);
        assertEquals(".", merged.outputDir);
        assertEquals(".playbook.json", merged.outputSuffix);
        assertTrue(merged.validateOutput);
        assertEquals(List.of("converted"), merged.metadata.labels);
        assertEquals(CacaoSpecVersion.V2_0, ConverterConfigHelper.resolveSpecVersion(merged));
    }

    @Test
    void shouldRejectUnsupportedSpecVersion() {
        ConverterConfig config = new ConverterConfig();
        config.cacaoSpecVersion = "3.0";

        assertThrows(IllegalArgumentException.class, () -> ConverterConfigHelper.resolveSpecVersion(config));
    }

    @Test
    void shouldFallBackToEmptyMetadata() {
        ConverterConfig config = new ConverterConfig();

        PlaybookMetadata metadata = ConverterConfigHelper.metadataOrEmpty(config);

        assertNotNull(metadata);
        assertNull(metadata.createdBy);
    }
}
