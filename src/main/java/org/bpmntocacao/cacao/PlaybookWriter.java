package org.bpmntocacao.cacao;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bpmntocacao.cacao.models.CacaoPlaybook;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders playbooks as CACAO JSON documents.
 */
public class PlaybookWriter {
    public static final String DEFAULT_SUFFIX = ".cacao.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    public static String toJson(CacaoPlaybook playbook) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(playbook);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render playbook " + playbook.id, e);
        }
    }

    /**
     * Writes already rendered playbook JSON next to other outputs in {@code outputDir}.
     *
     * @param json          the rendered playbook
     * @param outputDir     the directory to write to, created if missing
     * @param inputFileName base name of the BPMN file the playbook came from
     * @param suffix        appended to the input file name, e.g. ".cacao.json"
     * @return the path of the written file
     */
    public static Path writePlaybook(String json, Path outputDir, String inputFileName, String suffix) {
        Path outputPath = outputDir.resolve(inputFileName + suffix);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(outputPath, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write playbook to " + outputPath, e);
        }
        return outputPath;
    }

    public static Path writePlaybook(CacaoPlaybook playbook, Path outputDir, String inputFileName) {
        return writePlaybook(toJson(playbook), outputDir, inputFileName, DEFAULT_SUFFIX);
    }
}
