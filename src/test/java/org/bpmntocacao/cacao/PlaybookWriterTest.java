package org.bpmntocacao.cacao;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bpmntocacao.cacao.models.CacaoPlaybook;
import org.bpmntocacao.cacao.models.Step;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaybookWriterTest {
    private static final ObjectMapper mapper = new ObjectMapper();

    private static CacaoPlaybook playbook() {
        CacaoPlaybook playbook = new CacaoPlaybook();
        playbook.specVersion = "2.0";
        playbook.id = StepIdDeriver.derivePlaybookId("Process_1");
        playbook.name = "Example";
        playbook.created = "2024-03-01T12:00:00.123Z";
        playbook.modified = playbook.created;
        playbook.workflowStart = "start--ca64a3ba-3f7a-5563-9984-a18583d3ec68";
        playbook.workflow.put(playbook.workflowStart, Step.builder()
                .type("start")
                .name("Start")
                .onCompletion("end--dfe16a23-733f-5ff0-8850-20f9d4b97e3d")
                .build());
        playbook.workflow.put("end--dfe16a23-733f-5ff0-8850-20f9d4b97e3d", Step.builder()
                .type("end")
                .name("End")
                .build());
        return playbook;
    }

    @Test
    void shouldRenderSnakeCaseFieldsAndOmitEmptyOnes() throws IOException {
        JsonNode json = mapper.readTree(PlaybookWriter.toJson(playbook()));

        assertEquals("playbook", json.get("type").asText());
        assertEquals("2.0", json.get("spec_version").asText());
        assertEquals("start--ca64a3ba-3f7a-5563-9984-a18583d3ec68", json.get("workflow_start").asText());
        assertEquals("end--dfe16a23-733f-5ff0-8850-20f9d4b97e3d",
                json.get("workflow").get("start--ca64a3ba-3f7a-5563-9984-a18583d3ec68").get("on_completion").asText());

        assertFalse(json.has("playbook_variables"));
        assertFalse(json.has("labels"));
        assertFalse(json.has("revoked"));
        assertFalse(json.has("priority"));

        JsonNode end = json.get("workflow").get("end--dfe16a23-733f-5ff0-8850-20f9d4b97e3d");
        assertFalse(end.has("on_completion"));
        assertFalse(end.has("commands"));
    }

    @Test
    void shouldKeepWorkflowInsertionOrder() throws IOException {
        JsonNode json = mapper.readTree(PlaybookWriter.toJson(playbook()));

        List<String> stepIds = new ArrayList<>();
        json.get("workflow").fieldNames().forEachRemaining(stepIds::add);
        assertEquals(List.of(
                "start--ca64a3ba-3f7a-5563-9984-a18583d3ec68",
                "end--dfe16a23-733f-5ff0-8850-20f9d4b97e3d"), stepIds);
    }

    @Test
    void shouldWritePlaybookNextToInputName(@TempDir Path tempDir) throws IOException {
        Path outputDir = tempDir.resolve("nested/out");

        Path written = PlaybookWriter.writePlaybook(playbook(), outputDir, "alert.bpmn");

        assertEquals(outputDir.resolve("alert.bpmn.cacao.json"), written);
        assertEquals(PlaybookWriter.toJson(playbook()), Files.readString(written, StandardCharsets.UTF_8));
    }

    @Test
    void shouldUseCustomSuffix(@TempDir Path tempDir) {
        Path written = PlaybookWriter.writePlaybook("{}", tempDir, "alert.bpmn", ".playbook.json");

        assertEquals("alert.bpmn.playbook.json", written.getFileName().toString());
        assertTrue(Files.isRegularFile(written));
    }
}
