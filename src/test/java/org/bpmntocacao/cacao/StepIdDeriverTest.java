package org.bpmntocacao.cacao;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StepIdDeriverTest {

    @Test
    void shouldDeriveKnownUuids() {
        assertEquals(UUID.fromString("ca64a3ba-3f7a-5563-9984-a18583d3ec68"),
                StepIdDeriver.deriveUuid("StartEvent_1"));
        assertEquals(UUID.fromString("dfe16a23-733f-5ff0-8850-20f9d4b97e3d"),
                StepIdDeriver.deriveUuid("Activity_18ru9dm"));
    }

    @Test
    void shouldSetVersionAndVariantBits() {
        UUID uuid = StepIdDeriver.deriveUuid("Gateway_1hblfsj");

        assertEquals(5, uuid.version());
        assertEquals(2, uuid.variant());
    }

    @Test
    void shouldBeDeterministic() {
        assertEquals(StepIdDeriver.deriveStepId("Activity_1", StepKind.ACTION, CacaoSpecVersion.V2_0),
                StepIdDeriver.deriveStepId("Activity_1", StepKind.ACTION, CacaoSpecVersion.V2_0));
        assertNotEquals(StepIdDeriver.deriveUuid("Activity_1"), StepIdDeriver.deriveUuid("Activity_2"));
    }

    @Test
    void shouldPrefixByKindForVersion20() {
        assertEquals("start--ca64a3ba-3f7a-5563-9984-a18583d3ec68",
                StepIdDeriver.deriveStepId("StartEvent_1", StepKind.START, CacaoSpecVersion.V2_0));
        assertEquals("action--dfe16a23-733f-5ff0-8850-20f9d4b97e3d",
                StepIdDeriver.deriveStepId("Activity_18ru9dm", StepKind.ACTION, CacaoSpecVersion.V2_0));
        assertTrue(StepIdDeriver.deriveStepId("Gateway_1", StepKind.SWITCH_CONDITION, CacaoSpecVersion.V2_0)
                .startsWith("switch-condition--"));
    }

    @Test
    void shouldUseStepPrefixForVersion11() {
        assertEquals("step--ca64a3ba-3f7a-5563-9984-a18583d3ec68",
                StepIdDeriver.deriveStepId("StartEvent_1", StepKind.START, CacaoSpecVersion.V1_1));
        assertEquals("step--dfe16a23-733f-5ff0-8850-20f9d4b97e3d",
                StepIdDeriver.deriveStepId("Activity_18ru9dm", StepKind.ACTION, CacaoSpecVersion.V1_1));
    }

    @Test
    void shouldDerivePlaybookIdFromProcessId() {
        assertEquals("playbook--6448d80f-ada1-5800-bf08-11d19cb3cecf",
                StepIdDeriver.derivePlaybookId("ProcessAV-EDRAlert"));
    }

    @Test
    void shouldGenerateDistinctRandomIds() {
        String first = StepIdDeriver.randomStepId(StepKind.END, CacaoSpecVersion.V2_0);
        String second = StepIdDeriver.randomStepId(StepKind.END, CacaoSpecVersion.V2_0);

        assertNotEquals(first, second);
        assertTrue(first.matches("end--[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
