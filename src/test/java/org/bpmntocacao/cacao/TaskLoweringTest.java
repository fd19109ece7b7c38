package org.bpmntocacao.cacao;

import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.bpmn.models.FlowNodeType;
import org.bpmntocacao.cacao.models.Command;
import org.bpmntocacao.cacao.models.Step;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.bpmntocacao.cacao.ProcessFixtures.context;
import static org.bpmntocacao.cacao.ProcessFixtures.flow;
import static org.bpmntocacao.cacao.ProcessFixtures.register;
import static org.junit.jupiter.api.Assertions.*;

class TaskLoweringTest {

    @Test
    void shouldLinkTaskToItsSuccessor() {
        FlowNode task = FlowNode.builder()
                .id("Task_1")
                .type(FlowNodeType.SERVICE_TASK)
                .name("Query threat intel")
                .documentation("GET /indicators")
                .outgoing(List.of("Flow_1"))
                .build();
        ConversionContext context = context(CacaoSpecVersion.V2_0, flow("Flow_1", "Task_1", "End_1"));
        register(context, StepKind.ACTION, "Task_1");
        register(context, StepKind.END, "End_1");

        String stepId = TaskLowering.lower(task, CommandType.HTTP_API, context);

        assertEquals(context.stepIdOf("Task_1").orElseThrow(), stepId);
        Step step = context.playbook().workflow.get(stepId);
        assertEquals("action", step.type());
        assertEquals("Query threat intel", step.name());
        assertEquals(context.stepIdOf("End_1").orElseThrow(), step.onCompletion());
        assertEquals(List.of(new Command("http-api", "Query threat intel", "GET /indicators")), step.commands());
        assertEquals(0, context.synthesizedEndSteps());
    }

    @Test
    void shouldSynthesizeEndWhenTaskHasNoSuccessor() {
        FlowNode task = new FlowNode("Task_1", FlowNodeType.SCRIPT_TASK, "Collect logs");
        ConversionContext context = context(CacaoSpecVersion.V2_0);
        register(context, StepKind.ACTION, "Task_1");

        String stepId = TaskLowering.lower(task, CommandType.BASH, context);

        Step step = context.playbook().workflow.get(stepId);
        Step end = context.playbook().workflow.get(step.onCompletion());
        assertNotNull(end);
        assertEquals("end", end.type());
        assertEquals("End", end.name());
        assertTrue(step.onCompletion().startsWith("end--"));
        assertEquals(2, context.playbook().workflow.size());
        assertEquals(1, context.synthesizedEndSteps());
    }

    @Test
    void shouldSynthesizeEndWhenSuccessorIsNotAStep() {
        FlowNode task = new FlowNode("Task_1", FlowNodeType.TASK, "Review");
        ConversionContext context = context(CacaoSpecVersion.V2_0, flow("Flow_1", "Task_1", "SubProcess_1"));
        register(context, StepKind.ACTION, "Task_1");

        String stepId = TaskLowering.lower(task, CommandType.MANUAL, context);

        assertEquals(1, context.synthesizedEndSteps());
        assertEquals("end", context.playbook().workflow.get(
                context.playbook().workflow.get(stepId).onCompletion()).type());
    }

    @Test
    void shouldTypePromotedStartAsStart() {
        FlowNode catchEvent = new FlowNode("Catch_1", FlowNodeType.INTERMEDIATE_CATCH_EVENT, "Alert received");
        ConversionContext context = context(CacaoSpecVersion.V2_0, flow("Flow_1", "Catch_1", "Task_1"));
        register(context, StepKind.START, "Catch_1");
        register(context, StepKind.ACTION, "Task_1");
        context.declareStart(context.stepIdOf("Catch_1").orElseThrow());

        String stepId = TaskLowering.lower(catchEvent, CommandType.MANUAL, context);

        assertEquals(context.startStepId(), stepId);
        Step step = context.playbook().workflow.get(stepId);
        assertEquals("start", step.type());
        assertEquals(context.stepIdOf("Task_1").orElseThrow(), step.onCompletion());
        assertEquals("manual", step.commands().get(0).type());
    }

    @Test
    void shouldUseSingleTypeForVersion11() {
        FlowNode task = new FlowNode("Task_1", FlowNodeType.USER_TASK, "Approve");
        ConversionContext context = context(CacaoSpecVersion.V1_1, flow("Flow_1", "Task_1", "End_1"));
        register(context, StepKind.ACTION, "Task_1");
        register(context, StepKind.END, "End_1");

        String stepId = TaskLowering.lower(task, CommandType.MANUAL, context);

        assertTrue(stepId.startsWith("step--"));
        assertEquals("single", context.playbook().workflow.get(stepId).type());
    }
}
