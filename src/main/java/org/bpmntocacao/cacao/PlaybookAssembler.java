package org.bpmntocacao.cacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.models.BpmnDefinitions;
import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.bpmn.models.FlowNodeType;
import org.bpmntocacao.bpmn.models.ProcessDef;
import org.bpmntocacao.cacao.models.CacaoPlaybook;
import org.bpmntocacao.cacao.models.Step;
import org.bpmntocacao.config.models.PlaybookMetadata;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts a parsed BPMN document into a CACAO playbook.
 *
 * <p>All nodes are classified and all transitions indexed before any step is built.
 * Steps are then built category by category in a fixed order, so the same input
 * always produces the same workflow. Only a document without exactly one process
 * fails; dangling transitions are repaired with new end steps, gateways that fit
 * no step type are left out, and a process with nothing to start from gets an empty
 * {@code workflow_start}.
 */
@Slf4j
public class PlaybookAssembler {
    private static final String END_STEP_NAME = "End";
    // written when the process has neither a start nor a catch event
    private static final String NO_WORKFLOW_START = "";

    // lowering order and command type per task-like category
    private static final Map<FlowNodeType, CommandType> TASK_COMMAND_TYPES = new LinkedHashMap<>();

    static {
        TASK_COMMAND_TYPES.put(FlowNodeType.SERVICE_TASK, CommandType.HTTP_API);
        TASK_COMMAND_TYPES.put(FlowNodeType.USER_TASK, CommandType.MANUAL);
        TASK_COMMAND_TYPES.put(FlowNodeType.MANUAL_TASK, CommandType.MANUAL);
        TASK_COMMAND_TYPES.put(FlowNodeType.SCRIPT_TASK, CommandType.BASH);
        TASK_COMMAND_TYPES.put(FlowNodeType.SEND_TASK, CommandType.BASH);
        TASK_COMMAND_TYPES.put(FlowNodeType.TASK, CommandType.MANUAL);
        TASK_COMMAND_TYPES.put(FlowNodeType.INTERMEDIATE_THROW_EVENT, CommandType.MANUAL);
    }

    private final CacaoSpecVersion specVersion;
    private final PlaybookMetadata metadata;
    private final Clock clock;

    public PlaybookAssembler(CacaoSpecVersion specVersion) {
        this(specVersion, null, Clock.systemUTC());
    }

    public PlaybookAssembler(CacaoSpecVersion specVersion, PlaybookMetadata metadata, Clock clock) {
        this.specVersion = specVersion;
        this.metadata = metadata;
        this.clock = clock;
    }

    public static CommandType commandTypeFor(FlowNodeType type) {
        return TASK_COMMAND_TYPES.get(type);
    }

    public CacaoPlaybook assemble(BpmnDefinitions definitions) throws ConversionException {
        if (definitions.processes().size() != 1) {
            throw new ConversionException(
                    "unexpected number of process definitions: " + definitions.processes().size());
        }
        ProcessDef process = definitions.processes().get(0);

        ConversionContext context = new ConversionContext(
                specVersion, TransitionIndex.build(process.sequenceFlows()), createEnvelope(process));
        NodeClassifier.classify(process, context);
        if (!context.hasStart()) {
            log.warn("Process {} has neither a start event nor a catch event to start from", process.id());
        }

        lowerStartEvent(process, context);
        for (FlowNode catchEvent : process.nodesOfType(FlowNodeType.INTERMEDIATE_CATCH_EVENT)) {
            TaskLowering.lower(catchEvent, CommandType.MANUAL, context);
        }
        for (FlowNode endEvent : process.nodesOfType(FlowNodeType.END_EVENT)) {
            lowerEndEvent(endEvent, context);
        }
        TASK_COMMAND_TYPES.forEach((type, commandType) -> {
            for (FlowNode task : process.nodesOfType(type)) {
                TaskLowering.lower(task, commandType, context);
            }
        });
        for (FlowNode gateway : process.nodesOfType(FlowNodeType.EXCLUSIVE_GATEWAY)) {
            GatewayLowering.lower(gateway, false, context);
        }
        for (FlowNode gateway : process.nodesOfType(FlowNodeType.PARALLEL_GATEWAY)) {
            GatewayLowering.lower(gateway, true, context);
        }
        for (FlowNode gateway : process.nodesOfType(FlowNodeType.INCLUSIVE_GATEWAY)) {
            GatewayLowering.lower(gateway, true, context);
        }

        CacaoPlaybook playbook = context.playbook();
        if (!context.hasStart()) {
            playbook.workflowStart = NO_WORKFLOW_START;
        }
        log.info("Converted process {} to {} with {} steps ({} synthesized end steps)",
                process.id(), playbook.id, playbook.workflow.size(), context.synthesizedEndSteps());
        return playbook;
    }

    private CacaoPlaybook createEnvelope(ProcessDef process) {
        String now = DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.MILLIS));

        CacaoPlaybook playbook = new CacaoPlaybook();
        playbook.specVersion = specVersion.value();
        playbook.id = StepIdDeriver.derivePlaybookId(process.id());
        playbook.name = process.name();
        playbook.created = now;
        playbook.modified = now;
        if (metadata != null) {
            playbook.createdBy = metadata.createdBy;
            playbook.description = metadata.description;
            playbook.playbookTypes = metadata.playbookTypes;
            playbook.labels = metadata.labels;
            playbook.externalReferences = metadata.externalReferences;
        }
        return playbook;
    }

    private void lowerStartEvent(ProcessDef process, ConversionContext context) {
        FlowNode startEvent = process.startEvent();
        if (startEvent == null) {
            return;
        }
        context.putStep(context.startStepId(), Step.builder()
                .type(specVersion.stepType(StepKind.START))
                .name(startEvent.name())
                .onCompletion(context.resolveStep(TransitionKey.positional(startEvent.id(), 0)).orElse(null))
                .build());
    }

    private void lowerEndEvent(FlowNode endEvent, ConversionContext context) {
        context.stepIdOf(endEvent.id()).ifPresent(stepId -> context.putStep(stepId, Step.builder()
                .type(specVersion.stepType(StepKind.END))
                .name(endEvent.name().isEmpty() ? END_STEP_NAME : endEvent.name())
                .build()));
    }
}
