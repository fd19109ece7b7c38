package org.bpmntocacao.cacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.bpmn.models.FlowNodeType;
import org.bpmntocacao.bpmn.models.ProcessDef;

import java.util.List;

/**
 * Assigns every supported BPMN node its CACAO step id before any step is built, so
 * that transitions to nodes of any category can be resolved while lowering.
 */
@Slf4j
public final class NodeClassifier {
    private static final List<FlowNodeType> ACTION_TYPES = List.of(
            FlowNodeType.SERVICE_TASK,
            FlowNodeType.USER_TASK,
            FlowNodeType.MANUAL_TASK,
            FlowNodeType.SCRIPT_TASK,
            FlowNodeType.SEND_TASK,
            FlowNodeType.TASK,
            FlowNodeType.INTERMEDIATE_THROW_EVENT);

    private NodeClassifier() {
    }

    public static void classify(ProcessDef process, ConversionContext context) {
        FlowNode startEvent = process.startEvent();
        if (startEvent != null) {
            String startStepId = register(startEvent, StepKind.START, context);
            context.declareStart(startStepId);
        }

        // without a start event the first catch event becomes the start
        for (FlowNode catchEvent : process.nodesOfType(FlowNodeType.INTERMEDIATE_CATCH_EVENT)) {
            if (context.hasStart()) {
                register(catchEvent, StepKind.ACTION, context);
            } else {
                context.declareStart(register(catchEvent, StepKind.START, context));
                log.info("Process {} has no start event, using catch event {} as start", process.id(), catchEvent.id());
            }
        }

        for (FlowNode endEvent : process.nodesOfType(FlowNodeType.END_EVENT)) {
            register(endEvent, StepKind.END, context);
        }

        for (FlowNodeType type : ACTION_TYPES) {
            for (FlowNode task : process.nodesOfType(type)) {
                register(task, StepKind.ACTION, context);
            }
        }

        for (FlowNode gateway : process.nodesOfType(FlowNodeType.EXCLUSIVE_GATEWAY)) {
            StepKind kind = conditionKind(gateway);
            if (kind == null) {
                log.error("exclusive gateway {} has unexpected number of outgoing flows: {}",
                        gateway.id(), gateway.outgoing().size());
                continue;
            }
            register(gateway, kind, context);
        }

        // inclusive gateways fan out like parallel ones
        for (FlowNodeType type : List.of(FlowNodeType.PARALLEL_GATEWAY, FlowNodeType.INCLUSIVE_GATEWAY)) {
            for (FlowNode gateway : process.nodesOfType(type)) {
                register(gateway, StepKind.PARALLEL, context);
            }
        }
    }

    /**
     * The condition step kind for a branching node: if-condition for two outgoing flows,
     * switch-condition for more, null when the node cannot be expressed as either.
     */
    public static StepKind conditionKind(FlowNode gateway) {
        int outgoing = gateway.outgoing().size();
        if (outgoing == 2) {
            return StepKind.IF_CONDITION;
        }
        if (outgoing > 2) {
            return StepKind.SWITCH_CONDITION;
        }
        return null;
    }

    private static String register(FlowNode node, StepKind kind, ConversionContext context) {
        String stepId = StepIdDeriver.deriveStepId(node.id(), kind, context.specVersion());
        context.registerStep(node.id(), stepId);
        return stepId;
    }
}
