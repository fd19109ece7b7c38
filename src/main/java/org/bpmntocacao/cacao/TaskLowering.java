package org.bpmntocacao.cacao;

import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.cacao.models.Command;
import org.bpmntocacao.cacao.models.Step;

import java.util.List;

/**
 * Builds the action step for a task-like BPMN node.
 */
public final class TaskLowering {

    private TaskLowering() {
    }

    /**
     * Adds the step for {@code task} to the playbook. The step follows the task's single
     * outgoing transition; when that cannot be resolved it is linked to a new end step.
     * The step is typed as the start step when its id is the declared workflow start.
     *
     * @param task        the task, or catch/throw event, to lower
     * @param commandType the command type for the step's single command
     * @param context     the conversion in progress
     * @return the id of the added step
     */
    public static String lower(FlowNode task, CommandType commandType, ConversionContext context) {
        CacaoSpecVersion specVersion = context.specVersion();
        String stepId = context.stepIdOf(task.id())
                .orElseGet(() -> StepIdDeriver.deriveStepId(task.id(), StepKind.ACTION, specVersion));

        String onCompletion = context.resolveOrSynthesizeEnd(TransitionKey.positional(task.id(), 0));

        StepKind kind = stepId.equals(context.startStepId()) ? StepKind.START : StepKind.ACTION;

        context.putStep(stepId, Step.builder()
                .type(specVersion.stepType(kind))
                .name(task.name())
                .onCompletion(onCompletion)
                .commands(List.of(new Command(commandType.value(), task.name(), task.documentation())))
                .build());
        return stepId;
    }
}
