package org.bpmntocacao.cacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.models.FlowNode;
import org.bpmntocacao.cacao.models.PlaybookVariable;
import org.bpmntocacao.cacao.models.Step;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds parallel, if-condition and switch-condition steps for BPMN gateways.
 */
@Slf4j
public final class GatewayLowering {
    static final String CONDITION_VARIABLE_TYPE = "integer";
    static final String CONDITION_VARIABLE_DEFAULT = "0";
    static final String CONDITION_TRUE_VALUE = "1";

    private GatewayLowering() {
    }

    /**
     * Adds the step for {@code gateway} to the playbook.
     *
     * @param gateway  the gateway to lower
     * @param parallel true to lower as a parallel fan-out, false for a condition step
     * @param context  the conversion in progress
     * @return the id of the added step, or empty when the gateway cannot be expressed
     */
    public static Optional<String> lower(FlowNode gateway, boolean parallel, ConversionContext context) {
        if (parallel) {
            return Optional.of(lowerParallel(gateway, context));
        }

        StepKind kind = NodeClassifier.conditionKind(gateway);
        if (kind == null) {
            log.error("exclusive gateway {} has unexpected number of outgoing flows: {}",
                    gateway.id(), gateway.outgoing().size());
            return Optional.empty();
        }

        String variable = conditionVariableName(gateway);
        String label = gateway.name().isEmpty() ? gateway.id() : gateway.name();
        context.declareVariable(variable, new PlaybookVariable(
                CONDITION_VARIABLE_TYPE, label, CONDITION_VARIABLE_DEFAULT, false));

        String stepId = context.stepIdOf(gateway.id())
                .orElseGet(() -> StepIdDeriver.deriveStepId(gateway.id(), kind, context.specVersion()));
        Step step = kind == StepKind.IF_CONDITION
                ? ifCondition(gateway, variable, label, context)
                : switchCondition(gateway, variable, label, context);
        context.putStep(stepId, step);
        return Optional.of(stepId);
    }

    /**
     * Turns a gateway label into a variable name: lower case, spaces to underscores,
     * everything but letters, digits and underscores removed. Falls back to the gateway id.
     * "Is it Malware?" becomes "is_it_malware".
     */
    public static String conditionVariableName(FlowNode gateway) {
        String mangled = gateway.name().toLowerCase(Locale.ROOT).replace(' ', '_');
        StringBuilder condition = new StringBuilder(mangled.length());
        mangled.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == '_')
                .forEach(condition::appendCodePoint);
        return condition.length() == 0 ? gateway.id() : condition.toString();
    }

    private static String lowerParallel(FlowNode gateway, ConversionContext context) {
        CacaoSpecVersion specVersion = context.specVersion();
        String stepId = context.stepIdOf(gateway.id())
                .orElseGet(() -> StepIdDeriver.deriveStepId(gateway.id(), StepKind.PARALLEL, specVersion));

        List<String> nextSteps = new ArrayList<>();
        for (TransitionKey key : context.transitionIndex().keysFrom(gateway.id())) {
            nextSteps.add(context.resolveOrSynthesizeEnd(key));
        }
        // declared branches with no sequence flow behind them
        for (int i = nextSteps.size(); i < gateway.outgoing().size(); i++) {
            log.warn("Gateway {} declares outgoing flow {} without a matching sequence flow",
                    gateway.id(), gateway.outgoing().get(i));
            nextSteps.add(context.addSynthesizedEnd());
        }

        context.putStep(stepId, Step.builder()
                .type(specVersion.stepType(StepKind.PARALLEL))
                .name(gateway.name().isEmpty() ? null : gateway.name())
                .nextSteps(nextSteps)
                .build());
        return stepId;
    }

    private static Step ifCondition(FlowNode gateway, String variable, String label, ConversionContext context) {
        String onTrue = context.resolveOrSynthesizeEnd(new TransitionKey(gateway.id(), TransitionKey.YES));
        String onFalse = context.resolveOrSynthesizeEnd(new TransitionKey(gateway.id(), TransitionKey.NO));

        return Step.builder()
                .type(context.specVersion().stepType(StepKind.IF_CONDITION))
                .name(label)
                .condition(variable + " == " + CONDITION_TRUE_VALUE)
                .inArgs(List.of(variable))
                .onTrue(onTrue)
                .onFalse(onFalse)
                .build();
    }

    private static Step switchCondition(FlowNode gateway, String variable, String label, ConversionContext context) {
        Map<String, List<String>> cases = new LinkedHashMap<>();
        for (TransitionKey key : context.transitionIndex().keysFrom(gateway.id())) {
            Optional<String> target = context.resolveStep(key);
            if (target.isEmpty()) {
                log.warn("Case {} of gateway {} leads to no known step", key.discriminator(), gateway.id());
            }
            cases.put(key.discriminator(), target.map(List::of).orElse(List.of()));
        }

        return Step.builder()
                .type(context.specVersion().stepType(StepKind.SWITCH_CONDITION))
                .name(label)
                .switchVariable(variable)
                .inArgs(List.of(variable))
                .cases(cases)
                .build();
    }
}
