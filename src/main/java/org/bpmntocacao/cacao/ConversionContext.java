package org.bpmntocacao.cacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.cacao.models.CacaoPlaybook;
import org.bpmntocacao.cacao.models.PlaybookVariable;
import org.bpmntocacao.cacao.models.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of one document conversion: the step-id index (BPMN id to CACAO step id),
 * the transition index and the playbook being built. Created by
 * {@link PlaybookAssembler} per document and handed to every lowering call.
 */
@Slf4j
public final class ConversionContext {
    private static final String END_STEP_NAME = "End";

    private final CacaoSpecVersion specVersion;
    private final TransitionIndex transitionIndex;
    private final CacaoPlaybook playbook;
    private final Map<String, String> stepIndex = new LinkedHashMap<>();
    private int synthesizedEndSteps;

    public ConversionContext(CacaoSpecVersion specVersion, TransitionIndex transitionIndex, CacaoPlaybook playbook) {
        this.specVersion = specVersion;
        this.transitionIndex = transitionIndex;
        this.playbook = playbook;
    }

    public CacaoSpecVersion specVersion() {
        return specVersion;
    }

    public TransitionIndex transitionIndex() {
        return transitionIndex;
    }

    public CacaoPlaybook playbook() {
        return playbook;
    }

    public void registerStep(String sourceId, String stepId) {
        stepIndex.put(sourceId, stepId);
    }

    public Optional<String> stepIdOf(String sourceId) {
        return Optional.ofNullable(stepIndex.get(sourceId));
    }

    public Map<String, String> stepIndex() {
        return Collections.unmodifiableMap(stepIndex);
    }

    public String startStepId() {
        return playbook.workflowStart;
    }

    public void declareStart(String stepId) {
        playbook.workflowStart = stepId;
    }

    public boolean hasStart() {
        return playbook.workflowStart != null;
    }

    /**
     * Resolves the step a transition leads to, if both the transition and its target node are known.
     */
    public Optional<String> resolveStep(TransitionKey key) {
        return transitionIndex.target(key).flatMap(this::stepIdOf);
    }

    /**
     * Resolves the step a transition leads to. When it cannot be resolved a new end step
     * is added to the workflow and its id returned instead.
     */
    public String resolveOrSynthesizeEnd(TransitionKey key) {
        return resolveStep(key).orElseGet(() -> {
            String endStepId = addSynthesizedEnd();
            log.warn("No step found for transition {}:{}, linked to new end step {}",
                    key.sourceId(), key.discriminator(), endStepId);
            return endStepId;
        });
    }

    public String addSynthesizedEnd() {
        String endStepId = StepIdDeriver.randomStepId(StepKind.END, specVersion);
        putStep(endStepId, Step.builder()
                .type(specVersion.stepType(StepKind.END))
                .name(END_STEP_NAME)
                .build());
        synthesizedEndSteps++;
        return endStepId;
    }

    public int synthesizedEndSteps() {
        return synthesizedEndSteps;
    }

    public void putStep(String stepId, Step step) {
        playbook.workflow.put(stepId, step);
    }

    public void declareVariable(String name, PlaybookVariable variable) {
        playbook.playbookVariables.put(name, variable);
    }
}
