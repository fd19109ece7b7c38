package org.bpmntocacao.cacao;

/**
 * Semantic kind of a workflow step. How a kind is spelled in step ids and step
 * records depends on the {@link CacaoSpecVersion}.
 */
public enum StepKind {
    START("start"),
    END("end"),
    ACTION("action"),
    IF_CONDITION("if-condition"),
    SWITCH_CONDITION("switch-condition"),
    PARALLEL("parallel");

    private final String tag;

    StepKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
