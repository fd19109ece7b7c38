package org.bpmntocacao.cacao;

import java.util.Arrays;

/**
 * The supported CACAO specification versions and their step vocabularies.
 *
 * <p>Version 2.0 prefixes step ids with the step kind ({@code action--...},
 * {@code if-condition--...}) and uses the kind as the step type. Version 1.1 prefixes
 * every step id with {@code step--} and types plain action steps as {@code single};
 * the remaining kinds keep their name as the step type.
 */
public enum CacaoSpecVersion {
    V1_1("1.1") {
        @Override
        public String idPrefix(StepKind kind) {
            return "step";
        }

        @Override
        public String stepType(StepKind kind) {
            return kind == StepKind.ACTION ? "single" : kind.tag();
        }
    },
    V2_0("2.0") {
        @Override
        public String idPrefix(StepKind kind) {
            return kind.tag();
        }

        @Override
        public String stepType(StepKind kind) {
            return kind.tag();
        }
    };

    private final String value;

    CacaoSpecVersion(String value) {
        this.value = value;
    }

    /**
     * The version string written to {@code spec_version}.
     */
    public String value() {
        return value;
    }

    /**
     * The prefix placed before {@code --<uuid>} in a step id.
     */
    public abstract String idPrefix(StepKind kind);

    /**
     * The value written to a step record's {@code type} field.
     */
    public abstract String stepType(StepKind kind);

    public static CacaoSpecVersion fromValue(String value) {
        return Arrays.stream(values())
                .filter(version -> version.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported CACAO spec version '" + value + "', expected 1.1 or 2.0"));
    }
}
