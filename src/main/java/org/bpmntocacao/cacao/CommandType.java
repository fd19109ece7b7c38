package org.bpmntocacao.cacao;

/**
 * CACAO command types emitted for action steps.
 */
public enum CommandType {
    MANUAL("manual"),
    BASH("bash"),
    HTTP_API("http-api");

    private final String value;

    CommandType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
