package org.bpmntocacao.cacao.models;

/**
 * A variable declared at playbook level, e.g. the condition variable of an if-condition step.
 *
 * Example:
 * "approved": { "type": "integer", "description": "Approved?", "value": "0", "constant": false }
 */
public record PlaybookVariable(
        String type,
        String description,
        String value,
        boolean constant
) {
}
