package org.bpmntocacao.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two nodes in a process.
 *
 * @param id        the unique identifier of the sequence flow
 * @param name      the label of the sequence flow, empty when unlabeled
 * @param sourceRef id of the node the flow leaves
 * @param targetRef id of the node the flow enters
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef
) {
    public SequenceFlow {
        if (name == null) {
            name = "";
        }
    }

    public boolean isLabeled() {
        return !name.isEmpty();
    }
}
