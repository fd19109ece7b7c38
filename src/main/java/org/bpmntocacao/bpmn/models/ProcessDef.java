package org.bpmntocacao.bpmn.models;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

@Builder
public record ProcessDef(
        String id,
        String name,
        boolean isExecutable,
        String versionTag,
        @Singular List<FlowNode> flowNodes,         // all recognised nodes, document order
        @Singular List<SequenceFlow> sequenceFlows  // graph edges, document order
) {
    public ProcessDef {
        if (name == null) {
            name = "";
        }
        flowNodes = flowNodes == null ? List.of() : List.copyOf(flowNodes);
        sequenceFlows = sequenceFlows == null ? List.of() : List.copyOf(sequenceFlows);
    }

    /**
     * Returns the nodes of one category in the order they were declared.
     */
    public List<FlowNode> nodesOfType(FlowNodeType type) {
        return flowNodes.stream()
                .filter(node -> node.type() == type)
                .toList();
    }

    /**
     * Returns the first start event of the process, or null when the process has none.
     */
    public FlowNode startEvent() {
        return flowNodes.stream()
                .filter(node -> node.type() == FlowNodeType.START_EVENT)
                .findFirst()
                .orElse(null);
    }
}
