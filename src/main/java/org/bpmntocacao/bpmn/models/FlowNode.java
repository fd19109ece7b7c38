package org.bpmntocacao.bpmn.models;

import lombok.Builder;

import java.util.List;

/**
 * A BPMN flow node (event, task or gateway) as read from a process.
 *
 * Example from BPMN:
 * <bpmn:serviceTask id="Activity_18ru9dm" name="SOAR Processes AV/EDR Alert">
 *   <bpmn:documentation>Enrich the alert</bpmn:documentation>
 *   <bpmn:incoming>Flow_1bgfopa</bpmn:incoming>
 *   <bpmn:outgoing>Flow_017q5eb</bpmn:outgoing>
 * </bpmn:serviceTask>
 */
@Builder
public record FlowNode(
        String id,
        FlowNodeType type,
        String name,
        String documentation,
        List<String> incoming,  // sequence flow ids, document order
        List<String> outgoing   // sequence flow ids, document order
) {
    public FlowNode {
        if (name == null) {
            name = "";
        }
        if (documentation == null) {
            documentation = "";
        }
        incoming = incoming == null ? List.of() : List.copyOf(incoming);
        outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    }

    public FlowNode(String id, FlowNodeType type, String name) {
        this(id, type, name, "", List.of(), List.of());
    }
}
