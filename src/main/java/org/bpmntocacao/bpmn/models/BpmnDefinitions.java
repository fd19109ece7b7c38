package org.bpmntocacao.bpmn.models;

import java.util.List;

public record BpmnDefinitions(
        String id,
        List<ProcessDef> processes
) {
    public BpmnDefinitions {
        processes = processes == null ? List.of() : List.copyOf(processes);
    }
}
