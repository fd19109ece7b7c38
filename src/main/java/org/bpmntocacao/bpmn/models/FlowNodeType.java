package org.bpmntocacao.bpmn.models;

import java.util.Arrays;
import java.util.Optional;

/**
 * The BPMN flow node elements the converter understands, keyed by their XML local name.
 */
public enum FlowNodeType {
    START_EVENT("startEvent"),
    SERVICE_TASK("serviceTask"),
    USER_TASK("userTask"),
    MANUAL_TASK("manualTask"),
    SCRIPT_TASK("scriptTask"),
    SEND_TASK("sendTask"),
    TASK("task"),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent"),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent"),
    EXCLUSIVE_GATEWAY("exclusiveGateway"),
    INCLUSIVE_GATEWAY("inclusiveGateway"),
    PARALLEL_GATEWAY("parallelGateway"),
    END_EVENT("endEvent");

    private final String elementName;

    FlowNodeType(String elementName) {
        this.elementName = elementName;
    }

    public static Optional<FlowNodeType> fromElementName(String localName) {
        return Arrays.stream(values())
                .filter(type -> type.elementName.equals(localName))
                .findFirst();
    }
}
