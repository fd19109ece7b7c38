package org.bpmntocacao.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.File;

/**
 * Checks BPMN input against the BPMN 2.0 XML schema through the Camunda model API.
 * The converter's own parser is lenient and skips what it does not understand, so
 * this check is the way to reject malformed diagrams before they are converted.
 */
@Slf4j
public class BpmnValidator {

    /**
     * Reads and schema-validates a diagram. Run by the converter for every input file
     * when {@code --validate} or {@code validateInput} is set.
     *
     * @param bpmnFile the diagram to check
     * @throws org.camunda.bpm.model.xml.ModelException if the file cannot be read as BPMN
     *                                                  or violates the schema
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
    }

    /**
     * Same check as {@link #validate(File)}, reporting the outcome instead of throwing.
     * The reason for a rejection is logged at debug level.
     */
    public static boolean isValid(File bpmnFile) {
        try {
            validate(bpmnFile);
            return true;
        } catch (RuntimeException e) {
            log.debug("BPMN file {} rejected by schema validation: {}", bpmnFile, e.getMessage());
            return false;
        }
    }
}
