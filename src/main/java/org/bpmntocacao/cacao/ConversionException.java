package org.bpmntocacao.cacao;

/**
 * Raised when a BPMN document cannot be converted at all, e.g. because it does not
 * contain exactly one process.
 */
public class ConversionException extends Exception {
    public ConversionException(String message) {
        super(message);
    }
}
