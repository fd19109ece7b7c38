package org.bpmntocacao.cacao;

import java.util.Locale;

/**
 * Identifies one outgoing transition of a source node: either by its upper-cased
 * label or, for unlabeled transitions, by its position among the node's unlabeled
 * transitions ("0", "1", ...).
 */
public record TransitionKey(String sourceId, String discriminator) {
    public static final String YES = "YES";
    public static final String NO = "NO";

    public static TransitionKey labeled(String sourceId, String label) {
        return new TransitionKey(sourceId, label.toUpperCase(Locale.ROOT));
    }

    public static TransitionKey positional(String sourceId, int index) {
        return new TransitionKey(sourceId, Integer.toString(index));
    }
}
