package org.bpmntocacao.cacao;

import lombok.extern.slf4j.Slf4j;
import org.bpmntocacao.bpmn.models.SequenceFlow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each outgoing transition, keyed by (source node, discriminator), to the BPMN id
 * of the node it leads to. For example:
 * <pre>
 *     (Activity_1g87yhd, 0)   -> Activity_0wagh2h
 *     (Gateway_1hblfsj, YES)  -> Activity_0vuc752
 *     (Gateway_1g3qmkj, FILEHASH) -> Event_0d4dl33
 * </pre>
 */
@Slf4j
public final class TransitionIndex {
    private final Map<TransitionKey, String> targets = new LinkedHashMap<>();

    private TransitionIndex() {
    }

    public static TransitionIndex build(List<SequenceFlow> sequenceFlows) {
        TransitionIndex index = new TransitionIndex();
        for (SequenceFlow flow : sequenceFlows) {
            TransitionKey key;
            if (flow.isLabeled()) {
                key = TransitionKey.labeled(flow.sourceRef(), flow.name());
                if (index.targets.containsKey(key)) {
                    log.warn("Sequence flow {} repeats label '{}' on {}, the later flow wins",
                            flow.id(), flow.name(), flow.sourceRef());
                }
            } else {
                // probe until we find an unused index
                int i = 0;
                do {
                    key = TransitionKey.positional(flow.sourceRef(), i++);
                } while (index.targets.containsKey(key));
            }
            index.targets.put(key, flow.targetRef());
        }
        return index;
    }

    public Optional<String> target(TransitionKey key) {
        return Optional.ofNullable(targets.get(key));
    }

    /**
     * All keys recorded for one source node, in sequence flow declaration order.
     */
    public List<TransitionKey> keysFrom(String sourceId) {
        return targets.keySet().stream()
                .filter(key -> key.sourceId().equals(sourceId))
                .toList();
    }

    public int size() {
        return targets.size();
    }
}
