package org.bpmntocacao.cacao.models;

public record Command(
        String type,
        String command,
        String description
) {
}
