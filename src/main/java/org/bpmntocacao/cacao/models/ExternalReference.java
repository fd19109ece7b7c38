package org.bpmntocacao.cacao.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExternalReference(
        String name,
        String description,
        String source,
        String url,
        String hash,
        @JsonProperty("external_id") String externalId
) {
}
