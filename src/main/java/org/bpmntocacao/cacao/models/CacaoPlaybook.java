package org.bpmntocacao.cacao.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The CACAO playbook envelope. Owns the workflow, a map of step id to step.
 *
 * Example (abridged):
 * {
 *   "type": "playbook",
 *   "spec_version": "2.0",
 *   "id": "playbook--6448d80f-ada1-5800-bf08-11d19cb3cecf",
 *   "workflow_start": "start--ca64a3ba-3f7a-5563-9984-a18583d3ec68",
 *   "workflow": { ... }
 * }
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CacaoPlaybook {
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String type = "playbook";

    @JsonProperty("spec_version")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String specVersion;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String id;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String name;

    public String description;

    @JsonProperty("playbook_types")
    public List<String> playbookTypes;

    @JsonProperty("created_by")
    public String createdBy;

    /**
     * RFC 3339 UTC timestamp, e.g. "2023-05-01T10:15:30.123Z".
     */
    public String created;
    public String modified;

    public Boolean revoked;

    @JsonProperty("valid_from")
    public String validFrom;

    @JsonProperty("valid_until")
    public String validUntil;

    @JsonProperty("derived_from")
    public String derivedFrom;

    public Integer priority;
    public Integer severity;
    public Integer impact;

    public List<String> labels;

    @JsonProperty("external_references")
    public List<ExternalReference> externalReferences;

    public List<String> markings;

    @JsonProperty("playbook_variables")
    public Map<String, PlaybookVariable> playbookVariables = new LinkedHashMap<>();

    @JsonProperty("workflow_start")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String workflowStart;

    @JsonProperty("workflow_exception")
    public String workflowException;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Map<String, Step> workflow = new LinkedHashMap<>();
}
