package org.bpmntocacao.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.bpmntocacao.cacao.models.ExternalReference;

import java.util.List;

/**
 * Envelope fields copied onto every generated playbook.
 *
 * Example from config.json:
 * "metadata": {
 *   "createdBy": "identity--5abe695c-7bd5-4c31-8824-2528696cdbf1",
 *   "playbookTypes": ["investigation"],
 *   "labels": ["converted"]
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlaybookMetadata {
    public String createdBy;
    public String description;
    public List<String> playbookTypes;
    public List<String> labels;
    public List<ExternalReference> externalReferences;
}
