package org.bpmntocacao.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root configuration file structure.
 * Unset fields keep the defaults from config/default_config.json.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * Target CACAO version, "1.1" or "2.0".
     */
    public String cacaoSpecVersion;

    /**
     * Directory the playbooks are written to.
     */
    public String outputDir;

    /**
     * Appended to the input file name to name the output file.
     * Example: "alert.bpmn" with ".cacao.json" gives "alert.bpmn.cacao.json"
     */
    public String outputSuffix;

    /**
     * Run the Camunda schema validation over each input before converting it.
     */
    public Boolean validateInput;

    /**
     * Check each rendered playbook against the bundled CACAO JSON schema.
     */
    public Boolean validateOutput;

    public PlaybookMetadata metadata;
}
