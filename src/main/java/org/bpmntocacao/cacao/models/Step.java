package org.bpmntocacao.cacao.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A single workflow step. Which successor fields are set depends on the step type:
 * on_completion for linear steps, on_true/on_false for if-condition, cases for
 * switch-condition, next_steps for parallel.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Step(
        String type,
        String name,
        String description,
        @JsonProperty("on_completion") String onCompletion,
        String condition,
        @JsonProperty("on_true") String onTrue,
        @JsonProperty("on_false") String onFalse,
        @JsonProperty("switch") String switchVariable,
        Map<String, List<String>> cases,
        @JsonProperty("next_steps") List<String> nextSteps,
        List<Command> commands,
        @JsonProperty("in_args") List<String> inArgs
) {
}
