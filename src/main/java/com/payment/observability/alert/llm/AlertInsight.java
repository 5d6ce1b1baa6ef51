package com.payment.observability.alert.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured answer expected from the model when explaining an alert.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertInsight {

    @NotBlank
    @JsonProperty("explanation")
    String explanation;

    @JsonProperty("root_cause_hypothesis")
    String rootCauseHypothesis;

    @JsonProperty("recommended_actions")
    List<String> recommendedActions;

    @Pattern(regexp = "^(immediate|high|medium|low)$")
    @JsonProperty("urgency")
    String urgency;

    /** Plain text attached to the alert. */
    public String render() {
        StringBuilder text = new StringBuilder(explanation.trim());
        if (rootCauseHypothesis != null && !rootCauseHypothesis.isBlank()) {
            text.append("\nLikely cause: ").append(rootCauseHypothesis.trim());
        }
        if (recommendedActions != null && !recommendedActions.isEmpty()) {
            text.append("\nRecommended actions:");
            for (String action : recommendedActions) {
                text.append("\n- ").append(action);
            }
        }
        if (urgency != null) {
            text.append("\nUrgency: ").append(urgency);
        }
        return text.toString();
    }
}
