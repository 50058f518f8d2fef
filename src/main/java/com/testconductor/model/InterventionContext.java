package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot taken when a step escalates to a human.
 *
 * Every transport receives exactly this shape, so the engine does not care
 * whether the operator sits at a terminal or behind a remote endpoint.
 *
 * @param stepNumber     number of the failing step
 * @param stepTitle      its title
 * @param errorMessage   error of the latest failed attempt
 * @param screenshotPath screenshot of the latest attempt, or null
 * @param pageUrl        current page location, or null when unavailable
 * @param retryCount     retry counter of the step at escalation time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InterventionContext(
        @JsonProperty("step_number") int stepNumber,
        @JsonProperty("step_title") String stepTitle,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("screenshot_path") String screenshotPath,
        @JsonProperty("page_url") String pageUrl,
        @JsonProperty("retry_count") int retryCount) {

    public InterventionContext {
        if (errorMessage == null || errorMessage.isBlank()) errorMessage = "Unknown error";
    }
}
