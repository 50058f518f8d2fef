package com.testconductor.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the operator (or remote responder) decided.
 *
 * Immutable; use the static factories:
 * <pre>
 *   InterventionResponse.of(InterventionAction.SKIP);
 *   InterventionResponse.hint("Click the cookie banner first");
 *   InterventionResponse.modify("Open the menu on the left instead");
 *   InterventionResponse.jumpTo(3);
 * </pre>
 */
public final class InterventionResponse {

    private final InterventionAction action;
    private final String message;                 // free text; the replacement instruction for MODIFY
    private final String additionalInstructions;  // guidance appended to the step for CONTINUE
    private final Integer targetStep;             // required for GOTO

    public InterventionResponse(InterventionAction action, String message,
                                String additionalInstructions, Integer targetStep) {
        this.action                 = action != null ? action : InterventionAction.UNKNOWN;
        this.message                = message;
        this.additionalInstructions = additionalInstructions;
        this.targetStep             = targetStep;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static InterventionResponse of(InterventionAction action) {
        return new InterventionResponse(action, null, null, null);
    }

    public static InterventionResponse hint(String instructions) {
        return new InterventionResponse(InterventionAction.CONTINUE, null, instructions, null);
    }

    public static InterventionResponse modify(String newInstruction) {
        return new InterventionResponse(InterventionAction.MODIFY, newInstruction, null, null);
    }

    public static InterventionResponse jumpTo(int stepNumber) {
        return new InterventionResponse(InterventionAction.GOTO, null, null, stepNumber);
    }

    /** The response applied when nobody answers in time. */
    public static InterventionResponse timeoutFallback(String message) {
        return new InterventionResponse(InterventionAction.CONTINUE, message, null, null);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public InterventionAction getAction()   { return action; }
    public String getMessage()              { return message; }
    public String getAdditionalInstructions() { return additionalInstructions; }
    public Integer getTargetStep()          { return targetStep; }

    public boolean hasMessage()      { return message != null && !message.isBlank(); }
    public boolean hasInstructions() { return additionalInstructions != null && !additionalInstructions.isBlank(); }
    public boolean hasTargetStep()   { return targetStep != null; }

    /** The detail payload recorded on the StepResult that triggered this response. */
    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", action.wireName());
        details.put("message", message);
        details.put("additional_instructions", additionalInstructions);
        if (targetStep != null) details.put("skip_to_step", targetStep);
        return details;
    }

    @Override
    public String toString() {
        return String.format("InterventionResponse{action=%s, message='%s', instructions='%s', target=%s}",
            action, message, additionalInstructions, targetStep);
    }
}
