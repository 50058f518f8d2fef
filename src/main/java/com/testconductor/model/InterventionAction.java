package com.testconductor.model;

import java.util.Locale;

/**
 * The action tag carried by an {@link InterventionResponse}.
 *
 *   CONTINUE : re-run the current step, optionally with operator guidance appended
 *   SKIP     : move past the current step without requiring success
 *   RETRY    : recognised on the wire but not acted on by the engine (advances like UNKNOWN)
 *   MODIFY   : replace the step's actions with the operator's instruction and re-run
 *   GOTO     : jump to another step number
 *   STATUS   : operator asked for page status; advances like UNKNOWN
 *   UNKNOWN  : anything the transport could not map
 */
public enum InterventionAction {
    CONTINUE,
    SKIP,
    RETRY,
    MODIFY,
    GOTO,
    STATUS,
    UNKNOWN;

    /** Wire form used by the console grammar and the remote channel. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Maps a wire tag to an action; null, blank and unrecognised tags map to UNKNOWN. */
    public static InterventionAction fromWire(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
