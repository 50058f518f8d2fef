package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry in the append-only intervention history: the request, how it was
 * resolved and when. Never mutated after it is appended.
 *
 * @param requestedAt when the escalation was issued
 * @param resolvedAt  when the response was obtained
 * @param context     the context presented to the operator
 * @param response    the response as a detail map (see {@link InterventionResponse#toDetails()})
 * @param timedOut    true when the response is the timeout fallback
 * @param error       transport failure text when the fallback was used because of an error, else null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InterventionRecord(
        Instant requestedAt,
        Instant resolvedAt,
        InterventionContext context,
        Map<String, Object> response,
        boolean timedOut,
        String error) {

    public InterventionRecord {
        response = response != null ? Map.copyOf(withoutNulls(response)) : Map.of();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return copy;
    }
}
