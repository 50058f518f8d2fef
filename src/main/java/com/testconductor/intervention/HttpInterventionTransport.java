package com.testconductor.intervention;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.testconductor.model.InterventionAction;
import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionResponse;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Remote request/response intervention channel.
 *
 * POSTs the context to a responder endpoint and blocks for its decision:
 * <pre>
 *   → { "type": "intervention_required",
 *       "intervention_type": "error_retry",
 *       "context": { "step_number": 2, "step_title": "...", "error_message": "...",
 *                    "screenshot_path": "...", "page_url": "...", "retry_count": 3 } }
 *   ← { "action": "goto", "message": null, "additional_instructions": null, "skip_to_step": 4 }
 * </pre>
 * A missing or unrecognised {@code action} maps to {@link InterventionAction#UNKNOWN}.
 * The whole HTTP call is bounded by the intervention timeout; exceeding it is
 * reported as {@link InterventionTimeoutException}.
 */
public class HttpInterventionTransport implements InterventionTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpInterventionTransport.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    private final String endpoint;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpInterventionTransport(String endpoint) {
        this(endpoint, new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .build());
    }

    public HttpInterventionTransport(String endpoint, OkHttpClient httpClient) {
        if (endpoint == null || endpoint.isBlank()) throw new IllegalArgumentException("endpoint is required");
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String name() { return "http"; }

    @Override
    public InterventionResponse await(InterventionContext context, Duration timeout)
            throws InterventionTimeoutException, IOException {
        OkHttpClient call = httpClient.newBuilder()
            .callTimeout(timeout)
            .readTimeout(timeout)
            .build();

        Request request = new Request.Builder()
            .url(endpoint)
            .addHeader("content-type", "application/json")
            .post(RequestBody.create(buildRequestBody(context), JSON_MEDIA_TYPE))
            .build();

        log.info("HttpInterventionTransport: Awaiting decision for step {} from {}", context.stepNumber(), endpoint);

        try (Response response = call.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Intervention endpoint returned HTTP " + response.code() + ": "
                    + body.substring(0, Math.min(200, body.length())));
            }
            return parseResponse(body);
        } catch (InterruptedIOException e) {
            throw new InterventionTimeoutException(timeout, e);
        }
    }

    // ── Request / response mapping ────────────────────────────────────────────

    String buildRequestBody(InterventionContext context) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "intervention_required");
        root.put("intervention_type", "error_retry");
        root.set("context", objectMapper.valueToTree(context));
        return objectMapper.writeValueAsString(root);
    }

    InterventionResponse parseResponse(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IOException("Intervention endpoint returned a non-object body");
        }
        InterventionAction action = InterventionAction.fromWire(textOrNull(root, "action"));
        Integer target = root.hasNonNull("skip_to_step") && root.get("skip_to_step").canConvertToInt()
            ? root.get("skip_to_step").asInt()
            : null;
        return new InterventionResponse(action,
            textOrNull(root, "message"),
            textOrNull(root, "additional_instructions"),
            target);
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }
}
