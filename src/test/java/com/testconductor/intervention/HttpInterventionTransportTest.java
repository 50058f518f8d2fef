package com.testconductor.intervention;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testconductor.model.InterventionAction;
import com.testconductor.model.InterventionContext;
import com.testconductor.model.InterventionResponse;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Remote intervention channel against a local {@link MockWebServer}.
 */
public class HttpInterventionTransportTest {

    private static final InterventionContext CONTEXT = new InterventionContext(
        3, "Submit order", "Step 3 timed out after 30s", null, "https://shop.example.com/cart", 2);

    private MockWebServer server;
    private HttpInterventionTransport transport;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeMethod
    public void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new HttpInterventionTransport(server.url("/intervention").toString());
    }

    @AfterMethod(alwaysRun = true)
    public void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    public void postsContextInTheWireShape() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"action\":\"skip\"}"));

        transport.await(CONTEXT, Duration.ofSeconds(5));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/intervention");

        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("type").asText()).isEqualTo("intervention_required");
        JsonNode context = body.get("context");
        assertThat(context.get("step_number").asInt()).isEqualTo(3);
        assertThat(context.get("step_title").asText()).isEqualTo("Submit order");
        assertThat(context.get("error_message").asText()).isEqualTo("Step 3 timed out after 30s");
        assertThat(context.get("page_url").asText()).isEqualTo("https://shop.example.com/cart");
        assertThat(context.get("retry_count").asInt()).isEqualTo(2);
        assertThat(context.has("screenshot_path")).isFalse();
    }

    @Test
    public void parsesGotoWithTargetStep() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"action\":\"goto\",\"skip_to_step\":5}"));

        InterventionResponse response = transport.await(CONTEXT, Duration.ofSeconds(5));

        assertThat(response.getAction()).isEqualTo(InterventionAction.GOTO);
        assertThat(response.getTargetStep()).isEqualTo(5);
    }

    @Test
    public void parsesContinueWithInstructions() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "{\"action\":\"continue\",\"message\":null,\"additional_instructions\":\"Accept the cookie banner\"}"));

        InterventionResponse response = transport.await(CONTEXT, Duration.ofSeconds(5));

        assertThat(response.getAction()).isEqualTo(InterventionAction.CONTINUE);
        assertThat(response.getAdditionalInstructions()).isEqualTo("Accept the cookie banner");
        assertThat(response.getMessage()).isNull();
    }

    @Test
    public void unknownOrMissingAction_mapsToUnknown() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"action\":\"pause\"}"));
        server.enqueue(new MockResponse().setBody("{}"));

        assertThat(transport.await(CONTEXT, Duration.ofSeconds(5)).getAction()).isEqualTo(InterventionAction.UNKNOWN);
        assertThat(transport.await(CONTEXT, Duration.ofSeconds(5)).getAction()).isEqualTo(InterventionAction.UNKNOWN);
    }

    @Test
    public void slowResponder_isReportedAsTimeout() {
        server.enqueue(new MockResponse().setBody("{\"action\":\"skip\"}").setHeadersDelay(3, TimeUnit.SECONDS));

        assertThatThrownBy(() -> transport.await(CONTEXT, Duration.ofMillis(300)))
            .isInstanceOf(InterventionTimeoutException.class);
    }

    @Test
    public void serverError_isAnIoFailure() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        assertThatThrownBy(() -> transport.await(CONTEXT, Duration.ofSeconds(5)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("503");
    }

    @Test
    public void nonObjectBody_isAnIoFailure() {
        server.enqueue(new MockResponse().setBody("[1,2,3]"));

        assertThatThrownBy(() -> transport.await(CONTEXT, Duration.ofSeconds(5)))
            .isInstanceOf(IOException.class);
    }
}
