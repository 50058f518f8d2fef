package com.testconductor.support;

import com.testconductor.core.TestConductorConfig;
import com.testconductor.executor.ExecutionEngine;
import com.testconductor.intervention.InterventionGateway;
import com.testconductor.intervention.InterventionTransport;
import com.testconductor.session.ProcessJanitor;
import com.testconductor.session.ResourceMonitor;
import com.testconductor.session.SessionManager;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Wires an {@link ExecutionEngine} against fakes: an in-memory session factory,
 * a {@link ScriptedAgent} and a {@link ScriptedTransport}. No browser, no network.
 *
 * <pre>
 *   ConductorFixture fixture = ConductorFixture.withConfig(b -> b.maxRetries(2));
 *   fixture.agent().fail("x").pass("ok");
 *   RunResult result = fixture.engine().run(plan);
 * </pre>
 */
public class ConductorFixture implements AutoCloseable {

    @FunctionalInterface
    public interface ConfigCustomizer {
        void customize(TestConductorConfig.Builder builder);
    }

    private final TestConductorConfig config;
    private final List<FakeSessionHandle> sessions = new ArrayList<>();
    private final SessionManager sessionManager;
    private final ScriptedAgent agent = new ScriptedAgent();
    private final ScriptedTransport transport = new ScriptedTransport();
    private final InterventionGateway gateway;
    private final ExecutionEngine engine;

    private ConductorFixture(TestConductorConfig config, InterventionTransport channel) {
        this.config = config;
        this.sessionManager = new SessionManager(
            () -> {
                FakeSessionHandle handle = new FakeSessionHandle(sessions.size() + 1);
                sessions.add(handle);
                return handle;
            },
            noPressure(),
            new ProcessJanitor(List.of()),
            config.getSessionAttempts(),
            config.getSessionStartupTimeout(),
            config.getSessionRetryDelay());
        this.transport.observing(sessionManager);
        this.gateway = new InterventionGateway(channel != null ? channel : transport, config.getInterventionTimeout());
        this.engine = new ExecutionEngine(config, sessionManager, agent.factory(), gateway);
    }

    public static ConductorFixture withConfig(ConfigCustomizer customizer) {
        return withTransport(customizer, null);
    }

    /** Same defaults, but interventions go to {@code channel} instead of the scripted transport. */
    public static ConductorFixture withTransport(ConfigCustomizer customizer, InterventionTransport channel) {
        TestConductorConfig.Builder builder = TestConductorConfig.builder()
            .maxRetries(0)
            .stepTimeout(Duration.ofSeconds(5))
            .interventionTimeout(Duration.ofSeconds(5))
            .sessionRetryDelay(Duration.ZERO)
            .screenshotsDir(tempDir());
        customizer.customize(builder);
        return new ConductorFixture(builder.build(), channel);
    }

    public TestConductorConfig config()          { return config; }
    public SessionManager sessionManager()       { return sessionManager; }
    public ScriptedAgent agent()                 { return agent; }
    public ScriptedTransport transport()         { return transport; }
    public InterventionGateway gateway()         { return gateway; }
    public ExecutionEngine engine()              { return engine; }
    public List<FakeSessionHandle> sessions()    { return sessions; }

    @Override
    public void close() {
        engine.close();
        sessionManager.close();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    public static ResourceMonitor noPressure() {
        return new ResourceMonitor(90) {
            @Override
            protected OptionalDouble memoryUsagePercent() {
                return OptionalDouble.of(10.0);
            }
        };
    }

    public static Path tempDir() {
        try {
            return Files.createTempDirectory("testconductor-");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
