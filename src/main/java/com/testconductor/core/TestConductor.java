package com.testconductor.core;

import com.testconductor.executor.ExecutionAgentFactory;
import com.testconductor.executor.ExecutionEngine;
import com.testconductor.intervention.InterventionGateway;
import com.testconductor.model.RunResult;
import com.testconductor.model.TestPlan;
import com.testconductor.session.ChromeSessionFactory;
import com.testconductor.session.SessionFactory;
import com.testconductor.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TestConductor: the integration point for running a parsed test plan.
 *
 * Wires the session manager, the intervention gateway and the execution engine
 * from one {@link TestConductorConfig}:
 * <pre>
 *   TestConductorConfig config = TestConductorConfig.fromEnvironment();
 *   try (TestConductor conductor = TestConductor.create(config, session -> new MyAgent(session))) {
 *       RunResult result = conductor.run(plan);
 *   }
 * </pre>
 *
 * The remote intervention channel is used when an intervention URL is
 * configured; otherwise the operator answers on the console.
 */
public class TestConductor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestConductor.class);

    private final TestConductorConfig config;
    private final SessionManager sessionManager;
    private final InterventionGateway gateway;
    private final ExecutionEngine engine;

    public TestConductor(TestConductorConfig config, SessionFactory sessionFactory,
                         ExecutionAgentFactory agentFactory, InterventionGateway gateway) {
        this.config         = config;
        this.sessionManager = new SessionManager(sessionFactory, config);
        this.gateway        = gateway;
        this.engine         = new ExecutionEngine(config, sessionManager, agentFactory, gateway);
        log.info("TestConductor initialized -- {}, intervention={}", config,
            config.isInterventionEnabled() ? gateway.getTransport().name() : "disabled");
    }

    /** Chrome sessions and the gateway chosen by {@link InterventionGateway#fromConfig}. */
    public static TestConductor create(TestConductorConfig config, ExecutionAgentFactory agentFactory) {
        return new TestConductor(config, new ChromeSessionFactory(config), agentFactory,
            InterventionGateway.fromConfig(config));
    }

    public RunResult run(TestPlan plan) {
        return engine.run(plan);
    }

    public TestConductorConfig getConfig()        { return config; }
    public SessionManager getSessionManager()     { return sessionManager; }
    public InterventionGateway getGateway()       { return gateway; }

    @Override
    public void close() {
        engine.close();
        sessionManager.close();
    }
}
