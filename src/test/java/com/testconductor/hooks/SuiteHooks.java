package com.testconductor.hooks;

import com.testconductor.model.RunResult;
import io.cucumber.java.AfterAll;
import io.cucumber.java.BeforeAll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Suite-level Cucumber hooks -- @BeforeAll and @AfterAll only.
 *
 * Rule: any class containing @BeforeAll or @AfterAll must have a public
 * no-arg constructor (or no explicit constructor at all).
 */
public class SuiteHooks {

    private static final Logger log = LoggerFactory.getLogger(SuiteHooks.class);

    private static final Queue<ScenarioReport> scenarioReports = new ConcurrentLinkedQueue<>();

    /** One row in the suite summary. */
    public record ScenarioReport(String scenarioName, RunResult result) {}

    public SuiteHooks() {}

    /** Called by Hooks.@After to accumulate per-scenario runs for the suite summary. */
    static void register(String scenarioName, RunResult result) {
        scenarioReports.add(new ScenarioReport(scenarioName, result));
    }

    @BeforeAll
    public static void resetReports() {
        scenarioReports.clear();
        log.info("SuiteHooks @BeforeAll: Execution scenarios run against an in-memory browser");
    }

    @AfterAll
    public static void logSuiteSummary() {
        List<ScenarioReport> reports = new ArrayList<>(scenarioReports);
        long interventions = reports.stream().mapToLong(r -> r.result().interventionHistory().size()).sum();

        log.info("+================================================================+");
        log.info("|           TestConductor Scenario Summary                       |");
        log.info("+================================================================+");
        log.info("|  Scenarios: {}  |  Interventions: {}", reports.size(), interventions);
        for (ScenarioReport report : reports) {
            RunResult r = report.result();
            log.info("|  [{}] success={} attempts={} -> {}", report.scenarioName(), r.success(),
                r.stepResults().size(), r.finalMessage());
        }
        log.info("+================================================================+");
    }
}
