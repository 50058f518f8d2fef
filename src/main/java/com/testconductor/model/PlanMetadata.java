package com.testconductor.model;

/**
 * Plan-level metadata carried alongside the steps.
 *
 * @param testName    name used in logs and the run result
 * @param environment default environment tag ("test" when the plan declares none)
 */
public record PlanMetadata(String testName, String environment) {

    public static final String DEFAULT_ENVIRONMENT = "test";

    public PlanMetadata {
        if (testName == null || testName.isBlank()) throw new IllegalArgumentException("testName is required");
        if (environment == null || environment.isBlank()) environment = DEFAULT_ENVIRONMENT;
    }

    public PlanMetadata(String testName) {
        this(testName, DEFAULT_ENVIRONMENT);
    }
}
