package com.columnduck.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for test suites: per-test logging of steps and observed data.
 *
 * <p>Subclasses write Given/When/Then steps with {@link #logStep(String)} and
 * record measured values with {@link #logData(String, Object)}.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void logTestStart(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
    }

    @AfterEach
    void logTestEnd() {
        logger.debug("Finished test: {}", testName);
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {} = {}", testName, label, value);
    }
}
