package com.csvstruct.test;

import com.csvstruct.config.SessionConf;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all tests.
 *
 * <p>Logs the start and end of every test, provides {@link #logStep(String)} for
 * narrating multi-step tests, and resets the session configuration around each
 * test so tests cannot leak settings into each other.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String currentTest;

    @BeforeEach
    void setUpTestBase(TestInfo testInfo) {
        SessionConf.reset();
        currentTest = testInfo.getDisplayName();
        logger.info("Starting test: {}", currentTest);
    }

    @AfterEach
    void tearDownTestBase() {
        SessionConf.reset();
        logger.info("Finished test: {}", currentTest);
    }

    /**
     * Logs a test step.
     *
     * @param step a short description of what the test does next
     */
    protected void logStep(String step) {
        logger.info("  [{}] {}", currentTest, step);
    }
}
