package com.tablebridge.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for tablebridge tests.
 *
 * <p>Subclasses override {@link #doSetUp()} and {@link #doTearDown()}
 * instead of declaring their own lifecycle methods, and use
 * {@link #logStep(String)} / {@link #logData(String, Object)} to trace
 * what a test does.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @BeforeEach
    void setUp(TestInfo testInfo) throws Exception {
        logger.debug("Starting test: {}", testInfo.getDisplayName());
        doSetUp();
    }

    @AfterEach
    void tearDown(TestInfo testInfo) throws Exception {
        try {
            doTearDown();
        } finally {
            logger.debug("Finished test: {}", testInfo.getDisplayName());
        }
    }

    protected void doSetUp() throws Exception {
    }

    protected void doTearDown() throws Exception {
    }

    protected void logStep(String step) {
        logger.debug("Step: {}", step);
    }

    protected void logData(String label, Object data) {
        logger.debug("{}: {}", label, data);
    }
}
