package io.dagtest.core.execution;

import io.dagtest.core.node.TestNode;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestState;
import java.util.Collection;
import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link RunListener} reporting the run through `java.util.logging`.
///
/// Run boundaries are logged at INFO, transitions at FINE, and test
/// failures at WARNING.
public class LoggingRunListener implements RunListener {

    private static final Logger logger = Logger.getLogger(LoggingRunListener.class.getName());

    @Override
    public void onRunStart(Collection<TestNode> nodes) {
        long tests = nodes.stream().filter(TestNode::isTest).count();
        logger.info("Starting run: " + tests + " tests, " + (nodes.size() - tests) + " fixtures");
    }

    @Override
    public void onStateChange(TestNode node, TestState state) {
        if (state.countsAsFailure() && node.isTest()) {
            logger.warning(node.getKey() + " -> " + state);
        } else if (logger.isLoggable(Level.FINE)) {
            logger.fine((node.isTest() ? "" : "[fixture] ") + node.getKey() + " -> " + state);
        }
    }

    @Override
    public void onRunComplete(RunSummary summary) {
        logger.info(
                "Run complete in "
                        + summary.getDuration().toMillis()
                        + " ms: "
                        + summary.getTotalTests()
                        + " tests, "
                        + summary.getPassCount()
                        + " passed, "
                        + summary.getFailureCount()
                        + " failed, "
                        + summary.getSkippedCount()
                        + " skipped, max "
                        + summary.getMaxConcurrent()
                        + " concurrent");
    }
}
