package io.dagtest.core.strategy;

import java.util.concurrent.Executor;

/// Runs sub-invocations one after another on the calling thread.
public final class SerialStrategy implements ExecutionStrategy {

    /// Shared instance; the strategy is stateless.
    public static final SerialStrategy INSTANCE = new SerialStrategy();

    private static final Batch SERIAL_BATCH =
            new Batch() {
                @Override
                public void spawn(Runnable call) {
                    call.run();
                }

                @Override
                public void await() {}
            };

    @Override
    public Batch prepare(Executor executor) {
        return SERIAL_BATCH;
    }

    @Override
    public String toString() {
        return "SerialStrategy";
    }
}
