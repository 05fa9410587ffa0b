package io.dagtest.core.capture;

import java.util.List;
import java.util.Objects;

/// Boundary between the engine and whatever collects output produced by tests.
///
/// The engine clears the calling task's capture at the start of every phase
/// and retrieves it at the end, so output never bleeds across phases or
/// between concurrently running nodes. How output reaches the capture
/// (a `PrintStream` handed to tests, a logging handler, redirected process
/// streams) is the implementation's concern.
///
/// ### Contracts
/// - **Invariant**: {@link #clear()} and {@link #retrieve()} only see output
///   attributed to the calling task
/// - **Postcondition**: {@link #retrieve()} leaves the task's capture empty
///
/// @see ThreadLocalOutputCapture for the default implementation
public interface OutputCapture {

    /// Discards everything captured so far for the calling task.
    void clear();

    /// Returns and discards everything captured so far for the calling task.
    ///
    /// @return one entry per channel that received output, never null
    List<CapturedOutput> retrieve();

    /// Prepares a task to run on another thread with a capture of its own.
    ///
    /// Used when a phase body is moved to a worker thread, e.g. to enforce a
    /// timeout. Output the task produces stays with the fork until the
    /// calling task {@linkplain Fork#join() joins} it; an
    /// {@linkplain Fork#abandon() abandoned} fork never reaches the caller,
    /// whatever the task writes afterwards.
    ///
    /// @param task the task to wrap, not null
    /// @return the fork to execute, never null
    default Fork fork(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        return new Fork() {
            @Override
            public void run() {
                task.run();
            }

            @Override
            public void join() {}

            @Override
            public void abandon() {}
        };
    }

    /// Task running on a worker thread with its own capture.
    interface Fork extends Runnable {

        /// Appends the output the task produced to the calling task's capture.
        ///
        /// Call from the task that created the fork, after the task finished.
        void join();

        /// Discards the task's output, including anything it writes later.
        void abandon();
    }

    /// Capture that never collects anything.
    OutputCapture NONE =
            new OutputCapture() {
                @Override
                public void clear() {}

                @Override
                public List<CapturedOutput> retrieve() {
                    return List.of();
                }
            };
}
