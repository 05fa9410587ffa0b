package io.dagtest.core.capture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThreadLocalOutputCaptureTest {

    private ThreadLocalOutputCapture capture;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        capture = new ThreadLocalOutputCapture();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRetrieveNonEmptyChannelsInNameOrder() {
        capture.write(ThreadLocalOutputCapture.STDOUT, "out");
        PrintStream err = capture.stream(ThreadLocalOutputCapture.STDERR);
        err.print("err");
        err.flush();

        List<CapturedOutput> captured = capture.retrieve();

        assertThat(captured)
                .extracting(CapturedOutput::name, CapturedOutput::text)
                .containsExactly(
                        tuple("stderr", "err"),
                        tuple("stdout", "out"));
        assertThat(capture.retrieve()).isEmpty();
    }

    @Test
    void shouldDiscardOutputOnClear() {
        capture.write(ThreadLocalOutputCapture.STDOUT, "stale");

        capture.clear();

        assertThat(capture.retrieve()).isEmpty();
    }

    @Test
    void shouldIsolateThreads() throws Exception {
        capture.write(ThreadLocalOutputCapture.STDOUT, "main");

        List<CapturedOutput> other = executor.submit(capture::retrieve).get(5, TimeUnit.SECONDS);

        assertThat(other).isEmpty();
        assertThat(capture.retrieve()).singleElement()
                .extracting(CapturedOutput::text).isEqualTo("main");
    }

    @Test
    void shouldAppendOutputOfJoinedForkToOwner() throws Exception {
        // Given
        capture.write(ThreadLocalOutputCapture.STDOUT, "owner ");
        OutputCapture.Fork fork =
                capture.fork(() -> capture.write(ThreadLocalOutputCapture.STDOUT, "worker"));

        // When
        executor.submit(fork).get(5, TimeUnit.SECONDS);
        fork.join();

        // Then
        assertThat(capture.retrieve()).singleElement()
                .extracting(CapturedOutput::text).isEqualTo("owner worker");
    }

    @Test
    void shouldKeepForkOutputAwayFromOwnerUntilJoined() throws Exception {
        OutputCapture.Fork fork =
                capture.fork(() -> capture.write(ThreadLocalOutputCapture.STDOUT, "worker"));

        executor.submit(fork).get(5, TimeUnit.SECONDS);

        assertThat(capture.retrieve()).isEmpty();
    }

    @Test
    void shouldDropOutputOfAbandonedFork() throws Exception {
        // Given
        CountDownLatch abandoned = new CountDownLatch(1);
        OutputCapture.Fork fork =
                capture.fork(
                        () -> {
                            try {
                                abandoned.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            capture.write(ThreadLocalOutputCapture.STDOUT, "late");
                        });
        Future<?> running = executor.submit(fork);

        // When
        fork.abandon();
        abandoned.countDown();
        running.get(5, TimeUnit.SECONDS);
        fork.join();

        // Then
        assertThat(capture.retrieve()).isEmpty();
    }

    @Test
    void shouldRestoreWorkerCaptureAfterFork() throws Exception {
        OutputCapture.Fork fork =
                capture.fork(() -> capture.write(ThreadLocalOutputCapture.STDOUT, "forked"));
        executor.submit(fork).get(5, TimeUnit.SECONDS);

        List<CapturedOutput> worker = executor.submit(capture::retrieve).get(5, TimeUnit.SECONDS);

        assertThat(worker).isEmpty();
    }

    @Test
    void shouldRejectUnknownChannel() {
        assertThatThrownBy(() -> capture.write("log", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown capture channel: log. Available: stderr, stdout");
    }
}
