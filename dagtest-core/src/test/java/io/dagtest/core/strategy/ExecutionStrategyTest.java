package io.dagtest.core.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExecutionStrategy")
class ExecutionStrategyTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("SerialStrategy")
    class Serial {

        @Test
        void shouldRunCallsInlineInOrder() throws InterruptedException {
            // Given
            List<String> order = new ArrayList<>();
            Thread caller = Thread.currentThread();
            List<Thread> threads = new ArrayList<>();
            ExecutionStrategy.Batch batch = SerialStrategy.INSTANCE.prepare(executor);

            // When
            batch.spawn(() -> {
                order.add("first");
                threads.add(Thread.currentThread());
            });
            batch.spawn(() -> order.add("second"));
            batch.await();

            // Then
            assertThat(order).containsExactly("first", "second");
            assertThat(threads).containsExactly(caller);
        }
    }

    @Nested
    @DisplayName("UnlimitedParallelStrategy")
    class Unlimited {

        @Test
        void shouldRunCallsConcurrently() throws InterruptedException {
            // Given: two calls that only finish once both have started
            CountDownLatch bothStarted = new CountDownLatch(2);
            List<Boolean> sawOther = Collections.synchronizedList(new ArrayList<>());
            ExecutionStrategy.Batch batch = new UnlimitedParallelStrategy().prepare(executor);

            // When
            for (int i = 0; i < 2; i++) {
                batch.spawn(
                        () -> {
                            bothStarted.countDown();
                            try {
                                sawOther.add(bothStarted.await(5, TimeUnit.SECONDS));
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        });
            }
            batch.await();

            // Then
            assertThat(sawOther).containsExactly(true, true);
        }

        @Test
        void shouldWaitForEverySpawnedCall() throws InterruptedException {
            AtomicInteger finished = new AtomicInteger();
            ExecutionStrategy.Batch batch = new UnlimitedParallelStrategy().prepare(executor);

            for (int i = 0; i < 20; i++) {
                batch.spawn(
                        () -> {
                            sleep(5);
                            finished.incrementAndGet();
                        });
            }
            batch.await();

            assertThat(finished).hasValue(20);
        }

        @Test
        void shouldReturnImmediatelyWhenNothingWasSpawned() throws InterruptedException {
            ExecutionStrategy.Batch batch = new UnlimitedParallelStrategy().prepare(executor);

            batch.await();
        }
    }

    @Nested
    @DisplayName("LimitedParallelStrategy")
    class Limited {

        @Test
        void shouldNeverExceedLimit() throws InterruptedException {
            // Given
            AtomicInteger live = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ExecutionStrategy.Batch batch = new LimitedParallelStrategy(2).prepare(executor);

            // When
            for (int i = 0; i < 10; i++) {
                batch.spawn(
                        () -> {
                            int now = live.incrementAndGet();
                            peak.accumulateAndGet(now, Math::max);
                            sleep(10);
                            live.decrementAndGet();
                        });
            }
            batch.await();

            // Then
            assertThat(peak.get()).isBetween(1, 2);
            assertThat(live).hasValue(0);
        }

        @Test
        void shouldRejectNonPositiveLimit() {
            assertThatThrownBy(() -> new LimitedParallelStrategy(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("limit must be positive");
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
