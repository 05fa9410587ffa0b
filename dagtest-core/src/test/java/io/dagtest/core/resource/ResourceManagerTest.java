package io.dagtest.core.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dagtest.core.result.TestState;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ResourceManager")
class ResourceManagerTest {

    private ResourceManager manager;

    @BeforeEach
    void setUp() {
        manager = new ResourceManager();
    }

    static final class Counter extends Resource<List<String>> {
        final AtomicInteger setUps = new AtomicInteger();
        final List<TestState> tornDown = new ArrayList<>();

        Counter(Object... args) {
            super(args);
        }

        @Override
        protected List<String> setUp() {
            setUps.incrementAndGet();
            return new ArrayList<>();
        }

        @Override
        protected void tearDown(List<String> object, TestState status) {
            tornDown.add(status);
        }
    }

    static final class Oneshot extends Resource<String> {
        int tearDowns;

        @Override
        protected String setUp() {
            return "temp";
        }

        @Override
        protected void tearDown(String object, TestState status) {
            tearDowns++;
        }

        @Override
        public boolean isOneshot() {
            return true;
        }
    }

    static final class Broken extends Resource<String> {
        @Override
        protected String setUp() {
            return "conn";
        }

        @Override
        protected void tearDown(String object, TestState status) throws Exception {
            throw new IllegalStateException("close failed");
        }
    }

    static final class Unavailable extends Resource<String> {
        @Override
        protected String setUp() throws Exception {
            throw new IOException("port in use");
        }
    }

    @Nested
    @DisplayName("keys")
    class Keys {

        @Test
        void shouldDeriveKeyFromClassAndArguments() {
            Counter counter = new Counter("db", 2);

            assertThat(counter.getKey()).isEqualTo(Counter.class.getName() + "(db,2)");
        }

        @Test
        void shouldShareKeyForEqualArguments() {
            assertThat(new Counter("x").getKey()).isEqualTo(new Counter("x").getKey());
            assertThat(new Counter("x").getKey()).isNotEqualTo(new Counter("y").getKey());
        }
    }

    @Nested
    @DisplayName("pooling")
    class Pooling {

        @Test
        void shouldReuseCleanObjects() throws Exception {
            // Given
            Counter counter = new Counter();
            ResourceHandle<List<String>> first = manager.acquire(counter);
            manager.release(first, TestState.OK);

            // When
            ResourceHandle<List<String>> second = manager.acquire(counter);

            // Then
            assertThat(second).isSameAs(first);
            assertThat(counter.setUps).hasValue(1);
            assertThat(counter.tornDown).isEmpty();
        }

        @Test
        void shouldTearDownDirtyObjectsWithStatus() throws Exception {
            Counter counter = new Counter();
            ResourceHandle<List<String>> handle = manager.acquire(counter);

            handle.mutate(list -> list.add("row"));
            manager.release(handle, TestState.FAIL);

            assertThat(counter.tornDown).containsExactly(TestState.FAIL);
            assertThat(manager.pooledCount(counter.getKey())).isZero();
        }

        @Test
        void shouldNotMarkDirtyDuringCleanAccess() throws Exception {
            Counter counter = new Counter();
            ResourceHandle<List<String>> handle = manager.acquire(counter);

            handle.cleanAccess(list -> handle.mutate(l -> l.add("scratch")));

            assertThat(handle.isDirty()).isFalse();
            assertThat(handle.get()).containsExactly("scratch");
        }

        @Test
        void shouldHonorExplicitDirtyMarks() throws Exception {
            Counter counter = new Counter();
            ResourceHandle<List<String>> handle = manager.acquire(counter);

            int size = handle.mutateAndGet(list -> {
                list.add("row");
                return list.size();
            });
            handle.markClean();
            manager.release(handle, TestState.OK);

            assertThat(size).isEqualTo(1);
            assertThat(manager.pooledCount(counter.getKey())).isEqualTo(1);
        }

        @Test
        void shouldHandOutPooledObjectsFirstInFirstOut() throws Exception {
            Counter counter = new Counter();
            ResourceHandle<List<String>> first = manager.acquire(counter);
            ResourceHandle<List<String>> second = manager.acquire(counter);
            manager.release(first, TestState.OK);
            manager.release(second, TestState.OK);

            assertThat(manager.acquire(counter)).isSameAs(first);
            assertThat(manager.acquire(counter)).isSameAs(second);
        }

        @Test
        void shouldAlwaysTearDownOneshotResources() throws Exception {
            Oneshot oneshot = new Oneshot();

            manager.release(manager.acquire(oneshot), TestState.OK);

            assertThat(oneshot.tearDowns).isEqualTo(1);
            assertThat(manager.pooledCount(oneshot.getKey())).isZero();
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        @Test
        void shouldForceTearDownOnReleaseAllWithoutStatus() throws Exception {
            // Given
            Counter counter = new Counter();
            manager.release(manager.acquire(counter), TestState.OK);

            // When
            manager.releaseAll();

            // Then
            assertThat(counter.tornDown).hasSize(1);
            assertThat(counter.tornDown.get(0)).isNull();
            assertThat(manager.pooledCount(counter.getKey())).isZero();
        }

        @Test
        void shouldCollectTearDownErrorsWithoutThrowing() throws Exception {
            Broken broken = new Broken();
            ResourceHandle<String> handle = manager.acquire(broken);
            handle.markDirty();

            manager.release(handle, TestState.OK);

            List<ResourceReleaseError> errors = manager.drainErrors();
            assertThat(errors).singleElement().satisfies(
                    error -> {
                        assertThat(error.resourceKey()).isEqualTo(broken.getKey());
                        assertThat(error.error()).hasMessage("close failed");
                    });
            assertThat(manager.drainErrors()).isEmpty();
        }

        @Test
        void shouldReleaseAcquiredHandlesWhenCollectFails() throws Exception {
            // Given
            Oneshot oneshot = new Oneshot();
            Map<String, Resource<?>> resources = new LinkedHashMap<>();
            resources.put("scratch", oneshot);
            resources.put("server", new Unavailable());

            // When / Then
            assertThatThrownBy(() -> manager.collect(resources))
                    .isInstanceOf(IOException.class)
                    .hasMessage("port in use");
            assertThat(oneshot.tearDowns).isEqualTo(1);
        }

        @Test
        void shouldReleaseCollectedHandlesOnce() throws Exception {
            Oneshot oneshot = new Oneshot();
            ResourceManager.Collected collected = manager.collect(Map.of("scratch", oneshot));

            collected.release(TestState.OK);
            collected.release(TestState.OK);

            assertThat(collected.getHandles()).containsOnlyKeys("scratch");
            assertThat(oneshot.tearDowns).isEqualTo(1);
        }
    }
}
