package io.github.hongjungwan.contextlog.api.context;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContextSlot")
class ContextSlotTest {

    private final ContextSlot<String> slot = new ContextSlot<>("request_id", "-");

    @AfterEach
    void tearDown() {
        slot.reset();
    }

    @Nested
    @DisplayName("Binding")
    class BindingTests {

        @Test
        @DisplayName("should return default when nothing is bound")
        void shouldReturnDefaultWhenUnbound() {
            assertThat(slot.current()).isEqualTo("-");
        }

        @Test
        @DisplayName("should return bound value until reset")
        void shouldReturnBoundValueUntilReset() {
            slot.bind("req-1");
            assertThat(slot.current()).isEqualTo("req-1");

            slot.reset();
            assertThat(slot.current()).isEqualTo("-");
        }
    }

    @Nested
    @DisplayName("Thread isolation")
    class ThreadIsolationTests {

        @Test
        @DisplayName("should not expose a bound value to other threads")
        void shouldIsolateThreads() throws Exception {
            slot.bind("main-thread");
            AtomicReference<String> seen = new AtomicReference<>();
            CountDownLatch latch = new CountDownLatch(1);

            Thread thread = new Thread(() -> {
                seen.set(slot.current());
                latch.countDown();
            });
            thread.start();
            latch.await(1, TimeUnit.SECONDS);

            assertThat(seen.get()).isEqualTo("-");
        }

        @Test
        @DisplayName("should carry the captured value into wrapped Runnable")
        void shouldPropagateIntoWrappedRunnable() throws Exception {
            slot.bind("wrapped");
            AtomicReference<String> seen = new AtomicReference<>();
            Runnable wrapped = slot.wrap(() -> seen.set(slot.current()));

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(wrapped).get(1, TimeUnit.SECONDS);
                String afterTask = executor.submit(slot::current).get(1, TimeUnit.SECONDS);

                assertThat(seen.get()).isEqualTo("wrapped");
                assertThat(afterTask).isEqualTo("-");
            } finally {
                executor.shutdown();
            }
        }

        @Test
        @DisplayName("should carry the captured value into wrapped Callable")
        void shouldPropagateIntoWrappedCallable() throws Exception {
            slot.bind("callable");
            Callable<String> wrapped = slot.wrap((Callable<String>) slot::current);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                assertThat(executor.submit(wrapped).get(1, TimeUnit.SECONDS)).isEqualTo("callable");
            } finally {
                executor.shutdown();
            }
        }
    }
}
