package com.causalflow.tracer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TraceContextHolder}: inheritable storage, MDC bridge and task wrapping.
 */
@DisplayName("TraceContextHolder")
class TraceContextHolderTest {

    private final TraceContextHolder holder = new TraceContextHolder();

    @AfterEach
    void cleanup() {
        holder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when nothing is set")
        void emptyByDefault() {
            assertThat(holder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve the id")
        void storeAndRetrieve() {
            holder.set("node-1");

            assertThat(holder.get()).contains("node-1");
        }

        @Test
        @DisplayName("null and empty ids clear the context")
        void nullAndEmptyClear() {
            holder.set("node-1");
            holder.set(null);
            assertThat(holder.get()).isEmpty();

            holder.set("node-2");
            holder.set("");
            assertThat(holder.get()).isEmpty();
        }

        @Test
        @DisplayName("separate holders do not share state")
        void holdersAreIndependent() {
            TraceContextHolder other = new TraceContextHolder();
            holder.set("node-1");

            assertThat(other.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should publish the id under traceNodeId")
        void publishesId() {
            holder.set("node-1");

            assertThat(MDC.get(TraceContextHolder.MDC_TRACE_NODE_ID)).isEqualTo("node-1");
        }

        @Test
        @DisplayName("should remove the key on clear")
        void removesOnClear() {
            holder.set("node-1");
            holder.clear();

            assertThat(MDC.get(TraceContextHolder.MDC_TRACE_NODE_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class Scoped {

        @Test
        @DisplayName("runWithTrace restores the previous id")
        void restoresPrevious() {
            holder.set("outer");
            AtomicReference<String> seen = new AtomicReference<>();

            holder.runWithTrace("inner", () -> seen.set(holder.get().orElse(null)));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(holder.get()).contains("outer");
        }

        @Test
        @DisplayName("runWithTrace restores even when the task throws")
        void restoresOnFailure() {
            assertThatThrownBy(() -> holder.runWithTrace("inner", () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(holder.get()).isEmpty();
            assertThat(MDC.get(TraceContextHolder.MDC_TRACE_NODE_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("thread propagation")
    class Propagation {

        @Test
        @DisplayName("child threads inherit the id and may change it without affecting the parent")
        void inheritance() throws InterruptedException {
            holder.set("parent-span");
            AtomicReference<String> inherited = new AtomicReference<>();

            Thread child = new Thread(() -> {
                inherited.set(holder.get().orElse(null));
                holder.set("child-span");
            });
            child.start();
            child.join();

            assertThat(inherited.get()).isEqualTo("parent-span");
            assertThat(holder.get()).contains("parent-span");
        }

        @Test
        @DisplayName("wrapped callable runs with the captured id")
        void wrapCallable() throws Exception {
            holder.set("captured");
            Callable<String> task = holder.wrap(() -> holder.get().orElse("none"));
            holder.set("later");

            assertThat(task.call()).isEqualTo("captured");
            assertThat(holder.get()).contains("later");
        }

        @Test
        @DisplayName("wrapped runnable runs with the captured id")
        void wrapRunnable() {
            holder.set("captured");
            AtomicReference<String> seen = new AtomicReference<>();
            Runnable task = holder.wrap((Runnable) () -> seen.set(holder.get().orElse(null)));
            holder.clear();

            task.run();

            assertThat(seen.get()).isEqualTo("captured");
            assertThat(holder.get()).isEmpty();
        }
    }
}
