package com.eainde.vendorrisk.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedFanOutTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor("fan-out-test", 2);

    @AfterEach
    void tearDown() {
        executor.close();
        MDC.clear();
    }

    @Test
    @DisplayName("should keep input order and drop empty, failed and slow tasks")
    void dropsFailures() {
        List<Integer> results = BoundedFanOut.map(List.of(1, 2, 3, 4, 5), i -> {
            if (i == 2) return Optional.empty();
            if (i == 3) throw new IllegalStateException("boom");
            if (i == 4) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Optional.of(i * 10);
        }, executor, Duration.ofMillis(300), () -> false);

        assertThat(results).containsExactly(10, 50);
    }

    @Test
    @DisplayName("should not start tasks once stopped")
    void stopped() {
        AtomicInteger started = new AtomicInteger();

        List<Integer> results = BoundedFanOut.map(List.of(1, 2, 3), i -> {
            started.incrementAndGet();
            return Optional.of(i);
        }, executor, Duration.ofSeconds(1), () -> true);

        assertThat(results).isEmpty();
        assertThat(started).hasValue(0);
    }

    @Test
    @DisplayName("should carry the caller's MDC into worker threads")
    void propagatesMdc() {
        MDC.put("runId", "run-42");

        List<String> seen = BoundedFanOut.map(List.of(1, 2), i -> Optional.ofNullable(MDC.get("runId")),
                executor, Duration.ofSeconds(1), () -> false);

        assertThat(seen).containsExactly("run-42", "run-42");
    }
}
