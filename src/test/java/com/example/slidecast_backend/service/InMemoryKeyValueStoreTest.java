package com.example.slidecast_backend.service;

import com.example.slidecast_backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);

    @Test
    void valuesExpireAfterTheirTtl() {
        store.set("a", "1", Duration.ofMinutes(5));
        store.set("b", "2");

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("a")).isEmpty();
        assertThat(store.exists("a")).isFalse();
        assertThat(store.get("b")).contains("2");
    }

    @Test
    void listIsFifoAndSupportsRemoval() {
        store.pushTail("q", "1");
        store.pushTail("q", "2");
        store.pushTail("q", "3");

        assertThat(store.removeFromList("q", "2")).isEqualTo(1);
        assertThat(store.removeFromList("q", "2")).isZero();
        assertThat(store.popHead("q", Duration.ofMillis(5))).contains("1");
        assertThat(store.popHead("q", Duration.ofMillis(5))).contains("3");
        assertThat(store.popHead("q", Duration.ofMillis(5))).isEmpty();
    }

    @Test
    void popBlocksUntilAValueArrives() throws Exception {
        CompletableFuture<java.util.Optional<String>> pending =
                CompletableFuture.supplyAsync(() -> store.popHead("q", Duration.ofSeconds(5)));

        Thread.sleep(50);
        store.pushTail("q", "late");

        assertThat(pending.get(5, TimeUnit.SECONDS)).contains("late");
    }
}
