package io.eventfanout.server.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotCacheTest {

    @Test
    void servesCachedValueUntilTtlElapses() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        AtomicInteger loads = new AtomicInteger();
        SnapshotCache<Integer> cache = new SnapshotCache<>(Duration.ofSeconds(10), loads::incrementAndGet, clock);

        assertThat(cache.get()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get()).isEqualTo(2);
    }

    @Test
    void concurrentCallersShareOneRebuild() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SnapshotCache<String> cache = new SnapshotCache<>(Duration.ofMinutes(1), () -> {
            loads.incrementAndGet();
            loading.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "snapshot";
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(cache::get));
            }
            assertThat(loading.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(50);
            release.countDown();

            for (Future<String> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("snapshot");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loads).hasValue(1);
    }

    @Test
    void failedRebuildKeepsNothingAndRetriesNextCall() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SnapshotCache<String> cache = new SnapshotCache<>(Duration.ofMinutes(1), () -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("db down");
            return "ok";
        });

        assertThatThrownBy(cache::get).isInstanceOf(IllegalStateException.class);
        assertThat(cache.get()).isEqualTo("ok");
    }

    @Test
    void invalidateForcesRebuild() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        SnapshotCache<Integer> cache = new SnapshotCache<>(Duration.ofMinutes(1), loads::incrementAndGet);

        cache.get();
        cache.invalidate();

        assertThat(cache.get()).isEqualTo(2);
    }
}
