package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.api.AdaptiveCache;
import com.github.rudygunawan.adaptivecache.builder.CacheBuilder;
import com.github.rudygunawan.adaptivecache.model.CacheStats;
import com.github.rudygunawan.adaptivecache.time.FakeTicker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GetOrComputeTest {

    private final FakeTicker ticker = new FakeTicker();
    private AdaptiveCache cache;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        cache = CacheBuilder.newBuilder()
                .ticker(ticker)
                .enableBackgroundCleanup(false)
                .build();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        cache.dispose();
    }

    @Test
    void testComputesOnMissAndCachesResult() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrCompute("k", () -> "value" + calls.incrementAndGet());
        String second = cache.getOrCompute("k", () -> "value" + calls.incrementAndGet());

        assertEquals("value1", first);
        assertEquals("value1", second);
        assertEquals(1, calls.get());

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.loadSuccessCount());
        assertEquals(1, stats.hitCount());
    }

    @Test
    void testCachedValueSkipsComputation() throws Exception {
        cache.set("k", "cached");
        String value = cache.getOrCompute("k", () -> {
            throw new AssertionError("must not compute");
        });
        assertEquals("cached", value);
    }

    @Test
    @Timeout(10)
    void testConcurrentCallersShareOneComputation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        int callers = 8;

        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return cache.getOrCompute("shared", () -> {
                    calls.incrementAndGet();
                    Thread.sleep(50);
                    return "computed";
                });
            }));
        }
        start.countDown();

        for (Future<String> result : results) {
            assertEquals("computed", result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, calls.get());
        assertEquals("computed", cache.peek("shared"));
    }

    @Test
    @Timeout(10)
    void testFailureReachesEveryWaiterAndAllowsRetry() throws Exception {
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();

        Future<String> first = executor.submit(() -> cache.getOrCompute("k", () -> {
            calls.incrementAndGet();
            computing.countDown();
            release.await();
            throw new IOException("backend down");
        }));
        assertTrue(computing.await(5, TimeUnit.SECONDS));

        CompletableFuture<String> waiter = cache.getOrComputeAsync("k",
                () -> CompletableFuture.completedFuture("unused"));
        release.countDown();

        ExecutionException e1 = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e1.getCause());
        ExecutionException e2 = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e2.getCause());

        assertEquals(1, calls.get());
        assertNull(cache.peek("k"));
        assertEquals(1, cache.getStats().loadFailureCount());

        String retried = cache.getOrCompute("k", () -> "recovered");
        assertEquals("recovered", retried);
    }

    @Test
    void testCheckedExceptionIsRethrownDirectly() {
        IOException thrown = assertThrows(IOException.class,
                () -> cache.getOrCompute("k", () -> {
                    throw new IOException("boom");
                }));
        assertEquals("boom", thrown.getMessage());
    }

    @Test
    @Timeout(10)
    void testErrorReleasesKeyForRetry() throws Exception {
        AssertionError thrown = assertThrows(AssertionError.class,
                () -> cache.getOrCompute("k", () -> {
                    throw new AssertionError("boom");
                }));
        assertEquals("boom", thrown.getMessage());
        assertEquals(1, cache.getStats().loadFailureCount());

        Future<String> retry = executor.submit(() -> cache.getOrCompute("k", () -> "ok"));
        assertEquals("ok", retry.get(5, TimeUnit.SECONDS));
    }

    @Test
    @Timeout(10)
    void testErrorFromAsyncSupplierReleasesKey() throws Exception {
        CompletableFuture<String> failed = cache.getOrComputeAsync("k", () -> {
            throw new StackOverflowError();
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
        assertInstanceOf(StackOverflowError.class, e.getCause());

        CompletableFuture<String> retry = cache.getOrComputeAsync("k",
                () -> CompletableFuture.completedFuture("ok"));
        assertEquals("ok", retry.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testNullResultIsAFailure() {
        assertThrows(NullPointerException.class, () -> cache.getOrCompute("k", () -> null));
        assertEquals(1, cache.getStats().loadFailureCount());
    }

    @Test
    void testLoadTimeUsesTicker() throws Exception {
        cache.getOrCompute("k", () -> {
            ticker.advance(30, TimeUnit.MILLISECONDS);
            return "v";
        });
        assertEquals(TimeUnit.MILLISECONDS.toNanos(30), cache.getStats().totalLoadTimeNanos());
    }

    @Test
    @Timeout(10)
    void testAsyncComputation() throws Exception {
        CompletableFuture<String> source = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> first = cache.getOrComputeAsync("k", () -> {
            calls.incrementAndGet();
            return source;
        });
        CompletableFuture<String> second = cache.getOrComputeAsync("k", () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });
        assertFalse(first.isDone());

        source.complete("async");

        assertEquals("async", first.get(5, TimeUnit.SECONDS));
        assertEquals("async", second.get(5, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
        assertEquals("async", cache.peek("k"));
    }

    @Test
    void testDisposeFailsPendingComputations() {
        CompletableFuture<String> pending = cache.getOrComputeAsync("k", CompletableFuture::new);

        cache.dispose();

        ExecutionException e = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
