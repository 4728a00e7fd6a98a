package com.github.rudygunawan.adaptivecache.impl;

import com.github.rudygunawan.adaptivecache.api.MaintainableCache;
import com.github.rudygunawan.adaptivecache.api.Optimizable;
import com.github.rudygunawan.adaptivecache.model.CleanupEvent;
import com.github.rudygunawan.adaptivecache.model.CleanupReport;
import com.github.rudygunawan.adaptivecache.model.CleanupResult;
import com.github.rudygunawan.adaptivecache.model.CleanupStats;
import com.github.rudygunawan.adaptivecache.time.FakeTicker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CacheCleanupServiceTest {

    private final FakeTicker ticker = new FakeTicker();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    /**
     * Stub cache reporting a fixed number of expired entries per sweep.
     */
    static class StubCache implements MaintainableCache {
        final String name;
        final int expiredPerSweep;
        final double utilization;
        final AtomicInteger sweeps = new AtomicInteger();
        volatile RuntimeException failure;

        StubCache(String name, int expiredPerSweep, double utilization) {
            this.name = name;
            this.expiredPerSweep = expiredPerSweep;
            this.utilization = utilization;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public long size() {
            return 10;
        }

        @Override
        public long expiredEntryCount() {
            return expiredPerSweep;
        }

        @Override
        public double utilization() {
            return utilization;
        }

        @Override
        public int removeExpiredEntries() {
            sweeps.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return expiredPerSweep;
        }
    }

    static class OptimizableStubCache extends StubCache implements Optimizable {
        final AtomicInteger optimizations = new AtomicInteger();

        OptimizableStubCache(String name, int expiredPerSweep, double utilization) {
            super(name, expiredPerSweep, utilization);
        }

        @Override
        public void optimize() {
            optimizations.incrementAndGet();
        }
    }

    private CacheCleanupService newService(List<? extends MaintainableCache> caches) {
        return new CacheCleanupService(caches, Duration.ofMinutes(1), scheduler, ticker);
    }

    @Test
    void testRemoveExpiredEntriesSumsAcrossCaches() {
        StubCache first = new StubCache("first", 2, 0.5);
        StubCache second = new StubCache("second", 3, 0.5);
        CacheCleanupService service = newService(List.of(first, second));

        assertEquals(5, service.removeExpiredEntries());
        assertEquals(5, service.getCleanupStats().getTotalExpiredRemoved());
        assertTrue(service.getCleanupStats().getLastCleanupNanos().isPresent());
    }

    @Test
    void testOnlyOptimizableCachesAreOptimized() {
        StubCache plain = new StubCache("plain", 0, 0.5);
        OptimizableStubCache optimizable = new OptimizableStubCache("optimizable", 0, 0.5);
        CacheCleanupService service = newService(List.of(plain, optimizable));

        service.optimizeCache();

        assertEquals(1, optimizable.optimizations.get());
        assertEquals(1, service.getCleanupStats().getTotalOptimizations());
    }

    @Test
    void testOptimizationEveryTenthRun() {
        OptimizableStubCache cache = new OptimizableStubCache("c", 1, 0.5);
        CacheCleanupService service = newService(List.of(cache));

        for (int i = 0; i < 9; i++) {
            service.performBackgroundCleanup();
        }
        assertEquals(0, cache.optimizations.get());

        service.performBackgroundCleanup();
        assertEquals(1, cache.optimizations.get());
        assertEquals(10, service.getCleanupStats().getBackgroundRuns());
        assertEquals(1.0, service.getCleanupStats().getAverageExpiredPerCleanup(), 1e-9);
    }

    @Test
    void testOptimizationAfterTenMinutesSinceStart() {
        OptimizableStubCache cache = new OptimizableStubCache("c", 0, 0.5);
        CacheCleanupService service = newService(List.of(cache));
        service.startBackgroundCleanup();

        service.performBackgroundCleanup();
        assertEquals(0, cache.optimizations.get());

        ticker.advance(10, TimeUnit.MINUTES);
        service.performBackgroundCleanup();
        assertEquals(1, cache.optimizations.get());

        // measured from the last optimization from now on
        service.performBackgroundCleanup();
        assertEquals(1, cache.optimizations.get());

        service.stopBackgroundCleanup();
    }

    @Test
    void testFailuresAreRecordedAndNotPropagated() {
        StubCache broken = new StubCache("broken", 0, 0.5);
        broken.failure = new IllegalStateException("boom");
        StubCache healthy = new StubCache("healthy", 4, 0.5);
        CacheCleanupService service = newService(List.of(broken, healthy));

        assertDoesNotThrow(service::performBackgroundCleanup);

        assertEquals(1, healthy.sweeps.get());
        CleanupStats stats = service.getCleanupStats();
        assertEquals(1, stats.getEventSummary().get(CleanupEvent.Type.ERROR));
        assertTrue(stats.getErrorRate() > 0.0);
        assertEquals(4, stats.getTotalExpiredRemoved());
    }

    @Test
    void testForceCleanupReportsErrors() {
        StubCache broken = new StubCache("broken", 0, 0.5);
        broken.failure = new IllegalStateException("boom");
        CacheCleanupService service = newService(List.of(broken, new StubCache("ok", 3, 0.5)));

        CleanupResult result = service.forceCleanup(false);

        assertFalse(result.isSuccess());
        assertEquals(3, result.getExpiredRemoved());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("broken"));
    }

    @Test
    void testForceCleanupWithOptimization() {
        OptimizableStubCache cache = new OptimizableStubCache("c", 2, 0.5);
        CacheCleanupService service = newService(List.of(cache));

        CleanupResult result = service.forceCleanup(true);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getExpiredRemoved());
        assertEquals(1, cache.optimizations.get());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testEventLogIsBounded() {
        CacheCleanupService service = newService(List.of(new StubCache("c", 0, 0.5)));
        for (int i = 0; i < 150; i++) {
            service.removeExpiredEntries();
        }
        assertEquals(CacheCleanupService.MAX_EVENTS, service.recentEvents().size());
    }

    @Test
    void testOldEventsArePrunedByBackgroundPass() {
        CacheCleanupService service = newService(List.of(new StubCache("c", 0, 0.5)));
        service.removeExpiredEntries();
        ticker.advance(61, TimeUnit.MINUTES);

        service.performBackgroundCleanup();

        for (CleanupEvent event : service.recentEvents()) {
            assertTrue(ticker.read() - event.getTimestampNanos() < CacheCleanupService.EVENT_RETENTION_NANOS);
        }
    }

    @Test
    void testStartAndStop() {
        CacheCleanupService service = newService(List.of(new StubCache("c", 0, 0.5)));
        assertFalse(service.isBackgroundCleanupRunning());

        service.startBackgroundCleanup();
        service.startBackgroundCleanup();
        assertTrue(service.isBackgroundCleanupRunning());
        assertTrue(service.getCleanupStats().isBackgroundActive());

        ticker.advance(5, TimeUnit.MINUTES);
        assertEquals(Duration.ofMinutes(5), service.getCleanupStats().getUptime());

        service.stopBackgroundCleanup();
        assertFalse(service.isBackgroundCleanupRunning());
        assertEquals(Duration.ZERO, service.getCleanupStats().getUptime());
        assertEquals(2, service.getCleanupStats().getEventSummary().get(CleanupEvent.Type.BACKGROUND));
    }

    @Test
    @Timeout(5)
    void testScheduledPassesRun() throws InterruptedException {
        CountDownLatch swept = new CountDownLatch(2);
        StubCache cache = new StubCache("c", 0, 0.5) {
            @Override
            public int removeExpiredEntries() {
                swept.countDown();
                return 0;
            }
        };
        CacheCleanupService service = new CacheCleanupService(List.of(cache), Duration.ofMillis(20), scheduler, ticker);

        service.startBackgroundCleanup();

        assertTrue(swept.await(5, TimeUnit.SECONDS));
        service.stopBackgroundCleanup();
    }

    @Test
    @Timeout(10)
    void testErrorInSweepDoesNotStopScheduledPasses() throws InterruptedException {
        CountDownLatch laterSweeps = new CountDownLatch(2);
        AtomicInteger sweeps = new AtomicInteger();
        StubCache cache = new StubCache("broken-once", 0, 0.5) {
            @Override
            public int removeExpiredEntries() {
                if (sweeps.incrementAndGet() == 1) {
                    throw new AssertionError("first sweep fails");
                }
                laterSweeps.countDown();
                return 0;
            }
        };
        CacheCleanupService service = new CacheCleanupService(List.of(cache), Duration.ofMillis(20), scheduler, ticker);

        service.startBackgroundCleanup();

        assertTrue(laterSweeps.await(5, TimeUnit.SECONDS));
        assertTrue(service.isBackgroundCleanupRunning());
        assertTrue(service.recentEvents().stream()
                .anyMatch(e -> e.getType() == CleanupEvent.Type.ERROR && e.getMessage().contains("first sweep fails")));
        service.stopBackgroundCleanup();
    }

    @Test
    void testErrorInOptimizeIsRecorded() {
        StubCache cache = new OptimizableStubCache("c", 0, 0.5) {
            @Override
            public void optimize() {
                throw new StackOverflowError();
            }
        };
        CacheCleanupService service = newService(List.of(cache));

        CleanupResult result = service.forceCleanup(true);

        assertFalse(result.isSuccess());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("StackOverflowError"));
    }

    @Test
    void testEfficiency() {
        CacheCleanupService service = newService(List.of(new StubCache("c", 0, 0.5)));
        assertEquals(0.0, service.getCleanupStats().getCleanupEfficiency());

        service.performBackgroundCleanup();
        // nothing removed yet and no errors
        assertEquals(0.5, service.getCleanupStats().getCleanupEfficiency(), 1e-9);
    }

    @Test
    void testReportRecommendations() {
        CacheCleanupService full = newService(List.of(new StubCache("full", 0, 0.95)));
        CleanupReport report = full.getCleanupReport();
        assertTrue(report.getRecommendations().contains("High cache utilization detected. Consider increasing cache sizes."));
        assertEquals(1, report.getCaches().size());
        assertEquals("full", report.getCaches().get(0).getName());

        CacheCleanupService idle = newService(List.of(new StubCache("idle", 0, 0.1)));
        assertTrue(idle.getCleanupReport().getRecommendations()
                .contains("Low cache utilization. Consider optimizing cache strategies or reducing sizes."));

        CacheCleanupService healthy = newService(List.of(new StubCache("healthy", 0, 0.5)));
        assertEquals(List.of("Cache cleanup is operating optimally!"), healthy.getCleanupReport().getRecommendations());
    }

    @Test
    void testReportKeepsTwentyMostRecentEvents() {
        CacheCleanupService service = newService(List.of(new StubCache("c", 0, 0.5)));
        for (int i = 0; i < 30; i++) {
            ticker.advance(1, TimeUnit.SECONDS);
            service.removeExpiredEntries();
        }

        List<CleanupEvent> events = service.getCleanupReport().getRecentEvents();
        assertEquals(CacheCleanupService.REPORT_EVENTS, events.size());
        assertEquals(ticker.read(), events.get(events.size() - 1).getTimestampNanos());
    }
}
