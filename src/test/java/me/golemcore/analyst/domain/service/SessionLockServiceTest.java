package me.golemcore.analyst.domain.service;

import me.golemcore.analyst.domain.model.AgentErrorKind;
import me.golemcore.analyst.domain.model.AgentException;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionLockServiceTest {

    private SessionLockService lockService;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        AnalystProperties properties = new AnalystProperties();
        properties.getAgent().setSessionLockTimeout(Duration.ofMillis(200));
        lockService = new SessionLockService(properties);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReturnActionResult() {
        assertEquals("done", lockService.withLock("s1", () -> "done"));
        assertEquals(0, lockService.trackedLocks());
    }

    @Test
    void shouldFailWithSessionBusyWhenLockHeldTooLong() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Object> holder = executor.submit(() -> lockService.withLock("s1", () -> {
            acquired.countDown();
            await(release);
            return null;
        }));
        assertTrue(acquired.await(2, TimeUnit.SECONDS));

        AgentException ex = assertThrows(AgentException.class, () -> lockService.withLock("s1", () -> "second"));

        assertEquals(AgentErrorKind.SESSION_BUSY, ex.getKind());
        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldNotBlockOtherSessions() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Object> holder = executor.submit(() -> lockService.withLock("s1", () -> {
            acquired.countDown();
            await(release);
            return null;
        }));
        assertTrue(acquired.await(2, TimeUnit.SECONDS));

        assertEquals("other", lockService.withLock("s2", () -> "other"));

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldSerializeOperationsOnSameSession() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AnalystProperties properties = new AnalystProperties();
        properties.getAgent().setSessionLockTimeout(Duration.ofSeconds(5));
        SessionLockService patient = new SessionLockService(properties);

        Runnable task = () -> patient.withLock("s1", () -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            sleepQuietly(20);
            inside.decrementAndGet();
            return null;
        });
        Future<?> a = executor.submit(task);
        Future<?> b = executor.submit(task);
        Future<?> c = executor.submit(task);
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        c.get(5, TimeUnit.SECONDS);

        assertEquals(1, maxInside.get());
    }

    @Test
    void shouldReleaseLockWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> lockService.withLock("s1", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals("after", lockService.withLock("s1", () -> "after"));
    }

    @Test
    void shouldNotKeepLocksForFailedCallsOnUnknownSessions() {
        for (int i = 0; i < 1000; i++) {
            String id = "missing-" + i;
            assertThrows(AgentException.class, () -> lockService.withLock(id, () -> {
                throw AgentException.notFound(id);
            }));
        }

        assertEquals(0, lockService.trackedLocks());
    }

    @Test
    void shouldTrackLockOnlyWhileInUse() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<Object> holder = executor.submit(() -> lockService.withLock("s1", () -> {
            acquired.countDown();
            await(release);
            return null;
        }));
        assertTrue(acquired.await(2, TimeUnit.SECONDS));

        assertEquals(1, lockService.trackedLocks());
        assertThrows(AgentException.class, () -> lockService.withLock("s1", () -> "second"));
        assertEquals(1, lockService.trackedLocks());

        release.countDown();
        holder.get(2, TimeUnit.SECONDS);
        assertEquals(0, lockService.trackedLocks());
    }

    @Test
    void shouldKeepMutualExclusionWhileEntriesComeAndGo() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AnalystProperties properties = new AnalystProperties();
        properties.getAgent().setSessionLockTimeout(Duration.ofSeconds(5));
        SessionLockService patient = new SessionLockService(properties);

        Runnable task = () -> {
            for (int i = 0; i < 50; i++) {
                patient.withLock("s1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    inside.decrementAndGet();
                    return null;
                });
            }
        };
        Future<?> a = executor.submit(task);
        Future<?> b = executor.submit(task);
        Future<?> c = executor.submit(task);
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        c.get(5, TimeUnit.SECONDS);

        assertEquals(1, maxInside.get());
        assertEquals(0, patient.trackedLocks());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
