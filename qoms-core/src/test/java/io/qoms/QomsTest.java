package io.qoms;

import io.qoms.dead.DeadLetterEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QomsTest {

    private final List<Qoms> opened = new ArrayList<>();
    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());

    @AfterEach
    void closeAll() {
        opened.forEach(Qoms::close);
    }

    private Qoms newQoms(StubResourceSampler sampler) {
        return newQoms(sampler, b -> { });
    }

    private Qoms newQoms(StubResourceSampler sampler, Consumer<QomsConfig.Builder> customizer) {
        QomsConfig.Builder builder = QomsConfig.builder()
                .checkIntervalMs(5)
                .metricsCacheMs(0)
                .interItemDelayMs(0)
                .drainTimeoutMs(1000);
        customizer.accept(builder);
        Qoms qoms = Qoms.builder()
                .config(builder.build())
                .sampler(sampler)
                .build();
        opened.add(qoms);
        return qoms;
    }

    private Operation<String> recording(String name) {
        return () -> {
            executed.add(name);
            return name;
        };
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    private static void awaitAll(List<? extends CompletableFuture<?>> futures) throws Exception {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(10, TimeUnit.SECONDS);
    }

    // ── Ordering ────────────────────────────────────────────────────

    @Test
    void higherTierSubmittedLaterRunsFirst() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);

        CompletableFuture<String> a = qoms.medium(recording("A"));
        CompletableFuture<String> b = qoms.medium(recording("B"));
        CompletableFuture<String> c = qoms.high(recording("C"));
        Thread.sleep(30);
        sampler.ram(10);

        awaitAll(List.of(a, b, c));
        assertEquals(List.of("C", "A", "B"), executed);
    }

    @Test
    void everyHighItemRunsBeforeAnyLowItem() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(qoms.low(recording("low-" + i)));
            futures.add(qoms.high(recording("high-" + i)));
        }
        Thread.sleep(30);
        sampler.ram(10);

        awaitAll(futures);
        for (int i = 0; i < 5; i++) {
            assertTrue(executed.get(i).startsWith("high-"), executed.toString());
            assertTrue(executed.get(i + 5).startsWith("low-"), executed.toString());
        }
    }

    @Test
    void sameTierRunsInSubmissionOrder() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(qoms.enqueue(recording("m" + i)));
            expected.add("m" + i);
        }
        sampler.ram(10);

        awaitAll(futures);
        assertEquals(expected, executed);
    }

    // ── Retry and dead letters ──────────────────────────────────────

    @Test
    void failedAttemptsBackOffExponentially() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler, b -> b.maxRetries(3).baseRetryDelayMs(100).maxRetryDelayMs(1000));
        List<Long> attempts = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<String> future = qoms.medium(() -> {
            attempts.add(System.nanoTime());
            if (attempts.size() < 3) {
                throw new IllegalStateException("attempt " + attempts.size());
            }
            return "third time lucky";
        });
        sampler.ram(10);

        assertEquals("third time lucky", future.get(10, TimeUnit.SECONDS));
        assertEquals(3, attempts.size());
        long firstGapMs = TimeUnit.NANOSECONDS.toMillis(attempts.get(1) - attempts.get(0));
        long secondGapMs = TimeUnit.NANOSECONDS.toMillis(attempts.get(2) - attempts.get(1));
        assertTrue(firstGapMs >= 95, "first gap " + firstGapMs);
        assertTrue(secondGapMs >= 195, "second gap " + secondGapMs);
        assertEquals(2, qoms.getStats().totalRetries());
    }

    @Test
    void operationIsDeadLetteredAfterMaxRetries() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler, b -> b.maxRetries(3).baseRetryDelayMs(10).maxRetryDelayMs(50));
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> future = qoms.low(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("disk full");
        });
        sampler.ram(10);

        RetriesExhaustedException e = assertInstanceOf(RetriesExhaustedException.class, failureOf(future));
        assertEquals(3, attempts.get());
        assertEquals(3, e.retryCount());
        assertEquals("Operation failed after 3 retries. Last error: disk full", e.getMessage());
        assertTrue(e.itemId().matches("qoms_\\d+_\\d+"), e.itemId());

        List<DeadLetterEntry> dead = qoms.getDeadLetters();
        assertEquals(1, dead.size());
        assertEquals(e.itemId(), dead.get(0).id());
        assertEquals(Priority.LOW, dead.get(0).priority());
        assertEquals(3, dead.get(0).retryCount());
        assertEquals("disk full", dead.get(0).lastError());
        assertEquals(1, qoms.getStats().dlqSize());
    }

    @Test
    void deadLettersCanBeRemovedAndCleared() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler, b -> b.maxRetries(1));
        CompletableFuture<String> first = qoms.medium(() -> {
            throw new IllegalStateException("one");
        });
        CompletableFuture<String> second = qoms.medium(() -> {
            throw new IllegalStateException("two");
        });
        sampler.ram(10);
        RetriesExhaustedException e = assertInstanceOf(RetriesExhaustedException.class, failureOf(first));
        failureOf(second);

        assertTrue(qoms.removeDeadLetter(e.itemId()));
        assertFalse(qoms.removeDeadLetter(e.itemId()));
        assertEquals(1, qoms.getDeadLetters().size());
        assertEquals(1, qoms.clearDeadLetters());
        assertTrue(qoms.getDeadLetters().isEmpty());
    }

    // ── Admission ───────────────────────────────────────────────────

    @Test
    void criticalRunsWhileHostIsSaturated() throws Exception {
        Qoms qoms = newQoms(new StubResourceSampler(99, 99));

        assertEquals("urgent", qoms.critical(() -> "urgent").get(5, TimeUnit.SECONDS));
        assertTrue(qoms.canExecute(Priority.CRITICAL));
        assertFalse(qoms.canExecute(Priority.HIGH));
    }

    @Test
    void criticalOvertakesBlockedQueue() throws Exception {
        Qoms qoms = newQoms(new StubResourceSampler(99, 99));
        CompletableFuture<String> blocked = qoms.high(recording("high"));

        assertEquals("urgent", qoms.critical(recording("urgent")).get(5, TimeUnit.SECONDS));

        assertFalse(blocked.isDone());
        assertEquals(List.of("urgent"), executed);
    }

    @Test
    void idleWaitsForNearlyIdleHost() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 10);
        Qoms qoms = newQoms(sampler);

        CompletableFuture<String> idle = qoms.idle(recording("idle"));
        CompletableFuture<String> medium = qoms.medium(recording("medium"));

        assertEquals("medium", medium.get(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(idle.isDone());

        sampler.set(1, 5);
        assertEquals("idle", idle.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("medium", "idle"), executed);
    }

    @Test
    void agingLiftsStarvedIdleItem() throws Exception {
        Qoms qoms = newQoms(new StubResourceSampler(10, 10), b -> b.agePromotionMs(50));

        // the host never becomes idle enough for IDLE, but one promotion makes it LOW
        assertEquals("aged", qoms.idle(() -> "aged").get(5, TimeUnit.SECONDS));
    }

    @Test
    void resourceTimeoutEventuallyDeadLetters() throws Exception {
        Qoms qoms = newQoms(new StubResourceSampler(95, 10),
                b -> b.maxWaitMs(30).maxRetries(2).baseRetryDelayMs(10).maxRetryDelayMs(10));
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> future = qoms.low(() -> {
            attempts.incrementAndGet();
            return "never";
        });

        RetriesExhaustedException e = assertInstanceOf(RetriesExhaustedException.class, failureOf(future));
        assertEquals(2, e.retryCount());
        assertTrue(e.getMessage().contains("Resource timeout"), e.getMessage());
        assertEquals(0, attempts.get());
    }

    // ── Fast path ───────────────────────────────────────────────────

    @Test
    void idleSchedulerRunsOperationOnCallerThread() throws Exception {
        Qoms qoms = newQoms(StubResourceSampler.idleHost());
        Thread caller = Thread.currentThread();

        CompletableFuture<Thread> future = qoms.enqueue(Thread::currentThread, Priority.LOW);

        assertTrue(future.isDone());
        assertSame(caller, future.get());
        assertEquals(1, qoms.getStats().totalProcessed());
        assertEquals(0, qoms.getStats().totalQueued());
    }

    @Test
    void inlineFailureIsNotRetried() {
        Qoms qoms = newQoms(StubResourceSampler.idleHost());
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> future = qoms.medium(() -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        });

        assertTrue(future.isCompletedExceptionally());
        IllegalArgumentException e = assertInstanceOf(IllegalArgumentException.class, failureOf(future));
        assertEquals("bad input", e.getMessage());
        assertEquals(1, attempts.get());
        assertTrue(qoms.getDeadLetters().isEmpty());
    }

    // ── Clearing ────────────────────────────────────────────────────

    @Test
    void clearQueueRejectsPendingButSparesRunning() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> first = qoms.medium(recording("first"));
        CompletableFuture<String> running = qoms.critical(() -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return "running";
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<String> second = qoms.low(recording("second"));
        CompletableFuture<String> third = qoms.idle(recording("third"));

        assertEquals(3, qoms.clearQueue());

        for (CompletableFuture<String> cleared : List.of(first, second, third)) {
            QueueClearedException e = assertInstanceOf(QueueClearedException.class, failureOf(cleared));
            assertEquals("Queue cleared", e.getMessage());
        }
        assertFalse(running.isDone());
        assertEquals(1, qoms.getStats().processing());

        release.countDown();
        assertEquals("running", running.get(5, TimeUnit.SECONDS));
        assertTrue(executed.isEmpty());
        assertEquals(0, qoms.clearQueue());
    }

    // ── Stats ───────────────────────────────────────────────────────

    @Test
    void statsReflectQueuedItems() {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);
        qoms.high(recording("h"));
        qoms.medium(recording("m1"));
        qoms.medium(recording("m2"));
        qoms.low(recording("l"));
        qoms.idle(recording("i"));

        QueueStats stats = qoms.getStats();

        assertEquals(1, stats.queueLengths().get(Priority.HIGH));
        assertEquals(2, stats.queueLengths().get(Priority.MEDIUM));
        assertEquals(1, stats.queueLengths().get(Priority.LOW));
        assertEquals(1, stats.queueLengths().get(Priority.IDLE));
        assertEquals(0, stats.queueLengths().get(Priority.CRITICAL));
        assertEquals(5, stats.totalQueued());
        assertEquals(0, stats.processing());
        assertEquals(0, stats.pendingRetries());
        assertEquals(90, stats.resources().ramPercent());
        assertSame(qoms.config(), stats.config());
        assertThrows(UnsupportedOperationException.class, () -> stats.queueLengths().put(Priority.HIGH, 9));
    }

    @Test
    void averageWaitCoversQueuedCompletions() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(10, 90);
        Qoms qoms = newQoms(sampler);
        CompletableFuture<String> future = qoms.medium(recording("waited"));
        Thread.sleep(50);
        sampler.ram(10);
        future.get(5, TimeUnit.SECONDS);

        QueueStats stats = qoms.getStats();

        assertEquals(1, stats.totalProcessed());
        assertTrue(stats.avgWaitTimeMs() >= 40, "avg " + stats.avgWaitTimeMs());
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void closeRejectsPendingAndLaterSubmissions() throws Exception {
        Qoms qoms = newQoms(new StubResourceSampler(10, 90));
        CompletableFuture<String> pending = qoms.medium(recording("pending"));

        qoms.close();

        QueueClearedException cleared = assertInstanceOf(QueueClearedException.class, failureOf(pending));
        assertEquals("Scheduler closed", cleared.getMessage());
        CompletableFuture<String> late = qoms.critical(recording("late"));
        IllegalStateException e = assertInstanceOf(IllegalStateException.class, failureOf(late));
        assertEquals("Qoms is closed", e.getMessage());
        assertTrue(executed.isEmpty());
    }

    @Test
    void nullArgumentsAreRejected() {
        Qoms qoms = newQoms(StubResourceSampler.idleHost());

        assertThrows(NullPointerException.class, () -> qoms.enqueue(null));
        assertThrows(NullPointerException.class, () -> qoms.enqueue(() -> "x", null));
    }

    @Test
    void samplerFailureAdmitsWork() throws Exception {
        StubResourceSampler sampler = new StubResourceSampler(99, 99);
        sampler.failing(true);
        Qoms qoms = newQoms(sampler);

        assertTrue(qoms.canExecute(Priority.IDLE));
        assertEquals("ok", qoms.low(() -> "ok").get(5, TimeUnit.SECONDS));
    }
}
