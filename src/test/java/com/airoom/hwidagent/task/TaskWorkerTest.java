package com.airoom.hwidagent.task;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskWorkerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private TaskWorker worker;

    private static void pause(long ms) throws TaskFailedException {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskFailedException("interrupted");
        }
    }

    private static void awaitQuietly(CountDownLatch latch) throws TaskFailedException {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskFailedException("interrupted");
        }
    }

    @AfterEach
    void tearDown() {
        if (worker != null) worker.stop();
    }

    @Test
    void resultIsCorrelatedById() {
        worker = new TaskWorker((kind, progress) -> kind.wireName());
        worker.start();

        String id = worker.submit(TaskKind.FETCH_STATS);
        TaskResult r = worker.poll(id, WAIT).orElseThrow();

        assertEquals(id, r.id());
        assertTrue(r.isSuccess());
        assertEquals("fetchStats", r.payload());
        assertTrue(id.startsWith("fetchStats_"));
    }

    @Test
    void concurrentSubmittersEachGetTheirOwnResult() throws Exception {
        // payload 에 실행 순번을 넣어 id ↔ 결과 대응 확인
        AtomicInteger executed = new AtomicInteger();
        Map<String, Integer> ranAs = new ConcurrentHashMap<>();
        worker = new TaskWorker((kind, progress) -> executed.incrementAndGet());
        worker.start();

        int n = 16;
        ExecutorService callers = Executors.newFixedThreadPool(n);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            final String myId = "caller-" + i;
            futures.add(callers.submit(() -> {
                go.await();
                String id = worker.submit("collect", myId);
                TaskResult r = worker.poll(id, WAIT).orElseThrow();
                assertEquals(myId, r.id());
                ranAs.put(myId, (Integer) r.payload());
                return r.id();
            }));
        }
        go.countDown();
        for (int i = 0; i < n; i++) {
            assertEquals("caller-" + i, futures.get(i).get(10, TimeUnit.SECONDS));
        }
        callers.shutdownNow();

        assertEquals(n, executed.get());
        // 각 작업은 정확히 한 번 실행, 순번이 겹치지 않음
        assertEquals(n, ranAs.values().stream().distinct().count());
    }

    @Test
    void unknownKindYieldsErrorResult() {
        worker = new TaskWorker((kind, progress) -> "ok");
        worker.start();

        String id = worker.submit("reticulateSplines");
        TaskResult r = worker.poll(id, WAIT).orElseThrow();

        assertEquals(TaskStatus.ERROR, r.status());
        assertEquals("unknown task kind reticulateSplines", r.errorMessage());
    }

    @Test
    void handlerExceptionBecomesErrorAndLoopContinues() {
        worker = new TaskWorker((kind, progress) -> {
            if (kind == TaskKind.COLLECT) throw new IllegalStateException("boom");
            if (kind == TaskKind.COMPARE_ONLY) throw new TaskFailedException("Failed to collect HWID data");
            return "fine";
        });
        worker.start();

        String bad = worker.submit(TaskKind.COLLECT);
        String failed = worker.submit(TaskKind.COMPARE_ONLY);
        String good = worker.submit(TaskKind.FETCH_STATS);

        assertEquals("boom", worker.poll(bad, WAIT).orElseThrow().errorMessage());
        assertEquals("Failed to collect HWID data", worker.poll(failed, WAIT).orElseThrow().errorMessage());
        assertEquals("fine", worker.poll(good, WAIT).orElseThrow().payload());
    }

    @Test
    void tasksRunOneAtATimeInOrder() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<String> order = new ArrayList<>();
        worker = new TaskWorker((kind, progress) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            synchronized (order) { order.add(kind.wireName()); }
            pause(5);
            inFlight.decrementAndGet();
            return null;
        });
        worker.start();

        List<String> ids = new ArrayList<>();
        for (TaskKind k : TaskKind.values()) ids.add(worker.submit(k));
        for (String id : ids) assertTrue(worker.poll(id, WAIT).isPresent());

        assertEquals(1, maxInFlight.get());
        assertEquals(List.of("collect", "compareOnly", "banCurrent", "runAntiCheatCheck", "fetchStats"), order);
    }

    @Test
    void pollTimesOutWhileTaskIsPendingAndResultStaysClaimable() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        worker = new TaskWorker((kind, progress) -> {
            progress.accept("Collecting HWID data...");
            awaitQuietly(release);
            return "late";
        });
        worker.start();

        String id = worker.submit(TaskKind.COLLECT);
        assertTrue(worker.poll(id, Duration.ofMillis(50)).isEmpty());

        long deadline = System.currentTimeMillis() + 5000;
        while (!worker.isWorking() && System.currentTimeMillis() < deadline) Thread.sleep(5);
        assertTrue(worker.isWorking());
        assertEquals("Collecting HWID data...", worker.progress());

        release.countDown();
        assertEquals("late", worker.poll(id, WAIT).orElseThrow().payload());
        // 한 번 받아간 결과는 다시 나오지 않음
        assertTrue(worker.poll(id, Duration.ZERO).isEmpty());
    }

    @Test
    void unknownIdPollsEmpty() {
        worker = new TaskWorker((kind, progress) -> null);
        assertTrue(worker.poll("nope", Duration.ofMillis(10)).isEmpty());
    }

    @Test
    void duplicatePendingIdIsRejected() {
        worker = new TaskWorker((kind, progress) -> null);
        worker.submit("collect", "same");
        assertThrows(IllegalStateException.class, () -> worker.submit("collect", "same"));
    }

    @Test
    void stopFailsQueuedAndLaterTasks() {
        worker = new TaskWorker((kind, progress) -> "never");
        String queued = worker.submit(TaskKind.COLLECT); // 시작 전이라 큐에 남음

        worker.stop();
        String after = worker.submit(TaskKind.COLLECT);

        assertEquals("worker stopped", worker.poll(queued, Duration.ZERO).orElseThrow().errorMessage());
        assertEquals("worker stopped", worker.poll(after, Duration.ZERO).orElseThrow().errorMessage());
    }

    @Test
    void generatedIdsAreUnique() {
        worker = new TaskWorker((kind, progress) -> null);
        String a = worker.submit(TaskKind.COLLECT);
        String b = worker.submit(TaskKind.COLLECT);
        assertNotEquals(a, b);
    }
}
