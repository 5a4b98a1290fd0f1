package com.airoom.hwidagent.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 단일 워커 스레드(hwid-task-worker)가 FIFO 큐의 작업을 하나씩 처리.
 *
 * 결과 전달: 제출 시점에 id 별 CompletableFuture 슬롯을 만들고, poll 은 자기 id 의 future 만 기다린다.
 * (공유 결과 큐 없음 → 다른 호출자의 결과를 꺼냈다가 되돌려 넣는 일 없음)
 * 핸들러 예외는 디스패치에서 잡아 ERROR 결과로 바꾸며 루프는 계속 돈다.
 */
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    static final long POLL_INTERVAL_MS = 100;
    // 완료됐지만 아무도 가져가지 않은 결과의 보관 시간
    static final Duration UNCLAIMED_TTL = Duration.ofMinutes(10);

    static final String MSG_UNKNOWN_KIND = "unknown task kind ";
    static final String MSG_STOPPED = "worker stopped";

    private final TaskHandler handler;
    private final Clock clock;
    private final LinkedBlockingQueue<Task> queue = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong seq = new AtomicLong();
    private final ExecutorService executor;

    private volatile boolean stopped = false;
    private volatile Task current;
    private volatile String progress = "";

    private static final class Slot {
        final CompletableFuture<TaskResult> future = new CompletableFuture<>();
        volatile Instant completedAt;
    }

    public TaskWorker(TaskHandler handler) {
        this(handler, Clock.systemUTC());
    }

    public TaskWorker(TaskHandler handler, Clock clock) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hwid-task-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (stopped) throw new IllegalStateException("worker already stopped");
        if (!running.compareAndSet(false, true)) return;
        executor.submit(this::loop);
        log.info("[TaskWorker] 워커 시작");
    }

    /** 진행 중인 작업은 끝까지 실행될 수 있으나, 대기 중인 작업은 ERROR 로 마감 */
    public void stop() {
        stopped = true;
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        List<Task> left = new ArrayList<>();
        queue.drainTo(left);
        for (Task t : left) deliver(TaskResult.error(t.id(), MSG_STOPPED));
        log.info("[TaskWorker] 워커 종료 (미처리 {}건 취소)", left.size());
    }

    public String submit(TaskKind kind) {
        return submit(kind.wireName(), null);
    }

    public String submit(String kind) {
        return submit(kind, null);
    }

    /**
     * 비블로킹 제출.
     * @param id null 이면 kind_밀리초_순번 으로 생성
     * @throws IllegalStateException 같은 id 의 작업이 아직 결과 미수령 상태
     */
    public String submit(String kind, String id) {
        Objects.requireNonNull(kind, "kind");
        sweepExpired();

        Instant now = clock.instant();
        String taskId = (id != null) ? id : kind + "_" + now.toEpochMilli() + "_" + seq.incrementAndGet();
        Slot slot = new Slot();
        if (slots.putIfAbsent(taskId, slot) != null) {
            throw new IllegalStateException("task id already pending: " + taskId);
        }

        if (stopped) {
            deliver(TaskResult.error(taskId, MSG_STOPPED));
            return taskId;
        }
        Task task = new Task(kind, taskId, now);
        queue.add(task);
        // stop() 의 drain 과 엇갈린 경우
        if (stopped && queue.remove(task)) deliver(TaskResult.error(taskId, MSG_STOPPED));
        log.debug("[TaskWorker] 작업 제출: {}", taskId);
        return taskId;
    }

    /**
     * id 의 결과를 최대 timeout 동안 기다림. 받아간 결과는 슬롯에서 제거.
     * @return 모르는 id 이거나 시간 내 완료되지 않으면 empty
     */
    public Optional<TaskResult> poll(String id, Duration timeout) {
        Slot slot = slots.get(id);
        if (slot == null) return Optional.empty();
        try {
            TaskResult r = slot.future.get(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
            slots.remove(id, slot);
            return Optional.of(r);
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            // 슬롯은 complete() 로만 채워지므로 정상 경로에선 오지 않음
            slots.remove(id, slot);
            return Optional.of(TaskResult.error(id, String.valueOf(e.getCause())));
        }
    }

    public boolean isWorking() {
        return current != null;
    }

    /** 현재 작업의 단계 문자열 (작업이 없으면 빈 문자열) */
    public String progress() {
        return progress;
    }

    public Optional<Task> currentTask() {
        return Optional.ofNullable(current);
    }

    public int pendingCount() {
        return queue.size();
    }

    private void loop() {
        while (running.get()) {
            Task task;
            try {
                task = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == null) continue;
            deliver(dispatch(task));
        }
    }

    TaskResult dispatch(Task task) {
        current = task;
        try {
            Optional<TaskKind> kind = TaskKind.fromName(task.kind());
            if (kind.isEmpty()) {
                log.warn("[TaskWorker] 알 수 없는 작업 종류: {}", task.kind());
                return TaskResult.error(task.id(), MSG_UNKNOWN_KIND + task.kind());
            }
            Object payload = handler.handle(kind.get(), this::setProgress);
            return TaskResult.success(task.id(), payload);
        } catch (TaskFailedException e) {
            return TaskResult.error(task.id(), e.getMessage());
        } catch (Throwable t) {
            // 핸들러 결함으로 워커 루프가 죽지 않도록 전부 결과로 변환
            log.error("[TaskWorker] 작업 처리 중 예외: {}", task.id(), t);
            String msg = (t.getMessage() != null) ? t.getMessage() : t.getClass().getSimpleName();
            return TaskResult.error(task.id(), msg);
        } finally {
            current = null;
            progress = "";
        }
    }

    private void setProgress(String stage) {
        progress = stage;
        log.debug("[TaskWorker] {}", stage);
    }

    private void deliver(TaskResult result) {
        Slot slot = slots.get(result.id());
        if (slot == null) {
            log.warn("[TaskWorker] 결과를 받을 슬롯 없음: {}", result.id());
            return;
        }
        slot.completedAt = clock.instant();
        slot.future.complete(result);
    }

    private void sweepExpired() {
        Instant cutoff = clock.instant().minus(UNCLAIMED_TTL);
        slots.entrySet().removeIf(e -> {
            Instant done = e.getValue().completedAt;
            return done != null && done.isBefore(cutoff);
        });
    }
}
