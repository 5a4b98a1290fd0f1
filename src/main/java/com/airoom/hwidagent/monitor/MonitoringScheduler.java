package com.airoom.hwidagent.monitor;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.report.DriftResult;
import com.airoom.hwidagent.task.DriftPipeline;
import com.airoom.hwidagent.task.TaskFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 주기적 HWID 점검 (전용 데몬 스레드 hwid-monitor).
 * monitoringIntervalSeconds 만큼 tick 단위로 쉬면서 매 tick 마다 정지 플래그를 확인한다.
 * 점검 자체는 DriftPipeline 을 통해 워커와 같은 락 아래에서 실행.
 */
public class MonitoringScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonitoringScheduler.class);

    static final int ERROR_BACKOFF_TICKS = 60;

    private final DriftPipeline pipeline;
    private final SettingsStore settings;
    private final Duration tick;
    private final Clock clock;

    private volatile boolean active = false;
    // start() 마다 새로 만드는 실행 토큰. 정지 후에도 살아있는 이전 루프는 자기 토큰만 본다
    private AtomicBoolean runToken;
    private volatile Instant lastCheck;
    private volatile String lastOutcome;
    private final AtomicLong passes = new AtomicLong();
    private ExecutorService executor;

    public MonitoringScheduler(DriftPipeline pipeline, SettingsStore settings) {
        this(pipeline, settings, Duration.ofSeconds(1), Clock.systemUTC());
    }

    /** @param tick 대기 단위 (운영 1초, 테스트에선 짧게) */
    public MonitoringScheduler(DriftPipeline pipeline, SettingsStore settings, Duration tick, Clock clock) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (tick.isNegative() || tick.isZero()) throw new IllegalArgumentException("tick must be positive");
    }

    public synchronized void start() {
        if (active) return;
        active = true;
        AtomicBoolean token = new AtomicBoolean(true);
        runToken = token;
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "hwid-monitor");
            t.setDaemon(true);
            return t;
        });
        executor.submit(() -> loop(token));
        log.info("[Monitor] 백그라운드 모니터링 시작 (주기 {}초)", settings.monitoringIntervalSeconds());
    }

    public synchronized void stop() {
        if (!active) return;
        active = false;
        runToken.set(false);
        executor.shutdown();
        try {
            // 진행 중인 점검은 끝까지 (수집이 길어지면 강제 중단)
            if (!executor.awaitTermination(Math.max(2000, tick.toMillis() * 2), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        runToken = null;
        log.info("[Monitor] 백그라운드 모니터링 중지");
    }

    public boolean isActive() {
        return active;
    }

    public MonitoringStatus status() {
        return new MonitoringStatus(active, lastCheck, lastOutcome, passes.get());
    }

    /**
     * 점검 1회 (대기 없이).
     * @throws TaskFailedException 하드웨어 수집 실패
     */
    public DriftResult runOnce() throws TaskFailedException {
        log.info("[Monitor] 정기 HWID 점검 수행");
        lastCheck = clock.instant();
        try {
            DriftResult r = pipeline.monitorPass();
            lastOutcome = r.status().name();
            return r;
        } catch (TaskFailedException | RuntimeException e) {
            lastOutcome = "ERROR: " + e.getMessage();
            throw e;
        } finally {
            passes.incrementAndGet();
        }
    }

    private void loop(AtomicBoolean token) {
        while (token.get()) {
            if (!waitTicks(token, settings.monitoringIntervalSeconds())) break;
            try {
                runOnce();
            } catch (TaskFailedException e) {
                log.warn("[Monitor] 점검 실패, 다음 주기에 재시도: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Monitor] 모니터링 오류, {}tick 후 재시도", ERROR_BACKOFF_TICKS, e);
                if (!waitTicks(token, ERROR_BACKOFF_TICKS)) break;
            }
        }
    }

    /** @return 정지 요청 없이 다 기다렸으면 true */
    private boolean waitTicks(AtomicBoolean token, int ticks) {
        for (int i = 0; i < ticks; i++) {
            if (!token.get()) return false;
            try {
                Thread.sleep(tick.toMillis(), (int) (tick.toNanos() % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return token.get();
    }
}
