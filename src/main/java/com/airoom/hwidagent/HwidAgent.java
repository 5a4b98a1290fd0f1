package com.airoom.hwidagent;

import com.airoom.hwidagent.ban.BanRegistry;
import com.airoom.hwidagent.ban.BanResult;
import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.device.HardwareCollector;
import com.airoom.hwidagent.device.OshiHardwareCollector;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.monitor.MonitoringScheduler;
import com.airoom.hwidagent.monitor.MonitoringStatus;
import com.airoom.hwidagent.report.Report;
import com.airoom.hwidagent.report.ReportStore;
import com.airoom.hwidagent.stats.StatsTracker;
import com.airoom.hwidagent.stats.StatsView;
import com.airoom.hwidagent.store.FileDataStore;
import com.airoom.hwidagent.store.HwidDataStore;
import com.airoom.hwidagent.task.DriftPipeline;
import com.airoom.hwidagent.task.TaskKind;
import com.airoom.hwidagent.task.TaskResult;
import com.airoom.hwidagent.task.TaskWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 외부(메인/상태 서버/테스트)에서 쓰는 진입점.
 * 구성 요소를 조립하고 워커/모니터 수명주기를 관리한다.
 */
public class HwidAgent implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HwidAgent.class);

    private final SettingsStore settings;
    private final ReportStore reports;
    private final StatsTracker stats;
    private final BanRegistry bans;
    private final DriftPipeline pipeline;
    private final TaskWorker worker;
    private final MonitoringScheduler monitor;
    private final Instant startedAt;

    /** 운영용: OSHI 수집기 + dataDir 아래 파일 저장소 */
    public static HwidAgent create(Path dataDir, SettingsStore settings) throws IOException {
        return new HwidAgent(new OshiHardwareCollector(), new FileDataStore(dataDir), settings,
                Clock.systemDefaultZone(), Duration.ofSeconds(1));
    }

    /** @param monitorTick 모니터 대기 단위 (테스트에서 짧게) */
    public HwidAgent(HardwareCollector collector, HwidDataStore store, SettingsStore settings,
                     Clock clock, Duration monitorTick) {
        this.settings = settings;
        this.reports = new ReportStore(store, settings, clock);
        this.stats = new StatsTracker(store, settings, clock);
        this.bans = new BanRegistry(settings);
        this.pipeline = new DriftPipeline(collector, reports, stats, bans, settings);
        this.worker = new TaskWorker(pipeline, clock);
        this.monitor = new MonitoringScheduler(pipeline, settings, monitorTick, clock);
        this.startedAt = clock.instant();
    }

    /** 워커 시작, backgroundMonitoring 이 켜져 있으면 모니터도 시작 */
    public void start() {
        worker.start();
        if (settings.backgroundMonitoring()) monitor.start();
        log.info("[HwidAgent] 시작 (monitoring={})", monitor.isActive());
    }

    @Override
    public void close() {
        monitor.stop();
        worker.stop();
        log.info("[HwidAgent] 종료");
    }

    // ----------------- tasks -----------------

    public String submit(TaskKind kind) {
        return worker.submit(kind);
    }

    public String submit(String kind) {
        return worker.submit(kind);
    }

    public String submit(String kind, String id) {
        return worker.submit(kind, id);
    }

    public Optional<TaskResult> poll(String id, Duration timeout) {
        return worker.poll(id, timeout);
    }

    /** compareOnStartup 설정이 켜져 있을 때만 비교 작업을 돌리고 결과를 기다림 */
    public Optional<TaskResult> compareOnStartup(Duration timeout) {
        if (!settings.compareOnStartup()) return Optional.empty();
        log.info("[HwidAgent] 시작 시 HWID 비교 수행");
        return poll(submit(TaskKind.COMPARE_ONLY), timeout);
    }

    public boolean isWorking() {
        return worker.isWorking();
    }

    public String progress() {
        return worker.progress();
    }

    // ----------------- bans -----------------

    public boolean isBanned(Fingerprint f) {
        return bans.isBanned(f);
    }

    public BanResult checkBan(Fingerprint f) {
        return bans.check(f);
    }

    public BanResult ban(Fingerprint f) {
        return bans.ban(f);
    }

    public BanResult unban(Fingerprint f) {
        return bans.unban(f);
    }

    public int clearAllBans() {
        return bans.clearAll();
    }

    public List<String> bannedFingerprints() {
        return bans.list();
    }

    // ----------------- monitoring -----------------

    public MonitoringStatus monitoringStatus() {
        return monitor.status();
    }

    public void startMonitoring() {
        monitor.start();
    }

    public void stopMonitoring() {
        monitor.stop();
    }

    // ----------------- read-only views -----------------

    public StatsView stats() {
        return stats.view();
    }

    /** 백업 리포트, 최신순 */
    public List<Report> history() {
        return reports.history();
    }

    public Optional<Fingerprint> currentFingerprint() {
        return pipeline.currentFingerprint();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public SettingsStore settings() {
        return settings;
    }
}
