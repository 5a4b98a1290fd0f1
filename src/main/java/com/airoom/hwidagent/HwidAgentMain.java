package com.airoom.hwidagent;

import com.airoom.hwidagent.config.SettingsStore;
import com.airoom.hwidagent.server.StatusServer;
import com.airoom.hwidagent.store.DataDirs;
import com.airoom.hwidagent.task.TaskResult;
import com.airoom.hwidagent.util.SingleInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

public class HwidAgentMain {

    private static final Logger log = LoggerFactory.getLogger(HwidAgentMain.class);

    private static final Duration STARTUP_COMPARE_TIMEOUT = Duration.ofMinutes(2);

    public static void main(String[] args) {
        Path dataDir = DataDirs.defaultDataDir();

        // 0) 단일 실행 보장 (같은 dataDir 을 두 프로세스가 쓰지 않도록)
        try {
            if (!SingleInstance.tryAcquire(dataDir.resolve("run.lock"))) {
                log.error("[HwidAgent] 이미 실행 중입니다. 종료합니다. dataDir={}", dataDir.toAbsolutePath());
                System.exit(0);
            }
        } catch (IOException e) {
            log.error("[HwidAgent] 락 파일을 만들 수 없습니다: {}", e.getMessage());
            System.exit(1);
        }

        HwidAgent agent;
        StatusServer server = null;
        try {
            log.info("[HwidAgent] 에이전트 시작. dataDir={}", dataDir.toAbsolutePath());

            /* 1) 설정 + 에이전트 조립 */
            SettingsStore settings = SettingsStore.load(dataDir.resolve("settings.json"));
            agent = HwidAgent.create(dataDir, settings);
            agent.start();

            /* 2) 시작 시 비교 */
            Optional<TaskResult> startup = agent.compareOnStartup(STARTUP_COMPARE_TIMEOUT);
            startup.ifPresent(r -> log.info("[HwidAgent] 시작 시 비교 결과: {}",
                    r.isSuccess() ? r.payload() : r.errorMessage()));

            /* 3) 로컬 상태 서버 */
            if (settings.statusServerEnabled()) {
                server = new StatusServer(agent, loadVersion());
                server.start(settings.statusServerPort());
            }
        } catch (Exception e) {
            log.error("[HwidAgent] 초기화 중 오류: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        // ---- 종료 훅: 서버/워커/모니터 정리 ----
        final StatusServer serverRef = server;
        final HwidAgent agentRef = agent;
        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[HwidAgent] 종료 중…");
            if (serverRef != null) serverRef.stop();
            agentRef.close();
            done.countDown();
        }, "hwid-shutdown"));

        /* 메인 스레드는 대기만 (워커/모니터는 데몬 스레드) */
        log.info("[HwidAgent] 초기화 완료. 감시 중… (monitoring={})", agent.monitoringStatus().active());
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // agent.properties 의 agent.version
    static String loadVersion() {
        Properties p = new Properties();
        try (InputStream is = HwidAgentMain.class.getClassLoader().getResourceAsStream("agent.properties")) {
            if (is != null) p.load(is);
        } catch (IOException e) {
            log.warn("[HwidAgent] agent.properties 읽기 실패: {}", e.getMessage());
        }
        return p.getProperty("agent.version", "1.0.0");
    }
}
