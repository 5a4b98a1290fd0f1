package com.airoom.hwidagent.server;

import com.airoom.hwidagent.HwidAgent;
import com.airoom.hwidagent.ban.BanResult;
import com.airoom.hwidagent.fingerprint.Fingerprint;
import com.airoom.hwidagent.store.Json;
import com.airoom.hwidagent.task.TaskResult;
import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 로컬 상태/제어 HTTP 서버 (127.0.0.1 전용).
 *
 *   GET  /status                      버전, 시작 시각, 워커/모니터 상태, 현재 지문
 *   POST /task?kind=..[&id=..]        작업 제출 → {"id": ...}
 *   GET  /result?id=..&timeoutMs=..   결과 대기 (없으면 404)
 *   GET  /bans, POST /ban?fp=, POST /unban?fp=, DELETE /bans
 *   GET  /stats
 */
public class StatusServer {

    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    static final int PORT_ATTEMPTS = 6;
    static final long MAX_RESULT_WAIT_MS = 30_000;

    private final HwidAgent agent;
    private final String agentVersion;
    private HttpServer server;
    private volatile int runningPort = -1;

    public StatusServer(HwidAgent agent, String agentVersion) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.agentVersion = (agentVersion == null || agentVersion.isBlank()) ? "1.0.0-dev" : agentVersion;
    }

    public int getRunningPort() { return runningPort; }

    /**
     * basePort 부터 순서대로 빈 포트를 찾아 바인딩. basePort=0 이면 임의 포트.
     * @throws IOException 시도한 포트를 모두 쓸 수 없음
     */
    public synchronized void start(int basePort) throws IOException {
        if (server != null) return;
        InetAddress loopback = InetAddress.getLoopbackAddress();
        int attempts = (basePort == 0) ? 1 : PORT_ATTEMPTS;
        for (int i = 0; i < attempts && server == null; i++) {
            try {
                server = HttpServer.create(new InetSocketAddress(loopback, basePort + i), 0);
            } catch (BindException e) {
                log.debug("[StatusServer] 포트 사용 중: {}", basePort + i);
            }
        }
        if (server == null) {
            throw new IOException("[StatusServer] " + basePort + "~" + (basePort + attempts - 1) + " 포트를 모두 사용할 수 없습니다.");
        }
        runningPort = server.getAddress().getPort();

        server.createContext("/status", new StatusHandler());
        server.createContext("/task", new TaskHandler());
        server.createContext("/result", new ResultHandler());
        server.createContext("/bans", new BansHandler());
        server.createContext("/ban", new BanHandler(true));
        server.createContext("/unban", new BanHandler(false));
        server.createContext("/stats", new StatsHandler());

        server.setExecutor(null);
        server.start();
        log.info("[StatusServer] 상태 서버가 {} 포트에서 실행 중입니다. ver={}", runningPort, agentVersion);
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop(0);
        server = null;
        runningPort = -1;
        log.info("[StatusServer] 상태 서버 종료");
    }

    // ----------------- handlers -----------------

    class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!requireMethod(ex, "GET")) return;
            JsonObject o = new JsonObject();
            o.addProperty("version", agentVersion);
            o.addProperty("startedAt", agent.startedAt().toString());
            o.addProperty("port", runningPort);
            o.addProperty("working", agent.isWorking());
            o.addProperty("progress", agent.progress());
            o.add("monitoring", Json.COMPACT.toJsonTree(agent.monitoringStatus()));
            Optional<Fingerprint> fp = agent.currentFingerprint();
            o.addProperty("currentFingerprint", fp.map(Fingerprint::hash).orElse(null));
            o.addProperty("historyCount", agent.history().size());
            sendJson(ex, 200, Json.COMPACT.toJson(o));
        }
    }

    class TaskHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!requireMethod(ex, "POST")) return;
            String query = ex.getRequestURI().getRawQuery();
            String kind = getParam(query, "kind", null);
            if (kind == null || kind.isBlank()) {
                sendError(ex, 400, "kind is required");
                return;
            }
            try {
                String id = agent.submit(kind, getParam(query, "id", null));
                JsonObject o = new JsonObject();
                o.addProperty("id", id);
                sendJson(ex, 202, Json.COMPACT.toJson(o));
            } catch (IllegalStateException e) {
                sendError(ex, 409, e.getMessage());
            }
        }
    }

    class ResultHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!requireMethod(ex, "GET")) return;
            String query = ex.getRequestURI().getRawQuery();
            String id = getParam(query, "id", null);
            if (id == null || id.isBlank()) {
                sendError(ex, 400, "id is required");
                return;
            }
            long timeoutMs;
            try {
                timeoutMs = Long.parseLong(getParam(query, "timeoutMs", "0"));
            } catch (NumberFormatException e) {
                sendError(ex, 400, "timeoutMs must be a number");
                return;
            }
            timeoutMs = Math.max(0, Math.min(timeoutMs, MAX_RESULT_WAIT_MS));

            Optional<TaskResult> r = agent.poll(id, Duration.ofMillis(timeoutMs));
            if (r.isEmpty()) {
                sendError(ex, 404, "no result for " + id);
                return;
            }
            sendJson(ex, 200, Json.COMPACT.toJson(r.get()));
        }
    }

    class BansHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            String method = ex.getRequestMethod();
            if ("GET".equalsIgnoreCase(method)) {
                sendJson(ex, 200, Json.COMPACT.toJson(agent.bannedFingerprints()));
            } else if ("DELETE".equalsIgnoreCase(method)) {
                JsonObject o = new JsonObject();
                o.addProperty("cleared", agent.clearAllBans());
                sendJson(ex, 200, Json.COMPACT.toJson(o));
            } else {
                sendError(ex, 405, "method not allowed");
            }
        }
    }

    class BanHandler implements HttpHandler {
        private final boolean ban;

        BanHandler(boolean ban) { this.ban = ban; }

        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!requireMethod(ex, "POST")) return;
            String fp = getParam(ex.getRequestURI().getRawQuery(), "fp", null);
            if (fp == null || fp.isBlank()) {
                sendError(ex, 400, "fp is required");
                return;
            }
            Fingerprint f = Fingerprint.of(fp.trim());
            BanResult r = ban ? agent.ban(f) : agent.unban(f);
            sendJson(ex, r.ok() ? 200 : 409, Json.COMPACT.toJson(r));
        }
    }

    class StatsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange ex) throws IOException {
            if (!requireMethod(ex, "GET")) return;
            sendJson(ex, 200, Json.COMPACT.toJson(agent.stats()));
        }
    }

    // ----------------- 공통 응답 유틸 -----------------

    private static boolean requireMethod(HttpExchange ex, String method) throws IOException {
        if (method.equalsIgnoreCase(ex.getRequestMethod())) return true;
        sendError(ex, 405, "method not allowed");
        return false;
    }

    private static void sendError(HttpExchange ex, int code, String message) throws IOException {
        JsonObject o = new JsonObject();
        o.addProperty("error", message);
        sendJson(ex, code, Json.COMPACT.toJson(o));
    }

    private static void sendJson(HttpExchange ex, int code, String json) throws IOException {
        byte[] b = json.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        try {
            ex.sendResponseHeaders(code, b.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(b); }
        } catch (IOException ioe) {
            if (!isClientAbort(ioe)) throw ioe;
            log.debug("[StatusServer] 클라이언트가 연결을 끊음: {}", ioe.getMessage());
        } finally {
            ex.close();
        }
    }

    static boolean isClientAbort(IOException e) {
        String m = (e.getMessage() == null ? "" : e.getMessage()).toLowerCase();
        return m.contains("connection reset")
                || m.contains("broken pipe")
                || m.contains("insufficient bytes")
                || m.contains("forcibly closed")
                || m.contains("원격 호스트에 의해")
                || m.contains("호스트 시스템의 소프트웨어");
    }

    static String getParam(String q, String key, String def) {
        if (q == null || q.isBlank()) return def;
        for (String pair : q.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && kv[0].equalsIgnoreCase(key)) return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
        }
        return def;
    }
}
