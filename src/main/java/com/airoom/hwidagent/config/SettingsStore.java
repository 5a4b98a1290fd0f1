package com.airoom.hwidagent.config;

import com.airoom.hwidagent.store.Json;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * settings.json 키/값 설정.
 * - 로드 시 기본값과 병합 (없는 키만 채움), 파일이 없으면 기본값으로 생성
 * - set() 할 때마다 파일에 저장
 * - 여러 스레드(워커/모니터/상태 서버)에서 접근하므로 전부 synchronized
 */
public class SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(SettingsStore.class);

    public static final String AUTO_SAVE_REPORTS = "autoSaveReports";
    public static final String COMPARE_ON_STARTUP = "compareOnStartup";
    public static final String BACKUP_REPORTS = "backupReports";
    public static final String MAX_REPORTS = "maxReports";
    public static final String BAN_SIMULATOR_ENABLED = "banSimulatorEnabled";
    public static final String BACKGROUND_MONITORING = "backgroundMonitoring";
    public static final String MONITORING_INTERVAL_SECONDS = "monitoringIntervalSeconds";
    public static final String STATS_TRACKING = "statsTracking";
    public static final String BANNED_FINGERPRINTS = "bannedFingerprints";
    public static final String STATS_MAX_CHANGE_EVENTS = "statsMaxChangeEvents";
    public static final String STATS_MAX_FINGERPRINTS = "statsMaxFingerprints";
    public static final String STATS_DAILY_RETENTION_DAYS = "statsDailyRetentionDays";
    public static final String STATUS_SERVER_ENABLED = "statusServerEnabled";
    public static final String STATUS_SERVER_PORT = "statusServerPort";

    public static final int MIN_MONITORING_INTERVAL_SECONDS = 60;

    private final Path file; // null 이면 메모리 전용 (테스트)
    private final JsonObject settings;

    private SettingsStore(Path file, JsonObject loaded) {
        this.file = file;
        this.settings = loaded;
    }

    /** 파일 기반. 읽기 실패 시 기본값으로 동작하고 오류만 남김 */
    public static SettingsStore load(Path file) {
        JsonObject defaults = defaults();
        if (!Files.exists(file)) {
            log.info("[Settings] 기본 설정 파일 생성: {}", file);
            SettingsStore s = new SettingsStore(file, defaults);
            s.save();
            return s;
        }
        try {
            JsonElement parsed = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8));
            JsonObject obj = parsed.isJsonObject() ? parsed.getAsJsonObject() : new JsonObject();
            for (Map.Entry<String, JsonElement> e : defaults.entrySet()) {
                if (!obj.has(e.getKey())) obj.add(e.getKey(), e.getValue());
            }
            log.info("[Settings] 설정 로드 완료: {}", file);
            return new SettingsStore(file, obj);
        } catch (IOException | RuntimeException e) {
            log.error("[Settings] 설정 로드 실패, 기본값 사용: {}", e.getMessage());
            return new SettingsStore(file, defaults);
        }
    }

    public static SettingsStore inMemory() {
        return new SettingsStore(null, defaults());
    }

    private static JsonObject defaults() {
        JsonObject d = new JsonObject();
        d.addProperty(AUTO_SAVE_REPORTS, true);
        d.addProperty(COMPARE_ON_STARTUP, false);
        d.addProperty(BACKUP_REPORTS, true);
        d.addProperty(MAX_REPORTS, 10);
        d.addProperty(BAN_SIMULATOR_ENABLED, true);
        d.addProperty(BACKGROUND_MONITORING, false);
        d.addProperty(MONITORING_INTERVAL_SECONDS, 300);
        d.addProperty(STATS_TRACKING, true);
        d.add(BANNED_FINGERPRINTS, new JsonArray());
        d.addProperty(STATS_MAX_CHANGE_EVENTS, 500);
        d.addProperty(STATS_MAX_FINGERPRINTS, 500);
        d.addProperty(STATS_DAILY_RETENTION_DAYS, 400);
        d.addProperty(STATUS_SERVER_ENABLED, true);
        d.addProperty(STATUS_SERVER_PORT, 4475);
        return d;
    }

    // ----------------- generic get/set -----------------

    public synchronized boolean getBoolean(String key) {
        JsonElement e = settings.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean()) return e.getAsBoolean();
        if (e != null) log.warn("[Settings] {} 값이 boolean 이 아님 ({}), 기본값 사용", key, e);
        return defaults().get(key).getAsBoolean();
    }

    public synchronized int getInt(String key) {
        JsonElement e = settings.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) return e.getAsInt();
        if (e != null) log.warn("[Settings] {} 값이 숫자가 아님 ({}), 기본값 사용", key, e);
        return defaults().get(key).getAsInt();
    }

    public synchronized List<String> getStringList(String key) {
        List<String> out = new ArrayList<>();
        JsonElement e = settings.get(key);
        if (e != null && e.isJsonArray()) {
            for (JsonElement x : e.getAsJsonArray()) {
                if (x.isJsonPrimitive()) out.add(x.getAsString());
            }
        }
        return out;
    }

    public synchronized void set(String key, boolean value) {
        settings.add(key, new JsonPrimitive(value));
        save();
    }

    public synchronized void set(String key, int value) {
        settings.add(key, new JsonPrimitive(value));
        save();
    }

    public synchronized void set(String key, Collection<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) arr.add(v);
        settings.add(key, arr);
        save();
    }

    // ----------------- typed view -----------------

    public boolean autoSaveReports() { return getBoolean(AUTO_SAVE_REPORTS); }
    public boolean compareOnStartup() { return getBoolean(COMPARE_ON_STARTUP); }
    public boolean backupReports() { return getBoolean(BACKUP_REPORTS); }
    public boolean banSimulatorEnabled() { return getBoolean(BAN_SIMULATOR_ENABLED); }
    public boolean backgroundMonitoring() { return getBoolean(BACKGROUND_MONITORING); }
    public boolean statsTracking() { return getBoolean(STATS_TRACKING); }
    public boolean statusServerEnabled() { return getBoolean(STATUS_SERVER_ENABLED); }
    public int statusServerPort() { return getInt(STATUS_SERVER_PORT); }

    /** 0 이하 값은 1로 */
    public int maxReports() { return Math.max(1, getInt(MAX_REPORTS)); }

    /** 하한 60초 */
    public int monitoringIntervalSeconds() {
        return Math.max(MIN_MONITORING_INTERVAL_SECONDS, getInt(MONITORING_INTERVAL_SECONDS));
    }

    public int statsMaxChangeEvents() { return Math.max(1, getInt(STATS_MAX_CHANGE_EVENTS)); }
    public int statsMaxFingerprints() { return Math.max(1, getInt(STATS_MAX_FINGERPRINTS)); }
    public int statsDailyRetentionDays() { return Math.max(1, getInt(STATS_DAILY_RETENTION_DAYS)); }

    public List<String> bannedFingerprints() { return getStringList(BANNED_FINGERPRINTS); }

    // ----------------- persistence -----------------

    private void save() {
        if (file == null) return;
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Json.GSON.toJson(settings), StandardCharsets.UTF_8);
            Files.move(tmp, file, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("[Settings] 설정 저장 실패: {}", e.getMessage());
        }
    }
}
