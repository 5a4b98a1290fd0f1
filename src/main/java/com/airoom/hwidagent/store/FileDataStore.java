package com.airoom.hwidagent.store;

import com.airoom.hwidagent.report.Report;
import com.airoom.hwidagent.stats.HwidStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * 데이터 디렉터리 레이아웃
 * <pre>
 * data/
 *   current_hwid.json
 *   hwid_stats.json
 *   reports/hwid_report_&lt;millis&gt;_&lt;seq&gt;.json
 * </pre>
 * 모든 쓰기는 .tmp 에 먼저 쓰고 ATOMIC_MOVE → 읽는 쪽은 반쯤 쓰인 파일을 보지 않는다.
 */
public class FileDataStore implements HwidDataStore {

    private static final Logger log = LoggerFactory.getLogger(FileDataStore.class);

    private static final String CURRENT_FILE = "current_hwid.json";
    private static final String STATS_FILE = "hwid_stats.json";
    private static final String REPORT_PREFIX = "hwid_report_";

    private final Path baseDir;
    private final Path reportsDir;

    // 같은 ms 안에 여러 번 저장해도 파일명이 겹치지 않도록
    private long lastMillis = -1;
    private int seq = 0;

    public FileDataStore(Path baseDir) throws IOException {
        this.baseDir = (baseDir == null) ? DataDirs.defaultDataDir() : baseDir;
        this.reportsDir = this.baseDir.resolve("reports");
        Files.createDirectories(reportsDir);
    }

    public Path baseDir() { return baseDir; }

    @Override
    public synchronized Optional<Report> loadCurrentReport() throws IOException {
        return read(baseDir.resolve(CURRENT_FILE), Report.class);
    }

    @Override
    public synchronized void writeCurrentReport(Report report) throws IOException {
        writeAtomic(baseDir.resolve(CURRENT_FILE), Json.GSON.toJson(report));
    }

    @Override
    public synchronized void appendHistory(Report report) throws IOException {
        Path target = reportsDir.resolve(newReportName());
        writeAtomic(target, Json.GSON.toJson(report));
    }

    @Override
    public synchronized int pruneHistory(int keep) throws IOException {
        List<Path> files = historyFilesNewestFirst();
        int removed = 0;
        for (int i = Math.max(keep, 0); i < files.size(); i++) {
            Files.deleteIfExists(files.get(i));
            log.info("[DataStore] 오래된 리포트 삭제: {}", files.get(i).getFileName());
            removed++;
        }
        return removed;
    }

    @Override
    public synchronized List<Report> listHistory() throws IOException {
        List<Report> out = new ArrayList<>();
        for (Path p : historyFilesNewestFirst()) {
            try {
                read(p, Report.class).ifPresent(out::add);
            } catch (IOException e) {
                // 손상된 이력 한 건 때문에 전체 목록이 막히지 않도록 건너뜀
                log.warn("[DataStore] 이력 리포트 읽기 실패 {}: {}", p.getFileName(), e.getMessage());
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<HwidStats> loadStats() throws IOException {
        return read(baseDir.resolve(STATS_FILE), HwidStats.class);
    }

    @Override
    public synchronized void writeStats(HwidStats stats) throws IOException {
        writeAtomic(baseDir.resolve(STATS_FILE), Json.GSON.toJson(stats));
    }

    // ----------------- helpers -----------------

    private String newReportName() {
        long now = System.currentTimeMillis();
        if (now <= lastMillis) {
            seq++;
        } else {
            lastMillis = now;
            seq = 0;
        }
        return String.format("%s%013d_%04d.json", REPORT_PREFIX, lastMillis, seq);
    }

    // 수정 시각 내림차순, 같으면 파일명(생성 순서) 내림차순
    private List<Path> historyFilesNewestFirst() throws IOException {
        try (Stream<Path> s = Files.list(reportsDir)) {
            List<Path> files = s.filter(Files::isRegularFile)
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(REPORT_PREFIX) && n.endsWith(".json");
                    })
                    .collect(Collectors.toList());
            Comparator<Path> byMtime = Comparator.comparing(FileDataStore::mtime);
            files.sort(byMtime.thenComparing(p -> p.getFileName().toString()).reversed());
            return files;
        }
    }

    private static FileTime mtime(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private static <T> Optional<T> read(Path file, Class<T> type) throws IOException {
        if (!Files.exists(file)) return Optional.empty();
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return Optional.ofNullable(Json.GSON.fromJson(json, type));
        } catch (RuntimeException e) {
            throw new IOException("corrupt json " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static void writeAtomic(Path target, String body) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, body, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        try {
            Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, REPLACE_EXISTING);
        }
    }
}
