package com.airoom.hwidagent.store;

import com.airoom.hwidagent.report.Report;
import com.airoom.hwidagent.stats.HwidStats;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 리포트/통계 영속화 계층.
 * load 는 마지막으로 "성공한" 저장 값을 돌려준다 (부분 기록 파일은 보이지 않음).
 */
public interface HwidDataStore {

    Optional<Report> loadCurrentReport() throws IOException;

    /** current 리포트 덮어쓰기 (원자적) */
    void writeCurrentReport(Report report) throws IOException;

    /** 이력 리포트 1건 추가 */
    void appendHistory(Report report) throws IOException;

    /** 수정 시각 기준 최신 keep 건만 남기고 삭제, 삭제 건수 반환 */
    int pruneHistory(int keep) throws IOException;

    /** 이력 리포트, 최신순 */
    List<Report> listHistory() throws IOException;

    Optional<HwidStats> loadStats() throws IOException;

    void writeStats(HwidStats stats) throws IOException;
}
