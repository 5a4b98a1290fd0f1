package com.airoom.hwidagent.device;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 컴포넌트 하나의 수집 결과.
 * - 구조화: 장치 1개당 필드 맵 1개 (디스크처럼 여러 개일 수 있음)
 * - 비구조화: 조회가 깨졌을 때 원문 텍스트만 보관 (rawText)
 */
public record ComponentRecord(List<Map<String, String>> entries, String rawText) {

    public ComponentRecord {
        List<Map<String, String>> copy = new ArrayList<>();
        if (entries != null) {
            for (Map<String, String> e : entries) {
                if (e != null) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(e)));
            }
        }
        entries = Collections.unmodifiableList(copy);
    }

    public static ComponentRecord of(Map<String, String> fields) {
        return new ComponentRecord(List.of(fields), null);
    }

    public static ComponentRecord ofEntries(List<Map<String, String>> entries) {
        return new ComponentRecord(entries, null);
    }

    public static ComponentRecord opaque(String rawText) {
        return new ComponentRecord(List.of(), rawText);
    }

    public boolean isOpaque() {
        return entries.isEmpty() && rawText != null;
    }

    /** 첫 번째 장치의 필드 값 */
    public Optional<String> first(String field) {
        return entries.isEmpty() ? Optional.empty() : Optional.ofNullable(entries.get(0).get(field));
    }

    /** 모든 장치에서 해당 필드 값 (null 제외) */
    public List<String> all(String field) {
        List<String> out = new ArrayList<>();
        for (Map<String, String> e : entries) {
            String v = e.get(field);
            if (v != null) out.add(v);
        }
        return out;
    }
}
