package com.airoom.hwidagent.device;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PowerShell {@code Format-List} 출력 파서.
 *
 * <pre>
 * Model        : Samsung SSD 970
 * SerialNumber : S4EWNX0N123456
 *
 * Model        : WDC WD10EZEX
 * SerialNumber : WD-WCC6Y1234567
 * </pre>
 *
 * 빈 줄이 객체 구분자. " : " 가 없으면 "key=value" 형식(구 wmic)도 허용한다.
 */
public final class FormatListParser {

    private FormatListParser() {}

    public static List<Map<String, String>> parse(String text) {
        List<Map<String, String>> objects = new ArrayList<>();
        if (text == null || text.isBlank() || text.contains("Error:")) return objects;

        Map<String, String> current = new LinkedHashMap<>();
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                if (!current.isEmpty()) {
                    objects.add(current);
                    current = new LinkedHashMap<>();
                }
                continue;
            }
            int sep = line.indexOf(" : ");
            if (sep > 0) {
                put(current, line.substring(0, sep), line.substring(sep + 3));
            } else {
                int eq = line.indexOf('=');
                if (eq > 0) put(current, line.substring(0, eq), line.substring(eq + 1));
            }
        }
        if (!current.isEmpty()) objects.add(current);
        return objects;
    }

    /** 원문 블롭을 구조화 레코드로 복구 시도. 실패하면 원래 레코드 그대로 */
    public static ComponentRecord salvage(ComponentRecord record) {
        if (record == null || !record.isOpaque()) return record;
        List<Map<String, String>> parsed = parse(record.rawText());
        return parsed.isEmpty() ? record : ComponentRecord.ofEntries(parsed);
    }

    private static void put(Map<String, String> obj, String key, String value) {
        String k = key.trim();
        String v = value.trim();
        if (k.isEmpty() || v.isEmpty() || "{}".equals(v)) return;
        obj.put(k, v);
    }
}
