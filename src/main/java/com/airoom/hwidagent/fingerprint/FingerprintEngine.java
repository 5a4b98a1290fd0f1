package com.airoom.hwidagent.fingerprint;

import com.airoom.hwidagent.device.ComponentRecord;
import com.airoom.hwidagent.device.FormatListParser;
import com.airoom.hwidagent.device.Snapshot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

// 하드웨어 지문 해시 생성
// 전략 : 식별용 필드(디스크/BIOS/메인보드 시리얼, 플랫폼 UUID)만 뽑아 정규화 → 정렬 → "|" 결합 → SHA-256
// 정렬하므로 수집 순서(디스크 열거 순서 등)는 결과에 영향 없음.
// MAC/CPU/OS 는 스냅샷에는 남기지만 지문에는 넣지 않음 (VPN, 가상 NIC 등으로 쉽게 흔들림)
public final class FingerprintEngine {

    private FingerprintEngine() {}

    private record CanonicalField(String component, String field, boolean allDevices) {}

    private static final List<CanonicalField> CANONICAL = List.of(
            new CanonicalField(Snapshot.DISK, Snapshot.SERIAL_NUMBER, true),
            new CanonicalField(Snapshot.BIOS, Snapshot.SERIAL_NUMBER, false),
            new CanonicalField(Snapshot.MOTHERBOARD, Snapshot.SERIAL_NUMBER, false),
            new CanonicalField(Snapshot.SYSTEM, Snapshot.UUID, false)
    );

    /** 순수 함수. 어떤 입력에도 예외 없이 결과를 낸다 */
    public static Fingerprint compute(Snapshot snapshot) {
        List<String> values = canonicalValues(snapshot);
        if (values.isEmpty()) return Fingerprint.INVALID;
        return Fingerprint.of(sha256Hex(String.join("|", values)));
    }

    /** 해시 입력이 되는 정규화 값 목록 (정렬됨) */
    public static List<String> canonicalValues(Snapshot snapshot) {
        List<String> values = new ArrayList<>();
        if (snapshot == null) return values;

        for (CanonicalField cf : CANONICAL) {
            Optional<ComponentRecord> rec = snapshot.component(cf.component()).map(FormatListParser::salvage);
            if (rec.isEmpty()) continue;
            if (cf.allDevices()) {
                for (String v : rec.get().all(cf.field())) addNormalized(values, v);
            } else {
                rec.get().first(cf.field()).ifPresent(v -> addNormalized(values, v));
            }
        }
        Collections.sort(values);
        return values;
    }

    private static void addNormalized(List<String> out, String s) {
        if (s == null) return;
        String v = s.trim();
        if (!v.isEmpty()) out.add(v);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(d.length * 2);
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // JDK 필수 알고리즘이라 실제로는 오지 않음
            throw new IllegalStateException(e);
        }
    }
}
