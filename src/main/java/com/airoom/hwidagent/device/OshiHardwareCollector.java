package com.airoom.hwidagent.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import oshi.SystemInfo;
import oshi.hardware.Baseboard;
import oshi.hardware.CentralProcessor;
import oshi.hardware.ComputerSystem;
import oshi.hardware.Firmware;
import oshi.hardware.HWDiskStore;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

// OSHI 기반 수집기 (Windows/Linux/macOS 공통)
// 컴포넌트 단위로 실패를 격리: 한 컴포넌트 조회가 터지면 "Error: ..." 원문만 남기고 계속 진행
public class OshiHardwareCollector implements HardwareCollector {

    private static final Logger log = LoggerFactory.getLogger(OshiHardwareCollector.class);

    private final SystemInfo si;

    public OshiHardwareCollector() {
        this(new SystemInfo());
    }

    public OshiHardwareCollector(SystemInfo si) {
        this.si = si;
    }

    @Override
    public Optional<Snapshot> collect() {
        HardwareAbstractionLayer hal;
        try {
            hal = si.getHardware();
        } catch (Exception | LinkageError e) {
            log.error("[Collector] OSHI 초기화 실패: {}", e.toString());
            return Optional.empty();
        }

        Snapshot.Builder b = Snapshot.builder();
        b.component(Snapshot.DISK, query("disk", () -> disks(hal)));
        b.component(Snapshot.BIOS, query("bios", () -> bios(hal.getComputerSystem())));
        b.component(Snapshot.MOTHERBOARD, query("motherboard", () -> baseboard(hal.getComputerSystem().getBaseboard())));
        b.component(Snapshot.SYSTEM, query("system", () -> system(hal.getComputerSystem())));
        b.component(Snapshot.MAC, query("mac", () -> macs(hal)));
        b.component(Snapshot.CPU, query("cpu", () -> cpu(hal.getProcessor())));
        b.component(Snapshot.OS, query("os", () -> List.of(fields(Snapshot.NAME, String.valueOf(si.getOperatingSystem())))));
        Snapshot snapshot = b.build();

        boolean anyData = snapshot.components().values().stream().anyMatch(r -> !r.entries().isEmpty());
        if (!anyData) {
            log.warn("[Collector] 모든 컴포넌트 조회 실패");
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    private static ComponentRecord query(String name, Supplier<List<Map<String, String>>> q) {
        try {
            return ComponentRecord.ofEntries(q.get());
        } catch (Exception e) {
            log.warn("[Collector] {} 조회 실패: {}", name, e.toString());
            return ComponentRecord.opaque("Error: " + e.getMessage());
        }
    }

    private static List<Map<String, String>> disks(HardwareAbstractionLayer hal) {
        List<Map<String, String>> out = new ArrayList<>();
        for (HWDiskStore d : hal.getDiskStores()) {
            out.add(fields(Snapshot.MODEL, d.getModel(), Snapshot.SERIAL_NUMBER, d.getSerial(), "Size", String.valueOf(d.getSize())));
        }
        return out;
    }

    // Windows 에서 ComputerSystem 시리얼 = Win32_BIOS.SerialNumber
    private static List<Map<String, String>> bios(ComputerSystem cs) {
        Firmware fw = cs.getFirmware();
        return List.of(fields(Snapshot.SERIAL_NUMBER, cs.getSerialNumber(),
                "Manufacturer", fw.getManufacturer(), "Version", fw.getVersion()));
    }

    private static List<Map<String, String>> baseboard(Baseboard bb) {
        return List.of(fields(Snapshot.SERIAL_NUMBER, bb.getSerialNumber(),
                "Manufacturer", bb.getManufacturer(), "Product", bb.getModel()));
    }

    private static List<Map<String, String>> system(ComputerSystem cs) {
        return List.of(fields(Snapshot.UUID, cs.getHardwareUUID(),
                "Vendor", cs.getManufacturer(), Snapshot.NAME, cs.getModel()));
    }

    private static List<Map<String, String>> macs(HardwareAbstractionLayer hal) {
        List<Map<String, String>> out = new ArrayList<>();
        for (NetworkIF nif : hal.getNetworkIFs()) {
            String mac = nif.getMacaddr();
            if (mac == null || mac.isBlank() || "00:00:00:00:00:00".equals(mac)) continue;
            out.add(fields(Snapshot.NAME, nif.getName(), Snapshot.MAC_ADDRESS, mac.toUpperCase()));
        }
        return out;
    }

    private static List<Map<String, String>> cpu(CentralProcessor p) {
        CentralProcessor.ProcessorIdentifier id = p.getProcessorIdentifier();
        return List.of(fields(Snapshot.NAME, id.getName(), Snapshot.PROCESSOR_ID, id.getProcessorID()));
    }

    /** key, value, key, value ... 쌍에서 의미 없는 값은 건너뜀 */
    private static Map<String, String> fields(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            String v = cleanup(kv[i + 1]);
            if (v != null) m.put(kv[i], v);
        }
        return m;
    }

    // OSHI 가 못 읽으면 "unknown", 제조사 기본 문자열도 간단 필터
    static String cleanup(String s) {
        if (s == null) return null;
        s = s.trim();
        if (s.isEmpty()) return null;
        if (s.equalsIgnoreCase("unknown") || s.equalsIgnoreCase("To Be Filled By O.E.M.")
                || s.equalsIgnoreCase("Default string") || s.equalsIgnoreCase("None") || s.equalsIgnoreCase("Null")) {
            return null;
        }
        return s;
    }
}
