package com.airoom.hwidagent.device;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 한 시점의 하드웨어 수집 결과 (컴포넌트 이름 → 레코드).
 * 생성 후 변경되지 않는다.
 */
public record Snapshot(Map<String, ComponentRecord> components) {

    // 컴포넌트 이름
    public static final String DISK = "disk";
    public static final String BIOS = "bios";
    public static final String MOTHERBOARD = "motherboard";
    public static final String SYSTEM = "system";
    public static final String MAC = "mac";
    public static final String CPU = "cpu";
    public static final String OS = "os";

    // 필드 이름 (WMI 속성명과 동일하게 맞춤)
    public static final String SERIAL_NUMBER = "SerialNumber";
    public static final String UUID = "UUID";
    public static final String MODEL = "Model";
    public static final String MAC_ADDRESS = "MacAddress";
    public static final String NAME = "Name";
    public static final String PROCESSOR_ID = "ProcessorId";

    public Snapshot {
        components = (components == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public Optional<ComponentRecord> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ComponentRecord> components = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> singleFields = new LinkedHashMap<>();

        private Builder() {}

        public Builder component(String name, ComponentRecord record) {
            singleFields.remove(name);
            components.put(name, record);
            return this;
        }

        /** 장치가 하나뿐인 컴포넌트에 필드 하나를 추가 */
        public Builder field(String component, String field, String value) {
            singleFields.computeIfAbsent(component, k -> new LinkedHashMap<>()).put(field, value);
            components.put(component, ComponentRecord.of(singleFields.get(component)));
            return this;
        }

        public Builder opaque(String component, String rawText) {
            return component(component, ComponentRecord.opaque(rawText));
        }

        public Snapshot build() {
            return new Snapshot(components);
        }
    }
}
