package com.airoom.hwidagent.device;

import java.util.Optional;

public interface HardwareCollector {

    /**
     * 현재 하드웨어 정보를 새로 수집한다.
     * 일부 컴포넌트 조회가 실패해도 나머지는 채워서 반환하고,
     * 수집 자체가 불가능하면 empty (예외를 던지지 않음).
     */
    Optional<Snapshot> collect();
}
