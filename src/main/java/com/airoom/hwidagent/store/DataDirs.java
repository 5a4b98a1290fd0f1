package com.airoom.hwidagent.store;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class DataDirs {

    private DataDirs() {}

    // ── 구성: JVM prop이 최우선, 없으면 ENV, 둘 다 없으면 실행 디렉터리 기준 data/
    //  -Dhwid.dataDir=...  |  HWID_DATA_DIR=...
    public static Path defaultDataDir() {
        String p = System.getProperty("hwid.dataDir");
        if (p != null && !p.isBlank()) return Paths.get(p);
        String e = System.getenv("HWID_DATA_DIR");
        if (e != null && !e.isBlank()) return Paths.get(e);
        return Paths.get("data");
    }
}
