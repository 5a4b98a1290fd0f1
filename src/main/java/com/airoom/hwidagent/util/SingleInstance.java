package com.airoom.hwidagent.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/*
 실행 시 단일 인스턴스 보장 (dataDir/run.lock 에 FileLock)
 두 프로세스가 같은 dataDir 의 current_hwid.json / hwid_stats.json 을 동시에 고치면
 통계 카운터가 덮어써지므로 두 번째 실행은 바로 종료시킨다.
 프로세스가 죽으면 OS 가 핸들을 닫아 락도 풀린다.
*/
public final class SingleInstance {

    private static final Logger log = LoggerFactory.getLogger(SingleInstance.class);

    private static FileChannel channel;
    private static FileLock lock;

    private SingleInstance() {}

    /** @return 락을 얻었으면 true, 다른 인스턴스가 실행 중이면 false */
    public static synchronized boolean tryAcquire(Path lockFile) throws IOException {
        if (lock != null) return true;
        if (lockFile.getParent() != null) Files.createDirectories(lockFile.getParent());
        FileChannel ch = FileChannel.open(lockFile, CREATE, WRITE);
        FileLock l;
        try {
            l = ch.tryLock(); // 이미 잠겨 있으면 null
        } catch (OverlappingFileLockException e) {
            l = null; // 같은 JVM 안에서 이미 잡음
        }
        if (l == null) {
            ch.close();
            log.warn("[SingleInstance] 이미 실행 중: {}", lockFile);
            return false;
        }
        channel = ch;
        lock = l;
        Runtime.getRuntime().addShutdownHook(new Thread(SingleInstance::release, "hwid-lock-release"));
        return true;
    }

    public static synchronized void release() {
        try {
            if (lock != null) lock.release();
            if (channel != null) channel.close();
        } catch (IOException e) {
            log.warn("[SingleInstance] 락 해제 실패: {}", e.getMessage());
        } finally {
            lock = null;
            channel = null;
        }
    }
}
