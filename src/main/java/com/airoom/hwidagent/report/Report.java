package com.airoom.hwidagent.report;

import com.airoom.hwidagent.device.Snapshot;
import com.airoom.hwidagent.fingerprint.Fingerprint;

import java.time.Instant;
import java.util.Objects;

public record Report(Snapshot snapshot, Fingerprint fingerprint, Instant createdAt) {

    public Report {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
