package com.github.anirbanmu.discorder.discord;

import java.util.Locale;

public enum WorkerKind {
    HEARTBEAT,
    PROCESSOR,
    DOCTOR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
