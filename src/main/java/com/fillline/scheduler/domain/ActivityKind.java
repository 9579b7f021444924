package com.fillline.scheduler.domain;

public enum ActivityKind {
    CLEAN,
    CHANGEOVER,
    FILL
}
