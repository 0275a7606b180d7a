package com.smartpole.core.engine;

public enum StreamKind {
    VIDEO,
    AUDIO,
    TEXT
}
