package com.quantflow.core.engine;

public enum RunState {
    INITIALIZED,
    RUNNING,
    COMPLETED,
    FAILED
}
