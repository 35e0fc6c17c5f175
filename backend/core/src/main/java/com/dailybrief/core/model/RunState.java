package com.dailybrief.core.model;

public enum RunState {
    IDLE,
    FETCHING,
    SELECTING,
    TRANSFORMING,
    DISPATCHING,
    COMMITTING,
    DONE,
    FAILED
}
