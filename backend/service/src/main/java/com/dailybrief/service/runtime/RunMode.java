package com.dailybrief.service.runtime;

public enum RunMode {
    /** Fetch, select, dispatch and commit. */
    DELIVER,
    /** Fetch, select and summarize only; nothing is sent and the dedup state is not touched. */
    DRY_RUN
}
