package com.dailybrief.service.runtime;

import com.dailybrief.core.model.RunResult;
import com.dailybrief.core.model.RunState;

public record RunOutcome(RunState finalState, RunResult result, String message) {
    public boolean succeeded() {
        return finalState == RunState.DONE;
    }
}
