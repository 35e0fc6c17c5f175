package com.dailybrief.service.dispatch;

import com.dailybrief.core.model.RunResult;

/**
 * Delivers a digest to a chat channel. Implementations report failure by returning {@code false} and
 * must not throw for transport or remote errors.
 */
public interface DigestDispatcher {
    String channel();

    boolean dispatch(RunResult result);
}
