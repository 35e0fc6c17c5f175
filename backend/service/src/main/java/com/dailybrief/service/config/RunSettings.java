package com.dailybrief.service.config;

import com.dailybrief.collectors.config.FetchSettings;
import com.dailybrief.collectors.scoring.ScoringRules;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Fully defaulted view of the {@code settings} and {@code scoring} blocks.
 */
public record RunSettings(
        int maxNews,
        FetchSettings fetch,
        ScoringRules scoring,
        Path seenFile,
        Path journalFile,
        ZoneId zone
) {
    public RunSettings {
        Objects.requireNonNull(fetch, "fetch is required");
        Objects.requireNonNull(scoring, "scoring is required");
        Objects.requireNonNull(seenFile, "seenFile is required");
        Objects.requireNonNull(journalFile, "journalFile is required");
        Objects.requireNonNull(zone, "zone is required");
        if (maxNews < 1) {
            throw new IllegalArgumentException("max_news must be >= 1");
        }
    }
}
