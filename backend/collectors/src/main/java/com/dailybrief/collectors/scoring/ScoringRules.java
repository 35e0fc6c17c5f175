package com.dailybrief.collectors.scoring;

import java.util.List;
import java.util.Objects;

/**
 * Weights for {@link RelevanceScorer}. Every weight must be non-negative so a score never drops below
 * the base.
 */
public record ScoringRules(
        double base,
        double sourceKeywordWeight,
        List<TermGroup> termGroups
) {
    // Terms are matched as substrings, so short acronyms appear only inside longer phrases and no
    // term contains another.
    private static final List<String> HIGH_VALUE_TERMS = List.of(
            // vendors and flagship products
            "openai", "anthropic", "deepmind", "meta ai", "claude", "gpt-5", "gpt-4",
            "chatgpt", "sora", "gemini", "llama", "mistral",
            // funding
            "funding", "raises", "series a", "series b", "series c", "valuation", "acquisition",
            "ipo filing", "files for ipo", "plans ipo",
            // compute and chips
            "nvidia", "gpu", "ai chip", "ai compute", "data center", "google tpu", "cloud tpu",
            // focus areas
            "world model", "data annotation", "ai startup"
    );

    public ScoringRules {
        termGroups = termGroups == null ? List.of() : List.copyOf(termGroups);
        if (base < 0 || sourceKeywordWeight < 0) {
            throw new IllegalArgumentException("scoring weights must be >= 0");
        }
    }

    public static ScoringRules defaults() {
        return new ScoringRules(1.0, 2.0, List.of(new TermGroup(3.0, HIGH_VALUE_TERMS)));
    }

    public record TermGroup(double weight, List<String> terms) {
        public TermGroup {
            Objects.requireNonNull(terms, "terms are required");
            terms = List.copyOf(terms);
            if (weight < 0) {
                throw new IllegalArgumentException("term group weight must be >= 0");
            }
        }
    }
}
