package com.dailybrief.collectors.scoring;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores a headline by plain substring matches against weighted term lists.
 *
 * <p>Matching is case-insensitive containment, not word matching, so {@code gpt-4} also hits
 * {@code gpt-4o}. Every matched term adds its weight; there is no cap.
 */
public class RelevanceScorer {
    private final double base;
    private final double sourceKeywordWeight;
    private final List<WeightedTerms> groups;

    public RelevanceScorer(ScoringRules rules) {
        this.base = rules.base();
        this.sourceKeywordWeight = rules.sourceKeywordWeight();
        this.groups = rules.termGroups().stream()
                .map(group -> new WeightedTerms(group.weight(), normalize(group.terms())))
                .toList();
    }

    public double score(String title, Collection<String> sourceKeywords) {
        double score = base;
        if (title == null || title.isBlank()) {
            return score;
        }
        String lowered = title.toLowerCase(Locale.ROOT);
        score += sourceKeywordWeight * countMatches(lowered, normalize(sourceKeywords));
        for (WeightedTerms group : groups) {
            score += group.weight() * countMatches(lowered, group.terms());
        }
        return score;
    }

    private static int countMatches(String loweredTitle, Set<String> terms) {
        int matches = 0;
        for (String term : terms) {
            if (loweredTitle.contains(term)) {
                matches++;
            }
        }
        return matches;
    }

    private static Set<String> normalize(Collection<String> terms) {
        Set<String> normalized = new LinkedHashSet<>();
        if (terms == null) {
            return normalized;
        }
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                normalized.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    private record WeightedTerms(double weight, Set<String> terms) {
    }
}
