package com.dailybrief.service.store;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fingerprints of every article already delivered. Only grows: there is no remove.
 *
 * <p>Not thread-safe. Fetch workers get {@link #snapshot()}; only the run controller calls {@link #add}.
 */
public final class SeenSet {
    private final Set<String> fingerprints;

    public SeenSet(Set<String> fingerprints) {
        this.fingerprints = new LinkedHashSet<>(fingerprints);
    }

    public static SeenSet empty() {
        return new SeenSet(Set.of());
    }

    public boolean contains(String fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    public boolean add(String fingerprint) {
        return fingerprints.add(fingerprint);
    }

    public int size() {
        return fingerprints.size();
    }

    public Set<String> snapshot() {
        return Set.copyOf(fingerprints);
    }
}
