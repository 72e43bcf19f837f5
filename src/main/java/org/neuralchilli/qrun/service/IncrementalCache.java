package org.neuralchilli.qrun.service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Set of input fingerprints from previously successful executions.
 * Entries are pure content keys, not tied to a task id, and never expire.
 * <p>
 * Not synchronized: only the task runner mutates it, after collecting results.
 */
public final class IncrementalCache {

    private final Set<String> fingerprints;

    public IncrementalCache() {
        this.fingerprints = new HashSet<>();
    }

    public IncrementalCache(Collection<String> fingerprints) {
        this.fingerprints = new HashSet<>();
        for (String fingerprint : fingerprints) {
            if (fingerprint != null && !fingerprint.isBlank()) {
                this.fingerprints.add(fingerprint);
            }
        }
    }

    public boolean contains(String fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    /**
     * @return true if the fingerprint was not already present
     */
    public boolean insert(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Fingerprint cannot be null or empty");
        }
        return fingerprints.add(fingerprint);
    }

    public int size() {
        return fingerprints.size();
    }

    public boolean isEmpty() {
        return fingerprints.isEmpty();
    }

    /**
     * Snapshot of all entries in sorted order.
     */
    public List<String> fingerprints() {
        return fingerprints.stream().sorted().toList();
    }

    @Override
    public String toString() {
        return "IncrementalCache[size=" + fingerprints.size() + "]";
    }
}
