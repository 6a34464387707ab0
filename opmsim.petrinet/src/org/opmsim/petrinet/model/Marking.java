package org.opmsim.petrinet.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable token count per place. Places without tokens are not stored, so two markings
 * are equal exactly when every place holds the same count.
 */
public final class Marking {
    public static final Marking EMPTY = new Marking(new TreeMap<String, Integer>());

    private final TreeMap<String, Integer> tokens;

    private Marking(TreeMap<String, Integer> tokens) {
        this.tokens = tokens;
    }

    public static Marking of(Map<String, Integer> counts) {
        TreeMap<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count < 0) {
                throw new IllegalArgumentException("Negative token count for " + entry.getKey() + ": " + count);
            }
            if (count > 0) {
                copy.put(entry.getKey(), count);
            }
        }
        return new Marking(copy);
    }

    public int get(String placeId) {
        Integer count = tokens.get(placeId);
        return count == null ? 0 : count;
    }

    public Marking with(String placeId, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative token count for " + placeId + ": " + count);
        }
        TreeMap<String, Integer> copy = new TreeMap<>(tokens);
        if (count == 0) {
            copy.remove(placeId);
        } else {
            copy.put(placeId, count);
        }
        return new Marking(copy);
    }

    /** Adds {@code delta} tokens, which may be negative. */
    public Marking add(String placeId, int delta) {
        return with(placeId, get(placeId) + delta);
    }

    public int total() {
        int sum = 0;
        for (int count : tokens.values()) {
            sum += count;
        }
        return sum;
    }

    /** Marked places with their counts, sorted by place id. */
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Marking)) return false;
        return tokens.equals(((Marking) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
