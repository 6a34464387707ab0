package org.opmsim.diagram.model;

/**
 * Multiplicity at one end of a link: an exact count ({@code "2"}) or an open range
 * with a finite lower bound ({@code "0..*"}).
 */
public final class Cardinality {
    private final int lower;
    private final boolean unbounded;

    private Cardinality(int lower, boolean unbounded) {
        if (lower < 0) {
            throw new IllegalArgumentException("Cardinality cannot be negative: " + lower);
        }
        this.lower = lower;
        this.unbounded = unbounded;
    }

    public static Cardinality exactly(int count) {
        return new Cardinality(count, false);
    }

    public static Cardinality atLeast(int lower) {
        return new Cardinality(lower, true);
    }

    /**
     * Parses {@code "n"}, {@code "n..*"} or {@code "*"} (shorthand for {@code "0..*"}).
     *
     * @return null for a null or blank text
     * @throws IllegalArgumentException for anything else
     */
    public static Cardinality parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String value = text.trim();
        if (value.equals("*")) {
            return atLeast(0);
        }
        try {
            if (value.endsWith("..*")) {
                return atLeast(Integer.parseInt(value.substring(0, value.length() - 3).trim()));
            }
            return exactly(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed cardinality '" + text + "'", e);
        }
    }

    public int getLower() {
        return lower;
    }

    public boolean isExact() {
        return !unbounded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cardinality)) return false;
        Cardinality other = (Cardinality) o;
        return lower == other.lower && unbounded == other.unbounded;
    }

    @Override
    public int hashCode() {
        return 31 * lower + (unbounded ? 1 : 0);
    }

    @Override
    public String toString() {
        return unbounded ? lower + "..*" : Integer.toString(lower);
    }
}
