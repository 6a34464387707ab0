package org.opmsim.diagram.model;

import java.util.Comparator;

/**
 * Helpers for {@code <prefix>_<number>} identifiers.
 */
public final class Identifiers {

    /**
     * Orders identifiers by prefix, then numerically by counter value, so that
     * {@code process_9} sorts before {@code process_10}. Identifiers that do not follow the
     * pattern sort after well-formed ones, lexicographically.
     */
    public static final Comparator<String> ORDER = (a, b) -> {
        int sa = a.lastIndexOf('_');
        int sb = b.lastIndexOf('_');
        long na = number(a);
        long nb = number(b);
        if (na < 0 || nb < 0) {
            if (na >= 0) return -1;
            if (nb >= 0) return 1;
            return a.compareTo(b);
        }
        int byPrefix = a.substring(0, sa).compareTo(b.substring(0, sb));
        if (byPrefix != 0) {
            return byPrefix;
        }
        return Long.compare(na, nb);
    };

    private Identifiers() {
    }

    public static String format(IdKind kind, long number) {
        return kind.getPrefix() + "_" + number;
    }

    /**
     * @return the kind encoded in the identifier, or null if it does not follow the pattern
     */
    public static IdKind kindOf(String id) {
        if (id == null) return null;
        int sep = id.lastIndexOf('_');
        if (sep <= 0 || number(id) < 0) return null;
        return IdKind.fromPrefix(id.substring(0, sep));
    }

    /**
     * @return the counter value encoded in the identifier, or -1 if it does not follow the pattern
     */
    public static long number(String id) {
        if (id == null) return -1;
        int sep = id.lastIndexOf('_');
        if (sep <= 0 || sep == id.length() - 1) return -1;
        String digits = id.substring(sep + 1);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) return -1;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
