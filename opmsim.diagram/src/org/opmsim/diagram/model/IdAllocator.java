package org.opmsim.diagram.model;

import java.util.EnumMap;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Issues unique, monotonically increasing identifiers per {@link IdKind}.
 * Identifiers are never reused, not even after the element they named was deleted.
 * Not thread-safe; the engine is mutated from a single thread.
 */
public class IdAllocator {
    private static final Logger logger = Logger.getLogger(IdAllocator.class);

    private final Map<IdKind, Long> lastIssued = new EnumMap<>(IdKind.class);

    public IdAllocator() {
        for (IdKind kind : IdKind.values()) {
            lastIssued.put(kind, 0L);
        }
    }

    public String next(IdKind kind) {
        long value = lastIssued.get(kind) + 1;
        lastIssued.put(kind, value);
        return Identifiers.format(kind, value);
    }

    public String next(NodeKind kind) {
        return next(kind.getIdKind());
    }

    /**
     * Makes sure the counter of the identifier's kind is at least the identifier's number,
     * so the next issued value is strictly greater. Identifiers outside the
     * {@code <prefix>_<n>} scheme are ignored.
     */
    public void reserve(String id) {
        IdKind kind = Identifiers.kindOf(id);
        if (kind == null) {
            logger.debug("Identifier " + id + " is outside the allocator scheme, not reserved");
            return;
        }
        long number = Identifiers.number(id);
        if (number > lastIssued.get(kind)) {
            lastIssued.put(kind, number);
        }
    }

    /** Value the next call to {@link #next(IdKind)} will use. */
    public long peek(IdKind kind) {
        return lastIssued.get(kind) + 1;
    }
}
