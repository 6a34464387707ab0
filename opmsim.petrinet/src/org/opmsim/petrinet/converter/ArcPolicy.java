package org.opmsim.petrinet.converter;

import org.apache.log4j.Logger;

/**
 * How agent and instrument links enter the net.
 */
public enum ArcPolicy {
    /** enablers must be present and are kept */
    TEST,
    /** enablers are consumed like inputs */
    CONSUME;

    private static final Logger logger = Logger.getLogger(ArcPolicy.class);

    /**
     * Reads {@code "test"} or {@code "consume"}; anything else falls back to TEST.
     */
    public static ArcPolicy fromName(String name) {
        if (name != null) {
            for (ArcPolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(name.trim())) {
                    return policy;
                }
            }
        }
        logger.warn("Unknown enabler arc policy '" + name + "', using " + TEST);
        return TEST;
    }
}
