package org.opmsim.constants;

import org.apache.log4j.Logger;

/**
 * Centralized defaults for the diagram engine and the simulator.
 *
 * Every tunable value can be overridden with a JVM system property, e.g.
 * {@code -Dopmsim.reachability.nodeCap=50000}. Values are read once at class load.
 */
public final class EngineConstants {
    private static final Logger logger = Logger.getLogger(EngineConstants.class);

    // =============================================================================
    // GEOMETRY DEFAULTS
    // =============================================================================
    public static final int GRID_SIZE = 25;
    public static final double NODE_WIDTH = 140;
    public static final double NODE_HEIGHT = 70;
    public static final double STATE_WIDTH = 100;
    public static final double STATE_HEIGHT = 28;

    // =============================================================================
    // OVERRIDABLE SETTINGS
    // =============================================================================
    public static final String PASTE_OFFSET_PROPERTY = "opmsim.paste.offset";
    public static final String HISTORY_LIMIT_PROPERTY = "opmsim.history.limit";
    public static final String MAX_STEPS_PROPERTY = "opmsim.simulation.maxSteps";
    public static final String NODE_CAP_PROPERTY = "opmsim.reachability.nodeCap";
    public static final String ENABLER_ARCS_PROPERTY = "opmsim.petrinet.enablerArcs";

    /** Offset applied to pasted and duplicated nodes, in both axes. */
    public static final double PASTE_OFFSET = doubleProperty(PASTE_OFFSET_PROPERTY, 30);

    /** Maximum number of undoable commands kept; 0 keeps everything. */
    public static final int HISTORY_LIMIT = intProperty(HISTORY_LIMIT_PROPERTY, 0);

    /** Step budget of run-to-fixpoint. */
    public static final int MAX_SIMULATION_STEPS = intProperty(MAX_STEPS_PROPERTY, 1000);

    /** Number of distinct markings after which reachability analysis gives up. */
    public static final int REACHABILITY_NODE_CAP = intProperty(NODE_CAP_PROPERTY, 10000);

    /** "test" keeps agent/instrument tokens on firing, "consume" removes them. */
    public static final String ENABLER_ARCS = System.getProperty(ENABLER_ARCS_PROPERTY, "test");

    private EngineConstants() {
    }

    static int intProperty(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '" + value + "' for " + name + ", using " + defaultValue);
            return defaultValue;
        }
    }

    static double doubleProperty(String name, double defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '" + value + "' for " + name + ", using " + defaultValue);
            return defaultValue;
        }
    }
}
