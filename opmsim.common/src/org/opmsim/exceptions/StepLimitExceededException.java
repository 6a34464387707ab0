package org.opmsim.exceptions;

/**
 * Thrown by run-to-fixpoint when the net still has an enabled transition after the step budget.
 */
public class StepLimitExceededException extends SimulationException {

    public static final String ERROR_CODE = "STEP_LIMIT_EXCEEDED";

    private final int maxSteps;

    public StepLimitExceededException(int maxSteps) {
        super("Net did not reach a fixpoint within " + maxSteps + " steps", ERROR_CODE, null);
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
