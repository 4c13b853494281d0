package io.tradeflow.core.execution;

import java.io.Serial;

/// Thrown when `step N` is referenced before step N has recorded a result.
public class StepNotFoundException extends WorkflowRuntimeException {

    @Serial private static final long serialVersionUID = -3785110984657302731L;

    private final int stepId;

    public StepNotFoundException(int stepId) {
        super("Step " + stepId + " not found");
        this.stepId = stepId;
    }

    public int getStepId() {
        return stepId;
    }
}
