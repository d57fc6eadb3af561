package org.camunda.bpm.getstarted.bpmnlayout.constraint;

/**
 * How firmly a constraint holds. Only {@link #REQUIRED} constraints are guaranteed; weaker ones are
 * dropped when an earlier constraint of higher strength already fixed the same coordinate.
 */
public enum ConstraintStrength {
    REQUIRED(1000),
    STRONG(100),
    MEDIUM(10),
    WEAK(1);

    private final int weight;

    ConstraintStrength(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
