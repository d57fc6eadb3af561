package org.camunda.bpm.getstarted.bpmnlayout.models;

/**
 * Node priority handed to the layout engine. Higher values are kept straighter.
 */
public enum LayoutPriority {
    MAIN_FLOW(10),
    BOUNDARY_BRANCH(0);

    private final int value;

    LayoutPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
