package org.camunda.bpm.getstarted.bpmnlayout.sizing;

/**
 * Default dimensions per element category.
 */
public enum DefaultSizes {
    EVENT(36, 36),
    GATEWAY(50, 50),
    TASK(100, 80),
    TASK_WIDE(120, 80),
    TASK_WIDER(150, 80),
    SUBPROCESS_COLLAPSED(100, 80),
    SUBPROCESS_EXPANDED_MIN(300, 200),
    DATA_OBJECT(36, 50),
    DATA_STORE(50, 50),
    TEXT_ANNOTATION(100, 30),
    PARTICIPANT(680, 200),
    LANE(680, 150),
    OTHER(100, 80);

    private final double width;
    private final double height;

    DefaultSizes(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }
}
