package org.camunda.bpm.getstarted.bpmnlayout.models;

public enum LayerConstraint {
    FIRST,
    LAST
}
