package org.camunda.bpm.getstarted.bpmnlayout.models;

public record Obstacle(String id, Bounds bounds) {
}
