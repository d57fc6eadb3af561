package org.camunda.bpm.getstarted.bpmnlayout.models;

/**
 * @param input true when the artifact feeds the task (artifact is the edge source)
 */
public record ArtifactInfo(String artifactId, String associatedTaskId, boolean input) {
}
