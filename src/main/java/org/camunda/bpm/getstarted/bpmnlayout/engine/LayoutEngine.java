package org.camunda.bpm.getstarted.bpmnlayout.engine;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;

/**
 * The hierarchical layout primitive the pipeline runs on. Given a prepared tree of sized nodes and
 * edges it assigns node positions (relative to the parent) and edge routes (relative to the node
 * owning the edge).
 */
public interface LayoutEngine {

    /**
     * Lays out the tree in place and returns it.
     *
     * @throws LayoutEngineException when the layout cannot be computed
     */
    BpmnNode layout(BpmnNode prepared);
}
