package org.camunda.bpm.getstarted.bpmnlayout.options;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Layout engine options tuned for BPMN diagrams.
 */
public final class ElkOptions {
    public static final String ALGORITHM = "elk.algorithm";
    public static final String DIRECTION = "elk.direction";
    public static final String PADDING = "elk.padding";
    public static final String HIERARCHY_HANDLING = "elk.hierarchyHandling";
    public static final String PARTITIONING_ACTIVATE = "elk.partitioning.activate";
    public static final String PARTITION = "elk.partitioning.partition";

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(ALGORITHM, "layered");
        defaults.put(DIRECTION, "RIGHT");
        defaults.put("elk.layered.layering.strategy", "NETWORK_SIMPLEX");
        defaults.put("elk.layered.crossingMinimization.strategy", "LAYER_SWEEP");
        defaults.put("elk.layered.crossingMinimization.greedySwitch.type", "TWO_SIDED");
        defaults.put("elk.layered.nodePlacement.strategy", "BRANDES_KOEPF");
        defaults.put("elk.layered.nodePlacement.bk.fixedAlignment", "BALANCED");
        defaults.put("elk.edgeRouting", "ORTHOGONAL");
        defaults.put("elk.layered.edgeRouting.selfLoopDistribution", "EQUALLY");
        defaults.put("elk.edgeLabels.placement", "CENTER");
        defaults.put("elk.spacing.labelLabel", "5");
        defaults.put("elk.spacing.labelNode", "10");
        defaults.put("elk.spacing.edgeLabel", "10");
        defaults.put("elk.spacing.nodeNode", "60");
        defaults.put("elk.spacing.edgeNode", "40");
        defaults.put("elk.spacing.edgeEdge", "25");
        defaults.put("elk.layered.spacing.nodeNodeBetweenLayers", "100");
        defaults.put("elk.layered.spacing.edgeNodeBetweenLayers", "40");
        defaults.put("elk.layered.spacing.edgeEdgeBetweenLayers", "25");
        defaults.put(HIERARCHY_HANDLING, "INCLUDE_CHILDREN");
        defaults.put("elk.layered.considerModelOrder.strategy", "NODES_AND_EDGES");
        defaults.put("elk.layered.compaction.connectedComponents", "true");
        defaults.put("elk.alignment", "CENTER");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private ElkOptions() {
    }

    public static Map<String, String> defaults() {
        return DEFAULTS;
    }

    /**
     * Defaults, overridden by the graph's own options, overridden by the caller's options.
     * Null keys or values are ignored.
     */
    public static Map<String, String> merge(Map<String, String> userOptions, Map<String, String> graphOptions) {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULTS);
        putAll(merged, graphOptions);
        putAll(merged, userOptions);
        return merged;
    }

    /**
     * Partition index from {@link #PARTITION}, 0 when absent.
     *
     * @throws IllegalArgumentException when the value is not an integer
     */
    public static int partition(String ownerId, Map<String, String> options) {
        String value = options == null ? null : options.get(PARTITION);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("'%s' has an invalid partition '%s'", ownerId, value), e);
        }
    }

    private static void putAll(Map<String, String> target, Map<String, String> source) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                target.put(key, value);
            }
        });
    }
}
