package org.camunda.bpm.getstarted.bpmnlayout.models;

import java.util.Set;

/**
 * Category predicates over BPMN type names.
 */
public final class BpmnTypes {
    public static final String PARTICIPANT = "participant";
    public static final String LANE = "lane";
    public static final String COLLABORATION = "collaboration";
    public static final String GROUP = "group";
    public static final String START_EVENT = "startEvent";
    public static final String END_EVENT = "endEvent";
    public static final String BOUNDARY_EVENT = "boundaryEvent";

    public static final String SEQUENCE_FLOW = "sequenceFlow";
    public static final String MESSAGE_FLOW = "messageFlow";
    public static final String DATA_INPUT_ASSOCIATION = "dataInputAssociation";
    public static final String DATA_OUTPUT_ASSOCIATION = "dataOutputAssociation";
    public static final String ASSOCIATION = "association";

    private static final Set<String> SUB_PROCESSES = Set.of("subProcess", "transaction", "adHocSubProcess",
            "eventSubProcess");
    private static final Set<String> DATA_OBJECTS = Set.of("dataObject", "dataObjectReference", "dataInput",
            "dataOutput");
    private static final Set<String> ARTIFACTS = Set.of("dataObject", "dataObjectReference", "dataInput",
            "dataOutput", "dataStoreReference", "textAnnotation");

    private BpmnTypes() {
    }

    public static boolean isEvent(String type) {
        return type != null && type.contains("Event");
    }

    public static boolean isGateway(String type) {
        return type != null && type.contains("Gateway");
    }

    public static boolean isTask(String type) {
        return type != null && (type.contains("Task") || type.equals("task"));
    }

    public static boolean isSubProcess(String type) {
        return type != null && SUB_PROCESSES.contains(type);
    }

    public static boolean isActivity(String type) {
        return isTask(type) || isSubProcess(type) || "callActivity".equals(type);
    }

    public static boolean isDataObject(String type) {
        return type != null && DATA_OBJECTS.contains(type);
    }

    public static boolean isArtifact(String type) {
        return type != null && ARTIFACTS.contains(type);
    }

    public static boolean isGroup(String type) {
        return GROUP.equals(type);
    }

    public static boolean isPool(String type) {
        return PARTICIPANT.equals(type);
    }

    public static boolean isLane(String type) {
        return LANE.equals(type);
    }

    /**
     * Nodes that take part in the process flow: activities, events and gateways.
     */
    public static boolean isFlowNode(String type) {
        return isActivity(type) || isEvent(type) || isGateway(type);
    }

    public static boolean isExpandedSubProcess(BpmnNode node) {
        return node.bpmn != null && Boolean.TRUE.equals(node.bpmn.isExpanded);
    }

    public static boolean isDataAssociation(String edgeType) {
        return DATA_INPUT_ASSOCIATION.equals(edgeType) || DATA_OUTPUT_ASSOCIATION.equals(edgeType);
    }
}
