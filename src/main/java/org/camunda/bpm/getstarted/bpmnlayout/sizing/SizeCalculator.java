package org.camunda.bpm.getstarted.bpmnlayout.sizing;

import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnTypes;

/**
 * Fills in missing node dimensions from the element category.
 */
public class SizeCalculator {
    private static final int WIDE_NAME_LENGTH = 8;
    private static final int WIDER_NAME_LENGTH = 12;

    private final double boundaryEventPitch;
    private final double boundaryEventSpacing;

    public SizeCalculator(double boundaryEventWidth, double boundaryEventSpacing) {
        this.boundaryEventPitch = boundaryEventWidth + boundaryEventSpacing;
        this.boundaryEventSpacing = boundaryEventSpacing;
    }

    public SizeCalculator() {
        this(36, 20);
    }

    /**
     * Applies default sizes to every node below the root, boundary events included.
     * Only missing dimensions are filled, explicit ones are kept.
     */
    public void applyDefaultSizes(BpmnNode graph) {
        for (BpmnNode child : graph.childrenOrEmpty()) {
            applyRecursive(child);
        }
    }

    private void applyRecursive(BpmnNode node) {
        if (node.bpmn != null) {
            DefaultSizes size = defaultSizeFor(node.type(), node.name(), node.bpmn.isExpanded);
            if (node.width == null) {
                node.width = size.width();
            }
            if (node.height == null) {
                node.height = size.height();
            }
        }

        for (BpmnNode child : node.childrenOrEmpty()) {
            applyRecursive(child);
        }

        int boundaryCount = node.boundaryEventsOrEmpty().size();
        for (BpmnNode event : node.boundaryEventsOrEmpty()) {
            applyRecursive(event);
        }
        // room for every boundary event with spacing between them
        if (boundaryCount > 1 && node.width != null) {
            double minWidth = boundaryCount * boundaryEventPitch + boundaryEventSpacing;
            if (node.width < minWidth) {
                node.width = minWidth;
            }
        }
    }

    public DefaultSizes defaultSizeFor(String type, String name, Boolean isExpanded) {
        if (Boolean.TRUE.equals(isExpanded)) {
            return DefaultSizes.SUBPROCESS_EXPANDED_MIN;
        }
        if (type == null) {
            return DefaultSizes.OTHER;
        }
        if (BpmnTypes.isEvent(type)) {
            return DefaultSizes.EVENT;
        }
        if (BpmnTypes.isGateway(type)) {
            return DefaultSizes.GATEWAY;
        }
        if (BpmnTypes.isTask(type) || type.equals("callActivity")) {
            int length = name == null ? 0 : name.length();
            if (length > WIDER_NAME_LENGTH) {
                return DefaultSizes.TASK_WIDER;
            }
            if (length > WIDE_NAME_LENGTH) {
                return DefaultSizes.TASK_WIDE;
            }
            return DefaultSizes.TASK;
        }
        if (BpmnTypes.isSubProcess(type)) {
            return DefaultSizes.SUBPROCESS_COLLAPSED;
        }
        if (BpmnTypes.isDataObject(type)) {
            return DefaultSizes.DATA_OBJECT;
        }
        return switch (type) {
            case "dataStoreReference" -> DefaultSizes.DATA_STORE;
            case "textAnnotation" -> DefaultSizes.TEXT_ANNOTATION;
            case BpmnTypes.PARTICIPANT -> DefaultSizes.PARTICIPANT;
            case BpmnTypes.LANE -> DefaultSizes.LANE;
            default -> DefaultSizes.OTHER;
        };
    }

    /**
     * Rough label width: 7 px per Latin character, 14 px per wide (CJK) character, clamped to [30, 200].
     * Empty labels count as 50 px.
     */
    public static double estimateLabelWidth(String text) {
        if (text == null || text.isEmpty()) {
            return 50;
        }
        double width = 0;
        for (int i = 0; i < text.length(); i++) {
            width += text.charAt(i) > 255 ? 14 : 7;
        }
        return Math.max(30, Math.min(200, width));
    }
}
