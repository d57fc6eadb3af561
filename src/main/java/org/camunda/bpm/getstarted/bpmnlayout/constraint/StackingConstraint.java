package org.camunda.bpm.getstarted.bpmnlayout.constraint;

/**
 * A constraint between a node and a reference node.
 * <ul>
 *     <li>{@code BELOW}: node.y &ge; reference.bottom + value</li>
 *     <li>{@code ABOVE}: node.bottom + value &le; reference.y</li>
 *     <li>{@code ALIGN_X}: node.x = reference.x</li>
 *     <li>{@code FIXED_Y}: node.y = value, no reference</li>
 * </ul>
 */
public record StackingConstraint(
        Kind kind,
        String nodeId,
        String referenceId,
        double value,
        ConstraintStrength strength
) {
    public enum Kind {
        BELOW,
        ABOVE,
        ALIGN_X,
        FIXED_Y
    }

    public StackingConstraint {
        if (kind == null || nodeId == null) {
            throw new IllegalArgumentException("Constraint needs a kind and a node id");
        }
        if (kind != Kind.FIXED_Y && referenceId == null) {
            throw new IllegalArgumentException(String.format("%s constraint on '%s' needs a reference", kind, nodeId));
        }
        strength = strength == null ? ConstraintStrength.REQUIRED : strength;
    }

    public static StackingConstraint below(String nodeId, String referenceId, double minGap,
                                           ConstraintStrength strength) {
        return new StackingConstraint(Kind.BELOW, nodeId, referenceId, minGap, strength);
    }

    public static StackingConstraint above(String nodeId, String referenceId, double minGap,
                                           ConstraintStrength strength) {
        return new StackingConstraint(Kind.ABOVE, nodeId, referenceId, minGap, strength);
    }

    public static StackingConstraint alignX(String nodeId, String referenceId, ConstraintStrength strength) {
        return new StackingConstraint(Kind.ALIGN_X, nodeId, referenceId, 0, strength);
    }

    public static StackingConstraint fixedY(String nodeId, double y, ConstraintStrength strength) {
        return new StackingConstraint(Kind.FIXED_Y, nodeId, null, y, strength);
    }
}
