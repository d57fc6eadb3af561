package org.camunda.bpm.getstarted.bpmnlayout.tree;

import lombok.Builder;
import org.camunda.bpm.getstarted.bpmnlayout.LayoutConfig;

/**
 * @param horizontalGap distance between neighbouring subtrees
 * @param verticalGap   distance between a parent level and its children's level
 */
@Builder(toBuilder = true)
public record TreeLayoutOptions(
        double horizontalGap,
        double verticalGap,
        Direction direction
) {
    public enum Direction {
        DOWN,
        RIGHT
    }

    public TreeLayoutOptions {
        if (horizontalGap < 0 || verticalGap < 0) {
            throw new IllegalArgumentException(String.format(
                    "Tree gaps must not be negative (horizontal=%s, vertical=%s)", horizontalGap, verticalGap));
        }
        direction = direction == null ? Direction.DOWN : direction;
    }

    public static TreeLayoutOptions defaults() {
        return new TreeLayoutOptions(40, 60, Direction.DOWN);
    }

    public static TreeLayoutOptions from(LayoutConfig config) {
        return new TreeLayoutOptions(config.treeHorizontalGap(), config.treeVerticalGap(), Direction.DOWN);
    }
}
