package org.camunda.bpm.getstarted.bpmnlayout;

import lombok.Builder;

/**
 * Every tunable constant of the layout pipeline. Use {@link #defaults()} or start from
 * {@link #defaultsBuilder()} to override single values.
 */
@Builder(toBuilder = true)
public record LayoutConfig(
        boolean debug,

        // main flow
        double mainFlowTargetY,
        double convergingGatewayOffset,
        double horizontalGap,

        // boundary branches
        double boundaryEventWidth,
        double boundaryEventSpacing,
        double branchMergeLayerOffset,
        double branchToEndLayerOffset,
        double branchDeadEndLayerOffset,
        double branchMinVerticalGap,
        double branchClearance,
        double branchMergeXOffset,
        double branchToEndXOffset,
        double branchDetourClearance,
        double branchDetourJog,
        double branchNodeGap,

        // artifacts and groups
        double artifactVerticalGap,
        double artifactSpacing,
        double artifactRouteMargin,
        double groupPadding,

        // lanes
        double laneHeaderWidth,
        double laneExtraWidth,
        double laneExtraHeight,
        double emptyLaneContentHeight,

        // pools
        double poolHeaderWidth,
        double poolPaddingX,
        double poolPaddingY,
        double poolMinHeight,
        double poolExtraWidth,
        double poolExtraHeight,
        double blackBoxPoolHeight,
        double flattenedPoolPadding,
        double messageFlowJog,
        double messageFlowLongDistance,

        // routing
        double gatewaySnapTolerance,
        double gatewayBendAlignTolerance,
        double edgeFixerMargin,
        double gridCellSize,
        double gridObstacleMargin,
        double gridPadding,
        double containerPadding,

        // boundary branch trees
        double treeHorizontalGap,
        double treeVerticalGap,
        double boundaryBranchGap
) {
    public LayoutConfig {
        if (gridCellSize <= 0) {
            throw new IllegalArgumentException(String.format("Grid cell size must be positive, got %s", gridCellSize));
        }
        if (gridObstacleMargin < 0 || gridPadding < 0) {
            throw new IllegalArgumentException("Grid margins must not be negative");
        }
    }

    public static LayoutConfig defaults() {
        return defaultsBuilder().build();
    }

    public static LayoutConfigBuilder defaultsBuilder() {
        return LayoutConfig.builder()
                .debug(false)
                .mainFlowTargetY(12)
                .convergingGatewayOffset(150)
                .horizontalGap(50)
                .boundaryEventWidth(36)
                .boundaryEventSpacing(20)
                .branchMergeLayerOffset(85)
                .branchToEndLayerOffset(80)
                .branchDeadEndLayerOffset(100)
                .branchMinVerticalGap(35)
                .branchClearance(55)
                .branchMergeXOffset(30)
                .branchToEndXOffset(20)
                .branchDetourClearance(30)
                .branchDetourJog(20)
                .branchNodeGap(20)
                .artifactVerticalGap(20)
                .artifactSpacing(15)
                .artifactRouteMargin(15)
                .groupPadding(20)
                .laneHeaderWidth(30)
                .laneExtraWidth(50)
                .laneExtraHeight(80)
                .emptyLaneContentHeight(50)
                .poolHeaderWidth(55)
                .poolPaddingX(25)
                .poolPaddingY(20)
                .poolMinHeight(100)
                .poolExtraWidth(50)
                .poolExtraHeight(80)
                .blackBoxPoolHeight(60)
                .flattenedPoolPadding(12)
                .messageFlowJog(20)
                .messageFlowLongDistance(200)
                .gatewaySnapTolerance(30)
                .gatewayBendAlignTolerance(20)
                .edgeFixerMargin(15)
                .gridCellSize(10)
                .gridObstacleMargin(5)
                .gridPadding(50)
                .containerPadding(12)
                .treeHorizontalGap(40)
                .treeVerticalGap(60)
                .boundaryBranchGap(50);
    }

    /**
     * Minimal horizontal distance between two branches started by boundary events of the same host.
     */
    public double boundaryEventPitch() {
        return boundaryEventWidth + boundaryEventSpacing;
    }
}
