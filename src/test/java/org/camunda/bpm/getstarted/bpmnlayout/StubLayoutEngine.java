package org.camunda.bpm.getstarted.bpmnlayout;

import org.camunda.bpm.getstarted.bpmnlayout.engine.LayoutEngine;
import org.camunda.bpm.getstarted.bpmnlayout.index.NodeIndex;
import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;
import org.camunda.bpm.getstarted.bpmnlayout.models.Padding;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.camunda.bpm.getstarted.bpmnlayout.options.ElkOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Predictable engine for pipeline tests: children of every container in one row in declaration
 * order, vertically centred, 50 px apart. Edges run from the source's right side to the target's
 * left side.
 */
public class StubLayoutEngine implements LayoutEngine {
    public static final double GAP = 50;
    private static final double DEFAULT_PADDING = 12;

    private int calls;

    @Override
    public BpmnNode layout(BpmnNode prepared) {
        calls++;
        prepared.setPosition(0, 0);
        place(prepared);
        NodeIndex index = NodeIndex.build(prepared);
        for (NodeIndex.EdgeRef ref : index.edges()) {
            String source = ref.edge().sourceId();
            String target = ref.edge().targetId();
            if (source == null || target == null || !index.contains(source) || !index.contains(target)) {
                continue;
            }
            index.setAbsoluteRoute(ref.edge(), route(index.absoluteBounds(source), index.absoluteBounds(target)));
        }
        return prepared;
    }

    public int calls() {
        return calls;
    }

    private void place(BpmnNode container) {
        if (!container.hasChildren()) {
            return;
        }
        for (BpmnNode child : container.children) {
            place(child);
        }
        Padding padding = padding(container);
        double rowHeight = 0;
        for (BpmnNode child : container.children) {
            rowHeight = Math.max(rowHeight, child.heightValue());
        }
        double x = padding.left();
        for (BpmnNode child : container.children) {
            child.setPosition(x, padding.top() + (rowHeight - child.heightValue()) / 2);
            x += child.widthValue() + GAP;
        }
        container.setSize(x - GAP + padding.right(), padding.top() + rowHeight + padding.bottom());
    }

    private static Padding padding(BpmnNode node) {
        if (node.padding != null) {
            return node.padding;
        }
        String option = node.option(ElkOptions.PADDING);
        return option == null ? Padding.uniform(DEFAULT_PADDING) : Padding.parse(option);
    }

    private static List<Point> route(Bounds source, Bounds target) {
        Point start = new Point(source.right(), source.centerY());
        Point end = new Point(target.x(), target.centerY());
        List<Point> route = new ArrayList<>();
        route.add(start);
        if (Math.abs(start.y() - end.y()) > 1) {
            double midX = (start.x() + end.x()) / 2;
            route.add(new Point(midX, start.y()));
            route.add(new Point(midX, end.y()));
        }
        route.add(end);
        return route;
    }
}
