package org.camunda.bpm.getstarted.bpmnlayout.constraint;

import org.camunda.bpm.getstarted.bpmnlayout.models.Bounds;
import org.camunda.bpm.getstarted.bpmnlayout.models.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintSolverTest {
    private final ConstraintSolver solver = new ConstraintSolver();

    @Test
    void shouldPushNodeBelowReference() {
        solver.addNode("A", 0, 0, 100, 50);
        solver.addNode("B", 0, 10, 100, 50);
        solver.addConstraint(StackingConstraint.below("B", "A", 20, ConstraintStrength.REQUIRED));

        Map<String, Point> solved = solver.solve();

        assertEquals(new Point(0, 0), solved.get("A"));
        assertEquals(new Point(0, 70), solved.get("B"));
    }

    @Test
    void shouldNotMoveNodeAlreadyBelow() {
        solver.addNode("A", 0, 0, 100, 50);
        solver.addNode("B", 0, 200, 100, 50);
        solver.addConstraint(StackingConstraint.below("B", "A", 20, ConstraintStrength.REQUIRED));

        assertEquals(200, solver.solve().get("B").y());
    }

    @Test
    void shouldPullNodeAboveReference() {
        solver.addNode("A", 0, 100, 100, 50);
        solver.addNode("B", 0, 120, 100, 50);
        solver.addConstraint(StackingConstraint.above("B", "A", 10, ConstraintStrength.REQUIRED));

        assertEquals(40, solver.solve().get("B").y());
    }

    @Test
    void shouldKeepFixedYAgainstWeakerConstraint() {
        solver.addNode("A", 0, 0, 100, 50);
        solver.addNode("B", 0, 0, 100, 50);
        solver.addConstraint(StackingConstraint.fixedY("B", 5, ConstraintStrength.REQUIRED));
        solver.addConstraint(StackingConstraint.below("B", "A", 20, ConstraintStrength.WEAK));

        assertEquals(5, solver.solve().get("B").y());
    }

    @Test
    void shouldAlignX() {
        solver.addNode("A", 40, 0, 100, 50);
        solver.addNode("B", 300, 100, 60, 50);
        solver.addConstraint(StackingConstraint.alignX("B", "A", ConstraintStrength.MEDIUM));

        Map<String, Bounds> solved = solver.solveWithBounds();

        assertEquals(new Bounds(40, 100, 60, 50), solved.get("B"));
    }

    @Test
    void shouldStackChainTopToBottom() {
        solver.addNode("P1", 0, 0, 200, 60);
        solver.addNode("P2", 0, 0, 200, 100);
        solver.addNode("P3", 0, 0, 200, 80);
        int added = solver.addConstraints(List.of(
                StackingConstraint.fixedY("P1", 0, ConstraintStrength.REQUIRED),
                StackingConstraint.below("P2", "P1", 0, ConstraintStrength.REQUIRED),
                StackingConstraint.below("P3", "P2", 0, ConstraintStrength.REQUIRED)));

        Map<String, Point> solved = solver.solve();

        assertEquals(3, added);
        assertEquals(60, solved.get("P2").y());
        assertEquals(160, solved.get("P3").y());
    }

    @Test
    void shouldRejectConstraintOnUnknownNode() {
        solver.addNode("A", 0, 0, 100, 50);

        assertFalse(solver.addConstraint(StackingConstraint.below("X", "A", 0, ConstraintStrength.REQUIRED)));
        assertFalse(solver.addConstraint(StackingConstraint.below("A", "X", 0, ConstraintStrength.REQUIRED)));
    }

    @Test
    void shouldIgnoreSecondRegistration() {
        solver.addNode("A", 0, 0, 100, 50);
        solver.addNode("A", 0, 500, 100, 50);

        assertEquals(0, solver.solve().get("A").y());
    }

    @Test
    void shouldForgetEverythingOnClear() {
        solver.addNode("A", 0, 0, 100, 50);
        solver.clear();

        assertTrue(solver.solve().isEmpty());
    }

    @Test
    void shouldRequireReferenceForRelativeConstraint() {
        assertThrows(IllegalArgumentException.class,
                () -> new StackingConstraint(StackingConstraint.Kind.BELOW, "A", null, 0, ConstraintStrength.WEAK));
    }
}
