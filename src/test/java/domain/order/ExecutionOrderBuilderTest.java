package domain.order;

import domain.error.TreeIntegrityException;
import domain.plan.PlanStep;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionOrderBuilderTest {

    private final ExecutionOrderBuilder builder = new ExecutionOrderBuilder();

    private static List<PlanStep> nestedLoopsPlan() {
        // 0 SELECT, 1 HASH JOIN, 2 NESTED LOOPS, 3 INDEX, 4 VIEW, 5 TABLE ACCESS
        return List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0),
                new PlanStep(2, 1),
                new PlanStep(3, 2),
                new PlanStep(4, 1),
                new PlanStep(5, 4));
    }

    @Test
    void should_rank_children_before_parents_and_lower_siblings_first() {
        ExecutionOrderTable t = builder.build(null, nestedLoopsPlan());

        assertEquals(6, t.find(0).getOrderId());
        assertEquals(5, t.find(1).getOrderId());
        assertEquals(2, t.find(2).getOrderId());
        assertEquals(1, t.find(3).getOrderId());
        assertEquals(4, t.find(4).getOrderId());
        assertEquals(3, t.find(5).getOrderId());
        assertEquals(6, t.maxOrderId());
    }

    @Test
    void should_pass_parent_ids_through() {
        ExecutionOrderTable t = builder.build(null, nestedLoopsPlan());

        assertNull(t.find(0).getParentId());
        assertEquals(Integer.valueOf(1), t.find(4).getParentId());
        assertNull(t.find(42));
    }

    @Test
    void should_produce_dense_permutation_with_root_last_and_leaf_first() {
        // wide and deep: every node i > 0 hangs below (i - 1) / 3
        List<PlanStep> steps = new ArrayList<>();
        steps.add(new PlanStep(0, null));
        for (int i = 1; i < 40; i++) steps.add(new PlanStep(i, (i - 1) / 3));

        ExecutionOrderTable t = builder.build("1", steps);

        Set<Integer> orders = new HashSet<>();
        Set<Integer> parents = new HashSet<>();
        StepOrder first = null;
        for (StepOrder s : t.asMap().values()) {
            orders.add(s.getOrderId());
            if (s.getParentId() != null) parents.add(s.getParentId());
            if (s.getOrderId() == 1) first = s;
        }

        assertEquals(40, orders.size());
        for (int k = 1; k <= 40; k++) assertTrue(orders.contains(k), "missing order " + k);
        assertEquals(40, t.find(0).getOrderId());
        assertNotNull(first);
        assertFalse(parents.contains(first.getId()), "order 1 must be a leaf: " + first);
    }

    @Test
    void should_accept_rows_in_any_order() {
        List<PlanStep> shuffled = List.of(
                new PlanStep(5, 4),
                new PlanStep(2, 1),
                new PlanStep(0, null),
                new PlanStep(4, 1),
                new PlanStep(3, 2),
                new PlanStep(1, 0));

        Map<Integer, StepOrder> m = builder.build(null, shuffled).asMap();

        assertEquals(1, m.get(3).getOrderId());
        assertEquals(6, m.get(0).getOrderId());
    }

    @Test
    void should_keep_owner_and_name_for_qualification() {
        ExecutionOrderTable t = builder.build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0, "SCOTT", "DEPT"),
                new PlanStep(2, 0, null, "EMP")));

        assertEquals("SCOTT.DEPT", t.find(1).qualifiedName());
        assertEquals("EMP", t.find(2).qualifiedName());
    }

    @Test
    void should_reject_duplicate_root() {
        TreeIntegrityException e = assertThrows(TreeIntegrityException.class, () -> builder.build("7", List.of(
                new PlanStep(0, null),
                new PlanStep(0, null),
                new PlanStep(1, 0))));

        assertEquals("7", e.getGroupKey());
        assertEquals(List.of(0), e.getOffendingIds());
        assertTrue(e.getMessage().startsWith("[group 7] "), e.getMessage());
        assertEquals(4, e.exitCode());
    }

    @Test
    void should_reject_missing_root() {
        assertThrows(TreeIntegrityException.class, () -> builder.build(null, List.of(
                new PlanStep(1, null),
                new PlanStep(2, 1))));
    }

    @Test
    void should_reject_second_parentless_step() {
        TreeIntegrityException e = assertThrows(TreeIntegrityException.class, () -> builder.build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0),
                new PlanStep(2, null))));

        assertEquals(List.of(2), e.getOffendingIds());
    }

    @Test
    void should_name_steps_with_dangling_parent() {
        TreeIntegrityException e = assertThrows(TreeIntegrityException.class, () -> builder.build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0),
                new PlanStep(2, 9))));

        assertEquals(List.of(2), e.getOffendingIds());
        assertTrue(e.getMessage().contains("[2]"), e.getMessage());
    }

    @Test
    void should_reject_cycle_detached_from_root() {
        TreeIntegrityException e = assertThrows(TreeIntegrityException.class, () -> builder.build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 2),
                new PlanStep(2, 1))));

        assertEquals(List.of(1, 2), e.getOffendingIds());
    }

    @Test
    void should_reject_duplicate_non_root_ids() {
        TreeIntegrityException e = assertThrows(TreeIntegrityException.class, () -> builder.build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0),
                new PlanStep(1, 0))));

        assertEquals(List.of(1), e.getOffendingIds());
    }

    @Test
    void should_rank_single_root() {
        ExecutionOrderTable t = builder.build(null, List.of(new PlanStep(0, null)));
        assertEquals(1, t.find(0).getOrderId());
        assertEquals(1, t.size());
    }
}
