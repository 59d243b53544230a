package domain.order;

import domain.error.TreeIntegrityException;
import domain.plan.PlanStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ranks the steps of one plan in physical execution order.
 *
 * <p>Depth-first walk from id 0, children in descending id order, with an explicit stack.
 * The walk visits a parent before its children and the highest sibling first, so reversing the
 * visit sequence ({@code order = N + 1 - visit}) puts children before parents and lower
 * siblings before higher ones.</p>
 *
 * <pre>
 *   0                     visit: 0 1 4 5 2 3
 *   └ 1                   order: 6 5 4 3 2 1
 *     ├ 2
 *     │ └ 3               =&gt; 3 runs first, then 2, 5, 4, 1, 0
 *     └ 4
 *       └ 5
 * </pre>
 */
public final class ExecutionOrderBuilder {

    public static final int ROOT_ID = 0;

    /**
     * @param groupKey group the steps belong to (for messages), may be {@code null}
     * @param steps    all steps of one group
     * @throws TreeIntegrityException when the rows do not form a single tree rooted at id 0
     */
    public ExecutionOrderTable build(String groupKey, List<PlanStep> steps) {
        List<PlanStep> rows = (steps == null) ? Collections.emptyList() : steps;

        Map<Integer, PlanStep> byId = index(groupKey, rows);
        checkRoot(groupKey, byId, rows);
        Map<Integer, List<Integer>> children = childrenDescending(groupKey, byId);

        List<Integer> visitOrder = walk(children);
        if (visitOrder.size() != byId.size()) {
            TreeSet<Integer> unreachable = new TreeSet<>(byId.keySet());
            unreachable.removeAll(visitOrder);
            throw fail(groupKey, new ArrayList<>(unreachable),
                    "steps not reachable from id 0 (cycle in parent ids): " + unreachable);
        }

        int n = visitOrder.size();
        Map<Integer, StepOrder> orders = new TreeMap<>();
        for (int v = 0; v < n; v++) {
            PlanStep s = byId.get(visitOrder.get(v));
            int orderId = n - v;
            orders.put(s.getId(), new StepOrder(s.getId(), s.getParentId(), orderId,
                    s.getObjectOwner(), s.getObjectName()));
        }
        return new ExecutionOrderTable(groupKey, orders);
    }

    private static Map<Integer, PlanStep> index(String groupKey, List<PlanStep> rows) {
        Map<Integer, PlanStep> byId = new HashMap<>(Math.max(16, rows.size() * 2));
        TreeSet<Integer> negative = new TreeSet<>();
        TreeSet<Integer> duplicates = new TreeSet<>();

        for (PlanStep s : rows) {
            if (s == null) continue;
            if (s.getId() < 0) {
                negative.add(s.getId());
                continue;
            }
            if (byId.putIfAbsent(s.getId(), s) != null) {
                duplicates.add(s.getId());
            }
        }

        if (!negative.isEmpty()) {
            throw fail(groupKey, new ArrayList<>(negative), "negative step ids: " + negative);
        }
        if (duplicates.contains(ROOT_ID)) {
            throw fail(groupKey, new ArrayList<>(duplicates), "more than one root: id 0 appears more than once");
        }
        if (!duplicates.isEmpty()) {
            throw fail(groupKey, new ArrayList<>(duplicates), "duplicate step ids: " + duplicates);
        }
        return byId;
    }

    private static void checkRoot(String groupKey, Map<Integer, PlanStep> byId, List<PlanStep> rows) {
        PlanStep root = byId.get(ROOT_ID);
        if (root == null) {
            throw fail(groupKey, Collections.emptyList(),
                    "no root: id 0 is missing (" + rows.size() + " rows)");
        }
        if (root.getParentId() != null) {
            throw fail(groupKey, List.of(ROOT_ID), "id 0 must not have a parent, found parent_id=" + root.getParentId());
        }

        TreeSet<Integer> extraRoots = new TreeSet<>();
        for (PlanStep s : byId.values()) {
            if (!s.isRoot() && s.getParentId() == null) extraRoots.add(s.getId());
        }
        if (!extraRoots.isEmpty()) {
            throw fail(groupKey, new ArrayList<>(extraRoots),
                    "more than one root: steps without parent besides id 0: " + extraRoots);
        }
    }

    private static Map<Integer, List<Integer>> childrenDescending(String groupKey, Map<Integer, PlanStep> byId) {
        Map<Integer, List<Integer>> children = new HashMap<>();
        TreeSet<Integer> dangling = new TreeSet<>();

        for (PlanStep s : byId.values()) {
            Integer pid = s.getParentId();
            if (pid == null) continue;
            if (!byId.containsKey(pid)) {
                dangling.add(s.getId());
                continue;
            }
            children.computeIfAbsent(pid, k -> new ArrayList<>()).add(s.getId());
        }

        if (!dangling.isEmpty()) {
            throw fail(groupKey, new ArrayList<>(dangling),
                    "parent_id references a missing step for ids: " + dangling);
        }

        for (List<Integer> c : children.values()) {
            c.sort(Collections.reverseOrder());
        }
        return children;
    }

    private static List<Integer> walk(Map<Integer, List<Integer>> children) {
        List<Integer> visited = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(ROOT_ID);

        while (!stack.isEmpty()) {
            int id = stack.pop();
            visited.add(id);

            List<Integer> c = children.get(id);
            if (c == null) continue;
            // c is descending; push lowest first so the highest id is popped next
            for (int i = c.size() - 1; i >= 0; i--) {
                stack.push(c.get(i));
            }
        }
        return visited;
    }

    private static TreeIntegrityException fail(String groupKey, List<Integer> ids, String message) {
        String prefix = (groupKey == null) ? "" : "[group " + groupKey + "] ";
        return new TreeIntegrityException(groupKey, ids, prefix + message);
    }
}
