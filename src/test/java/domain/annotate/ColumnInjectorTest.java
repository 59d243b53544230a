package domain.annotate;

import domain.order.ExecutionOrderBuilder;
import domain.order.ExecutionOrderTable;
import domain.plan.PlanStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnInjectorTest {

    @Test
    void should_size_cells_by_largest_order_id() {
        assertEquals(6, ColumnInjector.columnWidth(1));
        assertEquals(6, ColumnInjector.columnWidth(999));
        assertEquals(7, ColumnInjector.columnWidth(1000));
        assertEquals(8, ColumnInjector.columnWidth(12345));
    }

    @Test
    void should_insert_cells_after_second_delimiter() {
        ExecutionOrderTable t = new ExecutionOrderBuilder().build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0)));
        ColumnInjector injector = new ColumnInjector(6);

        assertEquals("| Id  | Pid | Ord | Operation |", injector.header("| Id  | Operation |"));
        assertEquals("|   0 |     |   2 | SELECT    |", injector.data("|   0 | SELECT    |", t.find(0)));
        assertEquals("|*  1 |   0 |   1 |  FILTER   |", injector.data("|*  1 |  FILTER   |", t.find(1)));
        assertEquals("|     |     |     | (more)    |", injector.continuation("|     | (more)    |"));
    }

    @Test
    void should_extend_separator_by_both_cells_and_extra() {
        ColumnInjector injector = new ColumnInjector(7);
        assertEquals("--------------" + "-----", injector.separator("-----", 0));
        assertEquals("--------------" + "---" + "-----", injector.separator("-----", 3));
    }

    @Test
    void should_leave_line_without_second_delimiter() {
        assertEquals("| broken", ColumnInjector.insertAfterIdColumn("| broken", "xx"));
        assertEquals(-1, ColumnInjector.nthIndexOf("a|b", '|', 2));
        assertEquals(3, ColumnInjector.nthIndexOf("|ab|c|", '|', 2));
    }
}
