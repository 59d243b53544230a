package domain.annotate;

import domain.order.ExecutionOrderBuilder;
import domain.order.ExecutionOrderTable;
import domain.plan.PlanStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameQualifierTest {

    private static ExecutionOrderTable deptAndEmp() {
        return new ExecutionOrderBuilder().build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0, "SCOTT", "DEPT"),
                new PlanStep(2, 0, null, "EMP")));
    }

    @Test
    void should_pad_by_owner_prefix_length() {
        assertEquals("SCOTT.".length(), NameQualifier.sizeFor(deptAndEmp()).namePad());
    }

    @Test
    void should_render_qualified_and_bare_names_at_same_width() {
        ExecutionOrderTable t = deptAndEmp();
        NameQualifier q = NameQualifier.sizeFor(t);

        String dept = q.qualify("|   1 | TABLE ACCESS | DEPT |", 3, t.find(1));
        String emp = q.qualify("|   2 | TABLE ACCESS | EMP  |", 3, t.find(2));

        assertEquals("|   1 | TABLE ACCESS | SCOTT.DEPT |", dept);
        assertEquals("|   2 | TABLE ACCESS | EMP        |", emp);
        assertEquals(dept.length(), emp.length());
    }

    @Test
    void should_find_name_field_in_header() {
        assertEquals(3, NameQualifier.nameFieldIndex("| Id  | Operation | Name | Rows |"));
        assertEquals(-1, NameQualifier.nameFieldIndex("| Id  | Operation | Rows |"));
    }

    @Test
    void should_widen_header_on_the_right() {
        NameQualifier q = new NameQualifier(4);
        assertEquals("| Id  | Name     | Rows |", q.widen("| Id  | Name | Rows |", 2));
    }

    @Test
    void should_not_touch_lines_when_disabled() {
        NameQualifier q = NameQualifier.disabled();
        assertEquals("| Id  | Name | Rows |", q.widen("| Id  | Name | Rows |", 2));
        assertEquals(0, q.namePad());
    }

    @Test
    void should_keep_blank_before_delimiter_when_name_overflows() {
        ExecutionOrderTable t = new ExecutionOrderBuilder().build(null, List.of(
                new PlanStep(0, null),
                new PlanStep(1, 0, "SYS", "OBJ$")));
        // rendered column narrower than the bare name
        NameQualifier q = new NameQualifier(0);
        assertEquals("|   1 | SYS.OBJ$ |", q.qualify("|   1 | OB |", 2, t.find(1)));
    }
}
