package infra.jdbc;

import domain.error.CatalogAccessException;
import domain.plan.PlanTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DbmsXplanReportRendererTest {

    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private DbmsXplanReportRenderer renderer;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        renderer = new DbmsXplanReportRenderer(() -> connection);
    }

    @Test
    void should_return_plan_table_output_lines() throws Exception {
        when(resultSet.next()).thenReturn(true, true, true, false);
        when(resultSet.getString(1)).thenReturn("Plan hash value: 1", null, "| Id  | Operation |");

        List<String> lines = renderer.render(PlanTarget.planTable(null, null, "BASIC"), null);

        verify(connection).prepareStatement(DbmsXplanReportRenderer.SQL_DISPLAY);
        verify(statement).setString(1, "PLAN_TABLE");
        verify(statement).setNull(2, Types.VARCHAR);
        verify(statement).setString(3, "BASIC");
        assertEquals(List.of("Plan hash value: 1", "", "| Id  | Operation |"), lines);
    }

    @Test
    void should_render_one_history_plan_per_group_key() throws Exception {
        when(resultSet.next()).thenReturn(false);

        renderer.render(PlanTarget.awr("7h35uxf5uhmm1", null, 99L, "TYPICAL"), "3956160932");

        verify(connection).prepareStatement(DbmsXplanReportRenderer.SQL_DISPLAY_AWR);
        verify(statement).setLong(2, 3956160932L);
        verify(statement).setLong(3, 99L);
        verify(statement).setString(4, "TYPICAL");
    }

    @Test
    void should_reject_non_numeric_history_group() {
        assertThrows(CatalogAccessException.class,
                () -> renderer.render(PlanTarget.awr("7h35uxf5uhmm1", null, 99L, null), "abc"));
    }
}
