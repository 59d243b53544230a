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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OraclePlanTargetResolverTest {

    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private OraclePlanTargetResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        resolver = new OraclePlanTargetResolver(() -> connection);
    }

    @Test
    void should_pick_latest_plan_id() throws Exception {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(17L);
        when(resultSet.getString(2)).thenReturn("q1");

        PlanTarget resolved = resolver.resolve(PlanTarget.planTable(null, null, null));

        verify(connection).prepareStatement(String.format(OraclePlanTargetResolver.SQL_LATEST_PLAN, "PLAN_TABLE"));
        verify(statement).setNull(1, Types.VARCHAR);
        assertEquals(Long.valueOf(17L), resolved.getPlanId());
        assertEquals("q1", resolved.getStatementId());
    }

    @Test
    void should_use_previous_cursor_of_session() throws Exception {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn("7h35uxf5uhmm1");
        when(resultSet.getInt(2)).thenReturn(3);

        PlanTarget resolved = resolver.resolve(PlanTarget.cursor(null, null, null));

        assertEquals("7h35uxf5uhmm1", resolved.getSqlId());
        assertEquals(Integer.valueOf(3), resolved.getChildNumber());
    }

    @Test
    void should_default_child_without_query() throws Exception {
        PlanTarget resolved = resolver.resolve(PlanTarget.cursor("7h35uxf5uhmm1", null, null));

        assertEquals(Integer.valueOf(0), resolved.getChildNumber());
        verify(connection, never()).prepareStatement(anyString());
    }

    @Test
    void should_fail_without_previous_cursor() throws Exception {
        when(resultSet.next()).thenReturn(false);
        assertThrows(CatalogAccessException.class, () -> resolver.resolve(PlanTarget.cursor(null, null, null)));
    }

    @Test
    void should_fill_in_current_dbid() throws Exception {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(1234567890L);

        PlanTarget resolved = resolver.resolve(PlanTarget.awr("7h35uxf5uhmm1", null, null, null));

        verify(connection).prepareStatement(OraclePlanTargetResolver.SQL_DBID);
        assertEquals(Long.valueOf(1234567890L), resolved.getDbid());
    }
}
