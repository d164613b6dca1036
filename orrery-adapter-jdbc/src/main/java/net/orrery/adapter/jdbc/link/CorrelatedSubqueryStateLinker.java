package net.orrery.adapter.jdbc.link;

import net.orrery.adapter.jdbc.JdbcUtil;
import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.core.model.FlowRunState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * For engines without a multi-table UPDATE: each run looks up its own new state
 * through a correlated subquery. The outer WHERE keeps every other run untouched.
 */
public final class CorrelatedSubqueryStateLinker implements StateLinker {
    private final SqlDialect dialect;

    public CorrelatedSubqueryStateLinker(SqlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public void link(Connection c, List<FlowRunState> states) throws SQLException {
        for (List<FlowRunState> chunk : JdbcUtil.chunks(states, JdbcUtil.IN_CHUNK)) {
            String in = JdbcUtil.placeholders(chunk.size());
            String sql = """
                UPDATE flow_run
                   SET state_id = (SELECT s.id
                                     FROM flow_run_state s
                                    WHERE s.flow_run_id = flow_run.id
                                      AND s.id IN (%s)
                                    LIMIT 1)
                 WHERE id IN (%s)
                """.formatted(in, in);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (FlowRunState s : chunk) dialect.bindUuid(ps, i++, s.id());
                for (FlowRunState s : chunk) dialect.bindUuid(ps, i++, s.flowRunId());
                ps.executeUpdate();
            }
        }
    }

    @Override
    public String name() {
        return "correlated-subquery";
    }
}
