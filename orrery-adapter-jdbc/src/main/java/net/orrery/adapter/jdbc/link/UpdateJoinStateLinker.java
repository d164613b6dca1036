package net.orrery.adapter.jdbc.link;

import net.orrery.adapter.jdbc.JdbcUtil;
import net.orrery.adapter.jdbc.SqlDialect;
import net.orrery.core.model.FlowRunState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/** One {@code UPDATE ... FROM} joining the new states onto their runs. */
public final class UpdateJoinStateLinker implements StateLinker {
    private final SqlDialect dialect;

    public UpdateJoinStateLinker(SqlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public void link(Connection c, List<FlowRunState> states) throws SQLException {
        for (List<FlowRunState> chunk : JdbcUtil.chunks(states, JdbcUtil.IN_CHUNK)) {
            String sql = """
                UPDATE flow_run
                   SET state_id = s.id
                  FROM flow_run_state s
                 WHERE s.flow_run_id = flow_run.id
                   AND s.id IN (%s)
                """.formatted(JdbcUtil.placeholders(chunk.size()));
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (FlowRunState s : chunk) dialect.bindUuid(ps, i++, s.id());
                ps.executeUpdate();
            }
        }
    }

    @Override
    public String name() {
        return "update-join";
    }
}
