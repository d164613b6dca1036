package net.orrery.adapter.jdbc.link;

import net.orrery.core.model.FlowRunState;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Sets {@code flow_run.state_id} to the id of the given states, for exactly the
 * runs those states belong to. Every run passed in is brand new, so no row-count
 * check against concurrent readers is needed.
 */
public interface StateLinker {
    void link(Connection c, List<FlowRunState> states) throws SQLException;

    String name();
}
