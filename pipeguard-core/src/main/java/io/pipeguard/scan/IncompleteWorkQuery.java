package io.pipeguard.scan;

import io.pipeguard.model.TrackedEntity;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Finds the entities of one collection that startup requeue should re-inject.
 */
@FunctionalInterface
public interface IncompleteWorkQuery {

    List<TrackedEntity> find(Connection conn, int limit) throws SQLException;
}
