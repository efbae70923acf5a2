package com.familyagenda.repository;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * Statement-level access to the store. Implemented by the pooled gateway and by a
 * transaction scope, so repositories run the same SQL either way.
 */
public interface StatementExecutor {

    /**
     * @return number of affected rows
     */
    int update(String sql, Object... args);

    <T> List<T> query(String sql, RowMapper<T> mapper, Object... args);

    /**
     * Runs an INSERT and returns the identifier the store assigned to the new row.
     */
    Long insertReturningId(String sql, Object... args);
}
