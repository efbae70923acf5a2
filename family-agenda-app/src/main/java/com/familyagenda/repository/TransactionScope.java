package com.familyagenda.repository;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * Statements issued inside {@link RelationalStoreGateway#inTransaction}. They all run on
 * the connection bound to the surrounding transaction. The scope rejects use after the
 * transaction has ended.
 */
public class TransactionScope implements StatementExecutor {

    private final StatementExecutor delegate;
    private boolean commitRequested;
    private boolean closed;

    TransactionScope(StatementExecutor delegate) {
        this.delegate = delegate;
    }

    @Override
    public int update(String sql, Object... args) {
        ensureOpen();
        return delegate.update(sql, args);
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        ensureOpen();
        return delegate.query(sql, mapper, args);
    }

    @Override
    public Long insertReturningId(String sql, Object... args) {
        ensureOpen();
        return delegate.insertReturningId(sql, args);
    }

    /**
     * Marks the unit for commit once the work returns normally.
     */
    public void commit() {
        ensureOpen();
        commitRequested = true;
    }

    boolean isCommitRequested() {
        return commitRequested;
    }

    void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction scope already closed");
        }
    }
}
