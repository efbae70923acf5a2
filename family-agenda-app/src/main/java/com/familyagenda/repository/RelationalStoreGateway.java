package com.familyagenda.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Single entry point to the relational store, backed by the process-wide
 * connection pool.
 *
 * <p>Single statements borrow a connection for their own duration. Multi-statement
 * work goes through {@link #inTransaction(Function)}, which pins one connection for
 * the whole unit and always hands it back to the pool afterwards.
 */
@Component
public class RelationalStoreGateway implements StatementExecutor {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public RelationalStoreGateway(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.transactions = new TransactionTemplate(transactionManager);
    }

    @Override
    public int update(String sql, Object... args) {
        return jdbc.update(sql, args);
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        return jdbc.query(sql, mapper, args);
    }

    @Override
    public Long insertReturningId(String sql, Object... args) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            new ArgumentPreparedStatementSetter(args).setValues(ps);
            return ps;
        }, keys);
        // PostgreSQL returns every column of the new row, H2 only the identity column;
        // the key map is case-insensitive either way
        Map<String, Object> row = keys.getKeys();
        Object id = row != null ? row.get("id") : null;
        if (!(id instanceof Number number)) {
            throw new IllegalStateException("Store did not return a generated id for: " + sql);
        }
        return number.longValue();
    }

    /**
     * Runs {@code work} on one dedicated connection. The unit is committed only if the
     * work calls {@link TransactionScope#commit()}; returning without it, or throwing,
     * rolls everything back.
     */
    public <T> T inTransaction(Function<TransactionScope, T> work) {
        return transactions.execute(status -> {
            TransactionScope scope = new TransactionScope(this);
            try {
                T result = work.apply(scope);
                if (!scope.isCommitRequested()) {
                    status.setRollbackOnly();
                }
                return result;
            } finally {
                scope.close();
            }
        });
    }

    /**
     * Runs a callback against a pooled connection, for metadata inspection.
     */
    public <T> T withConnection(ConnectionCallback<T> callback) {
        return jdbc.execute(callback);
    }

    /**
     * True when {@code failure}, or anything in its cause chain, is a unique-key violation.
     */
    public static boolean isDuplicateKey(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof DuplicateKeyException) {
                return true;
            }
        }
        return false;
    }
}
