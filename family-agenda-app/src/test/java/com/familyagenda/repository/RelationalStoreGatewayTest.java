package com.familyagenda.repository;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/reset.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class RelationalStoreGatewayTest {

    private static final String INSERT_CHILD =
        "INSERT INTO child (full_name, national_id, birth_date) VALUES (?, ?, ?)";

    @Autowired
    private RelationalStoreGateway store;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private DataSource dataSource;

    @Test
    void insertReturnsGeneratedId() {
        Long first = store.insertReturningId(INSERT_CHILD, "Ana", "100", LocalDate.of(2015, 3, 2));
        Long second = store.insertReturningId(INSERT_CHILD, "Bia", "101", LocalDate.of(2016, 4, 3));

        assertThat(first).isPositive();
        assertThat(second).isGreaterThan(first);
    }

    @Test
    void commitsWhenRequested() {
        Long id = store.inTransaction(tx -> {
            Long childId = tx.insertReturningId(INSERT_CHILD, "Ana", "200", LocalDate.of(2015, 3, 2));
            tx.update("INSERT INTO parent_child (parent_id, child_id) VALUES (?, ?)", 7L, childId);
            tx.commit();
            return childId;
        });

        assertThat(countRows("child")).isEqualTo(1);
        assertThat(jdbc.queryForObject("SELECT child_id FROM parent_child WHERE parent_id = 7", Long.class))
            .isEqualTo(id);
    }

    @Test
    void rollsBackWhenCommitNotRequested() {
        store.inTransaction(tx -> tx.insertReturningId(INSERT_CHILD, "Ana", "300", LocalDate.of(2015, 3, 2)));

        assertThat(countRows("child")).isZero();
    }

    @Test
    void rollsBackEarlierStatementsWhenALaterOneFails() {
        assertThatThrownBy(() -> store.inTransaction(tx -> {
            tx.insertReturningId(INSERT_CHILD, "Ana", "400", LocalDate.of(2015, 3, 2));
            // child 0 never exists, so the foreign key rejects this row
            tx.update("INSERT INTO parent_child (parent_id, child_id) VALUES (?, ?)", 7L, 0L);
            tx.commit();
            return null;
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(countRows("child")).isZero();
        assertThat(countRows("parent_child")).isZero();
    }

    @Test
    void returnsConnectionsToThePoolAfterFailure() {
        for (int i = 0; i < 20; i++) {
            try {
                store.inTransaction(tx -> {
                    tx.update("INSERT INTO parent_child (parent_id, child_id) VALUES (?, ?)", 7L, 0L);
                    return null;
                });
            } catch (DataAccessException expected) {
                // each attempt fails on the foreign key
            }
        }

        HikariDataSource pool = (HikariDataSource) dataSource;
        assertThat(pool.getHikariPoolMXBean().getActiveConnections()).isZero();
    }

    @Test
    void scopeCannotBeUsedAfterTransactionEnds() {
        AtomicReference<TransactionScope> leaked = new AtomicReference<>();
        store.inTransaction(tx -> {
            leaked.set(tx);
            tx.commit();
            return null;
        });

        assertThatThrownBy(() -> leaked.get().update("DELETE FROM child"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void detectsDuplicateKeyViolations() {
        store.insertReturningId(INSERT_CHILD, "Ana", "500", LocalDate.of(2015, 3, 2));

        Throwable failure = null;
        try {
            store.insertReturningId(INSERT_CHILD, "Other", "500", LocalDate.of(2014, 1, 1));
        } catch (DataAccessException e) {
            failure = e;
        }

        assertThat(failure).isInstanceOf(DuplicateKeyException.class);
        assertThat(RelationalStoreGateway.isDuplicateKey(failure)).isTrue();
        assertThat(RelationalStoreGateway.isDuplicateKey(new RuntimeException("wrapped", failure))).isTrue();
        assertThat(RelationalStoreGateway.isDuplicateKey(new IllegalStateException("other"))).isFalse();
        assertThat(RelationalStoreGateway.isDuplicateKey(null)).isFalse();
    }

    private int countRows(String table) {
        return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }
}
