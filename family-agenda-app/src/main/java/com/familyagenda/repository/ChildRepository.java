package com.familyagenda.repository;

import com.familyagenda.model.Child;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

@Repository
public class ChildRepository {

    private final RelationalStoreGateway store;

    private static final RowMapper<Child> CHILD_MAPPER = (rs, rowNum) -> new Child(
        rs.getLong("id"),
        rs.getString("full_name"),
        decodeNationalId(rs.getObject("national_id")),
        rs.getObject("birth_date", LocalDate.class)
    );

    public ChildRepository(RelationalStoreGateway store) {
        this.store = store;
    }

    public Long insert(StatementExecutor exec, String fullName, String nationalId, LocalDate birthDate) {
        // TODO: encrypt national_id at rest once existing rows can be migrated
        return exec.insertReturningId(
            "INSERT INTO child (full_name, national_id, birth_date) VALUES (?, ?, ?)",
            fullName, nationalId, birthDate
        );
    }

    public List<Child> findByParentId(Long parentId) {
        return store.query("""
            SELECT c.* FROM child c
            INNER JOIN parent_child pc ON c.id = pc.child_id
            WHERE pc.parent_id = ?
            """,
            CHILD_MAPPER,
            parentId
        );
    }

    /**
     * Dependent parent_child and schedule rows go with the child through the
     * schema's ON DELETE CASCADE rules.
     *
     * @return number of child rows deleted
     */
    public int delete(Long id) {
        return store.update("DELETE FROM child WHERE id = ?", id);
    }

    /**
     * Binary columns (e.g. a VARBINARY national_id) come back as raw bytes; they are
     * returned as UTF-8 text. Anything else passes through as text.
     */
    static String decodeNationalId(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return raw.toString();
    }
}
