package com.familyagenda.repository;

import org.springframework.stereotype.Repository;

@Repository
public class ParentChildRepository {

    private final RelationalStoreGateway store;

    public ParentChildRepository(RelationalStoreGateway store) {
        this.store = store;
    }

    public void link(StatementExecutor exec, Long parentId, Long childId) {
        exec.update(
            "INSERT INTO parent_child (parent_id, child_id) VALUES (?, ?)",
            parentId, childId
        );
    }

    public boolean isLinked(Long parentId, Long childId) {
        return !store.query(
            "SELECT 1 FROM parent_child WHERE parent_id = ? AND child_id = ?",
            (rs, rowNum) -> rs.getInt(1),
            parentId, childId
        ).isEmpty();
    }
}
