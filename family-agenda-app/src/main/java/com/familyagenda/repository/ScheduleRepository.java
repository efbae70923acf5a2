package com.familyagenda.repository;

import com.familyagenda.model.Schedule;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class ScheduleRepository {

    private final RelationalStoreGateway store;

    private static final RowMapper<Schedule> SCHEDULE_MAPPER = (rs, rowNum) -> new Schedule(
        rs.getLong("id"),
        rs.getLong("child_id"),
        rs.getLong("created_by_parent_id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getObject("starts_at", LocalDateTime.class),
        rs.getObject("ends_at", LocalDateTime.class),
        rs.getString("schedule_type")
    );

    public ScheduleRepository(RelationalStoreGateway store) {
        this.store = store;
    }

    public Long save(Long childId, Long createdByParentId, String title, String description,
                     LocalDateTime start, LocalDateTime end, String type) {
        return store.insertReturningId("""
            INSERT INTO schedule (child_id, created_by_parent_id, title, description, starts_at, ends_at, schedule_type)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            childId, createdByParentId, title, description, start, end, type
        );
    }

    public List<Schedule> findByChildId(Long childId) {
        return store.query(
            "SELECT * FROM schedule WHERE child_id = ? ORDER BY starts_at ASC, id ASC",
            SCHEDULE_MAPPER,
            childId
        );
    }

    public Optional<Long> findChildId(Long scheduleId) {
        List<Long> results = store.query(
            "SELECT child_id FROM schedule WHERE id = ?",
            (rs, rowNum) -> rs.getLong("child_id"),
            scheduleId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public int delete(Long id) {
        return store.update("DELETE FROM schedule WHERE id = ?", id);
    }
}
