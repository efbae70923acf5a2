package com.familyagenda.service;

import com.familyagenda.error.ApiException;
import com.familyagenda.model.Schedule;
import com.familyagenda.model.ScheduleRequest;
import com.familyagenda.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Appointments attached to a child. Neither ownership of the child (unless the
 * {@link OwnershipGuard} is enforced) nor start-before-end is checked.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final OwnershipGuard ownershipGuard;

    public ScheduleService(ScheduleRepository scheduleRepository, OwnershipGuard ownershipGuard) {
        this.scheduleRepository = scheduleRepository;
        this.ownershipGuard = ownershipGuard;
    }

    /**
     * @return id of the new schedule
     */
    public Long create(ScheduleRequest request, Long createdByParentId) {
        List<String> problems = new ArrayList<>();
        if (request.childId() == null) {
            problems.add("childId is required");
        }
        if (!StringUtils.hasText(request.title())) {
            problems.add("title is required");
        }
        LocalDateTime start = parseTimestamp("start", request.start(), problems);
        LocalDateTime end = parseTimestamp("end", request.end(), problems);
        if (!StringUtils.hasText(request.type())) {
            problems.add("type is required");
        }
        if (!problems.isEmpty()) {
            throw ApiException.validation(problems);
        }

        try {
            ownershipGuard.requireChild(createdByParentId, request.childId());
            Long id = scheduleRepository.save(request.childId(), createdByParentId, request.title(),
                request.description(), start, end, request.type());
            log.info("Created schedule {} for child {} by parent {}", id, request.childId(), createdByParentId);
            return id;
        } catch (DataAccessException e) {
            log.error("Failed to create schedule for child {}", request.childId(), e);
            throw ApiException.internal(e);
        }
    }

    /**
     * All schedules of a child, earliest start first.
     */
    public List<Schedule> listForChild(Long childId, Long requestingParentId) {
        try {
            ownershipGuard.requireChild(requestingParentId, childId);
            return scheduleRepository.findByChildId(childId);
        } catch (DataAccessException e) {
            log.error("Failed to list schedules for child {}", childId, e);
            throw ApiException.internal(e);
        }
    }

    public void delete(Long scheduleId, Long requestingParentId) {
        try {
            ownershipGuard.requireSchedule(requestingParentId, scheduleId);
            if (scheduleRepository.delete(scheduleId) == 0) {
                throw ApiException.notFound("Schedule not found.");
            }
            log.info("Deleted schedule {} on request of parent {}", scheduleId, requestingParentId);
        } catch (DataAccessException e) {
            log.error("Failed to delete schedule {}", scheduleId, e);
            throw ApiException.internal(e);
        }
    }

    /**
     * Accepts ISO local date-times ("2024-01-10T09:00") and the SQL-style space
     * separator ("2024-01-10 09:00").
     */
    private LocalDateTime parseTimestamp(String field, String value, List<String> problems) {
        if (!StringUtils.hasText(value)) {
            problems.add(field + " is required");
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim().replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            problems.add(field + " must be a date-time in yyyy-MM-ddTHH:mm format");
            return null;
        }
    }
}
