package com.familyagenda.service;

import com.familyagenda.config.AgendaConfig;
import com.familyagenda.error.ApiException;
import com.familyagenda.repository.ParentChildRepository;
import com.familyagenda.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Optional ownership checks for operations addressed by child or schedule id.
 *
 * <p>Disabled by default: any caller may then delete a child, and list, create or delete
 * schedules for it, knowing only its id. Set {@code familyagenda.ownership.enforce=true}
 * to require that the caller is linked to the child. A failed check reports the target
 * as not found so ids owned by other parents are not disclosed.
 */
@Component
public class OwnershipGuard {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    private final boolean enforce;
    private final ParentChildRepository parentChildRepository;
    private final ScheduleRepository scheduleRepository;

    public OwnershipGuard(AgendaConfig config,
                          ParentChildRepository parentChildRepository,
                          ScheduleRepository scheduleRepository) {
        this.enforce = config.getOwnership().isEnforce();
        this.parentChildRepository = parentChildRepository;
        this.scheduleRepository = scheduleRepository;
        if (!enforce) {
            log.warn("Ownership checks are disabled: child and schedule ids are not scoped to the calling parent");
        }
    }

    public void requireChild(Long parentId, Long childId) {
        if (!enforce) {
            return;
        }
        if (!parentChildRepository.isLinked(parentId, childId)) {
            log.debug("Parent {} is not linked to child {}", parentId, childId);
            throw ApiException.notFound("Child not found.");
        }
    }

    public void requireSchedule(Long parentId, Long scheduleId) {
        if (!enforce) {
            return;
        }
        boolean owned = scheduleRepository.findChildId(scheduleId)
            .map(childId -> parentChildRepository.isLinked(parentId, childId))
            .orElse(false);
        if (!owned) {
            log.debug("Parent {} has no access to schedule {}", parentId, scheduleId);
            throw ApiException.notFound("Schedule not found.");
        }
    }
}
