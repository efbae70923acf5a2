package com.familyagenda.service;

import com.familyagenda.error.ApiException;
import com.familyagenda.model.Child;
import com.familyagenda.repository.ChildRepository;
import com.familyagenda.repository.ParentChildRepository;
import com.familyagenda.repository.RelationalStoreGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@Service
public class ChildService {

    private static final Logger log = LoggerFactory.getLogger(ChildService.class);

    private final RelationalStoreGateway store;
    private final ChildRepository childRepository;
    private final ParentChildRepository parentChildRepository;
    private final OwnershipGuard ownershipGuard;

    public ChildService(RelationalStoreGateway store,
                        ChildRepository childRepository,
                        ParentChildRepository parentChildRepository,
                        OwnershipGuard ownershipGuard) {
        this.store = store;
        this.childRepository = childRepository;
        this.parentChildRepository = parentChildRepository;
        this.ownershipGuard = ownershipGuard;
    }

    /**
     * Registers a child and links it to its owner in one transaction. Either both rows
     * exist afterwards or neither does.
     *
     * @throws ApiException VALIDATION_ERROR listing every missing or malformed field,
     *                      CONFLICT when the national id is already registered,
     *                      INTERNAL_FAILURE for any other store error
     */
    public ChildCreated create(String fullName, String nationalId, String birthDate, Long ownerParentId) {
        List<String> problems = new ArrayList<>();
        if (!StringUtils.hasText(fullName)) {
            problems.add("fullName is required");
        }
        if (!StringUtils.hasText(nationalId)) {
            problems.add("nationalId is required");
        }
        LocalDate parsedBirthDate = null;
        if (!StringUtils.hasText(birthDate)) {
            problems.add("birthDate is required");
        } else {
            parsedBirthDate = parseDate(birthDate);
            if (parsedBirthDate == null) {
                problems.add("birthDate must be a date in yyyy-MM-dd format");
            }
        }
        if (!problems.isEmpty()) {
            throw ApiException.validation(problems);
        }

        LocalDate dob = parsedBirthDate;
        try {
            Long id = store.inTransaction(tx -> {
                Long childId = childRepository.insert(tx, fullName, nationalId, dob);
                parentChildRepository.link(tx, ownerParentId, childId);
                tx.commit();
                return childId;
            });
            log.info("Registered child {} for parent {}", id, ownerParentId);
            return new ChildCreated(id, fullName);
        } catch (DataAccessException e) {
            if (RelationalStoreGateway.isDuplicateKey(e)) {
                log.warn("Rejected child registration for parent {}: national id already registered", ownerParentId);
                throw ApiException.conflict("National identifier already registered.", e);
            }
            log.error("Failed to register child for parent {}", ownerParentId, e);
            throw ApiException.internal(e);
        }
    }

    /**
     * Children linked to the given parent, in whatever order the store returns them.
     */
    public List<Child> list(Long ownerParentId) {
        try {
            return childRepository.findByParentId(ownerParentId);
        } catch (DataAccessException e) {
            log.error("Failed to list children for parent {}", ownerParentId, e);
            throw ApiException.internal(e);
        }
    }

    /**
     * Deletes a child by id. Its parent links and schedules are removed by the
     * store's cascade rules, not here.
     */
    public void delete(Long childId, Long requestingParentId) {
        try {
            ownershipGuard.requireChild(requestingParentId, childId);
            if (childRepository.delete(childId) == 0) {
                throw ApiException.notFound("Child not found.");
            }
            log.info("Deleted child {} on request of parent {}", childId, requestingParentId);
        } catch (DataAccessException e) {
            log.error("Failed to delete child {}", childId, e);
            throw ApiException.internal(e);
        }
    }

    LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public record ChildCreated(Long id, String fullName) {}
}
