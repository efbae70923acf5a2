package com.familyagenda.model;

import java.time.LocalDateTime;

public record Schedule(
    Long id,
    Long childId,
    Long createdByParentId,
    String title,
    String description,
    LocalDateTime start,
    LocalDateTime end,
    String type
) {}
