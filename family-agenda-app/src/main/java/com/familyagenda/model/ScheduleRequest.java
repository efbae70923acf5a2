package com.familyagenda.model;

/**
 * Body of POST /schedules. Only description is optional.
 */
public record ScheduleRequest(
    Long childId,
    String title,
    String description,
    String start,
    String end,
    String type
) {}
