package com.familyagenda.model;

/**
 * Body of POST /children. Fields stay as raw text so that every missing or
 * malformed field can be reported together.
 */
public record ChildRequest(
    String fullName,
    String nationalId,
    String birthDate
) {}
