package com.familyagenda.model;

import java.time.LocalDate;

public record Child(
    Long id,
    String fullName,
    String nationalId,
    LocalDate birthDate
) {}
