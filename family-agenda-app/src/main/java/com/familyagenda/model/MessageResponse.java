package com.familyagenda.model;

public record MessageResponse(String message) {}
