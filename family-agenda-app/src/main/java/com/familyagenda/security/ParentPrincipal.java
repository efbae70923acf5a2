package com.familyagenda.security;

/**
 * The caller on whose behalf a request runs.
 */
public record ParentPrincipal(Long parentId) {}
