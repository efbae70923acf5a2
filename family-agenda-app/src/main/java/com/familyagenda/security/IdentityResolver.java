package com.familyagenda.security;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Works out which parent a request acts for. The default implementation trusts a
 * request header; a verifying implementation (signed tokens) can replace it as a bean
 * without touching the services.
 */
public interface IdentityResolver {

    /**
     * @return the caller, or empty when the request carries no identity at all
     * @throws InvalidIdentityException when an identity is present but unusable
     */
    Optional<ParentPrincipal> resolve(HttpServletRequest request);
}
