package com.familyagenda.security;

import com.familyagenda.config.AgendaConfig;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Reads the parent id the caller asserts in a header. Nothing is looked up or
 * verified: this scopes requests, it does not authenticate them.
 */
@Component
public class HeaderIdentityResolver implements IdentityResolver {

    private final String headerName;

    public HeaderIdentityResolver(AgendaConfig config) {
        this.headerName = config.getIdentity().getHeader();
    }

    @Override
    public Optional<ParentPrincipal> resolve(HttpServletRequest request) {
        String value = request.getHeader(headerName);
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ParentPrincipal(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            throw new InvalidIdentityException("Unauthorized: malformed user identity.");
        }
    }
}
