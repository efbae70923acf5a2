package com.familyagenda.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Attaches the resolved parent to the security context. Requests without an identity
 * continue anonymously and are turned away by the authorization rules; requests with a
 * malformed identity are answered with 401 here and go no further.
 */
public class ParentIdentityFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ParentIdentityFilter.class);

    static final String ROLE_PARENT = "ROLE_PARENT";

    private final IdentityResolver identityResolver;
    private final AuthenticationEntryPoint entryPoint;

    public ParentIdentityFilter(IdentityResolver identityResolver, AuthenticationEntryPoint entryPoint) {
        this.identityResolver = identityResolver;
        this.entryPoint = entryPoint;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<ParentPrincipal> principal;
        try {
            principal = identityResolver.resolve(request);
        } catch (InvalidIdentityException e) {
            log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            SecurityContextHolder.clearContext();
            entryPoint.commence(request, response, e);
            return;
        }

        principal.ifPresent(parent -> {
            PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
                parent, null, List.of(new SimpleGrantedAuthority(ROLE_PARENT)));
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
        });
        filterChain.doFilter(request, response);
    }
}
