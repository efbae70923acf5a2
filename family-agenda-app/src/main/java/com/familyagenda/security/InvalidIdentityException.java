package com.familyagenda.security;

import org.springframework.security.core.AuthenticationException;

public class InvalidIdentityException extends AuthenticationException {

    public InvalidIdentityException(String message) {
        super(message);
    }
}
