package com.flagship.atm.api.exception;

/**
 * The presented PIN does not resolve to an account. No session was issued.
 */
public class AuthenticationFailedException extends RuntimeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
