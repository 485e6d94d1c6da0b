package com.flagship.atm.api.exception;

/**
 * An authenticated route ran without a session resolved by {@code SessionAuthenticationFilter}.
 * This is a wiring bug, never a client error.
 */
public class SessionContextMissingException extends RuntimeException {

    public SessionContextMissingException(String route) {
        super("Session must be resolved before reaching " + route);
    }
}
