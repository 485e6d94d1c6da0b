package com.flagship.atm.session;

/**
 * Classification returned by session validation.
 */
public enum SessionStatus {
    VALID,
    NOT_FOUND,
    EXPIRED
}
