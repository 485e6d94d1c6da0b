package com.flagship.atm.api.exception;

import com.flagship.atm.session.SessionStatus;
import lombok.Getter;

/**
 * A session could not be used; the caller has to log in again.
 */
@Getter
public class SessionRejectedException extends RuntimeException {

    private final SessionStatus status;

    public SessionRejectedException(SessionStatus status) {
        super(status == SessionStatus.EXPIRED ? "session expired" : "invalid authorization");
        this.status = status;
    }
}
