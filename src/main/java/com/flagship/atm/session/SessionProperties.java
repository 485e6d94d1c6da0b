package com.flagship.atm.session;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Session lifetime settings, bound from {@code atm.session.*}.
 */
@ConfigurationProperties(prefix = "atm.session")
@Getter
@Setter
public class SessionProperties {

    /**
     * How long a session stays valid after creation or renewal.
     */
    private Duration ttl = Duration.ofMinutes(10);

    /**
     * A validation renews the session when less than this much time remains.
     */
    private Duration renewalThreshold = Duration.ofMinutes(1);
}
