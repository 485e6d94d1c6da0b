package com.flagship.atm.ledger;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger policy settings, bound from {@code atm.ledger.*}.
 */
@ConfigurationProperties(prefix = "atm.ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * When false, a withdrawal that would leave a negative balance is rejected.
     */
    private boolean allowOverdraft = false;
}
