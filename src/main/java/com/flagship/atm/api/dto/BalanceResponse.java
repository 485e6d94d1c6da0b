package com.flagship.atm.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("balance")
    long balance;
}
