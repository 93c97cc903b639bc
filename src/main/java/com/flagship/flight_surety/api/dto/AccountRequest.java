package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Names a target account: an airline to register or a caller to authorize.
 */
@Value
public class AccountRequest {

    @NotBlank(message = "Account is required")
    @JsonProperty("account")
    String account;
}
