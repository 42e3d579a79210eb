package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request body for opening an account. Currency falls back to the configured default.
 */
@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Account number is required")
    @Pattern(regexp = "^\\s*\\d{6,12}\\s*$", message = "Account number must be 6 to 12 digits")
    @JsonProperty("account_number")
    String accountNumber;

    @PositiveOrZero(message = "Initial balance cannot be negative")
    @JsonProperty("initial_balance_cents")
    Long initialBalanceCents;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;
}
