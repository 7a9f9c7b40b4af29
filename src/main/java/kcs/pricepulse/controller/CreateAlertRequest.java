package kcs.pricepulse.controller;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateAlertRequest(
        @NotNull
        Long productId,

        @NotBlank @Email
        String email,

        @NotNull @Positive(message = "Target price must be positive")
        Long targetPrice
) {
}
