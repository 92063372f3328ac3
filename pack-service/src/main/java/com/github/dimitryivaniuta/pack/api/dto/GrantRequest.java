package com.github.dimitryivaniuta.pack.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/** Dev-only balance grant. Defaults: 1000 COIN. */
public record GrantRequest(
        @Min(1) Long amount,
        @Pattern(regexp = "^[A-Z][A-Z0-9_]{1,15}$") String currency
) {
}
