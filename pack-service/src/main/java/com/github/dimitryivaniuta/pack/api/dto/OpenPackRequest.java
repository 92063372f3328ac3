package com.github.dimitryivaniuta.pack.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/**
 * Request to buy and open one pack.
 */
@Jacksonized
@Builder
public record OpenPackRequest(
        @NotBlank @Size(max = 64)
        @Schema(description = "Catalog pack id", example = "starter")
        String packId,

        @NotBlank @Size(max = 128)
        @Schema(description = "Client-chosen key; repeating it replays the first response", example = "open-7f3a")
        String idempotencyKey
) {
}
