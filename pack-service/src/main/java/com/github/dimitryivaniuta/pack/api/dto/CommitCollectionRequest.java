package com.github.dimitryivaniuta.pack.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/**
 * Items of the pending opening to keep. Everything not listed is discarded.
 */
@Jacksonized
@Builder
public record CommitCollectionRequest(
        @NotEmpty @Size(max = 50)
        @Schema(description = "Item ids to add; repeat an id to keep a repeated draw", example = "[\"stem-1\",\"cover-1\"]")
        List<@NotBlank String> itemIds
) {
}
