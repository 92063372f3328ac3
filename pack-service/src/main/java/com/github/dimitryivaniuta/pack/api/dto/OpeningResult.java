package com.github.dimitryivaniuta.pack.api.dto;

import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/**
 * Response of an opening. Replays of the same idempotency key return this exact instance.
 *
 * @param staged false when another opening was already pending and kept its place
 */
@Jacksonized
@Builder
public record OpeningResult(
        String openingId,
        PackView pack,
        List<DrawResult> results,
        EconomySummary economy,
        PityView pity,
        boolean staged,
        Instant openedAt
) {}
