package com.github.dimitryivaniuta.pack.api.web;

import com.github.dimitryivaniuta.pack.api.dto.OpenPackRequest;
import com.github.dimitryivaniuta.pack.api.dto.OpeningResult;
import com.github.dimitryivaniuta.pack.api.dto.PackView;
import com.github.dimitryivaniuta.pack.identity.IdentityResolver;
import com.github.dimitryivaniuta.pack.service.PackOpeningService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Packs API.
 *
 * Responsibilities:
 * - List purchasable packs of the current catalog.
 * - Open a pack: debit, draw, stage the result for a later commit.
 *
 * Opening is idempotent per owner and {@code idempotencyKey}.
 */
@RestController
@RequestMapping("/api/packs")
@RequiredArgsConstructor
@Validated
public class PackController {

    private final PackOpeningService service;
    private final IdentityResolver identity;

    @GetMapping
    public Flux<PackView> list() {
        return service.listPacks();
    }

    /** Buy and open a pack. */
    @PostMapping("/open")
    public Mono<OpeningResult> open(@Valid @RequestBody OpenPackRequest req, ServerWebExchange exchange) {
        return identity.resolve(exchange).flatMap(owner -> service.open(owner, req));
    }
}
