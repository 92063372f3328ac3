package com.github.dimitryivaniuta.pack.api.web;

import com.github.dimitryivaniuta.pack.api.dto.CollectionResult;
import com.github.dimitryivaniuta.pack.api.dto.CommitCollectionRequest;
import com.github.dimitryivaniuta.pack.domain.model.PendingOpening;
import com.github.dimitryivaniuta.pack.identity.IdentityResolver;
import com.github.dimitryivaniuta.pack.service.CollectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/** Pending opening lookup and commit. */
@RestController
@RequestMapping("/api/collection")
@RequiredArgsConstructor
@Validated
public class CollectionController {

    private final CollectionService service;
    private final IdentityResolver identity;

    /** The staged opening, or 204 when there is none. */
    @GetMapping("/pending")
    public Mono<ResponseEntity<PendingOpening>> pending(ServerWebExchange exchange) {
        return identity.resolve(exchange)
                .flatMap(service::pending)
                .map(p -> p.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build()));
    }

    /** Keep the listed items of the pending opening; the rest is discarded. */
    @PostMapping("/add")
    public Mono<CollectionResult> add(@Valid @RequestBody CommitCollectionRequest req, ServerWebExchange exchange) {
        return identity.resolve(exchange).flatMap(owner -> service.commit(owner, req));
    }
}
