package com.github.dimitryivaniuta.pack.api.web;

import com.github.dimitryivaniuta.pack.api.dto.GrantRequest;
import com.github.dimitryivaniuta.pack.identity.IdentityResolver;
import com.github.dimitryivaniuta.pack.service.DevToolsService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/** Test helpers for local play. Not registered unless {@code pack.dev.enabled=true}. */
@RestController
@RequestMapping("/api/dev")
@RequiredArgsConstructor
@Validated
@ConditionalOnProperty(prefix = "pack.dev", name = "enabled", havingValue = "true")
public class DevController {

    private final DevToolsService service;
    private final IdentityResolver identity;

    /** Top up the caller's balance (default 1000 of the economy currency). */
    @PostMapping("/grant")
    public Mono<Map<String, Object>> grant(@Valid @RequestBody(required = false) GrantRequest req,
                                           ServerWebExchange exchange) {
        return identity.resolve(exchange)
                .flatMap(owner -> service.grant(owner, req))
                .map(balance -> Map.<String, Object>of("balance", balance));
    }

    /** Wipe the caller's account and pending opening. */
    @PostMapping("/reset")
    public Mono<Map<String, Object>> reset(ServerWebExchange exchange) {
        return identity.resolve(exchange).flatMap(service::reset);
    }

    @PostMapping("/catalog/reload")
    public Mono<Map<String, Object>> reloadCatalog() {
        return service.reloadCatalog();
    }
}
