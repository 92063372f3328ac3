package com.github.dimitryivaniuta.pack.api.web;

import com.github.dimitryivaniuta.pack.api.dto.InventoryView;
import com.github.dimitryivaniuta.pack.identity.IdentityResolver;
import com.github.dimitryivaniuta.pack.service.InventoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService service;
    private final IdentityResolver identity;

    @GetMapping
    public Mono<InventoryView> inventory(ServerWebExchange exchange) {
        return identity.resolve(exchange).flatMap(service::inventory);
    }
}
