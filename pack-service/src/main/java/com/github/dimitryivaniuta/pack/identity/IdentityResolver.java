package com.github.dimitryivaniuta.pack.identity;

import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/** Maps the caller's credential on an inbound request to the owner it acts for. */
public interface IdentityResolver {

    Mono<OwnerId> resolve(ServerWebExchange exchange);
}
