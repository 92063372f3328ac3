package com.github.dimitryivaniuta.pack.identity;

import static org.springframework.util.StringUtils.hasText;

import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves the owner from the {@code X-Player-Id} header. Requests without it act for the
 * shared anonymous owner. A malformed id is a validation error, not a fallback to anonymous.
 */
@Slf4j
@Component
public class HeaderIdentityResolver implements IdentityResolver {

    public static final String HEADER_PLAYER_ID = "X-Player-Id";

    @Override
    public Mono<OwnerId> resolve(final ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            String raw = exchange.getRequest().getHeaders().getFirst(HEADER_PLAYER_ID);
            if (!hasText(raw)) {
                return OwnerId.anonymous(OwnerId.ANONYMOUS);
            }
            return OwnerId.player(raw.trim());
        });
    }
}
