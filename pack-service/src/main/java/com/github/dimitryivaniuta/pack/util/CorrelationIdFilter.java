package com.github.dimitryivaniuta.pack.util;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Ensures every request carries a correlation id:
 * <ul>
 *   <li>Reads or creates {@code X-Correlation-ID}.</li>
 *   <li>Mirrors the header on the HTTP response.</li>
 *   <li>Exposes the id via exchange attribute and Reactor Context for downstream code.</li>
 * </ul>
 */
@Slf4j
@Component
public class CorrelationIdFilter implements WebFilter, Ordered {

    /** Exchange attribute key containing the correlation id. */
    public static final String ATTR_CORRELATION_ID = "com.github.dimitryivaniuta.pack.correlation-id";

    /** Reactor context key containing the correlation id. */
    public static final String CTX_CORRELATION_ID = "correlationId";

    public static final String HEADER_CORRELATION_ID = "X-Correlation-ID";

    private static final int MAX_LENGTH = 200;

    @Override
    public Mono<Void> filter(final ServerWebExchange exchange, final WebFilterChain chain) {
        final String raw = exchange.getRequest().getHeaders().getFirst(HEADER_CORRELATION_ID);
        final String incoming = normalize(raw);
        final String id = incoming != null ? incoming : UUID.randomUUID().toString();

        ServerWebExchange target = exchange;
        if (incoming == null) {
            final ServerHttpRequest mutated = exchange.getRequest()
                    .mutate()
                    .headers(h -> h.set(HEADER_CORRELATION_ID, id))
                    .build();
            target = exchange.mutate().request(mutated).build();
            log.debug("Generated new correlation id {}", id);
        }

        target.getAttributes().put(ATTR_CORRELATION_ID, id);
        target.getResponse().getHeaders().set(HEADER_CORRELATION_ID, id);
        return chain.filter(target).contextWrite(ctx -> ctx.put(CTX_CORRELATION_ID, id));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    /** Blank or oversized values are replaced. */
    private static String normalize(final String raw) {
        if (raw == null) return null;
        final String v = raw.trim();
        if (v.isEmpty() || v.length() > MAX_LENGTH) return null;
        return v;
    }
}
