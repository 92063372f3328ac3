package com.github.dimitryivaniuta.pack.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.catalog.CatalogLoader;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.draw.DropTableResolver;
import com.github.dimitryivaniuta.pack.draw.ItemSelector;
import com.github.dimitryivaniuta.pack.draw.RandomSource;
import com.github.dimitryivaniuta.pack.draw.ThreadLocalRandomSource;
import com.github.dimitryivaniuta.pack.economy.EconomyPolicy;
import com.github.dimitryivaniuta.pack.economy.ImmediateDupeCreditPolicy;
import com.github.dimitryivaniuta.pack.economy.ShardTokenPolicy;
import com.github.dimitryivaniuta.pack.progress.ProgressEvaluator;
import com.github.dimitryivaniuta.pack.service.EconomyLedger;
import com.github.dimitryivaniuta.pack.service.IdempotencyService;
import com.github.dimitryivaniuta.pack.service.PendingOpeningLedger;
import com.github.dimitryivaniuta.pack.service.UnlockService;
import com.github.dimitryivaniuta.pack.store.InMemoryInventoryStore;
import com.github.dimitryivaniuta.pack.store.InventoryStore;
import com.github.dimitryivaniuta.pack.store.JsonFileInventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the pack-opening core. Collaborators a deployment may swap (clock, randomness,
 * inventory store) are declared {@link ConditionalOnMissingBean}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        PackProperties.class
})
public class PackAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomSource randomSource() {
        return new ThreadLocalRandomSource();
    }

    @Bean
    public CatalogStore catalogStore(ObjectMapper objectMapper, ResourceLoader resourceLoader, PackProperties props,
                                     Clock clock) {
        return new CatalogStore(new CatalogLoader(objectMapper, clock), resourceLoader, props.getCatalog().getLocation());
    }

    @Bean
    @ConditionalOnMissingBean
    public InventoryStore inventoryStore(PackProperties props, ObjectMapper objectMapper, Clock clock) {
        var economy = props.getEconomy();
        return switch (props.getStore().getType()) {
            case MEMORY -> new InMemoryInventoryStore(economy.getStartingBalance(), clock);
            case FILE -> new JsonFileInventoryStore(Path.of(props.getStore().getDirectory()), objectMapper,
                    economy.getStartingBalance(), clock);
        };
    }

    @Bean
    public OwnerLocks ownerLocks() {
        return new OwnerLocks();
    }

    @Bean
    public DropTableResolver dropTableResolver(RandomSource randomSource) {
        return new DropTableResolver(randomSource);
    }

    @Bean
    public ItemSelector itemSelector(RandomSource randomSource) {
        return new ItemSelector(randomSource);
    }

    @Bean
    public IdempotencyService idempotencyService(ObjectMapper objectMapper, Clock clock, PackProperties props) {
        return new IdempotencyService(objectMapper, clock, props.getIdempotency().getInFlightTimeout());
    }

    @Bean
    public PendingOpeningLedger pendingOpeningLedger(PackProperties props) {
        return new PendingOpeningLedger(props.getPending().getPolicy());
    }

    @Bean
    public EconomyLedger economyLedger(Clock clock) {
        return new EconomyLedger(clock);
    }

    @Bean
    public EconomyPolicy economyPolicy(PackProperties props, EconomyLedger ledger) {
        var economy = props.getEconomy();
        EconomyPolicy policy = switch (economy.getModel()) {
            case IMMEDIATE_DUPE_CREDIT -> new ImmediateDupeCreditPolicy(ledger,
                    Money.of(economy.getCurrency(), economy.getDupeCredit()));
            case SHARD_TOKENS -> new ShardTokenPolicy(economy.getShardsPerToken(), economy.getCurrency());
        };
        log.info("Economy model: {}", policy.model());
        return policy;
    }

    @Bean
    public ProgressEvaluator progressEvaluator() {
        return new ProgressEvaluator();
    }

    @Bean
    public UnlockService unlockService(ProgressEvaluator evaluator, Clock clock) {
        return new UnlockService(evaluator, clock);
    }
}
